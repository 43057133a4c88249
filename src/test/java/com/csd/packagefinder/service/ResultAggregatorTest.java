package com.csd.packagefinder.service;

import com.csd.packagefinder.model.ErrorReason;
import com.csd.packagefinder.model.PackageInfo;
import com.csd.packagefinder.model.RegistryId;
import com.csd.packagefinder.model.RegistryOutcome;
import com.csd.packagefinder.model.RegistrySearchError;
import com.csd.packagefinder.model.SearchResult;
import com.csd.packagefinder.registry.PackageInfoFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ResultAggregatorTest {

    static PackageInfo info(RegistryId registry, String name) {
        return PackageInfoFactory.draft()
                .repository(registry)
                .name(name)
                .url("https://example.org/" + registry.getKey() + "/" + name)
                .description(name + " package")
                .versions(List.of("1.0", "1.1"))
                .build()
                .orElseThrow();
    }

    static RegistrySearchError error(RegistryId registry, String name, ErrorReason reason) {
        return RegistrySearchError.builder().repository(registry).packageName(name).reason(reason).build();
    }

    @Test
    void keepsRecordsInOutcomeOrderAndCollectsErrors() {
        SearchResult result = ResultAggregator.aggregate(List.of(
                RegistryOutcome.found(info(RegistryId.BIOCONDA, "fastqc")),
                RegistryOutcome.failed(error(RegistryId.PYPI, "fastqc", ErrorReason.TIMEOUT)),
                RegistryOutcome.notFound(),
                RegistryOutcome.found(info(RegistryId.HOMEBREW, "fastqc"))));

        assertEquals(2, result.getInfos().size());
        assertEquals(RegistryId.BIOCONDA, result.getInfos().get(0).getRepository());
        assertEquals(RegistryId.HOMEBREW, result.getInfos().get(1).getRepository());
        assertEquals(1, result.getErrors().size());
        assertFalse(result.isNotFound());
        assertTrue(result.isIncomplete());
    }

    @Test
    void allFailedIsNotNotFound() {
        SearchResult result = ResultAggregator.aggregate(List.of(
                RegistryOutcome.failed(error(RegistryId.CRAN, "x", ErrorReason.NETWORK_FAILURE)),
                RegistryOutcome.failed(error(RegistryId.POSIT, "x", ErrorReason.RATE_LIMITED))));

        assertTrue(result.getInfos().isEmpty());
        assertEquals(2, result.getErrors().size());
        assertFalse(result.isNotFound());
    }

    @Test
    void cleanMissIsNotFound() {
        SearchResult result = ResultAggregator.aggregate(List.of(RegistryOutcome.notFound(), RegistryOutcome.notFound()));
        assertTrue(result.isNotFound());
        assertFalse(result.isIncomplete());
    }
}
