package com.csd.packagefinder.registry;

import com.csd.packagefinder.exception.InvalidSearchRequestException;
import com.csd.packagefinder.model.RegistryId;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class RegistrySourcesTest {

    private final List<RegistrySource> all = RegistrySources.defaults(new StubHttpClient(), null);

    @Test
    void defaultsAreInReportingOrder() {
        List<RegistryId> ids = all.stream().map(RegistrySource::id).collect(Collectors.toList());
        assertEquals(List.of(
                RegistryId.BIOCONDA, RegistryId.ANACONDA, RegistryId.PYPI, RegistryId.BIOCONDUCTOR,
                RegistryId.CONDA_FORGE, RegistryId.CRAN, RegistryId.ROPENSCI, RegistryId.POSIT,
                RegistryId.BIOLIB, RegistryId.GALAXY_TOOL_SHED, RegistryId.DOCKER_HUB,
                RegistryId.GITHUB_CONTAINER_REGISTRY, RegistryId.HOMEBREW), ids);
    }

    @Test
    void selectKeepsOrderAndIgnoresCase() {
        List<RegistrySource> picked = RegistrySources.select(all, List.of("homebrew", " PyPI "));
        assertEquals(List.of(RegistryId.PYPI, RegistryId.HOMEBREW),
                picked.stream().map(RegistrySource::id).collect(Collectors.toList()));
    }

    @Test
    void emptySelectionKeepsAll() {
        assertSame(all, RegistrySources.select(all, List.of()));
        assertSame(all, RegistrySources.select(all, List.of("", " ")));
    }

    @Test
    void unknownKeyIsRejected() {
        InvalidSearchRequestException e = assertThrows(InvalidSearchRequestException.class,
                () -> RegistrySources.select(all, List.of("pypi", "npm")));
        assertTrue(e.getMessage().contains("npm"));
    }
}
