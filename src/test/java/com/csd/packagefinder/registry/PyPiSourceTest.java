package com.csd.packagefinder.registry;

import com.csd.packagefinder.model.PackageInfo;
import com.csd.packagefinder.model.RegistryOutcome;
import com.csd.packagefinder.model.ErrorReason;
import com.csd.packagefinder.model.ThreadingSupport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PyPiSourceTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private static final String MULTIQC = "{"
            + "\"info\":{\"name\":\"multiqc\",\"summary\":\"Aggregate bioinformatics results\","
            + "\"description\":\"Runs on a single core.\",\"license\":\"GPLv3\",\"classifiers\":[]},"
            + "\"releases\":{\"1.14\":[{\"filename\":\"a.whl\"}],\"1.15\":[{\"filename\":\"b.whl\"}],\"1.16.dev0\":[]}"
            + "}";

    @Test
    void readsProjectDocument() {
        StubHttpClient http = new StubHttpClient().on("/pypi/MultiQC/json", MULTIQC);

        RegistryOutcome outcome = new PyPiSource(http, "http://pypi.test").find("MultiQC");

        PackageInfo info = outcome.getInfos().get(0);
        assertEquals("MultiQC", info.getName());
        assertEquals("multiqc", info.getRegistryName());
        assertEquals("http://pypi.test/project/multiqc", info.getUrl());
        assertEquals("Aggregate bioinformatics results", info.getDescription());
        assertEquals(List.of("1.14", "1.15"), info.getVersions());
        assertEquals("1.15", info.getLatestVersion());
        assertEquals("GPLv3", info.getLicense());
        assertEquals(ThreadingSupport.NONE_DETECTED, info.getThreadingSupport());
    }

    @Test
    void missingProjectIsNotFound() {
        RegistryOutcome outcome = new PyPiSource(new StubHttpClient(), "http://pypi.test").find("nope");
        assertTrue(outcome.getInfos().isEmpty());
        assertFalse(outcome.isFailed());
    }

    @Test
    void documentWithoutInfoIsParseFailure() {
        StubHttpClient http = new StubHttpClient().on("/pypi/odd/json", "{\"releases\":{}}");
        RegistryOutcome outcome = new PyPiSource(http, "http://pypi.test").find("odd");
        assertEquals(ErrorReason.PARSE_FAILURE, outcome.getError().get().getReason());
    }

    @Test
    void licensePrefersExpressionThenShortTextThenClassifier() throws Exception {
        JsonNode expression = mapper.readTree("{\"license_expression\":\"Apache-2.0\",\"license\":\"whatever\"}");
        assertEquals("Apache-2.0", PyPiSource.license(expression));

        JsonNode shortText = mapper.readTree("{\"license\":\"BSD\"}");
        assertEquals("BSD", PyPiSource.license(shortText));

        JsonNode classifier = mapper.readTree("{\"license\":\"" + "x".repeat(200) + "\","
                + "\"classifiers\":[\"Programming Language :: Python\",\"License :: OSI Approved :: MIT License\"]}");
        assertEquals("MIT License", PyPiSource.license(classifier));

        assertNull(PyPiSource.license(mapper.readTree("{}")));
    }
}
