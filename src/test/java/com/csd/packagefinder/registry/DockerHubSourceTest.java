package com.csd.packagefinder.registry;

import com.csd.packagefinder.model.PackageInfo;
import com.csd.packagefinder.model.RegistryOutcome;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DockerHubSourceTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void officialImageWinsAndTagsBecomeVersions() {
        StubHttpClient http = new StubHttpClient()
                .on("/v2/search/repositories/", "{\"results\":["
                        + "{\"repo_name\":\"someone/python\",\"short_description\":\"fork\"},"
                        + "{\"repo_name\":\"python\",\"short_description\":\"Python is an interpreted language\"}]}")
                .on("/v2/repositories/library/python/tags",
                        "{\"results\":[{\"name\":\"3.12\"},{\"name\":\"3.11.9\"},{\"name\":\"latest\"}]}");

        RegistryOutcome outcome = new DockerHubSource(http, "http://hub.test").find("python");

        PackageInfo info = outcome.getInfos().get(0);
        assertEquals("python", info.getRegistryName());
        assertEquals("http://hub.test/_/python", info.getUrl());
        assertEquals("Python is an interpreted language", info.getDescription());
        assertEquals(List.of("latest", "3.11.9", "3.12"), info.getVersions());
        assertEquals("3.12", info.getLatestVersion());
    }

    @Test
    void namespacedImageWhenNoOfficialOne() {
        StubHttpClient http = new StubHttpClient()
                .on("/v2/search/repositories/", "{\"results\":[{\"repo_name\":\"staphb/samtools\",\"short_description\":\"\"}]}")
                .on("/v2/repositories/staphb/samtools/tags", "{\"results\":[{\"name\":\"1.19\"}]}");

        PackageInfo info = new DockerHubSource(http, "http://hub.test").find("samtools").getInfos().get(0);

        assertEquals("staphb/samtools", info.getRegistryName());
        assertEquals("http://hub.test/r/staphb/samtools", info.getUrl());
        assertEquals(List.of("1.19"), info.getVersions());
    }

    @Test
    void unrelatedHitsAreNotFound() throws Exception {
        JsonNode results = mapper.readTree("[{\"repo_name\":\"someone/samtools-extra\"},{\"repo_name\":\"bwa\"}]");
        assertTrue(DockerHubSource.bestMatch("samtools", results).isEmpty());

        StubHttpClient http = new StubHttpClient().on("/v2/search/repositories/", "{\"results\":[{\"repo_name\":\"bwa\"}]}");
        RegistryOutcome outcome = new DockerHubSource(http, "http://hub.test").find("samtools");
        assertTrue(outcome.getInfos().isEmpty());
        assertFalse(outcome.isFailed());
    }

    @Test
    void officialImageReportedWithLibraryPrefix() throws Exception {
        JsonNode results = mapper.readTree("[{\"repo_name\":\"a/nginx\"},{\"repo_name\":\"library/nginx\"}]");
        assertEquals("library/nginx", DockerHubSource.bestMatch("NGINX", results).get().get("repo_name").asText());
    }
}
