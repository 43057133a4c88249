package com.csd.packagefinder.registry;

import com.csd.packagefinder.model.PackageInfo;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GalaxyToolShedSourceTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void readsToolVersionsOfMatchingRepository() {
        StubHttpClient http = new StubHttpClient()
                .on("/api/repositories", "{\"hits\":[{\"repository\":{\"id\":\"f2db41e1fa331b3e\",\"name\":\"fastqc\","
                        + "\"repo_owner_username\":\"devteam\",\"description\":\"Read QC reports\"}}]}")
                .on("/api/repositories/f2db41e1fa331b3e/metadata", "{"
                        + "\"1:aaaaaaaaaaaa\":{\"changeset_revision\":\"aaaaaaaaaaaa\",\"tools\":[{\"version\":\"0.73\"}]},"
                        + "\"2:bbbbbbbbbbbb\":{\"changeset_revision\":\"bbbbbbbbbbbb\",\"tools\":[{\"version\":\"0.74+galaxy0\"}]}}");

        PackageInfo info = new GalaxyToolShedSource(http, "http://shed.test").find("FastQC").getInfos().get(0);

        assertEquals("fastqc", info.getRegistryName());
        assertEquals("http://shed.test/view/devteam/fastqc", info.getUrl());
        assertEquals(List.of("0.73", "0.74+galaxy0"), info.getVersions());
    }

    @Test
    void fallsBackToShortChangesets() throws Exception {
        List<String> versions = GalaxyToolShedSource.versions(mapper.readTree(
                "{\"0:1234567890ab\":{\"changeset_revision\":\"1234567890ab\",\"tools\":[]}}"));
        assertEquals(List.of("1234567"), versions);
    }

    @Test
    void acceptsBareArraySearchResults() throws Exception {
        assertEquals(2, GalaxyToolShedSource.repositories(mapper.readTree("[{\"name\":\"a\"},{\"name\":\"b\"}]")).size());
        assertTrue(GalaxyToolShedSource.repositories(mapper.readTree("{\"total\":0}")).isEmpty());
    }
}
