package com.csd.packagefinder.service;

import com.csd.packagefinder.model.ErrorReason;
import com.csd.packagefinder.model.RegistryId;
import com.csd.packagefinder.model.SearchResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ExportServiceTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ExportService exportService = new ExportService(mapper);

    private Map<String, SearchResult> sample() {
        Map<String, SearchResult> results = new LinkedHashMap<>();
        results.put("fastqc", new SearchResult(
                List.of(ResultAggregatorTest.info(RegistryId.BIOCONDA, "fastqc")),
                List.of(ResultAggregatorTest.error(RegistryId.PYPI, "fastqc", ErrorReason.TIMEOUT))));
        results.put("nope", new SearchResult(List.of(), List.of()));
        return results;
    }

    @Test
    void jsonKeepsRecordsAndErrors() throws Exception {
        JsonNode json = mapper.readTree(exportService.exportJson(sample()));

        JsonNode fastqc = json.get("fastqc");
        assertEquals("fastqc", fastqc.get("infos").get(0).get("name").asText());
        assertEquals("bioconda", fastqc.get("infos").get(0).get("repository").get("key").asText());
        assertEquals("1.1", fastqc.get("infos").get(0).get("latestVersion").asText());
        assertEquals("TIMEOUT", fastqc.get("errors").get(0).get("reason").asText());
        assertEquals(0, json.get("nope").get("infos").size());
    }

    @Test
    void csvHasOneRowPerRecordAndMarksMisses() {
        String[] lines = exportService.exportCsv(sample()).split("\n");

        assertEquals(3, lines.length);
        assertTrue(lines[0].startsWith("Package,Repository,Registry Name,URL,Latest Version"));
        assertTrue(lines[1].startsWith("fastqc,Bioconda,fastqc,https://example.org/bioconda/fastqc,1.1,2,2,1.0;1.1,Unknown,"));
        assertEquals("nope,,,,not found,,,,,,,", lines[2]);
        assertEquals(ExportService.FOUND_HEADERS.length, lines[2].split(",", -1).length);
    }

    @Test
    void csvEscapesSeparators() {
        assertEquals("\"a, b\"", ExportService.escapeCsv("a, b"));
        assertEquals("\"say \"\"hi\"\"\"", ExportService.escapeCsv("say \"hi\""));
        assertEquals("", ExportService.escapeCsv(null));
    }

    @Test
    void workbookHasPackagesAndErrorsSheets() throws Exception {
        byte[] bytes = exportService.exportExcel(sample());

        try (Workbook workbook = new XSSFWorkbook(new ByteArrayInputStream(bytes))) {
            Sheet packages = workbook.getSheet("Packages");
            Sheet errors = workbook.getSheet("Errors");
            assertEquals(1, packages.getLastRowNum());
            assertEquals("fastqc", packages.getRow(1).getCell(0).getStringCellValue());
            assertEquals(1, errors.getLastRowNum());
            assertEquals("TIMEOUT", errors.getRow(1).getCell(2).getStringCellValue());
        }
    }

    @Test
    void exportLinksEncodeNames() {
        Map<String, String> links = exportService.getExportLinks(List.of("data.table", "a b"));
        assertEquals("/api/export/csv?name=data.table&name=a+b", links.get("CSV"));
    }
}
