package com.csd.packagefinder.controller;

import com.csd.packagefinder.model.SearchResult;
import com.csd.packagefinder.service.ExportService;
import com.csd.packagefinder.service.PackageSearcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * REST API for downloading search results.
 */
@Slf4j
@RestController
@RequestMapping("/api/export")
public class ExportController {

    static final String XLSX_MEDIA_TYPE = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";

    private final PackageSearcher packageSearcher;
    private final ExportService exportService;

    public ExportController(PackageSearcher packageSearcher, ExportService exportService) {
        this.packageSearcher = packageSearcher;
        this.exportService = exportService;
    }

    @GetMapping(value = "/csv", produces = "text/csv")
    public ResponseEntity<String> exportCsv(@RequestParam(name = "name", required = false) List<String> names) {
        log.info("Export CSV request: names={}", names);
        String csv = exportService.exportCsv(packageSearcher.searchPackages(names));
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"package-search.csv\"")
                .contentType(MediaType.parseMediaType("text/csv"))
                .body(csv);
    }

    @GetMapping(value = "/xlsx", produces = XLSX_MEDIA_TYPE)
    public ResponseEntity<byte[]> exportExcel(@RequestParam(name = "name", required = false) List<String> names) throws IOException {
        log.info("Export Excel request: names={}", names);
        byte[] excel = exportService.exportExcel(packageSearcher.searchPackages(names));
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"package-search.xlsx\"")
                .contentType(MediaType.parseMediaType(XLSX_MEDIA_TYPE))
                .body(excel);
    }

    @GetMapping(value = "/json", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> exportJson(@RequestParam(name = "name", required = false) List<String> names) throws IOException {
        log.info("Export JSON request: names={}", names);
        Map<String, SearchResult> results = packageSearcher.searchPackages(names);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"package-search.json\"")
                .contentType(MediaType.APPLICATION_JSON)
                .body(exportService.exportJson(results));
    }

    @GetMapping("/links")
    public Map<String, String> links(@RequestParam(name = "name") List<String> names) {
        return exportService.getExportLinks(names);
    }
}
