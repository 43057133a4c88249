package com.csd.packagefinder.service;

import com.csd.packagefinder.model.PackageInfo;
import com.csd.packagefinder.model.RegistrySearchError;
import com.csd.packagefinder.model.SearchResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exports search results as JSON, CSV or an Excel workbook.
 */
@Slf4j
@Service
public class ExportService {

    static final String[] FOUND_HEADERS = {
            "Package", "Repository", "Registry Name", "URL", "Latest Version", "Major.Minor Count",
            "Version Count", "Versions", "License", "Threading", "Thread Flags", "Description"
    };
    static final String[] ERROR_HEADERS = {"Package", "Repository", "Reason", "Detail"};
    private static final int COLUMN_WIDTH = 24 * 256;

    private final ObjectMapper objectMapper;

    public ExportService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String exportJson(Map<String, SearchResult> results) throws IOException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(results);
    }

    /**
     * One row per record. Names found nowhere get a row with only the package column and
     * "not found" in the latest-version column; registries that failed are not listed here.
     */
    public String exportCsv(Map<String, SearchResult> results) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.join(",", FOUND_HEADERS)).append('\n');
        results.forEach((name, result) -> {
            if (result.getInfos().isEmpty()) {
                sb.append(escapeCsv(name)).append(",,,,")
                        .append(result.isNotFound() ? "not found" : "unknown")
                        .append(",,,,,,,\n");
                return;
            }
            for (PackageInfo info : result.getInfos()) {
                String[] row = foundRow(info);
                for (int i = 0; i < row.length; i++) {
                    if (i > 0) sb.append(',');
                    sb.append(escapeCsv(row[i]));
                }
                sb.append('\n');
            }
        });
        return sb.toString();
    }

    /**
     * A "Packages" sheet with every record and an "Errors" sheet with every registry that
     * could not be checked.
     */
    public byte[] exportExcel(Map<String, SearchResult> results) throws IOException {
        try (Workbook workbook = new XSSFWorkbook()) {
            CellStyle headerStyle = workbook.createCellStyle();
            Font headerFont = workbook.createFont();
            headerFont.setBold(true);
            headerStyle.setFont(headerFont);

            Sheet packages = workbook.createSheet("Packages");
            header(packages, FOUND_HEADERS, headerStyle);
            Sheet errors = workbook.createSheet("Errors");
            header(errors, ERROR_HEADERS, headerStyle);

            int packageRow = 1;
            int errorRow = 1;
            for (SearchResult result : results.values()) {
                for (PackageInfo info : result.getInfos()) {
                    fill(packages.createRow(packageRow++), foundRow(info));
                }
                for (RegistrySearchError error : result.getErrors()) {
                    fill(errors.createRow(errorRow++), new String[]{
                            error.getPackageName(),
                            error.getRepository().getDisplayName(),
                            error.getReason().name(),
                            error.getDetail() == null ? "" : error.getDetail()
                    });
                }
            }
            // autoSizeColumn needs AWT fonts
            for (int i = 0; i < FOUND_HEADERS.length; i++) {
                packages.setColumnWidth(i, COLUMN_WIDTH);
            }
            for (int i = 0; i < ERROR_HEADERS.length; i++) {
                errors.setColumnWidth(i, COLUMN_WIDTH);
            }

            ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
            workbook.write(outputStream);
            log.debug("Exported {} record(s) and {} error(s) to xlsx", packageRow - 1, errorRow - 1);
            return outputStream.toByteArray();
        }
    }

    private static String[] foundRow(PackageInfo info) {
        return new String[]{
                info.getName(),
                info.getRepository().getDisplayName(),
                info.getRegistryName(),
                info.getUrl(),
                info.getLatestVersion(),
                String.valueOf(info.getVersionGroups().size()),
                String.valueOf(info.getVersions().size()),
                String.join(";", info.getVersions()),
                info.getLicense(),
                info.getThreadingSupport().getLabel(),
                String.join(";", info.getThreadFlags()),
                info.getDescription()
        };
    }

    private static void header(Sheet sheet, String[] headers, CellStyle style) {
        Row row = sheet.createRow(0);
        for (int i = 0; i < headers.length; i++) {
            Cell cell = row.createCell(i);
            cell.setCellValue(headers[i]);
            cell.setCellStyle(style);
        }
    }

    private static void fill(Row row, String[] values) {
        for (int i = 0; i < values.length; i++) {
            row.createCell(i).setCellValue(values[i] == null ? "" : values[i]);
        }
    }

    static String escapeCsv(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    /** Export links for a set of names, as served by the REST API. */
    public Map<String, String> getExportLinks(List<String> names) {
        StringBuilder query = new StringBuilder();
        for (String name : names) {
            query.append(query.length() == 0 ? "?" : "&")
                    .append("name=").append(URLEncoder.encode(name, StandardCharsets.UTF_8));
        }
        Map<String, String> links = new LinkedHashMap<>();
        links.put("CSV", "/api/export/csv" + query);
        links.put("Excel", "/api/export/xlsx" + query);
        links.put("JSON", "/api/export/json" + query);
        return links;
    }
}
