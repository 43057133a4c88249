package com.csd.packagefinder.model;

import com.csd.packagefinder.exception.InvalidSearchRequestException;

import java.util.Locale;

public enum ExportFormat {
    TEXT,
    JSON,
    CSV,
    XLSX;

    public static ExportFormat parse(String value) {
        try {
            return ExportFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidSearchRequestException("Unknown format: " + value);
        }
    }
}
