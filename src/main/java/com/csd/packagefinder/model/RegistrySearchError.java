package com.csd.packagefinder.model;

import lombok.Builder;
import lombok.Value;

/**
 * A registry that could not be checked for a package. Collected, never thrown.
 */
@Value
@Builder
public class RegistrySearchError {
    RegistryId repository;
    String packageName;
    ErrorReason reason;
    String detail; // may be null

    public String describe() {
        String base = repository.getDisplayName() + ": " + reason;
        return detail == null || detail.isBlank() ? base : base + " (" + detail + ")";
    }
}
