package com.csd.packagefinder.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.util.List;

/**
 * Everything found for one package name, plus the registries that could not be checked.
 * Callers must look at {@link #getErrors()} before reporting "not found".
 */
@Value
public class SearchResult {
    List<PackageInfo> infos;
    List<RegistrySearchError> errors;

    /** Checked everywhere, found nowhere. */
    @JsonIgnore
    public boolean isNotFound() {
        return infos.isEmpty() && errors.isEmpty();
    }

    /** At least one registry could not be checked. */
    @JsonIgnore
    public boolean isIncomplete() {
        return !errors.isEmpty();
    }
}
