package com.csd.packagefinder.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * What a single registry lookup produced: records, nothing, or an error, never records and an
 * error together. Built only through the factory methods.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RegistryOutcome {
    List<PackageInfo> infos;
    RegistrySearchError error;

    public static RegistryOutcome found(List<PackageInfo> infos) {
        return new RegistryOutcome(List.copyOf(infos), null);
    }

    public static RegistryOutcome found(PackageInfo info) {
        return new RegistryOutcome(List.of(info), null);
    }

    public static RegistryOutcome notFound() {
        return new RegistryOutcome(List.of(), null);
    }

    public static RegistryOutcome failed(RegistrySearchError error) {
        return new RegistryOutcome(List.of(), Objects.requireNonNull(error, "error"));
    }

    public Optional<RegistrySearchError> getError() {
        return Optional.ofNullable(error);
    }

    public boolean isFailed() {
        return error != null;
    }
}
