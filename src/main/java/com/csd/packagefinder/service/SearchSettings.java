package com.csd.packagefinder.service;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class SearchSettings {

    public static final int DEFAULT_CONCURRENCY = 32;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    /** Upper bound on registry calls in flight at once. */
    @Builder.Default
    int concurrency = DEFAULT_CONCURRENCY;

    /** Per (name, registry) call. */
    @Builder.Default
    Duration timeout = DEFAULT_TIMEOUT;

    public static SearchSettings defaults() {
        return SearchSettings.builder().build();
    }
}
