package com.csd.packagefinder.config;

import com.csd.packagefinder.registry.RegistryHttpClient;
import com.csd.packagefinder.registry.RegistrySource;
import com.csd.packagefinder.registry.RegistrySources;
import com.csd.packagefinder.service.PackageSearcher;
import com.csd.packagefinder.service.SearchSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Wires the registry adapters and the searcher from {@code packagefinder.*} properties.
 */
@Slf4j
@Configuration
public class SearchConfig {

    @Value("${packagefinder.search.concurrency:32}")
    private int concurrency;

    @Value("${packagefinder.search.timeout:30s}")
    private Duration timeout;

    @Value("${packagefinder.registries.enabled:}")
    private List<String> enabledRegistries;

    @Value("${packagefinder.github.token:}")
    private String githubToken;

    @Value("${packagefinder.http.user-agent:package-finder/0.1}")
    private String userAgent;

    @Bean
    public SearchSettings searchSettings() {
        return SearchSettings.builder()
                .concurrency(concurrency)
                .timeout(timeout)
                .build();
    }

    @Bean
    public OkHttpClient registryOkHttpClient(SearchSettings settings) {
        // the call timeout matches the per-search timeout so abandoned workers are released
        return new OkHttpClient.Builder()
                .callTimeout(settings.getTimeout())
                .followRedirects(true)
                .build();
    }

    @Bean
    public RegistryHttpClient registryHttpClient(OkHttpClient registryOkHttpClient, ObjectMapper objectMapper) {
        return new RegistryHttpClient(registryOkHttpClient, objectMapper, userAgent);
    }

    @Bean
    public PackageSearcher packageSearcher(RegistryHttpClient registryHttpClient, SearchSettings settings) {
        List<RegistrySource> sources = RegistrySources.select(
                RegistrySources.defaults(registryHttpClient, githubToken), enabledRegistries);
        log.info("Registries enabled: {}", sources.stream()
                .map(s -> s.id().getKey())
                .collect(Collectors.joining(", ")));
        return new PackageSearcher(sources, settings);
    }
}
