package com.csd.packagefinder.registry;

import com.csd.packagefinder.model.RegistryId;
import okhttp3.HttpUrl;

/**
 * Posit Package Manager (formerly RStudio Package Manager) CRAN mirror.
 */
public class PositSource extends RPackageApiSource {

    static final String DEFAULT_BASE = "https://packagemanager.posit.co/client";

    private final HttpUrl base;

    public PositSource(RegistryHttpClient http) {
        this(http, DEFAULT_BASE);
    }

    public PositSource(RegistryHttpClient http, String base) {
        super(RegistryId.POSIT, http);
        this.base = baseUrl(base);
    }

    @Override
    protected HttpUrl packageUrl(String name) {
        return packages().addPathSegment(name).build();
    }

    @Override
    protected HttpUrl versionsUrl(String name) {
        return packages().addPathSegment(name).addPathSegment("versions").build();
    }

    @Override
    protected HttpUrl listingUrl() {
        return packages().build();
    }

    @Override
    protected String pageUrl(String name) {
        return packageUrl(name).toString();
    }

    private HttpUrl.Builder packages() {
        return base.newBuilder().addPathSegment("packages");
    }
}
