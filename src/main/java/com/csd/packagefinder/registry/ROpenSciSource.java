package com.csd.packagefinder.registry;

import com.csd.packagefinder.model.RegistryId;
import okhttp3.HttpUrl;

/**
 * rOpenSci packages on r-universe.
 */
public class ROpenSciSource extends RPackageApiSource {

    static final String DEFAULT_BASE = "https://ropensci.r-universe.dev";

    private final HttpUrl base;

    public ROpenSciSource(RegistryHttpClient http) {
        this(http, DEFAULT_BASE);
    }

    public ROpenSciSource(RegistryHttpClient http, String base) {
        super(RegistryId.ROPENSCI, http);
        this.base = baseUrl(base);
    }

    @Override
    protected HttpUrl packageUrl(String name) {
        return api().addPathSegment("packages").addPathSegment(name).build();
    }

    @Override
    protected HttpUrl versionsUrl(String name) {
        return api().addPathSegment("versions").addPathSegment(name).build();
    }

    @Override
    protected HttpUrl listingUrl() {
        return api().addPathSegment("packages").build();
    }

    @Override
    protected String pageUrl(String name) {
        return base.newBuilder().addPathSegment(name).build().toString();
    }

    private HttpUrl.Builder api() {
        return base.newBuilder().addPathSegment("api");
    }
}
