package com.csd.packagefinder.registry;

import com.csd.packagefinder.exception.RegistryException;
import com.csd.packagefinder.model.PackageInfo;
import com.csd.packagefinder.model.RegistryId;
import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.HttpUrl;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * R package services that serve DESCRIPTION fields as JSON ({@code Package}, {@code Version},
 * {@code Title}, {@code Description}, {@code License}) plus a list of published versions.
 */
public abstract class RPackageApiSource extends AbstractRegistrySource {

    protected RPackageApiSource(RegistryId id, RegistryHttpClient http) {
        super(id, http);
    }

    protected abstract HttpUrl packageUrl(String name);

    protected abstract HttpUrl versionsUrl(String name);

    protected abstract HttpUrl listingUrl();

    protected abstract String pageUrl(String name);

    @Override
    protected List<PackageInfo> lookup(String packageName) throws RegistryException {
        String registryName = packageName;
        Optional<JsonNode> data = http.getJson(packageUrl(packageName));
        if (data.isEmpty()) {
            Optional<String> corrected = correctCase(packageName);
            if (corrected.isEmpty()) {
                return List.of();
            }
            registryName = corrected.get();
            data = http.getJson(packageUrl(registryName));
            if (data.isEmpty()) {
                return List.of();
            }
        }
        JsonNode pkg = data.get();
        if (pkg.isArray() && !pkg.isEmpty()) {
            pkg = pkg.get(0);
        }
        if (!pkg.isObject()) {
            throw unexpectedShape("package document is not an object");
        }

        List<String> versions = new ArrayList<>();
        Optional<JsonNode> published = http.getJson(versionsUrl(registryName));
        published.ifPresent(list -> versions.addAll(texts(list, "Version")));
        String current = text(pkg, "Version");
        if (!current.isBlank()) {
            versions.add(current);
        }

        return listOf(draft(packageName)
                .registryName(text(pkg, "Package").isBlank() ? registryName : text(pkg, "Package"))
                .url(pageUrl(registryName))
                .description(firstNonBlank(text(pkg, "Title"), text(pkg, "Description")))
                .readme(text(pkg, "Description"))
                .versions(versions)
                .license(text(pkg, "License"))
                .build());
    }

    private Optional<String> correctCase(String packageName) throws RegistryException {
        Optional<JsonNode> listing = http.getJson(listingUrl());
        if (listing.isEmpty()) {
            return Optional.empty();
        }
        return matchIgnoringCase(packageName, texts(listing.get(), "Package"));
    }

    private static String firstNonBlank(String a, String b) {
        return a.isBlank() ? b : a;
    }
}
