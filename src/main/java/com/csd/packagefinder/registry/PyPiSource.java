package com.csd.packagefinder.registry;

import com.csd.packagefinder.exception.RegistryException;
import com.csd.packagefinder.model.PackageInfo;
import com.csd.packagefinder.model.RegistryId;
import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.HttpUrl;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PyPI JSON API. PyPI normalizes project names itself, so no case-insensitive fallback is needed.
 */
public class PyPiSource extends AbstractRegistrySource {

    static final String DEFAULT_BASE = "https://pypi.org";
    private static final String LICENSE_CLASSIFIER = "License :: ";

    private final HttpUrl base;

    public PyPiSource(RegistryHttpClient http) {
        this(http, DEFAULT_BASE);
    }

    public PyPiSource(RegistryHttpClient http, String base) {
        super(RegistryId.PYPI, http);
        this.base = baseUrl(base);
    }

    @Override
    protected List<PackageInfo> lookup(String packageName) throws RegistryException {
        HttpUrl url = base.newBuilder()
                .addPathSegment("pypi")
                .addPathSegment(packageName)
                .addPathSegment("json")
                .build();
        Optional<JsonNode> data = http.getJson(url);
        if (data.isEmpty()) {
            return List.of();
        }
        JsonNode info = data.get().get("info");
        if (info == null || !info.isObject()) {
            throw unexpectedShape("missing 'info' object");
        }
        String registryName = text(info, "name");

        return listOf(draft(packageName)
                .registryName(registryName)
                .url(base.newBuilder().addPathSegment("project").addPathSegment(registryName).build().toString())
                .description(text(info, "summary"))
                .readme(text(info, "description"))
                .versions(releasedVersions(data.get().get("releases")))
                .license(license(info))
                .build());
    }

    /** Versions that have at least one uploaded file; yanked-only placeholders are skipped. */
    static List<String> releasedVersions(JsonNode releases) {
        List<String> versions = new ArrayList<>();
        if (releases == null || !releases.isObject()) {
            return versions;
        }
        Iterator<Map.Entry<String, JsonNode>> it = releases.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> release = it.next();
            if (release.getValue().isArray() && !release.getValue().isEmpty()) {
                versions.add(release.getKey());
            }
        }
        return versions;
    }

    /**
     * Prefers the SPDX expression, then a short free-text license, then the trove classifier.
     * Some projects paste the whole license text into the free-text field.
     */
    static String license(JsonNode info) {
        String expression = text(info, "license_expression");
        if (!expression.isBlank()) return expression;

        String free = text(info, "license").trim();
        if (!free.isBlank() && free.length() <= 80 && !free.contains("\n")) return free;

        JsonNode classifiers = info.get("classifiers");
        if (classifiers != null && classifiers.isArray()) {
            for (JsonNode c : classifiers) {
                String value = c.asText();
                if (value.startsWith(LICENSE_CLASSIFIER)) {
                    return value.substring(value.lastIndexOf(" :: ") + 4);
                }
            }
        }
        return free.isBlank() ? null : free.lines().findFirst().orElse(null);
    }
}
