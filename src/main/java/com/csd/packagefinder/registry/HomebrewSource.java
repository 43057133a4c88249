package com.csd.packagefinder.registry;

import com.csd.packagefinder.exception.RegistryException;
import com.csd.packagefinder.model.PackageInfo;
import com.csd.packagefinder.model.RegistryId;
import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.HttpUrl;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Homebrew core formulae. The stable version, {@code head} when the formula builds from its
 * development branch, plus every versioned formula ({@code python@3.11} contributes {@code 3.11}).
 * Only the exact formula name is looked up.
 */
public class HomebrewSource extends AbstractRegistrySource {

    static final String DEFAULT_BASE = "https://formulae.brew.sh";

    private final HttpUrl base;

    public HomebrewSource(RegistryHttpClient http) {
        this(http, DEFAULT_BASE);
    }

    public HomebrewSource(RegistryHttpClient http, String base) {
        super(RegistryId.HOMEBREW, http);
        this.base = baseUrl(base);
    }

    @Override
    protected List<PackageInfo> lookup(String packageName) throws RegistryException {
        String formula = packageName.toLowerCase(Locale.ROOT);
        HttpUrl url = base.newBuilder()
                .addPathSegment("api").addPathSegment("formula")
                .addPathSegment(formula + ".json")
                .build();
        Optional<JsonNode> data = http.getJson(url);
        if (data.isEmpty()) {
            return List.of();
        }
        JsonNode json = data.get();
        if (!json.isObject()) {
            throw unexpectedShape("formula document is not an object");
        }
        String name = text(json, "name").isBlank() ? formula : text(json, "name");

        return listOf(draft(packageName)
                .registryName(name)
                .url(base.newBuilder().addPathSegment("formula").addPathSegment(name).build().toString())
                .description(text(json, "desc"))
                .versions(versions(json))
                .license(text(json, "license"))
                .build());
    }

    static List<String> versions(JsonNode formula) {
        List<String> versions = new ArrayList<>();
        JsonNode declared = formula.get("versions");
        String stable = text(declared, "stable");
        if (!stable.isBlank()) {
            versions.add(stable);
        }
        // a formula buildable from its development branch
        if (declared != null && declared.hasNonNull("head")) {
            versions.add("head");
        }
        JsonNode versioned = formula.get("versioned_formulae");
        if (versioned != null && versioned.isArray()) {
            for (JsonNode v : versioned) {
                String entry = v.asText();
                int at = entry.indexOf('@');
                if (at >= 0 && at < entry.length() - 1) {
                    versions.add(entry.substring(at + 1));
                }
            }
        }
        return versions;
    }
}
