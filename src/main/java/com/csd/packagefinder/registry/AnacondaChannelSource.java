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
 * A channel on anaconda.org (bioconda, anaconda, conda-forge).
 * R packages from Bioconductor are packaged as {@code bioconductor-<name>}; when that
 * package exists it is reported instead of the plain name.
 */
public class AnacondaChannelSource extends AbstractRegistrySource {

    static final String DEFAULT_API = "https://api.anaconda.org";
    static final String BIOCONDUCTOR_PREFIX = "bioconductor-";

    private final String channel;
    private final HttpUrl api;

    public AnacondaChannelSource(RegistryId id, String channel, RegistryHttpClient http) {
        this(id, channel, http, DEFAULT_API);
    }

    public AnacondaChannelSource(RegistryId id, String channel, RegistryHttpClient http, String apiBase) {
        super(id, http);
        this.channel = channel;
        this.api = baseUrl(apiBase);
    }

    public static AnacondaChannelSource bioconda(RegistryHttpClient http) {
        return new AnacondaChannelSource(RegistryId.BIOCONDA, "bioconda", http);
    }

    public static AnacondaChannelSource anaconda(RegistryHttpClient http) {
        return new AnacondaChannelSource(RegistryId.ANACONDA, "anaconda", http);
    }

    public static AnacondaChannelSource condaForge(RegistryHttpClient http) {
        return new AnacondaChannelSource(RegistryId.CONDA_FORGE, "conda-forge", http);
    }

    public String getChannel() {
        return channel;
    }

    @Override
    protected List<PackageInfo> lookup(String packageName) throws RegistryException {
        String lower = packageName.toLowerCase(Locale.ROOT);
        List<String> candidates = new ArrayList<>();
        if (!lower.startsWith(BIOCONDUCTOR_PREFIX)) {
            candidates.add(BIOCONDUCTOR_PREFIX + lower);
        }
        candidates.add(packageName);
        // conda package names are lower case; retry when the caller used capitals
        if (!lower.equals(packageName)) {
            candidates.add(lower);
        }

        for (String candidate : candidates) {
            Optional<JsonNode> data = fetch(candidate);
            if (data.isPresent()) {
                return toInfos(packageName, candidate, data.get());
            }
        }
        return List.of();
    }

    private List<PackageInfo> toInfos(String packageName, String fetchedName, JsonNode pkg) throws RegistryException {
        if (!pkg.isObject()) {
            throw unexpectedShape("package document is not an object");
        }
        String registryName = text(pkg, "name").isBlank() ? fetchedName : text(pkg, "name");
        return listOf(draft(packageName)
                .registryName(registryName)
                .url("https://anaconda.org/" + channel + "/" + registryName)
                .description(text(pkg, "summary"))
                .readme(text(pkg, "description"))
                .versions(versions(pkg))
                .license(text(pkg, "license"))
                .build());
    }

    private Optional<JsonNode> fetch(String name) throws RegistryException {
        HttpUrl url = api.newBuilder()
                .addPathSegment("package")
                .addPathSegment(channel)
                .addPathSegment(name)
                .build();
        return http.getJson(url);
    }

    private static List<String> versions(JsonNode pkg) {
        JsonNode versions = pkg.get("versions");
        List<String> result = new ArrayList<>();
        if (versions != null && versions.isArray()) {
            versions.forEach(v -> result.add(v.asText()));
        }
        return result;
    }
}
