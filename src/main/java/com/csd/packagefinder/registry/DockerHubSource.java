package com.csd.packagefinder.registry;

import com.csd.packagefinder.exception.RegistryException;
import com.csd.packagefinder.model.PackageInfo;
import com.csd.packagefinder.model.RegistryId;
import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.HttpUrl;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Docker Hub images. An official image named exactly like the package wins, then the first
 * {@code namespace/<name>} image. Tags are the versions.
 */
public class DockerHubSource extends AbstractRegistrySource {

    static final String DEFAULT_BASE = "https://hub.docker.com";
    static final int SEARCH_PAGE_SIZE = 25;
    static final int TAG_PAGE_SIZE = 100;

    private final HttpUrl base;

    public DockerHubSource(RegistryHttpClient http) {
        this(http, DEFAULT_BASE);
    }

    public DockerHubSource(RegistryHttpClient http, String base) {
        super(RegistryId.DOCKER_HUB, http);
        this.base = baseUrl(base);
    }

    @Override
    protected List<PackageInfo> lookup(String packageName) throws RegistryException {
        HttpUrl searchUrl = base.newBuilder()
                .addPathSegments("v2/search/repositories/")
                .addQueryParameter("query", packageName)
                .addQueryParameter("page_size", String.valueOf(SEARCH_PAGE_SIZE))
                .build();
        Optional<JsonNode> search = http.getJson(searchUrl);
        if (search.isEmpty()) {
            return List.of();
        }
        JsonNode results = search.get().get("results");
        if (results == null || !results.isArray()) {
            throw unexpectedShape("search response without 'results'");
        }
        Optional<JsonNode> match = bestMatch(packageName, results);
        if (match.isEmpty()) {
            return List.of();
        }

        JsonNode image = match.get();
        String repoName = text(image, "repo_name");
        if (repoName.startsWith("library/")) {
            repoName = repoName.substring("library/".length());
        }
        boolean official = !repoName.contains("/");
        String repoPath = official ? "library/" + repoName : repoName;

        HttpUrl tagsUrl = base.newBuilder()
                .addPathSegment("v2").addPathSegment("repositories")
                .addPathSegments(repoPath)
                .addPathSegment("tags")
                .addQueryParameter("page_size", String.valueOf(TAG_PAGE_SIZE))
                .build();
        List<String> tags = http.getJson(tagsUrl).map(t -> texts(t.get("results"), "name")).orElse(List.of());

        String pageUrl = official
                ? base.newBuilder().addPathSegment("_").addPathSegment(repoName).build().toString()
                : base.newBuilder().addPathSegment("r").addPathSegments(repoName).build().toString();
        return listOf(draft(packageName)
                .registryName(repoName)
                .url(pageUrl)
                .description(text(image, "short_description"))
                .versions(tags)
                .build());
    }

    static Optional<JsonNode> bestMatch(String packageName, JsonNode results) {
        String wanted = packageName.toLowerCase(Locale.ROOT);
        JsonNode namespaced = null;
        for (JsonNode result : results) {
            String repoName = text(result, "repo_name").toLowerCase(Locale.ROOT);
            if (repoName.equals(wanted) || repoName.equals("library/" + wanted)) {
                return Optional.of(result);
            }
            if (namespaced == null && repoName.endsWith("/" + wanted)) {
                namespaced = result;
            }
        }
        return Optional.ofNullable(namespaced);
    }
}
