package com.csd.packagefinder.registry;

import com.csd.packagefinder.exception.RegistryException;
import com.csd.packagefinder.model.ErrorReason;
import com.csd.packagefinder.model.PackageInfo;
import com.csd.packagefinder.model.RegistryId;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Container images published to ghcr.io, found through the GitHub repository search.
 * The packages API needs a token; without one every lookup reports UNSUPPORTED.
 */
@Slf4j
public class GitHubContainerRegistrySource extends AbstractRegistrySource {

    static final String DEFAULT_API = "https://api.github.com";
    static final int PAGE_SIZE = 100;

    private final HttpUrl api;
    private final String token;

    public GitHubContainerRegistrySource(RegistryHttpClient http, String token) {
        this(http, token, DEFAULT_API);
    }

    public GitHubContainerRegistrySource(RegistryHttpClient http, String token, String api) {
        super(RegistryId.GITHUB_CONTAINER_REGISTRY, http);
        this.token = token;
        this.api = baseUrl(api);
    }

    @Override
    protected List<PackageInfo> lookup(String packageName) throws RegistryException {
        if (token == null || token.isBlank()) {
            throw new RegistryException(ErrorReason.UNSUPPORTED, "no GitHub token configured");
        }
        Map<String, String> headers = Map.of(
                "Authorization", "Bearer " + token,
                "Accept", "application/vnd.github+json");

        HttpUrl searchUrl = api.newBuilder()
                .addPathSegments("search/repositories")
                .addQueryParameter("q", packageName + " in:name topic:container")
                .addQueryParameter("per_page", String.valueOf(PAGE_SIZE))
                .build();
        Optional<JsonNode> search = http.getJson(searchUrl, headers);
        if (search.isEmpty()) {
            return List.of();
        }
        JsonNode items = search.get().get("items");
        if (items == null || !items.isArray()) {
            throw unexpectedShape("search response without 'items'");
        }
        Optional<String> name = matchIgnoringCase(packageName, texts(items, "name"));
        if (name.isEmpty()) {
            return List.of();
        }
        JsonNode repo = null;
        for (JsonNode item : items) {
            if (name.get().equals(text(item, "name"))) {
                repo = item;
                break;
            }
        }
        JsonNode owner = repo.get("owner");
        String login = text(owner, "login");
        String ownerKind = "Organization".equals(text(owner, "type")) ? "orgs" : "users";

        HttpUrl versionsUrl = api.newBuilder()
                .addPathSegment(ownerKind).addPathSegment(login)
                .addPathSegments("packages/container")
                .addPathSegment(name.get())
                .addPathSegment("versions")
                .addQueryParameter("per_page", String.valueOf(PAGE_SIZE))
                .build();
        List<String> tags = http.getJson(versionsUrl, headers).map(GitHubContainerRegistrySource::tags).orElse(List.of());

        HttpUrl readmeUrl = api.newBuilder()
                .addPathSegment("repos").addPathSegment(login).addPathSegment(name.get())
                .addPathSegment("readme")
                .build();
        String readme = http.getJson(readmeUrl, headers).map(GitHubContainerRegistrySource::decodeContent).orElse("");

        return listOf(draft(packageName)
                .registryName(login + "/" + name.get())
                .url("https://github.com/" + login + "/" + name.get() + "/pkgs/container/" + name.get())
                .description(text(repo, "description"))
                .readme(readme)
                .versions(tags)
                .license(text(repo.get("license"), "spdx_id"))
                .build());
    }

    static List<String> tags(JsonNode versions) {
        Set<String> tags = new LinkedHashSet<>();
        if (versions.isArray()) {
            for (JsonNode version : versions) {
                JsonNode container = version.path("metadata").path("container").path("tags");
                container.forEach(tag -> tags.add(tag.asText()));
            }
        }
        return new ArrayList<>(tags);
    }

    static String decodeContent(JsonNode readme) {
        String content = text(readme, "content");
        if (content.isBlank()) return "";
        try {
            return new String(Base64.getMimeDecoder().decode(content), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // the readme is only used for the threading scan
            log.debug("Undecodable README content: {}", e.getMessage());
            return "";
        }
    }
}
