package com.csd.packagefinder.registry;

import com.csd.packagefinder.exception.RegistryException;
import com.csd.packagefinder.model.PackageInfo;
import com.csd.packagefinder.model.RegistryId;
import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.HttpUrl;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Galaxy Tool Shed repositories. Versions are the tool versions declared by installable
 * revisions, or the short changeset ids when a repository declares no tool versions.
 */
public class GalaxyToolShedSource extends AbstractRegistrySource {

    static final String DEFAULT_BASE = "https://toolshed.g2.bx.psu.edu";
    private static final int SHORT_CHANGESET = 7;

    private final HttpUrl base;

    public GalaxyToolShedSource(RegistryHttpClient http) {
        this(http, DEFAULT_BASE);
    }

    public GalaxyToolShedSource(RegistryHttpClient http, String base) {
        super(RegistryId.GALAXY_TOOL_SHED, http);
        this.base = baseUrl(base);
    }

    @Override
    protected List<PackageInfo> lookup(String packageName) throws RegistryException {
        HttpUrl searchUrl = base.newBuilder()
                .addPathSegment("api").addPathSegment("repositories")
                .addQueryParameter("q", packageName)
                .build();
        Optional<JsonNode> search = http.getJson(searchUrl);
        if (search.isEmpty()) {
            return List.of();
        }
        Optional<JsonNode> match = bestMatch(packageName, repositories(search.get()));
        if (match.isEmpty()) {
            return List.of();
        }
        JsonNode repo = match.get();
        String name = text(repo, "name");
        String owner = text(repo, "owner").isBlank() ? text(repo, "repo_owner_username") : text(repo, "owner");
        String id = text(repo, "id");
        if (name.isBlank() || owner.isBlank() || id.isBlank()) {
            throw unexpectedShape("repository without name, owner or id");
        }

        HttpUrl metadataUrl = base.newBuilder()
                .addPathSegment("api").addPathSegment("repositories")
                .addPathSegment(id).addPathSegment("metadata")
                .addQueryParameter("downloadable_only", "true")
                .build();
        List<String> versions = http.getJson(metadataUrl).map(GalaxyToolShedSource::versions).orElse(List.of());

        return listOf(draft(packageName)
                .registryName(name)
                .url(base.newBuilder().addPathSegment("view").addPathSegment(owner).addPathSegment(name).build().toString())
                .description(text(repo, "description"))
                .readme(text(repo, "long_description"))
                .versions(versions)
                .build());
    }

    /** Search results come either as a bare array or wrapped in {@code hits[].repository}. */
    static List<JsonNode> repositories(JsonNode search) {
        List<JsonNode> repos = new ArrayList<>();
        JsonNode items = search.isArray() ? search : search.get("hits");
        if (items == null || !items.isArray()) {
            return repos;
        }
        for (JsonNode item : items) {
            repos.add(item.has("repository") ? item.get("repository") : item);
        }
        return repos;
    }

    private static Optional<JsonNode> bestMatch(String packageName, List<JsonNode> repos) {
        List<String> names = new ArrayList<>();
        repos.forEach(r -> names.add(text(r, "name")));
        return matchIgnoringCase(packageName, names)
                .flatMap(name -> repos.stream().filter(r -> name.equals(text(r, "name"))).findFirst());
    }

    static List<String> versions(JsonNode metadata) {
        Set<String> toolVersions = new LinkedHashSet<>();
        Set<String> changesets = new LinkedHashSet<>();
        Iterator<Map.Entry<String, JsonNode>> it = metadata.fields();
        while (it.hasNext()) {
            JsonNode revision = it.next().getValue();
            toolVersions.addAll(texts(revision.get("tools"), "version"));
            String changeset = text(revision, "changeset_revision");
            if (!changeset.isBlank()) {
                changesets.add(changeset.substring(0, Math.min(SHORT_CHANGESET, changeset.length())));
            }
        }
        return new ArrayList<>(toolVersions.isEmpty() ? changesets : toolVersions);
    }
}
