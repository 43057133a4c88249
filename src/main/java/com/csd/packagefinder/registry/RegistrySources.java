package com.csd.packagefinder.registry;

import com.csd.packagefinder.exception.InvalidSearchRequestException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The built-in registries, in the order results are reported.
 */
public final class RegistrySources {

    private RegistrySources() {}

    public static List<RegistrySource> defaults(RegistryHttpClient http, String githubToken) {
        List<RegistrySource> sources = new ArrayList<>();
        sources.add(AnacondaChannelSource.bioconda(http));
        sources.add(AnacondaChannelSource.anaconda(http));
        sources.add(new PyPiSource(http));
        sources.add(new BioconductorSource(http));
        sources.add(AnacondaChannelSource.condaForge(http));
        sources.add(new CranSource(http));
        sources.add(new ROpenSciSource(http));
        sources.add(new PositSource(http));
        sources.add(new BioLibSource(http));
        sources.add(new GalaxyToolShedSource(http));
        sources.add(new DockerHubSource(http));
        sources.add(new GitHubContainerRegistrySource(http, githubToken));
        sources.add(new HomebrewSource(http));
        return List.copyOf(sources);
    }

    /**
     * Keeps the sources whose key is listed, preserving their order. An empty selection keeps all.
     */
    public static List<RegistrySource> select(List<RegistrySource> sources, Collection<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return sources;
        }
        Set<String> wanted = keys.stream()
                .map(k -> k.trim().toLowerCase(Locale.ROOT))
                .filter(k -> !k.isEmpty())
                .collect(Collectors.toSet());
        if (wanted.isEmpty()) {
            return sources;
        }
        Set<String> known = sources.stream().map(s -> s.id().getKey()).collect(Collectors.toSet());
        List<String> unknown = wanted.stream().filter(k -> !known.contains(k)).sorted().collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new InvalidSearchRequestException("Unknown registries: " + String.join(", ", unknown));
        }
        return sources.stream()
                .filter(s -> wanted.contains(s.id().getKey()))
                .collect(Collectors.toList());
    }
}
