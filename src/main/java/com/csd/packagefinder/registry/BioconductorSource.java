package com.csd.packagefinder.registry;

import com.csd.packagefinder.exception.RegistryException;
import com.csd.packagefinder.model.ErrorReason;
import com.csd.packagefinder.model.PackageInfo;
import com.csd.packagefinder.model.RegistryId;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bioconductor software packages, read from the DCF {@code VIEWS} index of the release and
 * devel channels. The release index is required; devel is best effort.
 */
@Slf4j
public class BioconductorSource extends AbstractRegistrySource {

    static final String DEFAULT_BASE = "https://bioconductor.org/packages";

    private final HttpUrl base;

    public BioconductorSource(RegistryHttpClient http) {
        this(http, DEFAULT_BASE);
    }

    public BioconductorSource(RegistryHttpClient http, String base) {
        super(RegistryId.BIOCONDUCTOR, http);
        this.base = baseUrl(base);
    }

    @Override
    protected List<PackageInfo> lookup(String packageName) throws RegistryException {
        Optional<String> releaseViews = http.getText(viewsUrl("release"));
        if (releaseViews.isEmpty()) {
            throw new RegistryException(ErrorReason.NETWORK_FAILURE, "release VIEWS index is missing");
        }
        Optional<Map<String, String>> release = findStanza(parseDcf(releaseViews.get()), packageName);

        Optional<Map<String, String>> devel = develStanza(packageName);

        Map<String, String> primary = release.or(() -> devel).orElse(null);
        if (primary == null) {
            return List.of();
        }

        List<String> versions = new ArrayList<>();
        release.ifPresent(s -> versions.add(s.get("Version")));
        devel.ifPresent(s -> versions.add(s.get("Version")));

        String registryName = primary.get("Package");
        String channel = release.isPresent() ? "release" : "devel";
        return listOf(draft(packageName)
                .registryName(registryName)
                .url(base.newBuilder()
                        .addPathSegment(channel).addPathSegment("bioc").addPathSegment("html")
                        .addPathSegment(registryName + ".html")
                        .build().toString())
                .description(primary.get("Title"))
                .readme(primary.get("Description"))
                .versions(versions)
                .license(primary.get("License"))
                .build());
    }

    private Optional<Map<String, String>> develStanza(String packageName) {
        try {
            return http.getText(viewsUrl("devel")).flatMap(text -> findStanza(parseDcf(text), packageName));
        } catch (RegistryException e) {
            log.warn("Bioconductor devel index unavailable ({}: {}), using release only", e.getReason(), e.getMessage());
            return Optional.empty();
        }
    }

    private HttpUrl viewsUrl(String channel) {
        return base.newBuilder().addPathSegment(channel).addPathSegment("bioc").addPathSegment("VIEWS").build();
    }

    private static Optional<Map<String, String>> findStanza(List<Map<String, String>> stanzas, String packageName) {
        for (Map<String, String> stanza : stanzas) {
            if (packageName.equals(stanza.get("Package"))) {
                return Optional.of(stanza);
            }
        }
        for (Map<String, String> stanza : stanzas) {
            String name = stanza.get("Package");
            if (name != null && name.equalsIgnoreCase(packageName)) {
                return Optional.of(stanza);
            }
        }
        return Optional.empty();
    }

    /**
     * Debian control format: "Field: value" lines, indented continuation lines,
     * records separated by blank lines.
     */
    static List<Map<String, String>> parseDcf(String text) {
        List<Map<String, String>> stanzas = new ArrayList<>();
        Map<String, String> current = new LinkedHashMap<>();
        String lastKey = null;
        for (String line : text.split("\\r?\\n")) {
            if (line.isBlank()) {
                if (!current.isEmpty()) {
                    stanzas.add(current);
                    current = new LinkedHashMap<>();
                }
                lastKey = null;
            } else if (Character.isWhitespace(line.charAt(0)) && lastKey != null) {
                current.merge(lastKey, line.trim(), (a, b) -> a + " " + b);
            } else {
                int colon = line.indexOf(':');
                if (colon <= 0) continue;
                lastKey = line.substring(0, colon).trim();
                current.put(lastKey, line.substring(colon + 1).trim());
            }
        }
        if (!current.isEmpty()) {
            stanzas.add(current);
        }
        return stanzas;
    }
}
