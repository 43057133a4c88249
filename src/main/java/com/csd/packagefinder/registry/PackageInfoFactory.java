package com.csd.packagefinder.registry;

import com.csd.packagefinder.model.PackageInfo;
import com.csd.packagefinder.model.RegistryId;
import com.csd.packagefinder.service.ThreadingDetector;
import com.csd.packagefinder.service.VersionGrouper;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Normalizes what an adapter scraped into a {@link PackageInfo}: groups versions, picks the
 * latest, classifies threading support and fills in a license.
 * Refuses to build a record without versions; the adapter then reports "not found".
 */
@Slf4j
public final class PackageInfoFactory {

    public static final String UNKNOWN_LICENSE = "Unknown";

    private PackageInfoFactory() {}

    @Builder(builderMethodName = "draft", builderClassName = "Draft")
    static Optional<PackageInfo> create(RegistryId repository,
                                        String name,
                                        String registryName,
                                        String url,
                                        String description,
                                        String readme,
                                        Collection<String> versions,
                                        String license) {
        VersionGrouper.Grouping grouping = VersionGrouper.group(versions == null ? List.of() : versions);
        if (grouping.isEmpty()) {
            log.debug("{} lists '{}' without versions, treating it as absent", repository, name);
            return Optional.empty();
        }
        String desc = clean(description);
        ThreadingDetector.Assessment threading = ThreadingDetector.detect(desc, readme);

        return Optional.of(PackageInfo.builder()
                .name(name)
                .registryName(registryName == null || registryName.isBlank() ? name : registryName)
                .repository(repository)
                .url(clean(url))
                .description(desc)
                .versions(grouping.getVersions())
                .versionGroups(grouping.getGroups())
                .latestVersion(grouping.getLatestVersion())
                .license(normalizeLicense(license))
                .threadingSupport(threading.getSupport())
                .threadFlags(threading.getFlags())
                .build());
    }

    static String normalizeLicense(String license) {
        if (license == null) return UNKNOWN_LICENSE;
        String trimmed = license.trim();
        if (trimmed.isEmpty() || "none".equalsIgnoreCase(trimmed) || "null".equalsIgnoreCase(trimmed)
                || "NOASSERTION".equals(trimmed)) {
            return UNKNOWN_LICENSE;
        }
        return trimmed;
    }

    private static String clean(String s) {
        return s == null ? "" : s.trim();
    }
}
