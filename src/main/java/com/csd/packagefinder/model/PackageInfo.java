package com.csd.packagefinder.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One package as found in one registry. Build through
 * {@link com.csd.packagefinder.registry.PackageInfoFactory} so versions are grouped
 * and the latest version is chosen consistently.
 */
@Value
@Builder
public class PackageInfo {
    String name;            // as queried by the caller
    String registryName;    // as the registry spells it
    RegistryId repository;
    String url;
    String description;
    List<String> versions;
    List<VersionGroup> versionGroups;
    String latestVersion;
    String license;
    ThreadingSupport threadingSupport;
    List<String> threadFlags;
}
