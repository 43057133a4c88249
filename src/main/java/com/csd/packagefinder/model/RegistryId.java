package com.csd.packagefinder.model;

import lombok.Value;

/**
 * Identifies the registry a record or error came from.
 * Built-in registries have constants here; custom sources can mint their own with {@link #of}.
 */
@Value
public class RegistryId {

    public static final RegistryId BIOCONDA = new RegistryId("bioconda", "Bioconda");
    public static final RegistryId ANACONDA = new RegistryId("anaconda", "Anaconda");
    public static final RegistryId PYPI = new RegistryId("pypi", "PyPI");
    public static final RegistryId BIOCONDUCTOR = new RegistryId("bioconductor", "Bioconductor");
    public static final RegistryId CONDA_FORGE = new RegistryId("conda-forge", "Conda-forge");
    public static final RegistryId CRAN = new RegistryId("cran", "CRAN");
    public static final RegistryId ROPENSCI = new RegistryId("ropensci", "rOpenSci");
    public static final RegistryId POSIT = new RegistryId("posit", "Posit Package Manager");
    public static final RegistryId BIOLIB = new RegistryId("biolib", "BioLib");
    public static final RegistryId GALAXY_TOOL_SHED = new RegistryId("galaxy-toolshed", "Galaxy Tool Shed");
    public static final RegistryId DOCKER_HUB = new RegistryId("dockerhub", "Docker Hub");
    public static final RegistryId GITHUB_CONTAINER_REGISTRY = new RegistryId("ghcr", "GitHub Container Registry");
    public static final RegistryId HOMEBREW = new RegistryId("homebrew", "Homebrew");

    String key;
    String displayName;

    public static RegistryId of(String key, String displayName) {
        return new RegistryId(key, displayName);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
