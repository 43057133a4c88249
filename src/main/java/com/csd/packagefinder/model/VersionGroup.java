package com.csd.packagefinder.model;

import lombok.Value;

import java.util.List;

/**
 * Versions sharing the same major.minor key, ascending.
 */
@Value
public class VersionGroup {
    String key;
    List<String> versions;
}
