package com.csd.packagefinder.service;

import com.csd.packagefinder.model.VersionGroup;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Groups raw version strings by major.minor and picks the latest one, using {@link VersionUtil#ORDER}.
 * Null and blank entries are dropped; everything else lands in exactly one group.
 */
public final class VersionGrouper {

    private VersionGrouper() {}

    public static Grouping group(Collection<String> rawVersions) {
        TreeSet<String> distinct = new TreeSet<>(VersionUtil.ORDER);
        for (String v : rawVersions) {
            if (v != null && !v.isBlank()) {
                distinct.add(v);
            }
        }

        Map<String, TreeSet<String>> byKey = new TreeMap<>(VersionUtil.ORDER);
        for (String v : distinct) {
            byKey.computeIfAbsent(VersionUtil.majorMinorKey(v), k -> new TreeSet<>(VersionUtil.ORDER)).add(v);
        }

        List<VersionGroup> groups = new ArrayList<>(byKey.size());
        byKey.forEach((key, members) -> groups.add(new VersionGroup(key, List.copyOf(members))));

        String latest = distinct.isEmpty() ? null : distinct.last();
        return new Grouping(List.copyOf(distinct), List.copyOf(groups), latest);
    }

    @Value
    public static class Grouping {
        List<String> versions;       // distinct, ascending
        List<VersionGroup> groups;   // ascending by key
        String latestVersion;        // null only when versions is empty

        public boolean isEmpty() {
            return versions.isEmpty();
        }
    }
}
