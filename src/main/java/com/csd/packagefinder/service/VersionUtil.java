package com.csd.packagefinder.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Total order over raw version strings from any ecosystem.
 * <p>
 * A version is read as an optional {@code v} marker, a numeric prefix of dot-separated
 * integers and a free-form suffix. Versions without a numeric prefix sort first, among
 * themselves lexicographically. Numeric prefixes compare component by component as
 * unbounded integers, a shorter prefix before a longer one it starts. Equal prefixes
 * compare by suffix, then the longer string wins, then plain string order.
 */
public final class VersionUtil {

    public static final Comparator<String> ORDER = VersionUtil::compare;

    private VersionUtil() {}

    public static int compare(String a, String b) {
        if (a == null && b == null) return 0;
        if (a == null) return -1;
        if (b == null) return 1;
        if (a.equals(b)) return 0;

        ParsedVersion pa = ParsedVersion.parse(a);
        ParsedVersion pb = ParsedVersion.parse(b);
        if (pa.isNumeric() != pb.isNumeric()) {
            return pa.isNumeric() ? 1 : -1;
        }
        if (!pa.isNumeric()) {
            return a.compareTo(b);
        }
        int c = compareComponents(pa.components, pb.components);
        if (c != 0) return c;
        c = pa.suffix.compareTo(pb.suffix);
        if (c != 0) return c;
        c = Integer.compare(a.length(), b.length());
        if (c != 0) return c;
        return a.compareTo(b);
    }

    public static boolean isBelow(String version, String other) {
        if (version == null || other == null) return false;
        return compare(version, other) < 0;
    }

    /** Greatest version, or null when there is none. */
    public static String latest(Collection<String> versions) {
        String best = null;
        for (String v : versions) {
            if (v == null || v.isBlank()) continue;
            if (best == null || compare(v, best) > 0) {
                best = v;
            }
        }
        return best;
    }

    /**
     * The major.minor key of a version as written ({@code "v1.2.3-rc1"} gives {@code "1.2"}),
     * or the whole string when it has fewer than two numeric components.
     */
    public static String majorMinorKey(String version) {
        ParsedVersion parsed = ParsedVersion.parse(version);
        if (parsed.rawComponents.size() < 2) {
            return version;
        }
        return parsed.rawComponents.get(0) + "." + parsed.rawComponents.get(1);
    }

    /** Numeric components with leading zeros stripped; empty when the version is not numeric. */
    static List<String> numericComponents(String version) {
        return ParsedVersion.parse(version).components;
    }

    private static int compareComponents(List<String> a, List<String> b) {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            String x = a.get(i);
            String y = b.get(i);
            // no leading zeros, so longer means larger
            int c = Integer.compare(x.length(), y.length());
            if (c == 0) c = x.compareTo(y);
            if (c != 0) return c;
        }
        return Integer.compare(a.size(), b.size());
    }

    private static final class ParsedVersion {
        final List<String> rawComponents;
        final List<String> components;
        final String suffix;

        private ParsedVersion(List<String> rawComponents, String suffix) {
            this.rawComponents = rawComponents;
            List<String> normalized = new ArrayList<>(rawComponents.size());
            for (String raw : rawComponents) {
                normalized.add(stripLeadingZeros(raw));
            }
            this.components = Collections.unmodifiableList(normalized);
            this.suffix = suffix;
        }

        boolean isNumeric() {
            return !components.isEmpty();
        }

        static ParsedVersion parse(String version) {
            Objects.requireNonNull(version, "version");
            int pos = 0;
            if (version.length() > 1 && (version.charAt(0) == 'v' || version.charAt(0) == 'V')
                    && Character.isDigit(version.charAt(1))) {
                pos = 1;
            }
            List<String> parts = new ArrayList<>();
            int len = version.length();
            while (pos < len && isAsciiDigit(version.charAt(pos))) {
                int start = pos;
                while (pos < len && isAsciiDigit(version.charAt(pos))) pos++;
                parts.add(version.substring(start, pos));
                // a dot only continues the prefix when a digit follows it
                if (pos + 1 < len && version.charAt(pos) == '.' && isAsciiDigit(version.charAt(pos + 1))) {
                    pos++;
                } else {
                    break;
                }
            }
            if (parts.isEmpty()) {
                return new ParsedVersion(List.of(), version);
            }
            return new ParsedVersion(List.copyOf(parts), version.substring(pos));
        }

        private static boolean isAsciiDigit(char c) {
            return c >= '0' && c <= '9';
        }

        private static String stripLeadingZeros(String digits) {
            int i = 0;
            while (i < digits.length() - 1 && digits.charAt(i) == '0') i++;
            return digits.substring(i);
        }
    }
}
