package com.csd.packagefinder.service;

import com.csd.packagefinder.model.PackageInfo;
import com.csd.packagefinder.model.RegistrySearchError;
import com.csd.packagefinder.model.SearchResult;
import com.csd.packagefinder.model.ThreadingSupport;
import com.csd.packagefinder.model.VersionGroup;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders search results as human readable text for the terminal.
 */
@Service
public class SearchResultFormatter {

    public String formatAll(Map<String, SearchResult> results) {
        StringBuilder sb = new StringBuilder();
        results.forEach((name, result) -> sb.append(format(name, result)));
        return sb.toString();
    }

    public String format(String name, SearchResult result) {
        StringBuilder sb = new StringBuilder();
        List<PackageInfo> infos = result.getInfos();
        if (!infos.isEmpty()) {
            sb.append(String.format("%nFound '%s' in %d %s:%n", name, infos.size(),
                    infos.size() == 1 ? "repository" : "repositories"));
            for (PackageInfo info : infos) {
                sb.append(formatPackage(info));
            }
        } else if (result.isNotFound()) {
            sb.append(String.format("%n❌ Package '%s' was not found in any repository.%n", name));
        } else {
            sb.append(String.format("%n⚠️ Package '%s' was not found, but %d %s could not be checked.%n", name,
                    result.getErrors().size(), result.getErrors().size() == 1 ? "registry" : "registries"));
        }
        if (result.isIncomplete()) {
            sb.append(formatErrors(result.getErrors()));
        }
        return sb.toString();
    }

    public String formatPackage(PackageInfo info) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%n✅ Package '%s' found in %s!%n", info.getName(), info.getRepository()));
        if (!info.getRegistryName().equals(info.getName())) {
            sb.append("Listed as: ").append(info.getRegistryName()).append('\n');
        }
        sb.append("URL: ").append(info.getUrl()).append('\n');
        sb.append("Description: ")
                .append(isBlank(info.getDescription()) ? "No description available" : info.getDescription())
                .append('\n');

        sb.append("Latest version: ").append(info.getLatestVersion()).append('\n');
        sb.append(String.format("Version counts: %d major.minor, %d total%n",
                info.getVersionGroups().size(), info.getVersions().size()));
        sb.append("All versions grouped by Major.Minor: ").append(formatVersionGroups(info.getVersionGroups())).append('\n');

        sb.append("License: ").append(info.getLicense()).append('\n');
        sb.append("Threading: ").append(info.getThreadingSupport().getLabel()).append('\n');
        if (info.getThreadingSupport() == ThreadingSupport.EXPLICIT && !info.getThreadFlags().isEmpty()) {
            sb.append("Thread flags: ").append(String.join(", ", info.getThreadFlags())).append('\n');
        }
        return sb.toString();
    }

    /**
     * A group holding only its own key prints bare ({@code 1.0}); anything else prints braced
     * ({@code {0.11.2, 0.11.3}}).
     */
    public static String formatVersionGroups(List<VersionGroup> groups) {
        return groups.stream()
                .map(g -> g.getVersions().size() == 1 && g.getVersions().get(0).equals(g.getKey())
                        ? g.getKey()
                        : "{" + String.join(", ", g.getVersions()) + "}")
                .collect(Collectors.joining(", "));
    }

    public String formatErrors(List<RegistrySearchError> errors) {
        StringBuilder sb = new StringBuilder("Registries that could not be checked:\n");
        for (RegistrySearchError error : errors) {
            sb.append("  - ").append(error.describe()).append('\n');
        }
        return sb.toString();
    }

    public String formatError(String message) {
        return "❌ " + message;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
