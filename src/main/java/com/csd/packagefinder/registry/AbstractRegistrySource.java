package com.csd.packagefinder.registry;

import com.csd.packagefinder.exception.RegistryException;
import com.csd.packagefinder.model.ErrorReason;
import com.csd.packagefinder.model.PackageInfo;
import com.csd.packagefinder.model.RegistryId;
import com.csd.packagefinder.model.RegistryOutcome;
import com.csd.packagefinder.model.RegistrySearchError;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Base for registry adapters. Subclasses implement {@link #lookup} and may throw
 * {@link RegistryException}; {@link #find} turns every failure into an error outcome.
 */
@Slf4j
public abstract class AbstractRegistrySource implements RegistrySource {

    protected final RegistryHttpClient http;
    private final RegistryId id;

    protected AbstractRegistrySource(RegistryId id, RegistryHttpClient http) {
        this.id = id;
        this.http = http;
    }

    @Override
    public RegistryId id() {
        return id;
    }

    @Override
    public final RegistryOutcome find(String packageName) {
        try {
            List<PackageInfo> infos = lookup(packageName);
            if (infos.isEmpty()) {
                log.debug("{}: '{}' not found", id, packageName);
                return RegistryOutcome.notFound();
            }
            log.debug("{}: '{}' found ({} record(s))", id, packageName, infos.size());
            return RegistryOutcome.found(infos);
        } catch (RegistryException e) {
            log.warn("{}: lookup of '{}' failed with {}: {}", id, packageName, e.getReason(), e.getMessage());
            return RegistryOutcome.failed(error(packageName, e.getReason(), e.getMessage()));
        } catch (RuntimeException e) {
            log.warn("{}: could not read response for '{}'", id, packageName, e);
            return RegistryOutcome.failed(error(packageName, ErrorReason.PARSE_FAILURE, e.toString()));
        }
    }

    /**
     * Queries the registry. Returns an empty list when the package is not there.
     */
    protected abstract List<PackageInfo> lookup(String packageName) throws RegistryException;

    protected RegistrySearchError error(String packageName, ErrorReason reason, String detail) {
        return RegistrySearchError.builder()
                .repository(id)
                .packageName(packageName)
                .reason(reason)
                .detail(detail)
                .build();
    }

    /** A draft already carrying this registry and the queried name. */
    protected PackageInfoFactory.Draft draft(String packageName) {
        return PackageInfoFactory.draft().repository(id).name(packageName);
    }

    protected static List<PackageInfo> listOf(Optional<PackageInfo> info) {
        return info.map(List::of).orElse(List.of());
    }

    protected static HttpUrl baseUrl(String url) {
        HttpUrl parsed = HttpUrl.parse(url);
        if (parsed == null) {
            throw new IllegalArgumentException("Not an http(s) URL: " + url);
        }
        return parsed;
    }

    /**
     * Returns the registry's own spelling of {@code name} from {@code candidates}, ignoring case.
     */
    protected static Optional<String> matchIgnoringCase(String name, Collection<String> candidates) {
        String wanted = name.toLowerCase(Locale.ROOT);
        for (String candidate : candidates) {
            if (candidate != null && candidate.toLowerCase(Locale.ROOT).equals(wanted)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /** Text of a field, or "" when missing or null. */
    protected static String text(JsonNode node, String field) {
        if (node == null) return "";
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "" : value.asText();
    }

    protected static List<String> texts(JsonNode array, String field) {
        List<String> values = new ArrayList<>();
        if (array == null || !array.isArray()) return values;
        for (JsonNode item : array) {
            String value = text(item, field);
            if (!value.isBlank()) values.add(value);
        }
        return values;
    }

    protected static RegistryException unexpectedShape(String what) {
        return new RegistryException(ErrorReason.PARSE_FAILURE, "Unexpected response shape: " + what);
    }
}
