package com.csd.packagefinder.registry;

import com.csd.packagefinder.exception.RegistryException;
import com.csd.packagefinder.model.ErrorReason;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Map;
import java.util.Optional;

/**
 * Shared HTTP access for registry adapters. Thread-safe.
 * <p>
 * 404 and 410 mean "absent" and come back as an empty Optional. Everything else that is not
 * a 2xx becomes a {@link RegistryException} with the matching {@link ErrorReason}.
 */
@Slf4j
public class RegistryHttpClient {

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final String userAgent;

    public RegistryHttpClient(OkHttpClient client, ObjectMapper mapper, String userAgent) {
        this.client = client;
        this.mapper = mapper;
        this.userAgent = userAgent;
    }

    public Optional<String> getText(HttpUrl url) throws RegistryException {
        return getText(url, Map.of());
    }

    public Optional<String> getText(HttpUrl url, Map<String, String> headers) throws RegistryException {
        Request.Builder builder = new Request.Builder()
                .url(url)
                .header("User-Agent", userAgent);
        headers.forEach(builder::header);
        Request request = builder.build();

        log.debug("GET {}", url);
        try (Response response = client.newCall(request).execute()) {
            int code = response.code();
            if (code == 404 || code == 410) {
                return Optional.empty();
            }
            if (code == 429 || (code == 403 && "0".equals(response.header("X-RateLimit-Remaining")))) {
                throw new RegistryException(ErrorReason.RATE_LIMITED, "HTTP " + code + " from " + url.host());
            }
            if (!response.isSuccessful()) {
                throw new RegistryException(ErrorReason.NETWORK_FAILURE, "HTTP " + code + " from " + url.host());
            }
            ResponseBody body = response.body();
            return Optional.of(body == null ? "" : body.string());
        } catch (InterruptedIOException e) {
            // SocketTimeoutException and OkHttp's call timeout both land here
            throw new RegistryException(ErrorReason.TIMEOUT, "Timed out calling " + url.host(), e);
        } catch (IOException e) {
            throw new RegistryException(ErrorReason.NETWORK_FAILURE, e.getClass().getSimpleName() + " calling " + url.host(), e);
        }
    }

    public Optional<JsonNode> getJson(HttpUrl url) throws RegistryException {
        return getJson(url, Map.of());
    }

    public Optional<JsonNode> getJson(HttpUrl url, Map<String, String> headers) throws RegistryException {
        Optional<String> body = getText(url, headers);
        if (body.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(readJson(body.get(), url));
    }

    JsonNode readJson(String body, HttpUrl source) throws RegistryException {
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RegistryException(ErrorReason.PARSE_FAILURE, "Malformed JSON from " + source.host(), e);
        }
    }
}
