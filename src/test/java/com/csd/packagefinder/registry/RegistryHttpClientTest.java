package com.csd.packagefinder.registry;

import com.csd.packagefinder.exception.RegistryException;
import com.csd.packagefinder.model.ErrorReason;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class RegistryHttpClientTest {

    private MockWebServer server;
    private RegistryHttpClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        OkHttpClient ok = new OkHttpClient.Builder()
                .callTimeout(Duration.ofMillis(500))
                .build();
        client = new RegistryHttpClient(ok, new ObjectMapper(), "package-finder-test");
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void returnsBodyAndSendsUserAgent() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"name\":\"samtools\"}"));

        Optional<JsonNode> json = client.getJson(server.url("/pkg"), Map.of("Accept", "application/json"));

        assertTrue(json.isPresent());
        assertEquals("samtools", json.get().get("name").asText());
        RecordedRequest request = server.takeRequest();
        assertEquals("package-finder-test", request.getHeader("User-Agent"));
        assertEquals("application/json", request.getHeader("Accept"));
    }

    @Test
    void notFoundIsEmpty() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(404));
        assertTrue(client.getText(server.url("/missing")).isEmpty());

        server.enqueue(new MockResponse().setResponseCode(410));
        assertTrue(client.getText(server.url("/gone")).isEmpty());
    }

    @Test
    void tooManyRequestsIsRateLimited() {
        server.enqueue(new MockResponse().setResponseCode(429));
        RegistryException e = assertThrows(RegistryException.class, () -> client.getText(server.url("/x")));
        assertEquals(ErrorReason.RATE_LIMITED, e.getReason());
    }

    @Test
    void exhaustedGitHubQuotaIsRateLimited() {
        server.enqueue(new MockResponse().setResponseCode(403).setHeader("X-RateLimit-Remaining", "0"));
        RegistryException e = assertThrows(RegistryException.class, () -> client.getText(server.url("/x")));
        assertEquals(ErrorReason.RATE_LIMITED, e.getReason());
    }

    @Test
    void otherErrorStatusIsNetworkFailure() {
        server.enqueue(new MockResponse().setResponseCode(403));
        assertEquals(ErrorReason.NETWORK_FAILURE,
                assertThrows(RegistryException.class, () -> client.getText(server.url("/x"))).getReason());

        server.enqueue(new MockResponse().setResponseCode(503));
        assertEquals(ErrorReason.NETWORK_FAILURE,
                assertThrows(RegistryException.class, () -> client.getText(server.url("/x"))).getReason());
    }

    @Test
    void slowServerIsTimeout() {
        server.enqueue(new MockResponse().setBody("late").setHeadersDelay(2, TimeUnit.SECONDS));
        RegistryException e = assertThrows(RegistryException.class, () -> client.getText(server.url("/slow")));
        assertEquals(ErrorReason.TIMEOUT, e.getReason());
    }

    @Test
    void malformedJsonIsParseFailure() {
        server.enqueue(new MockResponse().setBody("<html>not json"));
        RegistryException e = assertThrows(RegistryException.class, () -> client.getJson(server.url("/x")));
        assertEquals(ErrorReason.PARSE_FAILURE, e.getReason());
    }
}
