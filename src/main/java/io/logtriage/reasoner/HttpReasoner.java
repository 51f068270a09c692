package io.logtriage.reasoner;

import io.logtriage.util.Jsons;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Posts each request envelope to an HTTP endpoint, typically a gateway in front of a language
 * model, and parses the response body as JSON.
 */
public final class HttpReasoner implements Reasoner {
    private final HttpClient client;
    private final URI endpoint;
    private final Duration timeout;

    public HttpReasoner(String endpoint, long timeoutMs) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("http reasoner endpoint cannot be empty");
        }
        this.endpoint = URI.create(endpoint.trim());
        this.timeout = Duration.ofMillis(Math.max(1_000L, timeoutMs));
        this.client = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public ReasonerResult reason(ReasonerRequest request) {
        HttpRequest httpRequest = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(
                        Jsons.toCompactJson(request.toEnvelope()), StandardCharsets.UTF_8))
                .build();
        try {
            HttpResponse<String> response = client.send(httpRequest, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                return ReasonerResult.fail("reasoner endpoint returned status " + response.statusCode());
            }
            return ReasonerResponses.parse(response.body());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ReasonerResult.fail("reasoner request interrupted");
        } catch (IOException e) {
            return ReasonerResult.fail("reasoner request failed: " + e.getMessage());
        }
    }
}
