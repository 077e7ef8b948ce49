package com.catalog.reconciliation.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Blocking JSON GET client shared by the provider fetchers.
 * Every request carries {@code Accept: application/json}, a fixed User-Agent and the
 * configured timeout; non-2xx responses and unparsable bodies are failures.
 */
public class JsonHttpClient {
    private static final Logger log = LoggerFactory.getLogger(JsonHttpClient.class);

    static final String USER_AGENT = "catalog-reconciliation/1.0";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public JsonHttpClient(Duration timeout) {
        this(HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), new ObjectMapper(), timeout);
    }

    public JsonHttpClient(HttpClient httpClient, ObjectMapper objectMapper, Duration timeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    /**
     * GETs {@code url} and parses the body as JSON.
     *
     * @throws ProviderFetchException on transport errors, timeouts, non-2xx statuses or invalid JSON
     */
    public JsonNode getJson(String url) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .header("Accept", "application/json")
                .header("User-Agent", USER_AGENT)
                .GET()
                .build();

        log.debug("http.get url={}", url);
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ProviderFetchException(null, "Request failed for " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderFetchException(null, "Request interrupted for " + url, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new ProviderFetchException(null, "Request failed (" + status + ") for " + url);
        }

        try {
            return objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new ProviderFetchException(null, "Invalid JSON from " + url + ": " + e.getMessage(), e);
        }
    }
}
