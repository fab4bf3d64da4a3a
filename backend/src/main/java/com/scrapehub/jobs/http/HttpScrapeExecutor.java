package com.scrapehub.jobs.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scrapehub.config.ScrapeHubProperties;
import com.scrapehub.jobs.model.ScrapeRequest;
import com.scrapehub.jobs.scrape.ExtractionException;
import com.scrapehub.jobs.scrape.FetchException;
import com.scrapehub.jobs.scrape.ScrapeExecutor;
import com.scrapehub.jobs.scrape.UpstreamException;
import com.scrapehub.jobs.scrape.UpstreamTooLargeException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutorService;

/**
 * Calls the remote scraper worker: POST {@code {href, selector, description}} as JSON with a
 * bearer token, and read the extracted JSON back.
 */
@Service
public class HttpScrapeExecutor implements ScrapeExecutor {
    private static final int MAX_ERROR_BODY_LENGTH = 500;

    private final ScrapeHubProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    public HttpScrapeExecutor(
        ScrapeHubProperties properties,
        ObjectMapper objectMapper,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getScraper().getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    @Override
    public JsonNode execute(ScrapeRequest request) {
        ScrapeHubProperties.Scraper scraper = properties.getScraper();
        URI uri = endpointUri(scraper.getApiUrl());

        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(scraper.getRequestTimeoutSeconds()))
            .header("User-Agent", scraper.getUserAgent())
            .header("Accept", "application/json")
            .header("Content-Type", "application/json");
        String token = scraper.getApiToken();
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token.trim());
        }
        HttpRequest httpRequest = builder
            .POST(HttpRequest.BodyPublishers.ofString(requestBody(request), StandardCharsets.UTF_8))
            .build();

        HttpResponse<String> response;
        try {
            response = client.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new FetchException("Scraper request timed out for " + request.href(), e);
        } catch (IOException e) {
            throw new FetchException("Scraper request failed for " + request.href() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("Scraper request interrupted for " + request.href(), e);
        }

        int status = response.statusCode();
        String body = response.body();
        if (status == 413) {
            throw new UpstreamTooLargeException(
                isBlank(body) ? "Scraped content is too large for the extraction model" : truncate(body)
            );
        }
        if (status < 200 || status >= 300) {
            throw new UpstreamException(
                "Scraper responded with HTTP " + status + (isBlank(body) ? "" : ": " + truncate(body))
            );
        }
        return parseResult(body);
    }

    /**
     * The worker answers with the model output, which is itself a JSON document encoded as a
     * JSON string; unwrap one level when that is the case.
     */
    JsonNode parseResult(String body) {
        if (isBlank(body)) {
            throw new ExtractionException("Scraper returned an empty body");
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ExtractionException("Scraper returned malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (!node.isTextual()) {
            return node;
        }
        try {
            return objectMapper.readTree(node.textValue());
        } catch (JsonProcessingException e) {
            throw new ExtractionException("Extracted content is not JSON: " + truncate(node.textValue()), e);
        }
    }

    private String requestBody(ScrapeRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("href", request.href());
        body.put("selector", request.selector());
        body.put("description", request.description());
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ExtractionException("Failed to encode scrape request", e);
        }
    }

    private URI endpointUri(String apiUrl) {
        if (isBlank(apiUrl)) {
            throw new FetchException("Scraper endpoint is not configured");
        }
        try {
            URI uri = new URI(apiUrl.trim());
            if (uri.getHost() == null) {
                throw new FetchException("Scraper endpoint is missing a host: " + apiUrl);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new FetchException("Scraper endpoint is malformed: " + apiUrl, e);
        }
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_BODY_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_BODY_LENGTH);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
