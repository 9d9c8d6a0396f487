package com.affiliate.autopilot.pipeline.http;

import com.affiliate.autopilot.config.AutopilotProperties;
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
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Thin wrapper over {@link HttpClient} that never throws: transport failures come back as
 * results carrying an error code ({@code invalid_url}, {@code timeout}, {@code io_error},
 * {@code interrupted}).
 */
@Service
public class PlatformHttpClient {
    private final AutopilotProperties properties;
    private final HttpClient client;

    public PlatformHttpClient(
        AutopilotProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getPlatform().getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public PlatformHttpResult get(String url, String acceptHeader, Map<String, String> headers) {
        return send(url, "GET", acceptHeader, headers, null, null);
    }

    public PlatformHttpResult postForm(String url, String formBody, String acceptHeader, Map<String, String> headers) {
        return send(url, "POST", acceptHeader, headers, formBody == null ? "" : formBody, "application/x-www-form-urlencoded");
    }

    private PlatformHttpResult send(
        String url,
        String method,
        String acceptHeader,
        Map<String, String> headers,
        String body,
        String contentType
    ) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }
        String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getPlatform().getRequestTimeoutSeconds()))
            .header("User-Agent", properties.getPlatform().getUserAgent())
            .header("Accept", safeAccept)
            .header("Accept-Language", "en-US,en;q=0.8");
        if (headers != null) {
            headers.forEach((name, value) -> {
                if (value != null) {
                    builder.header(name, value);
                }
            });
        }
        HttpRequest request;
        if ("POST".equalsIgnoreCase(method)) {
            request = builder
                .header("Content-Type", contentType)
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();
        } else {
            request = builder.GET().build();
        }

        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            return new PlatformHttpResult(
                url,
                response.statusCode(),
                response.body(),
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        }
    }

    private PlatformHttpResult errorResult(String url, Instant startedAt, String code, String message) {
        return new PlatformHttpResult(
            url,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
