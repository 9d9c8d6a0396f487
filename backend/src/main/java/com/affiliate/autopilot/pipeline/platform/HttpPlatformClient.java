package com.affiliate.autopilot.pipeline.platform;

import com.affiliate.autopilot.config.AutopilotProperties;
import com.affiliate.autopilot.pipeline.http.PlatformHttpClient;
import com.affiliate.autopilot.pipeline.http.PlatformHttpResult;
import com.affiliate.autopilot.pipeline.model.CommunityNames;
import com.affiliate.autopilot.pipeline.model.EngagementStats;
import com.affiliate.autopilot.pipeline.model.PublishResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reddit-style JSON API: self posts through {@code /api/submit}, counters through
 * {@code /api/info}.
 */
@Service
public class HttpPlatformClient implements PlatformClient {
    private static final Logger log = LoggerFactory.getLogger(HttpPlatformClient.class);
    private static final String ACCEPT_JSON = "application/json";

    private final PlatformHttpClient httpClient;
    private final AutopilotProperties properties;
    private final ObjectMapper objectMapper;

    public HttpPlatformClient(PlatformHttpClient httpClient, AutopilotProperties properties, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public PublishResult createPost(String community, String title, String content) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("api_type", "json");
        form.put("kind", "self");
        form.put("sr", CommunityNames.normalize(community));
        form.put("title", title == null ? "" : title);
        form.put("text", content == null ? "" : content);

        PlatformHttpResult result = httpClient.postForm(url("/api/submit"), encodeForm(form), ACCEPT_JSON, authHeaders());
        if (!result.isSuccessful()) {
            return PublishResult.failure(result.failureCode(), describe(result));
        }
        try {
            JsonNode json = objectMapper.readTree(result.body()).path("json");
            JsonNode errors = json.path("errors");
            if (errors.isArray() && errors.size() > 0) {
                return PublishResult.failure("platform_rejected", errors.toString());
            }
            JsonNode data = json.path("data");
            String externalId = data.hasNonNull("name") ? data.get("name").asText() : data.path("id").asText(null);
            if (externalId == null || externalId.isBlank()) {
                return PublishResult.failure("invalid_response", "Submit response carried no post id");
            }
            return PublishResult.published(externalId);
        } catch (JsonProcessingException e) {
            return PublishResult.failure("invalid_response", e.getOriginalMessage());
        }
    }

    @Override
    public EngagementStats fetchEngagement(String externalId) {
        if (externalId == null || externalId.isBlank()) {
            return null;
        }
        String id = externalId.startsWith("t3_") ? externalId : "t3_" + externalId;
        PlatformHttpResult result = httpClient.get(
            url("/api/info?id=" + URLEncoder.encode(id, StandardCharsets.UTF_8)),
            ACCEPT_JSON,
            authHeaders()
        );
        if (!result.isSuccessful()) {
            throw new PlatformClientException(result.failureCode(), describe(result));
        }
        try {
            JsonNode children = objectMapper.readTree(result.body()).path("data").path("children");
            if (!children.isArray() || children.size() == 0) {
                log.debug("No engagement data for {}", id);
                return null;
            }
            JsonNode data = children.get(0).path("data");
            return new EngagementStats(
                data.path("ups").asInt(0),
                data.path("downs").asInt(0),
                data.path("num_comments").asInt(0)
            );
        } catch (JsonProcessingException e) {
            throw new PlatformClientException("invalid_response", e.getOriginalMessage());
        }
    }

    private Map<String, String> authHeaders() {
        String token = properties.getPlatform().getAccessToken();
        if (token == null || token.isBlank()) {
            return Map.of();
        }
        return Map.of("Authorization", "Bearer " + token.trim());
    }

    private String url(String path) {
        String base = properties.getPlatform().getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    private String describe(PlatformHttpResult result) {
        if (result.errorMessage() != null) {
            return result.errorMessage();
        }
        return "HTTP " + result.statusCode();
    }

    private static String encodeForm(Map<String, String> form) {
        return form.entrySet().stream()
            .map(entry -> URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8)
                + "=" + URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8))
            .collect(Collectors.joining("&"));
    }
}
