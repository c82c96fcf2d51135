package com.example.feedpipeline.delivery;

import com.example.feedpipeline.exception.FeedConfigurationException;
import com.example.feedpipeline.model.DeliveryMethod;
import com.example.feedpipeline.model.DeliveryOutcome;
import com.example.feedpipeline.model.FeedDefinition;
import com.example.feedpipeline.model.FeedOwner;
import com.example.feedpipeline.model.GenerationRecord;
import com.example.feedpipeline.storage.StorageSink;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Webhook 通知：POST JSON 或 GET 查询参数，非 2xx 视为失败。
 */
@Slf4j
@Component
public class WebhookDeliveryHandler extends AbstractDeliveryHandler {

    static final Duration TIMEOUT = Duration.ofSeconds(30);
    private static final int RESPONSE_PREVIEW_LIMIT = 500;
    private static final Set<String> RESTRICTED_HEADERS = Set.of("content-length", "host", "connection",
            "expect", "upgrade");

    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(TIMEOUT)
            .build();

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final FeedLinks feedLinks;
    private final Clock clock;

    public WebhookDeliveryHandler(StorageSink storageSink, FeedLinks feedLinks, Clock clock) {
        super(storageSink);
        this.feedLinks = feedLinks;
        this.clock = clock;
    }

    @Override
    public DeliveryMethod method() {
        return DeliveryMethod.WEBHOOK;
    }

    @Override
    protected void checkConfig(FeedDefinition feed, DeliveryConfig config) {
        String webhookUrl = config.require("webhook_url", "webhook");
        URI uri;
        try {
            uri = URI.create(webhookUrl);
        } catch (IllegalArgumentException e) {
            throw new FeedConfigurationException("Invalid webhook_url: " + webhookUrl);
        }
        if (uri.getHost() == null
                || !("http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme()))) {
            throw new FeedConfigurationException("webhook_url must be an absolute http(s) URL: " + webhookUrl);
        }
        String method = config.getString("method", "POST").toUpperCase();
        if (!"POST".equals(method) && !"GET".equals(method)) {
            throw new FeedConfigurationException("Unsupported webhook method: " + method);
        }
        config.getStringMap("custom_headers");
    }

    @Override
    protected DeliveryOutcome doDeliver(FeedDefinition feed, GenerationRecord generation, DeliveryConfig config)
            throws Exception {
        checkConfig(feed, config);
        String webhookUrl = config.getString("webhook_url");
        String authToken = config.getString("auth_token");
        boolean includeFileUrl = config.getBoolean("include_file_url", true);
        String method = config.getString("method", "POST").toUpperCase();

        Map<String, Object> payload = payload(feed, generation, includeFileUrl);

        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder().timeout(TIMEOUT);
        if ("POST".equals(method)) {
            requestBuilder.uri(URI.create(webhookUrl))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofByteArray(objectMapper.writeValueAsBytes(payload)));
        } else {
            requestBuilder.uri(URI.create(withQuery(webhookUrl, flatten(payload)))).GET();
        }
        requestBuilder.header("User-Agent", "FeedPipeline/1.0");
        if (authToken != null) {
            requestBuilder.header("Authorization", "Bearer " + authToken);
        }
        config.getStringMap("custom_headers").forEach((name, value) -> {
            if (!RESTRICTED_HEADERS.contains(name.toLowerCase())) {
                requestBuilder.setHeader(name, value);
            }
        });

        HttpResponse<String> response = httpClient.send(requestBuilder.build(), HttpResponse.BodyHandlers.ofString());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("webhook_url", webhookUrl);
        details.put("status_code", response.statusCode());
        details.put("response", preview(response.body()));

        boolean success = response.statusCode() >= 200 && response.statusCode() < 300;
        log.info("Webhook {} {} for feed {} -> HTTP {}", method, webhookUrl, feed.getSlug(), response.statusCode());
        if (!success) {
            return DeliveryOutcome.builder()
                    .success(false)
                    .details(details)
                    .error("Webhook returned HTTP " + response.statusCode())
                    .build();
        }
        return DeliveryOutcome.success(details);
    }

    Map<String, Object> payload(FeedDefinition feed, GenerationRecord generation, boolean includeFileUrl) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("feed_id", String.valueOf(feed.getId()));
        payload.put("feed_name", feed.getName());
        payload.put("feed_type", feed.getFeedType().getCode());
        payload.put("generation_id", generation.getGenerationId());
        payload.put("status", "completed");
        payload.put("row_count", generation.getRowCount());
        payload.put("file_size", generation.getFileSize());
        LocalDateTime generatedAt = generation.getCompletedAt() != null
                ? generation.getCompletedAt() : LocalDateTime.now(clock);
        payload.put("generated_at", generatedAt.toString());

        FeedOwner owner = feed.getOwner();
        Map<String, Object> customer = new LinkedHashMap<>();
        customer.put("id", owner != null ? owner.getId() : null);
        customer.put("username", owner != null ? owner.getUsername() : null);
        customer.put("company", owner != null ? owner.getCompanyName() : null);
        payload.put("customer", customer);

        if (includeFileUrl) {
            payload.put("download_url", feedLinks.downloadUrl(generation.getGenerationId()));
        }
        return payload;
    }

    /**
     * GET 方式下把 customer 展开为 customer_id / customer_username / customer_company。
     */
    static Map<String, Object> flatten(Map<String, Object> payload) {
        Map<String, Object> flat = new LinkedHashMap<>();
        payload.forEach((key, value) -> {
            if (value instanceof Map) {
                ((Map<?, ?>) value).forEach((nestedKey, nestedValue) -> flat.put(key + "_" + nestedKey, nestedValue));
            } else {
                flat.put(key, value);
            }
        });
        return flat;
    }

    private static String withQuery(String url, Map<String, Object> params) {
        StringJoiner query = new StringJoiner("&");
        params.forEach((key, value) -> {
            if (value != null) {
                query.add(URLEncoder.encode(key, StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(value.toString(), StandardCharsets.UTF_8));
            }
        });
        if (query.length() == 0) {
            return url;
        }
        return url + (url.contains("?") ? "&" : "?") + query;
    }

    private static String preview(String body) {
        if (body == null || body.isEmpty()) {
            return null;
        }
        return body.length() > RESPONSE_PREVIEW_LIMIT ? body.substring(0, RESPONSE_PREVIEW_LIMIT) : body;
    }
}
