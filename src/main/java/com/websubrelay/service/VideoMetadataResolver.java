package com.websubrelay.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.RateLimiter;
import com.websubrelay.model.VideoMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;

/**
 * Looks up authoritative video attributes, cache first.
 *
 * <p>Minimal and extended field sets are cached under different keys because
 * the extended set costs more API quota.
 */
@Service
public class VideoMetadataResolver {

    private static final Logger logger = LoggerFactory.getLogger(VideoMetadataResolver.class);

    private static final String MINIMAL_PARTS = "contentDetails,status";
    private static final String EXTENDED_PARTS = "snippet,contentDetails,status";

    private final RestTemplate restTemplate;
    private final CacheStore cacheStore;
    private final ObjectMapper objectMapper;
    private final RateLimiter youtubeRateLimiter;
    private final String baseUrl;
    private final String apiKey;
    private final Duration cacheTtl;

    @SuppressWarnings("UnstableApiUsage")
    public VideoMetadataResolver(RestTemplate restTemplate,
                                 CacheStore cacheStore,
                                 ObjectMapper objectMapper,
                                 @Qualifier("youtubeRateLimiter") RateLimiter youtubeRateLimiter,
                                 @Value("${app.youtube.base-url:https://www.googleapis.com/youtube/v3}") String baseUrl,
                                 @Value("${app.youtube.api-key:}") String apiKey,
                                 @Value("${app.youtube.cache-ttl:PT1H}") Duration cacheTtl) {
        this.restTemplate = restTemplate;
        this.cacheStore = cacheStore;
        this.objectMapper = objectMapper;
        this.youtubeRateLimiter = youtubeRateLimiter;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.cacheTtl = cacheTtl;
    }

    /**
     * @param extended also request title, publish time and thumbnails
     * @return the metadata, or {@code null} when the video is unknown or the
     *         API could not be reached
     */
    public VideoMetadata resolve(String itemId, boolean extended) {
        String key = "video:" + itemId + ":" + extended;
        Optional<String> cached = cacheStore.get(key);
        if (cached.isPresent()) {
            try {
                VideoMetadata metadata = objectMapper.readValue(cached.get(), VideoMetadata.class);
                logger.debug("Metadata cache hit for {}", key);
                return metadata;
            } catch (JsonProcessingException e) {
                logger.debug("Ignoring unreadable cached metadata for {}: {}", key, e.getMessage());
            }
        }

        if (!StringUtils.hasText(apiKey)) {
            logger.warn("YouTube API key not configured; cannot fetch details for {}", itemId);
            return null;
        }

        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/videos")
                .queryParam("part", extended ? EXTENDED_PARTS : MINIMAL_PARTS)
                .queryParam("id", itemId)
                .queryParam("key", apiKey)
                .encode()
                .build()
                .toUri();

        JsonNode body;
        try {
            youtubeRateLimiter.acquire();
            ResponseEntity<JsonNode> response = restTemplate.getForEntity(uri, JsonNode.class);
            body = response.getBody();
        } catch (RestClientResponseException e) {
            logger.warn("YouTube videos.list failed for {} with status {}", itemId, e.getStatusCode().value());
            return null;
        } catch (RestClientException e) {
            logger.warn("YouTube videos.list failed for {}: {}", itemId, e.getMessage());
            return null;
        }

        JsonNode items = body == null ? null : body.path("items");
        if (items == null || !items.isArray() || items.isEmpty()) {
            logger.info("YouTube returned no video for {}", itemId);
            return null;
        }

        VideoMetadata metadata = toMetadata(items.get(0));
        try {
            cacheStore.put(key, objectMapper.writeValueAsString(metadata), cacheTtl);
        } catch (JsonProcessingException e) {
            logger.warn("Could not cache metadata for {}: {}", itemId, e.getMessage());
        }
        return metadata;
    }

    private VideoMetadata toMetadata(JsonNode video) {
        JsonNode snippet = video.path("snippet");
        JsonNode contentDetails = video.path("contentDetails");
        return new VideoMetadata(
                video.path("status").path("privacyStatus").asText(null),
                contentDetails.path("duration").asText(null),
                contentDetails.path("definition").asText(null),
                snippet.path("title").asText(null),
                snippet.path("publishedAt").asText(null),
                snippet.path("thumbnails").has("maxres"));
    }
}
