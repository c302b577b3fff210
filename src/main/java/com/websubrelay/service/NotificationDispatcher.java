package com.websubrelay.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.util.concurrent.RateLimiter;
import com.websubrelay.model.DispatchTarget;
import com.websubrelay.model.NotificationItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sends an accepted item to every target through the Telegram Bot API.
 *
 * <p>Targets are independent: one failing send does not stop the others. The
 * call only fails when no target received the message, so that a retry of the
 * job is worth its duplicate deliveries.
 */
@Service
public class NotificationDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final RestTemplate restTemplate;
    private final RateLimiter telegramRateLimiter;
    private final String baseUrl;
    private final String botToken;
    private final boolean disableLinkPreview;

    @SuppressWarnings("UnstableApiUsage")
    public NotificationDispatcher(RestTemplate restTemplate,
                                  @Qualifier("telegramRateLimiter") RateLimiter telegramRateLimiter,
                                  @Value("${app.telegram.base-url:https://api.telegram.org}") String baseUrl,
                                  @Value("${app.telegram.bot-token:}") String botToken,
                                  @Value("${app.telegram.disable-link-preview:false}") boolean disableLinkPreview) {
        this.restTemplate = restTemplate;
        this.telegramRateLimiter = telegramRateLimiter;
        this.baseUrl = baseUrl;
        this.botToken = botToken;
        this.disableLinkPreview = disableLinkPreview;
        if (!StringUtils.hasText(botToken)) {
            logger.warn("Telegram bot token not configured; every send will fail.");
        }
    }

    /**
     * @return delivered targets and per-target failures
     * @throws AllTargetsFailedException if there were targets and none of them was reached
     */
    public DispatchReport dispatch(NotificationItem item, List<DispatchTarget> targets) {
        if (targets == null || targets.isEmpty()) {
            return DispatchReport.empty();
        }

        List<String> delivered = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (DispatchTarget target : targets) {
            try {
                send(target.target(), formatText(item, target.accountName()));
                delivered.add(target.target());
            } catch (RestClientException | IllegalStateException e) {
                String error = describe(e);
                failures.put(target.target(), error);
                logger.error("Failed to send item {} to chat {}: {}", item.itemId(), target.target(), error);
            }
        }

        if (delivered.isEmpty()) {
            throw new AllTargetsFailedException(item.itemId(), failures);
        }
        if (!failures.isEmpty()) {
            logger.warn("Partial send failure for item {}: {} delivered, {} failed {}",
                    item.itemId(), delivered.size(), failures.size(), failures);
        }
        return new DispatchReport(delivered, failures);
    }

    static String formatText(NotificationItem item, String accountName) {
        return "[" + escapeHtml(accountName) + "] New video: <b>" + escapeHtml(item.title()) + "</b>\n" + item.link();
    }

    private void send(String chatId, String text) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("chat_id", chatId);
        payload.put("text", text);
        payload.put("parse_mode", "HTML");
        payload.put("disable_web_page_preview", disableLinkPreview);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        telegramRateLimiter.acquire();
        JsonNode response = restTemplate.postForObject(
                baseUrl + "/bot" + botToken + "/sendMessage",
                new HttpEntity<>(payload, headers),
                JsonNode.class);
        if (response != null && response.has("ok") && !response.path("ok").asBoolean()) {
            throw new IllegalStateException("Telegram rejected message: " + response.path("description").asText(""));
        }
    }

    private String describe(Exception e) {
        String description;
        if (e instanceof RestClientResponseException responseException) {
            description = "HTTP " + responseException.getStatusCode().value() + ": " + responseException.getResponseBodyAsString();
        } else {
            description = String.valueOf(e.getMessage());
        }
        // transport errors quote the request URL, which embeds the token
        return StringUtils.hasText(botToken) ? description.replace(botToken, "***") : description;
    }

    private static String escapeHtml(String s) {
        if (s == null) {
            return "";
        }
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
