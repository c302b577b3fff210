package com.websubrelay.service;

import com.websubrelay.config.SubscriptionProperties;
import com.websubrelay.model.Subscription;
import com.websubrelay.model.SubscriptionStatus;
import com.websubrelay.repository.SubscriptionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps hub subscriptions alive.
 *
 * <p>{@link #subscribe(String)} is the only path to the hub: the admin
 * endpoint, the renewal sweep and new feeds all go through it, so status
 * bookkeeping is identical everywhere.
 */
@Service
public class SubscriptionManager {

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionManager.class);

    private static final int MAX_ERROR_LENGTH = 2000;

    private final RestTemplate restTemplate;
    private final SubscriptionRepository subscriptionRepository;
    private final SubscriptionProperties properties;
    private final Clock clock;

    private final AtomicBoolean sweepRunning = new AtomicBoolean(false);

    public SubscriptionManager(RestTemplate restTemplate,
                               SubscriptionRepository subscriptionRepository,
                               SubscriptionProperties properties,
                               Clock clock) {
        this.restTemplate = restTemplate;
        this.subscriptionRepository = subscriptionRepository;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Subscribes (or renews) the topic of {@code sourceId}. A failed handshake
     * is retried once per entry of the delay table; after that the row is
     * marked failed and left for the next sweep. Never throws for hub errors.
     */
    public SubscriptionResult subscribe(String sourceId) {
        String topic = properties.topicFor(sourceId);
        subscriptionRepository.insertPendingIfAbsent(sourceId, topic, clock.instant());

        List<Duration> retryDelays = properties.getRetryDelays();
        int maxAttempts = retryDelays.size() + 1;
        Integer lastStatus = null;
        String lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                ResponseEntity<String> response = restTemplate.postForEntity(
                        properties.getHubUrl(), subscribeRequest(topic), String.class);
                Instant now = clock.instant();
                Instant expiresAt = now.plus(properties.getLease());
                subscriptionRepository.upsertActive(sourceId, topic, expiresAt, now);
                logger.info("Hub subscription for {} accepted (status {}); lease until {}.",
                        sourceId, response.getStatusCode().value(), expiresAt);
                return SubscriptionResult.success(sourceId, response.getStatusCode().value(), expiresAt);
            } catch (RestClientResponseException e) {
                lastStatus = e.getStatusCode().value();
                lastError = "HTTP " + lastStatus + ": " + e.getResponseBodyAsString();
            } catch (RestClientException e) {
                lastStatus = null;
                lastError = e.getMessage();
            }

            if (attempt < maxAttempts) {
                Duration delay = retryDelays.get(attempt - 1);
                logger.warn("Hub subscription for {} failed ({}); retry {} of {} in {} ms.",
                        sourceId, lastError, attempt, retryDelays.size(), delay.toMillis());
                if (!pause(delay)) {
                    lastError = "interrupted before retry: " + lastError;
                    break;
                }
            }
        }

        String error = truncate(lastError);
        subscriptionRepository.upsertFailed(sourceId, topic, error, clock.instant());
        logger.error("Hub subscription for {} failed after retries: {}", sourceId, error);
        return SubscriptionResult.failure(sourceId, lastStatus, error);
    }

    /**
     * Refreshes derived statuses, then renews every subscription that expires
     * within the lookahead window, has no expiry, or is failed or pending.
     * Calls are serial and spaced out to respect the hub's rate limits.
     *
     * @return the number of successful renewals
     */
    public int renewDueSubscriptions() {
        if (!sweepRunning.compareAndSet(false, true)) {
            logger.info("Renewal sweep already running; skipping.");
            return 0;
        }
        try {
            Instant now = clock.instant();
            Instant cutoff = now.plus(properties.getRenewalLookahead());
            List<Subscription> subscriptions = subscriptionRepository.findAll(Sort.by("sourceId"));
            refreshStatuses(subscriptions, now, cutoff);

            List<Subscription> due = subscriptions.stream()
                    .filter(s -> isDueForRenewal(s, cutoff))
                    .toList();
            logger.info("Renewal sweep: {} of {} subscriptions due before {}.", due.size(), subscriptions.size(), cutoff);

            int renewed = 0;
            for (int i = 0; i < due.size(); i++) {
                if (i > 0 && !pause(properties.getRenewalInterCallDelay())) {
                    logger.warn("Renewal sweep interrupted after {} subscriptions.", i);
                    break;
                }
                if (subscribe(due.get(i).getSourceId()).ok()) {
                    renewed++;
                }
            }
            logger.info("Renewal sweep finished: {} renewed, {} failed.", renewed, due.size() - renewed);
            return renewed;
        } finally {
            sweepRunning.set(false);
        }
    }

    static boolean isDueForRenewal(Subscription subscription, Instant cutoff) {
        SubscriptionStatus status = subscription.getStatus();
        if (status == SubscriptionStatus.FAILED || status == SubscriptionStatus.PENDING) {
            return true;
        }
        Instant expiresAt = subscription.getExpiresAt();
        return expiresAt == null || !expiresAt.isAfter(cutoff);
    }

    private void refreshStatuses(List<Subscription> subscriptions, Instant now, Instant cutoff) {
        for (Subscription subscription : subscriptions) {
            SubscriptionStatus current = subscription.getStatus();
            Instant expiresAt = subscription.getExpiresAt();
            if (expiresAt == null
                    || (current != SubscriptionStatus.ACTIVE && current != SubscriptionStatus.EXPIRING)) {
                continue;
            }
            SubscriptionStatus derived = current;
            if (!expiresAt.isAfter(now)) {
                derived = SubscriptionStatus.EXPIRED;
            } else if (!expiresAt.isAfter(cutoff)) {
                derived = SubscriptionStatus.EXPIRING;
            }
            if (derived != current) {
                subscriptionRepository.updateStatusIfMatches(subscription.getSourceId(), current, derived, now);
                subscription.setStatus(derived);
            }
        }
    }

    private HttpEntity<MultiValueMap<String, String>> subscribeRequest(String topic) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("hub.mode", "subscribe");
        form.add("hub.topic", topic);
        form.add("hub.callback", properties.callbackUrl());
        form.add("hub.verify", "async");
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        return new HttpEntity<>(form, headers);
    }

    private boolean pause(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String truncate(String error) {
        if (error == null) {
            return "unknown error";
        }
        return error.length() > MAX_ERROR_LENGTH ? error.substring(0, MAX_ERROR_LENGTH) : error;
    }
}
