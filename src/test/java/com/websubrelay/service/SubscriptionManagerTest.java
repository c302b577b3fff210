package com.websubrelay.service;

import com.websubrelay.config.SubscriptionProperties;
import com.websubrelay.model.Subscription;
import com.websubrelay.model.SubscriptionStatus;
import com.websubrelay.repository.SubscriptionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;

@ExtendWith(MockitoExtension.class)
class SubscriptionManagerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final String HUB_URL = "https://hub.test/subscribe";
    private static final String TOPIC = "https://www.youtube.com/xml/feeds/videos.xml?channel_id=UCabc";

    @Mock
    private SubscriptionRepository subscriptionRepository;

    private MockRestServiceServer server;
    private SubscriptionManager manager;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();

        SubscriptionProperties properties = new SubscriptionProperties();
        properties.setHubUrl(HUB_URL);
        properties.setPublicUrl("https://relay.test/");
        properties.setRetryDelays(List.of(Duration.ZERO, Duration.ZERO, Duration.ZERO));
        properties.setRenewalInterCallDelay(Duration.ZERO);

        manager = new SubscriptionManager(restTemplate, subscriptionRepository, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void acceptedSubscribeMarksSubscriptionActiveForTheLease() {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("hub.mode", "subscribe");
        form.add("hub.topic", TOPIC);
        form.add("hub.callback", "https://relay.test/webhook");
        form.add("hub.verify", "async");
        server.expect(requestTo(HUB_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().formData(form))
                .andRespond(withStatus(HttpStatus.ACCEPTED));

        SubscriptionResult result = manager.subscribe("UCabc");

        server.verify();
        assertThat(result.ok()).isTrue();
        assertThat(result.status()).isEqualTo(202);
        assertThat(result.expiresAt()).isEqualTo(NOW.plus(Duration.ofDays(18)));
        verify(subscriptionRepository).insertPendingIfAbsent("UCabc", TOPIC, NOW);
        verify(subscriptionRepository).upsertActive("UCabc", TOPIC, NOW.plus(Duration.ofDays(18)), NOW);
    }

    @Test
    void failedHandshakeIsRetriedThenRecordedAsFailed() {
        server.expect(ExpectedCount.times(4), requestTo(HUB_URL))
                .andRespond(withServerError().body("hub down"));

        SubscriptionResult result = manager.subscribe("UCabc");

        server.verify();
        assertThat(result.ok()).isFalse();
        assertThat(result.status()).isEqualTo(500);
        assertThat(result.error()).isEqualTo("HTTP 500: hub down");
        verify(subscriptionRepository).upsertFailed("UCabc", TOPIC, "HTTP 500: hub down", NOW);
        verify(subscriptionRepository, never()).upsertActive(anyString(), anyString(), any(), any());
    }

    @Test
    void transientFailureRecoversWithinRetries() {
        server.expect(ExpectedCount.times(2), requestTo(HUB_URL))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));
        server.expect(requestTo(HUB_URL))
                .andRespond(withStatus(HttpStatus.NO_CONTENT));

        SubscriptionResult result = manager.subscribe("UCabc");

        server.verify();
        assertThat(result.ok()).isTrue();
        verify(subscriptionRepository, never()).upsertFailed(anyString(), anyString(), anyString(), any());
    }

    @Test
    void sweepRenewsOnlyWhatIsDue() {
        when(subscriptionRepository.findAll(any(Sort.class))).thenReturn(List.of(
                subscription("UC-a", SubscriptionStatus.ACTIVE, NOW.plus(Duration.ofHours(72))),
                subscription("UC-b", SubscriptionStatus.ACTIVE, NOW.plus(Duration.ofHours(10))),
                subscription("UC-c", SubscriptionStatus.FAILED, null),
                subscription("UC-d", SubscriptionStatus.ACTIVE, NOW.minus(Duration.ofHours(1)))));
        server.expect(ExpectedCount.times(3), requestTo(HUB_URL))
                .andRespond(withStatus(HttpStatus.ACCEPTED));

        int renewed = manager.renewDueSubscriptions();

        server.verify();
        assertThat(renewed).isEqualTo(3);
        verify(subscriptionRepository).updateStatusIfMatches("UC-b", SubscriptionStatus.ACTIVE, SubscriptionStatus.EXPIRING, NOW);
        verify(subscriptionRepository).updateStatusIfMatches("UC-d", SubscriptionStatus.ACTIVE, SubscriptionStatus.EXPIRED, NOW);
        verify(subscriptionRepository, never()).insertPendingIfAbsent(eq("UC-a"), anyString(), any());
        verify(subscriptionRepository).upsertActive(eq("UC-b"), anyString(), any(), eq(NOW));
        verify(subscriptionRepository).upsertActive(eq("UC-c"), anyString(), any(), eq(NOW));
        verify(subscriptionRepository).upsertActive(eq("UC-d"), anyString(), any(), eq(NOW));
    }

    @Test
    void renewalSelection() {
        Instant cutoff = NOW.plus(Duration.ofHours(48));

        assertThat(SubscriptionManager.isDueForRenewal(
                subscription("a", SubscriptionStatus.ACTIVE, NOW.plus(Duration.ofHours(72))), cutoff)).isFalse();
        assertThat(SubscriptionManager.isDueForRenewal(
                subscription("b", SubscriptionStatus.ACTIVE, NOW.plus(Duration.ofHours(10))), cutoff)).isTrue();
        assertThat(SubscriptionManager.isDueForRenewal(
                subscription("c", SubscriptionStatus.ACTIVE, cutoff), cutoff)).isTrue();
        assertThat(SubscriptionManager.isDueForRenewal(
                subscription("d", SubscriptionStatus.ACTIVE, null), cutoff)).isTrue();
        assertThat(SubscriptionManager.isDueForRenewal(
                subscription("e", SubscriptionStatus.PENDING, NOW.plus(Duration.ofDays(10))), cutoff)).isTrue();
    }

    private static Subscription subscription(String sourceId, SubscriptionStatus status, Instant expiresAt) {
        Subscription subscription = new Subscription();
        subscription.setSourceId(sourceId);
        subscription.setTopic("topic-" + sourceId);
        subscription.setStatus(status);
        subscription.setExpiresAt(expiresAt);
        return subscription;
    }
}
