package com.websubrelay.controller;

import com.websubrelay.model.EventJob;
import com.websubrelay.service.EnqueueResult;
import com.websubrelay.service.EventQueue;
import com.websubrelay.service.FeedFixtures;
import com.websubrelay.service.FeedParser;
import com.websubrelay.service.WebhookIngestService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class WebhookControllerTest {

    @Mock
    private EventQueue eventQueue;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        WebhookIngestService ingestService = new WebhookIngestService(new FeedParser(), eventQueue, Clock.systemUTC());
        mockMvc = MockMvcBuilders.standaloneSetup(new WebhookController(ingestService)).build();
    }

    @Test
    void echoesHubChallenge() throws Exception {
        mockMvc.perform(get("/webhook")
                        .param("hub.mode", "subscribe")
                        .param("hub.topic", "https://www.youtube.com/xml/feeds/videos.xml?channel_id=UCabc")
                        .param("hub.challenge", "abc123")
                        .param("hub.lease_seconds", "432000"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
                .andExpect(content().string("abc123"));
    }

    @Test
    void verificationWithoutChallengeIsEmpty() throws Exception {
        mockMvc.perform(get("/webhook"))
                .andExpect(status().isOk())
                .andExpect(content().string(""));
    }

    @Test
    void validDeliveryEnqueuesEveryEntry() throws Exception {
        when(eventQueue.enqueue(any(EventJob.class))).thenReturn(EnqueueResult.ENQUEUED);

        mockMvc.perform(post("/webhook")
                        .contentType(MediaType.APPLICATION_ATOM_XML)
                        .content(FeedFixtures.load("two-entries.xml")))
                .andExpect(status().isOk());

        verify(eventQueue, times(2)).enqueue(any(EventJob.class));
    }

    @Test
    void malformedDeliveryIsAcknowledgedWithoutJobs() throws Exception {
        mockMvc.perform(post("/webhook")
                        .contentType(MediaType.TEXT_XML)
                        .content("<feed><entry><title>broken"))
                .andExpect(status().isOk());

        verifyNoInteractions(eventQueue);
    }

    @Test
    void missingBodyIsRejected() throws Exception {
        mockMvc.perform(post("/webhook").contentType(MediaType.APPLICATION_XML))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(eventQueue);
    }

    @Test
    void nonTextualContentTypeIsRejected() throws Exception {
        mockMvc.perform(post("/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entry\":{}}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(eventQueue);
    }

    @Test
    void textualContentTypes() {
        assertThat(WebhookController.isTextual("application/atom+xml; charset=UTF-8")).isTrue();
        assertThat(WebhookController.isTextual("text/plain")).isTrue();
        assertThat(WebhookController.isTextual("application/xml")).isTrue();
        assertThat(WebhookController.isTextual("application/octet-stream")).isFalse();
        assertThat(WebhookController.isTextual("not a type")).isFalse();
        assertThat(WebhookController.isTextual(null)).isFalse();
    }
}
