package com.websubrelay.service;

import com.websubrelay.repository.JobLedgerRepository;
import com.websubrelay.repository.ProcessedItemRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RetentionServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-08T03:30:00Z");

    @Mock
    private ProcessedItemRepository itemRepository;

    @Mock
    private JobLedgerRepository jobLedger;

    private RetentionService retentionService;

    @BeforeEach
    void setUp() {
        retentionService = new RetentionService(itemRepository, jobLedger, Duration.ofDays(7), Duration.ofDays(3),
                Duration.ofHours(6), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void purgesItemsAndFailedJobsOlderThanTheirRetention() {
        when(itemRepository.deleteCreatedBefore(Instant.parse("2024-05-01T03:30:00Z"))).thenReturn(4);
        when(jobLedger.purgeFailedBefore(Instant.parse("2024-05-05T03:30:00Z"))).thenReturn(1);

        assertThat(retentionService.purge()).isEqualTo(5);
    }

    @Test
    void purgesQueuedJobsIdleLongerThanTheStaleWindow() {
        when(jobLedger.purgeStaleQueuedBefore(Instant.parse("2024-05-07T21:30:00Z"))).thenReturn(2);

        assertThat(retentionService.purge()).isEqualTo(2);
        verify(jobLedger).purgeStaleQueuedBefore(Instant.parse("2024-05-07T21:30:00Z"));
    }

    @Test
    void scheduledPurgeSurvivesStoreErrors() {
        when(itemRepository.deleteCreatedBefore(any())).thenThrow(new IllegalStateException("db down"));

        retentionService.scheduledPurge();
    }
}
