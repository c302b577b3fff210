package com.websubrelay.service;

import com.websubrelay.repository.JobLedgerRepository;
import com.websubrelay.repository.ProcessedItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Bounds storage: processed items and parked failed jobs are deleted once
 * they are older than their retention. Queued jobs idle for longer than any
 * retry backoff are treated as orphans and removed as well.
 */
@Service
public class RetentionService {

    private static final Logger logger = LoggerFactory.getLogger(RetentionService.class);

    private final ProcessedItemRepository itemRepository;
    private final JobLedgerRepository jobLedger;
    private final Duration itemRetention;
    private final Duration failedJobRetention;
    private final Duration staleQueuedAfter;
    private final Clock clock;

    public RetentionService(ProcessedItemRepository itemRepository,
                            JobLedgerRepository jobLedger,
                            @Value("${app.retention.items:P7D}") Duration itemRetention,
                            @Value("${app.retention.failed-jobs:P7D}") Duration failedJobRetention,
                            @Value("${app.retention.stale-queued-jobs:PT6H}") Duration staleQueuedAfter,
                            Clock clock) {
        this.itemRepository = itemRepository;
        this.jobLedger = jobLedger;
        this.itemRetention = itemRetention;
        this.failedJobRetention = failedJobRetention;
        this.staleQueuedAfter = staleQueuedAfter;
        this.clock = clock;
    }

    @Scheduled(cron = "${app.retention.cron:0 30 3 * * *}")
    public void scheduledPurge() {
        try {
            purge();
        } catch (Exception e) {
            logger.error("Retention sweep failed", e);
        }
    }

    public int purge() {
        Instant now = clock.instant();
        int items = itemRepository.deleteCreatedBefore(now.minus(itemRetention));
        int failedJobs = jobLedger.purgeFailedBefore(now.minus(failedJobRetention));
        int staleJobs = jobLedger.purgeStaleQueuedBefore(now.minus(staleQueuedAfter));
        if (staleJobs > 0) {
            logger.warn("Retention sweep removed {} queued jobs idle since before {}.", staleJobs, now.minus(staleQueuedAfter));
        }
        logger.info("Retention sweep removed {} items and {} failed jobs.", items, failedJobs);
        return items + failedJobs + staleJobs;
    }
}
