package com.websubrelay.service;

import com.websubrelay.model.EventJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Turns a hub delivery into queued jobs, one per announced item.
 */
@Service
public class WebhookIngestService {

    private static final Logger logger = LoggerFactory.getLogger(WebhookIngestService.class);

    private final FeedParser feedParser;
    private final EventQueue eventQueue;
    private final Clock clock;

    public WebhookIngestService(FeedParser feedParser, EventQueue eventQueue, Clock clock) {
        this.feedParser = feedParser;
        this.eventQueue = eventQueue;
        this.clock = clock;
    }

    /**
     * Parses the delivery and enqueues every entry that carries an item and a
     * source id. Enqueue failures are counted and logged, never thrown, so the
     * hub always receives its acknowledgement.
     *
     * @throws FeedParseException if the body is not a feed document
     */
    public DeliverySummary ingest(String body) throws FeedParseException {
        List<FeedEntry> entries = feedParser.parse(body);
        Instant receivedAt = clock.instant();

        int enqueued = 0;
        int duplicates = 0;
        int skipped = 0;
        int failed = 0;
        for (FeedEntry entry : entries) {
            if (!entry.hasIdentity()) {
                logger.debug("Skipping feed entry without item or source id: {}", entry);
                skipped++;
                continue;
            }
            EventJob job = new EventJob(
                    entry.itemId(),
                    entry.sourceId(),
                    entry.title() == null ? "" : entry.title(),
                    publishedAt(entry, receivedAt),
                    receivedAt);
            try {
                EnqueueResult result = eventQueue.enqueue(job);
                if (result == EnqueueResult.DUPLICATE) {
                    duplicates++;
                    logger.info("Item {} from {} already queued; ignoring duplicate delivery.", job.getItemId(), job.getSourceId());
                } else {
                    enqueued++;
                    logger.info("Enqueued item {} from {}.", job.getItemId(), job.getSourceId());
                }
            } catch (Exception e) {
                failed++;
                logger.error("Failed to enqueue item {} from {}: {}", job.getItemId(), job.getSourceId(), e.getMessage(), e);
            }
        }
        return new DeliverySummary(entries.size(), enqueued, duplicates, skipped, failed);
    }

    private Instant publishedAt(FeedEntry entry, Instant fallback) {
        Instant published = parseTimestamp(entry.published());
        if (published != null) {
            return published;
        }
        Instant updated = parseTimestamp(entry.updated());
        return updated != null ? updated : fallback;
    }

    private Instant parseTimestamp(String value) {
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            logger.debug("Ignoring unparsable feed timestamp '{}'", value);
            return null;
        }
    }
}
