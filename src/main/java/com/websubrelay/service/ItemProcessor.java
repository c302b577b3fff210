package com.websubrelay.service;

import com.websubrelay.config.FilterProperties;
import com.websubrelay.model.DispatchTarget;
import com.websubrelay.model.EventJob;
import com.websubrelay.model.InterestedAccount;
import com.websubrelay.model.NotificationItem;
import com.websubrelay.model.VideoMetadata;
import com.websubrelay.repository.AccountDirectory;
import com.websubrelay.repository.ProcessedItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Runs one queued job through dedup, filters and dispatch.
 *
 * <p>Steps are ordered cheapest first so that no API quota is spent on items
 * a local check already rejects:
 * <ol>
 *   <li>processing guard in the cache; a held guard means a duplicate</li>
 *   <li>durable dedup against {@code items}</li>
 *   <li>title keyword denylist</li>
 *   <li>metadata lookup; an unknown video is filtered</li>
 *   <li>public visibility</li>
 *   <li>duration bounds, both exclusive</li>
 *   <li>optional HD quality</li>
 *   <li>idempotent insert, account lookup and dispatch in one transaction</li>
 * </ol>
 * The guard only narrows the window in which two workers handle the same
 * item. The unique insert in the last step decides which of them dispatches,
 * and a failed dispatch rolls that insert back so the retry starts clean.
 */
@Service
public class ItemProcessor {

    private static final Logger logger = LoggerFactory.getLogger(ItemProcessor.class);

    static final String GUARD_PREFIX = "proc:";

    private final CacheStore cacheStore;
    private final ProcessedItemRepository itemRepository;
    private final VideoMetadataResolver metadataResolver;
    private final AccountDirectory accountDirectory;
    private final NotificationDispatcher dispatcher;
    private final FilterProperties filterProperties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public ItemProcessor(CacheStore cacheStore,
                         ProcessedItemRepository itemRepository,
                         VideoMetadataResolver metadataResolver,
                         AccountDirectory accountDirectory,
                         NotificationDispatcher dispatcher,
                         FilterProperties filterProperties,
                         TransactionTemplate transactionTemplate,
                         Clock clock) {
        this.cacheStore = cacheStore;
        this.itemRepository = itemRepository;
        this.metadataResolver = metadataResolver;
        this.accountDirectory = accountDirectory;
        this.dispatcher = dispatcher;
        this.filterProperties = filterProperties;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    /**
     * @return the terminal outcome; skips are results, not exceptions
     * @throws AllTargetsFailedException if no target could be reached
     */
    public ProcessingResult process(EventJob job) {
        String itemId = job.getItemId();
        String guardKey = GUARD_PREFIX + itemId;
        String token = UUID.randomUUID().toString();

        if (!cacheStore.tryLock(guardKey, token, filterProperties.getGuardTtl())) {
            logger.info("Item {} is already being processed; skipping.", itemId);
            return ProcessingResult.duplicate("processing guard held");
        }
        try {
            ProcessingResult result = runFilters(job);
            if (result.outcome() == ProcessingResult.Outcome.FILTERED) {
                logger.info("Item {} filtered: {}", itemId, result.reason());
            }
            return result;
        } finally {
            cacheStore.unlock(guardKey, token);
        }
    }

    private ProcessingResult runFilters(EventJob job) {
        String itemId = job.getItemId();
        if (itemRepository.existsById(itemId)) {
            logger.info("Item {} already processed.", itemId);
            return ProcessingResult.duplicate("already processed");
        }

        String keyword = matchingKeyword(job.getTitle());
        if (keyword != null) {
            return ProcessingResult.filtered("title keyword '" + keyword + "'");
        }

        VideoMetadata metadata = metadataResolver.resolve(itemId, filterProperties.isRequireHd());
        if (metadata == null) {
            return ProcessingResult.filtered("metadata unavailable");
        }
        if (!metadata.publiclyVisible()) {
            return ProcessingResult.filtered("privacy status " + metadata.getPrivacyStatus());
        }

        long seconds = metadata.durationSeconds();
        if (!durationAccepted(seconds)) {
            return ProcessingResult.filtered("duration " + seconds + "s");
        }

        if (filterProperties.isRequireHd() && !metadata.meetsHdQuality()) {
            return ProcessingResult.filtered("quality (definition " + metadata.getDefinition()
                    + ", maxres " + metadata.isMaxresThumbnail() + ")");
        }

        return accept(job, metadata);
    }

    private ProcessingResult accept(EventJob job, VideoMetadata metadata) {
        return transactionTemplate.execute(status -> {
            int inserted = itemRepository.insertIfAbsent(
                    job.getItemId(),
                    job.getSourceId(),
                    job.getTitle(),
                    job.getPublishedAt(),
                    job.getReceivedAt(),
                    clock.instant());
            if (inserted == 0) {
                logger.info("Item {} was accepted by another worker.", job.getItemId());
                return ProcessingResult.duplicate("committed by another worker");
            }

            List<InterestedAccount> accounts = accountDirectory.accountsWatching(job.getSourceId());
            List<DispatchTarget> targets = new ArrayList<>();
            for (InterestedAccount account : accounts) {
                for (String target : account.targets()) {
                    targets.add(new DispatchTarget(account.displayName(), target));
                }
            }
            if (targets.isEmpty()) {
                logger.info("Item {} accepted; no accounts watch {}.", job.getItemId(), job.getSourceId());
                return ProcessingResult.acceptedWithoutRecipients();
            }

            String title = StringUtils.hasText(metadata.getTitle()) ? metadata.getTitle() : job.getTitle();
            DispatchReport report = dispatcher.dispatch(
                    new NotificationItem(job.getItemId(), job.getSourceId(), title), targets);
            logger.info("Item {} accepted and sent to {} of {} targets.",
                    job.getItemId(), report.delivered().size(), targets.size());
            return ProcessingResult.accepted(report);
        });
    }

    boolean durationAccepted(long seconds) {
        if (seconds <= filterProperties.getMinSeconds()) {
            return false;
        }
        Long maxSeconds = filterProperties.getMaxSeconds();
        return maxSeconds == null || seconds < maxSeconds;
    }

    private String matchingKeyword(String title) {
        String lowerTitle = title == null ? "" : title.toLowerCase(Locale.ROOT);
        for (String keyword : filterProperties.getKeywords()) {
            if (StringUtils.hasText(keyword) && lowerTitle.contains(keyword.toLowerCase(Locale.ROOT))) {
                return keyword;
            }
        }
        return null;
    }
}
