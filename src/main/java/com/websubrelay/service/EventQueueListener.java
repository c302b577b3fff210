package com.websubrelay.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.websubrelay.config.JobQueueProperties;
import com.websubrelay.model.EventJob;
import com.websubrelay.model.JobRecord;
import com.websubrelay.model.JobStatus;
import com.websubrelay.repository.JobLedgerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.ChangeMessageVisibilityRequest;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;

/**
 * Consumer side of the event queue.
 *
 * <p>Each received message is claimed in the job ledger before its handler
 * runs. While the handler runs, a heartbeat extends both the ledger lock and
 * the message visibility. A message that comes back while its job is still
 * marked active with an expired lock belongs to a worker that died: that
 * counts as a stall, and too many stalls fail the job.
 */
@Service
public class EventQueueListener {

    private static final Logger logger = LoggerFactory.getLogger(EventQueueListener.class);

    private static final int MAX_ERROR_LENGTH = 2000;

    private final SqsClient sqsClient;
    private final ObjectMapper objectMapper;
    private final ItemProcessor itemProcessor;
    private final JobLedgerRepository jobLedger;
    private final JobQueueProperties queueProperties;
    private final TaskExecutor taskExecutor;
    private final TaskScheduler heartbeatScheduler;
    private final Clock clock;

    public EventQueueListener(SqsClient sqsClient,
                              ObjectMapper objectMapper,
                              ItemProcessor itemProcessor,
                              JobLedgerRepository jobLedger,
                              JobQueueProperties queueProperties,
                              @Qualifier("eventJobExecutor") TaskExecutor taskExecutor,
                              @Qualifier("queueHeartbeatScheduler") TaskScheduler heartbeatScheduler,
                              Clock clock) {
        this.sqsClient = sqsClient;
        this.objectMapper = objectMapper;
        this.itemProcessor = itemProcessor;
        this.jobLedger = jobLedger;
        this.queueProperties = queueProperties;
        this.taskExecutor = taskExecutor;
        this.heartbeatScheduler = heartbeatScheduler;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.queue.poll-delay-ms:1000}")
    public void pollQueue() {
        if (!queueProperties.isListenerEnabled()) {
            return;
        }
        try {
            int freeWorkers = freeWorkerSlots();
            if (freeWorkers <= 0) {
                logger.debug("All workers busy; skipping this poll.");
                return;
            }

            int batch = Math.max(1, Math.min(freeWorkers, 10));
            ReceiveMessageRequest receiveMessageRequest = ReceiveMessageRequest.builder()
                    .queueUrl(queueProperties.getUrl())
                    .maxNumberOfMessages(batch)
                    .waitTimeSeconds(queueProperties.getWaitTimeSeconds())
                    .visibilityTimeout(queueProperties.lockSeconds())
                    .build();

            List<Message> messages = sqsClient.receiveMessage(receiveMessageRequest).messages();
            logger.debug("Polled SQS and received {} messages (batch size {}).", messages.size(), batch);

            for (Message message : messages) {
                try {
                    taskExecutor.execute(() -> processMessage(message));
                } catch (TaskRejectedException tre) {
                    // Not claimed yet: the message becomes visible again after the lock window.
                    logger.warn("Workers saturated; leaving message {} for redelivery.", message.messageId());
                }
            }
        } catch (Exception e) {
            logger.error("Error polling SQS queue", e);
        }
    }

    private int freeWorkerSlots() {
        if (taskExecutor instanceof ThreadPoolTaskExecutor ex) {
            return ex.getMaxPoolSize() - ex.getActiveCount();
        }
        return queueProperties.getConcurrency();
    }

    void processMessage(Message message) {
        EventJob job;
        try {
            job = objectMapper.readValue(message.body(), EventJob.class).validate();
        } catch (Exception e) {
            logger.error("Discarding malformed job message {}: {}", message.messageId(), e.getMessage());
            deleteMessage(message);
            return;
        }

        String itemId = job.getItemId();
        String token = UUID.randomUUID().toString();
        Instant now = clock.instant();
        Optional<JobRecord> claimed = jobLedger.claim(itemId, token, now, now.plus(queueProperties.getLockDuration()));
        if (claimed.isEmpty()) {
            handleUnclaimed(itemId, message);
            return;
        }

        JobRecord record = claimed.get();
        if (record.stallCount() > queueProperties.getMaxStalledCount()) {
            String reason = "job stalled " + record.stallCount() + " times";
            jobLedger.markFailed(itemId, reason, now);
            deleteMessage(message);
            logger.error("Job {} failed permanently: {}.", itemId, reason);
            return;
        }
        if (record.stallCount() > 0) {
            logger.warn("Recovered stalled job {} (stall {} of {}).", itemId, record.stallCount(), queueProperties.getMaxStalledCount());
        }

        LockHeartbeat heartbeat = startHeartbeat(itemId, token, message);
        ProcessingResult result = null;
        Exception failure = null;
        try {
            result = itemProcessor.process(job);
        } catch (Exception e) {
            failure = e;
        } finally {
            heartbeat.stop();
        }

        if (failure != null) {
            handleFailure(itemId, token, message, failure);
            return;
        }
        if (!jobLedger.complete(itemId, token)) {
            logger.warn("Lock for job {} was lost before completion.", itemId);
        }
        deleteMessage(message);
        logger.info("Job {} finished: {}", itemId, result);
    }

    private void handleUnclaimed(String itemId, Message message) {
        Optional<JobRecord> current = jobLedger.find(itemId);
        if (current.isEmpty()) {
            logger.debug("No pending job for item {}; deleting stale message {}.", itemId, message.messageId());
            deleteMessage(message);
        } else if (current.get().status() == JobStatus.FAILED) {
            logger.debug("Job {} already failed; deleting message {}.", itemId, message.messageId());
            deleteMessage(message);
        } else {
            logger.debug("Job {} is locked by another worker until {}; leaving message {}.",
                    itemId, current.get().lockedUntil(), message.messageId());
        }
    }

    private void handleFailure(String itemId, String token, Message message, Exception failure) {
        Instant now = clock.instant();
        String error = describe(failure);
        int attempts = jobLedger.recordFailure(itemId, token, error, now);
        if (attempts < 0) {
            logger.warn("Lock for job {} was lost before its failure could be recorded: {}", itemId, error);
            return;
        }
        if (attempts >= queueProperties.getMaxAttempts()) {
            jobLedger.markFailed(itemId, error, now);
            deleteMessage(message);
            logger.error("Job {} failed permanently after {} attempts.", itemId, attempts, failure);
            return;
        }
        Duration delay = queueProperties.backoff(attempts);
        changeVisibility(message, delay);
        logger.warn("Job {} failed (attempt {} of {}); retrying in {} ms: {}",
                itemId, attempts, queueProperties.getMaxAttempts(), delay.toMillis(), error);
    }

    private LockHeartbeat startHeartbeat(String itemId, String token, Message message) {
        Duration interval = queueProperties.getLockDuration().dividedBy(2);
        LockHeartbeat heartbeat = new LockHeartbeat(itemId, token, message);
        heartbeat.start(clock.instant().plus(interval), interval);
        return heartbeat;
    }

    private void renewLock(String itemId, String token, Message message) {
        try {
            Instant now = clock.instant();
            if (jobLedger.renewLock(itemId, token, now.plus(queueProperties.getLockDuration()), now)) {
                changeVisibility(message, queueProperties.getLockDuration());
            }
        } catch (Exception e) {
            logger.warn("Failed to renew lock for job {}: {}", itemId, e.getMessage());
        }
    }

    /**
     * Periodic lock renewal for one claimed job. {@link #stop()} waits for a
     * renewal in progress, and no renewal runs after it returns, so the
     * visibility set when the job finishes is never overwritten.
     */
    private final class LockHeartbeat implements Runnable {

        private final String itemId;
        private final String token;
        private final Message message;
        private ScheduledFuture<?> future;
        private boolean stopped;

        LockHeartbeat(String itemId, String token, Message message) {
            this.itemId = itemId;
            this.token = token;
            this.message = message;
        }

        synchronized void start(Instant firstRun, Duration interval) {
            future = heartbeatScheduler.scheduleAtFixedRate(this, firstRun, interval);
        }

        @Override
        public synchronized void run() {
            if (!stopped) {
                renewLock(itemId, token, message);
            }
        }

        synchronized void stop() {
            stopped = true;
            if (future != null) {
                future.cancel(false);
            }
        }
    }

    private void changeVisibility(Message message, Duration visibility) {
        try {
            sqsClient.changeMessageVisibility(ChangeMessageVisibilityRequest.builder()
                    .queueUrl(queueProperties.getUrl())
                    .receiptHandle(message.receiptHandle())
                    .visibilityTimeout((int) Math.max(0, visibility.toSeconds()))
                    .build());
        } catch (Exception e) {
            logger.error("Failed to change visibility for message {}: {}", message.messageId(), e.getMessage(), e);
        }
    }

    private void deleteMessage(Message message) {
        try {
            DeleteMessageRequest deleteMessageRequest = DeleteMessageRequest.builder()
                    .queueUrl(queueProperties.getUrl())
                    .receiptHandle(message.receiptHandle())
                    .build();
            sqsClient.deleteMessage(deleteMessageRequest);
            logger.debug("Successfully deleted message {} from the queue.", message.messageId());
        } catch (Exception e) {
            logger.error("Failed to delete message {} from SQS queue: {}", message.messageId(), e.getMessage(), e);
        }
    }

    private static String describe(Throwable e) {
        String msg = e.getClass().getSimpleName() + ": " + (e.getMessage() == null ? "" : e.getMessage());
        return msg.length() > MAX_ERROR_LENGTH ? msg.substring(0, MAX_ERROR_LENGTH) : msg;
    }
}
