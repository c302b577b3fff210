package com.websubrelay.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.websubrelay.config.JobQueueProperties;
import com.websubrelay.model.EventJob;
import com.websubrelay.repository.JobLedgerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;

import java.time.Clock;
import java.time.Instant;

/**
 * Producer side of the event queue. A job is first registered in the ledger,
 * which rejects a second job for the same item id, and only then sent to SQS.
 */
@Service
public class EventQueue {

    private static final Logger logger = LoggerFactory.getLogger(EventQueue.class);

    private final SqsClient sqsClient;
    private final ObjectMapper objectMapper;
    private final JobLedgerRepository jobLedger;
    private final JobQueueProperties queueProperties;
    private final Clock clock;

    public EventQueue(SqsClient sqsClient,
                      ObjectMapper objectMapper,
                      JobLedgerRepository jobLedger,
                      JobQueueProperties queueProperties,
                      Clock clock) {
        this.sqsClient = sqsClient;
        this.objectMapper = objectMapper;
        this.jobLedger = jobLedger;
        this.queueProperties = queueProperties;
        this.clock = clock;
    }

    /**
     * Enqueues a job keyed by its item id.
     *
     * @return {@link EnqueueResult#DUPLICATE} when a job for the item already exists
     * @throws IllegalArgumentException if the job is missing required fields
     * @throws QueueException if the job could not be sent
     */
    public EnqueueResult enqueue(EventJob job) {
        job.validate();
        String body;
        try {
            body = objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new QueueException("Error serializing job for item " + job.getItemId(), e);
        }

        Instant registeredAt = clock.instant();
        if (!jobLedger.insertIfAbsent(job.getItemId(), job.getSourceId(), body, registeredAt)) {
            logger.debug("Job for item {} already exists; skipping enqueue.", job.getItemId());
            return EnqueueResult.DUPLICATE;
        }

        try {
            SendMessageRequest.Builder request = SendMessageRequest.builder()
                    .queueUrl(queueProperties.getUrl())
                    .messageBody(body);
            if (queueProperties.isFifo()) {
                request.messageGroupId(job.getSourceId())
                        .messageDeduplicationId(deduplicationId(job.getItemId(), registeredAt));
            }
            sqsClient.sendMessage(request.build());
        } catch (RuntimeException e) {
            // Without a message the ledger row would block every future delivery of this item.
            try {
                jobLedger.delete(job.getItemId());
            } catch (RuntimeException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new QueueException("Error sending job for item " + job.getItemId() + " to SQS queue", e);
        }
        logger.debug("Sent job for item {} to SQS queue.", job.getItemId());
        return EnqueueResult.ENQUEUED;
    }

    /**
     * FIFO dedup id for one ledger registration. A later registration of the
     * same item gets a new id, so SQS does not drop it inside its dedup window.
     */
    static String deduplicationId(String itemId, Instant registeredAt) {
        return itemId + ":" + registeredAt.toEpochMilli();
    }
}
