package com.websubrelay.controller;

import com.websubrelay.dto.RenewalSweepResponse;
import com.websubrelay.dto.SubscribeRequest;
import com.websubrelay.model.Subscription;
import com.websubrelay.repository.SubscriptionRepository;
import com.websubrelay.service.SubscriptionManager;
import com.websubrelay.service.SubscriptionResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/subscriptions")
@Tag(name = "Subscriptions", description = "Hub subscription status and manual renewal")
public class SubscriptionController {

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionController.class);

    private final SubscriptionManager subscriptionManager;
    private final SubscriptionRepository subscriptionRepository;

    public SubscriptionController(SubscriptionManager subscriptionManager,
                                  SubscriptionRepository subscriptionRepository) {
        this.subscriptionManager = subscriptionManager;
        this.subscriptionRepository = subscriptionRepository;
    }

    @Operation(summary = "List subscriptions", description = "Returns every subscription row ordered by source id.")
    @GetMapping
    public List<Subscription> list() {
        return subscriptionRepository.findAll(Sort.by("sourceId"));
    }

    @Operation(
            summary = "Subscribe a source",
            description = "Subscribes or renews the topic of one source immediately. " +
                    "Hub failures are reported in the body, not as an error status."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Attempt finished",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = SubscriptionResult.class))),
            @ApiResponse(responseCode = "400", description = "sourceId missing", content = @Content)
    })
    @PostMapping
    public ResponseEntity<SubscriptionResult> subscribe(@RequestBody SubscribeRequest request) {
        if (request == null || request.getSourceId() == null || request.getSourceId().isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        String sourceId = request.getSourceId().trim();
        logger.info("Manual subscribe requested for {}", sourceId);
        return ResponseEntity.ok(subscriptionManager.subscribe(sourceId));
    }

    @Operation(summary = "Run the renewal sweep now", description = "Renews every subscription that is due.")
    @PostMapping("/renewals")
    public RenewalSweepResponse renew() {
        return new RenewalSweepResponse(subscriptionManager.renewDueSubscriptions());
    }
}
