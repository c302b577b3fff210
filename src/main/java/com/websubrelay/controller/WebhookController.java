package com.websubrelay.controller;

import com.websubrelay.service.DeliverySummary;
import com.websubrelay.service.FeedParseException;
import com.websubrelay.service.WebhookIngestService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/webhook")
@Tag(name = "Webhook", description = "WebSub hub verification and content delivery callback")
public class WebhookController {

    private static final Logger logger = LoggerFactory.getLogger(WebhookController.class);

    private final WebhookIngestService ingestService;

    public WebhookController(WebhookIngestService ingestService) {
        this.ingestService = ingestService;
    }

    @Operation(
            summary = "Hub verification handshake",
            description = "Echoes hub.challenge verbatim so the hub can confirm the subscription."
    )
    @ApiResponse(responseCode = "200", description = "Challenge echoed, or empty body when none was sent")
    @GetMapping
    public ResponseEntity<String> verify(
            @Parameter(description = "Token to echo back") @RequestParam(name = "hub.challenge", required = false) String challenge,
            @RequestParam(name = "hub.mode", required = false) String mode,
            @RequestParam(name = "hub.topic", required = false) String topic,
            @RequestParam(name = "hub.lease_seconds", required = false) String leaseSeconds) {
        if (mode != null || topic != null) {
            logger.info("Hub verification: mode={}, topic={}, lease_seconds={}", mode, topic, leaseSeconds);
        }
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .body(challenge == null ? "" : challenge);
    }

    @Operation(
            summary = "Receive a content notification",
            description = "Accepts an Atom feed delivery from the hub and enqueues one job per announced item. " +
                    "Malformed feeds are acknowledged and dropped."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Delivery acknowledged"),
            @ApiResponse(responseCode = "400", description = "Missing body or non-text content type"),
            @ApiResponse(responseCode = "500", description = "Internal server error")
    })
    @PostMapping(consumes = MediaType.ALL_VALUE)
    public ResponseEntity<Void> receive(
            @RequestBody(required = false) String body,
            @RequestHeader(name = HttpHeaders.CONTENT_TYPE, required = false) String contentType) {
        if (body == null || body.isBlank()) {
            logger.warn("Rejected webhook delivery with empty body");
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).build();
        }
        if (!isTextual(contentType)) {
            logger.warn("Rejected webhook delivery with content type '{}'", contentType);
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).build();
        }

        try {
            DeliverySummary summary = ingestService.ingest(body);
            logger.info("Webhook delivery processed: {}", summary);
        } catch (FeedParseException e) {
            logger.warn("Dropping malformed webhook delivery: {}", e.getMessage());
        }
        return ResponseEntity.ok().build();
    }

    static boolean isTextual(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return false;
        }
        MediaType mediaType;
        try {
            mediaType = MediaType.parseMediaType(contentType);
        } catch (InvalidMediaTypeException e) {
            return false;
        }
        String subtype = mediaType.getSubtype();
        return "text".equals(mediaType.getType())
                || "xml".equals(subtype)
                || subtype.endsWith("+xml");
    }
}
