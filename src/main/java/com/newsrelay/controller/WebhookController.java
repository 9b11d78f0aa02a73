package com.newsrelay.controller;

import com.newsrelay.model.DeliveryReceipt;
import com.newsrelay.service.SubscriptionService;
import com.newsrelay.service.WebhookReceiver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * WebSub callback: the hub verifies subscriptions with GET and pushes new entries with POST.
 */
@RestController
@RequestMapping("/webhook")
@Slf4j
public class WebhookController {

    private final SubscriptionService subscriptionService;
    private final WebhookReceiver webhookReceiver;

    public WebhookController(SubscriptionService subscriptionService, WebhookReceiver webhookReceiver) {
        this.subscriptionService = subscriptionService;
        this.webhookReceiver = webhookReceiver;
    }

    @GetMapping
    public ResponseEntity<String> verify(@RequestParam(name = "hub.mode", required = false) String mode,
                                         @RequestParam(name = "hub.topic", required = false) String topic,
                                         @RequestParam(name = "hub.challenge", required = false) String challenge,
                                         @RequestParam(name = "hub.lease_seconds", required = false) Long leaseSeconds) {
        log.info("Verification request: mode={}, topic={}, lease={}", mode, topic, leaseSeconds);
        if (challenge == null || challenge.isBlank()) {
            return plainText(HttpStatus.BAD_REQUEST, "Missing hub.challenge");
        }
        return subscriptionService.verifyChallenge(mode, topic, challenge, leaseSeconds)
                .map(echo -> plainText(HttpStatus.OK, echo))
                .orElseGet(() -> plainText(HttpStatus.NOT_FOUND, "Unknown subscription"));
    }

    @PostMapping
    public ResponseEntity<String> receive(@RequestBody(required = false) byte[] body,
                                          @RequestHeader(name = "X-Hub-Signature", required = false) String signature,
                                          @RequestHeader(name = "Link", required = false) String link,
                                          @RequestHeader(name = "Content-Type", required = false) String contentType) {
        byte[] payload = body != null ? body : new byte[0];
        log.info("WebSub notification: {} bytes, type={}", payload.length, contentType);
        DeliveryReceipt receipt = webhookReceiver.receive(payload, signature, link);
        return plainText(HttpStatus.OK, receipt.summary());
    }

    private static ResponseEntity<String> plainText(HttpStatus status, String body) {
        return ResponseEntity.status(status).contentType(MediaType.TEXT_PLAIN).body(body);
    }
}
