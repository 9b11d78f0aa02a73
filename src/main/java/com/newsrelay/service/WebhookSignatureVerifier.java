package com.newsrelay.service;

import com.newsrelay.exception.WebhookAuthenticationException;
import com.newsrelay.util.DigestUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks the hub's {@code X-Hub-Signature} header: an HMAC of the raw request
 * body keyed with the topic secret (or the shared secret).
 */
@Component
@Slf4j
public class WebhookSignatureVerifier {

    private static final Map<String, String> ALGORITHMS = Map.of(
            "sha1", "HmacSHA1",
            "sha256", "HmacSHA256",
            "sha384", "HmacSHA384",
            "sha512", "HmacSHA512");

    private static final Pattern SELF_LINK = Pattern.compile("<([^>]+)>\\s*;\\s*rel=\"?self\"?", Pattern.CASE_INSENSITIVE);

    private final SubscriptionService subscriptionService;

    @Value("${relay.websub.secret:}")
    private String sharedSecret;

    @Value("${relay.websub.allow-unsigned:false}")
    private boolean allowUnsigned;

    public WebhookSignatureVerifier(SubscriptionService subscriptionService) {
        this.subscriptionService = subscriptionService;
    }

    /**
     * @param linkHeader the delivery's {@code Link} header, used to find the topic; may be null
     * @throws WebhookAuthenticationException when the signature is missing, malformed or wrong
     */
    public void verify(byte[] body, String signatureHeader, String linkHeader) {
        List<String> candidates = candidateSecrets(linkHeader);

        if (signatureHeader == null || signatureHeader.isBlank()) {
            if (candidates.isEmpty() && allowUnsigned) {
                log.debug("Accepting unsigned delivery: no secrets configured");
                return;
            }
            throw new WebhookAuthenticationException("Missing X-Hub-Signature header");
        }
        if (candidates.isEmpty()) {
            throw new WebhookAuthenticationException("No secret available to check the delivery signature");
        }

        int separator = signatureHeader.indexOf('=');
        if (separator <= 0) {
            throw new WebhookAuthenticationException("Malformed X-Hub-Signature header");
        }
        String method = signatureHeader.substring(0, separator).trim().toLowerCase(Locale.ROOT);
        String algorithm = ALGORITHMS.get(method);
        if (algorithm == null) {
            throw new WebhookAuthenticationException("Unsupported signature method: " + method);
        }
        byte[] provided = signatureHeader.substring(separator + 1).trim().toLowerCase(Locale.ROOT)
                .getBytes(StandardCharsets.US_ASCII);

        for (String secret : candidates) {
            byte[] expected = hmacHex(algorithm, secret, body).getBytes(StandardCharsets.US_ASCII);
            if (MessageDigest.isEqual(expected, provided)) {
                return;
            }
        }
        log.warn("Rejected delivery with invalid {} signature ({} bytes)", method, body.length);
        throw new WebhookAuthenticationException("Signature verification failed");
    }

    private List<String> candidateSecrets(String linkHeader) {
        List<String> secrets = new ArrayList<>();
        Optional<String> topic = topicFromLink(linkHeader);
        topic.flatMap(subscriptionService::secretFor)
                .filter(secret -> !secret.isBlank())
                .ifPresent(secrets::add);
        if (secrets.isEmpty()) {
            secrets.addAll(subscriptionService.knownSecrets());
        }
        if (sharedSecret != null && !sharedSecret.isBlank()) {
            secrets.add(sharedSecret);
        }
        return secrets;
    }

    static Optional<String> topicFromLink(String linkHeader) {
        if (linkHeader == null) {
            return Optional.empty();
        }
        Matcher matcher = SELF_LINK.matcher(linkHeader);
        return matcher.find() ? Optional.of(matcher.group(1).trim()) : Optional.empty();
    }

    static String hmacHex(String algorithm, String secret, byte[] body) {
        try {
            Mac mac = Mac.getInstance(algorithm);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), algorithm));
            return DigestUtils.toHex(mac.doFinal(body));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC not available: " + algorithm, e);
        }
    }
}
