package com.flagship.credit_ledger.payment;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Verifies provider webhook signatures: hex HMAC-SHA256 of the raw request body
 * with the shared secret, optionally prefixed with "sha256=".
 *
 * The comparison is constant-time. With no secret configured every payload is
 * rejected.
 */
@Component
@Slf4j
public class WebhookSignatureVerifier {

    private static final String ALGORITHM = "HmacSHA256";
    private static final String PREFIX = "sha256=";

    private final String secret;

    public WebhookSignatureVerifier(@Value("${payment.webhook.secret:}") String secret) {
        this.secret = secret;
        if (secret == null || secret.isBlank()) {
            log.warn("payment.webhook.secret is not set; all provider webhooks will be rejected");
        }
    }

    public boolean verify(String rawPayload, String signatureHeader) {
        return rawPayload != null && verify(rawPayload.getBytes(StandardCharsets.UTF_8), signatureHeader);
    }

    public boolean verify(byte[] rawBody, String signatureHeader) {
        if (secret == null || secret.isBlank() || rawBody == null || signatureHeader == null) {
            return false;
        }

        String provided = signatureHeader.trim().toLowerCase(Locale.ROOT);
        if (provided.startsWith(PREFIX)) {
            provided = provided.substring(PREFIX.length());
        }

        byte[] expected = sign(rawBody).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, provided.getBytes(StandardCharsets.US_ASCII));
    }

    public String sign(String payload) {
        return sign(payload.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Hex signature of the body bytes with the configured secret.
     */
    public String sign(byte[] body) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(body));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }
}
