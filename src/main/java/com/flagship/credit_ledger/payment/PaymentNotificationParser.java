package com.flagship.credit_ledger.payment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Parses provider webhook bodies.
 *
 * Two shapes are accepted: the provider envelope
 * {"event": "payment.succeeded", "object": {"id": ..., "status": ..., "metadata": {"topup_id": ...}}}
 * and a flat {"payment_id": ..., "status": ..., "metadata": {"topup_id": ...}}.
 */
@Component
@RequiredArgsConstructor
public class PaymentNotificationParser {

    private final ObjectMapper objectMapper;

    /**
     * @throws IllegalArgumentException if the payload is not JSON or misses a required field
     */
    public PaymentNotification parse(String rawPayload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(rawPayload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Webhook payload is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Webhook payload must be a JSON object");
        }

        JsonNode payment = root.hasNonNull("object") ? root.get("object") : root;

        String paymentId = text(payment, "id");
        if (paymentId == null) {
            paymentId = text(payment, "payment_id");
        }
        if (paymentId == null || paymentId.isBlank()) {
            throw new IllegalArgumentException("Webhook payload has no payment id");
        }

        String status = text(payment, "status");
        if (status == null) {
            throw new IllegalArgumentException("Webhook payload has no status for payment " + paymentId);
        }

        JsonNode metadata = payment.get("metadata");
        String topupId = metadata != null ? text(metadata, "topup_id") : null;
        if (topupId == null) {
            throw new IllegalArgumentException("Webhook payload has no metadata.topup_id for payment " + paymentId);
        }

        try {
            return new PaymentNotification(paymentId, ProviderPaymentStatus.fromProvider(status), status,
                    UUID.fromString(topupId));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid topup_id in webhook payload: " + topupId, e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }
}
