package com.flagship.credit_ledger.payment;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class PaymentNotificationParserTest {

    private final PaymentNotificationParser parser = new PaymentNotificationParser(new ObjectMapper());
    private final UUID topupId = UUID.randomUUID();

    @Test
    @DisplayName("Parses the provider envelope")
    void parsesEnvelope() {
        String payload = """
            {"type":"notification","event":"payment.succeeded",
             "object":{"id":"pay_123","status":"succeeded","metadata":{"topup_id":"%s"}}}
            """.formatted(topupId);

        PaymentNotification notification = parser.parse(payload);

        assertEquals("pay_123", notification.getPaymentId());
        assertEquals(ProviderPaymentStatus.SUCCEEDED, notification.getStatus());
        assertEquals(topupId, notification.getTopupId());
    }

    @Test
    @DisplayName("Parses the flat form")
    void parsesFlat() {
        String payload = """
            {"payment_id":"pay_9","status":"canceled","metadata":{"topup_id":"%s"}}
            """.formatted(topupId);

        PaymentNotification notification = parser.parse(payload);

        assertEquals("pay_9", notification.getPaymentId());
        assertEquals(ProviderPaymentStatus.CANCELED, notification.getStatus());
    }

    @Test
    @DisplayName("Unknown statuses are kept but not final")
    void unknownStatus() {
        String payload = """
            {"payment_id":"pay_9","status":"refund_pending","metadata":{"topup_id":"%s"}}
            """.formatted(topupId);

        PaymentNotification notification = parser.parse(payload);

        assertEquals(ProviderPaymentStatus.UNKNOWN, notification.getStatus());
        assertEquals("refund_pending", notification.getRawStatus());
        assertFalse(notification.getStatus().isFinal());
    }

    @Test
    @DisplayName("Malformed payloads are rejected")
    void rejectsMalformed() {
        assertThrows(IllegalArgumentException.class, () -> parser.parse("not json"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("[1,2]"));
        assertThrows(IllegalArgumentException.class,
                () -> parser.parse("{\"payment_id\":\"p\",\"status\":\"succeeded\"}"));
        assertThrows(IllegalArgumentException.class,
                () -> parser.parse("{\"status\":\"succeeded\",\"metadata\":{\"topup_id\":\"" + topupId + "\"}}"));
        assertThrows(IllegalArgumentException.class,
                () -> parser.parse("{\"payment_id\":\"p\",\"status\":\"succeeded\",\"metadata\":{\"topup_id\":\"x\"}}"));
    }
}
