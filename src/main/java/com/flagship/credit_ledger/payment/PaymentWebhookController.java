package com.flagship.credit_ledger.payment;

import com.flagship.credit_ledger.payment.dto.WebhookResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receives payment provider notifications. The body is taken as raw bytes
 * because the signature covers the exact bytes sent.
 */
@RestController
@RequestMapping("/webhooks/payments")
@RequiredArgsConstructor
public class PaymentWebhookController {

    static final String SIGNATURE_HEADER = "X-Webhook-Signature";

    private final PaymentReconciler reconciler;

    @PostMapping
    public ResponseEntity<WebhookResponse> receive(
            @RequestBody byte[] rawBody,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature) {
        ReconciliationResult result = reconciler.reconcile(rawBody, signature);
        return ResponseEntity.ok(WebhookResponse.accepted(result.getOutcome()));
    }

    @ExceptionHandler(AuthenticationFailedException.class)
    public ResponseEntity<WebhookResponse> handleAuthenticationFailed(AuthenticationFailedException e) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
            .body(WebhookResponse.rejected(e.getMessage()));
    }
}
