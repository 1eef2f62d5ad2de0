package com.flagship.credit_ledger.payment;

import com.flagship.credit_ledger.exception.StorageUnavailableException;
import com.flagship.credit_ledger.observability.CorrelationContext;
import com.flagship.credit_ledger.observability.CreditMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

import java.nio.charset.StandardCharsets;

/**
 * Entry point for provider webhooks.
 *
 * Flow: verify signature, parse, Redis fast-path, settle in one transaction,
 * then remember the payment in Redis. Nothing is read or written before the
 * signature is verified.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentReconciler {

    private final WebhookSignatureVerifier signatureVerifier;
    private final PaymentNotificationParser parser;
    private final ProcessedPaymentCache processedPaymentCache;
    private final TopupSettlementService settlementService;
    private final CreditMetrics creditMetrics;

    public ReconciliationResult reconcile(String rawPayload, String signatureHeader) {
        return reconcile(rawPayload == null ? null : rawPayload.getBytes(StandardCharsets.UTF_8), signatureHeader);
    }

    /**
     * The signature is checked over the body exactly as received; it is decoded
     * as UTF-8 only after it verifies.
     *
     * @throws AuthenticationFailedException if the signature does not match
     * @throws IllegalArgumentException if the payload is malformed or names an unknown topup
     * @throws StorageUnavailableException if the database failed transiently
     */
    public ReconciliationResult reconcile(byte[] rawBody, String signatureHeader) {
        if (!signatureVerifier.verify(rawBody, signatureHeader)) {
            creditMetrics.recordWebhook("rejected");
            log.warn("Rejected payment webhook: invalid signature");
            throw new AuthenticationFailedException("Invalid webhook signature");
        }
        String rawPayload = new String(rawBody, StandardCharsets.UTF_8);

        PaymentNotification notification;
        try {
            notification = parser.parse(rawPayload);
        } catch (IllegalArgumentException e) {
            creditMetrics.recordWebhook("malformed");
            log.warn("Rejected payment webhook: {}", e.getMessage());
            throw e;
        }

        MDC.put(CorrelationContext.PAYMENT_ID_MDC_KEY, notification.getPaymentId());
        try {
            if (processedPaymentCache.isProcessed(notification.getPaymentId())) {
                creditMetrics.recordWebhook("duplicate");
                log.debug("Payment already processed; acknowledging");
                return new ReconciliationResult(ReconciliationOutcome.DUPLICATE,
                        notification.getPaymentId(), notification.getTopupId());
            }

            ReconciliationResult result = settlementService.settle(notification, rawPayload);

            if (result.getOutcome() != ReconciliationOutcome.IGNORED) {
                processedPaymentCache.markProcessed(notification.getPaymentId());
            }
            creditMetrics.recordWebhook(result.getOutcome().name());
            log.info("Payment webhook reconciled: status={}, topupId={}, outcome={}",
                    notification.getRawStatus(), notification.getTopupId(), result.getOutcome());
            return result;

        } catch (TransientDataAccessException | DataAccessResourceFailureException
                 | CannotCreateTransactionException e) {
            creditMetrics.recordWebhook("storage_unavailable");
            log.error("Storage unavailable while reconciling payment: {}", e.getMessage());
            throw new StorageUnavailableException("Storage unavailable while reconciling payment "
                    + notification.getPaymentId(), e);
        } finally {
            MDC.remove(CorrelationContext.PAYMENT_ID_MDC_KEY);
        }
    }
}
