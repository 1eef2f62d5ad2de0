package com.flagship.credit_ledger.payment;

import com.flagship.credit_ledger.ledger.CreditLedger;
import com.flagship.credit_ledger.ledger.LedgerResult;
import com.flagship.credit_ledger.notification.TopupFailedNotification;
import com.flagship.credit_ledger.notification.TopupPaidNotification;
import com.flagship.credit_ledger.notification.UserNotifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Applies one verified provider notification to the topup, the payment record
 * and the ledger in a single transaction.
 *
 * Lock order: payment record, then topup, then balance (inside the ledger).
 * The payment record lock serializes redeliveries of the same payment; the
 * processed_at check under that lock makes them no-ops.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TopupSettlementService {

    private final TopupRepository topupRepository;
    private final PaymentRecordRepository paymentRecordRepository;
    private final CreditLedger creditLedger;
    private final UserNotifier userNotifier;

    /**
     * @throws IllegalArgumentException if the topup is unknown or the payment belongs to another topup
     */
    @Transactional
    public ReconciliationResult settle(PaymentNotification notification, String rawPayload) {
        String paymentId = notification.getPaymentId();

        if (!topupRepository.existsById(notification.getTopupId())) {
            throw new IllegalArgumentException(
                    "Payment " + paymentId + " refers to unknown topup " + notification.getTopupId());
        }

        paymentRecordRepository.insertIfAbsent(paymentId, notification.getTopupId());
        PaymentRecordEntity record = paymentRecordRepository.findByPaymentIdForUpdate(paymentId)
                .orElseThrow(() -> new IllegalStateException("Payment record vanished: " + paymentId));

        if (record.isProcessed()) {
            log.debug("Payment {} already processed at {}", paymentId, record.getProcessedAt());
            return result(ReconciliationOutcome.DUPLICATE, notification);
        }
        if (!record.getTopupId().equals(notification.getTopupId())) {
            throw new IllegalArgumentException(String.format(
                    "Payment %s belongs to topup %s, notification names %s",
                    paymentId, record.getTopupId(), notification.getTopupId()));
        }

        TopupEntity topupEntity = topupRepository.findByIdForUpdate(notification.getTopupId())
                .orElseThrow(() -> new TopupNotFoundException(notification.getTopupId()));
        Topup topup = topupEntity.toDomain();

        switch (notification.getStatus()) {
            case SUCCEEDED -> {
                LedgerResult grant = creditLedger.grant(topup.getUserId(), topup.getCredits(), topup.getId());
                if (!topup.isPaid()) {
                    if (topup.getStatus() != TopupStatus.CREATED) {
                        log.warn("Capture confirmed for {} topup {}; marking it paid", topup.getStatus(), topup.getId());
                    }
                    topup = topup.markPaid();
                    topupEntity.updateFromDomain(topup);
                    topupRepository.save(topupEntity);
                }
                record.markProcessed(notification.getRawStatus(), rawPayload);
                paymentRecordRepository.save(record);

                userNotifier.notify(TopupPaidNotification.of(topup.getUserId(), topup.getId(),
                        topup.getRubAmount(), topup.getCredits(), grant.getAvailableAfter()));

                log.info("Topup {} paid: granted {} credits to user {} (duplicate grant: {})",
                        topup.getId(), topup.getCredits(), topup.getUserId(), grant.isDuplicate());
                return result(ReconciliationOutcome.GRANTED, notification);
            }
            case CANCELED -> {
                if (topup.getStatus() == TopupStatus.CREATED) {
                    topup = topup.markFailed();
                    topupEntity.updateFromDomain(topup);
                    topupRepository.save(topupEntity);
                    userNotifier.notify(TopupFailedNotification.of(topup.getUserId(), topup.getId(),
                            topup.getRubAmount(), "payment canceled"));
                    log.info("Topup {} failed: payment {} canceled", topup.getId(), paymentId);
                } else {
                    log.warn("Payment {} canceled but topup {} is already {}", paymentId, topup.getId(), topup.getStatus());
                }
                record.markProcessed(notification.getRawStatus(), rawPayload);
                paymentRecordRepository.save(record);
                return result(ReconciliationOutcome.CANCELED, notification);
            }
            default -> {
                record.recordStatus(notification.getRawStatus(), rawPayload);
                paymentRecordRepository.save(record);
                log.debug("Payment {} reported non-final status {}", paymentId, notification.getRawStatus());
                return result(ReconciliationOutcome.IGNORED, notification);
            }
        }
    }

    private static ReconciliationResult result(ReconciliationOutcome outcome, PaymentNotification notification) {
        return new ReconciliationResult(outcome, notification.getPaymentId(), notification.getTopupId());
    }
}
