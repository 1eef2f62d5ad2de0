package com.flagship.credit_ledger.payment;

import java.util.UUID;

public class TopupNotFoundException extends RuntimeException {

    public TopupNotFoundException(UUID topupId) {
        super("Topup not found: " + topupId);
    }
}
