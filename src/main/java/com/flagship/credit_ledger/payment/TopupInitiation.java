package com.flagship.credit_ledger.payment;

import lombok.Value;

/**
 * A created topup plus where to send the user to pay for it.
 */
@Value
public class TopupInitiation {
    Topup topup;
    String paymentId;
    String confirmationUrl;
}
