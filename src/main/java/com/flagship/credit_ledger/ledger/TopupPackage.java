package com.flagship.credit_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A predefined topup offered to users.
 */
@Value
public class TopupPackage {
    BigDecimal rubAmount;
    long credits;
}
