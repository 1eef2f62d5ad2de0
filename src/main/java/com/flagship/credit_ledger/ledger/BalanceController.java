package com.flagship.credit_ledger.ledger;

import com.flagship.credit_ledger.ledger.dto.BalanceResponse;
import com.flagship.credit_ledger.ledger.dto.TransactionResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/balances")
@RequiredArgsConstructor
public class BalanceController {

    private static final int MAX_HISTORY = 500;

    private final CreditLedger creditLedger;

    @GetMapping("/{userId}")
    public BalanceResponse getBalance(@PathVariable("userId") long userId) {
        return BalanceResponse.from(creditLedger.getBalance(userId));
    }

    /**
     * Newest first.
     */
    @GetMapping("/{userId}/transactions")
    public List<TransactionResponse> getTransactions(@PathVariable("userId") long userId,
                                                     @RequestParam(value = "limit", defaultValue = "50") int limit) {
        if (limit <= 0 || limit > MAX_HISTORY) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_HISTORY);
        }
        return creditLedger.getTransactions(userId, limit).stream()
            .map(TransactionResponse::from)
            .toList();
    }
}
