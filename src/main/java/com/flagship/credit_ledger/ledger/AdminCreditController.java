package com.flagship.credit_ledger.ledger;

import com.flagship.credit_ledger.ledger.dto.ManualGrantRequest;
import com.flagship.credit_ledger.ledger.dto.ManualGrantResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator credit grants (compensation, promotions). Goes through the same
 * idempotent grant as paid topups. Callers must present the operator token.
 */
@RestController
@RequestMapping("/api/admin/credits")
@RequiredArgsConstructor
@Slf4j
public class AdminCreditController {

    private final CreditLedger creditLedger;
    private final AdminTokenVerifier adminTokenVerifier;

    @PostMapping
    public ResponseEntity<ManualGrantResponse> grant(
            @RequestHeader(value = AdminTokenVerifier.ADMIN_TOKEN_HEADER, required = false) String adminToken,
            @Valid @RequestBody ManualGrantRequest request) {
        adminTokenVerifier.requireOperator(adminToken);
        LedgerResult result = creditLedger.grant(request.getUserId(), request.getAmount(), request.getReferenceId());
        log.info("Manual grant of {} credits to user {} (reference {}, duplicate: {})",
                request.getAmount(), request.getUserId(), request.getReferenceId(), result.isDuplicate());
        HttpStatus status = result.isDuplicate() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(ManualGrantResponse.from(result));
    }
}
