package com.flagship.credit_ledger.referral;

import com.flagship.credit_ledger.referral.dto.ReferralStatsResponse;
import com.flagship.credit_ledger.referral.dto.RegistrationRequest;
import com.flagship.credit_ledger.referral.dto.RegistrationResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/users/{userId}")
@RequiredArgsConstructor
public class ReferralController {

    private final ReferralService referralService;

    /**
     * 201 when a signup bonus was granted, 200 for a user that was already registered.
     */
    @PostMapping("/registration")
    public ResponseEntity<RegistrationResponse> register(@PathVariable("userId") long userId,
                                                         @Valid @RequestBody(required = false) RegistrationRequest request) {
        if (userId <= 0) {
            throw new IllegalArgumentException("userId must be positive");
        }
        String referrerCode = request != null ? request.getReferrerCode() : null;
        RegistrationResult result = referralService.registerUser(userId, referrerCode);
        HttpStatus status = result.isNewUser() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(RegistrationResponse.from(result));
    }

    @GetMapping("/referrals")
    public ReferralStatsResponse getReferralStats(@PathVariable("userId") long userId) {
        return ReferralStatsResponse.from(referralService.getStats(userId));
    }
}
