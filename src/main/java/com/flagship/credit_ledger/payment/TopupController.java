package com.flagship.credit_ledger.payment;

import com.flagship.credit_ledger.ledger.CreditPricing;
import com.flagship.credit_ledger.ledger.TopupPackage;
import com.flagship.credit_ledger.payment.dto.CreateTopupRequest;
import com.flagship.credit_ledger.payment.dto.TopupInitiationResponse;
import com.flagship.credit_ledger.payment.dto.TopupResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/topups")
@RequiredArgsConstructor
public class TopupController {

    private final TopupService topupService;
    private final CreditPricing pricing;

    /**
     * Creates a topup and returns the provider checkout link. Credits arrive only
     * with the provider's webhook.
     */
    @PostMapping
    public ResponseEntity<TopupInitiationResponse> createTopup(@Valid @RequestBody CreateTopupRequest request) {
        TopupInitiation initiation = topupService.initiateTopup(request.getUserId(), request.getRubAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(TopupInitiationResponse.from(initiation));
    }

    @GetMapping("/packages")
    public List<TopupPackage> getPackages() {
        return pricing.packages();
    }

    @GetMapping("/{id}")
    public TopupResponse getTopup(@PathVariable("id") UUID id) {
        return TopupResponse.from(topupService.getTopup(id));
    }

    @GetMapping
    public List<TopupResponse> getTopups(@RequestParam("userId") long userId) {
        return topupService.getTopups(userId).stream().map(TopupResponse::from).toList();
    }
}
