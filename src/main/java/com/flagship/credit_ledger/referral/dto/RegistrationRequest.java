package com.flagship.credit_ledger.referral.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * First contact of a user with the bot. referrerCode is the start parameter of
 * an invite link ("ref_&lt;userId&gt;"), if any.
 */
@Value
@Builder
@Jacksonized
public class RegistrationRequest {

    @Size(max = 64, message = "Referral code is too long")
    @JsonProperty("referrerCode")
    String referrerCode;
}
