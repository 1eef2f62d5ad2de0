package com.flagship.credit_ledger.ledger;

import com.flagship.credit_ledger.payment.AuthenticationFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Guards operator endpoints with a shared token. With no token configured the
 * operator endpoints are closed.
 */
@Component
@Slf4j
public class AdminTokenVerifier {

    public static final String ADMIN_TOKEN_HEADER = "X-Admin-Token";

    private final String token;

    public AdminTokenVerifier(@Value("${admin.api-token:}") String token) {
        this.token = token;
        if (token == null || token.isBlank()) {
            log.warn("admin.api-token is not set; operator endpoints will reject every request");
        }
    }

    /**
     * @throws AuthenticationFailedException if the presented token is missing or wrong
     */
    public void requireOperator(String presented) {
        if (token == null || token.isBlank() || presented == null
                || !MessageDigest.isEqual(token.getBytes(StandardCharsets.UTF_8),
                        presented.getBytes(StandardCharsets.UTF_8))) {
            throw new AuthenticationFailedException("Invalid operator token");
        }
    }
}
