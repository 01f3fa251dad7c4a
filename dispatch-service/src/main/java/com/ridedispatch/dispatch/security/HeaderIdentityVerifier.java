package com.ridedispatch.dispatch.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Trusts the user id propagated by the API gateway, after a format check.
 */
@Slf4j
@Component
public class HeaderIdentityVerifier implements IdentityVerifier {

    public static final String USER_ID_HEADER = "X-User-Id";

    private static final Pattern USER_ID_FORMAT = Pattern.compile("[A-Za-z0-9:._@-]{1,128}");

    @Override
    public Optional<VerifiedIdentity> verify(String presentedIdentity) {
        if (presentedIdentity == null || presentedIdentity.isBlank()) {
            return Optional.empty();
        }
        String trimmed = presentedIdentity.trim();
        if (!USER_ID_FORMAT.matcher(trimmed).matches()) {
            log.warn("Rejected malformed identity '{}'", trimmed);
            return Optional.empty();
        }
        return Optional.of(new VerifiedIdentity(trimmed));
    }
}
