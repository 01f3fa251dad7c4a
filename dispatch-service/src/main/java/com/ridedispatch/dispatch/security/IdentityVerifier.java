package com.ridedispatch.dispatch.security;

import java.util.Optional;

/**
 * Resolves the raw identity presented by a client into a verified one.
 * Credential checks (tokens, DIDs) happen upstream of this service.
 */
public interface IdentityVerifier {

    Optional<VerifiedIdentity> verify(String presentedIdentity);
}
