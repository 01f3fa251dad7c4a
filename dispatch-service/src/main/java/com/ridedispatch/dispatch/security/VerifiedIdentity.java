package com.ridedispatch.dispatch.security;

/**
 * A caller whose identity has been established upstream.
 */
public record VerifiedIdentity(String userId) {
}
