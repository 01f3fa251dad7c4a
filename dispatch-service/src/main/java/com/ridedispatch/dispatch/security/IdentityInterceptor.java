package com.ridedispatch.dispatch.security;

import com.ridedispatch.dispatch.exception.DispatchException;
import com.ridedispatch.dispatch.exception.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Rejects REST calls without a verifiable identity and exposes the verified user id
 * to controllers as the {@link #USER_ID_ATTRIBUTE} request attribute.
 */
@Component
@RequiredArgsConstructor
public class IdentityInterceptor implements HandlerInterceptor {

    public static final String USER_ID_ATTRIBUTE = "verifiedUserId";

    private final IdentityVerifier identityVerifier;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        VerifiedIdentity identity = identityVerifier.verify(request.getHeader(HeaderIdentityVerifier.USER_ID_HEADER))
                .orElseThrow(() -> new DispatchException(ErrorCode.UNAUTHORIZED,
                        "Missing or invalid " + HeaderIdentityVerifier.USER_ID_HEADER + " header"));
        request.setAttribute(USER_ID_ATTRIBUTE, identity.userId());
        return true;
    }
}
