package com.ridedispatch.dispatch.realtime;

import com.ridedispatch.dispatch.entity.Driver;
import com.ridedispatch.dispatch.repository.DriverRepository;
import com.ridedispatch.dispatch.security.HeaderIdentityVerifier;
import com.ridedispatch.dispatch.security.IdentityVerifier;
import com.ridedispatch.dispatch.security.VerifiedIdentity;
import com.ridedispatch.shared.enums.ConnectionRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;
import java.util.Optional;

/**
 * Verifies the caller before the WebSocket upgrade completes. Rejected handshakes
 * never reach the handler, so no connection state exists for them.
 *
 * Identity: {@code X-User-Id} header, or {@code userId} query parameter for browser clients.
 * Role: {@code role} query parameter ({@code driver} or {@code rider}, default rider).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IdentityHandshakeInterceptor implements HandshakeInterceptor {

    public static final String IDENTITY_ATTRIBUTE = "identity";
    public static final String ROLE_ATTRIBUTE = "role";
    public static final String USER_ID_ATTRIBUTE = "userId";

    private final IdentityVerifier identityVerifier;
    private final DriverRepository driverRepository;

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        MultiValueMap<String, String> params = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams();
        String presented = request.getHeaders().getFirst(HeaderIdentityVerifier.USER_ID_HEADER);
        if (presented == null) {
            presented = params.getFirst("userId");
        }

        Optional<VerifiedIdentity> identity = identityVerifier.verify(presented);
        if (identity.isEmpty()) {
            log.info("Rejected WebSocket handshake from {}: no verifiable identity", request.getRemoteAddress());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }

        String userId = identity.get().userId();
        ConnectionRole role = ConnectionRole.fromParam(params.getFirst("role"));
        String connectionIdentity = userId;
        if (role == ConnectionRole.DRIVER) {
            Optional<Driver> driver = driverRepository.findByUserId(userId);
            if (driver.isEmpty()) {
                log.info("Rejected driver handshake of {}: no driver profile", userId);
                response.setStatusCode(HttpStatus.FORBIDDEN);
                return false;
            }
            connectionIdentity = driver.get().getId();
        }

        attributes.put(USER_ID_ATTRIBUTE, userId);
        attributes.put(IDENTITY_ATTRIBUTE, connectionIdentity);
        attributes.put(ROLE_ATTRIBUTE, role);
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        if (exception != null) {
            log.warn("WebSocket handshake failed: {}", exception.getMessage());
        }
    }
}
