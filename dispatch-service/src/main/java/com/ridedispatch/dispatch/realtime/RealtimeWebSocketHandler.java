package com.ridedispatch.dispatch.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.ridedispatch.dispatch.exception.DispatchException;
import com.ridedispatch.dispatch.exception.ErrorCode;
import com.ridedispatch.dispatch.location.DriverLocationService;
import com.ridedispatch.dispatch.service.DispatchOrchestrator;
import com.ridedispatch.shared.enums.ConnectionRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Inbound side of the realtime protocol. Every inbound frame is an envelope
 * {@code {type, payload}}:
 *
 *   subscribe{channel}          -> subscribed{channel}
 *   unsubscribe{channel}        -> unsubscribed{channel}
 *   driver_location{latitude, longitude, heading?, orderId?}   drivers only
 *   ping                        -> pong
 *
 * Bad frames are answered with {@code error{code, message}}; the connection stays open.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RealtimeWebSocketHandler extends TextWebSocketHandler {

    private final WebSocketRealtimeGateway gateway;
    private final DriverLocationService locationService;
    private final DispatchOrchestrator orchestrator;
    private final ObjectMapper objectMapper;

    private final Map<String, ClientConnection> bySession = new ConcurrentHashMap<>();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String identity = (String) session.getAttributes().get(IdentityHandshakeInterceptor.IDENTITY_ATTRIBUTE);
        ConnectionRole role = (ConnectionRole) session.getAttributes().get(IdentityHandshakeInterceptor.ROLE_ATTRIBUTE);

        ClientConnection connection = gateway.connect(identity, role, session);
        bySession.put(session.getId(), connection);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("identity", identity);
        payload.put("role", role);
        payload.put("instanceId", gateway.getInstanceId());
        gateway.reply(connection, RealtimeMessage.of(RealtimeMessage.CONNECTED, payload));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ClientConnection connection = bySession.get(session.getId());
        if (connection == null) {
            return;
        }
        connection.touch();

        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            sendError(connection, ErrorCode.VALIDATION_ERROR.name(), "Malformed message");
            return;
        }
        String type = envelope.path("type").asText("");
        JsonNode payload = envelope.path("payload");
        log.debug("{} {} -> {}", connection.getRole(), connection.getIdentity(), type);

        try {
            switch (type) {
                case "subscribe" -> handleSubscribe(connection, payload);
                case "unsubscribe" -> handleUnsubscribe(connection, payload);
                case "driver_location" -> handleDriverLocation(connection, payload);
                case "ping" -> gateway.reply(connection, RealtimeMessage.of(RealtimeMessage.PONG, null));
                default -> sendError(connection, ErrorCode.VALIDATION_ERROR.name(), "Unknown message type '" + type + "'");
            }
        } catch (DispatchException e) {
            sendError(connection, e.getCode().name(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Failed to handle {} from {}: {}", type, connection.getIdentity(), e.getMessage());
            sendError(connection, "INTERNAL_ERROR", "Message could not be processed");
        }
    }

    @Override
    protected void handlePongMessage(WebSocketSession session, PongMessage message) {
        ClientConnection connection = bySession.get(session.getId());
        if (connection != null) {
            connection.touch();
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Transport error on session {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ClientConnection connection = bySession.remove(session.getId());
        if (connection != null) {
            gateway.disconnect(connection);
        }
    }

    private void handleSubscribe(ClientConnection connection, JsonNode payload) {
        String channel = requireChannel(payload);
        if (Channels.isOrderChannel(channel)) {
            Optional<UUID> orderId = Channels.orderId(channel);
            if (orderId.isEmpty() || !orchestrator.isParticipant(orderId.get(), connection.getIdentity())) {
                throw new DispatchException(ErrorCode.FORBIDDEN, "Not a participant of " + channel);
            }
        }
        gateway.subscribe(connection, channel);
        gateway.reply(connection, RealtimeMessage.of(RealtimeMessage.SUBSCRIBED, Map.of("channel", channel)));
    }

    private void handleUnsubscribe(ClientConnection connection, JsonNode payload) {
        String channel = requireChannel(payload);
        gateway.unsubscribe(connection, channel);
        gateway.reply(connection, RealtimeMessage.of(RealtimeMessage.UNSUBSCRIBED, Map.of("channel", channel)));
    }

    // orderId in the payload is informational: the driver's active order is looked up server side
    private void handleDriverLocation(ClientConnection connection, JsonNode payload) {
        if (connection.getRole() != ConnectionRole.DRIVER) {
            throw new DispatchException(ErrorCode.FORBIDDEN, "Only drivers can report locations");
        }
        JsonNode lat = payload.path("latitude");
        JsonNode lng = payload.path("longitude");
        if (!lat.isNumber() || !lng.isNumber()
                || Math.abs(lat.asDouble()) > 90 || Math.abs(lng.asDouble()) > 180) {
            throw new DispatchException(ErrorCode.VALIDATION_ERROR, "latitude and longitude are required");
        }
        JsonNode heading = payload.path("heading");
        locationService.reportLocation(connection.getIdentity(), lat.asDouble(), lng.asDouble(),
                heading.isNumber() ? heading.asDouble() : null);
    }

    private static String requireChannel(JsonNode payload) {
        JsonNode channel = payload == null ? MissingNode.getInstance() : payload.path("channel");
        if (!channel.isTextual() || channel.asText().isBlank()) {
            throw new DispatchException(ErrorCode.VALIDATION_ERROR, "channel is required");
        }
        return channel.asText();
    }

    private void sendError(ClientConnection connection, String code, String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("code", code);
        payload.put("message", message);
        gateway.reply(connection, RealtimeMessage.of(RealtimeMessage.ERROR, payload));
    }
}
