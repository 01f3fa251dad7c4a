package com.ridedispatch.dispatch.realtime;

import com.ridedispatch.shared.enums.ConnectionRole;
import org.springframework.web.socket.WebSocketSession;

import java.util.Collection;
import java.util.List;

/**
 * Addresses connected riders and drivers by identity or channel, regardless of
 * which instance holds their connection. None of the send methods throw.
 */
public interface RealtimeGateway {

    ClientConnection connect(String identity, ConnectionRole role, WebSocketSession session);

    void disconnect(ClientConnection connection);

    void subscribe(ClientConnection connection, String channel);

    void unsubscribe(ClientConnection connection, String channel);

    /**
     * Delivers locally when this instance holds the identity's connection, otherwise
     * relays through the cluster bus.
     *
     * @return true when delivered locally or handed to the bus
     */
    boolean sendTo(String identity, RealtimeMessage message);

    /** Every subscriber of the channel on every instance. */
    void broadcast(String channel, RealtimeMessage message);

    /**
     * Sends to drivers near a point, skipping {@code excludeIds}.
     *
     * @return the driver ids the message was addressed to
     */
    List<String> broadcastToRadius(double lat, double lng, double radiusKm,
                                   RealtimeMessage message, Collection<String> excludeIds);

    /** Operator fan-out to every connection of a role on every instance. */
    void broadcastToRole(ConnectionRole role, RealtimeMessage message);

    boolean isConnectedLocally(String identity);
}
