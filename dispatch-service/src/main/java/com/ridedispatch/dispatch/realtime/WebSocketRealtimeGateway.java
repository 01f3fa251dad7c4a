package com.ridedispatch.dispatch.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ridedispatch.dispatch.cluster.BroadcastEnvelope;
import com.ridedispatch.dispatch.cluster.ClusterBus;
import com.ridedispatch.dispatch.cluster.RelayEnvelope;
import com.ridedispatch.dispatch.config.RealtimeProperties;
import com.ridedispatch.dispatch.geo.GeoIndex;
import com.ridedispatch.dispatch.metrics.DispatchMetrics;
import com.ridedispatch.shared.enums.ConnectionRole;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connection registry of this instance plus the cluster relay that makes every
 * instance's connections addressable from any other instance.
 *
 * Registry:  identity -> connection (one per identity; a reconnect replaces and closes the old one)
 * Channels:  channel  -> connections subscribed on this instance
 * Relay:     {@code realtime.relay-topic} carries RelayEnvelope,
 *            {@code realtime.broadcast-topic} carries BroadcastEnvelope
 */
@Slf4j
@Component
public class WebSocketRealtimeGateway implements RealtimeGateway {

    private static final int RADIUS_BROADCAST_LIMIT = 50;

    private final ClusterBus clusterBus;
    private final GeoIndex geoIndex;
    private final ObjectMapper objectMapper;
    private final RealtimeProperties properties;
    private final DispatchMetrics metrics;

    private final Map<String, ClientConnection> connections = new ConcurrentHashMap<>();
    private final Map<String, Set<ClientConnection>> channelMembers = new ConcurrentHashMap<>();

    public WebSocketRealtimeGateway(ClusterBus clusterBus,
                                    GeoIndex geoIndex,
                                    ObjectMapper objectMapper,
                                    RealtimeProperties properties,
                                    DispatchMetrics metrics,
                                    MeterRegistry meterRegistry) {
        this.clusterBus = clusterBus;
        this.geoIndex = geoIndex;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.metrics = metrics;
        Gauge.builder("realtime.connections", connections, Map::size)
                .description("Open client connections on this instance")
                .register(meterRegistry);
    }

    @PostConstruct
    public void subscribeToCluster() {
        clusterBus.subscribe(properties.getRelayTopic(), RelayEnvelope.class, this::onRelay);
        clusterBus.subscribe(properties.getBroadcastTopic(), BroadcastEnvelope.class, this::onBroadcast);
        log.info("Realtime gateway {} listening on {} and {}",
                properties.getInstanceId(), properties.getRelayTopic(), properties.getBroadcastTopic());
    }

    public String getInstanceId() {
        return properties.getInstanceId();
    }

    @Override
    public ClientConnection connect(String identity, ConnectionRole role, WebSocketSession session) {
        WebSocketSession safeSession = new ConcurrentWebSocketSessionDecorator(
                session, properties.getSendTimeLimitMs(), properties.getSendBufferSizeBytes());
        ClientConnection connection = new ClientConnection(identity, role, safeSession);

        ClientConnection previous = connections.put(identity, connection);
        if (previous != null && previous != connection) {
            leaveAllChannels(previous);
            previous.close(CloseStatus.POLICY_VIOLATION.withReason("Replaced by a newer connection"));
            log.info("Connection {} of {} replaced by {}", previous.getSessionId(), identity, session.getId());
        }
        log.info("{} {} connected on {} (session {})", role, identity, properties.getInstanceId(), session.getId());
        return connection;
    }

    @Override
    public void disconnect(ClientConnection connection) {
        leaveAllChannels(connection);
        if (connections.remove(connection.getIdentity(), connection)) {
            log.info("{} {} disconnected (session {})", connection.getRole(), connection.getIdentity(),
                    connection.getSessionId());
        }
    }

    @Override
    public void subscribe(ClientConnection connection, String channel) {
        if (connection.addChannel(channel)) {
            channelMembers.computeIfAbsent(channel, c -> ConcurrentHashMap.newKeySet()).add(connection);
        }
    }

    @Override
    public void unsubscribe(ClientConnection connection, String channel) {
        connection.removeChannel(channel);
        removeMember(channel, connection);
    }

    @Override
    public boolean sendTo(String identity, RealtimeMessage message) {
        if (deliverLocal(identity, message)) {
            return true;
        }
        boolean published = clusterBus.publish(properties.getRelayTopic(),
                new RelayEnvelope(identity, message, properties.getInstanceId()));
        if (published) {
            metrics.recordRelayPublished();
            log.debug("{} not connected here, relayed {} through the cluster bus", identity, message.getType());
        } else {
            log.warn("Could not deliver {} to {}: not connected here and relay failed", message.getType(), identity);
        }
        return published;
    }

    @Override
    public void broadcast(String channel, RealtimeMessage message) {
        deliverToChannel(channel, message);
        clusterBus.publish(properties.getBroadcastTopic(),
                new BroadcastEnvelope(channel, null, message, properties.getInstanceId()));
    }

    @Override
    public List<String> broadcastToRadius(double lat, double lng, double radiusKm,
                                          RealtimeMessage message, Collection<String> excludeIds) {
        Set<String> excluded = excludeIds == null ? Set.of() : new HashSet<>(excludeIds);
        List<String> targets = geoIndex.query(lat, lng, radiusKm, RADIUS_BROADCAST_LIMIT + excluded.size())
                .stream()
                .filter(id -> !excluded.contains(id))
                .toList();

        if (targets.isEmpty()) {
            // nobody indexed nearby: fall back to every driver connected to this instance
            targets = connections.values().stream()
                    .filter(c -> c.getRole() == ConnectionRole.DRIVER)
                    .map(ClientConnection::getIdentity)
                    .filter(id -> !excluded.contains(id))
                    .toList();
            log.debug("No indexed drivers near ({}, {}), falling back to {} local drivers", lat, lng, targets.size());
        }

        List<String> addressed = new ArrayList<>();
        for (String driverId : targets) {
            if (sendTo(driverId, message)) {
                addressed.add(driverId);
            }
        }
        return addressed;
    }

    @Override
    public void broadcastToRole(ConnectionRole role, RealtimeMessage message) {
        deliverToRole(role, message);
        clusterBus.publish(properties.getBroadcastTopic(),
                new BroadcastEnvelope(null, role, message, properties.getInstanceId()));
    }

    @Override
    public boolean isConnectedLocally(String identity) {
        ClientConnection connection = connections.get(identity);
        return connection != null && connection.isOpen();
    }

    /**
     * Pings every connection and closes those that have not answered within the
     * liveness timeout.
     *
     * @return number of connections closed
     */
    public int sweepLiveness() {
        Instant now = Instant.now();
        int closed = 0;
        for (ClientConnection connection : List.copyOf(connections.values())) {
            if (!connection.isOpen()) {
                disconnect(connection);
                closed++;
            } else if (connection.isStale(now, properties.getLivenessTimeout())) {
                log.info("Closing unresponsive connection of {} (last seen {})",
                        connection.getIdentity(), connection.getLastSeen());
                connection.close(CloseStatus.SESSION_NOT_RELIABLE);
                disconnect(connection);
                closed++;
            } else {
                connection.ping();
            }
        }
        return closed;
    }

    public int connectionCount() {
        return connections.size();
    }

    /** Sends to a single connection without touching the registry. */
    public boolean reply(ClientConnection connection, RealtimeMessage message) {
        String json = serialize(message);
        return json != null && connection.send(json);
    }

    void onRelay(RelayEnvelope envelope) {
        if (envelope.getTargetIdentity() == null || envelope.getMessage() == null) {
            return;
        }
        if (deliverLocal(envelope.getTargetIdentity(), envelope.getMessage())) {
            metrics.recordRelayReceived();
            log.debug("Delivered relayed {} from {} to {}", envelope.getMessage().getType(),
                    envelope.getOriginInstance(), envelope.getTargetIdentity());
        }
    }

    void onBroadcast(BroadcastEnvelope envelope) {
        if (envelope.getMessage() == null || properties.getInstanceId().equals(envelope.getOriginInstance())) {
            return;
        }
        if (envelope.getChannel() != null) {
            deliverToChannel(envelope.getChannel(), envelope.getMessage());
        } else {
            deliverToRole(envelope.getRole(), envelope.getMessage());
        }
    }

    private boolean deliverLocal(String identity, RealtimeMessage message) {
        ClientConnection connection = connections.get(identity);
        if (connection == null) {
            return false;
        }
        String json = serialize(message);
        return json != null && connection.send(json);
    }

    private void deliverToChannel(String channel, RealtimeMessage message) {
        Set<ClientConnection> members = channelMembers.get(channel);
        if (members == null || members.isEmpty()) {
            return;
        }
        String json = serialize(message);
        if (json == null) {
            return;
        }
        members.forEach(connection -> connection.send(json));
    }

    /** A null role addresses every connection. */
    private void deliverToRole(ConnectionRole role, RealtimeMessage message) {
        String json = serialize(message);
        if (json == null) {
            return;
        }
        connections.values().stream()
                .filter(c -> role == null || c.getRole() == role)
                .forEach(c -> c.send(json));
    }

    private void leaveAllChannels(ClientConnection connection) {
        for (String channel : connection.getChannels()) {
            connection.removeChannel(channel);
            removeMember(channel, connection);
        }
    }

    private void removeMember(String channel, ClientConnection connection) {
        channelMembers.computeIfPresent(channel, (c, members) -> {
            members.remove(connection);
            return members.isEmpty() ? null : members;
        });
    }

    private String serialize(RealtimeMessage message) {
        if (message.getTimestamp() == null) {
            message.setTimestamp(Instant.now());
        }
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.warn("Cannot serialize {} message: {}", message.getType(), e.getMessage());
            return null;
        }
    }
}
