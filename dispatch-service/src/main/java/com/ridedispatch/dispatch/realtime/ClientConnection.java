package com.ridedispatch.dispatch.realtime;

import com.ridedispatch.shared.enums.ConnectionRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One client's live transport, owned by the instance that accepted it.
 */
@Slf4j
public class ClientConnection {

    private final String identity;
    private final ConnectionRole role;
    private final WebSocketSession session;
    private final Set<String> channels = ConcurrentHashMap.newKeySet();
    private volatile Instant lastSeen;

    public ClientConnection(String identity, ConnectionRole role, WebSocketSession session) {
        this.identity = identity;
        this.role = role;
        this.session = session;
        this.lastSeen = Instant.now();
    }

    public String getIdentity() {
        return identity;
    }

    public ConnectionRole getRole() {
        return role;
    }

    public String getSessionId() {
        return session.getId();
    }

    public Set<String> getChannels() {
        return Collections.unmodifiableSet(channels);
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    public boolean isOpen() {
        return session.isOpen();
    }

    public void touch() {
        lastSeen = Instant.now();
    }

    public boolean isStale(Instant now, Duration livenessTimeout) {
        return lastSeen.plus(livenessTimeout).isBefore(now);
    }

    boolean addChannel(String channel) {
        return channels.add(channel);
    }

    boolean removeChannel(String channel) {
        return channels.remove(channel);
    }

    public boolean send(String json) {
        if (!session.isOpen()) {
            return false;
        }
        try {
            session.sendMessage(new TextMessage(json));
            return true;
        } catch (IOException | IllegalStateException | SessionLimitExceededException e) {
            log.debug("Send to {} ({}) failed: {}", identity, session.getId(), e.getMessage());
            return false;
        }
    }

    void ping() {
        try {
            session.sendMessage(new PingMessage(ByteBuffer.allocate(0)));
        } catch (IOException | IllegalStateException | SessionLimitExceededException e) {
            log.debug("Ping to {} failed: {}", identity, e.getMessage());
        }
    }

    void close(CloseStatus status) {
        try {
            session.close(status);
        } catch (IOException e) {
            log.debug("Closing session {} failed: {}", session.getId(), e.getMessage());
        }
    }
}
