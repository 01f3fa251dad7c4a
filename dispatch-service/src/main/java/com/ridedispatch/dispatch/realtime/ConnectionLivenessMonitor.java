package com.ridedispatch.dispatch.realtime;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Pings every local connection and closes the ones that stopped answering.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectionLivenessMonitor {

    private final WebSocketRealtimeGateway gateway;

    @Scheduled(fixedDelayString = "${realtime.ping-interval-ms:30000}")
    public void probe() {
        int closed = gateway.sweepLiveness();
        if (closed > 0) {
            log.info("Closed {} unresponsive connections, {} remain", closed, gateway.connectionCount());
        }
    }
}
