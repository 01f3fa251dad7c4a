package com.ridedispatch.dispatch.config;

import com.ridedispatch.dispatch.realtime.IdentityHandshakeInterceptor;
import com.ridedispatch.dispatch.realtime.RealtimeWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final RealtimeWebSocketHandler handler;
    private final IdentityHandshakeInterceptor identityHandshakeInterceptor;
    private final RealtimeProperties properties;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, properties.getEndpoint())
                .addInterceptors(identityHandshakeInterceptor)
                .setAllowedOriginPatterns(properties.getAllowedOrigins().toArray(String[]::new));
    }
}
