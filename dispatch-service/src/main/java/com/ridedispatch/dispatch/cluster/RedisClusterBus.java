package com.ridedispatch.dispatch.cluster;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * ClusterBus on Redis pub/sub. Payloads travel as JSON strings.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisClusterBus implements ClusterBus {

    private final StringRedisTemplate redisTemplate;
    private final RedisMessageListenerContainer listenerContainer;
    private final ObjectMapper objectMapper;

    @Override
    public boolean publish(String topic, Object payload) {
        try {
            redisTemplate.convertAndSend(topic, objectMapper.writeValueAsString(payload));
            return true;
        } catch (JsonProcessingException e) {
            log.warn("Cannot serialize payload for topic {}: {}", topic, e.getMessage());
        } catch (DataAccessException e) {
            log.warn("Publish to {} failed: {}", topic, e.getMessage());
        }
        return false;
    }

    @Override
    public <T> void subscribe(String topic, Class<T> payloadType, Consumer<T> handler) {
        listenerContainer.addMessageListener((message, pattern) -> {
            T payload;
            try {
                payload = objectMapper.readValue(message.getBody(), payloadType);
            } catch (IOException e) {
                log.warn("Dropping malformed message on {}: {}", topic, e.getMessage());
                return;
            }
            try {
                handler.accept(payload);
            } catch (RuntimeException e) {
                log.warn("Handler for {} failed: {}", topic, e.getMessage(), e);
            }
        }, new ChannelTopic(topic));
        log.info("Subscribed to cluster topic {}", topic);
    }
}
