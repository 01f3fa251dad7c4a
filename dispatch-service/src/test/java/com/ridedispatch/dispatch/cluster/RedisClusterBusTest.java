package com.ridedispatch.dispatch.cluster;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ridedispatch.dispatch.realtime.RealtimeMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.DefaultMessage;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class RedisClusterBusTest {

    private static final String TOPIC = "ws:message";

    @Mock private StringRedisTemplate redisTemplate;
    @Mock private RedisMessageListenerContainer listenerContainer;

    private RedisClusterBus bus;

    @BeforeEach
    void setUp() {
        bus = new RedisClusterBus(redisTemplate, listenerContainer, new ObjectMapper().findAndRegisterModules());
    }

    @Test
    @DisplayName("A published relay envelope arrives intact at a subscriber on another instance")
    void envelopeRoundTrip() {
        List<RelayEnvelope> received = new ArrayList<>();
        bus.subscribe(TOPIC, RelayEnvelope.class, received::add);
        MessageListener listener = capturedListener();

        RelayEnvelope sent = new RelayEnvelope("drv-1",
                RealtimeMessage.of(RealtimeMessage.NEW_ORDER_REQUEST, Map.of("orderId", "o-1")), "gw-a");
        assertThat(bus.publish(TOPIC, sent)).isTrue();

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(redisTemplate).convertAndSend(eq(TOPIC), json.capture());
        listener.onMessage(message(json.getValue()), null);

        assertThat(received).hasSize(1);
        assertThat(received.get(0).getTargetIdentity()).isEqualTo("drv-1");
        assertThat(received.get(0).getOriginInstance()).isEqualTo("gw-a");
        assertThat(received.get(0).getMessage().getType()).isEqualTo(RealtimeMessage.NEW_ORDER_REQUEST);
    }

    @Test
    @DisplayName("A publish that Redis rejects is reported as not handed to the bus")
    void publishFailure() {
        doThrow(new RedisConnectionFailureException("down")).when(redisTemplate).convertAndSend(anyString(), anyString());

        assertThat(bus.publish(TOPIC, new RelayEnvelope("drv-1", null, "gw-a"))).isFalse();
    }

    @Test
    @DisplayName("Malformed payloads and failing handlers do not break the listener")
    void badMessagesAreDropped() {
        bus.subscribe(TOPIC, RelayEnvelope.class, envelope -> {
            throw new IllegalStateException("handler bug");
        });
        MessageListener listener = capturedListener();

        assertThatCode(() -> listener.onMessage(message("{not json"), null)).doesNotThrowAnyException();
        assertThatCode(() -> listener.onMessage(message("{\"targetIdentity\":\"drv-1\"}"), null))
                .doesNotThrowAnyException();
    }

    private MessageListener capturedListener() {
        ArgumentCaptor<MessageListener> listener = ArgumentCaptor.forClass(MessageListener.class);
        verify(listenerContainer).addMessageListener(listener.capture(), eq(new ChannelTopic(TOPIC)));
        return listener.getValue();
    }

    private static DefaultMessage message(String body) {
        return new DefaultMessage(TOPIC.getBytes(StandardCharsets.UTF_8), body.getBytes(StandardCharsets.UTF_8));
    }
}
