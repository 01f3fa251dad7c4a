package com.ridedispatch.dispatch.messaging;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Fire-and-forget Kafka republication of domain events. Downstream consumers are
 * best-effort: a broker outage is logged and never fails the operation that raised the event.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    public void publish(String topic, String key, Object event) {
        try {
            kafkaTemplate.send(topic, key, event).whenComplete((result, ex) -> {
                if (ex != null) {
                    log.warn("Kafka publish to {} (key {}) failed: {}", topic, key, ex.getMessage());
                } else {
                    log.debug("Published {} to {} partition {}", key, topic,
                            result.getRecordMetadata().partition());
                }
            });
        } catch (RuntimeException e) {
            log.warn("Kafka publish to {} (key {}) rejected: {}", topic, key, e.getMessage());
        }
    }
}
