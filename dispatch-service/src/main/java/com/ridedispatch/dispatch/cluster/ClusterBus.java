package com.ridedispatch.dispatch.cluster;

import java.util.function.Consumer;

/**
 * Best-effort, at-most-once publish/subscribe between service instances.
 */
public interface ClusterBus {

    /**
     * @return false when the payload could not be handed to the bus
     */
    boolean publish(String topic, Object payload);

    <T> void subscribe(String topic, Class<T> payloadType, Consumer<T> handler);
}
