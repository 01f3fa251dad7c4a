package com.ridedispatch.dispatch.realtime;

import java.util.Optional;
import java.util.UUID;

public final class Channels {

    private static final String ORDER_PREFIX = "order:";

    private Channels() {}

    public static String order(UUID orderId) {
        return ORDER_PREFIX + orderId;
    }

    /** Order id of an {@code order:{id}} channel, empty for any other channel. */
    public static Optional<UUID> orderId(String channel) {
        if (channel == null || !channel.startsWith(ORDER_PREFIX)) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(channel.substring(ORDER_PREFIX.length())));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public static boolean isOrderChannel(String channel) {
        return channel != null && channel.startsWith(ORDER_PREFIX);
    }
}
