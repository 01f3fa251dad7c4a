package com.ridedispatch.shared.util;

/**
 * Central registry of all Kafka topic names.
 */
public final class KafkaTopics {

    private KafkaTopics() {}

    public static final String DRIVER_LOCATION_UPDATED  = "driver.location.updated";
    public static final String ORDER_CREATED            = "order.created";
    public static final String ORDER_OFFER_SENT         = "order.offer.sent";
    public static final String ORDER_ACCEPTED           = "order.accepted";
    public static final String ORDER_STATUS_CHANGED     = "order.status.changed";
    public static final String ORDER_CANCELLED          = "order.cancelled";
}
