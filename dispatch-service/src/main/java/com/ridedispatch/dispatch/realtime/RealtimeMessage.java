package com.ridedispatch.dispatch.realtime;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outbound envelope {@code {type, payload, timestamp}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RealtimeMessage {

    public static final String CONNECTED         = "connected";
    public static final String SUBSCRIBED        = "subscribed";
    public static final String UNSUBSCRIBED      = "unsubscribed";
    public static final String PONG              = "pong";
    public static final String ERROR             = "error";
    public static final String DRIVER_LOCATION   = "driver_location";
    public static final String ORDER_UPDATE      = "order_update";
    public static final String NEW_ORDER_REQUEST = "new_order_request";

    private String type;
    private Object payload;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant timestamp;

    public static RealtimeMessage of(String type, Object payload) {
        return new RealtimeMessage(type, payload, Instant.now());
    }
}
