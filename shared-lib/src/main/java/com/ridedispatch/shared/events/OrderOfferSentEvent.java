package com.ridedispatch.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderOfferSentEvent {

    public static final String TOPIC = "order.offer.sent";

    private String orderId;
    private List<String> driverIds;
    private int broadcastNumber;
    private int excludedCount;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant expiresAt;
}
