package com.ridedispatch.dispatch.notification;

import com.ridedispatch.dispatch.entity.DispatchOrder;
import com.ridedispatch.dispatch.model.DriverSummary;
import com.ridedispatch.shared.enums.OrderStatus;

import java.util.List;

/**
 * A committed order transition and who has to hear about it.
 *
 * @param recipients realtime identities: rider user ids and driver ids
 * @param driver     assigned driver as shown to the rider, null when none
 */
public record OrderNotification(DispatchOrder order,
                                OrderStatus previousStatus,
                                String actorId,
                                String reason,
                                List<String> recipients,
                                DriverSummary driver) {
}
