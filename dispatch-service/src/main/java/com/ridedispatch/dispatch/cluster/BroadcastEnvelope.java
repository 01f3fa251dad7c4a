package com.ridedispatch.dispatch.cluster;

import com.ridedispatch.dispatch.realtime.RealtimeMessage;
import com.ridedispatch.shared.enums.ConnectionRole;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cluster-wide fan-out. With a channel, only that channel's subscribers receive it;
 * with a role, only connections of that role; with neither, every connection.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BroadcastEnvelope {
    private String channel;
    private ConnectionRole role;
    private RealtimeMessage message;
    private String originInstance;
}
