package com.ridedispatch.dispatch.cluster;

import com.ridedispatch.dispatch.realtime.RealtimeMessage;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Point-to-point relay: deliver {@code message} to whichever instance holds {@code targetIdentity}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RelayEnvelope {
    private String targetIdentity;
    private RealtimeMessage message;
    private String originInstance;
}
