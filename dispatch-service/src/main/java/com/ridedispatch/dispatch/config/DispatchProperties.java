package com.ridedispatch.dispatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "dispatch")
public class DispatchProperties {

    private Search search = new Search();
    private Location location = new Location();
    private Geo geo = new Geo();

    @Data
    public static class Search {
        /** Candidate search radius around the pickup point. */
        private double radiusKm = 10.0;
        /** Accept window of one broadcast round. */
        private Duration offerTimeout = Duration.ofSeconds(30);
        private long sweepIntervalMs = 5000;
        private int sweepBatchSize = 50;
        /** Broadcast rounds before a search is given up; 0 searches until cancelled. */
        private int maxBroadcasts = 0;
        private int candidateLimit = 10;
        /** Most nearby drivers inspected per search while looking for eligible ones. */
        private int candidateScanLimit = 500;
        private int estimateCandidateLimit = 20;
        private int defaultPickupEtaMinutes = 15;
    }

    @Data
    public static class Location {
        private double minMovementMeters = 80.0;
    }

    @Data
    public static class Geo {
        private String key = "drivers:geo";
        private String positionKeyPrefix = "driver:location:";
        /** Lease of an indexed position; refreshed by every report, moved or not. */
        private Duration entryTtl = Duration.ofMinutes(5);
    }
}
