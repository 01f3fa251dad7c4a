package com.ridedispatch.dispatch.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Custom Micrometer metrics for the dispatch engine, location tracker and realtime gateway.
 *
 * Metrics exposed at /actuator/prometheus:
 *
 *   dispatch_order_requests_total{status="created|rejected|duplicate"}
 *   dispatch_latency_seconds{quantile="0.5|0.95|0.99"}   (request to offers sent)
 *   dispatch_offers_sent_total
 *   dispatch_offer_response_total{outcome="accepted|declined|timeout|conflict"}
 *   dispatch_no_candidates_total
 *   dispatch_kill_switch_rejections_total
 *   geo_index_fallback_total
 *   location_updates_total{result="accepted|suppressed"}
 *   realtime_relay_total{direction="published|received"}
 */
@Component
public class DispatchMetrics {

    private final Counter orderCreatedCounter;
    private final Counter orderRejectedCounter;
    private final Counter idempotentReplayCounter;
    private final Counter offersSentCounter;
    private final Counter offerAcceptedCounter;
    private final Counter offerDeclinedCounter;
    private final Counter offerTimeoutCounter;
    private final Counter acceptConflictCounter;
    private final Counter noCandidatesCounter;
    private final Counter killSwitchCounter;
    private final Counter geoFallbackCounter;
    private final Counter locationAcceptedCounter;
    private final Counter locationSuppressedCounter;
    private final Counter relayPublishedCounter;
    private final Counter relayReceivedCounter;
    private final Timer   dispatchLatencyTimer;

    public DispatchMetrics(MeterRegistry registry) {
        this.orderCreatedCounter = Counter.builder("dispatch.order.requests")
                .tag("status", "created")
                .description("Orders successfully created")
                .register(registry);

        this.orderRejectedCounter = Counter.builder("dispatch.order.requests")
                .tag("status", "rejected")
                .description("Order requests rejected (validation, kill switch)")
                .register(registry);

        this.idempotentReplayCounter = Counter.builder("dispatch.order.requests")
                .tag("status", "duplicate")
                .description("Idempotent replay requests (same key)")
                .register(registry);

        this.offersSentCounter = Counter.builder("dispatch.offers.sent")
                .description("Individual offers pushed to candidate drivers")
                .register(registry);

        this.offerAcceptedCounter = Counter.builder("dispatch.offer.response")
                .tag("outcome", "accepted")
                .register(registry);

        this.offerDeclinedCounter = Counter.builder("dispatch.offer.response")
                .tag("outcome", "declined")
                .register(registry);

        this.offerTimeoutCounter = Counter.builder("dispatch.offer.response")
                .tag("outcome", "timeout")
                .description("Accept windows that expired without an accept")
                .register(registry);

        this.acceptConflictCounter = Counter.builder("dispatch.offer.response")
                .tag("outcome", "conflict")
                .description("Accepts that lost the race to another driver")
                .register(registry);

        this.noCandidatesCounter = Counter.builder("dispatch.no_candidates")
                .description("Broadcast rounds that found no eligible driver")
                .register(registry);

        this.killSwitchCounter = Counter.builder("dispatch.kill_switch_rejections")
                .description("Requests rejected because dispatch kill switch was active")
                .register(registry);

        this.geoFallbackCounter = Counter.builder("geo.index.fallback")
                .description("Radius queries answered by the durable store")
                .register(registry);

        this.locationAcceptedCounter = Counter.builder("location.updates")
                .tag("result", "accepted")
                .register(registry);

        this.locationSuppressedCounter = Counter.builder("location.updates")
                .tag("result", "suppressed")
                .description("Reports below the movement threshold")
                .register(registry);

        this.relayPublishedCounter = Counter.builder("realtime.relay")
                .tag("direction", "published")
                .register(registry);

        this.relayReceivedCounter = Counter.builder("realtime.relay")
                .tag("direction", "received")
                .register(registry);

        // p50, p95, p99 histogram published to Prometheus
        this.dispatchLatencyTimer = Timer.builder("dispatch.latency")
                .description("Time from order request received to offers sent")
                .publishPercentiles(0.5, 0.95, 0.99)
                .publishPercentileHistogram(true)
                .minimumExpectedValue(Duration.ofMillis(10))
                .maximumExpectedValue(Duration.ofSeconds(5))
                .register(registry);
    }

    public void recordOrderCreated()          { orderCreatedCounter.increment(); }
    public void recordOrderRejected()         { orderRejectedCounter.increment(); }
    public void recordIdempotentReplay()      { idempotentReplayCounter.increment(); }
    public void recordOffersSent(int count)   { offersSentCounter.increment(count); }
    public void recordOfferAccepted()         { offerAcceptedCounter.increment(); }
    public void recordOfferDeclined()         { offerDeclinedCounter.increment(); }
    public void recordOfferTimeout()          { offerTimeoutCounter.increment(); }
    public void recordAcceptConflict()        { acceptConflictCounter.increment(); }
    public void recordNoCandidates()          { noCandidatesCounter.increment(); }
    public void recordKillSwitchRejection()   { killSwitchCounter.increment(); }
    public void recordGeoFallback()           { geoFallbackCounter.increment(); }
    public void recordLocationAccepted()      { locationAcceptedCounter.increment(); }
    public void recordLocationSuppressed()    { locationSuppressedCounter.increment(); }
    public void recordRelayPublished()        { relayPublishedCounter.increment(); }
    public void recordRelayReceived()         { relayReceivedCounter.increment(); }
    public Timer getDispatchLatencyTimer()    { return dispatchLatencyTimer; }
}
