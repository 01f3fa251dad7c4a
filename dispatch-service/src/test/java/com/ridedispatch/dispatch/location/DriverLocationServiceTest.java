package com.ridedispatch.dispatch.location;

import com.ridedispatch.dispatch.config.DispatchProperties;
import com.ridedispatch.dispatch.entity.DispatchOrder;
import com.ridedispatch.dispatch.entity.Driver;
import com.ridedispatch.dispatch.exception.DispatchException;
import com.ridedispatch.dispatch.exception.ErrorCode;
import com.ridedispatch.dispatch.geo.GeoIndex;
import com.ridedispatch.dispatch.messaging.EventPublisher;
import com.ridedispatch.dispatch.metrics.DispatchMetrics;
import com.ridedispatch.dispatch.model.AvailabilityRequest;
import com.ridedispatch.dispatch.model.DriverStatusResponse;
import com.ridedispatch.dispatch.model.LocationUpdateResult;
import com.ridedispatch.dispatch.realtime.Channels;
import com.ridedispatch.dispatch.realtime.RealtimeGateway;
import com.ridedispatch.dispatch.realtime.RealtimeMessage;
import com.ridedispatch.dispatch.repository.DriverRepository;
import com.ridedispatch.dispatch.repository.OrderRepository;
import com.ridedispatch.shared.enums.AvailabilityType;
import com.ridedispatch.shared.enums.OrderStatus;
import com.ridedispatch.shared.enums.VehicleType;
import com.ridedispatch.shared.featureflag.FeatureFlagService;
import com.ridedispatch.shared.util.GeoUtils;
import com.ridedispatch.shared.util.KafkaTopics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DriverLocationServiceTest {

    // ~0.0009 degrees of latitude is 100 m
    private static final double BASE_LAT = 34.0;
    private static final double BASE_LNG = -6.8;

    @Mock private DriverRepository driverRepository;
    @Mock private OrderRepository orderRepository;
    @Mock private GeoIndex geoIndex;
    @Mock private RealtimeGateway realtimeGateway;
    @Mock private EventPublisher eventPublisher;
    @Mock private FeatureFlagService featureFlagService;

    private SimpleMeterRegistry meterRegistry;
    private DriverLocationService service;
    private Driver driver;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        service = new DriverLocationService(driverRepository, orderRepository, geoIndex, realtimeGateway,
                eventPublisher, featureFlagService, new DispatchProperties(), new DispatchMetrics(meterRegistry));

        driver = Driver.builder()
                .id("drv-1")
                .userId("user-1")
                .online(true)
                .availabilityType(AvailabilityType.BOTH)
                .vehicleType(VehicleType.CAR)
                .currentLat(BASE_LAT)
                .currentLng(BASE_LNG)
                .build();
        when(driverRepository.findById("drv-1")).thenReturn(Optional.of(driver));
        when(orderRepository.findFirstByDriverIdAndStatusInOrderByAcceptedAtDesc(anyString(), anyCollection()))
                .thenReturn(Optional.empty());
        when(featureFlagService.isEnabled(FeatureFlagService.REAL_TIME_TRACKING, true)).thenReturn(true);
    }

    @Test
    @DisplayName("Offline drivers cannot report a location")
    void offlineDriverRejected() {
        driver.setOnline(false);

        assertThatThrownBy(() -> service.reportLocation("drv-1", BASE_LAT + 0.01, BASE_LNG, null))
                .isInstanceOf(DispatchException.class)
                .extracting(e -> ((DispatchException) e).getCode())
                .isEqualTo(ErrorCode.DRIVER_OFFLINE);
        verify(driverRepository, never()).updateLocation(anyString(), anyDouble(), anyDouble(), any(), any());
    }

    @Test
    @DisplayName("Unknown driver is DRIVER_NOT_FOUND")
    void unknownDriver() {
        when(driverRepository.findById("ghost")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.reportLocation("ghost", BASE_LAT, BASE_LNG, null))
                .extracting(e -> ((DispatchException) e).getCode())
                .isEqualTo(ErrorCode.DRIVER_NOT_FOUND);
    }

    @Test
    @DisplayName("A move under 80 m is suppressed: no store, index, or event writes")
    void smallMoveSuppressed() {
        LocationUpdateResult result = service.reportLocation("drv-1", BASE_LAT + 0.0005, BASE_LNG, 90.0);

        assertThat(result.updated()).isFalse();
        assertThat(result.distanceMeters()).isLessThan(80.0);
        verify(driverRepository, never()).updateLocation(anyString(), anyDouble(), anyDouble(), any(), any());
        verify(geoIndex, never()).upsert(anyString(), anyDouble(), anyDouble(), any());
        verify(eventPublisher, never()).publish(anyString(), anyString(), any());
        assertThat(meterRegistry.get("location.updates").tag("result", "suppressed").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("A suppressed report keeps the driver indexed by extending its lease at the stored position")
    void suppressedReportRefreshesLease() {
        service.reportLocation("drv-1", BASE_LAT + 0.0001, BASE_LNG, 180.0);

        verify(geoIndex).refresh("drv-1", BASE_LAT, BASE_LNG, null);
        verify(geoIndex, never()).upsert(anyString(), anyDouble(), anyDouble(), any());
        verify(driverRepository, never()).updateLocation(anyString(), anyDouble(), anyDouble(), any(), any());
        verify(eventPublisher, never()).publish(anyString(), anyString(), any());
    }

    @Test
    @DisplayName("A move of exactly 80 m is accepted")
    void exactlyThresholdAccepted() {
        double lat = latitudeAt(80.0);

        LocationUpdateResult result = service.reportLocation("drv-1", lat, BASE_LNG, null);

        assertThat(result.updated()).isTrue();
        assertThat(result.distanceMeters()).isCloseTo(80.0, within(1e-6));
        verify(geoIndex).upsert("drv-1", lat, BASE_LNG, null);
        verify(geoIndex, never()).refresh(anyString(), anyDouble(), anyDouble(), any());
    }

    @Test
    @DisplayName("A move just under 80 m is suppressed and reports the distance moved")
    void justUnderThresholdSuppressed() {
        LocationUpdateResult result = service.reportLocation("drv-1", latitudeAt(79.9), BASE_LNG, null);

        assertThat(result.updated()).isFalse();
        assertThat(result.distanceMeters()).isCloseTo(79.9, within(0.01));
        verify(driverRepository, never()).updateLocation(anyString(), anyDouble(), anyDouble(), any(), any());
    }

    @Test
    @DisplayName("A move of 100 m updates the store and the index and republishes the event")
    void largeMoveAccepted() {
        double lat = BASE_LAT + 0.0009;

        LocationUpdateResult result = service.reportLocation("drv-1", lat, BASE_LNG, 45.0);

        assertThat(result.updated()).isTrue();
        assertThat(result.distanceMeters()).isGreaterThan(80.0);
        verify(driverRepository).updateLocation(eq("drv-1"), eq(lat), eq(BASE_LNG), eq(45.0), any(Instant.class));
        verify(geoIndex).upsert("drv-1", lat, BASE_LNG, 45.0);
        verify(eventPublisher).publish(eq(KafkaTopics.DRIVER_LOCATION_UPDATED), eq("drv-1"), any());
        verify(realtimeGateway, never()).broadcast(anyString(), any());
    }

    @Test
    @DisplayName("The first report of a driver without a stored position is always accepted")
    void firstReportAccepted() {
        driver.setCurrentLat(null);
        driver.setCurrentLng(null);

        LocationUpdateResult result = service.reportLocation("drv-1", BASE_LAT, BASE_LNG, null);

        assertThat(result.updated()).isTrue();
        assertThat(result.distanceMeters()).isNull();
        verify(geoIndex).upsert("drv-1", BASE_LAT, BASE_LNG, null);
    }

    @Test
    @DisplayName("A driver on an active order streams the position to the order channel")
    void activeOrderStreamsToChannel() {
        UUID orderId = UUID.randomUUID();
        DispatchOrder order = DispatchOrder.builder()
                .id(orderId)
                .status(OrderStatus.DRIVER_ARRIVING)
                .riderId("rider-1")
                .driverId("drv-1")
                .pickupLat(BASE_LAT + 0.01)
                .pickupLng(BASE_LNG)
                .dropoffLat(BASE_LAT + 0.05)
                .dropoffLng(BASE_LNG)
                .build();
        when(orderRepository.findFirstByDriverIdAndStatusInOrderByAcceptedAtDesc(eq("drv-1"), anyCollection()))
                .thenReturn(Optional.of(order));

        service.reportLocation("drv-1", BASE_LAT + 0.0009, BASE_LNG, 0.0);

        ArgumentCaptor<RealtimeMessage> message = ArgumentCaptor.forClass(RealtimeMessage.class);
        verify(realtimeGateway).broadcast(eq(Channels.order(orderId)), message.capture());
        assertThat(message.getValue().getType()).isEqualTo(RealtimeMessage.DRIVER_LOCATION);
        @SuppressWarnings("unchecked")
        Map<String, Object> payload = (Map<String, Object>) message.getValue().getPayload();
        assertThat(payload).containsEntry("orderId", orderId).containsEntry("driverId", "drv-1");
        assertThat((Integer) payload.get("etaMinutes")).isPositive();
    }

    @Test
    @DisplayName("Tracking flag off: the location is stored but not streamed")
    void trackingFlagOff() {
        DispatchOrder order = DispatchOrder.builder()
                .id(UUID.randomUUID())
                .status(OrderStatus.IN_PROGRESS)
                .riderId("rider-1")
                .driverId("drv-1")
                .build();
        when(orderRepository.findFirstByDriverIdAndStatusInOrderByAcceptedAtDesc(eq("drv-1"), anyCollection()))
                .thenReturn(Optional.of(order));
        when(featureFlagService.isEnabled(FeatureFlagService.REAL_TIME_TRACKING, true)).thenReturn(false);

        service.reportLocation("drv-1", BASE_LAT + 0.0009, BASE_LNG, null);

        verify(geoIndex).upsert(eq("drv-1"), anyDouble(), anyDouble(), any());
        verify(realtimeGateway, never()).broadcast(anyString(), any());
    }

    // latitude due north of the base position at the given great-circle distance, never closer
    private static double latitudeAt(double meters) {
        double lat = BASE_LAT + Math.toDegrees(meters / (GeoUtils.EARTH_RADIUS_KM * 1000.0));
        while (GeoUtils.haversineMeters(BASE_LAT, BASE_LNG, lat, BASE_LNG) < meters) {
            lat = Math.nextUp(lat);
        }
        return lat;
    }

    @Test
    @DisplayName("Going offline removes the driver from the index")
    void goOffline() {
        DriverStatusResponse status = service.updateAvailability("drv-1", new AvailabilityRequest(false, null));

        assertThat(status.isOnline()).isFalse();
        assertThat(status.getAvailabilityType()).isEqualTo(AvailabilityType.BOTH);
        verify(driverRepository).updateAvailability("drv-1", false, AvailabilityType.BOTH);
        verify(geoIndex).remove("drv-1");
    }

    @Test
    @DisplayName("Going online with a known position re-indexes the driver")
    void goOnline() {
        driver.setOnline(false);

        DriverStatusResponse status = service.updateAvailability("drv-1",
                new AvailabilityRequest(true, AvailabilityType.DELIVERY));

        assertThat(status.isOnline()).isTrue();
        assertThat(status.getAvailabilityType()).isEqualTo(AvailabilityType.DELIVERY);
        verify(geoIndex).upsert("drv-1", BASE_LAT, BASE_LNG, null);
    }
}
