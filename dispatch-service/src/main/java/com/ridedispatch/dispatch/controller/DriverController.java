package com.ridedispatch.dispatch.controller;

import com.ridedispatch.dispatch.config.DispatchProperties;
import com.ridedispatch.dispatch.exception.DispatchException;
import com.ridedispatch.dispatch.exception.ErrorCode;
import com.ridedispatch.dispatch.location.DriverLocationService;
import com.ridedispatch.dispatch.model.AvailabilityRequest;
import com.ridedispatch.dispatch.model.DriverCandidate;
import com.ridedispatch.dispatch.model.DriverStatusResponse;
import com.ridedispatch.dispatch.model.LocationUpdateRequest;
import com.ridedispatch.dispatch.model.LocationUpdateResult;
import com.ridedispatch.dispatch.security.IdentityInterceptor;
import com.ridedispatch.dispatch.service.DriverCandidateService;
import com.ridedispatch.shared.dto.ApiResponse;
import com.ridedispatch.shared.enums.OrderType;
import com.ridedispatch.shared.enums.VehicleClass;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

@Validated
@RestController
@RequestMapping("/drivers")
@RequiredArgsConstructor
public class DriverController {

    private final DriverLocationService locationService;
    private final DriverCandidateService candidateService;
    private final DispatchProperties properties;

    @PostMapping("/me/location")
    public ResponseEntity<ApiResponse<LocationUpdateResult>> reportLocation(
            @RequestAttribute(IdentityInterceptor.USER_ID_ATTRIBUTE) String userId,
            @Valid @RequestBody LocationUpdateRequest request) {
        String driverId = locationService.requireDriverByUserId(userId).getId();
        return ResponseEntity.ok(ApiResponse.ok(locationService.reportLocation(
                driverId, request.getLatitude(), request.getLongitude(), request.getHeading())));
    }

    @PatchMapping("/me/availability")
    public ResponseEntity<ApiResponse<DriverStatusResponse>> updateAvailability(
            @RequestAttribute(IdentityInterceptor.USER_ID_ATTRIBUTE) String userId,
            @Valid @RequestBody AvailabilityRequest request) {
        String driverId = locationService.requireDriverByUserId(userId).getId();
        return ResponseEntity.ok(ApiResponse.ok(locationService.updateAvailability(driverId, request)));
    }

    @GetMapping("/me")
    public ResponseEntity<ApiResponse<DriverStatusResponse>> me(
            @RequestAttribute(IdentityInterceptor.USER_ID_ATTRIBUTE) String userId) {
        String driverId = locationService.requireDriverByUserId(userId).getId();
        return ResponseEntity.ok(ApiResponse.ok(locationService.getStatus(driverId)));
    }

    @GetMapping("/nearby")
    public ResponseEntity<ApiResponse<List<DriverCandidate>>> nearby(
            @RequestParam("latitude") @DecimalMin("-90.0") @DecimalMax("90.0") double latitude,
            @RequestParam("longitude") @DecimalMin("-180.0") @DecimalMax("180.0") double longitude,
            @RequestParam(value = "radiusKm", required = false) @DecimalMin("0.1") @DecimalMax("50.0") Double radiusKm,
            @RequestParam(value = "type", required = false) OrderType type,
            @RequestParam(value = "vehicleClass", required = false) String vehicleClass,
            @RequestParam(value = "limit", defaultValue = "20") @Min(1) @Max(100) int limit) {

        double radius = radiusKm != null ? radiusKm : properties.getSearch().getRadiusKm();
        VehicleClass cls = vehicleClass == null ? null : parseVehicleClass(type, vehicleClass);
        return ResponseEntity.ok(ApiResponse.ok(
                candidateService.findCandidates(latitude, longitude, radius, type, cls, List.of(), limit)));
    }

    private static VehicleClass parseVehicleClass(OrderType type, String code) {
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(VehicleClass.values())
                .filter(c -> c.name().equals(normalized))
                .filter(c -> type == null || c.getOrderType() == type)
                .findFirst()
                .orElseThrow(() -> new DispatchException(ErrorCode.UNKNOWN_VEHICLE_CLASS,
                        "Unknown vehicle class '" + code + "'"));
    }
}
