package com.ridedispatch.dispatch.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {
    ORDER_NOT_FOUND(HttpStatus.NOT_FOUND),
    DRIVER_NOT_FOUND(HttpStatus.NOT_FOUND),

    ORDER_NO_LONGER_AVAILABLE(HttpStatus.CONFLICT),
    ORDER_ALREADY_COMPLETED(HttpStatus.CONFLICT),
    ORDER_MODIFIED(HttpStatus.CONFLICT),
    DRIVER_BUSY(HttpStatus.CONFLICT),

    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    INVALID_OTP(HttpStatus.BAD_REQUEST),
    INVALID_STATUS_TRANSITION(HttpStatus.BAD_REQUEST),
    UNKNOWN_VEHICLE_CLASS(HttpStatus.BAD_REQUEST),
    DRIVER_OFFLINE(HttpStatus.BAD_REQUEST),

    UNAUTHORIZED(HttpStatus.UNAUTHORIZED),
    FORBIDDEN(HttpStatus.FORBIDDEN),

    SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
