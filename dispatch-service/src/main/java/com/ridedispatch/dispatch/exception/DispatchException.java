package com.ridedispatch.dispatch.exception;

/**
 * Typed, user-actionable failure of a dispatch operation.
 */
public class DispatchException extends RuntimeException {

    private final ErrorCode code;

    public DispatchException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    public static DispatchException orderNotFound(Object orderId) {
        return new DispatchException(ErrorCode.ORDER_NOT_FOUND, "Order " + orderId + " not found");
    }

    public static DispatchException driverNotFound(String driverOrUserId) {
        return new DispatchException(ErrorCode.DRIVER_NOT_FOUND, "No driver profile for " + driverOrUserId);
    }
}
