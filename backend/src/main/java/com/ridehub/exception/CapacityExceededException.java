package com.ridehub.exception;

public class CapacityExceededException extends RideHubException {

    public CapacityExceededException(String message) {
        super("CAPACITY_EXCEEDED", message);
    }
}
