package com.ridehub.exception;

public class RideHubException extends RuntimeException {

    private final String code;

    public RideHubException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
