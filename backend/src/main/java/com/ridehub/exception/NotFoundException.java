package com.ridehub.exception;

public class NotFoundException extends RideHubException {

    public NotFoundException(String message) {
        super("NOT_FOUND", message);
    }

    public static NotFoundException of(String kind, Long id) {
        return new NotFoundException(kind + " " + id + " not found");
    }
}
