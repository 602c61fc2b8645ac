package com.ridehub.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Rejected input. Carries every failing field with its messages so a caller
 * sees all problems at once.
 */
public class ValidationException extends RideHubException {

    public static final String CODE = "VALIDATION_ERROR";

    private final Map<String, List<String>> fields;

    public ValidationException(Map<String, List<String>> fields) {
        super(CODE, summarize(fields));
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public ValidationException(String field, String message) {
        this(Map.of(field, List.of(message)));
    }

    public Map<String, List<String>> getFields() {
        return fields;
    }

    private static String summarize(Map<String, List<String>> fields) {
        return fields.entrySet().stream()
                .map(e -> e.getKey() + ": " + String.join("; ", e.getValue()))
                .collect(Collectors.joining(", "));
    }
}
