package com.ridehub.service;

import org.springframework.data.domain.Sort;

public enum RideOrdering {
    PICKUP_TIME_ASC("pickupTime", Sort.Direction.ASC),
    PICKUP_TIME_DESC("pickupTime", Sort.Direction.DESC),
    DISTANCE_ASC(null, Sort.Direction.ASC),
    DISTANCE_DESC(null, Sort.Direction.DESC),
    ID_ASC("id", Sort.Direction.ASC),
    ID_DESC("id", Sort.Direction.DESC),
    STATUS_ASC("status", Sort.Direction.ASC),
    STATUS_DESC("status", Sort.Direction.DESC);

    public static final RideOrdering DEFAULT = PICKUP_TIME_DESC;

    private final String property;
    private final Sort.Direction direction;

    RideOrdering(String property, Sort.Direction direction) {
        this.property = property;
        this.direction = direction;
    }

    public boolean isDistance() {
        return property == null;
    }

    public Sort.Direction getDirection() {
        return direction;
    }

    /** Storage sort with ride id ascending as the tie-breaker. Not defined for distance orderings. */
    public Sort toSort() {
        if (isDistance()) {
            throw new IllegalStateException("Distance ordering is applied in memory");
        }
        Sort sort = Sort.by(direction, property);
        return "id".equals(property) ? sort : sort.and(Sort.by(Sort.Direction.ASC, "id"));
    }

    /**
     * Resolves a raw {@code ordering} parameter. Unknown values fall back to the
     * default, as does a distance ordering when no geolocation is available.
     */
    public static RideOrdering parse(String raw, boolean geolocated) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT;
        }
        String value = raw.trim();
        boolean descending = value.startsWith("-");
        String key = descending ? value.substring(1) : value;
        RideOrdering ordering;
        switch (key) {
            case "pickupTime":
            case "pickup_time":
                ordering = descending ? PICKUP_TIME_DESC : PICKUP_TIME_ASC;
                break;
            case "distance":
            case "distanceToPickup":
            case "distance_to_pickup":
                ordering = descending ? DISTANCE_DESC : DISTANCE_ASC;
                break;
            case "id":
                ordering = descending ? ID_DESC : ID_ASC;
                break;
            case "status":
                ordering = descending ? STATUS_DESC : STATUS_ASC;
                break;
            default:
                return DEFAULT;
        }
        if (ordering.isDistance() && !geolocated) {
            return DEFAULT;
        }
        return ordering;
    }
}
