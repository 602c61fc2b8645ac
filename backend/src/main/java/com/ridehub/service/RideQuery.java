package com.ridehub.service;

import java.util.Optional;

/**
 * Request-scoped listing options. Built once per request and never shared.
 */
public final class RideQuery {
    private final String status;
    private final String riderEmail;
    private final Long riderId;
    private final Long driverId;
    private final GeoPoint point;
    private final RideOrdering ordering;

    private RideQuery(Builder builder) {
        this.status = builder.status == null || builder.status.isBlank() ? null : builder.status;
        this.riderEmail = trimToNull(builder.riderEmail);
        this.riderId = builder.riderId;
        this.driverId = builder.driverId;
        this.point = GeoPoint.parse(builder.latitude, builder.longitude).orElse(null);
        this.ordering = RideOrdering.parse(builder.ordering, point != null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getStatus() { return status; }
    public String getRiderEmail() { return riderEmail; }
    public Long getRiderId() { return riderId; }
    public Long getDriverId() { return driverId; }
    public Optional<GeoPoint> getPoint() { return Optional.ofNullable(point); }
    public RideOrdering getOrdering() { return ordering; }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    @Override
    public String toString() {
        return "RideQuery{status=" + status + ", riderEmail=" + riderEmail + ", riderId=" + riderId
                + ", driverId=" + driverId + ", point=" + point + ", ordering=" + ordering + "}";
    }

    public static final class Builder {
        private String status;
        private String riderEmail;
        private Long riderId;
        private Long driverId;
        private String latitude;
        private String longitude;
        private String ordering;

        private Builder() {
        }

        public Builder status(String status) { this.status = status; return this; }
        public Builder riderEmail(String riderEmail) { this.riderEmail = riderEmail; return this; }
        public Builder riderId(Long riderId) { this.riderId = riderId; return this; }
        public Builder driverId(Long driverId) { this.driverId = driverId; return this; }
        public Builder latitude(String latitude) { this.latitude = latitude; return this; }
        public Builder longitude(String longitude) { this.longitude = longitude; return this; }
        public Builder ordering(String ordering) { this.ordering = ordering; return this; }

        public RideQuery build() {
            return new RideQuery(this);
        }
    }
}
