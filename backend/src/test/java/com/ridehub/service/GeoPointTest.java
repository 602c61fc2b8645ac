package com.ridehub.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GeoPointTest {

    @Test
    void parsesValidCoordinates() {
        GeoPoint point = GeoPoint.parse("37.7749", " -122.4194 ").orElseThrow();
        assertThat(point.getLatitude()).isEqualTo(37.7749);
        assertThat(point.getLongitude()).isEqualTo(-122.4194);
    }

    @Test
    void boundsAreInclusive() {
        assertThat(GeoPoint.parse("90", "180")).isPresent();
        assertThat(GeoPoint.parse("-90", "-180")).isPresent();
    }

    @Test
    void unusableInputYieldsEmpty() {
        assertThat(GeoPoint.parse(null, "10")).isEmpty();
        assertThat(GeoPoint.parse("10", "")).isEmpty();
        assertThat(GeoPoint.parse("abc", "10")).isEmpty();
        assertThat(GeoPoint.parse("NaN", "10")).isEmpty();
        assertThat(GeoPoint.parse("10", "Infinity")).isEmpty();
        assertThat(GeoPoint.parse("90.5", "10")).isEmpty();
        assertThat(GeoPoint.parse("10", "-181")).isEmpty();
    }
}
