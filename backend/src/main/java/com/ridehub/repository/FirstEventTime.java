package com.ridehub.repository;

import java.time.Instant;

/** Earliest occurrence of one event description on one ride. */
public interface FirstEventTime {
    Long getRideId();
    String getDescription();
    Instant getFirstAt();
}
