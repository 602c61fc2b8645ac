package com.ridehub.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class LongTripRow {
    private final String month;
    private final String driver;
    private final long tripCount;
}
