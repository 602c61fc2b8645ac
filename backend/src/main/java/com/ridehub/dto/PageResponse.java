package com.ridehub.dto;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Getter;

/** Paginated envelope. {@code next}/{@code previous} are absolute URLs or null. */
@Getter
@AllArgsConstructor
public class PageResponse<T> {
    private final long count;
    private final String next;
    private final String previous;
    private final int pageSize;
    private final int totalPages;
    private final int currentPage;
    private final List<T> results;
}
