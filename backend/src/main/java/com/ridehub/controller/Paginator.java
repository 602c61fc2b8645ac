package com.ridehub.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import com.ridehub.dto.PageResponse;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Translates the 1-based {@code page} / {@code page_size} query parameters
 * into a {@link Pageable} and wraps results in the paginated envelope.
 */
@Component
public class Paginator {

    private final int defaultPageSize;
    private final int maxPageSize;

    public Paginator(@Value("${ridehub.pagination.default-page-size:10}") int defaultPageSize,
                     @Value("${ridehub.pagination.max-page-size:100}") int maxPageSize) {
        this.defaultPageSize = defaultPageSize;
        this.maxPageSize = maxPageSize;
    }

    public Pageable pageable(Integer page, Integer pageSize) {
        int number = page == null || page < 1 ? 1 : page;
        int size = pageSize == null || pageSize < 1 ? defaultPageSize : Math.min(pageSize, maxPageSize);
        // keep the row offset within what JPA accepts
        int index = Math.min(number - 1, Integer.MAX_VALUE / size);
        return PageRequest.of(index, size);
    }

    public <T> PageResponse<T> envelope(Page<T> page, HttpServletRequest request) {
        int current = page.getNumber() + 1;
        String next = page.hasNext() ? link(request, current + 1) : null;
        String previous = current > 1 && page.getTotalElements() > 0 ? link(request, current - 1) : null;
        return new PageResponse<>(page.getTotalElements(), next, previous, page.getSize(),
                page.getTotalPages(), current, page.getContent());
    }

    private static String link(HttpServletRequest request, int page) {
        return ServletUriComponentsBuilder.fromRequest(request)
                .replaceQueryParam("page", page)
                .build()
                .toUriString();
    }
}
