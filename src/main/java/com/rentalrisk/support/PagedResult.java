package com.rentalrisk.support;

import java.util.List;
import java.util.stream.Stream;

public record PagedResult<T>(
    List<T> items,
    int page,
    int limit,
    long total,
    int totalPages
) {

    /**
     * Slices an already ordered stream. The caller owns the ordering.
     */
    public static <T> PagedResult<T> of(List<T> ordered, PageQuery query) {
        List<T> items = ordered.stream()
            .skip(query.offset())
            .limit(query.limit())
            .toList();
        int totalPages = (int) Math.ceil(ordered.size() / (double) query.limit());
        return new PagedResult<>(items, query.page(), query.limit(), ordered.size(), totalPages);
    }

    public static <T> PagedResult<T> of(Stream<T> ordered, PageQuery query) {
        return of(ordered.toList(), query);
    }
}
