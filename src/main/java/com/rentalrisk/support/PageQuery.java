package com.rentalrisk.support;

import com.rentalrisk.error.ValidationException;

/**
 * One-based page request.
 */
public record PageQuery(int page, int limit) {

    public static final int MAX_LIMIT = 100;

    public PageQuery {
        if (page < 1) {
            throw new ValidationException("page must be >= 1");
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new ValidationException("limit must be between 1 and " + MAX_LIMIT);
        }
    }

    public static PageQuery firstPage() {
        return new PageQuery(1, 20);
    }

    public long offset() {
        return (long) (page - 1) * limit;
    }
}
