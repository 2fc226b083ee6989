package com.qoeboost.api.storage;

import com.qoeboost.api.exception.ValidationFailedException;
import lombok.Value;

/**
 * Validated offset/limit window for list operations.
 */
@Value
public class Paging {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 100;

    int offset;
    int limit;

    public static Paging of(int offset, int limit) {
        if (offset < 0) {
            throw new ValidationFailedException("offset", "offset must be >= 0");
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new ValidationFailedException("limit", "limit must be between 1 and " + MAX_LIMIT);
        }
        return new Paging(offset, limit);
    }
}
