package com.qoeboost.api.storage;

import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

/**
 * Pageable over an arbitrary offset rather than a page number, ordered by id
 * so durable listings follow insertion order like the fallback store.
 */
class OffsetLimitRequest implements Pageable {

    private static final Sort BY_ID = Sort.by(Sort.Direction.ASC, "id");

    private final long offset;
    private final int limit;

    OffsetLimitRequest(Paging paging) {
        this(paging.getOffset(), paging.getLimit());
    }

    private OffsetLimitRequest(long offset, int limit) {
        this.offset = offset;
        this.limit = limit;
    }

    @Override
    public int getPageNumber() {
        return (int) (offset / limit);
    }

    @Override
    public int getPageSize() {
        return limit;
    }

    @Override
    public long getOffset() {
        return offset;
    }

    @Override
    public Sort getSort() {
        return BY_ID;
    }

    @Override
    public Pageable next() {
        return new OffsetLimitRequest(offset + limit, limit);
    }

    @Override
    public Pageable previousOrFirst() {
        return hasPrevious() ? new OffsetLimitRequest(Math.max(0, offset - limit), limit) : first();
    }

    @Override
    public Pageable first() {
        return new OffsetLimitRequest(0, limit);
    }

    @Override
    public Pageable withPage(int pageNumber) {
        return new OffsetLimitRequest((long) pageNumber * limit, limit);
    }

    @Override
    public boolean hasPrevious() {
        return offset > 0;
    }
}
