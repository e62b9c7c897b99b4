package com.openforge.numen.repository;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;

/**
 * Row-offset paging for LIMIT/OFFSET listings. {@link PageRequest} can only
 * start at multiples of the page size.
 */
public final class OffsetPageRequest extends PageRequest {

    private final long offset;

    public OffsetPageRequest(long offset, int limit) {
        super(0, limit, Sort.unsorted());
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        this.offset = offset;
    }

    @Override
    public long getOffset() {
        return offset;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof OffsetPageRequest other && super.equals(other) && offset == other.offset;
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + Long.hashCode(offset);
    }
}
