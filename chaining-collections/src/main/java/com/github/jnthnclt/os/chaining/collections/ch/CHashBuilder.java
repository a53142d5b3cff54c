package com.github.jnthnclt.os.chaining.collections.ch;

import com.google.common.base.Preconditions;

/**
 *
 * @author jonathan.colt
 */
public class CHashBuilder {

    private int capacity = -1;
    private int initialEntries = CHash.DEFAULT_INITIAL_ENTRIES;
    private CHListener listener = CHListener.NOOP;

    /**
     * Number of buckets. Required, fixed for the life of the table.
     */
    public CHashBuilder capacity(int capacity) {
        this.capacity = capacity;
        return this;
    }

    /**
     * Entry slots reserved up front. The reservation grows on demand.
     */
    public CHashBuilder initialEntries(int initialEntries) {
        this.initialEntries = initialEntries;
        return this;
    }

    public CHashBuilder listener(CHListener listener) {
        this.listener = listener;
        return this;
    }

    public CHash build() {
        Preconditions.checkNotNull(listener, "listener");
        return new CHash(new CHMapState(capacity, initialEntries), listener);
    }
}
