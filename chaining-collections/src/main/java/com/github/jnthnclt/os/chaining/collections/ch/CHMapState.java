package com.github.jnthnclt.os.chaining.collections.ch;

import com.google.common.base.Preconditions;
import java.util.Arrays;

/**
 * Bucket heads plus an arena of entries. An entry is a slot in the parallel {@code keys}, {@code values} and
 * {@code nexts} arrays; a bucket is the chain of slots reachable from its head. Released slots are kept on a free
 * list threaded through {@code nexts}. The number of buckets never changes; the arena doubles when it runs out of
 * slots, up to {@code maxEntries}, and {@link #clear} shrinks it back to the initial reservation.
 *
 * Every link, unlink and clear bumps {@link #modCount()} so traversals can detect changes made underneath them.
 *
 * @author jonathan.colt
 */
public class CHMapState {

    public static final int NIL = -1;

    static final int MAX_ENTRIES = Integer.MAX_VALUE - 8;

    private final int capacity;
    private final int initialEntries;
    private final int maxEntries;
    private final int[] heads;

    private String[] keys;
    private int[] values;
    private int[] nexts;

    private int allocated;
    private int free = NIL;
    private int count;

    private long modCount;
    private int lastUnlinked = NIL;

    public CHMapState(int capacity, int initialEntries) {
        this(capacity, initialEntries, MAX_ENTRIES);
    }

    CHMapState(int capacity, int initialEntries, int maxEntries) {
        Preconditions.checkArgument(capacity > 0, "capacity must be positive but was %s", capacity);
        Preconditions.checkArgument(initialEntries > 0, "initialEntries must be positive but was %s", initialEntries);
        Preconditions.checkArgument(maxEntries >= initialEntries && maxEntries <= MAX_ENTRIES,
            "maxEntries must be in [%s, %s] but was %s", initialEntries, MAX_ENTRIES, maxEntries);
        this.capacity = capacity;
        this.initialEntries = initialEntries;
        this.maxEntries = maxEntries;
        this.heads = new int[capacity];
        Arrays.fill(heads, NIL);

        this.keys = new String[initialEntries];
        this.values = new int[initialEntries];
        this.nexts = new int[initialEntries];
    }

    public int capacity() {
        return capacity;
    }

    public int size() {
        return count;
    }

    public int entries() {
        return keys.length;
    }

    public long modCount() {
        return modCount;
    }

    /**
     * The slot released by the most recent {@link #unlink}, or {@link #NIL} if a {@link #clear} came after it.
     */
    public int lastUnlinked() {
        return lastUnlinked;
    }

    public int head(int bucket) {
        return heads[bucket];
    }

    public int next(int entry) {
        return nexts[entry];
    }

    public String key(int entry) {
        return keys[entry];
    }

    public int value(int entry) {
        return values[entry];
    }

    /**
     * Claims a slot for the entry without linking it into any bucket.
     */
    public int allocate(String key, int value) throws CHAllocationException {
        int entry;
        if (free != NIL) {
            entry = free;
            free = nexts[entry];
        } else {
            if (allocated == keys.length) {
                grow();
            }
            entry = allocated;
            allocated++;
        }
        keys[entry] = key;
        values[entry] = value;
        nexts[entry] = NIL;
        return entry;
    }

    public void linkHead(int bucket, int entry) {
        nexts[entry] = heads[bucket];
        heads[bucket] = entry;
        count++;
        modCount++;
    }

    /**
     * Unlinks {@code entry} from {@code bucket} and returns its slot to the free list. {@code previous} is the entry
     * before it in the chain, or {@link #NIL} when it is the head.
     */
    public void unlink(int bucket, int previous, int entry) {
        if (previous == NIL) {
            heads[bucket] = nexts[entry];
        } else {
            nexts[previous] = nexts[entry];
        }
        keys[entry] = null;
        values[entry] = 0;
        nexts[entry] = free;
        free = entry;
        count--;
        modCount++;
        lastUnlinked = entry;
    }

    /**
     * Releases every entry and drops the arena back to its initial reservation. Returns how many were linked.
     */
    public int clear() {
        int released = count;
        Arrays.fill(heads, NIL);
        if (keys.length > initialEntries) {
            keys = new String[initialEntries];
            values = new int[initialEntries];
            nexts = new int[initialEntries];
        } else {
            Arrays.fill(keys, 0, allocated, null);
            Arrays.fill(values, 0, allocated, 0);
        }
        allocated = 0;
        free = NIL;
        count = 0;
        modCount++;
        lastUnlinked = NIL;
        return released;
    }

    private void grow() throws CHAllocationException {
        int length = keys.length;
        if (length >= maxEntries) {
            throw new CHAllocationException("Entry arena is full at " + length + " entries");
        }
        int grown = (int) Math.min((long) length << 1, maxEntries);

        String[] grownKeys;
        int[] grownValues;
        int[] grownNexts;
        try {
            grownKeys = Arrays.copyOf(keys, grown);
            grownValues = Arrays.copyOf(values, grown);
            grownNexts = Arrays.copyOf(nexts, grown);
        } catch (OutOfMemoryError e) {
            throw new CHAllocationException("Failed to grow entry arena from " + length + " to " + grown + " entries", e);
        }
        keys = grownKeys;
        values = grownValues;
        nexts = grownNexts;
    }
}
