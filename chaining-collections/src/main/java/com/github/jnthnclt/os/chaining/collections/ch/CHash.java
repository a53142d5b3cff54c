package com.github.jnthnclt.os.chaining.collections.ch;

import com.google.common.base.Preconditions;
import java.util.ConcurrentModificationException;
import java.util.OptionalInt;

/**
 * Fixed capacity string to int table resolving collisions by separate chaining. The hasher is chosen by the caller
 * on every keyed operation, so the same table can be probed with different hashers. Keys are not unique: putting a
 * key that is already present adds another entry in front of it, and {@link #remove} and {@link #get} act on the
 * most recently put one.
 *
 * Not thread safe. Share it behind a single exclusive lock or not at all.
 *
 * @author jonathan.colt
 */
public class CHash {

    public static final int DEFAULT_INITIAL_ENTRIES = 16;

    private final CHListener listener;
    private CHMapState state;

    public CHash(int capacity) {
        this(new CHMapState(capacity, DEFAULT_INITIAL_ENTRIES), CHListener.NOOP);
    }

    public CHash(CHMapState state, CHListener listener) {
        this.state = Preconditions.checkNotNull(state, "state");
        this.listener = Preconditions.checkNotNull(listener, "listener");
    }

    public int capacity() {
        return state().capacity();
    }

    public int size() {
        return state().size();
    }

    public boolean isDestroyed() {
        return state == null;
    }

    public void put(CHasher hasher, String key, int value) throws CHAllocationException {
        CHMapState s = state();
        int bucket = bucket(s, hasher, key);
        int entry = s.allocate(key, value);
        s.linkHead(bucket, entry);
        listener.inserted(bucket, key, value);
    }

    /**
     * Removes the first entry for {@code key} in its bucket, head to tail.
     *
     * @return false if the bucket holds no such key, in which case nothing changed
     */
    public boolean remove(CHasher hasher, String key) {
        CHMapState s = state();
        int bucket = bucket(s, hasher, key);
        int previous = CHMapState.NIL;
        for (int entry = s.head(bucket); entry != CHMapState.NIL; previous = entry, entry = s.next(entry)) {
            if (key.equals(s.key(entry))) {
                int value = s.value(entry);
                s.unlink(bucket, previous, entry);
                listener.removed(bucket, key, value);
                return true;
            }
        }
        listener.notFound(bucket, key);
        return false;
    }

    public OptionalInt get(CHasher hasher, String key) {
        CHMapState s = state();
        int bucket = bucket(s, hasher, key);
        for (int entry = s.head(bucket); entry != CHMapState.NIL; entry = s.next(entry)) {
            if (key.equals(s.key(entry))) {
                return OptionalInt.of(s.value(entry));
            }
        }
        return OptionalInt.empty();
    }

    public boolean contains(CHasher hasher, String key) {
        return get(hasher, key).isPresent();
    }

    /**
     * Sum over all buckets of {@code max(length - 1, 0)}.
     */
    public int collisions() {
        CHMapState s = state();
        int collisions = 0;
        for (int bucket = 0; bucket < s.capacity(); bucket++) {
            int length = bucketLength(s, bucket);
            if (length > 1) {
                collisions += length - 1;
            }
        }
        return collisions;
    }

    public int bucketLength(int bucket) {
        CHMapState s = state();
        Preconditions.checkElementIndex(bucket, s.capacity(), "bucket");
        return bucketLength(s, bucket);
    }

    private static int bucketLength(CHMapState s, int bucket) {
        int length = 0;
        for (int entry = s.head(bucket); entry != CHMapState.NIL; entry = s.next(entry)) {
            length++;
        }
        return length;
    }

    /**
     * Drops every entry. Capacity is unchanged.
     */
    public void clear() {
        CHMapState s = state();
        int released = s.clear();
        listener.cleared(s.capacity(), released);
    }

    /**
     * Drops every entry and the storage behind them. Any later call on this table fails.
     */
    public void destroy() {
        CHMapState s = state();
        s.clear();
        state = null;
    }

    /**
     * Visits every entry in bucket order, head to tail within a bucket, until the stream returns false. The stream
     * may remove the entry it is visiting; any other change to the table made from the stream fails the traversal
     * with {@link ConcurrentModificationException}.
     *
     * @return false if the stream stopped the traversal
     */
    public boolean stream(CHEntryStream stream) throws Exception {
        Preconditions.checkNotNull(stream, "stream");
        CHMapState s = state();
        for (int bucket = 0; bucket < s.capacity(); bucket++) {
            if (!stream(s, bucket, stream)) {
                return false;
            }
        }
        return true;
    }

    public boolean streamBucket(int bucket, CHEntryStream stream) throws Exception {
        Preconditions.checkNotNull(stream, "stream");
        CHMapState s = state();
        Preconditions.checkElementIndex(bucket, s.capacity(), "bucket");
        return stream(s, bucket, stream);
    }

    private static boolean stream(CHMapState s, int bucket, CHEntryStream stream) throws Exception {
        int entry = s.head(bucket);
        while (entry != CHMapState.NIL) {
            int next = s.next(entry);
            long modCount = s.modCount();
            boolean more = stream.entry(bucket, s.key(entry), s.value(entry));
            checkUnmodified(s, modCount, entry);
            if (!more) {
                return false;
            }
            entry = next;
        }
        return true;
    }

    /**
     * The stream may remove the entry it was handed and nothing else.
     */
    private static void checkUnmodified(CHMapState s, long modCount, int entry) {
        long now = s.modCount();
        if (now != modCount && !(now == modCount + 1 && s.lastUnlinked() == entry)) {
            throw new ConcurrentModificationException("table changed while streaming bucket entry " + entry);
        }
    }

    private static int bucket(CHMapState s, CHasher hasher, String key) {
        Preconditions.checkNotNull(hasher, "hasher");
        Preconditions.checkNotNull(key, "key");
        int bucket = hasher.index(key, s.capacity());
        Preconditions.checkElementIndex(bucket, s.capacity(), "bucket");
        return bucket;
    }

    private CHMapState state() {
        Preconditions.checkState(state != null, "table has been destroyed");
        return state;
    }
}
