package com.github.jnthnclt.os.chaining.collections.ch;

/**
 * Maps a key to a bucket of a table with the given capacity. Implementations must be stateless and
 * deterministic, must accept any non-null key including the empty string, and must return an index in
 * {@code [0, capacity)}.
 *
 * @author jonathan.colt
 */
public interface CHasher {

    int index(String key, int capacity);

}
