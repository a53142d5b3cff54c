package com.github.jnthnclt.os.chaining.collections.ch;

/**
 * Observes table mutations. Every method defaults to doing nothing.
 *
 * @author jonathan.colt
 */
public interface CHListener {

    CHListener NOOP = new CHListener() {
    };

    default void inserted(int bucket, String key, int value) {
    }

    default void removed(int bucket, String key, int value) {
    }

    default void notFound(int bucket, String key) {
    }

    default void cleared(int capacity, int released) {
    }
}
