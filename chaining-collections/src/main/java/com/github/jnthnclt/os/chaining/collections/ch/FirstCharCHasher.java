package com.github.jnthnclt.os.chaining.collections.ch;

/**
 * Buckets by the first character of the key. Keys sharing a first character always collide, which makes this
 * the baseline the other hashers are measured against.
 *
 * @author jonathan.colt
 */
public class FirstCharCHasher implements CHasher {

    public static final FirstCharCHasher SINGLETON = new FirstCharCHasher();

    private FirstCharCHasher() {
    }

    @Override
    public int index(String key, int capacity) {
        if (key.isEmpty()) {
            return 0;
        }
        return key.charAt(0) % capacity;
    }

    @Override
    public String toString() {
        return "firstChar";
    }
}
