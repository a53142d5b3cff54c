package com.github.jnthnclt.os.chaining.collections.ch;

/**
 * djb2: seed 5381, {@code hash = hash * 33 + c} per character, treated as an unsigned 64 bit value.
 *
 * @author jonathan.colt
 */
public class Djb2CHasher implements CHasher {

    public static final Djb2CHasher SINGLETON = new Djb2CHasher();

    private static final long SEED = 5381L;

    private Djb2CHasher() {
    }

    public static long hash(String key) {
        long hash = SEED;
        for (int i = 0; i < key.length(); i++) {
            hash = ((hash << 5) + hash) + key.charAt(i);
        }
        return hash;
    }

    @Override
    public int index(String key, int capacity) {
        return (int) Long.remainderUnsigned(hash(key), capacity);
    }

    @Override
    public String toString() {
        return "djb2";
    }
}
