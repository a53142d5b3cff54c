package com.github.jnthnclt.os.chaining.collections.ch;

/**
 * Polynomial rolling hash (multiplier 31) folded through Knuth's multiplicative method: the fractional part of
 * {@code hash * 0.6180339887} scaled by the capacity.
 *
 * @author jonathan.colt
 */
public class FibonacciCHasher implements CHasher {

    public static final FibonacciCHasher SINGLETON = new FibonacciCHasher();

    private static final double GOLDEN_RATIO_FRACTION = 0.6180339887d;

    private FibonacciCHasher() {
    }

    public static int hash(String key) {
        int hash = 0;
        for (int i = 0; i < key.length(); i++) {
            hash = 31 * hash + key.charAt(i);
        }
        return hash & 0x7fffffff;
    }

    @Override
    public int index(String key, int capacity) {
        double product = hash(key) * GOLDEN_RATIO_FRACTION;
        double fraction = product - Math.floor(product);
        // capacity * fraction can round up to capacity when fraction is within an ulp of 1
        return Math.min((int) (capacity * fraction), capacity - 1);
    }

    @Override
    public String toString() {
        return "fibonacci";
    }
}
