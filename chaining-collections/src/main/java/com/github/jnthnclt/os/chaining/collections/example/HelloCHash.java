package com.github.jnthnclt.os.chaining.collections.example;

import com.github.jnthnclt.os.chaining.collections.ch.CHAllocationException;
import com.github.jnthnclt.os.chaining.collections.ch.CHash;
import com.github.jnthnclt.os.chaining.collections.ch.CHashBuilder;
import com.github.jnthnclt.os.chaining.collections.ch.CHashPrinter;
import com.github.jnthnclt.os.chaining.collections.ch.CHasher;
import com.github.jnthnclt.os.chaining.collections.ch.Djb2CHasher;
import com.github.jnthnclt.os.chaining.collections.ch.FibonacciCHasher;
import com.github.jnthnclt.os.chaining.collections.ch.FirstCharCHasher;
import com.github.jnthnclt.os.chaining.collections.ch.LoggingCHListener;
import com.github.jnthnclt.os.chaining.log.ChainingLogger;
import com.github.jnthnclt.os.chaining.log.ChainingLoggerFactory;
import java.util.LinkedHashMap;
import java.util.Map;

public class HelloCHash {

    private static final ChainingLogger LOG = ChainingLoggerFactory.getLogger();

    public static final CHasher[] HASHERS = {
        FirstCharCHasher.SINGLETON,
        Djb2CHasher.SINGLETON,
        FibonacciCHasher.SINGLETON
    };

    private static final String[] WORDS = {
        "apple", "ant", "arc", "banana", "bear", "cherry", "cat", "dog", "delta", "eagle",
        "echo", "fig", "fox", "grape", "gamma", "hotel", "india", "juliet", "kilo", "lima"
    };

    public static void main(String[] args) throws Exception {
        String[] keys = args.length > 0 ? args : WORDS;
        int capacity = 16;

        for (CHasher hasher : HASHERS) {
            CHash table = load(new CHashBuilder().capacity(capacity).listener(LoggingCHListener.SINGLETON).build(), hasher, keys);
            LOG.info("hasher:{} capacity:{} total:{} collisions:{}", hasher, capacity, table.size(), table.collisions());
            CHashPrinter.print(table, System.out);

            for (String key : keys) {
                table.remove(hasher, key);
            }
            table.destroy();
        }
    }

    /**
     * Loads {@code keys} into a fresh table per hasher and reports each table's collision count.
     */
    public static Map<CHasher, Integer> collisionsByHasher(String[] keys, int capacity) throws CHAllocationException {
        Map<CHasher, Integer> collisions = new LinkedHashMap<>();
        for (CHasher hasher : HASHERS) {
            CHash table = load(new CHash(capacity), hasher, keys);
            collisions.put(hasher, table.collisions());
            table.destroy();
        }
        return collisions;
    }

    private static CHash load(CHash table, CHasher hasher, String[] keys) throws CHAllocationException {
        for (int i = 0; i < keys.length; i++) {
            table.put(hasher, keys[i], i);
        }
        return table;
    }
}
