package com.github.jnthnclt.os.chaining.collections.ch;

/**
 *
 * @author jonathan.colt
 */
public interface CHEntryStream {

    boolean entry(int bucket, String key, int value) throws Exception;
}
