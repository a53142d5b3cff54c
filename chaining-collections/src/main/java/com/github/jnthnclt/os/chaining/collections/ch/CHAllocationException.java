package com.github.jnthnclt.os.chaining.collections.ch;

/**
 * Thrown when entry storage cannot be grown. Nothing has been linked into the table when this is thrown.
 *
 * @author jonathan.colt
 */
public class CHAllocationException extends Exception {

    public CHAllocationException() {
    }

    public CHAllocationException(String message) {
        super(message);
    }

    public CHAllocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
