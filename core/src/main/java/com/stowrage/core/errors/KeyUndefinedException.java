package com.stowrage.core.errors;

/**
 * Thrown when structured data is changed without naming the key to replace.
 */
public class KeyUndefinedException extends StowrageException {

    public KeyUndefinedException() {
        super("A key is required to change the value of structured data");
    }
}
