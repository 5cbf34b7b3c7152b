package com.stowrage.core.errors;

/**
 * A failure in the backing mirror or in encoding a value for it.
 */
public class MirrorException extends StowrageException {

    public MirrorException(String message) {
        super(message);
    }

    public MirrorException(String message, Throwable cause) {
        super(message, cause);
    }
}
