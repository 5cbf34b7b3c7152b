package com.stowrage.core.errors;

/**
 * Thrown when a value change names a key that the structured data does not have.
 * Keys are never created implicitly.
 */
public class InvalidKeyException extends StowrageException {
    private final String key;
    private final String storeName;

    public InvalidKeyException(String key, String storeName) {
        super(String.format("Key \"%s\" does not exist in %s", key, storeName));
        this.key = key;
        this.storeName = storeName;
    }

    public String getKey() {
        return key;
    }

    public String getStoreName() {
        return storeName;
    }
}
