package com.stowrage.core.errors;

public class NonPersistentException extends StowrageException {
    private final String storeName;
    private final String action;

    public NonPersistentException(String storeName, String action) {
        super(String.format("%s is not persistent and can't be %s", storeName, action));
        this.storeName = storeName;
        this.action = action;
    }

    public String getStoreName() {
        return storeName;
    }

    public String getAction() {
        return action;
    }
}
