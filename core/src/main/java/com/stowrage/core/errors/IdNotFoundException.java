package com.stowrage.core.errors;

public class IdNotFoundException extends StowrageException {
    private final long id;

    public IdNotFoundException(long id) {
        super(String.format("No entry with id %d", id));
        this.id = id;
    }

    public long getId() {
        return id;
    }
}
