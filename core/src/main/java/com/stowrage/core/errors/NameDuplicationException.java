package com.stowrage.core.errors;

public class NameDuplicationException extends StowrageException {
    private final String name;

    public NameDuplicationException(String name) {
        super(String.format("An entry named \"%s\" already exists", name));
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
