package com.stowrage.core.errors;

public class NameNotFoundException extends StowrageException {
    private final String name;

    public NameNotFoundException(String name) {
        super(String.format("No entry named \"%s\"", name));
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
