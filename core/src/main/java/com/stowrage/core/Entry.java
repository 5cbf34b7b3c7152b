package com.stowrage.core;

/**
 * A stored record. The id is assigned once by the owning {@link Stowrage} and survives overrides.
 */
public record Entry<T>(
        long id,
        String name,
        T data
){}
