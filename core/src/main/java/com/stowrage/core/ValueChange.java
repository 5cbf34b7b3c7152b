package com.stowrage.core;

/**
 * Describes a partial or whole replacement of an entry's data.
 *
 * @param key   field to replace when the data is structured; ignored for scalar data
 * @param value the new value
 */
public record ValueChange(String key, Object value) {

    public static ValueChange of(Object value) {
        return new ValueChange(null, value);
    }

    public static ValueChange of(String key, Object value) {
        return new ValueChange(key, value);
    }
}
