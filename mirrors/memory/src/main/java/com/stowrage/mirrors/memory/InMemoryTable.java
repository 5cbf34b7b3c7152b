package com.stowrage.mirrors.memory;

import com.stowrage.core.MirrorRow;

import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Rows of one store, ordered by id. Outlives the mirrors opened over it so a store can be
 * closed and replayed again.
 */
public class InMemoryTable {
    private final NavigableMap<Long, MirrorRow> rows = new TreeMap<>();

    public NavigableMap<Long, MirrorRow> getRows() {
        return rows;
    }
}
