package com.stowrage.mirrors.memory;

import com.stowrage.core.Mirror;
import com.stowrage.core.MirrorRow;
import com.stowrage.core.errors.MirrorException;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;

/**
 * A mirror that keeps its rows in an {@link InMemoryTable}, following the same rules as the
 * SQLite table: ids are unique, replace is keyed by id and ranges are inclusive.
 */
public class InMemoryMirror implements Mirror {
    private final String storeName;
    private final NavigableMap<Long, MirrorRow> rows;
    private boolean open = true;

    public InMemoryMirror(String storeName, InMemoryTable table) {
        this.storeName = storeName;
        this.rows = table.getRows();
    }

    private void checkOpen() {
        if (!open) {
            throw new MirrorException("In-memory mirror " + storeName + " is closed");
        }
    }

    @Override
    public void initialize() {
        checkOpen();
    }

    @Override
    public List<MirrorRow> rows() {
        checkOpen();
        return new ArrayList<>(rows.values());
    }

    @Override
    public void insert(MirrorRow row) {
        checkOpen();
        if (rows.containsKey(row.id())) {
            throw new MirrorException("Row " + row.id() + " already exists in " + storeName);
        }
        rows.put(row.id(), row);
    }

    @Override
    public void replace(MirrorRow row) {
        checkOpen();
        rows.put(row.id(), row);
    }

    @Override
    public void deleteById(long id) {
        checkOpen();
        rows.remove(id);
    }

    @Override
    public void deleteByName(String name) {
        checkOpen();
        rows.values().removeIf(row -> row.name().equals(name));
    }

    @Override
    public void deleteBetween(long from, long to) {
        checkOpen();
        if (from > to) {
            return;
        }
        rows.subMap(from, true, to, true).clear();
    }

    @Override
    public void deleteAll() {
        checkOpen();
        rows.clear();
    }

    @Override
    public void close() {
        open = false;
    }
}
