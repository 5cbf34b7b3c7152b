package com.stowrage.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Mirror that serves a fixed set of rows and records every call made against it.
 */
class RecordingMirror implements Mirror {
    final List<String> calls = new ArrayList<>();
    private final List<MirrorRow> stored;

    RecordingMirror(List<MirrorRow> stored) {
        this.stored = stored;
    }

    @Override
    public void initialize() {
        calls.add("initialize");
    }

    @Override
    public List<MirrorRow> rows() {
        calls.add("rows");
        return stored;
    }

    @Override
    public void insert(MirrorRow row) {
        calls.add("insert " + row.id() + " " + row.name() + " " + row.data());
    }

    @Override
    public void replace(MirrorRow row) {
        calls.add("replace " + row.id() + " " + row.name() + " " + row.data());
    }

    @Override
    public void deleteById(long id) {
        calls.add("deleteById " + id);
    }

    @Override
    public void deleteByName(String name) {
        calls.add("deleteByName " + name);
    }

    @Override
    public void deleteBetween(long from, long to) {
        calls.add("deleteBetween " + from + " " + to);
    }

    @Override
    public void deleteAll() {
        calls.add("deleteAll");
    }

    @Override
    public void close() {
        calls.add("close");
    }
}
