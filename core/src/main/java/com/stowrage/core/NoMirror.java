package com.stowrage.core;

import java.util.List;

/**
 * Mirror used while a store is not persistent, or before {@link Stowrage#init()} and after
 * {@link Stowrage#close()}.
 */
public final class NoMirror implements Mirror {
    public static final NoMirror INSTANCE = new NoMirror();

    private NoMirror() {
    }

    @Override
    public void initialize() {
    }

    @Override
    public List<MirrorRow> rows() {
        return List.of();
    }

    @Override
    public void insert(MirrorRow row) {
    }

    @Override
    public void replace(MirrorRow row) {
    }

    @Override
    public void deleteById(long id) {
    }

    @Override
    public void deleteByName(String name) {
    }

    @Override
    public void deleteBetween(long from, long to) {
    }

    @Override
    public void deleteAll() {
    }

    @Override
    public void close() {
    }
}
