package com.stowrage.core;

import java.util.List;

/**
 * The backing store that shadows a {@link Stowrage}. Every mutating store operation issues
 * the matching call synchronously.
 */
public interface Mirror {
    void initialize();
    List<MirrorRow> rows();
    void insert(MirrorRow row);
    void replace(MirrorRow row);
    void deleteById(long id);
    void deleteByName(String name);
    void deleteBetween(long from, long to);
    void deleteAll();
    void close();
}
