package com.stowrage.core;

/**
 * One persisted entry as the mirror sees it: the data column holds JSON text.
 */
public record MirrorRow(
        long id,
        String name,
        String data
){}
