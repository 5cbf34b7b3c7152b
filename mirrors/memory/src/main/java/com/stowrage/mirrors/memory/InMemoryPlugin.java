package com.stowrage.mirrors.memory;

import com.stowrage.core.Mirror;
import com.stowrage.core.MirrorPlugin;
import com.stowrage.core.StowrageConfig;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out one {@link InMemoryTable} per store name, so a store reopened through the same
 * plugin sees what it wrote before closing.
 */
public class InMemoryPlugin implements MirrorPlugin {
    private final Map<String, InMemoryTable> tables = new ConcurrentHashMap<>();

    @Override
    public Mirror open(StowrageConfig config) {
        InMemoryTable table = tables.computeIfAbsent(config.name(), k -> new InMemoryTable());
        InMemoryMirror mirror = new InMemoryMirror(config.name(), table);
        mirror.initialize();
        return mirror;
    }

    public InMemoryTable table(String name) {
        return tables.get(name);
    }

    @Override
    public void cleanUp() {
        tables.clear();
    }
}
