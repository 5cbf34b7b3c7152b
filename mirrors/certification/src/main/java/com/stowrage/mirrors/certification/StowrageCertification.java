package com.stowrage.mirrors.certification;

import com.fasterxml.jackson.core.type.TypeReference;
import com.stowrage.core.Entry;
import com.stowrage.core.MirrorPlugin;
import com.stowrage.core.Stowrage;
import com.stowrage.core.StowrageConfig;
import com.stowrage.core.ValueChange;
import com.stowrage.core.errors.NonPersistentException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Round trips a persistent {@link Stowrage} through a mirror plugin: whatever a store holds when
 * it is closed must come back, with the same ids, when a fresh store replays the mirror.
 */
public abstract class StowrageCertification {
    private static final TypeReference<Map<String, Object>> HENS = new TypeReference<>() {};

    protected MirrorPlugin plugin;

    @TempDir
    protected Path dir;

    private String storeName;

    public abstract void init();

    @BeforeEach
    public void setUp() throws Exception {
        init();
        storeName = "hens";
    }

    @AfterEach
    public void tearDown() {
        plugin.cleanUp();
    }

    protected Stowrage<Map<String, Object>> open() {
        return open(null);
    }

    protected Stowrage<Map<String, Object>> open(Integer maxEntries) {
        StowrageConfig.Builder builder = StowrageConfig.builder()
                .name(storeName)
                .persistent(true)
                .path(dir)
                .mirrorPlugin(plugin);
        if (maxEntries != null) {
            builder.maxEntries(maxEntries);
        }
        Stowrage<Map<String, Object>> stowrage = new Stowrage<>(HENS, builder.build());
        stowrage.init();
        return stowrage;
    }

    private Stowrage<Map<String, Object>> reopen(Stowrage<Map<String, Object>> stowrage) {
        stowrage.close();
        return open(stowrage.maxEntries().orElse(null));
    }

    private static List<Entry<Map<String, Object>>> all(Stowrage<Map<String, Object>> stowrage) {
        return stowrage.filter(e -> true);
    }

    private static List<String> names(Stowrage<Map<String, Object>> stowrage) {
        return all(stowrage).stream().map(Entry::name).collect(Collectors.toList());
    }

    @Test
    public void aFreshStoreShouldStartEmpty() {
        Stowrage<Map<String, Object>> stowrage = open();

        assertTrue(stowrage.isInitialized());
        assertEquals(0, stowrage.totalEntries());
    }

    @Test
    public void closedStoresShouldReplayIdenticalEntries() {
        Stowrage<Map<String, Object>> stowrage = open();
        stowrage.add("henrietta", Map.of("eggs", 3, "coop", "north"));
        stowrage.add("clucky", Map.of("eggs", 1, "coop", "south"));
        stowrage.override("henrietta", Map.of("eggs", 4, "coop", "north"));
        List<Entry<Map<String, Object>>> before = all(stowrage);

        Stowrage<Map<String, Object>> reopened = reopen(stowrage);

        assertEquals(before, all(reopened));
    }

    @Test
    public void deletedEntriesShouldStayDeleted() {
        Stowrage<Map<String, Object>> stowrage = open();
        stowrage.add("a", Map.of("eggs", 1));
        stowrage.add("b", Map.of("eggs", 2));
        stowrage.add("c", Map.of("eggs", 3));
        stowrage.delete("b");
        stowrage.deleteById(0);

        Stowrage<Map<String, Object>> reopened = reopen(stowrage);

        assertEquals(List.of("c"), names(reopened));
        assertEquals(2, reopened.fetch("c").id());
    }

    @Test
    public void replayedStoresShouldKeepCountingFromTheLastId() {
        Stowrage<Map<String, Object>> stowrage = open();
        stowrage.add("a", Map.of("eggs", 1));
        stowrage.add("b", Map.of("eggs", 2));
        stowrage.delete("a");

        Stowrage<Map<String, Object>> reopened = reopen(stowrage);

        assertEquals(2, reopened.ensure("c", Map.of("eggs", 3)).id());
    }

    @Test
    public void setValueShouldPersistTheChangedKey() {
        Stowrage<Map<String, Object>> stowrage = open();
        stowrage.add("henrietta", Map.of("eggs", 3, "coop", "north"));

        stowrage.setValue("henrietta", ValueChange.of("eggs", 5));
        stowrage.setValueById(0, ValueChange.of("coop", "east"));
        Stowrage<Map<String, Object>> reopened = reopen(stowrage);

        assertEquals(Map.of("eggs", 5, "coop", "east"), reopened.fetch("henrietta").data());
    }

    @Test
    public void overrideByIdShouldReplaceTheStoredRow() {
        Stowrage<Map<String, Object>> stowrage = open();
        stowrage.add("a", Map.of("eggs", 1));

        stowrage.overrideById(0, Map.of("eggs", 9));
        Stowrage<Map<String, Object>> reopened = reopen(stowrage);

        assertEquals(1, reopened.totalEntries());
        assertEquals(Map.of("eggs", 9), reopened.fetchById(0).data());
    }

    @Test
    public void evictedEntriesShouldLeaveTheMirror() {
        Stowrage<Map<String, Object>> stowrage = open(2);
        stowrage.add("a", Map.of("eggs", 1));
        stowrage.add("b", Map.of("eggs", 2));
        stowrage.add("c", Map.of("eggs", 3));

        Stowrage<Map<String, Object>> reopened = reopen(stowrage);

        assertEquals(List.of("b", "c"), names(reopened));
    }

    @Test
    public void rangeDeletesShouldLeaveTheMirror() {
        Stowrage<Map<String, Object>> stowrage = open();
        for (int i = 0; i < 5; i++) {
            stowrage.add("n" + i, Map.of("eggs", i));
        }

        stowrage.deleteByRange(1, 2);
        Stowrage<Map<String, Object>> reopened = reopen(stowrage);

        assertEquals(List.of("n0", "n4"), names(reopened));
        assertEquals(4, reopened.fetch("n4").id());
    }

    @Test
    public void clearingShouldEmptyTheMirrorAndRestartIds() {
        Stowrage<Map<String, Object>> stowrage = open();
        stowrage.add("a", Map.of("eggs", 1));
        stowrage.add("b", Map.of("eggs", 2));

        stowrage.deleteStowrage();
        stowrage.add("c", Map.of("eggs", 3));
        Stowrage<Map<String, Object>> reopened = reopen(stowrage);

        assertEquals(List.of("c"), names(reopened));
        assertEquals(0, reopened.fetch("c").id());
    }

    @Test
    public void wholeStoreRangeDeletesShouldEmptyTheMirror() {
        Stowrage<Map<String, Object>> stowrage = open();
        stowrage.add("a", Map.of("eggs", 1));
        stowrage.add("b", Map.of("eggs", 2));

        stowrage.deleteByRange(0, 2);
        Stowrage<Map<String, Object>> reopened = reopen(stowrage);

        assertEquals(0, reopened.totalEntries());
    }

    @Test
    public void changesAfterCloseShouldNotBeMirrored() {
        Stowrage<Map<String, Object>> stowrage = open();
        stowrage.add("a", Map.of("eggs", 1));
        stowrage.close();

        stowrage.add("b", Map.of("eggs", 2));
        Stowrage<Map<String, Object>> reopened = open();

        assertEquals(2, stowrage.totalEntries());
        assertEquals(List.of("a"), names(reopened));
    }

    @Test
    public void closingTwiceShouldFail() {
        Stowrage<Map<String, Object>> stowrage = open();
        stowrage.close();

        NonPersistentException e = assertThrows(NonPersistentException.class, stowrage::close);

        assertEquals(storeName, e.getStoreName());
        assertEquals("closed", e.getAction());
    }

    @Test
    public void storesShouldNotSeeEachOthersEntries() {
        Stowrage<Map<String, Object>> first = open();
        first.add("a", Map.of("eggs", 1));
        storeName = "roosters";

        Stowrage<Map<String, Object>> second = open();

        assertEquals(0, second.totalEntries());
    }
}
