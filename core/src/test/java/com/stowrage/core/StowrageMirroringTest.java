package com.stowrage.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.stowrage.core.errors.MirrorException;
import com.stowrage.core.errors.NonPersistentException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class StowrageMirroringTest {

    @TempDir
    Path dir;

    private final List<StowrageConfig> opened = new ArrayList<>();

    private MirrorPlugin pluginFor(RecordingMirror mirror) {
        return new MirrorPlugin() {
            @Override
            public Mirror open(StowrageConfig config) {
                opened.add(config);
                mirror.initialize();
                return mirror;
            }

            @Override
            public void cleanUp() {
            }
        };
    }

    private <T> Stowrage<T> persistent(Class<T> type, RecordingMirror mirror, Integer maxEntries) {
        StowrageConfig.Builder builder = StowrageConfig.builder()
                .name("farm")
                .persistent(true)
                .path(dir)
                .mirrorPlugin(pluginFor(mirror));
        if (maxEntries != null) {
            builder.maxEntries(maxEntries);
        }
        Stowrage<T> stowrage = new Stowrage<>(type, builder.build());
        stowrage.init();
        mirror.calls.clear();
        return stowrage;
    }

    @Test
    public void initShouldReplayRowsKeepingTheirIds() {
        RecordingMirror mirror = new RecordingMirror(List.of(
                new MirrorRow(2, "a", "1"),
                new MirrorRow(5, "b", "2")));
        Stowrage<Integer> stowrage = new Stowrage<>(Integer.class, StowrageConfig.builder()
                .name("farm").persistent(true).path(dir).mirrorPlugin(pluginFor(mirror)).build());

        stowrage.init();

        assertTrue(stowrage.isInitialized());
        assertEquals(List.of("initialize", "rows"), mirror.calls);
        assertEquals(2, stowrage.fetch("a").id());
        assertEquals(2, stowrage.fetchById(5).data());
        assertEquals(6, stowrage.ensure("c", 3).id());
        assertEquals(dir.resolve("farm.db"), opened.get(0).file());
    }

    @Test
    public void replayShouldApplyEvictionAndMirrorIt() {
        RecordingMirror mirror = new RecordingMirror(List.of(
                new MirrorRow(0, "a", "1"),
                new MirrorRow(1, "b", "2"),
                new MirrorRow(2, "c", "3")));
        Stowrage<Integer> stowrage = new Stowrage<>(Integer.class, StowrageConfig.builder()
                .name("farm").persistent(true).path(dir).maxEntries(2).mirrorPlugin(pluginFor(mirror)).build());

        stowrage.init();

        assertEquals(2, stowrage.totalEntries());
        assertFalse(stowrage.has("a"));
        assertEquals(List.of("initialize", "rows", "deleteByName a"), mirror.calls);
    }

    @Test
    public void addShouldInsertARow() {
        RecordingMirror mirror = new RecordingMirror(List.of());
        Stowrage<String> stowrage = persistent(String.class, mirror, null);

        stowrage.add("a", "one");
        stowrage.ensure("b", "two");

        assertEquals(List.of("insert 0 a \"one\"", "insert 1 b \"two\""), mirror.calls);
    }

    @Test
    public void evictionShouldDeleteTheRowByName() {
        RecordingMirror mirror = new RecordingMirror(List.of());
        Stowrage<Integer> stowrage = persistent(Integer.class, mirror, 1);

        stowrage.add("a", 1);
        stowrage.add("b", 2);

        assertEquals(List.of("insert 0 a 1", "insert 1 b 2", "deleteByName a"), mirror.calls);
    }

    @Test
    public void deletesShouldDeleteRowsById() {
        RecordingMirror mirror = new RecordingMirror(List.of());
        Stowrage<Integer> stowrage = persistent(Integer.class, mirror, null);
        stowrage.add("a", 1);
        stowrage.add("b", 2);
        mirror.calls.clear();

        stowrage.delete("a");
        stowrage.deleteById(1);

        assertEquals(List.of("deleteById 0", "deleteById 1"), mirror.calls);
    }

    @Test
    public void rangeDeletesShouldDeleteBetweenOrEverything() {
        RecordingMirror mirror = new RecordingMirror(List.of());
        Stowrage<Integer> stowrage = persistent(Integer.class, mirror, null);
        for (int i = 0; i < 5; i++) {
            stowrage.add("n" + i, i);
        }
        mirror.calls.clear();

        stowrage.deleteByRange(1, 1);
        stowrage.deleteByRange(0, 10);
        stowrage.add("x", 9);
        stowrage.deleteStowrage();

        assertEquals(List.of("deleteBetween 1 2", "deleteAll", "insert 0 x 9", "deleteAll"), mirror.calls);
    }

    @Test
    public void overridesShouldReplaceTheRowById() {
        RecordingMirror mirror = new RecordingMirror(List.of());
        Stowrage<Map<String, Object>> stowrage = new Stowrage<>(new TypeReference<Map<String, Object>>() {},
                StowrageConfig.builder().name("farm").persistent(true).path(dir).mirrorPlugin(pluginFor(mirror)).build());
        stowrage.init();
        stowrage.add("hen", Map.of("eggs", 1));
        mirror.calls.clear();

        stowrage.override("hen", Map.of("eggs", 2));
        stowrage.overrideById(0, Map.of("eggs", 3));
        stowrage.setValue("hen", ValueChange.of("eggs", 4));

        assertEquals(List.of(
                "replace 0 hen {\"eggs\":2}",
                "replace 0 hen {\"eggs\":3}",
                "replace 0 hen {\"eggs\":4}"), mirror.calls);
    }

    @Test
    public void failedValidationShouldNotReachTheMirror() {
        RecordingMirror mirror = new RecordingMirror(List.of());
        Stowrage<Integer> stowrage = persistent(Integer.class, mirror, null);
        stowrage.add("a", 1);
        mirror.calls.clear();

        assertThrows(RuntimeException.class, () -> stowrage.add("a", 2));
        assertThrows(RuntimeException.class, () -> stowrage.delete("b"));
        assertThrows(RuntimeException.class, () -> stowrage.override("b", 2));

        assertTrue(mirror.calls.isEmpty());
    }

    @Test
    public void closeShouldDetachTheMirror() {
        RecordingMirror mirror = new RecordingMirror(List.of());
        Stowrage<Integer> stowrage = persistent(Integer.class, mirror, null);

        stowrage.close();
        stowrage.add("a", 1);

        assertEquals(List.of("close"), mirror.calls);
        assertFalse(stowrage.isInitialized());
        assertEquals(1, stowrage.totalEntries());
        assertThrows(NonPersistentException.class, stowrage::close);
    }

    @Test
    public void initTwiceShouldFail() {
        RecordingMirror mirror = new RecordingMirror(List.of());
        Stowrage<Integer> stowrage = persistent(Integer.class, mirror, null);

        assertThrows(IllegalStateException.class, stowrage::init);
    }

    @Test
    public void initOverInMemoryEntriesShouldFail() {
        RecordingMirror mirror = new RecordingMirror(List.of(new MirrorRow(0, "a", "1")));
        Stowrage<Integer> stowrage = new Stowrage<>(Integer.class, StowrageConfig.builder()
                .name("farm").persistent(true).path(dir).mirrorPlugin(pluginFor(mirror)).build());
        stowrage.add("b", 2);

        assertThrows(IllegalStateException.class, stowrage::init);
        assertFalse(stowrage.isInitialized());
        assertTrue(mirror.calls.isEmpty());
    }

    @Test
    public void undecodableRowsShouldFailInit() {
        RecordingMirror mirror = new RecordingMirror(List.of(new MirrorRow(0, "a", "not json")));
        Stowrage<Integer> stowrage = new Stowrage<>(Integer.class, StowrageConfig.builder()
                .name("farm").persistent(true).path(dir).mirrorPlugin(pluginFor(mirror)).build());

        assertThrows(MirrorException.class, stowrage::init);
        assertEquals(List.of("initialize", "rows", "close"), mirror.calls);
    }

    @Test
    public void aFailedReplayShouldLeaveTheStoreEmptyAndRetryable() {
        RecordingMirror broken = new RecordingMirror(List.of(
                new MirrorRow(0, "a", "1"),
                new MirrorRow(1, "b", "\"x\"")));
        Stowrage<Integer> stowrage = new Stowrage<>(Integer.class, StowrageConfig.builder()
                .name("farm").persistent(true).path(dir).mirrorPlugin(pluginFor(broken)).build());

        assertThrows(MirrorException.class, stowrage::init);

        assertFalse(stowrage.isInitialized());
        assertEquals(0, stowrage.totalEntries());
        assertFalse(stowrage.has("a"));
        assertEquals(List.of("initialize", "rows", "close"), broken.calls);

        stowrage.add("c", 3);
        assertEquals(List.of("initialize", "rows", "close"), broken.calls);
        stowrage.deleteStowrage();
        assertEquals(0, stowrage.ensure("d", 4).id());
    }

    @Test
    public void aFailingCloseShouldBeSuppressedIntoTheReplayFailure() {
        RecordingMirror mirror = new RecordingMirror(List.of(new MirrorRow(0, "a", "not json"))) {
            @Override
            public void close() {
                super.close();
                throw new MirrorException("close failed");
            }
        };
        Stowrage<Integer> stowrage = new Stowrage<>(Integer.class, StowrageConfig.builder()
                .name("farm").persistent(true).path(dir).mirrorPlugin(pluginFor(mirror)).build());

        MirrorException e = assertThrows(MirrorException.class, stowrage::init);

        assertEquals(1, e.getSuppressed().length);
        assertEquals("close failed", e.getSuppressed()[0].getMessage());
        assertFalse(stowrage.isInitialized());
    }
}
