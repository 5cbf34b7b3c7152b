package com.stowrage.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.stowrage.core.errors.IdNotFoundException;
import com.stowrage.core.errors.InvalidKeyException;
import com.stowrage.core.errors.KeyUndefinedException;
import com.stowrage.core.errors.NameDuplicationException;
import com.stowrage.core.errors.NameNotFoundException;
import com.stowrage.core.errors.NonPersistentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * A keyed store of values of one type. Every entry is reachable by its unique name and by a
 * numeric id assigned on insertion. Ids only grow and are reused only after a full clear.
 *
 * <p>A store configured with a name and {@code persistent = true} mirrors every mutation into a
 * {@link Mirror} once {@link #init()} has been called; until then, and for all other stores,
 * the store lives in memory only.
 *
 * <p>Not thread safe. Callers sharing a store between threads must serialize access.
 *
 * @param <T> the value type
 */
public class Stowrage<T> {
    private static final Logger logger = LoggerFactory.getLogger(Stowrage.class);

    private final StowrageConfig config;
    private final ValueCodec<T> codec;

    private long nextId = 0;
    private Map<String, Entry<T>> byName = new LinkedHashMap<>();
    private Map<Long, String> byId = new HashMap<>();
    private Mirror mirror = NoMirror.INSTANCE;

    public Stowrage(Class<T> type) {
        this(ValueCodec.of(type), StowrageConfig.builder().build());
    }

    public Stowrage(Class<T> type, StowrageConfig config) {
        this(ValueCodec.of(type), config);
    }

    public Stowrage(TypeReference<T> type, StowrageConfig config) {
        this(ValueCodec.of(type), config);
    }

    public Stowrage(ValueCodec<T> codec, StowrageConfig config) {
        this.codec = codec;
        this.config = config;
        if (config.name() != null) {
            ensureDirectory(config.path());
        }
    }

    private static void ensureDirectory(Path path) {
        if (Files.isDirectory(path)) {
            return;
        }
        try {
            Files.createDirectories(path);
        } catch (IOException e) {
            logger.warn("Could not create stowrage directory {}", path, e);
        }
    }

    /**
     * Opens the mirror and replays its rows into memory. Replayed entries keep their stored ids
     * and go through the same eviction rule as {@link #add}.
     *
     * @throws NonPersistentException if the store is unnamed or not persistent
     * @throws IllegalStateException  if a mirror is already open or the store already holds entries
     * @throws com.stowrage.core.errors.MirrorException if a stored row can not be read back; the
     *                                  mirror is closed again and the store is left untouched
     */
    public void init() {
        if (config.name() == null || !config.persistent()) {
            throw new NonPersistentException(config.label(), "initiated");
        }
        if (isInitialized()) {
            throw new IllegalStateException(config.label() + " is already initiated");
        }
        if (!byName.isEmpty()) {
            throw new IllegalStateException(
                    config.label() + " holds " + byName.size() + " entries and can't replay its mirror over them");
        }

        MirrorPlugin plugin = config.mirrorPlugin() != null ? config.mirrorPlugin() : MirrorPlugins.load();
        Mirror opened = plugin.open(config);
        List<Entry<T>> stored = new ArrayList<>();
        try {
            for (MirrorRow row : opened.rows()) {
                stored.add(new Entry<>(row.id(), row.name(), codec.decode(row.data())));
            }
        } catch (RuntimeException e) {
            logger.error("Could not replay {}", config.label(), e);
            closeAfterFailure(opened, e);
            throw e;
        }

        mirror = opened;
        for (Entry<T> entry : stored) {
            nextId = Math.max(nextId, entry.id());
            insert(entry.name(), entry.data(), false);
        }
        logger.info("Initiated {} with {} of {} stored entries", config.label(), byName.size(), stored.size());
    }

    private static void closeAfterFailure(Mirror opened, RuntimeException failure) {
        try {
            opened.close();
        } catch (RuntimeException e) {
            failure.addSuppressed(e);
        }
    }

    /**
     * Adds an entry and returns it, so the caller learns the assigned id.
     *
     * @throws NameDuplicationException if the name is taken
     */
    public Entry<T> ensure(String name, T value) {
        return insert(name, value, true);
    }

    /**
     * @throws NameDuplicationException if the name is taken
     */
    public void add(String name, T value) {
        insert(name, value, true);
    }

    private Entry<T> insert(String name, T value, boolean write) {
        if (byName.containsKey(name)) {
            throw new NameDuplicationException(name);
        }
        Entry<T> entry = new Entry<>(nextId++, name, value);
        byName.put(name, entry);
        byId.put(entry.id(), name);
        if (write) {
            mirror.insert(toRow(entry));
        }
        evictOverflow(entry.id());
        return entry;
    }

    private void evictOverflow(long newestId) {
        Integer maxEntries = config.maxEntries();
        if (maxEntries == null || byName.size() <= maxEntries) {
            return;
        }
        String evicted = byId.remove(newestId - maxEntries);
        if (evicted == null) {
            return;
        }
        byName.remove(evicted);
        mirror.deleteByName(evicted);
        logger.debug("Evicted {} from {}", evicted, config.label());
    }

    /**
     * @throws NameNotFoundException if there is no entry with that name
     */
    public void delete(String name) {
        Entry<T> entry = byName.get(name);
        if (entry == null) {
            throw new NameNotFoundException(name);
        }
        byName.remove(name);
        byId.remove(entry.id());
        mirror.deleteById(entry.id());
    }

    /**
     * @throws IdNotFoundException if there is no entry with that id
     */
    public void deleteById(long id) {
        String name = nameOf(id);
        byId.remove(id);
        byName.remove(name);
        mirror.deleteById(id);
    }

    /**
     * Removes every entry whose id lies in {@code [start, start + length]}. When
     * {@code start + length} reaches the current entry count the whole store is cleared and ids
     * start again at zero, whatever ids the remaining entries had.
     */
    public void deleteByRange(long start, long length) {
        long range = start + length;
        if (range >= byName.size()) {
            clear();
            return;
        }
        byName = byName.entrySet().stream()
                .filter(e -> e.getValue().id() < start || e.getValue().id() > range)
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));
        byId = byId.entrySet().stream()
                .filter(e -> e.getKey() < start || e.getKey() > range)
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, HashMap::new));
        mirror.deleteBetween(start, range);
    }

    /**
     * Replaces the data of an existing entry. The id and the iteration position are kept.
     *
     * @throws NameNotFoundException if there is no entry with that name
     */
    public void override(String name, T newValue) {
        Entry<T> existing = byName.get(name);
        if (existing == null) {
            throw new NameNotFoundException(name);
        }
        Entry<T> entry = new Entry<>(existing.id(), name, newValue);
        byName.put(name, entry);
        mirror.replace(toRow(entry));
    }

    /**
     * @throws IdNotFoundException if there is no entry with that id
     */
    public void overrideById(long id, T newValue) {
        override(nameOf(id), newValue);
    }

    public List<Entry<T>> filter(Predicate<Entry<T>> predicate) {
        return byName.values().stream()
                .filter(predicate)
                .collect(Collectors.toList());
    }

    public Optional<Entry<T>> find(Predicate<Entry<T>> predicate) {
        return byName.values().stream()
                .filter(predicate)
                .findFirst();
    }

    /**
     * @throws NameNotFoundException if there is no entry with that name
     */
    public Entry<T> fetch(String name) {
        Entry<T> entry = byName.get(name);
        if (entry == null) {
            throw new NameNotFoundException(name);
        }
        return entry;
    }

    /**
     * @throws IdNotFoundException if there is no entry with that id
     */
    public Entry<T> fetchById(long id) {
        return fetch(nameOf(id));
    }

    /**
     * Returns the entries whose id lies in {@code [start, start + length)}, or every entry when
     * {@code start + length} reaches the current entry count.
     */
    public List<Entry<T>> fetchByRange(long start, long length) {
        long range = start + length;
        if (range >= byName.size()) {
            return new ArrayList<>(byName.values());
        }
        return filter(entry -> entry.id() >= start && entry.id() < range);
    }

    /**
     * Replaces one key of structured data, or the whole value of scalar data, then overrides the
     * entry with the result.
     *
     * @throws NameNotFoundException if there is no entry with that name
     * @throws KeyUndefinedException if the data is structured and the change names no key
     * @throws InvalidKeyException   if the data is structured and lacks the named key
     */
    public void setValue(String name, ValueChange change) {
        Entry<T> entry = fetch(name);
        override(name, changedValue(entry.data(), change));
    }

    /**
     * @throws IdNotFoundException if there is no entry with that id
     * @see #setValue(String, ValueChange)
     */
    public void setValueById(long id, ValueChange change) {
        setValue(nameOf(id), change);
    }

    private T changedValue(T data, ValueChange change) {
        if (!codec.isStructured(data)) {
            return codec.coerce(change.value());
        }
        if (change.key() == null) {
            throw new KeyUndefinedException();
        }
        if (!codec.hasKey(data, change.key())) {
            throw new InvalidKeyException(change.key(), config.label());
        }
        return codec.withKey(data, change.key(), change.value());
    }

    public boolean has(String name) {
        return byName.containsKey(name);
    }

    /**
     * Removes every entry and resets ids to zero.
     */
    public void deleteStowrage() {
        clear();
    }

    private void clear() {
        byName.clear();
        byId.clear();
        nextId = 0;
        mirror.deleteAll();
    }

    /**
     * Closes the mirror. The entries stay available in memory, but later changes are not
     * mirrored.
     *
     * @throws NonPersistentException if no mirror is open
     */
    public void close() {
        if (!isInitialized()) {
            throw new NonPersistentException(config.label(), "closed");
        }
        mirror.close();
        mirror = NoMirror.INSTANCE;
        logger.info("Closed {}", config.label());
    }

    public int totalEntries() {
        return byName.size();
    }

    public String name() {
        return config.name();
    }

    public boolean isPersistent() {
        return config.persistent();
    }

    public Optional<Integer> maxEntries() {
        return Optional.ofNullable(config.maxEntries());
    }

    public Path path() {
        return config.path();
    }

    public boolean isInitialized() {
        return mirror != NoMirror.INSTANCE;
    }

    private String nameOf(long id) {
        String name = byId.get(id);
        if (name == null) {
            throw new IdNotFoundException(id);
        }
        return name;
    }

    private MirrorRow toRow(Entry<T> entry) {
        return new MirrorRow(entry.id(), entry.name(), codec.encode(entry.data()));
    }
}
