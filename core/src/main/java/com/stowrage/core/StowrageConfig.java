package com.stowrage.core;

import java.nio.file.Path;

/**
 * Construction options for a {@link Stowrage}.
 *
 * @param name         store identifier, required for persistence
 * @param persistent   whether {@link Stowrage#init()} may open a mirror
 * @param maxEntries   optional cap on the number of stored entries
 * @param path         directory holding the mirror files
 * @param mirrorPlugin factory for the mirror; {@code null} means the one registered as a service
 */
public record StowrageConfig(
        String name,
        boolean persistent,
        Integer maxEntries,
        Path path,
        MirrorPlugin mirrorPlugin
) {
    public static final String DEFAULT_PATH = "./stowrage/";
    public static final String PATH_ENV = "STOWRAGE_PATH";
    static final String UNNAMED = "unnamed db";

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Name used in log lines and error messages.
     */
    public String label() {
        return name != null ? name : UNNAMED;
    }

    public Path file() {
        if (name == null) {
            throw new IllegalStateException("An unnamed stowrage has no backing file");
        }
        return path.resolve(name + ".db");
    }

    public static class Builder {
        private String name;
        private boolean persistent = false;
        private Integer maxEntries;
        private Path path;
        private MirrorPlugin mirrorPlugin;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder persistent(boolean persistent) {
            this.persistent = persistent;
            return this;
        }

        public Builder maxEntries(int maxEntries) {
            if (maxEntries <= 0) {
                throw new IllegalArgumentException("maxEntries must be positive, got " + maxEntries);
            }
            this.maxEntries = maxEntries;
            return this;
        }

        public Builder path(Path path) {
            this.path = path;
            return this;
        }

        public Builder path(String path) {
            return path(Path.of(path));
        }

        public Builder mirrorPlugin(MirrorPlugin mirrorPlugin) {
            this.mirrorPlugin = mirrorPlugin;
            return this;
        }

        public StowrageConfig build() {
            Path resolved = path != null ? path : Path.of(getEnv(PATH_ENV, DEFAULT_PATH));
            return new StowrageConfig(name, persistent, maxEntries, resolved, mirrorPlugin);
        }

        private static String getEnv(String key, String defaultValue) {
            String value = System.getenv(key);
            return value != null && !value.isBlank() ? value : defaultValue;
        }
    }
}
