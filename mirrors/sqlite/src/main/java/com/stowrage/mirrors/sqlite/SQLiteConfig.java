package com.stowrage.mirrors.sqlite;

import com.stowrage.core.StowrageConfig;

/**
 * Where a store's rows live: the database file and the table inside it.
 */
public class SQLiteConfig {
    public final String file;
    public final String table;

    public SQLiteConfig(String file, String table) {
        this.file = file;
        this.table = table;
    }

    public static SQLiteConfig from(StowrageConfig config) {
        return new SQLiteConfig(config.file().toString(), tableName(config.name()));
    }

    static String tableName(String storeName) {
        return storeName.replaceAll("[^A-Za-z0-9_]", "_");
    }
}
