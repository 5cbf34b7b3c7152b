package com.stowrage.mirrors.sqlite;

import com.stowrage.core.Mirror;
import com.stowrage.core.MirrorPlugin;
import com.stowrage.core.StowrageConfig;
import com.stowrage.core.errors.MirrorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteDataSource;

import java.io.File;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Opens {@link SQLiteMirror}s on {@code <path>/<name>.db}. Registered as the default
 * {@link MirrorPlugin} service.
 */
public class SQLitePlugin implements MirrorPlugin {
    private static final Logger logger = LoggerFactory.getLogger(SQLitePlugin.class);
    Map<String, SQLiteDataSource> dataSources = new ConcurrentHashMap<>();

    @Override
    public Mirror open(StowrageConfig config) {
        SQLiteConfig c = SQLiteConfig.from(config);
        var dataSource = buildDatasource(c);
        Connection connection;
        try {
            connection = dataSource.getConnection();
        } catch (SQLException e) {
            logger.error("Failed to open SQLite database {}", c.file);
            throw new MirrorException("Error opening " + c.file, e);
        }
        SQLiteMirror mirror = new SQLiteMirror(connection, c.table);
        try {
            mirror.initialize();
        } catch (RuntimeException e) {
            close(connection, e);
            throw e;
        }
        logger.info("Opened SQLite mirror {} in {}", c.table, c.file);
        return mirror;
    }

    private static void close(Connection connection, RuntimeException failure) {
        try {
            connection.close();
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
    }

    private synchronized SQLiteDataSource buildDatasource(SQLiteConfig c) {
        if (dataSources.containsKey(c.file)) {
            return dataSources.get(c.file);
        } else {
            var dataSource = new SQLiteDataSource();
            dataSource.setUrl("jdbc:sqlite:" + c.file);
            dataSources.put(c.file, dataSource);
            return dataSource;
        }
    }

    @Override
    public void cleanUp() {
        dataSources.keySet().forEach(k -> {
            if (!k.startsWith(":memory:")) {
                File file = new File(k);
                if (file.exists() && !file.delete()) {
                    logger.warn("Could not delete {}", k);
                }
            }
        });
        dataSources.clear();
    }
}
