package com.stowrage.mirrors.sqlite;

import com.stowrage.core.Mirror;
import com.stowrage.core.MirrorRow;
import com.stowrage.core.errors.MirrorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;

/**
 * Mirrors a store into one SQLite table of {@code (id, name, data)} rows, data holding JSON.
 */
public class SQLiteMirror implements Mirror {
    private static final Logger logger = LoggerFactory.getLogger(SQLiteMirror.class);
    private final Connection connection;
    private final String table;

    public SQLiteMirror(Connection connection, String table) {
        this.connection = connection;
        this.table = "\"" + table + "\"";
    }

    @Override
    public void initialize() {
        String createTableSQL = String.format(
            "CREATE TABLE IF NOT EXISTS %s (" +
            "    id INTEGER PRIMARY KEY, " +
            "    name TEXT, " +
            "    data TEXT" +
            ");", table);

        try (Statement stmt = connection.createStatement()) {
            stmt.execute(createTableSQL);
        } catch (SQLException e) {
            logger.error("Failed to create SQLite table {}", table);
            throw new MirrorException("Error creating table " + table, e);
        }
    }

    @Override
    public List<MirrorRow> rows() {
        String query = String.format("SELECT id, name, data FROM %s ORDER BY id;", table);

        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(query)) {
            List<MirrorRow> rows = new ArrayList<>();
            while (rs.next()) {
                rows.add(new MirrorRow(rs.getLong("id"), rs.getString("name"), rs.getString("data")));
            }
            return rows;
        } catch (SQLException e) {
            throw new MirrorException("Error reading rows from " + table, e);
        }
    }

    @Override
    public void insert(MirrorRow row) {
        write("INSERT INTO %s (id, name, data) VALUES (?, ?, ?);", row);
    }

    @Override
    public void replace(MirrorRow row) {
        write("REPLACE INTO %s (id, name, data) VALUES (?, ?, ?);", row);
    }

    private void write(String template, MirrorRow row) {
        String query = String.format(template, table);

        try (PreparedStatement pstmt = connection.prepareStatement(query)) {
            pstmt.setLong(1, row.id());
            pstmt.setString(2, row.name());
            pstmt.setString(3, row.data());
            pstmt.executeUpdate();
            logger.debug("Wrote row {} ({}) to {}", row.id(), row.name(), table);
        } catch (SQLException e) {
            throw new MirrorException("Error writing row " + row.id() + " to " + table, e);
        }
    }

    @Override
    public void deleteById(long id) {
        delete(String.format("DELETE FROM %s WHERE id = ?;", table), pstmt -> pstmt.setLong(1, id));
    }

    @Override
    public void deleteByName(String name) {
        delete(String.format("DELETE FROM %s WHERE name = ?;", table), pstmt -> pstmt.setString(1, name));
    }

    @Override
    public void deleteBetween(long from, long to) {
        delete(String.format("DELETE FROM %s WHERE id BETWEEN ? AND ?;", table), pstmt -> {
            pstmt.setLong(1, from);
            pstmt.setLong(2, to);
        });
    }

    @Override
    public void deleteAll() {
        delete(String.format("DELETE FROM %s;", table), pstmt -> {});
    }

    private void delete(String query, Binder binder) {
        try (PreparedStatement pstmt = connection.prepareStatement(query)) {
            binder.bind(pstmt);
            int changes = pstmt.executeUpdate();
            logger.debug("Deleted {} rows from {}", changes, table);
        } catch (SQLException e) {
            throw new MirrorException("Error deleting rows from " + table, e);
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            throw new MirrorException("Error closing connection for " + table, e);
        }
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement pstmt) throws SQLException;
    }
}
