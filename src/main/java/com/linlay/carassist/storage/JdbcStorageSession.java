package com.linlay.carassist.storage;

import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

class JdbcStorageSession implements StorageSession {

    private final JdbcTemplate jdbc;

    JdbcStorageSession(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<Map<String, Object>> findById(Table table, Object id) {
        List<Map<String, Object>> rows = query(
                "SELECT * FROM " + table.tableName() + " WHERE " + table.idColumn() + " = ?",
                id
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public boolean exists(Table table, Object id) {
        List<Map<String, Object>> rows = query(
                "SELECT 1 AS present FROM " + table.tableName() + " WHERE " + table.idColumn() + " = ? LIMIT 1",
                id
        );
        return !rows.isEmpty();
    }

    @Override
    public List<Map<String, Object>> findBy(Table table, String column, Object value, boolean fuzzy) {
        requireReadable(table, column);
        if (fuzzy) {
            String pattern = "%" + String.valueOf(value).trim().toLowerCase(Locale.ROOT) + "%";
            return query(
                    "SELECT * FROM " + table.tableName() + " WHERE LOWER(" + column + ") LIKE ? ORDER BY " + table.idColumn(),
                    pattern
            );
        }
        return query(
                "SELECT * FROM " + table.tableName() + " WHERE " + column + " = ? ORDER BY " + table.idColumn(),
                value
        );
    }

    @Override
    public List<Map<String, Object>> findAll(Table table) {
        return query("SELECT * FROM " + table.tableName() + " ORDER BY " + table.idColumn());
    }

    @Override
    public List<Map<String, Object>> findWhere(Table table, Map<String, Object> equals, String orderByColumn) {
        String orderBy = orderByColumn == null ? table.idColumn() : orderByColumn;
        requireReadable(table, orderBy);
        StringJoiner where = new StringJoiner(" AND ");
        List<Object> params = new ArrayList<>();
        for (Map.Entry<String, Object> entry : equals.entrySet()) {
            requireReadable(table, entry.getKey());
            where.add(entry.getKey() + " = ?");
            params.add(entry.getValue());
        }
        String sql = "SELECT * FROM " + table.tableName()
                + (params.isEmpty() ? "" : " WHERE " + where)
                + " ORDER BY " + orderBy + " ASC";
        return query(sql, params.toArray());
    }

    @Override
    public Long minId(Table table) {
        List<Map<String, Object>> rows = query(
                "SELECT MIN(" + table.idColumn() + ") AS min_id FROM " + table.tableName()
        );
        if (rows.isEmpty()) {
            return null;
        }
        return Rows.longValue(rows.get(0).get("min_id"));
    }

    @Override
    public int insert(Table table, Map<String, Object> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("nothing to insert into " + table.tableName());
        }
        StringJoiner columns = new StringJoiner(", ");
        StringJoiner placeholders = new StringJoiner(", ");
        List<Object> params = new ArrayList<>();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            requireReadable(table, entry.getKey());
            columns.add(entry.getKey());
            placeholders.add("?");
            params.add(entry.getValue());
        }
        return jdbc.update(
                "INSERT INTO " + table.tableName() + " (" + columns + ") VALUES (" + placeholders + ")",
                params.toArray()
        );
    }

    @Override
    public int updateColumn(Table table, Object id, String column, Object value) {
        if (!table.writableColumns().contains(column)) {
            throw new IllegalArgumentException("column '" + column + "' is not writable on " + table.tableName());
        }
        return jdbc.update(
                "UPDATE " + table.tableName() + " SET " + column + " = ? WHERE " + table.idColumn() + " = ?",
                value,
                id
        );
    }

    private List<Map<String, Object>> query(String sql, Object... params) {
        return jdbc.queryForList(sql, params).stream()
                .map(Rows::normalize)
                .toList();
    }

    private static void requireReadable(Table table, String column) {
        if (!table.isReadableColumn(column)) {
            throw new IllegalArgumentException("column '" + column + "' is not known on " + table.tableName());
        }
    }
}
