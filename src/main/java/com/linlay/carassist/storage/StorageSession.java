package com.linlay.carassist.storage;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface StorageSession {

    Optional<Map<String, Object>> findById(Table table, Object id);

    boolean exists(Table table, Object id);

    List<Map<String, Object>> findBy(Table table, String column, Object value, boolean fuzzy);

    List<Map<String, Object>> findAll(Table table);

    List<Map<String, Object>> findWhere(Table table, Map<String, Object> equals, String orderByColumn);

    Long minId(Table table);

    int insert(Table table, Map<String, Object> values);

    int updateColumn(Table table, Object id, String column, Object value);
}
