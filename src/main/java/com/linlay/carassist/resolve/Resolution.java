package com.linlay.carassist.resolve;

import com.linlay.carassist.tool.ToolResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record Resolution(
        Long id,
        Map<String, Object> row,
        String selectedKey,
        Object selectedValue,
        List<String> ignoredKeys,
        ToolResult failure
) {

    public static Resolution direct(String key, long id) {
        return new Resolution(id, null, key, id, List.of(), null);
    }

    public static Resolution matched(long id, Map<String, Object> row, String selectedKey, Object selectedValue, List<String> ignoredKeys) {
        return new Resolution(id, row, selectedKey, selectedValue, List.copyOf(ignoredKeys), null);
    }

    public static Resolution failed(ToolResult failure) {
        return new Resolution(null, null, null, null, List.of(), failure);
    }

    public boolean resolved() {
        return failure == null;
    }

    public boolean lookedUp() {
        return row != null;
    }

    public List<String> consumedKeys() {
        List<String> keys = new ArrayList<>();
        if (selectedKey != null) {
            keys.add(selectedKey);
        }
        return keys;
    }

    public Map<String, Object> meta() {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("selected_key", selectedKey);
        meta.put("selected_value", selectedValue);
        meta.put("ignored_keys", ignoredKeys);
        return meta;
    }
}
