package com.linlay.carassist.tool;

import com.linlay.carassist.storage.StorageException;

import java.util.LinkedHashMap;
import java.util.Map;

public final class StorageResults {

    private StorageResults() {
    }

    public static ToolResult fromFailure(StorageException ex, String action) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("error", ex.getMessage());
        return switch (ex.category()) {
            case UNAVAILABLE -> ToolResult.error(ErrorCode.DB_UNAVAILABLE, "The database is unavailable right now.", data);
            case INTEGRITY_VIOLATION -> ToolResult.error(ErrorCode.PRECONDITION_FAILED, "Invalid reference (foreign key).", data);
            case UNIQUE_VIOLATION -> ToolResult.error(ErrorCode.CONFLICT, "That record already exists.", data);
            case TRANSACTION_FAILED -> ToolResult.error(ErrorCode.TXN_FAILED, action + " failed.", data);
        };
    }
}
