package com.linlay.carassist.tool;

import com.linlay.carassist.storage.StorageGateway;
import com.linlay.carassist.storage.StorageSession;
import com.linlay.carassist.storage.Table;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class AllPickupsTool extends AbstractStorageTool {

    public AllPickupsTool(StorageGateway storageGateway) {
        super(storageGateway);
    }

    @Override
    public ToolName name() {
        return ToolName.GET_ALL_PICKUPS;
    }

    @Override
    public String description() {
        return "Retrieve all pickups with all their details.";
    }

    @Override
    protected String actionLabel() {
        return "Query";
    }

    @Override
    protected ToolResult run(StorageSession storage, ToolInvocation invocation) {
        List<Map<String, Object>> pickups = storage.findAll(Table.PICKUP);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("pickups", pickups);
        data.put("count", pickups.size());
        return ToolResult.success("Retrieved " + pickups.size() + " pickup(s).", data);
    }
}
