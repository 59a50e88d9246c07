package com.linlay.carassist.tool;

import com.linlay.carassist.storage.StorageGateway;
import com.linlay.carassist.storage.StorageSession;
import com.linlay.carassist.storage.Table;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class AllCarsTool extends AbstractStorageTool {

    public AllCarsTool(StorageGateway storageGateway) {
        super(storageGateway);
    }

    @Override
    public ToolName name() {
        return ToolName.GET_ALL_CARS;
    }

    @Override
    public String description() {
        return "Retrieve all cars with all their details.";
    }

    @Override
    protected String actionLabel() {
        return "Query";
    }

    @Override
    protected ToolResult run(StorageSession storage, ToolInvocation invocation) {
        List<Map<String, Object>> cars = storage.findAll(Table.CARS);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("cars", cars);
        data.put("count", cars.size());
        return ToolResult.success("Retrieved " + cars.size() + " car(s).", data);
    }
}
