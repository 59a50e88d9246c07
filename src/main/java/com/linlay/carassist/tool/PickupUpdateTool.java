package com.linlay.carassist.tool;

import com.linlay.carassist.resolve.ResolutionFamily;
import com.linlay.carassist.storage.StorageGateway;
import com.linlay.carassist.storage.StorageSession;
import com.linlay.carassist.storage.Table;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

@Component
public class PickupUpdateTool extends AbstractStorageTool {

    public PickupUpdateTool(StorageGateway storageGateway) {
        super(storageGateway);
    }

    @Override
    public ToolName name() {
        return ToolName.PICKUP_UPDATE;
    }

    @Override
    public String description() {
        return "Update a pickup by pick_up_id (or by its car); supply only the fields to change.";
    }

    @Override
    public List<String> argumentNames() {
        return List.of("pick_up_id", "car_id", "address", "contact_phone", "pick_up_info", "created_at", "dropoff_time");
    }

    @Override
    public boolean mutating() {
        return true;
    }

    @Override
    public boolean patch() {
        return true;
    }

    @Override
    public Optional<ResolutionFamily> resolution() {
        return Optional.of(ResolutionFamily.PICKUP);
    }

    @Override
    protected String actionLabel() {
        return "Update";
    }

    @Override
    protected ToolResult precheck(ToolInvocation invocation) {
        if (ToolValues.onlyColumns(invocation.args(), Table.PICKUP.writableColumns()).isEmpty()) {
            return ToolResult.error(ErrorCode.INVALID_INPUT, "No allowed fields to update.",
                    Map.of("allowed_fields", List.copyOf(new TreeSet<>(Table.PICKUP.writableColumns()))));
        }
        return null;
    }

    @Override
    protected ToolResult run(StorageSession storage, ToolInvocation invocation) {
        long pickUpId = invocation.resolution().id();
        if (!storage.exists(Table.PICKUP, pickUpId)) {
            return ToolResult.error(ErrorCode.NOT_FOUND, "Pickup id " + pickUpId + " not found.");
        }
        int updated = 0;
        for (Map.Entry<String, Object> field : ToolValues.onlyColumns(invocation.args(), Table.PICKUP.writableColumns()).entrySet()) {
            if (storage.updateColumn(Table.PICKUP, pickUpId, field.getKey(), field.getValue()) > 0) {
                updated++;
            }
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("pick_up_id", pickUpId);
        data.put("updated_fields", updated);
        return ToolResult.success(updated > 0 ? "Pickup updated (" + updated + " fields)." : "No fields changed.", data);
    }
}
