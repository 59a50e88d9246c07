package com.linlay.carassist.tool;

import com.linlay.carassist.storage.Rows;
import com.linlay.carassist.storage.StorageGateway;
import com.linlay.carassist.storage.StorageSession;
import com.linlay.carassist.storage.Table;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class PickupAddTool extends AbstractStorageTool {

    public PickupAddTool(StorageGateway storageGateway) {
        super(storageGateway);
    }

    @Override
    public ToolName name() {
        return ToolName.PICKUP_ADD;
    }

    @Override
    public String description() {
        return "Create a new pickup request for a car.";
    }

    @Override
    public List<String> argumentNames() {
        return List.of("car_id", "address", "contact_phone", "pick_up_info", "created_at", "dropoff_time");
    }

    @Override
    public boolean mutating() {
        return true;
    }

    @Override
    protected String actionLabel() {
        return "Insert";
    }

    @Override
    protected ToolResult precheck(ToolInvocation invocation) {
        Object carId = invocation.arg("car_id");
        if (carId != null && Rows.longValue(carId) == null) {
            return ToolResult.error(ErrorCode.INVALID_INPUT, "car_id must be an integer.", ToolValues.received(carId));
        }
        return null;
    }

    @Override
    protected ToolResult run(StorageSession storage, ToolInvocation invocation) {
        Map<String, Object> values = ToolValues.onlyColumns(invocation.args(), Table.PICKUP.writableColumns());
        Long carId = Rows.longValue(values.get("car_id"));
        if (carId != null) {
            if (!storage.exists(Table.CARS, carId)) {
                return ToolResult.error(ErrorCode.PRECONDITION_FAILED, "Invalid car_id (no such car).", Map.of("car_id", carId));
            }
            values.put("car_id", carId);
        }

        long temporaryId = nextTemporaryId(storage, Table.PICKUP);
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("pick_up_id", temporaryId);
        row.putAll(values);
        storage.insert(Table.PICKUP, row);
        Map<String, Object> pickup = storage.findById(Table.PICKUP, temporaryId).orElse(Map.of("pick_up_id", temporaryId));
        return ToolResult.success("Pickup added.", Map.of("pickup", pickup));
    }
}
