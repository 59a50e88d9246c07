package com.linlay.carassist.tool;

import com.linlay.carassist.storage.StorageGateway;
import com.linlay.carassist.storage.StorageSession;
import com.linlay.carassist.storage.Table;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class CarAddTool extends AbstractStorageTool {

    public CarAddTool(StorageGateway storageGateway) {
        super(storageGateway);
    }

    @Override
    public ToolName name() {
        return ToolName.CAR_ADD;
    }

    @Override
    public String description() {
        return "Create a new car listing when the user wants to sell a car or gives details for a new listing "
                + "(upserts by VIN). seller_ask_cents may be set, buyer_offer_cents may not.";
    }

    @Override
    public List<String> argumentNames() {
        return List.of("vin", "year", "make", "model", "trim", "mileage",
                "interior_condition", "exterior_condition", "seller_ask_cents", "created_at");
    }

    @Override
    public boolean mutating() {
        return true;
    }

    @Override
    protected String actionLabel() {
        return "Insert/upsert";
    }

    @Override
    protected ToolResult run(StorageSession storage, ToolInvocation invocation) {
        Map<String, Object> values = ToolValues.onlyColumns(invocation.args(), Table.CARS.writableColumns());
        Object vin = values.get("vin");
        if (vin instanceof String text) {
            vin = text.trim().isEmpty() ? null : text.trim();
            if (vin == null) {
                values.remove("vin");
            } else {
                values.put("vin", vin);
            }
        }

        if (vin != null) {
            List<Map<String, Object>> existing = storage.findBy(Table.CARS, "vin", vin, false);
            if (!existing.isEmpty()) {
                return upsertExisting(storage, existing.get(0).get("id"), values);
            }
        }

        long temporaryId = nextTemporaryId(storage, Table.CARS);
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", temporaryId);
        row.putAll(values);
        storage.insert(Table.CARS, row);
        Map<String, Object> car = storage.findById(Table.CARS, temporaryId).orElse(Map.of("id", temporaryId));
        return ToolResult.success("Car added.", Map.of("car", car));
    }

    private ToolResult upsertExisting(StorageSession storage, Object carId, Map<String, Object> values) {
        int updated = 0;
        for (Map.Entry<String, Object> field : values.entrySet()) {
            if (storage.updateColumn(Table.CARS, carId, field.getKey(), field.getValue()) > 0) {
                updated++;
            }
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("car", storage.findById(Table.CARS, carId).orElse(Map.of("id", carId)));
        data.put("updated_fields", updated);
        return ToolResult.success(updated > 0 ? "Car upserted (existing VIN updated)." : "No fields changed.", data);
    }
}
