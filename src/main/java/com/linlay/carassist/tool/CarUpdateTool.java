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
public class CarUpdateTool extends AbstractStorageTool {

    public CarUpdateTool(StorageGateway storageGateway) {
        super(storageGateway);
    }

    @Override
    public ToolName name() {
        return ToolName.CAR_UPDATE;
    }

    @Override
    public String description() {
        return "Update a car by car_id (or vin/model/make/year); supply only the fields to change. "
                + "seller_ask_cents may be set, buyer_offer_cents may not.";
    }

    @Override
    public List<String> argumentNames() {
        return List.of("car_id", "vin", "year", "make", "model", "trim", "mileage",
                "interior_condition", "exterior_condition", "seller_ask_cents", "created_at");
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
        return Optional.of(ResolutionFamily.VEHICLE);
    }

    @Override
    protected String actionLabel() {
        return "Update";
    }

    @Override
    protected ToolResult precheck(ToolInvocation invocation) {
        if (ToolValues.onlyColumns(invocation.args(), Table.CARS.writableColumns()).isEmpty()) {
            return ToolResult.error(ErrorCode.INVALID_INPUT, "No allowed fields to update.",
                    Map.of("allowed_fields", List.copyOf(new TreeSet<>(Table.CARS.writableColumns()))));
        }
        return null;
    }

    @Override
    protected ToolResult run(StorageSession storage, ToolInvocation invocation) {
        long carId = invocation.resolution().id();
        if (!storage.exists(Table.CARS, carId)) {
            return ToolResult.error(ErrorCode.NOT_FOUND, "Car id " + carId + " not found.");
        }
        int updated = 0;
        for (Map.Entry<String, Object> field : ToolValues.onlyColumns(invocation.args(), Table.CARS.writableColumns()).entrySet()) {
            if (storage.updateColumn(Table.CARS, carId, field.getKey(), field.getValue()) > 0) {
                updated++;
            }
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("car_id", carId);
        data.put("updated_fields", updated);
        return ToolResult.success(updated > 0 ? "Car updated (" + updated + " fields)." : "No fields changed.", data);
    }
}
