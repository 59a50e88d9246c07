package com.linlay.carassist.tool;

import com.linlay.carassist.resolve.Resolution;
import com.linlay.carassist.resolve.ResolutionFamily;
import com.linlay.carassist.storage.StorageGateway;
import com.linlay.carassist.storage.StorageSession;
import com.linlay.carassist.storage.Table;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class PickupRetrieveTool extends AbstractStorageTool {

    public PickupRetrieveTool(StorageGateway storageGateway) {
        super(storageGateway);
    }

    @Override
    public ToolName name() {
        return ToolName.PICKUP_RETRIEVE;
    }

    @Override
    public String description() {
        return "Get an existing pickup by pick_up_id, or by the car it belongs to (car_id, vin, model, make, year).";
    }

    @Override
    public List<String> argumentNames() {
        return List.of("pick_up_id", "car_id", "vin", "model", "make", "year");
    }

    @Override
    public Optional<ResolutionFamily> resolution() {
        return Optional.of(ResolutionFamily.PICKUP);
    }

    @Override
    protected ToolResult run(StorageSession storage, ToolInvocation invocation) {
        Resolution resolution = invocation.resolution();
        Map<String, Object> pickup = resolution.lookedUp()
                ? resolution.row()
                : storage.findById(Table.PICKUP, resolution.id()).orElse(null);
        if (pickup == null) {
            return ToolResult.error(ErrorCode.NOT_FOUND, "Pickup not found.", Map.of("pick_up_id", resolution.id()));
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("pickup", pickup);
        if (resolution.lookedUp()) {
            data.putAll(resolution.meta());
        }
        return ToolResult.success("Pickup retrieved.", data);
    }
}
