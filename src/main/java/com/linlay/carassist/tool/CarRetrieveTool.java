package com.linlay.carassist.tool;

import com.linlay.carassist.resolve.Resolution;
import com.linlay.carassist.resolve.ResolutionFamily;
import com.linlay.carassist.storage.StorageGateway;
import com.linlay.carassist.storage.StorageSession;
import com.linlay.carassist.storage.Table;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class CarRetrieveTool extends AbstractStorageTool {

    public CarRetrieveTool(StorageGateway storageGateway) {
        super(storageGateway);
    }

    @Override
    public ToolName name() {
        return ToolName.CAR_RETRIEVE;
    }

    @Override
    public String description() {
        return "Get car details. Provide any of: car_id, vin, model, make, year.";
    }

    @Override
    public List<String> argumentNames() {
        return List.of("car_id", "vin", "model", "make", "year");
    }

    @Override
    public Optional<ResolutionFamily> resolution() {
        return Optional.of(ResolutionFamily.VEHICLE);
    }

    @Override
    protected ToolResult run(StorageSession storage, ToolInvocation invocation) {
        Resolution resolution = invocation.resolution();
        Map<String, Object> data = resolution.meta();
        Map<String, Object> car = resolution.lookedUp()
                ? resolution.row()
                : storage.findById(Table.CARS, resolution.id()).orElse(null);
        if (car == null) {
            return ToolResult.error(ErrorCode.NOT_FOUND, "No matching car found.", data);
        }
        data.put("car", car);
        return ToolResult.success("Car retrieved.", data);
    }
}
