package com.linlay.carassist.resolve;

import com.linlay.carassist.storage.Rows;
import com.linlay.carassist.storage.StorageException;
import com.linlay.carassist.storage.StorageGateway;
import com.linlay.carassist.storage.StorageSession;
import com.linlay.carassist.storage.Table;
import com.linlay.carassist.tool.ErrorCode;
import com.linlay.carassist.tool.StorageResults;
import com.linlay.carassist.tool.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Turns partial identifiers into exactly one canonical id or an explicit failure.
 * <p>
 * Only the highest-priority identifier present drives the lookup; the rest are reported as
 * ignored. Several matches never resolve: the caller gets at most {@value #MAX_CANDIDATES}
 * candidate summaries instead.
 */
@Component
public class EntityResolver {

    private static final Logger log = LoggerFactory.getLogger(EntityResolver.class);

    public static final int MAX_CANDIDATES = 5;

    private final StorageGateway storageGateway;

    public EntityResolver(StorageGateway storageGateway) {
        this.storageGateway = storageGateway;
    }

    public Resolution resolve(ResolutionFamily family, Map<String, Object> args, String storageDescriptor) {
        Map<String, Object> safeArgs = args == null ? Map.of() : args;

        Object direct = safeArgs.get(family.directKey());
        if (isPresent(direct)) {
            Long id = Rows.longValue(direct);
            if (id == null) {
                return Resolution.failed(mustBeInteger(family.directKey(), direct));
            }
            return Resolution.direct(family.directKey(), id);
        }

        List<IdentifierField> provided = new ArrayList<>();
        for (IdentifierField field : family.vehicleChain()) {
            if (isPresent(safeArgs.get(field.argName()))) {
                provided.add(field);
            }
        }
        if (provided.isEmpty()) {
            List<String> accepted = family.acceptedFields();
            return Resolution.failed(ToolResult.error(
                    ErrorCode.INVALID_INPUT,
                    "Provide " + String.join(", ", accepted) + ".",
                    Map.of("accepted_fields", accepted)
            ));
        }

        IdentifierField selected = provided.get(0);
        List<String> ignored = provided.subList(1, provided.size()).stream()
                .map(IdentifierField::argName)
                .toList();
        Object raw = safeArgs.get(selected.argName());
        Object value;
        if (selected.integer()) {
            value = Rows.longValue(raw);
            if (value == null) {
                return Resolution.failed(mustBeInteger(selected.argName(), raw));
            }
        } else {
            value = String.valueOf(raw).trim();
        }

        try {
            return storageGateway.execute(storageDescriptor,
                    storage -> lookup(storage, family, selected, value, ignored));
        } catch (StorageException ex) {
            log.warn("Resolution of {} by {} failed: {}", family, selected.argName(), ex.getMessage());
            return Resolution.failed(StorageResults.fromFailure(ex, "Lookup"));
        }
    }

    private Resolution lookup(
            StorageSession storage,
            ResolutionFamily family,
            IdentifierField selected,
            Object value,
            List<String> ignored
    ) {
        Map<String, Object> meta = meta(selected.argName(), value, ignored);

        long carId;
        Map<String, Object> carRow = null;
        if (selected.vehicleId()) {
            carId = (Long) value;
        } else {
            List<Map<String, Object>> cars = storage.findBy(Table.CARS, selected.column(), value, selected.fuzzy());
            if (cars.isEmpty()) {
                return Resolution.failed(ToolResult.error(ErrorCode.NOT_FOUND, "No matching car found.", meta));
            }
            if (cars.size() > 1) {
                return Resolution.failed(ambiguous(
                        "Multiple cars match. Refine with VIN or car_id.",
                        meta,
                        cars,
                        EntityResolver::carSummary
                ));
            }
            carRow = cars.get(0);
            carId = Rows.longValue(carRow.get(Table.CARS.idColumn()));
        }

        if (family == ResolutionFamily.VEHICLE) {
            return Resolution.matched(carId, carRow, selected.argName(), value, ignored);
        }

        List<Map<String, Object>> pickups = storage.findBy(Table.PICKUP, "car_id", carId, false);
        Map<String, Object> pickupMeta = new LinkedHashMap<>(meta);
        pickupMeta.put("car_id", carId);
        if (pickups.isEmpty()) {
            return Resolution.failed(ToolResult.error(ErrorCode.NOT_FOUND, "No pickup found for that car.", pickupMeta));
        }
        if (pickups.size() > 1) {
            return Resolution.failed(ambiguous(
                    "Multiple pickups exist for that car. Refine with pick_up_id.",
                    pickupMeta,
                    pickups,
                    EntityResolver::pickupSummary
            ));
        }
        Map<String, Object> pickup = pickups.get(0);
        return Resolution.matched(
                Rows.longValue(pickup.get(Table.PICKUP.idColumn())),
                pickup,
                selected.argName(),
                value,
                ignored
        );
    }

    private static ToolResult ambiguous(
            String message,
            Map<String, Object> meta,
            List<Map<String, Object>> rows,
            Function<Map<String, Object>, Map<String, Object>> summary
    ) {
        Map<String, Object> data = new LinkedHashMap<>(meta);
        data.put("match_count", rows.size());
        data.put("candidates", rows.stream().limit(MAX_CANDIDATES).map(summary).toList());
        return ToolResult.unsure(ErrorCode.AMBIGUOUS, message, data);
    }

    static Map<String, Object> carSummary(Map<String, Object> row) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("id", row.get("id"));
        summary.put("year", row.get("year"));
        summary.put("make", row.get("make"));
        summary.put("model", row.get("model"));
        summary.put("vin", row.get("vin"));
        return summary;
    }

    static Map<String, Object> pickupSummary(Map<String, Object> row) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("pick_up_id", row.get("pick_up_id"));
        summary.put("car_id", row.get("car_id"));
        summary.put("address", row.get("address"));
        summary.put("dropoff_time", row.get("dropoff_time"));
        return summary;
    }

    private static Map<String, Object> meta(String key, Object value, List<String> ignored) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("selected_key", key);
        meta.put("selected_value", value);
        meta.put("ignored_keys", ignored);
        return meta;
    }

    private static ToolResult mustBeInteger(String key, Object received) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("received", received);
        return ToolResult.error(ErrorCode.INVALID_INPUT, key + " must be an integer.", data);
    }

    private static boolean isPresent(Object value) {
        return value != null && !String.valueOf(value).isBlank();
    }
}
