package com.linlay.carassist.tool;

import com.linlay.carassist.storage.Rows;
import com.linlay.carassist.storage.StorageGateway;
import com.linlay.carassist.storage.StorageSession;
import com.linlay.carassist.storage.Table;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public class AddBuyerScheduleTool extends AbstractStorageTool {

    static final List<String> PRIORITIES = List.of("High", "Low", "Medium");
    static final String DEFAULT_PRIORITY = "Medium";

    public AddBuyerScheduleTool(StorageGateway storageGateway) {
        super(storageGateway);
    }

    @Override
    public ToolName name() {
        return ToolName.ADD_BUYER_SCHEDULE;
    }

    @Override
    public String description() {
        return "Schedule a meeting or appointment for the buyer. Requires description and schedule_time; "
                + "priority is Low, Medium or High. A time that is already booked is rejected.";
    }

    @Override
    public List<String> argumentNames() {
        return List.of("description", "schedule_time", "priority");
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
        if (Rows.longValue(invocation.session().buyerId()) == null) {
            return ToolResult.error(ErrorCode.INVALID_INPUT, "buyer_id must be an integer.",
                    ToolValues.received(invocation.session().buyerId()));
        }
        if (invocation.text("description").isEmpty()) {
            return ToolResult.error(ErrorCode.INVALID_INPUT, "description is required.");
        }
        if (priority(invocation) == null) {
            return ToolResult.error(ErrorCode.INVALID_INPUT, "priority must be one of " + PRIORITIES,
                    ToolValues.received(invocation.arg("priority")));
        }
        if (ToolValues.dateTime(invocation.arg("schedule_time")).isEmpty()) {
            return ToolResult.error(ErrorCode.INVALID_INPUT, "schedule_time is invalid.",
                    ToolValues.received(String.valueOf(invocation.arg("schedule_time"))));
        }
        return null;
    }

    @Override
    protected ToolResult run(StorageSession storage, ToolInvocation invocation) {
        long buyerId = Rows.longValue(invocation.session().buyerId());
        String scheduleTime = ToolValues.dateTime(invocation.arg("schedule_time"));
        if (!storage.exists(Table.BUYERS, buyerId)) {
            return ToolResult.error(ErrorCode.NOT_FOUND, "Buyer id " + buyerId + " not found.");
        }

        Map<String, Object> slot = new LinkedHashMap<>();
        slot.put("buyer_id", buyerId);
        slot.put("schedule_time", scheduleTime);
        List<Map<String, Object>> existing = storage.findWhere(Table.BUYER_SCHEDULE, slot, "id");
        if (!existing.isEmpty()) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("existing_schedule", existing.get(0));
            data.put("requested_time", scheduleTime);
            return ToolResult.error(
                    ErrorCode.TIME_ALREADY_BOOKED,
                    "The buyer is already booked at " + scheduleTime + ". Please choose another time.",
                    data
            );
        }

        Map<String, Object> row = new LinkedHashMap<>(slot);
        row.put("description", invocation.text("description"));
        row.put("priority", priority(invocation));
        storage.insert(Table.BUYER_SCHEDULE, row);

        List<Map<String, Object>> inserted = storage.findWhere(Table.BUYER_SCHEDULE, slot, "id");
        Map<String, Object> schedule = inserted.isEmpty() ? row : inserted.get(inserted.size() - 1);
        return ToolResult.success("Schedule added.", Map.of("schedule", schedule));
    }

    private static String priority(ToolInvocation invocation) {
        String raw = invocation.text("priority");
        if (raw.isEmpty()) {
            return DEFAULT_PRIORITY;
        }
        String titled = raw.substring(0, 1).toUpperCase(Locale.ROOT) + raw.substring(1).toLowerCase(Locale.ROOT);
        return PRIORITIES.contains(titled) ? titled : null;
    }
}
