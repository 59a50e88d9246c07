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
public class BuyerAvailabilityTool extends AbstractStorageTool {

    public BuyerAvailabilityTool(StorageGateway storageGateway) {
        super(storageGateway);
    }

    @Override
    public ToolName name() {
        return ToolName.GET_BUYER_AVAILABILITY;
    }

    @Override
    public String description() {
        return "Return all schedule rows for the buyer, ordered by schedule_time.";
    }

    @Override
    protected ToolResult precheck(ToolInvocation invocation) {
        if (Rows.longValue(invocation.session().buyerId()) == null) {
            return ToolResult.error(ErrorCode.INVALID_INPUT, "buyer_id must be an integer.",
                    ToolValues.received(invocation.session().buyerId()));
        }
        return null;
    }

    @Override
    protected ToolResult run(StorageSession storage, ToolInvocation invocation) {
        long buyerId = Rows.longValue(invocation.session().buyerId());
        if (!storage.exists(Table.BUYERS, buyerId)) {
            return ToolResult.error(ErrorCode.NOT_FOUND, "Buyer id " + buyerId + " not found.");
        }
        List<Map<String, Object>> schedules = storage.findWhere(
                Table.BUYER_SCHEDULE,
                Map.of("buyer_id", buyerId),
                "schedule_time"
        );
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("buyer_id", buyerId);
        data.put("schedules", schedules);
        return ToolResult.success(schedules.isEmpty() ? "No schedules found." : "Availability retrieved.", data);
    }
}
