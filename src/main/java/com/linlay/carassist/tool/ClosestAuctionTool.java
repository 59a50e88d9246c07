package com.linlay.carassist.tool;

import com.linlay.carassist.geo.ClosestAuction;
import com.linlay.carassist.geo.ClosestAuctionFinder;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
public class ClosestAuctionTool implements BaseTool {

    private final ClosestAuctionFinder finder;

    public ClosestAuctionTool(ClosestAuctionFinder finder) {
        this.finder = finder;
    }

    @Override
    public ToolName name() {
        return ToolName.GET_CLOSEST;
    }

    @Override
    public String description() {
        return "Find the nearest drop-off location to the user's address (state is the 2-letter code).";
    }

    @Override
    public List<String> argumentNames() {
        return List.of("user_address", "state");
    }

    @Override
    public ToolResult invoke(ToolInvocation invocation) {
        String address = invocation.text("user_address");
        if (address.isEmpty()) {
            return ToolResult.error(ErrorCode.INVALID_INPUT, "user_address is required.");
        }
        Optional<ClosestAuction> closest = finder.find(address, invocation.text("state"));
        if (closest.isEmpty()) {
            return ToolResult.error(ErrorCode.NOT_FOUND, "No nearby locations found.");
        }
        ClosestAuction auction = closest.get();
        String message = auction.thresholdExceeded()
                ? "Closest drop-off is " + auction.distanceMiles() + " miles away."
                : "Closest drop-off found.";
        return ToolResult.success(message, auction.toMap());
    }
}
