package com.linlay.carassist.session;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

public class TurnLog {

    public static final String USER_INPUT = "user_input";
    public static final String PLANNER_FAIL = "planner_fail";
    public static final String PLAN_INVALID = "plan_invalid";
    public static final String CHAT = "chat";
    public static final String TOOL_CALL = "tool_call";
    public static final String TOOL_RESULT = "tool_result";
    public static final String TOOL_RESPONSE_GENERATED = "tool_response_generated";

    private final Clock clock;
    private final List<TurnLogEntry> entries = new ArrayList<>();

    public TurnLog(Clock clock) {
        this.clock = clock;
    }

    public synchronized TurnLogEntry append(String event, String detail) {
        TurnLogEntry entry = new TurnLogEntry(event, detail == null ? "" : detail, clock.instant());
        entries.add(entry);
        return entry;
    }

    public synchronized List<TurnLogEntry> recent(int limit) {
        if (limit <= 0 || entries.isEmpty()) {
            return List.of();
        }
        int from = Math.max(0, entries.size() - limit);
        return List.copyOf(new ArrayList<>(entries.subList(from, entries.size())));
    }

    public synchronized List<TurnLogEntry> snapshot() {
        return List.copyOf(entries);
    }

    public synchronized int size() {
        return entries.size();
    }
}
