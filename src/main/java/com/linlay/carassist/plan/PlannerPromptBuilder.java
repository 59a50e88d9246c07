package com.linlay.carassist.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.carassist.session.SessionContext;
import com.linlay.carassist.session.TurnLogEntry;
import com.linlay.carassist.tool.BaseTool;
import com.linlay.carassist.tool.ToolName;
import com.linlay.carassist.tool.ToolRegistry;
import com.linlay.carassist.tool.ToolResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

@Component
public class PlannerPromptBuilder {

    public static final int CONTEXT_LOG_ENTRIES = 3;
    static final int LOG_SNIPPET_CHARS = 300;

    private static final String PLANNER_RULES = """
            You are a planner that decides whether to respond directly or call ONE tool.

            Return EXACTLY ONE JSON object (and nothing else) inside ```json code fences.

            Valid outputs:

            ```json
            {"action":"chat","answer":"<final user-facing text>"}
            ```
            OR
            ```json
            {"action":"tool","name":"<one_of:%s>","args":{}}
            ```

            Rules:
            - If you do not have enough details to call a tool, ask a short clarifying question with action="chat".
            - NEVER include %s or %s in args. The runtime injects the session values; %s can only be set by company employees.
            - You represent the buyer company. Customers are sellers. You can ask what they want to sell for (seller_ask_cents), but you CANNOT set %s.
            - Use ONE tool only per response.
            - Keep args minimal and valid for the chosen tool (e.g., for car_retrieve use one of: car_id, vin, model, make, year).
            - Output must be valid JSON (double quotes, no trailing commas).
            - Always attempt tool calls when the user's request matches a tool's purpose, even if previous tool calls failed.
            """;

    private final ToolRegistry toolRegistry;
    private final ObjectMapper objectMapper;

    public PlannerPromptBuilder(ToolRegistry toolRegistry, ObjectMapper objectMapper) {
        this.toolRegistry = toolRegistry;
        this.objectMapper = objectMapper;
    }

    public String planningPrompt(String userMessage, SessionContext session, List<TurnLogEntry> recentLog) {
        StringBuilder prompt = new StringBuilder();
        prompt.append(String.format(
                PLANNER_RULES,
                ToolName.wireNames(),
                String.join(", ", PlanValidator.SESSION_OWNED_KEYS),
                PlanValidator.RESTRICTED_FIELD,
                PlanValidator.RESTRICTED_FIELD,
                PlanValidator.RESTRICTED_FIELD
        ));
        prompt.append("\n\nAvailable Tools:\n").append(toolCatalog());
        prompt.append("\n\nContext:\n");
        prompt.append("- lead_id: ").append(session.leadId()).append('\n');
        String snippet = logSnippet(recentLog);
        if (!snippet.isEmpty()) {
            prompt.append("- recent_logs: ").append(snippet).append('\n');
        }
        prompt.append("\nUser says:\n").append(userMessage == null ? "" : userMessage);
        prompt.append("\n\nReturn only ONE JSON object inside ```json fences.");
        return prompt.toString();
    }

    public String phrasingPrompt(String userMessage, String toolName, ToolResult result) {
        return "The user asked: \"" + userMessage + "\"\n\n"
                + "I called the tool '" + toolName + "' and got this result:\n"
                + toJson(result) + "\n\n"
                + "Please provide a natural, conversational response to the user's question based on this tool result. "
                + "Be concise and directly answer what they asked. Return ONLY the response text, no JSON, "
                + "no code blocks, just plain conversational text.";
    }

    String toolCatalog() {
        return toolRegistry.list().stream()
                .map(this::catalogLine)
                .collect(Collectors.joining("\n"));
    }

    private String catalogLine(BaseTool tool) {
        String args = tool.argumentNames().isEmpty() ? "" : " (args: " + String.join(", ", tool.argumentNames()) + ")";
        String description = tool.description().isBlank() ? "No description available" : tool.description();
        return "- " + tool.name().wireName() + args + ": " + description;
    }

    static String logSnippet(List<TurnLogEntry> recentLog) {
        if (recentLog == null || recentLog.isEmpty()) {
            return "";
        }
        String joined = recentLog.stream()
                .map(entry -> entry.event() + ":" + entry.detail())
                .collect(Collectors.joining("; "));
        return joined.length() > LOG_SNIPPET_CHARS ? joined.substring(0, LOG_SNIPPET_CHARS) : joined;
    }

    private String toJson(ToolResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException ex) {
            return String.valueOf(result);
        }
    }
}
