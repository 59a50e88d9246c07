package com.linlay.carassist.plan;

import com.linlay.carassist.tool.ToolName;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Structural and authorization checks on a parsed plan. Pure: no state, no side effects, and
 * the input is never modified.
 */
@Component
public class PlanValidator {

    public static final String ACTION_CHAT = "chat";
    public static final String ACTION_TOOL = "tool";

    /**
     * Values the runtime injects from the session. The model may never supply them.
     */
    public static final List<String> SESSION_OWNED_KEYS = List.of(
            "sqlite_path",
            "storage_descriptor",
            "lead_id",
            "buyer_id",
            "receiver_number",
            "escalation_phone"
    );

    /**
     * The company's offer; only an internal operator may set it.
     */
    public static final String RESTRICTED_FIELD = "buyer_offer_cents";

    /**
     * First violation found, or empty when the plan is valid.
     */
    public Optional<String> validate(Object candidate) {
        if (!(candidate instanceof Map<?, ?> plan)) {
            return Optional.of("plan is not a JSON object");
        }
        Object action = plan.get("action");
        if (ACTION_CHAT.equals(action)) {
            if (!(plan.get("answer") instanceof String)) {
                return Optional.of("chat plan must include string 'answer'");
            }
            return Optional.empty();
        }
        if (!ACTION_TOOL.equals(action)) {
            return Optional.of("action must be 'chat' or 'tool'");
        }

        Object name = plan.get("name");
        if (!(name instanceof String toolName) || ToolName.fromWire(toolName).isEmpty()) {
            return Optional.of("unknown tool '" + name + "'");
        }
        if (!(plan.get("args") instanceof Map<?, ?> args)) {
            return Optional.of("tool plan must include object 'args'");
        }
        for (String key : SESSION_OWNED_KEYS) {
            if (args.containsKey(key)) {
                return Optional.of("args must not include " + String.join(", ", SESSION_OWNED_KEYS));
            }
        }
        if (args.containsKey(RESTRICTED_FIELD)) {
            return Optional.of("args must not include " + RESTRICTED_FIELD + " (only an internal operator can set the company's offer)");
        }
        return Optional.empty();
    }

    /**
     * Typed view of a plan that {@link #validate} accepted.
     *
     * @throws IllegalArgumentException if the plan does not validate
     */
    @SuppressWarnings("unchecked")
    public Plan toPlan(Map<String, Object> plan) {
        Optional<String> violation = validate(plan);
        if (violation.isPresent()) {
            throw new IllegalArgumentException(violation.get());
        }
        if (ACTION_CHAT.equals(plan.get("action"))) {
            return new Plan.Chat((String) plan.get("answer"));
        }
        return new Plan.Tool((String) plan.get("name"), (Map<String, Object>) plan.get("args"));
    }
}
