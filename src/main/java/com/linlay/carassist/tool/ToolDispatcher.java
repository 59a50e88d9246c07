package com.linlay.carassist.tool;

import com.linlay.carassist.plan.Plan;
import com.linlay.carassist.plan.PlanValidator;
import com.linlay.carassist.resolve.EntityResolver;
import com.linlay.carassist.resolve.Resolution;
import com.linlay.carassist.resolve.ResolutionFamily;
import com.linlay.carassist.session.SessionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

@Component
public class ToolDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);

    private final ToolRegistry toolRegistry;
    private final EntityResolver entityResolver;

    public ToolDispatcher(ToolRegistry toolRegistry, EntityResolver entityResolver) {
        this.toolRegistry = toolRegistry;
        this.entityResolver = entityResolver;
    }

    public ToolResult dispatch(Plan.Tool plan, SessionContext session) {
        Optional<BaseTool> found = toolRegistry.find(plan.name());
        if (found.isEmpty()) {
            log.warn("[{}] unknown tool '{}'", session.shortId(), plan.name());
            return ToolResult.error(ErrorCode.INVALID_INPUT, "Unknown tool '" + plan.name() + "'.");
        }
        BaseTool tool = found.get();
        Map<String, Object> args = new LinkedHashMap<>(plan.args());

        if (tool.mutating() && args.containsKey(PlanValidator.RESTRICTED_FIELD)) {
            log.warn("[{}] refused {}: {} is operator-only", session.shortId(), tool.name().wireName(), PlanValidator.RESTRICTED_FIELD);
            return ToolResult.error(
                    ErrorCode.FORBIDDEN,
                    "Only an internal operator can set " + PlanValidator.RESTRICTED_FIELD + ".",
                    Map.of("field", PlanValidator.RESTRICTED_FIELD)
            );
        }

        injectSessionFields(tool.name(), args, session);

        try {
            Resolution resolution = null;
            if (tool.resolution().isPresent()) {
                ResolutionFamily family = tool.resolution().get();
                resolution = entityResolver.resolve(family, args, session.storageDescriptor());
                if (!resolution.resolved()) {
                    log.info("[{}] {} target unresolved code={}", session.shortId(), tool.name().wireName(), resolution.failure().code());
                    return resolution.failure();
                }
                if (tool.patch()) {
                    args.remove(family.directKey());
                    resolution.consumedKeys().forEach(args::remove);
                }
            }
            if (tool.patch()) {
                args.values().removeIf(Objects::isNull);
            }
            log.debug("[{}] invoking {} with fields {}", session.shortId(), tool.name().wireName(), args.keySet());
            return tool.invoke(new ToolInvocation(args, session, resolution));
        } catch (RuntimeException ex) {
            log.error("[{}] operation {} failed", session.shortId(), tool.name().wireName(), ex);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("error", String.valueOf(ex.getMessage()));
            return ToolResult.error(ErrorCode.TXN_FAILED, "That did not work.", data);
        }
    }

    private void injectSessionFields(ToolName name, Map<String, Object> args, SessionContext session) {
        if (name == ToolName.CAR_ADD && session.leadId() != null) {
            args.putIfAbsent("lead_id", session.leadId());
        }
    }
}
