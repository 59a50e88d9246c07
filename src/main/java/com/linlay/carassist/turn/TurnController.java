package com.linlay.carassist.turn;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.carassist.backend.ChatReply;
import com.linlay.carassist.normalize.ResponseNormalizer;
import com.linlay.carassist.plan.Plan;
import com.linlay.carassist.plan.PlanParser;
import com.linlay.carassist.plan.PlanValidator;
import com.linlay.carassist.plan.PlannerPromptBuilder;
import com.linlay.carassist.session.SessionContext;
import com.linlay.carassist.session.SessionState;
import com.linlay.carassist.session.TurnLog;
import com.linlay.carassist.tool.ErrorCode;
import com.linlay.carassist.tool.ToolDispatcher;
import com.linlay.carassist.tool.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Runs one conversational turn: plan, validate, optionally dispatch one operation, and phrase
 * the outcome. Every step is traced in the session's {@link TurnLog}. Turns never throw for
 * planner, validation or backend trouble; those end in a user-facing sentence.
 */
@Component
public class TurnController {

    private static final Logger log = LoggerFactory.getLogger(TurnController.class);

    public static final String NO_PLAN_REPLY = "Sorry, I couldn't figure out a plan. Could you rephrase?";
    public static final String INVALID_PLAN_REPLY = "Sorry, my plan came out malformed. Please try again.";
    public static final String GENERIC_FAILURE_REPLY = "That did not work.";

    static final int RAW_DETAIL_CHARS = 200;
    static final int ANSWER_DETAIL_CHARS = 120;

    private final PlannerPromptBuilder promptBuilder;
    private final PlanParser planParser;
    private final PlanValidator planValidator;
    private final ToolDispatcher toolDispatcher;
    private final ResponseNormalizer responseNormalizer;
    private final ObjectMapper objectMapper;

    public TurnController(
            PlannerPromptBuilder promptBuilder,
            PlanParser planParser,
            PlanValidator planValidator,
            ToolDispatcher toolDispatcher,
            ResponseNormalizer responseNormalizer,
            ObjectMapper objectMapper
    ) {
        this.promptBuilder = promptBuilder;
        this.planParser = planParser;
        this.planValidator = planValidator;
        this.toolDispatcher = toolDispatcher;
        this.responseNormalizer = responseNormalizer;
        this.objectMapper = objectMapper;
    }

    public String handle(SessionState state, String userMessage) {
        ReentrantLock lock = state.turnLock();
        lock.lock();
        try {
            return runTurn(state, userMessage == null ? "" : userMessage);
        } finally {
            lock.unlock();
        }
    }

    private String runTurn(SessionState state, String userMessage) {
        SessionContext session = state.context();
        TurnLog turnLog = state.log();
        turnLog.append(TurnLog.USER_INPUT, userMessage);

        String prompt = promptBuilder.planningPrompt(
                userMessage,
                session,
                turnLog.recent(PlannerPromptBuilder.CONTEXT_LOG_ENTRIES)
        );
        ChatReply planReply = state.backendClient().ask(prompt);
        if (!planReply.delivered()) {
            turnLog.append(TurnLog.PLANNER_FAIL, "backend failure after " + planReply.attempts() + " attempts");
            log.warn("[{}] planner unavailable after {} attempts", session.shortId(), planReply.attempts());
            return planReply.text();
        }

        Optional<Map<String, Object>> parsed = planParser.parse(planReply.text());
        if (parsed.isEmpty()) {
            turnLog.append(TurnLog.PLANNER_FAIL, truncate(planReply.text(), RAW_DETAIL_CHARS));
            log.info("[{}] no plan in backend reply", session.shortId());
            return NO_PLAN_REPLY;
        }

        Optional<String> violation = planValidator.validate(parsed.get());
        if (violation.isPresent()) {
            turnLog.append(TurnLog.PLAN_INVALID, truncate(violation.get(), RAW_DETAIL_CHARS));
            log.info("[{}] plan rejected: {}", session.shortId(), violation.get());
            return INVALID_PLAN_REPLY;
        }

        Plan plan = planValidator.toPlan(parsed.get());
        if (plan instanceof Plan.Chat chat) {
            String answer = responseNormalizer.normalize(chat.answer());
            turnLog.append(TurnLog.CHAT, truncate(answer, ANSWER_DETAIL_CHARS));
            return answer;
        }
        return runTool(state, userMessage, (Plan.Tool) plan);
    }

    private String runTool(SessionState state, String userMessage, Plan.Tool plan) {
        SessionContext session = state.context();
        TurnLog turnLog = state.log();
        turnLog.append(TurnLog.TOOL_CALL, truncate(plan.name() + "(" + toJson(plan.args()) + ")", RAW_DETAIL_CHARS));

        ToolResult result = toolDispatcher.dispatch(plan, session);
        turnLog.append(TurnLog.TOOL_RESULT, truncate(toJson(result), RAW_DETAIL_CHARS));
        log.info("[{}] {} -> status={} code={}", session.shortId(), plan.name(), result.status(), result.code());

        if (!result.isSuccess()) {
            return failureReply(result);
        }

        ChatReply phrased = state.backendClient().ask(promptBuilder.phrasingPrompt(userMessage, plan.name(), result));
        if (!phrased.delivered()) {
            log.warn("[{}] phrasing unavailable, returning the operation message", session.shortId());
            return StringUtils.hasText(result.message()) ? result.message() : GENERIC_FAILURE_REPLY;
        }
        String reply = responseNormalizer.normalize(phrased.text());
        turnLog.append(TurnLog.TOOL_RESPONSE_GENERATED, truncate(reply, ANSWER_DETAIL_CHARS));
        return reply;
    }

    static String failureReply(ToolResult result) {
        if (result.hasCode(ErrorCode.TIME_ALREADY_BOOKED)) {
            Object existing = result.data().get("existing_schedule");
            if (existing instanceof Map<?, ?> schedule && schedule.get("schedule_time") != null) {
                return "The buyer is already booked at " + schedule.get("schedule_time") + ". Please choose another time.";
            }
        }
        if (result.hasCode(ErrorCode.AMBIGUOUS)) {
            String options = candidateList(result.data().get("candidates"));
            if (!options.isEmpty()) {
                return result.message() + " Which one did you mean: " + options + "?";
            }
        }
        return StringUtils.hasText(result.message()) ? result.message() : GENERIC_FAILURE_REPLY;
    }

    private static String candidateList(Object candidates) {
        if (!(candidates instanceof List<?> list)) {
            return "";
        }
        return list.stream()
                .filter(Map.class::isInstance)
                .map(candidate -> describeCandidate((Map<?, ?>) candidate))
                .filter(StringUtils::hasText)
                .collect(Collectors.joining("; "));
    }

    private static String describeCandidate(Map<?, ?> candidate) {
        if (candidate.containsKey("pick_up_id")) {
            return "pickup " + candidate.get("pick_up_id") + " at " + candidate.get("address")
                    + " (drop-off " + candidate.get("dropoff_time") + ")";
        }
        String vehicle = List.of("year", "make", "model").stream()
                .map(candidate::get)
                .filter(value -> value != null && StringUtils.hasText(String.valueOf(value)))
                .map(String::valueOf)
                .collect(Collectors.joining(" "));
        return (vehicle.isEmpty() ? "car" : vehicle) + " (VIN " + candidate.get("vin") + ", id " + candidate.get("id") + ")";
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            return String.valueOf(value);
        }
    }

    static String truncate(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() > max ? text.substring(0, max) : text;
    }
}
