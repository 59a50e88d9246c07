package com.linlay.carassist.turn;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.carassist.backend.BackendCallLogger;
import com.linlay.carassist.backend.BackendRetryPolicy;
import com.linlay.carassist.backend.ChatBackendClient;
import com.linlay.carassist.config.ChatBackendProperties;
import com.linlay.carassist.normalize.ResponseNormalizer;
import com.linlay.carassist.plan.PlanParser;
import com.linlay.carassist.plan.PlanValidator;
import com.linlay.carassist.plan.PlannerPromptBuilder;
import com.linlay.carassist.resolve.EntityResolver;
import com.linlay.carassist.session.SessionState;
import com.linlay.carassist.session.TurnLog;
import com.linlay.carassist.session.TurnLogEntry;
import com.linlay.carassist.storage.JdbcStorageGateway;
import com.linlay.carassist.storage.StorageGateway;
import com.linlay.carassist.support.FakeChatBackendGateway;
import com.linlay.carassist.support.SqliteFixture;
import com.linlay.carassist.support.TestSessions;
import com.linlay.carassist.tool.AddBuyerScheduleTool;
import com.linlay.carassist.tool.BaseTool;
import com.linlay.carassist.tool.CarRetrieveTool;
import com.linlay.carassist.tool.CarUpdateTool;
import com.linlay.carassist.tool.ErrorCode;
import com.linlay.carassist.tool.ToolDispatcher;
import com.linlay.carassist.tool.ToolRegistry;
import com.linlay.carassist.tool.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class TurnControllerTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final FakeChatBackendGateway gateway = new FakeChatBackendGateway();
    private SqliteFixture fixture;
    private SessionState state;
    private TurnController controller;

    @BeforeEach
    void setUp() {
        fixture = SqliteFixture.create(tempDir)
                .car(1, "1HGCM82633A004352", 2003, "Honda", "Accord", 120000)
                .car(2, "2T1BURHE0JC014000", 2018, "Toyota", "Corolla", 40000)
                .car(3, "4T1B11HK5JU000001", 2018, "Toyota", "Camry", 35000)
                .buyer(5, "Dana")
                .schedule(5, "Inspect Corolla", "2026-03-02 15:00:00", "High");

        StorageGateway storageGateway = new JdbcStorageGateway();
        List<BaseTool> tools = List.of(
                new CarRetrieveTool(storageGateway),
                new CarUpdateTool(storageGateway),
                new AddBuyerScheduleTool(storageGateway)
        );
        ToolRegistry registry = new ToolRegistry(tools);
        controller = new TurnController(
                new PlannerPromptBuilder(registry, objectMapper),
                new PlanParser(objectMapper),
                new PlanValidator(),
                new ToolDispatcher(registry, new EntityResolver(storageGateway)),
                new ResponseNormalizer(objectMapper),
                objectMapper
        );
        ChatBackendClient client = new ChatBackendClient(
                gateway,
                new BackendRetryPolicy(4),
                new BackendCallLogger(),
                "77",
                null,
                ChatBackendProperties.DEFAULT_APOLOGY
        );
        state = new SessionState(TestSessions.session(fixture.descriptor()), new TurnLog(Clock.systemUTC()), client);
    }

    private List<String> events() {
        return state.log().snapshot().stream().map(TurnLogEntry::event).toList();
    }

    @Test
    void concurrentTurnsOnOneSessionShouldRunOneAfterAnother() throws Exception {
        CountDownLatch firstSendStarted = new CountDownLatch(1);
        CountDownLatch releaseFirstSend = new CountDownLatch(1);
        gateway.holdNextSend(firstSendStarted, releaseFirstSend)
                .reply("{\"action\":\"chat\",\"answer\":\"First answer.\"}",
                        "{\"action\":\"chat\",\"answer\":\"Second answer.\"}");
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<String> first = executor.submit(() -> controller.handle(state, "first question"));
            assertThat(firstSendStarted.await(5, TimeUnit.SECONDS)).isTrue();

            Future<String> second = executor.submit(() -> controller.handle(state, "second question"));
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (!state.turnLock().hasQueuedThreads() && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            assertThat(state.turnLock().hasQueuedThreads()).isTrue();
            assertThat(events()).containsExactly(TurnLog.USER_INPUT);

            releaseFirstSend.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo("First answer.");
            assertThat(second.get(5, TimeUnit.SECONDS)).isEqualTo("Second answer.");
        } finally {
            executor.shutdownNow();
        }

        assertThat(events()).containsExactly(TurnLog.USER_INPUT, TurnLog.CHAT, TurnLog.USER_INPUT, TurnLog.CHAT);
        assertThat(state.log().snapshot().get(0).detail()).isEqualTo("first question");
        assertThat(state.log().snapshot().get(2).detail()).isEqualTo("second question");
        List<Object> sessionIds = gateway.payloads().stream().map(payload -> payload.get("session_id")).toList();
        assertThat(sessionIds).hasSize(2).containsOnly("ext-1");
        assertThat(gateway.openRequests()).containsExactly(false);
    }

    @Test
    void chatPlanShouldReturnNormalizedAnswer() {
        gateway.reply("```json\n{\"action\":\"chat\",\"answer\":\"Your Accord shows 120,000 miles.\"}\n```");

        String reply = controller.handle(state, "what's my mileage");

        assertThat(reply).isEqualTo("Your Accord shows 120,000 miles.");
        assertThat(events()).containsExactly(TurnLog.USER_INPUT, TurnLog.CHAT);
    }

    @Test
    void silentBackendShouldReturnApologyAndLogPlannerFailure() {
        String reply = controller.handle(state, "hello?");

        assertThat(reply).isEqualTo(ChatBackendProperties.DEFAULT_APOLOGY);
        assertThat(events()).containsExactly(TurnLog.USER_INPUT, TurnLog.PLANNER_FAIL);
        assertThat(state.log().snapshot().get(1).detail()).isEqualTo("backend failure after 4 attempts");
    }

    @Test
    void bookedSlotShouldExplainTheConflict() {
        gateway.reply("{\"action\":\"tool\",\"name\":\"add_buyer_schedule\","
                + "\"args\":{\"description\":\"Second look\",\"schedule_time\":\"2026-03-02 15:00\"}}");

        String reply = controller.handle(state, "book Dana at 3pm on March 2nd");

        assertThat(reply).isEqualTo("The buyer is already booked at 2026-03-02 15:00:00. Please choose another time.");
        assertThat(events()).containsExactly(TurnLog.USER_INPUT, TurnLog.TOOL_CALL, TurnLog.TOOL_RESULT);
        // no phrasing request after a failed operation
        assertThat(gateway.payloads()).hasSize(1);
    }

    @Test
    void proseWithoutPlanShouldAskToRephrase() {
        gateway.reply("I am not sure what to do here.");

        String reply = controller.handle(state, "hmm");

        assertThat(reply).isEqualTo(TurnController.NO_PLAN_REPLY);
        assertThat(state.log().snapshot().get(1).event()).isEqualTo(TurnLog.PLANNER_FAIL);
        assertThat(state.log().snapshot().get(1).detail()).isEqualTo("I am not sure what to do here.");
    }

    @Test
    void planCarryingSessionKeysShouldBeRejected() {
        gateway.reply("{\"action\":\"tool\",\"name\":\"car_update\",\"args\":{\"car_id\":1,\"lead_id\":9,\"mileage\":1}}");

        String reply = controller.handle(state, "update it");

        assertThat(reply).isEqualTo(TurnController.INVALID_PLAN_REPLY);
        assertThat(events()).containsExactly(TurnLog.USER_INPUT, TurnLog.PLAN_INVALID);
        assertThat(((Number) fixture.query("SELECT mileage FROM cars WHERE id = 1").get(0).get("mileage")).intValue())
                .isEqualTo(120000);
    }

    @Test
    void successfulToolShouldBePhrasedForTheUser() {
        gateway.reply(
                "{\"action\":\"tool\",\"name\":\"car_update\",\"args\":{\"vin\":\"1HGCM82633A004352\",\"mileage\":50000}}",
                "{\"message\":\"Done, your Accord now shows 50,000 miles.\"}"
        );

        String reply = controller.handle(state, "set mileage to 50000");

        assertThat(reply).isEqualTo("Done, your Accord now shows 50,000 miles.");
        assertThat(events()).containsExactly(
                TurnLog.USER_INPUT, TurnLog.TOOL_CALL, TurnLog.TOOL_RESULT, TurnLog.TOOL_RESPONSE_GENERATED);
        String phrasingPrompt = String.valueOf(gateway.payloads().get(1).get("message"));
        assertThat(phrasingPrompt).contains("car_update").contains("\"updated_fields\":1");
    }

    @Test
    void unavailablePhrasingShouldFallBackToOperationMessage() {
        gateway.reply("{\"action\":\"tool\",\"name\":\"car_update\",\"args\":{\"car_id\":2,\"mileage\":41000}}");

        String reply = controller.handle(state, "set mileage to 41000");

        assertThat(reply).isEqualTo("Car updated (1 fields).");
        assertThat(events()).doesNotContain(TurnLog.TOOL_RESPONSE_GENERATED);
    }

    @Test
    void ambiguousTargetShouldListCandidates() {
        gateway.reply("{\"action\":\"tool\",\"name\":\"car_retrieve\",\"args\":{\"make\":\"Toyota\"}}");

        String reply = controller.handle(state, "show my toyota");

        assertThat(reply).startsWith("Multiple cars match. Refine with VIN or car_id.")
                .contains("2018 Toyota Corolla (VIN 2T1BURHE0JC014000, id 2)")
                .contains("2018 Toyota Camry (VIN 4T1B11HK5JU000001, id 3)");
    }

    @Test
    void planningPromptShouldCarryRecentLog() {
        gateway.reply("{\"action\":\"chat\",\"answer\":\"Hi\"}", "{\"action\":\"chat\",\"answer\":\"Again\"}");

        controller.handle(state, "first");
        controller.handle(state, "second");

        String secondPrompt = String.valueOf(gateway.payloads().get(1).get("message"));
        assertThat(secondPrompt).contains("recent_logs: ").contains("chat:Hi").contains("user_input:second");
        assertThat(secondPrompt).contains("lead_id: 77").doesNotContain(fixture.descriptor());
    }

    @Test
    void otherFailuresShouldUseResultMessageOrGenericSentence() {
        assertThat(TurnController.failureReply(ToolResult.error(ErrorCode.NOT_FOUND, "No matching car found.")))
                .isEqualTo("No matching car found.");
        assertThat(TurnController.failureReply(ToolResult.error(ErrorCode.TXN_FAILED, "")))
                .isEqualTo("That did not work.");
        assertThat(TurnController.failureReply(ToolResult.error(ErrorCode.TIME_ALREADY_BOOKED, "busy",
                Map.of("existing_schedule", Map.of("schedule_time", "2026-01-01 09:00:00")))))
                .isEqualTo("The buyer is already booked at 2026-01-01 09:00:00. Please choose another time.");
    }
}
