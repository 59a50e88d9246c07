package com.linlay.carassist.plan;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.carassist.session.TurnLogEntry;
import com.linlay.carassist.storage.StorageGateway;
import com.linlay.carassist.support.TestSessions;
import com.linlay.carassist.tool.AllCarsTool;
import com.linlay.carassist.tool.CarRetrieveTool;
import com.linlay.carassist.tool.ToolRegistry;
import com.linlay.carassist.tool.ToolResult;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class PlannerPromptBuilderTest {

    private final StorageGateway storageGateway = mock(StorageGateway.class);
    private final PlannerPromptBuilder builder = new PlannerPromptBuilder(
            new ToolRegistry(List.of(new AllCarsTool(storageGateway), new CarRetrieveTool(storageGateway))),
            new ObjectMapper()
    );

    @Test
    void planningPromptShouldListToolsRulesAndContext() {
        String prompt = builder.planningPrompt("find my honda", TestSessions.session("/secret/path.db"), List.of());

        assertThat(prompt)
                .contains("- car_retrieve (args: car_id, vin, model, make, year)")
                .contains("- get_all_cars")
                .contains("NEVER include sqlite_path, storage_descriptor, lead_id, buyer_id, receiver_number, escalation_phone")
                .contains("- lead_id: 77")
                .contains("User says:\nfind my honda")
                .doesNotContain("/secret/path.db")
                .doesNotContain("recent_logs");
    }

    @Test
    void logSnippetShouldBeCapped() {
        String longDetail = "x".repeat(400);
        String snippet = PlannerPromptBuilder.logSnippet(List.of(
                new TurnLogEntry("user_input", "hi", Instant.EPOCH),
                new TurnLogEntry("chat", longDetail, Instant.EPOCH)
        ));

        assertThat(snippet).startsWith("user_input:hi; chat:xxx").hasSize(300);
    }

    @Test
    void phrasingPromptShouldEmbedResultJson() {
        String prompt = builder.phrasingPrompt("how many cars?", "get_all_cars",
                ToolResult.success("Retrieved 2 car(s).", Map.of("count", 2)));

        assertThat(prompt)
                .contains("The user asked: \"how many cars?\"")
                .contains("'get_all_cars'")
                .contains("\"status\":\"success\"")
                .contains("\"count\":2");
    }
}
