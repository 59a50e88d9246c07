package com.linlay.carassist.session;

import com.linlay.carassist.backend.ChatBackendClientFactory;
import com.linlay.carassist.config.ChatBackendProperties;
import com.linlay.carassist.config.StorageProperties;
import com.linlay.carassist.support.FakeChatBackendGateway;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionRegistryTest {

    private final FakeChatBackendGateway gateway = new FakeChatBackendGateway();
    private final StorageProperties storageProperties = new StorageProperties();
    private final SessionRegistry registry = new SessionRegistry(
            new ChatBackendClientFactory(gateway, new ChatBackendProperties()),
            storageProperties,
            Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC)
    );

    @Test
    void openShouldBuildContextAndWarmUpBackend() {
        storageProperties.setDatabaseUrl("/data/cars.db");

        SessionState state = registry.open("77", " 5 ", "+15125550100");

        SessionContext context = state.context();
        assertThat(context.leadId()).isEqualTo(77L);
        assertThat(context.buyerId()).isEqualTo(5L);
        assertThat(context.escalationPhone()).isEqualTo("+15125550100");
        assertThat(context.storageDescriptor()).isEqualTo("/data/cars.db");
        assertThat(state.backendClient().userId()).isEqualTo("77");
        assertThat(gateway.openRequests()).containsExactly(true);
    }

    @Test
    void sameLeadShouldReuseItsSession() {
        storageProperties.setDatabaseUrl("/data/cars.db");

        SessionState first = registry.open("77", "5", "+15125550100");
        SessionState second = registry.open("77", "6", "+15125550199");

        assertThat(second).isSameAs(first);
        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.require(first.context().sessionId())).isSameAs(first);
    }

    @Test
    void nonNumericLeadShouldStayText() {
        storageProperties.setDatabaseUrl("/data/cars.db");

        SessionState state = registry.open("lead-abc", "5", "+15125550100");

        assertThat(state.context().leadId()).isEqualTo("lead-abc");
    }

    @Test
    void failedWarmUpShouldNotBlockSessionCreation() {
        storageProperties.setDatabaseUrl("/data/cars.db");
        gateway.authenticationDown();

        SessionState state = registry.open("77", "5", "+15125550100");

        assertThat(state.backendClient().currentSession().bound()).isFalse();
    }

    @Test
    void missingStorageShouldRefuseSessions() {
        assertThatThrownBy(() -> registry.open("77", "5", "+15125550100"))
                .isInstanceOf(StorageNotConfiguredException.class)
                .hasMessageContaining("DATABASE_URL");
    }

    @Test
    void blankIdentifiersShouldBeRejected() {
        storageProperties.setDatabaseUrl("/data/cars.db");

        assertThatThrownBy(() -> registry.open("77", "", "+15125550100"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownSessionShouldBeReported() {
        assertThatThrownBy(() -> registry.require("nope"))
                .isInstanceOf(SessionNotFoundException.class)
                .hasMessage("Session not found: nope. Please initialize session first.");
        assertThat(registry.find(null)).isEmpty();
    }
}
