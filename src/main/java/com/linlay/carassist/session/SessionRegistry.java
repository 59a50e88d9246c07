package com.linlay.carassist.session;

import com.linlay.carassist.backend.ChatBackendClient;
import com.linlay.carassist.backend.ChatBackendClientFactory;
import com.linlay.carassist.config.StorageProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory sessions for the process lifetime. A lead that already has a session gets the same
 * one back.
 */
@Component
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, SessionState> sessionsById = new ConcurrentHashMap<>();
    private final Map<String, String> sessionIdByLead = new ConcurrentHashMap<>();
    private final ChatBackendClientFactory clientFactory;
    private final StorageProperties storageProperties;
    private final Clock clock;

    public SessionRegistry(ChatBackendClientFactory clientFactory, StorageProperties storageProperties, Clock clock) {
        this.clientFactory = clientFactory;
        this.storageProperties = storageProperties;
        this.clock = clock;
    }

    public SessionState open(String leadId, String buyerId, String escalationPhone) {
        String lead = normalize(leadId);
        String buyer = normalize(buyerId);
        String phone = normalize(escalationPhone);
        if (lead.isEmpty() || buyer.isEmpty() || phone.isEmpty()) {
            throw new IllegalArgumentException("lead_id, buyer_id, and escalation_phone are required");
        }
        String descriptor = storageProperties.getDatabaseUrl();
        if (!StringUtils.hasText(descriptor)) {
            log.error("Session init refused: no storage descriptor configured");
            throw new StorageNotConfiguredException();
        }

        String[] created = new String[1];
        String sessionId = sessionIdByLead.computeIfAbsent(lead, key -> {
            String id = UUID.randomUUID().toString();
            SessionContext context = new SessionContext(
                    id,
                    SessionContext.coerceId(lead),
                    SessionContext.coerceId(buyer),
                    phone,
                    descriptor.trim()
            );
            sessionsById.put(id, new SessionState(context, new TurnLog(clock), clientFactory.create(lead)));
            created[0] = id;
            return id;
        });

        SessionState state = sessionsById.get(sessionId);
        if (created[0] == null) {
            log.info("[{}] reusing session for lead_id={}", state.context().shortId(), lead);
            return state;
        }
        warmUp(state);
        log.info("[{}] session initialized for lead_id={}, buyer_id={}", state.context().shortId(), lead, buyer);
        return state;
    }

    public Optional<SessionState> find(String sessionId) {
        if (!StringUtils.hasText(sessionId)) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessionsById.get(sessionId.trim()));
    }

    public SessionState require(String sessionId) {
        return find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public int size() {
        return sessionsById.size();
    }

    private void warmUp(SessionState state) {
        ChatBackendClient client = state.backendClient();
        try {
            client.warmUp();
        } catch (RuntimeException ex) {
            // the first turn binds lazily and goes through the retry policy
            log.warn("[{}] backend warm-up failed: {}", state.context().shortId(), ex.getMessage());
        }
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim();
    }
}
