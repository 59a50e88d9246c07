package com.linlay.carassist.controller;

import com.linlay.carassist.model.api.ApiResponse;
import com.linlay.carassist.model.api.ChatRequest;
import com.linlay.carassist.model.api.ChatResponse;
import com.linlay.carassist.model.api.InitSessionRequest;
import com.linlay.carassist.model.api.InitSessionResponse;
import com.linlay.carassist.model.api.TurnLogResponse;
import com.linlay.carassist.session.SessionRegistry;
import com.linlay.carassist.session.SessionState;
import com.linlay.carassist.turn.TurnController;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Locale;
import java.util.Set;

@RestController
@RequestMapping("/api")
public class AssistantController {

    private static final Logger log = LoggerFactory.getLogger(AssistantController.class);

    public static final String SESSION_ENDED_REPLY = "Session ended. Thank you!";
    static final int LOG_WINDOW = 10;
    private static final Set<String> EXIT_WORDS = Set.of("exit", "quit");

    private final SessionRegistry sessionRegistry;
    private final TurnController turnController;

    public AssistantController(SessionRegistry sessionRegistry, TurnController turnController) {
        this.sessionRegistry = sessionRegistry;
        this.turnController = turnController;
    }

    @PostMapping("/init")
    public Mono<ApiResponse<InitSessionResponse>> init(@Valid @RequestBody InitSessionRequest request) {
        return Mono.fromCallable(() -> sessionRegistry.open(request.leadId(), request.buyerId(), request.escalationPhone()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(state -> ApiResponse.success(new InitSessionResponse(state.context().sessionId())));
    }

    @PostMapping("/chat")
    public Mono<ApiResponse<ChatResponse>> chat(@RequestBody ChatRequest request) {
        SessionState state = sessionRegistry.require(request.sessionId());
        String message = request.message() == null ? "" : request.message().trim();
        if (!StringUtils.hasText(message)) {
            throw new IllegalArgumentException("Message is required");
        }
        if (EXIT_WORDS.contains(message.toLowerCase(Locale.ROOT))) {
            return Mono.fromRunnable(() -> state.backendClient().close())
                    .subscribeOn(Schedulers.boundedElastic())
                    .then(Mono.fromSupplier(() -> {
                        log.info("[{}] session ended by user", state.context().shortId());
                        return ApiResponse.success(new ChatResponse(SESSION_ENDED_REPLY));
                    }));
        }
        return Mono.fromCallable(() -> turnController.handle(state, message))
                .subscribeOn(Schedulers.boundedElastic())
                .map(reply -> ApiResponse.success(new ChatResponse(reply)));
    }

    @GetMapping("/logs")
    public ApiResponse<TurnLogResponse> logs(@RequestParam(name = "session_id", required = false) String sessionId) {
        SessionState state = sessionRegistry.require(sessionId);
        return ApiResponse.success(new TurnLogResponse(
                state.context().sessionId(),
                state.log().recent(LOG_WINDOW)
        ));
    }
}
