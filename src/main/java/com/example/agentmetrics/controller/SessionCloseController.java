package com.example.agentmetrics.controller;

import com.example.agentmetrics.event.TriggerReason;
import com.example.agentmetrics.service.CloseOutcome;
import com.example.agentmetrics.service.ConversationCloseService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/chat")
public class SessionCloseController {

    private final ConversationCloseService closeService;

    public SessionCloseController(ConversationCloseService closeService) {
        this.closeService = closeService;
    }

    @PostMapping("/{sessionId}/close")
    public Mono<ResponseEntity<Map<String, Object>>> close(@PathVariable String sessionId,
                                                           @RequestParam(required = false) Long teamId,
                                                           @RequestParam(required = false) Long agentId) {
        return close(sessionId, TriggerReason.MANUAL_CLOSE, teamId, agentId);
    }

    /**
     * Sent by the chat frontend when a conversation is left; only long enough conversations
     * are classified.
     */
    @PostMapping("/{sessionId}/auto-close")
    public Mono<ResponseEntity<Map<String, Object>>> autoClose(@PathVariable String sessionId,
                                                               @RequestParam(required = false) Long teamId,
                                                               @RequestParam(required = false) Long agentId) {
        return close(sessionId, TriggerReason.AUTO_CLOSE, teamId, agentId);
    }

    private Mono<ResponseEntity<Map<String, Object>>> close(String sessionId, TriggerReason trigger,
                                                            Long teamId, Long agentId) {
        return Mono.fromCallable(() -> toResponse(trigger, closeService.closeSession(sessionId, trigger, teamId, agentId)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    static ResponseEntity<Map<String, Object>> toResponse(TriggerReason trigger, CloseOutcome outcome) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sessionId", outcome.sessionId());
        body.put("triggerReason", trigger.getValue());
        body.put("status", outcome.status().name().toLowerCase());
        body.put("classificationQueued", outcome.requested());
        body.put("messageCount", outcome.messageCount());
        HttpStatus status = switch (outcome.status()) {
            case REQUESTED, INSUFFICIENT_MESSAGES, ALREADY_CLASSIFIED -> HttpStatus.OK;
            case NO_MESSAGES -> HttpStatus.NOT_FOUND;
            case FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        return ResponseEntity.status(status).body(body);
    }
}
