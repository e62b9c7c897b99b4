package com.openforge.numen.agent;

import com.openforge.numen.agent.dto.ChatMessageRequest;
import com.openforge.numen.web.RequestHeaders;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

/**
 * POST /api/agents/{agentId}/chat: one conversational turn.
 *
 * Blocks for the duration of the turn, which is dominated by the
 * completion call.
 */
@RestController
@RequestMapping("/api/agents/{agentId}/chat")
@RequiredArgsConstructor
public class ChatController {

    private final InteractionOrchestrator orchestrator;

    @PostMapping
    public InteractionResult chat(
            @RequestHeader(RequestHeaders.TENANT) String tenantId,
            @RequestHeader(RequestHeaders.USER) String userId,
            @PathVariable String agentId,
            @Valid @RequestBody ChatMessageRequest request) {

        return orchestrator.process(agentId, tenantId, userId, request.message(), request.threadId());
    }
}
