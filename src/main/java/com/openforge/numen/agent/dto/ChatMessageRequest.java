package com.openforge.numen.agent.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request body for POST /api/agents/{agentId}/chat.
 *
 * @param message   the user's turn
 * @param threadId  optional; omitted or unknown ids open a new thread
 */
public record ChatMessageRequest(

        @NotBlank(message = "message must not be blank")
        @Size(max = 8000, message = "message must not exceed 8000 characters")
        String message,

        String threadId
) {}
