package com.openforge.numen.agent.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request body for POST /api/agents/{agentId}/rollback.
 */
public record RollbackRequest(

        @NotBlank(message = "version must not be blank")
        String version
) {}
