package com.openforge.ariste.agent.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request body for POST /api/agent/conversations/{id}/turns.
 */
public record TurnRequest(

        @NotBlank(message = "prompt must not be blank")
        @Size(max = 32000, message = "prompt must not exceed 32000 characters")
        String prompt
) {}
