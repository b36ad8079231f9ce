package com.openforge.ariste.agent.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * @param reason AgentLoopException reason name, when the failure came from the loop
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, String reason, String message) {}
