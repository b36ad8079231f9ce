package com.openforge.ariste.agent.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.ariste.agent.subagent.SubAgentOutcome;

import java.util.List;

/**
 * Fan-out result, in request order.
 *
 * All-or-nothing requests fill {@code results} with the rendered reports;
 * otherwise {@code outcomes} carries per-task success or error.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubAgentResponse(
        List<String>          results,
        List<SubAgentOutcome> outcomes,
        boolean               allSucceeded
) {

    public static SubAgentResponse ofResults(List<String> results) {
        return new SubAgentResponse(results, null, true);
    }

    public static SubAgentResponse ofOutcomes(List<SubAgentOutcome> outcomes) {
        return new SubAgentResponse(null, outcomes, outcomes.stream().allMatch(SubAgentOutcome::succeeded));
    }
}
