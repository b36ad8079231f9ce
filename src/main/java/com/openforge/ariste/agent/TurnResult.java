package com.openforge.ariste.agent;

/**
 * Outcome of a completed turn.
 *
 * @param answer     the final assistant text
 * @param iterations number of model calls the turn took
 * @param state      always {@link TurnState#DONE}; failures are thrown
 */
public record TurnResult(String answer, int iterations, TurnState state) {

    public static TurnResult done(String answer, int iterations) {
        return new TurnResult(answer, iterations, TurnState.DONE);
    }
}
