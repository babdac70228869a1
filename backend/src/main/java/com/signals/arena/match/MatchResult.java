package com.signals.arena.match;

/**
 * Immutable final record of a settled match. Revealed choices are null when the agent forfeited
 * without a valid reveal.
 */
public record MatchResult(
        PoolOutcome outcome,
        Choice revealedChoiceA,
        Choice revealedChoiceB,
        int pointsA,
        int pointsB,
        boolean forfeitA,
        boolean forfeitB
) {

    public static MatchResult of(Choice revealedA, boolean forfeitA, Choice revealedB, boolean forfeitB) {
        PoolOutcome outcome = PoolOutcome.resolve(revealedA, forfeitA, revealedB, forfeitB);
        return new MatchResult(
                outcome,
                forfeitA ? null : revealedA,
                forfeitB ? null : revealedB,
                outcome.pointsA(),
                outcome.pointsB(),
                forfeitA,
                forfeitB
        );
    }
}
