package org.resmover.engine;

import java.util.List;

/**
 * Outcome of a move or remove run.
 *
 * @param total     resources affected over all rounds.
 * @param rounds    rounds executed.
 * @param perRound  resources affected by each round, in order.
 * @param truncated whether the run stopped at the round cap while still making progress.
 */
public record RunSummary(int total, int rounds, List<Integer> perRound, boolean truncated) {

    public RunSummary {
        perRound = List.copyOf(perRound);
    }
}
