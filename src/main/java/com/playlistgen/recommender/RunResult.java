package com.playlistgen.recommender;

import java.util.List;
import java.util.Set;

/**
 * Outcome of one recommendation run: best-effort up to the requested count.
 *
 * @param results accepted candidates, in acceptance order
 * @param requested number of recommendations asked for
 * @param winnersDrawn total lottery draws, replacements included
 * @param exhaustedArtists artists discarded after seed ingestion failed
 * @param termination why the run stopped
 */
public record RunResult(
    List<CandidateResult> results,
    int requested,
    int winnersDrawn,
    Set<String> exhaustedArtists,
    Termination termination
) {
    public enum Termination {
        /** The requested number of results was collected. */
        COMPLETED,
        /** Every drawn winner was processed; some produced no match. */
        WINNERS_CONSUMED,
        /** No artist with positive weight remained for a replacement draw. */
        POOL_EXHAUSTED,
        /** The run-level cap on total winner draws was reached. */
        SAFETY_CAP_REACHED
    }

    public RunResult {
        results = List.copyOf(results);
        exhaustedArtists = Set.copyOf(exhaustedArtists);
    }

    public boolean isComplete() {
        return results.size() >= requested;
    }
}
