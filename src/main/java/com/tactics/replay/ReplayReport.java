package com.tactics.replay;

import java.util.List;

/**
 * Result of re-running a replay log through the engine.
 *
 * @param replayed number of records re-submitted before the comparison stopped
 */
public record ReplayReport(String scenarioId, long seed, int replayed, List<Divergence> divergences) {

    public ReplayReport {
        divergences = List.copyOf(divergences);
    }

    public boolean isConsistent() {
        return divergences.isEmpty();
    }
}
