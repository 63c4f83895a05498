package org.carball.materializer.model.candidate;

public enum CandidateState {
    NOT_MATERIALIZED,
    PENDING,
    MATERIALIZED,
    FAILED;

    /**
     * States that keep a property out of the next ranking.
     */
    public boolean blocksReselection() {
        return this == PENDING || this == MATERIALIZED;
    }
}
