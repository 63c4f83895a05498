package org.carball.materializer.model.backfill;

public enum BackfillState {
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED
}
