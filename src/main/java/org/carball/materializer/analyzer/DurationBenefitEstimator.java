package org.carball.materializer.analyzer;

import org.carball.materializer.model.query.PropertyUsage;

/**
 * Static heuristic: a fixed share of the observed duration is JSON parsing that a materialized
 * column avoids. Read bytes can optionally be converted to milliseconds and counted as well.
 */
public class DurationBenefitEstimator implements BenefitEstimator {

    private final double savingsRatio;
    private final double bytesPerMs;

    public DurationBenefitEstimator(double savingsRatio, double bytesPerMs) {
        this.savingsRatio = savingsRatio;
        this.bytesPerMs = bytesPerMs;
    }

    @Override
    public double averageCostSaved(PropertyUsage usage) {
        double costMs = usage.getAverageDurationMs();
        if (bytesPerMs > 0) {
            costMs += usage.getAverageReadBytes() / bytesPerMs;
        }
        return costMs * savingsRatio;
    }

    @Override
    public String describe() {
        return bytesPerMs > 0
                ? String.format("(avg duration + avg read bytes / %.0f) x %.2f", bytesPerMs, savingsRatio)
                : String.format("avg duration x %.2f", savingsRatio);
    }
}
