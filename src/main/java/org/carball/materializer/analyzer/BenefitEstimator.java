package org.carball.materializer.analyzer;

import org.carball.materializer.model.query.PropertyUsage;

/**
 * Estimates how much query time one use of a property would save once it is materialized.
 * The ranking multiplies this by the usage count.
 */
public interface BenefitEstimator {

    double averageCostSaved(PropertyUsage usage);

    String describe();
}
