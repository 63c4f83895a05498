package org.carball.materializer.model.candidate;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.materializer.model.query.PropertyKey;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MaterializationCandidate {
    private PropertyKey key;
    private String columnName;
    private double benefitScore;
    private long usageCount;

    @Builder.Default
    private CandidateState state = CandidateState.NOT_MATERIALIZED;

    private String failureReason;
    private Instant updatedAt;

    public void transitionTo(CandidateState newState, String reason) {
        this.state = newState;
        this.failureReason = reason;
        this.updatedAt = Instant.now();
    }

    public String getScoreInterpretation() {
        if (benefitScore >= 1_000_000) return "Very hot - materialize immediately";
        if (benefitScore >= 100_000) return "Hot - high priority";
        if (benefitScore >= 10_000) return "Warm - medium priority";
        return "Cool - low priority";
    }
}
