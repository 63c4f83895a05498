package org.carball.materializer.model.backfill;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.materializer.model.query.PropertyKey;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Progress of populating one materialized column for rows written before it existed.
 * The cursor is the index of the next partition to rewrite.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BackfillJob {
    private PropertyKey key;
    private String columnName;

    @Builder.Default
    private List<String> partitions = new ArrayList<>();

    private int nextPartitionIndex;

    // Rows at or after this instant are filled by the column definition itself
    private Instant upperBound;

    @Builder.Default
    private BackfillState state = BackfillState.RUNNING;

    private int attempts;
    private String lastError;
    private Instant createdAt;
    private Instant updatedAt;

    @JsonIgnore
    public boolean hasRemainingChunks() {
        return nextPartitionIndex < partitions.size();
    }

    /**
     * Partitions of the next chunk, without advancing the cursor.
     */
    @JsonIgnore
    public List<String> nextChunk(int chunkSize) {
        int end = Math.min(partitions.size(), nextPartitionIndex + chunkSize);
        return List.copyOf(partitions.subList(nextPartitionIndex, end));
    }

    @JsonIgnore
    public int getProgressPercent() {
        if (partitions.isEmpty()) {
            return 100;
        }
        return (int) (nextPartitionIndex * 100L / partitions.size());
    }

    public void transitionTo(BackfillState newState) {
        this.state = newState;
        this.updatedAt = Instant.now();
    }
}
