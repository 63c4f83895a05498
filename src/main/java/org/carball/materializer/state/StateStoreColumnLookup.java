package org.carball.materializer.state;

import lombok.RequiredArgsConstructor;
import org.carball.materializer.model.candidate.CandidateState;
import org.carball.materializer.model.candidate.MaterializationCandidate;
import org.carball.materializer.model.query.PropertyKey;

import java.util.Optional;

@RequiredArgsConstructor
public class StateStoreColumnLookup implements MaterializedColumnLookup {

    private final StateStore stateStore;

    @Override
    public Optional<String> lookup(String table, String propertyPath) {
        return stateStore.findCandidate(new PropertyKey(table, propertyPath))
                .filter(candidate -> candidate.getState() == CandidateState.MATERIALIZED)
                .map(MaterializationCandidate::getColumnName);
    }
}
