package com.pipewright.core.idempotency;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link RunStatusRepository}. Contents are lost on exit.
 */
public class InMemoryRunStatusRepository implements RunStatusRepository {

    private final ConcurrentHashMap<String, RecordedStatus> statuses = new ConcurrentHashMap<>();

    @Override
    public Optional<RecordedStatus> find(String referenceId) {
        return Optional.ofNullable(statuses.get(referenceId));
    }

    @Override
    public void upsert(RecordedStatus status) {
        statuses.put(status.referenceId(), status);
    }

    @Override
    public boolean delete(String referenceId) {
        return statuses.remove(referenceId) != null;
    }

    @Override
    public List<RecordedStatus> findAll() {
        return new ArrayList<>(statuses.values());
    }
}
