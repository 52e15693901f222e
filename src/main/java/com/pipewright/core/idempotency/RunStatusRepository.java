package com.pipewright.core.idempotency;

import java.util.List;
import java.util.Optional;

/**
 * Storage for {@link RecordedStatus} rows, keyed by reference id.
 */
public interface RunStatusRepository {

    Optional<RecordedStatus> find(String referenceId);

    void upsert(RecordedStatus status);

    boolean delete(String referenceId);

    List<RecordedStatus> findAll();
}
