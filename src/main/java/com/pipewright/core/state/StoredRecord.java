package com.pipewright.core.state;

import com.pipewright.core.model.WorkRecord;

import java.util.List;

/**
 * A loaded {@link WorkRecord} with the location it came from and any
 * warnings raised while finding it.
 */
public record StoredRecord(WorkRecord record, StateLocation location, List<String> warnings) {

    public StoredRecord {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean fromLegacyLocation() {
        return location == StateLocation.LEGACY;
    }
}
