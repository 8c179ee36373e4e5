package com.calcron.domain.port.out;

import com.calcron.domain.model.JobRecord;
import java.util.Map;

/**
 * Durable memory of the sync engine: event id to job record.
 * Both operations are all-or-nothing and report failures as
 * {@link com.calcron.domain.exception.JobStoreException}.
 */
public interface JobRecordStore {

    Map<String, JobRecord> load();

    /**
     * Replaces the whole persisted mapping. On failure the previous mapping is left untouched.
     */
    void save(Map<String, JobRecord> records);
}
