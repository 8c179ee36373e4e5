package com.calcron.application;

import com.calcron.domain.model.JobRecord;
import java.util.List;

/**
 * Read access to the jobs the engine currently tracks.
 */
public interface FindJobs {

    /**
     * Returns every tracked job record ordered by scheduled time.
     */
    List<JobRecord> execute();

}
