package com.calcron.application;

import com.calcron.domain.model.JobRecord;
import com.calcron.domain.port.out.JobRecordStore;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class JobQueryUseCase implements FindJobs {

    private static final Logger logger = LoggerFactory.getLogger(JobQueryUseCase.class);

    private final JobRecordStore jobRecordStore;

    public JobQueryUseCase(JobRecordStore jobRecordStore) {
        this.jobRecordStore = jobRecordStore;
    }

    @Override
    public List<JobRecord> execute() {
        List<JobRecord> records = jobRecordStore.load().values().stream()
                .sorted(Comparator.comparing(JobRecord::scheduledTime).thenComparing(JobRecord::eventId))
                .toList();

        logger.debug("Found {} tracked jobs", records.size());
        return records;
    }
}
