package com.calcron.infrastructure.persistence;

import com.calcron.domain.exception.JobStoreException;
import com.calcron.domain.model.JobRecord;
import com.calcron.domain.model.JobStatus;
import com.calcron.domain.port.out.JobRecordStore;
import io.github.resilience4j.retry.annotation.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * PostgreSQL implementation of JobRecordStore.
 * The whole mapping is replaced in one transaction, so a failed save leaves the previous one intact.
 */
@Repository
public class JdbcJobRecordStore implements JobRecordStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcJobRecordStore.class);

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public JdbcJobRecordStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public Map<String, JobRecord> load() {
        String sql = """
            SELECT event_id, scheduled_time, revision_token, job_handle, status, updated_at
            FROM job_records
            ORDER BY scheduled_time, event_id
            """;

        try {
            List<JobRecord> rows = jdbcTemplate.query(sql, (rs, rowNum) -> new JobRecord(
                    rs.getString("event_id"),
                    rs.getTimestamp("scheduled_time").toInstant(),
                    rs.getString("revision_token"),
                    rs.getString("job_handle"),
                    JobStatus.valueOf(rs.getString("status")),
                    rs.getTimestamp("updated_at").toInstant()
            ));

            Map<String, JobRecord> records = new LinkedHashMap<>();
            rows.forEach(record -> records.put(record.eventId(), record));
            logger.debug("Loaded {} job records", records.size());
            return records;

        } catch (DataAccessException e) {
            logger.error("Database error while loading job records", e);
            throw new JobStoreException("Failed to load job records", e);
        }
    }

    @Override
    @Retry(name = "job-record-store")
    public void save(Map<String, JobRecord> records) {
        String insert = """
            INSERT INTO job_records (
                event_id, scheduled_time, revision_token, job_handle, status, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?)
            """;

        List<Object[]> batch = records.values().stream()
                .map(record -> new Object[] {
                        record.eventId(),
                        Timestamp.from(record.scheduledTime()),
                        record.revisionToken(),
                        record.jobHandle(),
                        record.status().name(),
                        Timestamp.from(record.updatedAt())
                })
                .toList();

        try {
            transactionTemplate.executeWithoutResult(status -> {
                int deleted = jdbcTemplate.update("DELETE FROM job_records");
                if (!batch.isEmpty()) {
                    jdbcTemplate.batchUpdate(insert, batch);
                }
                logger.debug("Replaced {} job records with {}", deleted, batch.size());
            });

            logger.info("Saved {} job records", records.size());

        } catch (DataAccessException | TransactionException e) {
            logger.error("Error saving job records", e);
            throw new JobStoreException("Failed to save job records", e);
        }
    }
}
