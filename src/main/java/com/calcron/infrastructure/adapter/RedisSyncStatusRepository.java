package com.calcron.infrastructure.adapter;

import com.calcron.domain.model.SyncReport;
import com.calcron.domain.port.out.SyncStatusRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Keeps the report of the last cycle in Redis. Best effort: Redis being down never fails a cycle.
 */
@Repository
public class RedisSyncStatusRepository implements SyncStatusRepository {

    private static final Logger logger = LoggerFactory.getLogger(RedisSyncStatusRepository.class);

    static final String LAST_CYCLE_KEY = "calcron:sync:last_cycle";
    private static final long STATUS_TTL_HOURS = 24;

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisSyncStatusRepository(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void recordLastCycle(SyncReport report) {
        try {
            String json = objectMapper.writeValueAsString(report);
            redisTemplate.opsForValue().set(LAST_CYCLE_KEY, json, STATUS_TTL_HOURS, TimeUnit.HOURS);
            logger.debug("Recorded last cycle: {}", report.status());
        } catch (Exception e) {
            logger.error("Failed to record last cycle report", e);
        }
    }

    @Override
    public Optional<SyncReport> getLastCycle() {
        try {
            String json = redisTemplate.opsForValue().get(LAST_CYCLE_KEY);
            if (json != null) {
                return Optional.of(objectMapper.readValue(json, SyncReport.class));
            }
        } catch (Exception e) {
            logger.error("Failed to read last cycle report", e);
        }
        return Optional.empty();
    }
}
