package com.calcron.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Lets at most one cycle (sync or reset) touch the job record store at a time.
 * A caller that finds the gate busy is turned away instead of queued.
 */
@Component
public class CycleGate {

    private static final Logger logger = LoggerFactory.getLogger(CycleGate.class);

    private final AtomicBoolean running = new AtomicBoolean(false);

    public <T> Optional<T> runIfIdle(String taskName, Supplier<T> task) {
        if (!running.compareAndSet(false, true)) {
            logger.info("Skipping '{}': another cycle is still running", taskName);
            return Optional.empty();
        }

        try {
            return Optional.of(task.get());
        } finally {
            running.set(false);
        }
    }

    public boolean isBusy() {
        return running.get();
    }
}
