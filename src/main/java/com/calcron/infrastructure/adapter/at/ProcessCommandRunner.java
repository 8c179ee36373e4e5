package com.calcron.infrastructure.adapter.at;

import com.calcron.domain.exception.JobSchedulerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

@Component
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger logger = LoggerFactory.getLogger(ProcessCommandRunner.class);

    @Override
    public CommandResult run(List<String> command, String stdin, Map<String, String> environment, Duration timeout) {
        logger.debug("Running {}", command);

        ProcessBuilder builder = new ProcessBuilder(command);
        builder.environment().putAll(environment);

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new JobSchedulerException("Cannot start " + command.get(0) + ": " + e.getMessage(), e);
        }

        // All three pipes are serviced off this thread so the timeout below always applies.
        CompletableFuture<Void> input = CompletableFuture.runAsync(() -> writeFully(process.getOutputStream(), stdin));
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()));

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new JobSchedulerException(command.get(0) + " did not finish within " + timeout);
            }

            input.join();
            CommandResult result = new CommandResult(process.exitValue(), stdout.join(), stderr.join());
            logger.debug("{} exited with {}: stdout='{}' stderr='{}'",
                    command.get(0), result.exitCode(), result.stdout().strip(), result.stderr().strip());
            return result;

        } catch (CompletionException e) {
            process.destroyForcibly();
            throw new JobSchedulerException("I/O error talking to " + command.get(0) + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new JobSchedulerException("Interrupted while waiting for " + command.get(0), e);
        }
    }

    private static void writeFully(OutputStream stream, String content) {
        try (stream) {
            if (content != null) {
                stream.write(content.getBytes(StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String readFully(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
