package com.calcron.infrastructure.adapter.at;

import com.calcron.domain.exception.JobSchedulerException;
import com.calcron.domain.port.out.CancelResult;
import com.calcron.domain.port.out.JobScheduler;
import com.calcron.infrastructure.config.AtProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link JobScheduler} backed by the UNIX {@code at}, {@code atrm} and {@code atq} commands.
 */
@Component
public class AtCommandJobScheduler implements JobScheduler {

    private static final Logger logger = LoggerFactory.getLogger(AtCommandJobScheduler.class);

    private static final Pattern JOB_ID = Pattern.compile("job (\\d+) at");
    private static final Pattern NUMERIC_HANDLE = Pattern.compile("\\d+");
    // at -t [[CC]YY]MMDDhhmm[.ss]
    private static final DateTimeFormatter AT_TIME = DateTimeFormatter.ofPattern("yyyyMMddHHmm.ss", Locale.ROOT);

    private final CommandRunner commandRunner;
    private final AtProperties properties;
    private final ZoneId zone;

    public AtCommandJobScheduler(CommandRunner commandRunner, AtProperties properties) {
        this.commandRunner = commandRunner;
        this.properties = properties;
        this.zone = ZoneId.of(properties.getTimeZone());
    }

    @Override
    public String submit(Instant at, String payload) {
        List<String> command = new ArrayList<>();
        command.add(properties.getAtCommand());
        addQueue(command);
        command.add("-t");
        command.add(formatTime(at));

        CommandResult result = run(command, payload.endsWith("\n") ? payload : payload + "\n");

        Matcher matcher = JOB_ID.matcher(result.combinedOutput());
        if (!result.isSuccess() || !matcher.find()) {
            throw new JobSchedulerException(String.format("at exited with %d without a job id: %s",
                    result.exitCode(), result.stderr().strip()));
        }

        String handle = matcher.group(1);
        logger.debug("at accepted job {} for {}", handle, at);
        return handle;
    }

    @Override
    public CancelResult cancel(String jobHandle) {
        if (jobHandle == null || !NUMERIC_HANDLE.matcher(jobHandle).matches()) {
            throw new JobSchedulerException("Not an at job id: " + jobHandle);
        }

        CommandResult result = run(List.of(properties.getAtrmCommand(), jobHandle), null);
        if (result.isSuccess()) {
            return CancelResult.CANCELLED;
        }

        String output = result.combinedOutput().toLowerCase(Locale.ROOT);
        if (output.contains("cannot find jobid") || output.contains("cannot find job")) {
            return CancelResult.NOT_FOUND;
        }

        throw new JobSchedulerException(String.format("atrm %s exited with %d: %s",
                jobHandle, result.exitCode(), result.stderr().strip()));
    }

    @Override
    public Set<String> liveHandles() {
        List<String> command = new ArrayList<>();
        command.add(properties.getAtqCommand());
        addQueue(command);

        CommandResult result = run(command, null);
        if (!result.isSuccess()) {
            throw new JobSchedulerException(String.format("atq exited with %d: %s",
                    result.exitCode(), result.stderr().strip()));
        }

        Set<String> handles = new LinkedHashSet<>();
        for (String line : result.stdout().split("\\R")) {
            String[] columns = line.strip().split("\\s+");
            if (columns.length > 0 && NUMERIC_HANDLE.matcher(columns[0]).matches()) {
                handles.add(columns[0]);
            }
        }
        return handles;
    }

    String formatTime(Instant at) {
        return AT_TIME.format(at.atZone(zone));
    }

    private void addQueue(List<String> command) {
        if (properties.getQueue() != null && !properties.getQueue().isBlank()) {
            command.add("-q");
            command.add(properties.getQueue());
        }
    }

    private CommandResult run(List<String> command, String stdin) {
        return commandRunner.run(command, stdin, Map.of("TZ", zone.getId()), properties.getTimeout());
    }
}
