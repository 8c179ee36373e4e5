package com.calcron.infrastructure.adapter.at;

public record CommandResult(
        int exitCode,
        String stdout,
        String stderr
) {
    public boolean isSuccess() {
        return exitCode == 0;
    }

    /**
     * stderr followed by stdout; {@code at} reports the job id on stderr.
     */
    public String combinedOutput() {
        return stderr + "\n" + stdout;
    }
}
