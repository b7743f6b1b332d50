package com.platform.patchwatch.transport;

import java.util.Arrays;
import java.util.List;

/**
 * Captured result of one remote command. A nonzero exit is not an error at this level;
 * callers decide what each exit code means.
 */
public record CommandResult(String command, int exitCode, String stdout, String stderr) {

    public CommandResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public boolean succeeded() {
        return exitCode == 0;
    }

    public List<String> stdoutLines() {
        if (stdout.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(stdout.split("\\R"));
    }
}
