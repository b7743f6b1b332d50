package com.platform.patchwatch.transport;

import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs a local process with a deadline. Output goes to temp files so a chatty
 * child can never block on a full pipe.
 */
@Slf4j
class ProcessRunner {

    /**
     * Outcome of a local process run. {@code timedOut} means the process was killed.
     */
    record Completed(int exitCode, String stdout, String stderr, boolean timedOut) {
    }

    Completed run(List<String> command, Duration timeout) throws IOException, InterruptedException {
        Path out = Files.createTempFile("patchwatch-", ".out");
        Path err = Files.createTempFile("patchwatch-", ".err");
        try {
            Process process = new ProcessBuilder(command)
                .redirectInput(ProcessBuilder.Redirect.from(new File("/dev/null")))
                .redirectOutput(out.toFile())
                .redirectError(err.toFile())
                .start();
            boolean ended;
            try {
                ended = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                throw e;
            }
            if (!ended) {
                process.destroyForcibly();
                log.debug("Killed process after {}ms: {}", timeout.toMillis(), command.get(0));
                return new Completed(-1, read(out), read(err), true);
            }
            return new Completed(process.exitValue(), read(out), read(err), false);
        } finally {
            Files.deleteIfExists(out);
            Files.deleteIfExists(err);
        }
    }

    private static String read(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }
}
