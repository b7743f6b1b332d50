package com.platform.patchwatch.transport;

import java.time.Duration;

/**
 * An established remote session on one host.
 */
public interface TransportSession extends AutoCloseable {

    String hostName();

    /**
     * Timeout applied by {@link #run(String)}.
     */
    Duration commandTimeout();

    /**
     * Run a shell command and capture its output.
     *
     * @throws com.platform.patchwatch.error.ConnectionException if the link drops or the thread is interrupted
     * @throws com.platform.patchwatch.error.CommandFailedException if the command outlives the timeout
     */
    CommandResult run(String command, Duration timeout);

    default CommandResult run(String command) {
        return run(command, commandTimeout());
    }

    @Override
    void close();
}
