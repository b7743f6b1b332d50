package com.platform.patchwatch.transport;

import com.platform.patchwatch.config.PatchWatchProperties;
import com.platform.patchwatch.error.AuthenticationException;
import com.platform.patchwatch.error.CommandFailedException;
import com.platform.patchwatch.error.ConnectionException;
import com.platform.patchwatch.model.HostView;
import com.platform.patchwatch.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Transport backed by the local OpenSSH client. Every command is a separate
 * {@code ssh} invocation in batch mode, so keys and agents come from the
 * operator's own SSH setup and nothing ever prompts.
 */
@Slf4j
@Component
public class OpenSshTransportFactory implements TransportFactory {

    static final int SSH_ERROR_EXIT = 255;

    private static final List<String> AUTH_FAILURE_MARKERS = List.of(
        "permission denied", "too many authentication failures", "host key verification failed");
    private static final List<String> TIMEOUT_MARKERS = List.of(
        "connection timed out", "operation timed out");

    private final PatchWatchProperties.Ssh ssh;
    private final ProcessRunner runner;
    private final AtomicInteger openSessions = new AtomicInteger();

    @Autowired
    public OpenSshTransportFactory(PatchWatchProperties properties, MetricsRegistry metricsRegistry) {
        this(properties.ssh(), new ProcessRunner());
        metricsRegistry.registerGauge("patchwatch.sessions.open",
            "Remote sessions currently open", openSessions::get);
    }

    OpenSshTransportFactory(PatchWatchProperties.Ssh ssh, ProcessRunner runner) {
        this.ssh = ssh;
        this.runner = runner;
    }

    @Override
    public TransportSession open(HostView host, Duration connectTimeout, Duration commandTimeout) {
        OpenSshSession session = new OpenSshSession(host, connectTimeout, commandTimeout);
        openSessions.incrementAndGet();
        try {
            session.probe();
            return session;
        } catch (RuntimeException e) {
            session.close();
            throw e;
        }
    }

    @Override
    public int openSessions() {
        return openSessions.get();
    }

    List<String> commandLine(HostView host, Duration connectTimeout, String remoteCommand) {
        List<String> cmd = new ArrayList<>();
        cmd.add(ssh.binary());
        cmd.add("-T");
        cmd.add("-o");
        cmd.add("BatchMode=yes");
        cmd.add("-o");
        cmd.add("ConnectTimeout=" + Math.max(1, connectTimeout.toSeconds()));
        for (String option : ssh.options()) {
            cmd.add("-o");
            cmd.add(option);
        }
        cmd.add("-p");
        cmd.add(String.valueOf(host.port()));
        if (host.username() != null && !host.username().isBlank()) {
            cmd.add("-l");
            cmd.add(host.username());
        }
        cmd.add(host.address());
        cmd.add("--");
        cmd.add(remoteCommand);
        return cmd;
    }

    /**
     * Map an ssh client failure (exit 255) onto the connection error taxonomy.
     */
    static RuntimeException classifyClientFailure(String hostName, String stderr) {
        String lower = stderr.toLowerCase(Locale.ROOT);
        if (AUTH_FAILURE_MARKERS.stream().anyMatch(lower::contains)) {
            return new AuthenticationException(hostName,
                String.format("Authentication failed for %s: %s", hostName, stderr.strip()));
        }
        if (TIMEOUT_MARKERS.stream().anyMatch(lower::contains)) {
            return ConnectionException.timeout(hostName,
                String.format("Connection to %s timed out", hostName));
        }
        return new ConnectionException(hostName,
            String.format("Cannot reach %s: %s", hostName, stderr.isBlank() ? "ssh exited with 255" : stderr.strip()));
    }

    private class OpenSshSession implements TransportSession {

        private final HostView host;
        private final Duration connectTimeout;
        private final Duration commandTimeout;
        private volatile boolean closed;

        OpenSshSession(HostView host, Duration connectTimeout, Duration commandTimeout) {
            this.host = host;
            this.connectTimeout = connectTimeout;
            this.commandTimeout = commandTimeout;
        }

        void probe() {
            CommandResult result = execute("true", connectTimeout.plusSeconds(1), true);
            if (result.exitCode() == SSH_ERROR_EXIT) {
                throw classifyClientFailure(host.name(), result.stderr());
            }
            log.debug("Connected to {} ({}:{})", host.name(), host.address(), host.port());
        }

        @Override
        public String hostName() {
            return host.name();
        }

        @Override
        public Duration commandTimeout() {
            return commandTimeout;
        }

        @Override
        public CommandResult run(String command, Duration timeout) {
            if (closed) {
                throw new IllegalStateException("Session to " + host.name() + " is closed");
            }
            CommandResult result = execute(command, connectTimeout.plus(timeout), false);
            if (result.exitCode() == SSH_ERROR_EXIT && result.stdout().isEmpty()) {
                throw classifyClientFailure(host.name(), result.stderr());
            }
            return result;
        }

        private CommandResult execute(String command, Duration timeout, boolean connecting) {
            try {
                ProcessRunner.Completed done = runner.run(commandLine(host, connectTimeout, command), timeout);
                if (done.timedOut()) {
                    if (connecting) {
                        throw ConnectionException.timeout(host.name(),
                            String.format("Connection to %s timed out after %ds", host.name(), connectTimeout.toSeconds()));
                    }
                    throw CommandFailedException.timeout(command, timeout.toMillis());
                }
                return new CommandResult(command, done.exitCode(), done.stdout(), done.stderr());
            } catch (IOException e) {
                throw new ConnectionException(host.name(), "Failed to start ssh client: " + e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConnectionException(host.name(), "Interrupted while running: " + command, e);
            }
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                openSessions.decrementAndGet();
            }
        }
    }
}
