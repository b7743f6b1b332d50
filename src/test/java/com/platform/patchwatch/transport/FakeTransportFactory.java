package com.platform.patchwatch.transport;

import com.platform.patchwatch.error.ConnectionException;
import com.platform.patchwatch.model.HostView;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Scripted in-memory transport. Hosts answer commands from a table and the
 * factory tracks how many sessions are open at once.
 */
public class FakeTransportFactory implements TransportFactory {

    private final Map<String, FakeHost> hosts = new ConcurrentHashMap<>();
    private final AtomicInteger open = new AtomicInteger();
    private final AtomicInteger maxOpen = new AtomicInteger();

    public FakeHost host(String name) {
        return hosts.computeIfAbsent(name, FakeHost::new);
    }

    @Override
    public TransportSession open(HostView view, Duration connectTimeout, Duration commandTimeout) {
        FakeHost host = host(view.name());
        host.connects.incrementAndGet();
        Supplier<RuntimeException> failure = host.connectFailure;
        if (failure != null) {
            throw failure.get();
        }
        int now = open.incrementAndGet();
        maxOpen.accumulateAndGet(now, Math::max);
        return new FakeSession(host, commandTimeout);
    }

    @Override
    public int openSessions() {
        return open.get();
    }

    public int maxConcurrentSessions() {
        return maxOpen.get();
    }

    public static final class FakeHost {

        private final String name;
        private final Map<String, CommandResult> responses = new ConcurrentHashMap<>();
        private final List<String> commands = new ArrayList<>();
        private final AtomicInteger connects = new AtomicInteger();
        private volatile Supplier<RuntimeException> connectFailure;
        private volatile Duration delay = Duration.ZERO;
        private volatile CountDownLatch gate;

        FakeHost(String name) {
            this.name = name;
        }

        public FakeHost on(String command, int exitCode, String stdout) {
            return on(command, exitCode, stdout, "");
        }

        public FakeHost on(String command, int exitCode, String stdout, String stderr) {
            responses.put(command, new CommandResult(command, exitCode, stdout, stderr));
            return this;
        }

        public FakeHost failConnect(Supplier<RuntimeException> failure) {
            this.connectFailure = failure;
            return this;
        }

        public FakeHost delay(Duration delay) {
            this.delay = delay;
            return this;
        }

        /**
         * Block every command until the latch opens.
         */
        public FakeHost gate(CountDownLatch gate) {
            this.gate = gate;
            return this;
        }

        public FakeHost debian(String versionId) {
            return on("uname -s", 0, "Linux\n")
                .on("cat /etc/os-release", 0,
                    "PRETTY_NAME=\"Debian GNU/Linux 12 (bookworm)\"\nID=debian\nVERSION_ID=\"" + versionId + "\"\n");
        }

        public FakeHost rhel(String id, String versionId) {
            return on("uname -s", 0, "Linux\n")
                .on("cat /etc/os-release", 0,
                    "ID=\"" + id + "\"\nID_LIKE=\"rhel centos fedora\"\nVERSION_ID=\"" + versionId + "\"\n");
        }

        public FakeHost freebsd(String release) {
            return on("uname -s", 0, "FreeBSD\n").on("uname -r", 0, release + "\n");
        }

        public synchronized List<String> commands() {
            return List.copyOf(commands);
        }

        public int connects() {
            return connects.get();
        }

        synchronized void record(String command) {
            commands.add(command);
        }

        CommandResult respond(String command) {
            CommandResult result = responses.get(command);
            if (result != null) {
                return result;
            }
            return new CommandResult(command, 127, "", "sh: " + command + ": not found");
        }
    }

    private final class FakeSession implements TransportSession {

        private final FakeHost host;
        private final Duration commandTimeout;
        private boolean closed;

        FakeSession(FakeHost host, Duration commandTimeout) {
            this.host = host;
            this.commandTimeout = commandTimeout;
        }

        @Override
        public String hostName() {
            return host.name;
        }

        @Override
        public Duration commandTimeout() {
            return commandTimeout;
        }

        @Override
        public CommandResult run(String command, Duration timeout) {
            host.record(command);
            try {
                CountDownLatch gate = host.gate;
                if (gate != null) {
                    gate.await();
                }
                if (!host.delay.isZero()) {
                    Thread.sleep(host.delay.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConnectionException(host.name, "Interrupted while running: " + command, e);
            }
            return host.respond(command);
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                open.decrementAndGet();
            }
        }
    }
}
