package com.platform.patchwatch.scheduler;

import com.platform.patchwatch.config.OperationContext;
import com.platform.patchwatch.error.ErrorKind;
import com.platform.patchwatch.inventory.Attempt;
import com.platform.patchwatch.model.HostResult;
import com.platform.patchwatch.model.HostSelection;
import com.platform.patchwatch.model.HostView;
import com.platform.patchwatch.model.Operation;
import com.platform.patchwatch.model.OperationReport;
import com.platform.patchwatch.observability.LoggingConfig;
import com.platform.patchwatch.observability.MetricsRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Fans fleet operations out over a fixed worker pool. The pool size bounds the
 * number of hosts worked on, and so the number of open sessions, at any time.
 * Results come back in the order the hosts were given.
 */
@Slf4j
@Component
public class RefreshScheduler {

    private static final long POLL_INTERVAL_MS = 50;

    private final HostOperations hostOperations;
    private final OperationContext context;
    private final MetricsRegistry metricsRegistry;
    private final ExecutorService executor;
    private final Set<Run> activeRuns = ConcurrentHashMap.newKeySet();

    public RefreshScheduler(HostOperations hostOperations, OperationContext context, MetricsRegistry metricsRegistry) {
        this.hostOperations = hostOperations;
        this.context = context;
        this.metricsRegistry = metricsRegistry;
        this.executor = Executors.newFixedThreadPool(Math.max(1, context.poolSize()), new WorkerThreadFactory());
        log.info("Refresh scheduler started with {} workers", Math.max(1, context.poolSize()));
    }

    /**
     * Discover the given hosts. Hosts previously rejected as non-POSIX are
     * skipped unless the selection names them explicitly.
     */
    public OperationReport discover(List<HostView> targets, HostSelection selection) {
        return execute(Operation.DISCOVER, targets, (host, sink) -> {
            if (host.platformRejected() && !selection.isExplicit(host.name())) {
                return HostResult.skipped(host.name(), Operation.DISCOVER,
                    "Platform previously rejected; discover this host explicitly to retry");
            }
            return hostOperations.discover(host, context, sink);
        });
    }

    public OperationReport refresh(List<HostView> targets, HostSelection selection, boolean sync) {
        return execute(Operation.REFRESH, targets, (host, sink) ->
            hostOperations.refresh(host, sync, !selection.isExplicit(host.name()), context, sink));
    }

    public OperationReport ping(List<HostView> targets) {
        return execute(Operation.PING, targets, (host, sink) -> hostOperations.ping(host, context));
    }

    /**
     * Stop dispatching work for every running operation. Work not yet started
     * reports {@link ErrorKind#CANCELLED}; running hosts get the grace period and
     * are then interrupted.
     *
     * @return number of operations cancelled
     */
    public int cancel() {
        int cancelled = 0;
        for (Run run : activeRuns) {
            if (run.cancel(context.cancelGracePeriod())) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.warn("Cancelled {} running operation(s), grace period {}s",
                cancelled, context.cancelGracePeriod().toSeconds());
        }
        return cancelled;
    }

    public boolean isBusy() {
        return !activeRuns.isEmpty();
    }

    @PreDestroy
    public void shutdown() {
        cancel();
        executor.shutdownNow();
    }

    private OperationReport execute(Operation operation, List<HostView> targets, HostTask.Body body) {
        long started = System.nanoTime();
        Run run = new Run(operation);
        activeRuns.add(run);
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        try {
            log.info("Starting {} on {} host(s)", operation, targets.size());
            List<HostTask> tasks = new ArrayList<>(targets.size());
            List<Future<HostResult>> futures = new ArrayList<>(targets.size());
            for (HostView host : targets) {
                HostTask task = new HostTask(host, operation, run, body, mdc, metricsRegistry);
                tasks.add(task);
                futures.add(run.isCancelled() ? null : submit(task, run));
            }

            List<HostResult> results = new ArrayList<>(targets.size());
            for (int i = 0; i < tasks.size(); i++) {
                results.add(await(tasks.get(i), futures.get(i), run));
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            OperationReport report = new OperationReport(operation, results, elapsed);
            metricsRegistry.recordFleetOperation(operation, elapsed);
            log.info("{} finished in {}ms: {} ok, {} failed", operation, elapsed.toMillis(),
                report.successCount(), report.failureCount());
            return report;
        } finally {
            activeRuns.remove(run);
        }
    }

    private Future<HostResult> submit(HostTask task, Run run) {
        try {
            return executor.submit(task);
        } catch (RejectedExecutionException e) {
            log.warn("Worker pool is shut down, cancelling {} on {}", task.operation(), task.host().name());
            run.cancel(Duration.ZERO);
            return null;
        }
    }

    private HostResult await(HostTask task, Future<HostResult> future, Run run) {
        if (future == null) {
            return HostResult.cancelled(task.host().name(), task.operation());
        }
        while (true) {
            try {
                return future.get(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                if (run.isCancelled() && run.graceExpired()) {
                    return interrupt(task, future);
                }
            } catch (CancellationException e) {
                return HostResult.cancelled(task.host().name(), task.operation());
            } catch (ExecutionException e) {
                log.error("{} task for {} died", task.operation(), task.host().name(), e.getCause());
                return HostResult.failed(task.host().name(), task.operation(), ErrorKind.INTERNAL,
                    String.valueOf(e.getCause()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                run.cancel(Duration.ZERO);
                return interrupt(task, future);
            }
        }
    }

    private HostResult interrupt(HostTask task, Future<HostResult> future) {
        future.cancel(true);
        Attempt attempt = task.attempt();
        if (attempt != null) {
            hostOperations.abandon(attempt);
        }
        return HostResult.cancelled(task.host().name(), task.operation());
    }

    /**
     * One fleet operation in progress.
     */
    static final class Run {

        private final Operation operation;
        private volatile boolean cancelled;
        private volatile long graceDeadlineNanos;

        Run(Operation operation) {
            this.operation = operation;
        }

        synchronized boolean cancel(Duration gracePeriod) {
            if (cancelled) {
                return false;
            }
            graceDeadlineNanos = System.nanoTime() + gracePeriod.toNanos();
            cancelled = true;
            log.debug("Cancelling {}", operation);
            return true;
        }

        boolean isCancelled() {
            return cancelled;
        }

        boolean graceExpired() {
            return System.nanoTime() - graceDeadlineNanos >= 0;
        }
    }

    /**
     * Work for one host inside a run.
     */
    static final class HostTask implements Callable<HostResult> {

        @FunctionalInterface
        interface Body {
            HostResult run(HostView host, Consumer<Attempt> attemptSink);
        }

        private final HostView host;
        private final Operation operation;
        private final Run run;
        private final Body body;
        private final Map<String, String> mdc;
        private final MetricsRegistry metricsRegistry;
        private volatile Attempt attempt;

        HostTask(HostView host, Operation operation, Run run, Body body,
                 Map<String, String> mdc, MetricsRegistry metricsRegistry) {
            this.host = host;
            this.operation = operation;
            this.run = run;
            this.body = body;
            this.mdc = mdc;
            this.metricsRegistry = metricsRegistry;
        }

        HostView host() {
            return host;
        }

        Operation operation() {
            return operation;
        }

        Attempt attempt() {
            return attempt;
        }

        @Override
        public HostResult call() {
            if (run.isCancelled()) {
                return HostResult.cancelled(host.name(), operation);
            }
            long started = System.nanoTime();
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            LoggingConfig.setHostContext(host.name(), operation.name().toLowerCase());
            try {
                HostResult result = body.run(host, a -> attempt = a);
                metricsRegistry.recordHostResult(result,
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
                return result;
            } finally {
                MDC.clear();
            }
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "patchwatch-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
