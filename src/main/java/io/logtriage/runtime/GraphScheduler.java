package io.logtriage.runtime;

import io.logtriage.model.StageError;
import io.logtriage.model.StageErrorKind;
import io.logtriage.observability.TraceContextUtil;
import io.logtriage.reasoner.Reasoner;
import io.logtriage.stage.Stage;
import io.logtriage.stage.StageContext;
import io.logtriage.stage.StageId;
import io.logtriage.stage.StageRegistry;
import io.logtriage.state.Reducers;
import io.logtriage.state.SharedState;
import io.logtriage.state.StateUpdate;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a validated {@link PipelineGraph}. Ready stages execute concurrently on a bounded pool;
 * their updates are merged one at a time on the calling thread, in completion order, and the ready
 * set is recomputed after every merge. A failing stage contributes nothing but does not stop its
 * siblings or dependents.
 */
public final class GraphScheduler {
    private static final long POLL_SLICE_MS = 50L;

    private final PipelineGraph graph;
    private final StageRegistry registry;
    private final int parallelism;
    private final long runTimeoutMs;
    private final RunListener listener;

    public GraphScheduler(PipelineGraph graph, StageRegistry registry, int parallelism, long runTimeoutMs,
                          RunListener listener) {
        this.graph = graph;
        this.registry = registry;
        this.parallelism = Math.max(1, parallelism);
        this.runTimeoutMs = runTimeoutMs;
        this.listener = listener == null ? RunListener.noop() : listener;
        for (StageId node : graph.nodes()) {
            if (registry.findById(node).isEmpty()) {
                throw new GraphValidationException("No stage registered for node: " + node.id());
            }
        }
    }

    public RunOutcome run(SharedState initial, Reasoner reasoner, RunCancellation cancellation) {
        return run(TraceContextUtil.newRunId(), TraceContextUtil.newTraceId(), initial, reasoner, cancellation);
    }

    public RunOutcome run(String runId, String traceId, SharedState initial, Reasoner reasoner,
                          RunCancellation cancellation) {
        RunCancellation token = cancellation == null ? new RunCancellation() : cancellation;
        long startedNanos = System.nanoTime();
        long deadlineNanos = runTimeoutMs > 0 ? startedNanos + TimeUnit.MILLISECONDS.toNanos(runTimeoutMs) : Long.MAX_VALUE;
        fire(() -> listener.runStarted(runId, traceId, initial.logEntries().size(), initial.issues().size()));

        ExecutorService pool = Executors.newFixedThreadPool(parallelism, stageThreads(runId));
        CompletionService<StageCompletion> completion = new ExecutorCompletionService<>(pool);
        Map<StageId, Future<StageCompletion>> inFlight = new EnumMap<>(StageId.class);
        Set<StageId> dispatched = EnumSet.noneOf(StageId.class);
        Map<StageId, Long> durations = new EnumMap<>(StageId.class);
        SharedState state = initial;
        try {
            state = dispatchReady(runId, traceId, state, reasoner, completion, inFlight, dispatched, token);
            while (!inFlight.isEmpty()) {
                if (token.isCancelled()) {
                    break;
                }
                long remaining = deadlineNanos - System.nanoTime();
                if (remaining <= 0) {
                    token.cancel("run timed out after " + runTimeoutMs + "ms");
                    break;
                }
                Future<StageCompletion> next = completion.poll(
                        Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(POLL_SLICE_MS)), TimeUnit.NANOSECONDS);
                if (next == null) {
                    continue;
                }
                StageCompletion done = resultOf(next);
                inFlight.remove(done.stage());
                if (token.isCancelled()) {
                    break;
                }
                durations.put(done.stage(), done.durationMs());
                state = mergeCompletion(runId, traceId, state, done);
                state = dispatchReady(runId, traceId, state, reasoner, completion, inFlight, dispatched, token);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel("scheduler interrupted");
        } finally {
            pool.shutdownNow();
        }

        RunStatus status = token.isCancelled() ? RunStatus.CANCELLED : RunStatus.COMPLETED;
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
        RunOutcome outcome = new RunOutcome(runId, traceId, status, token.reason(), durationMs, durations, state);
        fire(() -> listener.runFinished(outcome));
        return outcome;
    }

    private SharedState dispatchReady(
            String runId,
            String traceId,
            SharedState state,
            Reasoner reasoner,
            CompletionService<StageCompletion> completion,
            Map<StageId, Future<StageCompletion>> inFlight,
            Set<StageId> dispatched,
            RunCancellation token
    ) {
        if (token.isCancelled()) {
            return state;
        }
        List<StageId> ready = new ArrayList<>();
        for (StageId node : graph.nodes()) {
            if (!dispatched.contains(node) && state.completedStages().containsAll(graph.dependenciesOf(node))) {
                ready.add(node);
            }
        }
        if (ready.isEmpty() && inFlight.isEmpty() && dispatched.size() < graph.nodes().size()) {
            throw new IllegalStateException("Pipeline stalled with undispatched stages");
        }
        for (StageId node : ready) {
            Stage stage = registry.findById(node).orElseThrow();
            String spanId = TraceContextUtil.newSpanId();
            StageContext context = new StageContext(runId, node, traceId, spanId, state);
            dispatched.add(node);
            fire(() -> listener.stageStarted(runId, traceId, spanId, node));
            inFlight.put(node, completion.submit(() -> execute(stage, context, reasoner)));
        }
        return state;
    }

    private static StageCompletion execute(Stage stage, StageContext context, Reasoner reasoner) {
        long started = System.nanoTime();
        try {
            StateUpdate update = stage.execute(context, reasoner);
            return new StageCompletion(context.stageId(), context.spanId(), update, null, elapsedMs(started));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new StageCompletion(context.stageId(), context.spanId(), null, e, elapsedMs(started));
        } catch (Throwable e) {
            // Errors included: a broken stage fails alone, the run still finishes.
            return new StageCompletion(context.stageId(), context.spanId(), null, e, elapsedMs(started));
        }
    }

    private SharedState mergeCompletion(String runId, String traceId, SharedState state, StageCompletion done) {
        SharedState next;
        if (done.failure() != null) {
            next = Reducers.fail(state, done.stage(), StageError.of(done.stage(), StageErrorKind.STAGE_FAILED,
                    describe(done.failure())));
        } else if (done.update() == null) {
            next = Reducers.fail(state, done.stage(), StageError.of(done.stage(), StageErrorKind.STAGE_FAILED,
                    "stage returned no update"));
        } else {
            next = Reducers.merge(state, done.stage(), done.update());
        }
        if (next.failedStages().contains(done.stage())) {
            StageError error = lastError(next, done.stage());
            fire(() -> listener.stageFailed(runId, traceId, done.spanId(), done.stage(), done.durationMs(), error));
        } else {
            fire(() -> listener.stageCompleted(runId, traceId, done.spanId(), done.stage(), done.durationMs()));
        }
        return next;
    }

    private static StageCompletion resultOf(Future<StageCompletion> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            // execute() catches every Throwable; only a failure outside the stage body lands here.
            throw new IllegalStateException("stage task crashed", e.getCause());
        }
    }

    private static StageError lastError(SharedState state, StageId stage) {
        StageError found = null;
        for (StageError error : state.softErrors()) {
            if (error.stage() == stage && error.stageLevel()) {
                found = error;
            }
        }
        return found;
    }

    private static String describe(Throwable failure) {
        String message = failure.getMessage();
        return failure.getClass().getSimpleName() + (message == null || message.isBlank() ? "" : ": " + message);
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    private static void fire(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            System.err.println("WARN run listener failed: " + e.getMessage());
        }
    }

    private static ThreadFactory stageThreads(String runId) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "logtriage-" + runId + "-stage-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    record StageCompletion(StageId stage, String spanId, StateUpdate update, Throwable failure, long durationMs) {
    }
}
