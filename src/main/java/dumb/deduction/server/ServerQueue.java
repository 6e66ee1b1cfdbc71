package dumb.deduction.server;

import dumb.deduction.Event;
import dumb.deduction.Events;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Runs prover tasks one at a time, in submission order unless added on top.
 * <p>
 * Each trial of a task races a timer. When the timer fires first, or the task fails, the
 * timeout is doubled and the task's cancel callback runs before the next trial; after the
 * last trial the task is abandoned and its future fails with a {@link TimeoutException}. All queue state is
 * confined to the scheduler thread.
 */
public class ServerQueue {

    private static final Logger logger = LoggerFactory.getLogger(ServerQueue.class);

    private final ScheduledExecutorService scheduler;
    private final @Nullable Events events;
    private final long timeoutMillis;
    private final long startingTimeoutMillis;
    private final int nbTrials;

    private final Deque<Task> tasks = new ArrayDeque<>();
    private volatile boolean busy;
    private boolean started;
    private volatile long actualTimeout;
    private @Nullable Trial current;
    private CompletableFuture<Void> queueEnded = CompletableFuture.completedFuture(null);

    /**
     * @param action starts one trial; the returned future completes when the trial is done
     * @param cancel run before a retry, may be null
     * @param done   completes when the task succeeds, fails with {@link TimeoutException} when abandoned
     */
    public record Task(String name, Supplier<CompletableFuture<?>> action, @Nullable Runnable cancel,
                       CompletableFuture<Void> done) {
    }

    private static final class Trial {
        final Task task;
        final int number;
        @Nullable CompletableFuture<?> running;
        @Nullable ScheduledFuture<?> deadline;
        boolean settled;

        Trial(Task task, int number) {
            this.task = task;
            this.number = number;
        }
    }

    public ServerQueue(ScheduledExecutorService scheduler, @Nullable Events events, long timeoutMillis, long startingTimeoutMillis, int nbTrials) {
        this.scheduler = requireNonNull(scheduler);
        this.events = events;
        this.timeoutMillis = timeoutMillis;
        this.startingTimeoutMillis = startingTimeoutMillis;
        this.nbTrials = nbTrials;
        this.actualTimeout = timeoutMillis;
    }

    public CompletableFuture<Void> addTask(String name, Supplier<CompletableFuture<?>> action,
                                           @Nullable Runnable cancel, boolean onTop) {
        var task = new Task(name, action, cancel, new CompletableFuture<>());
        scheduler.execute(() -> enqueue(task, onTop));
        return task.done();
    }

    private void enqueue(Task task, boolean onTop) {
        if (onTop) tasks.addFirst(task);
        else tasks.addLast(task);
        logger.debug("Added task {}{}", task.name(), onTop ? " on top" : "");
        if (!busy) {
            busy = true;
            queueEnded = new CompletableFuture<>();
            nextTask();
        }
    }

    private void nextTask() {
        var task = tasks.pollFirst();
        if (task == null) {
            busy = false;
            current = null;
            queueEnded.complete(null);
            if (events != null) events.emit(new Event.QueueEndedEvent());
            logger.debug("No more tasks");
            return;
        }
        if (!started) {
            actualTimeout = startingTimeoutMillis;
            started = true;
        } else {
            actualTimeout = timeoutMillis;
        }
        logger.debug("Launching task {}", task.name());
        attempt(task, 1);
    }

    private void attempt(Task task, int number) {
        var trial = new Trial(task, number);
        current = trial;
        CompletableFuture<?> running;
        try {
            running = requireNonNull(task.action().get(), "task returned no future");
        } catch (RuntimeException e) {
            running = CompletableFuture.failedFuture(e);
        }
        trial.running = running;
        trial.deadline = scheduler.schedule(() -> expire(trial), actualTimeout, TimeUnit.MILLISECONDS);
        running.whenCompleteAsync((r, e) -> finish(trial, e), scheduler);
    }

    private void finish(Trial trial, @Nullable Throwable error) {
        if (trial.settled) return;
        trial.settled = true;
        if (trial.deadline != null) trial.deadline.cancel(false);
        if (error == null) {
            trial.task.done().complete(null);
            nextTask();
        } else {
            logger.warn("Task {} failed (trial {}): {}", trial.task.name(), trial.number, error.toString());
            retryOrAbandon(trial);
        }
    }

    private void expire(Trial trial) {
        if (trial.settled) return;
        trial.settled = true;
        logger.warn("No answer within {}ms for {} (trial {})", actualTimeout, trial.task.name(), trial.number);
        if (trial.running != null) trial.running.cancel(false);
        retryOrAbandon(trial);
    }

    private void retryOrAbandon(Trial trial) {
        actualTimeout *= 2;
        if (trial.number >= nbTrials) {
            logger.warn("Abandoning task {} after {} trials", trial.task.name(), trial.number);
            trial.task.done().completeExceptionally(new TimeoutException(trial.task.name() + " timed out"));
            nextTask();
        } else {
            if (trial.task.cancel() != null) {
                try {
                    trial.task.cancel().run();
                } catch (RuntimeException e) {
                    logger.warn("Cancel callback of {} failed: {}", trial.task.name(), e.toString());
                }
            }
            attempt(trial.task, trial.number + 1);
        }
    }

    /** Pushes back the deadline of the running trial by the current timeout. */
    public void extendDeadline() {
        scheduler.execute(() -> {
            var trial = current;
            if (trial == null || trial.settled || trial.deadline == null) return;
            if (trial.deadline.cancel(false))
                trial.deadline = scheduler.schedule(() -> expire(trial), actualTimeout, TimeUnit.MILLISECONDS);
        });
    }

    /** Ends the running trial as if it had timed out. */
    public void cancelCurrentTask() {
        scheduler.execute(() -> {
            var trial = current;
            if (trial != null && !trial.settled) expire(trial);
        });
    }

    /** Drops every task not started yet. */
    public void clear() {
        scheduler.execute(() -> {
            Task t;
            while ((t = tasks.pollFirst()) != null)
                t.done().completeExceptionally(new CancellationException("Queue cleared"));
        });
    }

    public boolean isBusy() {
        return busy;
    }

    /** Completes when the queue next runs out of tasks. */
    public CompletableFuture<Void> queueEnded() {
        var f = new CompletableFuture<Void>();
        scheduler.execute(() -> queueEnded.whenComplete((r, e) -> f.complete(null)));
        return f;
    }

    long actualTimeoutMillis() {
        return actualTimeout;
    }
}
