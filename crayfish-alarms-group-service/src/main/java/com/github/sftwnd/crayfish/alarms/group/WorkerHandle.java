package com.github.sftwnd.crayfish.alarms.group;

import edu.umd.cs.findbugs.annotations.NonNull;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Display worker descriptor: identity, cancellation token and termination mark.
 * Worker ids are assigned monotonically by the supervisor and are used instead of thread ids in the logs.
 */
public final class WorkerHandle {

    @Getter private final long workerId;
    @Getter private final int groupId;
    @Getter private final Instant startedAt;
    private final CountDownLatch cancellation = new CountDownLatch(1);
    private final CompletableFuture<Void> termination = new CompletableFuture<>();
    private volatile Thread thread;

    WorkerHandle(long workerId, int groupId, @NonNull Instant startedAt) {
        this.workerId = workerId;
        this.groupId = groupId;
        this.startedAt = Objects.requireNonNull(startedAt, "WorkerHandle::new - startedAt is null");
    }

    /**
     * Set the cancellation token. The worker leaves its loop on the next check
     */
    public void cancel() {
        cancellation.countDown();
    }

    public boolean isCancelled() {
        return cancellation.getCount() == 0;
    }

    public boolean isTerminated() {
        return termination.isDone();
    }

    public @NonNull CompletionStage<Void> terminationStage() {
        return termination.minimalCompletionStage();
    }

    /**
     * Wait for the worker thread completion
     * @param timeout maximal wait
     * @return true if the worker has terminated
     * @throws InterruptedException if the current thread is interrupted
     */
    public boolean awaitTermination(@NonNull Duration timeout) throws InterruptedException {
        Thread workerThread = this.thread;
        if (workerThread != null) {
            workerThread.join(Math.max(1L, timeout.toMillis()));
        }
        return isTerminated() || Optional.ofNullable(workerThread).map(t -> !t.isAlive()).orElse(false);
    }

    // Sleep for one polling interval. true - the token is set
    boolean awaitCancellation(@NonNull Duration interval) throws InterruptedException {
        return cancellation.await(interval.toNanos(), TimeUnit.NANOSECONDS);
    }

    void attach(@NonNull Thread thread) {
        this.thread = thread;
    }

    void terminated() {
        termination.complete(null);
    }

    @Override
    public String toString() {
        return "DisplayWorker(" + workerId + ")[Group(" + groupId + ")]";
    }

}
