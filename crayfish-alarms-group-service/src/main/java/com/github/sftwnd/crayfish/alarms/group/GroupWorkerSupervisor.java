package com.github.sftwnd.crayfish.alarms.group;

import com.github.sftwnd.crayfish.alarms.registry.AlarmRegistry;
import com.github.sftwnd.crayfish.alarms.registry.ConcurrencyFailureException;
import com.github.sftwnd.crayfish.alarms.registry.GroupWorkerTable;
import com.github.sftwnd.crayfish.alarms.registry.WorkerStatus;
import edu.umd.cs.findbugs.annotations.NonNull;
import lombok.extern.java.Log;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.stream.Collectors;

/**
 * Keeps exactly one display worker for every group that holds alarms.
 * <p>
 * Two loops wait on the registry condition with their own predicates:
 * </p>
 * <ul>
 *     <li>creation: a present group has no running worker - start one and mark the group ACTIVE;</li>
 *     <li>removal: an ACTIVE group has no alarms - request the stop; a stopping worker has terminated - mark the group INACTIVE.</li>
 * </ul>
 * The worker table shares the registry lock, so each reconciliation pass sees a consistent picture of both.
 */
@Log
class GroupWorkerSupervisor {

    private final AlarmRegistry registry;
    private final GroupWorkerTable<WorkerHandle> table;
    private final ThreadFactory threadFactory;
    private final Duration interval;
    private final IAlarmListener listener;
    private final Thread.UncaughtExceptionHandler failureHandler;
    private final AtomicLong workerIds = new AtomicLong();
    private volatile boolean running = true;

    GroupWorkerSupervisor(
            @NonNull AlarmRegistry registry,
            @NonNull ThreadFactory threadFactory,
            @NonNull Duration interval,
            @NonNull IAlarmListener listener,
            @NonNull Thread.UncaughtExceptionHandler failureHandler
    ) {
        this.registry = Objects.requireNonNull(registry, "GroupWorkerSupervisor::new - registry is null");
        this.threadFactory = Objects.requireNonNull(threadFactory, "GroupWorkerSupervisor::new - threadFactory is null");
        this.interval = Objects.requireNonNull(interval, "GroupWorkerSupervisor::new - interval is null");
        this.listener = Objects.requireNonNull(listener, "GroupWorkerSupervisor::new - listener is null");
        this.failureHandler = Objects.requireNonNull(failureHandler, "GroupWorkerSupervisor::new - failureHandler is null");
        this.table = new GroupWorkerTable<>(registry);
    }

    void creationLoop() throws InterruptedException {
        try (AlarmRegistry.Guard guard = registry.guard()) {
            while (running) {
                guard.await(() -> !running || !vacantGroups().isEmpty());
                if (running && !reconcileCreation()) {
                    // spawn failure: retry on the next registry change
                    guard.awaitChange();
                }
            }
        }
        logger.fine("GroupWorkerSupervisor::creationLoop is completed");
    }

    void removalLoop() throws InterruptedException {
        try (AlarmRegistry.Guard guard = registry.guard()) {
            while (running) {
                guard.await(() -> !running || hasRetirableGroups());
                if (running && reconcileRemoval()) {
                    guard.broadcast();
                }
            }
        }
        logger.fine("GroupWorkerSupervisor::removalLoop is completed");
    }

    /**
     * Start workers for the present groups without a running worker. Lock is held.
     * @return false if at least one worker could not be started
     */
    boolean reconcileCreation() {
        boolean success = true;
        for (int groupId : vacantGroups()) {
            if (table.status(groupId) == WorkerStatus.ACTIVE) {
                logger.log(Level.WARNING, "Display worker of Group({0}) has terminated unexpectedly", groupId);
                table.deactivate(groupId);
            }
            success &= spawn(groupId);
        }
        return success;
    }

    /**
     * Request the stop of workers of the vanished groups and release the terminated ones. Lock is held.
     * @return true if at least one group became INACTIVE
     */
    boolean reconcileRemoval() {
        SortedSet<Integer> present = registry.groupsPresent();
        table.handles(WorkerStatus.ACTIVE).forEach((groupId, handle) -> {
            if (!present.contains(groupId)) {
                table.requestStop(groupId).cancel();
                logger.log(Level.FINE, "{0} is requested to stop", handle);
                listener.workerStopRequested(handle);
            }
        });
        boolean released = false;
        for (Map.Entry<Integer, WorkerHandle> entry : table.handles(WorkerStatus.STOP_REQUESTED).entrySet()) {
            if (entry.getValue().isTerminated()) {
                table.deactivate(entry.getKey());
                logger.log(Level.FINE, "{0} is removed", entry.getValue());
                listener.workerRemoved(entry.getValue());
                released = true;
            }
        }
        return released;
    }

    /**
     * Workers of the ACTIVE groups
     * @return group to worker map in group order
     */
    @NonNull Map<Integer, WorkerHandle> activeWorkers() {
        return registry.exclusive(guard -> table.handles(WorkerStatus.ACTIVE));
    }

    /**
     * Status of the group worker slot
     * @param groupId alarm group
     * @return status in the worker table
     */
    @NonNull WorkerStatus status(int groupId) {
        return registry.exclusive(guard -> table.status(groupId));
    }

    /**
     * Active groups with their alarms, taken atomically
     * @return views in group order
     */
    @NonNull List<GroupView> groupViews() {
        return registry.exclusive(guard -> table.handles(WorkerStatus.ACTIVE)
                .values()
                .stream()
                .map(handle -> new GroupView(handle.getGroupId(), handle.getWorkerId(), handle.getStartedAt(), registry.snapshotByGroup(handle.getGroupId())))
                .collect(Collectors.toUnmodifiableList()));
    }

    /**
     * Stop both loops and all the workers
     * @param timeout wait for every worker termination
     * @throws InterruptedException if the current thread is interrupted
     */
    void stop(@NonNull Duration timeout) throws InterruptedException {
        running = false;
        List<WorkerHandle> workers = registry.exclusive(guard -> {
            List<WorkerHandle> handles = new ArrayList<>(table.handles(WorkerStatus.ACTIVE).values());
            handles.addAll(table.handles(WorkerStatus.STOP_REQUESTED).values());
            handles.forEach(WorkerHandle::cancel);
            guard.broadcast();
            return handles;
        });
        for (WorkerHandle worker : workers) {
            if (!worker.awaitTermination(timeout)) {
                logger.log(Level.WARNING, "{0} has not stopped in {1}", new Object[] {worker, timeout});
            }
        }
        registry.exclusive(guard -> {
            workers.forEach(worker -> table.deactivate(worker.getGroupId()));
            return null;
        });
    }

    boolean isRunning() {
        return running;
    }

    // Lock is held
    private SortedSet<Integer> vacantGroups() {
        return registry.groupsPresent()
                .stream()
                .filter(this::isVacant)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    // Lock is held. Group has no running worker
    private boolean isVacant(int groupId) {
        WorkerStatus status = table.status(groupId);
        return status == WorkerStatus.INACTIVE
            || (status == WorkerStatus.ACTIVE && table.handle(groupId).map(WorkerHandle::isTerminated).orElse(true));
    }

    // Lock is held
    private boolean hasRetirableGroups() {
        SortedSet<Integer> present = registry.groupsPresent();
        return table.handles(WorkerStatus.ACTIVE).keySet().stream().anyMatch(groupId -> !present.contains(groupId))
            || table.handles(WorkerStatus.STOP_REQUESTED).values().stream().anyMatch(WorkerHandle::isTerminated);
    }

    // Lock is held
    private boolean spawn(int groupId) {
        Instant now = registry.now();
        WorkerHandle handle = new WorkerHandle(workerIds.incrementAndGet(), groupId, now);
        try {
            Thread thread = Optional.ofNullable(threadFactory.newThread(new DisplayWorker(registry, handle, interval, listener)))
                    .orElseThrow(() -> new IllegalStateException("ThreadFactory has rejected the display worker of Group(" + groupId + ")"));
            thread.setName("alarm-display-" + handle.getWorkerId());
            thread.setDaemon(true);
            // a broken registry lock inside the worker is as fatal as in the service loops
            thread.setUncaughtExceptionHandler(failureHandler);
            handle.attach(thread);
            thread.start();
        } catch (ConcurrencyFailureException cfex) {
            throw cfex;
        } catch (RuntimeException | OutOfMemoryError error) {
            logger.log(Level.SEVERE, "Unable to create display worker for Group(" + groupId + ")", error);
            listener.workerSpawnFailed(groupId, error);
            return false;
        }
        table.activate(groupId, handle);
        logger.log(Level.FINE, "{0} is created", handle);
        registry.snapshotByGroup(groupId).stream().findFirst().ifPresent(alarm -> listener.workerCreated(handle, alarm));
        return true;
    }

    // Identifier of the last started worker
    long lastWorkerId() {
        return workerIds.get();
    }

}
