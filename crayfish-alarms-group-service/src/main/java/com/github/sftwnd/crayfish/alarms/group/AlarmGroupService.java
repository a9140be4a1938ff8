package com.github.sftwnd.crayfish.alarms.group;

import com.github.sftwnd.crayfish.alarms.registry.Alarm;
import com.github.sftwnd.crayfish.alarms.registry.AlarmRegistry;
import com.github.sftwnd.crayfish.alarms.registry.IAlarmRegistry;
import com.github.sftwnd.crayfish.alarms.registry.WorkerStatus;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import lombok.extern.java.Log;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.logging.Level;

/**
 * The service owns the alarm registry, the group worker supervisor and the optional earliest-deadline dispatcher.
 * <p>
 * Service threads: the creation loop, the removal loop, the dispatcher and one display worker per active group.
 * An exception escaping one of the loops or a display worker (a broken lock or condition first of all) means that
 * the shared state can not be trusted any more: it is logged and passed to the fatal handler.
 * </p>
 */
@Log
public class AlarmGroupService implements IAlarmGroupService {

    public static final int FATAL_EXIT_CODE = 70;

    private static final int STARTING = 1;
    private static final int STARTED = 2;
    private static final int CLOSED = 3;

    private final AlarmRegistry registry;
    private final AlarmGroupServiceConfig config;
    private final GroupWorkerSupervisor supervisor;
    private final AlarmDispatcher dispatcher;
    private final Consumer<Throwable> fatalHandler;
    private final List<Thread> threads = new ArrayList<>();
    private final AtomicInteger state = new AtomicInteger(0);

    /**
     * Construct the service
     * @param registry alarm registry (new one if null)
     * @param config service settings (loaded from the classpath configuration if null)
     * @param listener receiver of the service events
     * @param workerThreadFactory factory of the display worker threads (plain threads if null)
     * @param fatalHandler reaction on a failure of a service loop (process halt if null)
     */
    public AlarmGroupService(
            @Nullable AlarmRegistry registry,
            @Nullable AlarmGroupServiceConfig config,
            @Nullable IAlarmListener listener,
            @Nullable ThreadFactory workerThreadFactory,
            @Nullable Consumer<Throwable> fatalHandler
    ) {
        this.registry = Optional.ofNullable(registry).orElseGet(AlarmRegistry::new);
        this.config = Optional.ofNullable(config).orElseGet(AlarmGroupServiceConfig::load);
        this.fatalHandler = Optional.ofNullable(fatalHandler).orElse(AlarmGroupService::halt);
        IAlarmListener guardedListener = new GuardedAlarmListener(listener);
        this.supervisor = new GroupWorkerSupervisor(
                this.registry,
                Optional.ofNullable(workerThreadFactory).orElse(Thread::new),
                this.config.getDisplayInterval(),
                guardedListener,
                this::fatal);
        this.dispatcher = new AlarmDispatcher(this.registry, guardedListener);
    }

    public AlarmGroupService(@Nullable AlarmGroupServiceConfig config, @Nullable IAlarmListener listener) {
        this(null, config, listener, null, null);
    }

    @Override
    public void start() {
        if (!state.compareAndSet(0, STARTING)) {
            throw new IllegalStateException("AlarmGroupService is already started");
        }
        threads.add(serviceThread("alarm-group-creation", supervisor::creationLoop));
        threads.add(serviceThread("alarm-group-removal", supervisor::removalLoop));
        if (config.isDispatcherEnabled()) {
            threads.add(serviceThread("alarm-dispatcher", dispatcher::dispatchLoop));
        }
        threads.forEach(Thread::start);
        state.set(STARTED);
        logger.log(Level.INFO, "AlarmGroupService is started: display interval {0}, dispatcher {1}",
                new Object[] {config.getDisplayInterval(), config.isDispatcherEnabled() ? "enabled" : "disabled"});
    }

    @Override
    public @NonNull Alarm registerAlarm(int id, int groupId, int periodSeconds, @Nullable String message) {
        return registry.insert(id, groupId, periodSeconds, message);
    }

    @Override
    public @NonNull List<GroupView> viewAlarms() {
        return supervisor.groupViews();
    }

    @Override
    public @NonNull Map<Integer, WorkerHandle> activeWorkers() {
        return supervisor.activeWorkers();
    }

    @Override
    public @NonNull WorkerStatus workerStatus(int groupId) {
        return supervisor.status(groupId);
    }

    @Override
    public @NonNull IAlarmRegistry registry() {
        return registry;
    }

    public @NonNull AlarmGroupServiceConfig getConfig() {
        return config;
    }

    boolean isStarted() {
        return state.get() == STARTED;
    }

    long lastWorkerId() {
        return supervisor.lastWorkerId();
    }

    @Override
    public void close() {
        if (state.getAndSet(CLOSED) == CLOSED) {
            return;
        }
        Duration timeout = config.getShutdownTimeout();
        try {
            dispatcher.stop();
            supervisor.stop(timeout);
            for (Thread thread : threads) {
                thread.join(timeout.toMillis());
                if (thread.isAlive()) {
                    logger.log(Level.WARNING, "{0} has not stopped in {1}", new Object[] {thread.getName(), timeout});
                }
            }
            logger.info("AlarmGroupService is stopped");
        } catch (InterruptedException itrex) {
            logger.log(Level.WARNING, "AlarmGroupService::close is interrupted by cause: {0}", Optional.ofNullable(itrex.getLocalizedMessage()).orElseGet(() -> String.valueOf(itrex)));
            Thread.currentThread().interrupt();
        }
    }

    private Thread serviceThread(@NonNull String name, @NonNull ServiceLoop loop) {
        Thread thread = new Thread(() -> {
            try {
                loop.run();
            } catch (InterruptedException itrex) {
                logger.log(Level.WARNING, "{0} is terminated by cause: {1}", new Object[] {name, Optional.ofNullable(itrex.getLocalizedMessage()).orElseGet(() -> String.valueOf(itrex))});
                Thread.currentThread().interrupt();
            }
        }, name);
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler(this::fatal);
        return thread;
    }

    private void fatal(Thread thread, Throwable throwable) {
        logger.log(Level.SEVERE, "Service thread " + thread.getName() + " has failed, shared alarm state is not reliable", throwable);
        fatalHandler.accept(throwable);
    }

    private static void halt(Throwable throwable) {
        Objects.requireNonNull(throwable, "AlarmGroupService::halt - throwable is null");
        Runtime.getRuntime().halt(FATAL_EXIT_CODE);
    }

    @FunctionalInterface
    private interface ServiceLoop {
        void run() throws InterruptedException;
    }

}
