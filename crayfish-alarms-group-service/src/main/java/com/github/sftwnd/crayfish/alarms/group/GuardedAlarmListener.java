package com.github.sftwnd.crayfish.alarms.group;

import com.github.sftwnd.crayfish.alarms.registry.Alarm;
import com.github.sftwnd.crayfish.alarms.registry.ConcurrencyFailureException;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import lombok.extern.java.Log;

import java.util.Optional;
import java.util.logging.Level;

/**
 * Listener wrapper: a failure of the listener is logged and does not break the calling loop.
 * Concurrency failures are passed through.
 */
@Log
final class GuardedAlarmListener implements IAlarmListener {

    private static final IAlarmListener SILENT = new IAlarmListener() {};

    private final IAlarmListener listener;

    GuardedAlarmListener(@Nullable IAlarmListener listener) {
        this.listener = Optional.ofNullable(listener).orElse(SILENT);
    }

    @Override
    public void alarmDisplayed(@NonNull WorkerHandle worker, @NonNull Alarm alarm) {
        call("alarmDisplayed", () -> listener.alarmDisplayed(worker, alarm));
    }

    @Override
    public void alarmExpired(@NonNull Alarm alarm) {
        call("alarmExpired", () -> listener.alarmExpired(alarm));
    }

    @Override
    public void workerCreated(@NonNull WorkerHandle worker, @NonNull Alarm alarm) {
        call("workerCreated", () -> listener.workerCreated(worker, alarm));
    }

    @Override
    public void workerStopRequested(@NonNull WorkerHandle worker) {
        call("workerStopRequested", () -> listener.workerStopRequested(worker));
    }

    @Override
    public void workerRemoved(@NonNull WorkerHandle worker) {
        call("workerRemoved", () -> listener.workerRemoved(worker));
    }

    @Override
    public void workerSpawnFailed(int groupId, @NonNull Throwable cause) {
        call("workerSpawnFailed", () -> listener.workerSpawnFailed(groupId, cause));
    }

    private void call(String event, Runnable call) {
        try {
            call.run();
        } catch (ConcurrencyFailureException cfex) {
            throw cfex;
        } catch (RuntimeException rtex) {
            logger.log(Level.WARNING, "IAlarmListener::" + event + " has failed", rtex);
        }
    }

}
