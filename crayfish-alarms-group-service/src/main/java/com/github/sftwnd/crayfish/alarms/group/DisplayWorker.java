package com.github.sftwnd.crayfish.alarms.group;

import com.github.sftwnd.crayfish.alarms.registry.Alarm;
import com.github.sftwnd.crayfish.alarms.registry.AlarmRegistry;
import edu.umd.cs.findbugs.annotations.NonNull;
import lombok.extern.java.Log;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;

/**
 * Periodic scanner of the due alarms of one group.
 * <p>
 * Every interval the worker checks its cancellation token and, if it is not set, fires the due alarms of the group:
 * each of them is reported and moved to now plus its period. The worker never decides to stop by itself,
 * it is retired by the supervisor through the token.
 * </p>
 */
@Log
class DisplayWorker implements Runnable {

    private final AlarmRegistry registry;
    private final WorkerHandle handle;
    private final Duration interval;
    private final IAlarmListener listener;

    DisplayWorker(@NonNull AlarmRegistry registry, @NonNull WorkerHandle handle, @NonNull Duration interval, @NonNull IAlarmListener listener) {
        this.registry = Objects.requireNonNull(registry, "DisplayWorker::new - registry is null");
        this.handle = Objects.requireNonNull(handle, "DisplayWorker::new - handle is null");
        this.interval = Objects.requireNonNull(interval, "DisplayWorker::new - interval is null");
        this.listener = Objects.requireNonNull(listener, "DisplayWorker::new - listener is null");
    }

    @Override
    public void run() {
        logger.log(Level.FINE, "{0} is started", handle);
        try {
            while (!handle.awaitCancellation(interval)) {
                displayDueAlarms();
            }
            logger.log(Level.FINE, "{0} is stopped", handle);
        } catch (InterruptedException itrex) {
            logger.log(Level.WARNING, "{0} is terminated by cause: {1}", new Object[] {handle, Optional.ofNullable(itrex.getLocalizedMessage()).orElseGet(() -> String.valueOf(itrex))});
            Thread.currentThread().interrupt();
        } finally {
            handle.terminated();
            // the removal loop waits for the termination
            registry.exclusive(guard -> {
                guard.broadcast();
                return null;
            });
        }
    }

    void displayDueAlarms() {
        List<Alarm> fired = registry.fireDue(handle.getGroupId(), registry.now());
        fired.forEach(alarm -> listener.alarmDisplayed(handle, alarm));
    }

}
