package com.github.sftwnd.crayfish.alarms.group;

import com.github.sftwnd.crayfish.alarms.registry.Alarm;
import com.github.sftwnd.crayfish.alarms.registry.AlarmRegistry;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import lombok.extern.java.Log;

import java.time.Instant;
import java.util.Objects;
import java.util.logging.Level;

/**
 * Earliest-deadline dispatcher: sleeps exactly until the earliest alarm of the registry is due and fires it.
 * <p>
 * The deadline of the current wait is published in the registry. An insertion of an earlier alarm replaces it under
 * the lock, so the dispatcher wakes up, sees that its deadline is no longer awaited and starts a new wait for the
 * new earliest alarm instead of treating the wake-up as an expiry.
 * </p>
 * A fired alarm with a positive period is queued again one period later, a zero period alarm leaves the registry.
 */
@Log
class AlarmDispatcher {

    private final AlarmRegistry registry;
    private final IAlarmListener listener;
    private volatile boolean running = true;

    AlarmDispatcher(@NonNull AlarmRegistry registry, @NonNull IAlarmListener listener) {
        this.registry = Objects.requireNonNull(registry, "AlarmDispatcher::new - registry is null");
        this.listener = Objects.requireNonNull(listener, "AlarmDispatcher::new - listener is null");
    }

    void dispatchLoop() throws InterruptedException {
        while (running) {
            Alarm fired = nextExpired();
            if (fired != null) {
                logger.log(Level.FINE, "Alarm({0}) has expired at {1}", new Object[] {fired.getId(), fired.getDueTime()});
                listener.alarmExpired(fired);
            }
        }
    }

    // One Idle -> Waiting(deadline) -> expiry or preemption cycle. null if there is nothing to fire
    private @Nullable Alarm nextExpired() throws InterruptedException {
        try (AlarmRegistry.Guard guard = registry.guard()) {
            registry.setAwaitedDeadline(null);
            guard.await(() -> !running || !registry.isEmpty());
            if (!running) {
                return null;
            }
            Instant target = registry.peek().orElseThrow();
            registry.setAwaitedDeadline(target);
            boolean expired = false;
            while (running && registry.getAwaitedDeadline().filter(target::equals).isPresent()) {
                if (!guard.awaitUntil(target)) {
                    expired = true;
                    break;
                }
            }
            if (!expired) {
                // preempted by an earlier alarm or stopped
                return null;
            }
            Instant now = registry.now();
            Alarm alarm = registry.popIfDue(now).orElse(null);
            if (alarm != null && alarm.getPeriodSeconds() > 0) {
                registry.requeue(alarm, now);
            }
            return alarm;
        }
    }

    void stop() {
        running = false;
        registry.exclusive(guard -> {
            guard.broadcast();
            return null;
        });
    }

    boolean isRunning() {
        return running;
    }

}
