/*
 * Copyright © 2017-2023 Andrey D. Shindarev. All rights reserved.
 * This program is made available under the terms of the BSD 3-Clause License.
 * Contacts: ashindarev@gmail.com
 */
package com.github.sftwnd.crayfish.alarms.registry;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import lombok.extern.java.Log;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.stream.Collectors;

/**
 * Alarm registry guarded by one lock and one condition.
 * <p>
 * The condition is shared by independent waiters (the dispatcher and both supervisor loops), so every change is
 * announced with signalAll and every waiter re-checks its own predicate after each wake-up.
 * </p>
 * The registry also keeps the deadline the dispatcher is waiting for. A change of this value under the lock tells
 * the dispatcher that its wait is no longer the earliest one.
 */
@Log
public class AlarmRegistry implements IAlarmRegistry {

    // Ascending dueTime, insertion sequence for the equal ones
    static final Comparator<Alarm> ORDER = Comparator.comparing(Alarm::getDueTime).thenComparingLong(Alarm::getSequence);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Clock clock;
    // Ascending dueTime, equal dueTime in the insertion order
    private final List<Alarm> alarms = new ArrayList<>();
    // Deadline of the dispatcher wait. null - dispatcher is idle
    private Instant awaitedDeadline = null;
    private long sequence = 0;

    public AlarmRegistry() {
        this(Clock.systemUTC());
    }

    public AlarmRegistry(@NonNull Clock clock) {
        this.clock = Objects.requireNonNull(clock, "AlarmRegistry::new - clock is null");
    }

    public @NonNull Instant now() {
        return Instant.now(clock);
    }

    @Override
    public @NonNull Alarm insert(int id, int groupId, int periodSeconds, @Nullable String message) {
        validate(groupId, periodSeconds);
        Instant now = now();
        return insert(Alarm.builder()
                .id(id)
                .groupId(groupId)
                .periodSeconds(periodSeconds)
                .dueTime(now.plusSeconds(periodSeconds))
                .createdAt(now)
                .message(message)
                .build());
    }

    @Override
    public @NonNull Alarm insert(@NonNull Alarm alarm) {
        Objects.requireNonNull(alarm, "AlarmRegistry::insert - alarm is null");
        validate(alarm.getGroupId(), alarm.getPeriodSeconds());
        Alarm stored = alarm.copy();
        Alarm result = exclusive(guard -> {
            enqueue(stored);
            guard.broadcast();
            return stored.copy();
        });
        logger.log(Level.FINE, "Alarm({0}) inserted: group {1}, due {2}", new Object[] {result.getId(), result.getGroupId(), result.getDueTime()});
        return result;
    }

    @Override
    public @NonNull Optional<Alarm> popIfDue(@NonNull Instant now) {
        Objects.requireNonNull(now, "AlarmRegistry::popIfDue - now is null");
        return exclusive(guard -> {
            if (alarms.isEmpty() || !alarms.get(0).isDue(now)) {
                return Optional.empty();
            }
            Alarm alarm = alarms.remove(0);
            guard.broadcast();
            return Optional.of(alarm.copy());
        });
    }

    @Override
    public @NonNull Optional<Instant> peek() {
        return exclusive(guard -> alarms.stream().findFirst().map(Alarm::getDueTime));
    }

    @Override
    public @NonNull List<Alarm> snapshotByGroup(int groupId) {
        return exclusive(guard -> alarms.stream()
                .filter(alarm -> alarm.getGroupId() == groupId)
                .map(Alarm::copy)
                .collect(Collectors.toUnmodifiableList()));
    }

    @Override
    public @NonNull List<Alarm> snapshot() {
        return exclusive(guard -> alarms.stream().map(Alarm::copy).collect(Collectors.toUnmodifiableList()));
    }

    @Override
    public boolean remove(int id) {
        boolean removed = exclusive(guard -> {
            if (alarms.removeIf(alarm -> alarm.getId() == id)) {
                headChanged();
                guard.broadcast();
                return true;
            }
            return false;
        });
        if (removed) {
            logger.log(Level.FINE, "Alarm({0}) removed", id);
        }
        return removed;
    }

    @Override
    public boolean updateDueTime(int id, @NonNull Instant dueTime) {
        Objects.requireNonNull(dueTime, "AlarmRegistry::updateDueTime - dueTime is null");
        return exclusive(guard -> {
            List<Alarm> moved = extract(alarm -> alarm.getId() == id);
            if (moved.isEmpty()) {
                return false;
            }
            moved.forEach(alarm -> { alarm.setDueTime(dueTime); enqueue(alarm); });
            headChanged();
            guard.broadcast();
            return true;
        });
    }

    @Override
    public @NonNull Alarm requeue(@NonNull Alarm alarm, @NonNull Instant now) {
        Objects.requireNonNull(alarm, "AlarmRegistry::requeue - alarm is null");
        Objects.requireNonNull(now, "AlarmRegistry::requeue - now is null");
        Alarm next = alarm.copy();
        next.setDueTime(now.plusSeconds(alarm.getPeriodSeconds()));
        return insert(next);
    }

    @Override
    public @NonNull List<Alarm> fireDue(int groupId, @NonNull Instant now) {
        Objects.requireNonNull(now, "AlarmRegistry::fireDue - now is null");
        return exclusive(guard -> {
            List<Alarm> due = extract(alarm -> alarm.getGroupId() == groupId && alarm.isDue(now));
            if (due.isEmpty()) {
                return List.of();
            }
            List<Alarm> fired = due.stream().map(Alarm::copy).collect(Collectors.toUnmodifiableList());
            due.forEach(alarm -> { alarm.setDueTime(now.plusSeconds(alarm.getPeriodSeconds())); enqueue(alarm); });
            headChanged();
            guard.broadcast();
            return fired;
        });
    }

    @Override
    public @NonNull SortedSet<Integer> groupsPresent() {
        return exclusive(guard -> alarms.stream()
                .map(Alarm::getGroupId)
                .collect(Collectors.toCollection(TreeSet::new)));
    }

    @Override
    public int size() {
        return exclusive(guard -> alarms.size());
    }

    /**
     * Deadline the dispatcher is waiting for. The caller has to hold the registry lock.
     * @return deadline or empty if the dispatcher is idle
     */
    public @NonNull Optional<Instant> getAwaitedDeadline() {
        requireLock("AlarmRegistry::getAwaitedDeadline");
        return Optional.ofNullable(awaitedDeadline);
    }

    /**
     * Publish the deadline of the dispatcher wait. The caller has to hold the registry lock.
     * @param deadline deadline of the wait or null for idle state
     */
    public void setAwaitedDeadline(@Nullable Instant deadline) {
        requireLock("AlarmRegistry::setAwaitedDeadline");
        this.awaitedDeadline = deadline;
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    /**
     * Acquire the registry lock
     * @return guard releasing the lock on close
     */
    public @NonNull Guard guard() {
        return new Guard();
    }

    /**
     * Call the action with the registry lock held
     * @param action action under the lock
     * @param <T> result type
     * @return result of the action
     */
    public <T> T exclusive(@NonNull GuardedAction<T> action) {
        Objects.requireNonNull(action, "AlarmRegistry::exclusive - action is null");
        try (Guard guard = guard()) {
            return action.apply(guard);
        }
    }

    // operation: Class::method of the caller
    void requireLock(@NonNull String operation) {
        if (!lock.isHeldByCurrentThread()) {
            throw new ConcurrencyFailureException(operation + " - registry lock is not held by " + Thread.currentThread().getName());
        }
    }

    private static void validate(int groupId, int periodSeconds) {
        if (!IAlarmRegistry.isValidGroup(groupId)) {
            throw new InvalidAlarmException("Group(" + groupId + ") is out of range [0, " + MAX_GROUPS + ")");
        }
        if (periodSeconds < 0) {
            throw new InvalidAlarmException("Negative period: " + periodSeconds);
        }
    }

    // Lock is held. The alarm gets the next sequence, so it goes after every alarm with the same dueTime
    private void enqueue(@NonNull Alarm alarm) {
        alarm.setSequence(++sequence);
        ListIterator<Alarm> iterator = alarms.listIterator();
        while (iterator.hasNext()) {
            if (ORDER.compare(iterator.next(), alarm) > 0) {
                iterator.previous();
                break;
            }
        }
        iterator.add(alarm);
        if (awaitedDeadline == null || alarm.getDueTime().isBefore(awaitedDeadline)) {
            awaitedDeadline = alarm.getDueTime();
        }
    }

    // Lock is held
    private List<Alarm> extract(@NonNull Predicate<Alarm> filter) {
        List<Alarm> result = new ArrayList<>();
        for (Iterator<Alarm> iterator = alarms.iterator(); iterator.hasNext();) {
            Alarm alarm = iterator.next();
            if (filter.test(alarm)) {
                result.add(alarm);
                iterator.remove();
            }
        }
        return result;
    }

    // Lock is held. A waiting dispatcher has to re-evaluate its deadline against the new head
    private void headChanged() {
        if (awaitedDeadline != null) {
            awaitedDeadline = alarms.isEmpty() ? null : alarms.get(0).getDueTime();
        }
    }

    /**
     * Action executed with the registry lock held
     * @param <T> result type
     */
    @FunctionalInterface
    public interface GuardedAction<T> {
        T apply(@NonNull Guard guard);
    }

    /**
     * Holder of the registry lock. Waits release the lock and reacquire it before return.
     */
    public final class Guard implements AutoCloseable {

        private boolean closed = false;

        private Guard() {
            lock.lock();
        }

        /**
         * Wait for the registry changes until the predicate is satisfied
         * @param predicate wake-up condition, evaluated under the lock
         * @throws InterruptedException if the thread is interrupted
         */
        public void await(@NonNull BooleanSupplier predicate) throws InterruptedException {
            Objects.requireNonNull(predicate, "AlarmRegistry.Guard::await - predicate is null");
            while (!predicate.getAsBoolean()) {
                awaitChange();
            }
        }

        /**
         * Wait for the next broadcast (or spurious wake-up)
         * @throws InterruptedException if the thread is interrupted
         */
        public void awaitChange() throws InterruptedException {
            checkOpen();
            try {
                changed.await();
            } catch (IllegalMonitorStateException imsex) {
                throw new ConcurrencyFailureException("AlarmRegistry.Guard::awaitChange - condition wait failed", imsex);
            }
        }

        /**
         * Wait for the next broadcast, but not longer than until the deadline
         * @param deadline absolute end of the wait
         * @return false if the deadline has elapsed, true if woken before it
         * @throws InterruptedException if the thread is interrupted
         */
        public boolean awaitUntil(@NonNull Instant deadline) throws InterruptedException {
            Objects.requireNonNull(deadline, "AlarmRegistry.Guard::awaitUntil - deadline is null");
            checkOpen();
            long nanos = durationTo(deadline).toNanos();
            if (nanos <= 0) {
                return false;
            }
            try {
                return changed.awaitNanos(nanos) > 0;
            } catch (IllegalMonitorStateException imsex) {
                throw new ConcurrencyFailureException("AlarmRegistry.Guard::awaitUntil - condition timed wait failed", imsex);
            }
        }

        /**
         * Wake all the waiters of the registry condition
         */
        public void broadcast() {
            checkOpen();
            try {
                changed.signalAll();
            } catch (IllegalMonitorStateException imsex) {
                throw new ConcurrencyFailureException("AlarmRegistry.Guard::broadcast - condition signal failed", imsex);
            }
        }

        public @NonNull AlarmRegistry registry() {
            return AlarmRegistry.this;
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                lock.unlock();
            }
        }

        private void checkOpen() {
            if (closed || !lock.isHeldByCurrentThread()) {
                throw new ConcurrencyFailureException("AlarmRegistry.Guard - registry lock is not held by " + Thread.currentThread().getName());
            }
        }

        private Duration durationTo(Instant deadline) {
            Instant now = now();
            return deadline.isAfter(now) ? Duration.between(now, deadline) : Duration.ZERO;
        }

    }

}
