/*
 * Copyright © 2017-2023 Andrey D. Shindarev. All rights reserved.
 * This program is made available under the terms of the BSD 3-Clause License.
 * Contacts: ashindarev@gmail.com
 */
package com.github.sftwnd.crayfish.alarms.registry;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Registered, possibly repeating alarm.
 * <p>
 * While queued the instance belongs to the registry and only {@code dueTime} changes, under the registry lock.
 * Everything the registry hands out is a copy.
 * </p>
 */
@ToString
public final class Alarm {

    @Getter private final int id;
    @Getter private final int groupId;
    @Getter private final int periodSeconds;
    @Getter private final AlarmMessage message;
    @Getter private final Instant createdAt;
    // guarded by the registry lock
    private Instant dueTime;
    // insertion order, breaks dueTime ties
    @ToString.Exclude
    private long sequence;

    /**
     * Construct alarm description
     * @param id caller supplied identifier
     * @param groupId group of the alarm, has to be in [0, MAX_GROUPS)
     * @param periodSeconds interval between firings, has to be non negative
     * @param dueTime the moment of the next firing
     * @param message alarm text, silently truncated to {@link AlarmMessage#MAX_BYTES} bytes
     * @param createdAt registration moment (dueTime minus period if null)
     */
    @Builder
    private Alarm(int id, int groupId, int periodSeconds, @NonNull Instant dueTime, @Nullable String message, @Nullable Instant createdAt) {
        this.id = id;
        this.groupId = groupId;
        this.periodSeconds = periodSeconds;
        this.dueTime = Objects.requireNonNull(dueTime, "Alarm::new - dueTime is null");
        this.message = AlarmMessage.of(message);
        this.createdAt = Optional.ofNullable(createdAt).orElseGet(() -> dueTime.minusSeconds(Math.max(0, periodSeconds)));
    }

    private Alarm(@NonNull Alarm alarm) {
        this.id = alarm.id;
        this.groupId = alarm.groupId;
        this.periodSeconds = alarm.periodSeconds;
        this.dueTime = alarm.dueTime;
        this.message = alarm.message;
        this.createdAt = alarm.createdAt;
        this.sequence = alarm.sequence;
    }

    public @NonNull Instant getDueTime() {
        return dueTime;
    }

    public @NonNull Duration getPeriod() {
        return Duration.ofSeconds(periodSeconds);
    }

    /**
     * The alarm has to fire at the moment
     * @param now point in time at which the check is made
     * @return true if dueTime is not after now
     */
    public boolean isDue(@NonNull Instant now) {
        return !dueTime.isAfter(now);
    }

    Alarm copy() {
        return new Alarm(this);
    }

    void setDueTime(@NonNull Instant dueTime) {
        this.dueTime = dueTime;
    }

    long getSequence() {
        return sequence;
    }

    void setSequence(long sequence) {
        this.sequence = sequence;
    }

}
