/*
 * Copyright © 2017-2023 Andrey D. Shindarev. All rights reserved.
 * This program is made available under the terms of the BSD 3-Clause License.
 * Contacts: ashindarev@gmail.com
 */
package com.github.sftwnd.crayfish.alarms.registry;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Shared collection of alarms ordered by ascending due time (ties in insertion order).
 * Every structural change wakes all the waiters of the registry condition.
 */
public interface IAlarmRegistry {

    /**
     * Number of the groups that can be served. Group id has to be in [0, MAX_GROUPS)
     */
    int MAX_GROUPS = 256;

    /**
     * Register new alarm which fires periodSeconds after now
     * @param id caller supplied alarm identifier
     * @param groupId alarm group
     * @param periodSeconds firing period in seconds
     * @param message alarm text
     * @return copy of the registered alarm
     * @throws InvalidAlarmException in the case of out of range group or negative period
     */
    @NonNull Alarm insert(int id, int groupId, int periodSeconds, @Nullable String message);

    /**
     * Register the prepared alarm with its own due time
     * @param alarm alarm description
     * @return copy of the registered alarm
     * @throws InvalidAlarmException in the case of out of range group or negative period
     */
    @NonNull Alarm insert(@NonNull Alarm alarm);

    /**
     * Remove and return the earliest alarm if it is due at the moment
     * @param now point in time at which the check is made
     * @return removed alarm or empty
     */
    @NonNull Optional<Alarm> popIfDue(@NonNull Instant now);

    /**
     * Due time of the earliest alarm
     * @return due time or empty if there are no alarms
     */
    @NonNull Optional<Instant> peek();

    /**
     * Ordered copy of the alarms of the group
     * @param groupId alarm group
     * @return alarms of the group in due time order
     */
    @NonNull List<Alarm> snapshotByGroup(int groupId);

    /**
     * Ordered copy of all registered alarms
     * @return alarms in due time order
     */
    @NonNull List<Alarm> snapshot();

    /**
     * Remove every alarm with the identifier
     * @param id alarm identifier
     * @return true if at least one alarm was removed
     */
    boolean remove(int id);

    /**
     * Move every alarm with the identifier to the new due time
     * @param id alarm identifier
     * @param dueTime new due time
     * @return true if at least one alarm was changed
     */
    boolean updateDueTime(int id, @NonNull Instant dueTime);

    /**
     * Put the alarm back with the due time one period after now
     * @param alarm alarm removed by {@link #popIfDue(Instant)}
     * @param now moment of firing
     * @return copy of the queued alarm
     */
    @NonNull Alarm requeue(@NonNull Alarm alarm, @NonNull Instant now);

    /**
     * Fire all due alarms of the group: each due alarm is rescheduled to now plus its period
     * @param groupId alarm group
     * @param now point in time at which the check is made
     * @return fired alarms as they were before rescheduling
     */
    @NonNull List<Alarm> fireDue(int groupId, @NonNull Instant now);

    /**
     * Groups holding at least one alarm
     * @return ascending set of group identifiers
     */
    @NonNull SortedSet<Integer> groupsPresent();

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Check that the group id can be registered
     * @param groupId alarm group
     * @return true if groupId is in [0, MAX_GROUPS)
     */
    static boolean isValidGroup(int groupId) {
        return groupId >= 0 && groupId < MAX_GROUPS;
    }

}
