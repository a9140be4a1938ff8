/*
 * Copyright © 2017-2023 Andrey D. Shindarev. All rights reserved.
 * This program is made available under the terms of the BSD 3-Clause License.
 * Contacts: ashindarev@gmail.com
 */
package com.github.sftwnd.crayfish.alarms.registry;

import edu.umd.cs.findbugs.annotations.NonNull;
import lombok.AllArgsConstructor;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Worker state per group: INACTIVE, ACTIVE(handle) or STOP_REQUESTED(handle).
 * <p>
 * The table lives in the lock domain of its registry: every call has to be made with the registry lock held,
 * otherwise {@link ConcurrencyFailureException} is thrown. Absent groups are INACTIVE.
 * </p>
 * @param <H> worker handle type
 */
public final class GroupWorkerTable<H> {

    private final AlarmRegistry registry;
    private final int capacity;
    private final TreeMap<Integer, Slot<H>> slots = new TreeMap<>();

    public GroupWorkerTable(@NonNull AlarmRegistry registry) {
        this(registry, IAlarmRegistry.MAX_GROUPS);
    }

    GroupWorkerTable(@NonNull AlarmRegistry registry, int capacity) {
        this.registry = Objects.requireNonNull(registry, "GroupWorkerTable::new - registry is null");
        this.capacity = capacity;
    }

    public int capacity() {
        return capacity;
    }

    public @NonNull WorkerStatus status(int groupId) {
        check(groupId, "status");
        return Optional.ofNullable(slots.get(groupId)).map(slot -> slot.status).orElse(WorkerStatus.INACTIVE);
    }

    public @NonNull Optional<H> handle(int groupId) {
        check(groupId, "handle");
        return Optional.ofNullable(slots.get(groupId)).map(slot -> slot.handle);
    }

    /**
     * Register the running worker of the group. The group has to be INACTIVE or ACTIVE with a worker to be replaced.
     * @param groupId group of the worker
     * @param handle worker handle
     */
    public void activate(int groupId, @NonNull H handle) {
        check(groupId, "activate");
        Objects.requireNonNull(handle, "GroupWorkerTable::activate - handle is null");
        if (status(groupId) == WorkerStatus.STOP_REQUESTED) {
            throw new IllegalStateException("GroupWorkerTable::activate - Group(" + groupId + ") worker is stopping");
        }
        slots.put(groupId, new Slot<>(WorkerStatus.ACTIVE, handle));
    }

    /**
     * Move ACTIVE group to STOP_REQUESTED
     * @param groupId group of the worker
     * @return handle of the worker to be stopped
     */
    public @NonNull H requestStop(int groupId) {
        check(groupId, "requestStop");
        Slot<H> slot = slots.get(groupId);
        if (slot == null || slot.status != WorkerStatus.ACTIVE) {
            throw new IllegalStateException("GroupWorkerTable::requestStop - Group(" + groupId + ") is not active");
        }
        slots.put(groupId, new Slot<>(WorkerStatus.STOP_REQUESTED, slot.handle));
        return slot.handle;
    }

    /**
     * Move the group to INACTIVE
     * @param groupId group of the worker
     * @return handle of the released worker if it was present
     */
    public @NonNull Optional<H> deactivate(int groupId) {
        check(groupId, "deactivate");
        return Optional.ofNullable(slots.remove(groupId)).map(slot -> slot.handle);
    }

    /**
     * Handles of the workers in the status
     * @param status ACTIVE or STOP_REQUESTED
     * @return ordered group to handle map
     */
    public @NonNull SortedMap<Integer, H> handles(@NonNull WorkerStatus status) {
        registry.requireLock("GroupWorkerTable::handles");
        SortedMap<Integer, H> result = new TreeMap<>();
        for (Map.Entry<Integer, Slot<H>> entry : slots.entrySet()) {
            if (entry.getValue().status == status) {
                result.put(entry.getKey(), entry.getValue().handle);
            }
        }
        return Collections.unmodifiableSortedMap(result);
    }

    private void check(int groupId, String operation) {
        registry.requireLock("GroupWorkerTable::" + operation);
        if (groupId < 0 || groupId >= capacity) {
            throw new IllegalArgumentException("GroupWorkerTable::" + operation + " - Group(" + groupId + ") is out of range [0, " + capacity + ")");
        }
    }

    @AllArgsConstructor
    private static final class Slot<H> {
        private final WorkerStatus status;
        private final H handle;
    }

}
