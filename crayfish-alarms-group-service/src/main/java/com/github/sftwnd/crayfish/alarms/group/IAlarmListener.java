package com.github.sftwnd.crayfish.alarms.group;

import com.github.sftwnd.crayfish.alarms.registry.Alarm;
import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Receiver of the alarm service events. Calls come from the service threads, some of them with the registry lock
 * held, so implementations have to return quickly and must not wait for other service activity.
 */
public interface IAlarmListener {

    /**
     * The display worker has found a due alarm of its group
     * @param worker display worker
     * @param alarm alarm as it was before rescheduling
     */
    default void alarmDisplayed(@NonNull WorkerHandle worker, @NonNull Alarm alarm) {}

    /**
     * The dispatcher has fired the earliest alarm
     * @param alarm fired alarm
     */
    default void alarmExpired(@NonNull Alarm alarm) {}

    /**
     * New display worker is started for the group
     * @param worker display worker
     * @param alarm earliest alarm of the group at the moment of creation
     */
    default void workerCreated(@NonNull WorkerHandle worker, @NonNull Alarm alarm) {}

    /**
     * There are no more alarms in the group and its worker is asked to stop
     * @param worker display worker
     */
    default void workerStopRequested(@NonNull WorkerHandle worker) {}

    /**
     * The stopped worker is released and the group is inactive
     * @param worker display worker
     */
    default void workerRemoved(@NonNull WorkerHandle worker) {}

    /**
     * Unable to start the worker. The group stays inactive until the next registry change
     * @param groupId group of the worker
     * @param cause failure cause
     */
    default void workerSpawnFailed(int groupId, @NonNull Throwable cause) {}

}
