package com.github.sftwnd.crayfish.alarms.group;

import com.github.sftwnd.crayfish.alarms.registry.Alarm;
import com.github.sftwnd.crayfish.alarms.registry.IAlarmRegistry;
import com.github.sftwnd.crayfish.alarms.registry.WorkerStatus;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Multi-group periodic alarm service: registered alarms are surfaced by one display worker per group
 */
public interface IAlarmGroupService extends AutoCloseable {

    /**
     * Start the supervisor loops (and the dispatcher if it is enabled)
     * @throws IllegalStateException if the service is already started or closed
     */
    void start();

    /**
     * Register new periodic alarm
     * @param id alarm identifier
     * @param groupId alarm group in [0, {@link IAlarmRegistry#MAX_GROUPS})
     * @param periodSeconds firing period
     * @param message alarm text
     * @return registered alarm
     * @throws com.github.sftwnd.crayfish.alarms.registry.InvalidAlarmException if the alarm is rejected
     */
    @NonNull Alarm registerAlarm(int id, int groupId, int periodSeconds, @Nullable String message);

    /**
     * Active groups with their alarms
     * @return views in group order
     */
    @NonNull List<GroupView> viewAlarms();

    /**
     * Running display workers
     * @return group to worker map
     */
    @NonNull Map<Integer, WorkerHandle> activeWorkers();

    /**
     * Worker state of the group
     * @param groupId alarm group
     * @return status in the worker table
     */
    @NonNull WorkerStatus workerStatus(int groupId);

    /**
     * The alarm registry of the service
     * @return registry
     */
    @NonNull IAlarmRegistry registry();

    /**
     * Stop all the service threads
     */
    @Override
    void close();

}
