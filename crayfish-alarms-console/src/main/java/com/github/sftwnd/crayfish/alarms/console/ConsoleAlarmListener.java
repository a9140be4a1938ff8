package com.github.sftwnd.crayfish.alarms.console;

import com.github.sftwnd.crayfish.alarms.group.IAlarmListener;
import com.github.sftwnd.crayfish.alarms.group.WorkerHandle;
import com.github.sftwnd.crayfish.alarms.registry.Alarm;
import edu.umd.cs.findbugs.annotations.NonNull;

import java.io.PrintStream;
import java.time.Clock;
import java.util.Objects;

/**
 * Prints the service events to the console
 */
public class ConsoleAlarmListener implements IAlarmListener {

    private final PrintStream out;
    private final Clock clock;
    private final ConsoleFormat format;

    public ConsoleAlarmListener(@NonNull PrintStream out, @NonNull Clock clock) {
        this.out = Objects.requireNonNull(out, "ConsoleAlarmListener::new - out is null");
        this.clock = Objects.requireNonNull(clock, "ConsoleAlarmListener::new - clock is null");
        this.format = new ConsoleFormat(clock.getZone());
    }

    @Override
    public void alarmDisplayed(@NonNull WorkerHandle worker, @NonNull Alarm alarm) {
        out.printf("Alarm(%d) Printed by Display Alarm Thread %d at %s: %s%n",
                alarm.getId(), worker.getWorkerId(), now(), format.alarm(alarm));
    }

    @Override
    public void alarmExpired(@NonNull Alarm alarm) {
        out.printf("Alarm(%d) Expired at %s: %s%n", alarm.getId(), now(), format.alarm(alarm));
    }

    @Override
    public void workerCreated(@NonNull WorkerHandle worker, @NonNull Alarm alarm) {
        out.printf("Alarm Group Display Creation Thread Created New Display Alarm Thread %d For Alarm(%d) at %s: %s%n",
                worker.getWorkerId(), alarm.getId(), format.time(worker.getStartedAt()), format.alarm(alarm));
    }

    @Override
    public void workerRemoved(@NonNull WorkerHandle worker) {
        out.printf("No More Alarms in Group(%d): Alarm Removal Thread Has Removed Display Alarm Thread %d at %s%n",
                worker.getGroupId(), worker.getWorkerId(), now());
    }

    @Override
    public void workerSpawnFailed(int groupId, @NonNull Throwable cause) {
        out.printf("Error: Unable to create Display Alarm Thread for Group(%d): %s%n", groupId, cause.getMessage());
    }

    private String now() {
        return format.time(clock.instant());
    }

}
