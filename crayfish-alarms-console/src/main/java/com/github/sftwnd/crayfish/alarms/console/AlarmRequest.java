package com.github.sftwnd.crayfish.alarms.console;

import edu.umd.cs.findbugs.annotations.NonNull;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * Validated console request. The set of request kinds is closed: consumers dispatch on {@link #getKind()}.
 * Numeric fields not used by the kind are -1, the message is empty.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class AlarmRequest {

    public enum Kind {
        START_ALARM, CHANGE_ALARM, CANCEL_ALARM, SUSPEND_ALARM, REACTIVATE_ALARM, VIEW_ALARMS
    }

    private static final int NONE = -1;

    private final @NonNull Kind kind;
    private final int alarmId;
    private final int groupId;
    private final int seconds;
    private final @NonNull String message;

    public static @NonNull AlarmRequest startAlarm(int alarmId, int groupId, int seconds, @NonNull String message) {
        return new AlarmRequest(Kind.START_ALARM, alarmId, groupId, seconds, Objects.requireNonNull(message, "AlarmRequest::startAlarm - message is null"));
    }

    public static @NonNull AlarmRequest changeAlarm(int alarmId, int groupId, int seconds, @NonNull String message) {
        return new AlarmRequest(Kind.CHANGE_ALARM, alarmId, groupId, seconds, Objects.requireNonNull(message, "AlarmRequest::changeAlarm - message is null"));
    }

    public static @NonNull AlarmRequest cancelAlarm(int alarmId) {
        return new AlarmRequest(Kind.CANCEL_ALARM, alarmId, NONE, NONE, "");
    }

    public static @NonNull AlarmRequest suspendAlarm(int alarmId) {
        return new AlarmRequest(Kind.SUSPEND_ALARM, alarmId, NONE, NONE, "");
    }

    public static @NonNull AlarmRequest reactivateAlarm(int alarmId) {
        return new AlarmRequest(Kind.REACTIVATE_ALARM, alarmId, NONE, NONE, "");
    }

    public static @NonNull AlarmRequest viewAlarms() {
        return new AlarmRequest(Kind.VIEW_ALARMS, NONE, NONE, NONE, "");
    }

}
