package com.github.sftwnd.crayfish.alarms.console;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

import java.util.Optional;
import java.util.function.IntFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser of the console commands:
 * <pre>
 *     Start_Alarm(id): Group(group) seconds message
 *     Change_Alarm(id): Group(group) seconds message
 *     Cancel_Alarm(id)
 *     Suspend_Alarm(id)
 *     Reactivate_Alarm(id)
 *     View_Alarms
 * </pre>
 * Commands are matched from the beginning of the line. Negative or too large numbers make the request invalid.
 */
public class AlarmRequestParser {

    private static final String NUMBER = "\\s*([-+]?\\d+)\\s*";
    private static final Pattern START_ALARM = alarmPattern("Start_Alarm");
    private static final Pattern CHANGE_ALARM = alarmPattern("Change_Alarm");
    private static final Pattern CANCEL_ALARM = idPattern("Cancel_Alarm");
    private static final Pattern SUSPEND_ALARM = idPattern("Suspend_Alarm");
    private static final Pattern REACTIVATE_ALARM = idPattern("Reactivate_Alarm");
    private static final String VIEW_ALARMS = "View_Alarms";

    /**
     * Parse the console line
     * @param line input line without the line terminator
     * @return request or empty if the line is not a valid request
     */
    public @NonNull Optional<AlarmRequest> parse(@Nullable String line) {
        if (line == null) {
            return Optional.empty();
        }
        String request = line.strip();
        if (VIEW_ALARMS.equals(request)) {
            return Optional.of(AlarmRequest.viewAlarms());
        }
        Matcher matcher;
        if ((matcher = START_ALARM.matcher(request)).lookingAt()) {
            return alarm(matcher, true);
        } else if ((matcher = CHANGE_ALARM.matcher(request)).lookingAt()) {
            return alarm(matcher, false);
        } else if ((matcher = CANCEL_ALARM.matcher(request)).lookingAt()) {
            return id(matcher, AlarmRequest::cancelAlarm);
        } else if ((matcher = SUSPEND_ALARM.matcher(request)).lookingAt()) {
            return id(matcher, AlarmRequest::suspendAlarm);
        } else if ((matcher = REACTIVATE_ALARM.matcher(request)).lookingAt()) {
            return id(matcher, AlarmRequest::reactivateAlarm);
        }
        return Optional.empty();
    }

    private static Optional<AlarmRequest> alarm(Matcher matcher, boolean start) {
        Integer alarmId = nonNegative(matcher.group(1));
        Integer groupId = nonNegative(matcher.group(2));
        Integer seconds = nonNegative(matcher.group(3));
        if (alarmId == null || groupId == null || seconds == null) {
            return Optional.empty();
        }
        String message = matcher.group(4).strip();
        return Optional.of(start
                ? AlarmRequest.startAlarm(alarmId, groupId, seconds, message)
                : AlarmRequest.changeAlarm(alarmId, groupId, seconds, message));
    }

    private static Optional<AlarmRequest> id(Matcher matcher, IntFunction<AlarmRequest> factory) {
        return Optional.ofNullable(nonNegative(matcher.group(1))).map(factory::apply);
    }

    private static @Nullable Integer nonNegative(String text) {
        try {
            int value = Integer.parseInt(text);
            return value < 0 ? null : value;
        } catch (NumberFormatException nfex) {
            // overflow
            return null;
        }
    }

    private static Pattern alarmPattern(String command) {
        return Pattern.compile(command + "\\(" + NUMBER + "\\):\\s*Group\\(" + NUMBER + "\\)\\s*([-+]?\\d+)\\s+(\\S.*)");
    }

    private static Pattern idPattern(String command) {
        return Pattern.compile(command + "\\(" + NUMBER + "\\)");
    }

}
