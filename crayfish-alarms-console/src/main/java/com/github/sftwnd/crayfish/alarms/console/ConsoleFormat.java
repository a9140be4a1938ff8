package com.github.sftwnd.crayfish.alarms.console;

import com.github.sftwnd.crayfish.alarms.registry.Alarm;
import edu.umd.cs.findbugs.annotations.NonNull;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Console text of the timestamps and alarms
 */
final class ConsoleFormat {

    static final String TIME_PATTERN = "yyyy-MM-dd HH:mm:ss";

    private final DateTimeFormatter formatter;

    ConsoleFormat(@NonNull ZoneId zone) {
        this.formatter = DateTimeFormatter.ofPattern(TIME_PATTERN).withZone(Objects.requireNonNull(zone, "ConsoleFormat::new - zone is null"));
    }

    @NonNull String time(@NonNull Instant instant) {
        return formatter.format(instant);
    }

    // Group(g) period message
    @NonNull String alarm(@NonNull Alarm alarm) {
        return String.format("Group(%d) %d %s", alarm.getGroupId(), alarm.getPeriodSeconds(), alarm.getMessage().getText());
    }

}
