package com.github.sftwnd.crayfish.alarms.console;

import com.github.sftwnd.crayfish.alarms.group.GroupView;
import com.github.sftwnd.crayfish.alarms.group.IAlarmGroupService;
import com.github.sftwnd.crayfish.alarms.registry.Alarm;
import com.github.sftwnd.crayfish.alarms.registry.InvalidAlarmException;
import edu.umd.cs.findbugs.annotations.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Line-oriented front end of the alarm group service. Reads the requests until the end of the input.
 */
@Slf4j
public class AlarmConsole {

    public static final String DEFAULT_PROMPT = "Alarm> ";
    static final String INVALID_REQUEST = "Error: Invalid request format. Request discarded.";

    private final IAlarmGroupService service;
    private final PrintStream out;
    private final Clock clock;
    private final String prompt;
    private final ConsoleFormat format;
    private final AlarmRequestParser parser = new AlarmRequestParser();

    public AlarmConsole(@NonNull IAlarmGroupService service, @NonNull PrintStream out, @NonNull Clock clock, @NonNull String prompt) {
        this.service = Objects.requireNonNull(service, "AlarmConsole::new - service is null");
        this.out = Objects.requireNonNull(out, "AlarmConsole::new - out is null");
        this.clock = Objects.requireNonNull(clock, "AlarmConsole::new - clock is null");
        this.prompt = Objects.requireNonNull(prompt, "AlarmConsole::new - prompt is null");
        this.format = new ConsoleFormat(clock.getZone());
    }

    public AlarmConsole(@NonNull IAlarmGroupService service, @NonNull PrintStream out) {
        this(service, out, Clock.systemDefaultZone(), DEFAULT_PROMPT);
    }

    /**
     * Process the requests of the input
     * @param in console input
     * @return number of the processed requests, invalid ones included
     * @throws IOException on input failure
     */
    public int run(@NonNull BufferedReader in) throws IOException {
        Objects.requireNonNull(in, "AlarmConsole::run - in is null");
        int processed = 0;
        for (;;) {
            out.print(prompt);
            out.flush();
            String line = in.readLine();
            if (line == null) {
                logger.debug("End of the console input");
                return processed;
            }
            if (!line.isBlank()) {
                process(line);
                processed++;
            }
        }
    }

    /**
     * Process single request line
     * @param line request text
     * @return true if the request is accepted
     */
    public boolean process(@NonNull String line) {
        return parser.parse(line)
                .map(this::dispatch)
                .orElseGet(() -> {
                    logger.debug("Invalid request: {}", line);
                    out.println(INVALID_REQUEST);
                    return false;
                });
    }

    private boolean dispatch(@NonNull AlarmRequest request) {
        switch (request.getKind()) {
            case START_ALARM:
                return startAlarm(request);
            case CHANGE_ALARM:
                printRequest("Change Alarm Request", request);
                return true;
            case CANCEL_ALARM:
                printId("Cancel Alarm Request", request);
                return true;
            case SUSPEND_ALARM:
                printId("Suspend Alarm Request", request);
                return true;
            case REACTIVATE_ALARM:
                printId("Reactivate Alarm Request", request);
                return true;
            case VIEW_ALARMS:
                viewAlarms();
                return true;
            default:
                throw new IllegalStateException("AlarmConsole::dispatch - unknown request kind: " + request.getKind());
        }
    }

    private boolean startAlarm(AlarmRequest request) {
        printRequest("Start Alarm Request", request);
        try {
            Alarm alarm = service.registerAlarm(request.getAlarmId(), request.getGroupId(), request.getSeconds(), request.getMessage());
            out.printf("Alarm(%d) Inserted by Main Thread Into Alarm List at %s: %s%n",
                    alarm.getId(), format.time(alarm.getCreatedAt()), format.alarm(alarm));
            return true;
        } catch (InvalidAlarmException iaex) {
            logger.warn("Alarm({}) is rejected: {}", request.getAlarmId(), iaex.getMessage());
            out.println(INVALID_REQUEST);
            return false;
        }
    }

    private void viewAlarms() {
        List<GroupView> views = service.viewAlarms();
        out.printf("View Alarms at %s:%n", format.time(clock.instant()));
        int thread = 0;
        for (GroupView view : views) {
            out.printf("%d. Display Thread %d Assigned:%n", ++thread, view.getWorkerId());
            if (view.getAlarms().isEmpty()) {
                out.println(" No alarms assigned to this thread.");
                continue;
            }
            int number = 0;
            for (Alarm alarm : view.getAlarms()) {
                Instant assignedAt = alarm.getCreatedAt().isAfter(view.getAssignedAt()) ? alarm.getCreatedAt() : view.getAssignedAt();
                out.printf(" %da. Alarm(%d): Created at %s Assigned at %s %s Status: Active%n",
                        ++number, alarm.getId(), format.time(alarm.getCreatedAt()), format.time(assignedAt), format.alarm(alarm));
            }
        }
    }

    private void printRequest(String title, AlarmRequest request) {
        out.printf("%s:%n  Alarm ID: %d%n  Group ID: %d%n  Time: %d seconds%n  Message: %s%n",
                title, request.getAlarmId(), request.getGroupId(), request.getSeconds(), request.getMessage());
    }

    private void printId(String title, AlarmRequest request) {
        out.printf("%s:%n  Alarm ID: %d%n", title, request.getAlarmId());
    }

}
