package com.github.sftwnd.crayfish.alarms.console;

import com.github.sftwnd.crayfish.alarms.group.AlarmGroupService;
import com.github.sftwnd.crayfish.alarms.group.AlarmGroupServiceConfig;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.bridge.SLF4JBridgeHandler;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;

@Slf4j
public class AlarmConsoleApplication {

    static final String PROMPT_PATH = "crayfish.alarms.console.prompt";

    public static void main(String[] args) throws IOException {
        SLF4JBridgeHandler.removeHandlersForRootLogger();
        SLF4JBridgeHandler.install();
        Config config = ConfigFactory.load();
        AlarmGroupServiceConfig serviceConfig = AlarmGroupServiceConfig.fromConfig(config);
        PrintStream out = System.out;
        Clock clock = Clock.systemDefaultZone();
        AlarmGroupService service = new AlarmGroupService(
                null,
                serviceConfig,
                new ConsoleAlarmListener(out, clock),
                null,
                AlarmConsoleApplication::halt);
        Runtime.getRuntime().addShutdownHook(new Thread(service::close, "alarm-service-shutdown"));
        try (service) {
            service.start();
            AlarmConsole console = new AlarmConsole(service, out, clock, config.getString(PROMPT_PATH));
            int processed = console.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
            logger.info("Console input is closed, {} requests processed", processed);
        }
        logger.info("Terminated...");
    }

    private static void halt(Throwable throwable) {
        logger.error("Alarm service has failed, process is halted", throwable);
        System.out.flush();
        Runtime.getRuntime().halt(AlarmGroupService.FATAL_EXIT_CODE);
    }

}
