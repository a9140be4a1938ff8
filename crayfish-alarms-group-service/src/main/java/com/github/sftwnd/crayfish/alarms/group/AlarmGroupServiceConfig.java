package com.github.sftwnd.crayfish.alarms.group;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import edu.umd.cs.findbugs.annotations.NonNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Settings of {@link AlarmGroupService}. Loaded from the {@value #CONFIG_PATH} section of Typesafe Config,
 * defaults are in reference.conf
 */
@NoArgsConstructor
@AllArgsConstructor
public final class AlarmGroupServiceConfig {

    public static final String CONFIG_PATH = "crayfish.alarms.groups";
    public static final Duration DEFAULT_DISPLAY_INTERVAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(3);

    // Polling interval of the display workers
    @Getter @Setter private Duration displayInterval = DEFAULT_DISPLAY_INTERVAL;
    // Start the earliest-deadline dispatcher together with the supervisor loops (off by default)
    @Getter @Setter private boolean dispatcherEnabled = false;
    // Wait for every service thread on close
    @Getter @Setter private Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;

    /**
     * Read the settings from the section {@value #CONFIG_PATH}
     * @param config root configuration
     * @return service settings
     */
    public static @NonNull AlarmGroupServiceConfig fromConfig(@NonNull Config config) {
        Objects.requireNonNull(config, "AlarmGroupServiceConfig::fromConfig - config is null");
        Config section = config.withFallback(ConfigFactory.defaultReference()).getConfig(CONFIG_PATH);
        return new AlarmGroupServiceConfig(
                positive(section.getDuration("display-interval")).orElse(DEFAULT_DISPLAY_INTERVAL),
                section.getBoolean("dispatcher.enabled"),
                positive(section.getDuration("shutdown-timeout")).orElse(DEFAULT_SHUTDOWN_TIMEOUT)
        );
    }

    /**
     * Settings from application.conf / reference.conf of the classpath
     * @return service settings
     */
    public static @NonNull AlarmGroupServiceConfig load() {
        return fromConfig(ConfigFactory.load());
    }

    private static Optional<Duration> positive(Duration duration) {
        return Optional.ofNullable(duration).filter(Predicate.not(Duration::isNegative)).filter(Predicate.not(Duration::isZero));
    }

}
