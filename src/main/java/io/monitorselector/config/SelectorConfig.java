package io.monitorselector.config;

import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;

import static io.monitorselector.config.Constants.*;

/**
 * Selector tunables.
 * Loads selector.yml (or the file named by SELECTOR_CONFIG_FILE) with fallbacks to constants.
 */
@Slf4j
@Getter
public class SelectorConfig {

    private final SelectionSettings selectionSettings;
    private final Duration changedReviewInterval;
    private final Duration unchangedReviewInterval;
    private final int reviewBatchSize;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final Duration recheckPausedInterval;
    private final Duration telemetryWindow;

    // Default classpath location
    static final String DEFAULT_CONFIG_FILE_CLASSPATH = "selector.yml";
    // Environment variable to check for external config file path
    static final String EXTERNAL_CONFIG_ENV_VAR = "SELECTOR_CONFIG_FILE";

    public SelectorConfig() {
        this(System.getenv(EXTERNAL_CONFIG_ENV_VAR), DEFAULT_CONFIG_FILE_CLASSPATH);
    }

    SelectorConfig(String externalConfigPath, String classpathResource) {
        this(loadYamlConfig(externalConfigPath, classpathResource));
    }

    SelectorConfig(ConfigModel config) {
        this.selectionSettings = parseSelectionSettings(config.getSelection());
        this.changedReviewInterval = Duration.ofMinutes(positiveOrDefault(
                config.getReview() == null ? null : config.getReview().getChangedIntervalMinutes(),
                DEFAULT_CHANGED_REVIEW_MINUTES, "review.changedIntervalMinutes"));
        this.unchangedReviewInterval = Duration.ofMinutes(positiveOrDefault(
                config.getReview() == null ? null : config.getReview().getUnchangedIntervalMinutes(),
                DEFAULT_UNCHANGED_REVIEW_MINUTES, "review.unchangedIntervalMinutes"));
        this.reviewBatchSize = (int) positiveOrDefault(
                config.getReview() == null ? null : config.getReview().getBatchSize(),
                DEFAULT_REVIEW_BATCH_SIZE, "review.batchSize");
        this.initialBackoff = Duration.ofSeconds(positiveOrDefault(
                config.getDriver() == null ? null : config.getDriver().getInitialBackoffSeconds(),
                DEFAULT_INITIAL_BACKOFF_SECONDS, "driver.initialBackoffSeconds"));
        Duration parsedMaxBackoff = Duration.ofSeconds(positiveOrDefault(
                config.getDriver() == null ? null : config.getDriver().getMaxBackoffSeconds(),
                DEFAULT_MAX_BACKOFF_SECONDS, "driver.maxBackoffSeconds"));
        if (parsedMaxBackoff.compareTo(initialBackoff) < 0) {
            log.warn("driver.maxBackoffSeconds ({}) is below driver.initialBackoffSeconds ({}), using the initial value",
                    parsedMaxBackoff.getSeconds(), initialBackoff.getSeconds());
            parsedMaxBackoff = initialBackoff;
        }
        this.maxBackoff = parsedMaxBackoff;
        this.recheckPausedInterval = Duration.ofMinutes(positiveOrDefault(
                config.getConstraints() == null ? null : config.getConstraints().getRecheckPausedMinutes(),
                DEFAULT_RECHECK_PAUSED_MINUTES, "constraints.recheckPausedMinutes"));
        this.telemetryWindow = Duration.ofHours(positiveOrDefault(
                config.getTelemetry() == null ? null : config.getTelemetry().getWindowHours(),
                DEFAULT_TELEMETRY_WINDOW_HOURS, "telemetry.windowHours"));

        log.info("Loaded selector config - {}, review intervals: {}m changed / {}m unchanged, backoff: {}s..{}s",
                selectionSettings, changedReviewInterval.toMinutes(), unchangedReviewInterval.toMinutes(),
                initialBackoff.getSeconds(), maxBackoff.getSeconds());
    }

    static ConfigModel loadYamlConfig(String externalConfigPath, String classpathResource) {
        Yaml yaml = new Yaml(new Constructor(ConfigModel.class, new LoaderOptions()));
        InputStream inputStream = null;
        String loadedFrom = "";

        // 1. External config file
        if (externalConfigPath != null && !externalConfigPath.trim().isEmpty()) {
            log.info("External config file path specified via {}: {}", EXTERNAL_CONFIG_ENV_VAR, externalConfigPath);
            try {
                if (Files.exists(Paths.get(externalConfigPath))) {
                    inputStream = new FileInputStream(externalConfigPath);
                    loadedFrom = "external file (" + externalConfigPath + ")";
                } else {
                    log.warn("External config file specified but not found at path: {}. Falling back.", externalConfigPath);
                }
            } catch (IOException e) {
                log.warn("Error opening external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
            } catch (SecurityException se) {
                log.warn("Permission denied accessing external config file {}: {}. Falling back.", externalConfigPath, se.getMessage());
            }
        } else {
            log.debug("{} environment variable not set, looking for config on classpath.", EXTERNAL_CONFIG_ENV_VAR);
        }

        // 2. Classpath
        if (inputStream == null) {
            log.info("Loading config from classpath: {}", classpathResource);
            inputStream = SelectorConfig.class.getClassLoader().getResourceAsStream(classpathResource);
            loadedFrom = "classpath (" + classpathResource + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", classpathResource);
                return new ConfigModel();
            }
        }

        // 3. Parse
        try {
            ConfigModel config = yaml.load(inputStream);
            log.info("Successfully loaded configuration from {}", loadedFrom);
            return config != null ? config : new ConfigModel();
        } catch (Exception e) {
            log.warn("Failed to parse configuration from {}: {}. Using defaults.", loadedFrom, e.getMessage());
            return new ConfigModel();
        } finally {
            try {
                inputStream.close();
            } catch (IOException e) {
                log.error("Error closing config file input stream: {}", e.getMessage());
            }
        }
    }

    private SelectionSettings parseSelectionSettings(Selection selection) {
        if (selection == null) {
            return SelectionSettings.defaults();
        }
        SelectionSettings.SelectionSettingsBuilder builder = SelectionSettings.builder()
                .targetActive((int) positiveOrDefault(selection.getTargetActive(), DEFAULT_TARGET_ACTIVE, "selection.targetActive"))
                .baseTesting((int) positiveOrDefault(selection.getBaseTesting(), DEFAULT_BASE_TESTING, "selection.baseTesting"))
                .minCountForTesting((int) nonNegativeOrDefault(selection.getMinCountForTesting(), DEFAULT_MIN_COUNT_FOR_TESTING, "selection.minCountForTesting"))
                .minCountForActive((int) nonNegativeOrDefault(selection.getMinCountForActive(), DEFAULT_MIN_COUNT_FOR_ACTIVE, "selection.minCountForActive"))
                .replacementMinPercent(nonNegativeOrDefault(selection.getReplacementMinPercent(), DEFAULT_REPLACEMENT_MIN_PERCENT, "selection.replacementMinPercent"))
                .replacementMinPoints(nonNegativeOrDefault(selection.getReplacementMinPoints(), DEFAULT_REPLACEMENT_MIN_POINTS, "selection.replacementMinPoints"));
        if (selection.getActiveSwapEnabled() != null) {
            builder.activeSwapEnabled(selection.getActiveSwapEnabled());
        }
        return builder.build();
    }

    private static long positiveOrDefault(Number value, long defaultValue, String key) {
        if (value == null) {
            return defaultValue;
        }
        if (value.longValue() <= 0) {
            log.warn("Invalid value {} for {}, using default {}", value, key, defaultValue);
            return defaultValue;
        }
        return value.longValue();
    }

    private static long nonNegativeOrDefault(Integer value, long defaultValue, String key) {
        if (value == null) {
            return defaultValue;
        }
        if (value < 0) {
            log.warn("Invalid value {} for {}, using default {}", value, key, defaultValue);
            return defaultValue;
        }
        return value;
    }

    private static double nonNegativeOrDefault(Double value, double defaultValue, String key) {
        if (value == null) {
            return defaultValue;
        }
        if (value < 0 || value.isNaN()) {
            log.warn("Invalid value {} for {}, using default {}", value, key, defaultValue);
            return defaultValue;
        }
        return value;
    }

    // YAML model classes

    @Data
    public static class ConfigModel {
        private Selection selection;
        private Review review;
        private Driver driver;
        private Constraints constraints;
        private Telemetry telemetry;
    }

    @Data
    public static class Selection {
        private Integer targetActive;
        private Integer baseTesting;
        private Integer minCountForTesting;
        private Integer minCountForActive;
        private Double replacementMinPercent;
        private Double replacementMinPoints;
        private Boolean activeSwapEnabled;
    }

    @Data
    public static class Review {
        private Long changedIntervalMinutes;
        private Long unchangedIntervalMinutes;
        private Integer batchSize;
    }

    @Data
    public static class Driver {
        private Long initialBackoffSeconds;
        private Long maxBackoffSeconds;
    }

    @Data
    public static class Constraints {
        private Long recheckPausedMinutes;
    }

    @Data
    public static class Telemetry {
        private Long windowHours;
    }
}
