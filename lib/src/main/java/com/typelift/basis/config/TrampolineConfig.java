package com.typelift.basis.config;

import java.util.Properties;

/**
 * Configuration for running a {@link com.typelift.basis.functional.Trampoline}.
 *
 * <p>Settings here only affect diagnostics; they never change what a computation evaluates to.
 */
public class TrampolineConfig {
    // Default values for trampoline configuration
    public static final String DEFAULT_NAME = "trampoline";
    public static final long DEFAULT_PROGRESS_LOG_INTERVAL = 0;

    public static final String NAME_PROPERTY = "basis.trampoline.name";
    public static final String PROGRESS_LOG_INTERVAL_PROPERTY = "basis.trampoline.progressLogInterval";

    private String name;
    private long progressLogInterval;

    /**
     * Creates a new TrampolineConfig with default values.
     */
    public TrampolineConfig() {
        this.name = DEFAULT_NAME;
        this.progressLogInterval = DEFAULT_PROGRESS_LOG_INTERVAL;
    }

    /**
     * Creates a new TrampolineConfig with default values.
     *
     * @return a fresh default configuration
     */
    public static TrampolineConfig defaults() {
        return new TrampolineConfig();
    }

    /**
     * Creates a TrampolineConfig from properties, falling back to defaults for missing keys.
     *
     * @param properties the properties to read
     * @return the resulting configuration
     * @throws IllegalArgumentException if a numeric property cannot be parsed or is invalid
     */
    public static TrampolineConfig fromProperties(Properties properties) {
        TrampolineConfig config = new TrampolineConfig();
        if (properties == null) {
            return config;
        }

        String name = properties.getProperty(NAME_PROPERTY);
        if (name != null) {
            config.setName(name);
        }

        String interval = properties.getProperty(PROGRESS_LOG_INTERVAL_PROPERTY);
        if (interval != null) {
            try {
                config.setProgressLogInterval(Long.parseLong(interval.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                    "Invalid value for " + PROGRESS_LOG_INTERVAL_PROPERTY + ": " + interval, e);
            }
        }
        return config;
    }

    /**
     * Sets the name used to identify the computation in log lines.
     *
     * @param name The name, must not be blank
     * @return This TrampolineConfig instance
     */
    public TrampolineConfig setName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
        this.name = name;
        return this;
    }

    public String getName() {
        return name;
    }

    /**
     * Sets how many resume steps pass between progress log lines. Zero disables progress logging.
     *
     * @param progressLogInterval The interval in steps, must not be negative
     * @return This TrampolineConfig instance
     */
    public TrampolineConfig setProgressLogInterval(long progressLogInterval) {
        if (progressLogInterval < 0) {
            throw new IllegalArgumentException("progressLogInterval must not be negative");
        }
        this.progressLogInterval = progressLogInterval;
        return this;
    }

    public long getProgressLogInterval() {
        return progressLogInterval;
    }

    @Override
    public String toString() {
        return "TrampolineConfig{" +
                "name='" + name + '\'' +
                ", progressLogInterval=" + progressLogInterval +
                '}';
    }
}
