package com.alertgate.service;

/**
 * Typed, immutable configuration for the alert gate service.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults.
 * Rule, storm and quiet-hours settings live in the YAML file named by
 * {@code GATE_CONFIG_PATH}; this object only covers the host process.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    // ---------------------------------------------------------------
    // Gate configuration
    // ---------------------------------------------------------------
    private final String configPath;

    // ---------------------------------------------------------------
    // Schedules
    // ---------------------------------------------------------------
    private final int digestIntervalSeconds;
    private final int summaryIntervalSeconds;

    // ---------------------------------------------------------------
    // Channel queues
    // ---------------------------------------------------------------
    private final int queueCheckIntervalSeconds;
    private final int queueMaxSize;

    // ---------------------------------------------------------------
    // Health / status
    // ---------------------------------------------------------------
    private final int healthPort;

    private ServiceConfig(Builder b) {
        this.configPath = b.configPath;
        this.digestIntervalSeconds = b.digestIntervalSeconds;
        this.summaryIntervalSeconds = b.summaryIntervalSeconds;
        this.queueCheckIntervalSeconds = b.queueCheckIntervalSeconds;
        this.queueMaxSize = b.queueMaxSize;
        this.healthPort = b.healthPort;
    }

    /**
     * Build a {@link ServiceConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment() {
        try {
            return new Builder()
                    .configPath(env("GATE_CONFIG_PATH", ""))
                    .digestIntervalSeconds(parseIntEnv("DIGEST_INTERVAL_SECONDS", "60"))
                    .summaryIntervalSeconds(parseIntEnv("SUMMARY_INTERVAL_SECONDS", "300"))
                    .queueCheckIntervalSeconds(parseIntEnv("QUEUE_CHECK_INTERVAL_SECONDS", "60"))
                    .queueMaxSize(parseIntEnv("QUEUE_MAX_SIZE", "100"))
                    .healthPort(parseIntEnv("HEALTH_PORT", "8080"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return YAML file path, or blank to use the classpath default
     */
    public String getConfigPath() {
        return configPath;
    }

    public int getDigestIntervalSeconds() {
        return digestIntervalSeconds;
    }

    public int getSummaryIntervalSeconds() {
        return summaryIntervalSeconds;
    }

    public int getQueueCheckIntervalSeconds() {
        return queueCheckIntervalSeconds;
    }

    public int getQueueMaxSize() {
        return queueMaxSize;
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}.
     *
     * <p>
     * The {@link #build()} method validates that intervals and the queue size
     * are positive and the port is in [1, 65535].
     * </p>
     */
    public static class Builder {
        private String configPath = "";
        private int digestIntervalSeconds = 60;
        private int summaryIntervalSeconds = 300;
        private int queueCheckIntervalSeconds = 60;
        private int queueMaxSize = 100;
        private int healthPort = 8080;

        public Builder configPath(String v) {
            this.configPath = v;
            return this;
        }

        public Builder digestIntervalSeconds(int v) {
            this.digestIntervalSeconds = v;
            return this;
        }

        public Builder summaryIntervalSeconds(int v) {
            this.summaryIntervalSeconds = v;
            return this;
        }

        public Builder queueCheckIntervalSeconds(int v) {
            this.queueCheckIntervalSeconds = v;
            return this;
        }

        public Builder queueMaxSize(int v) {
            this.queueMaxSize = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ServiceConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            if (configPath == null) {
                configPath = "";
            }
            requirePositive(digestIntervalSeconds, "digestIntervalSeconds");
            requirePositive(summaryIntervalSeconds, "summaryIntervalSeconds");
            requirePositive(queueCheckIntervalSeconds, "queueCheckIntervalSeconds");
            requirePositive(queueMaxSize, "queueMaxSize");
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }
            return new ServiceConfig(this);
        }

        private static void requirePositive(int value, String name) {
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be >= 1, got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue).trim());
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "configPath='" + configPath + '\'' +
                ", digestIntervalSeconds=" + digestIntervalSeconds +
                ", summaryIntervalSeconds=" + summaryIntervalSeconds +
                ", queueCheckIntervalSeconds=" + queueCheckIntervalSeconds +
                ", queueMaxSize=" + queueMaxSize +
                ", healthPort=" + healthPort +
                '}';
    }
}
