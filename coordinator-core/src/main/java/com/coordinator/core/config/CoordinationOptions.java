package com.coordinator.core.config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Properties;

/**
 * Tunables of a coordinated activity.
 * Immutable and reusable across adapters.
 *
 * Invariants:
 * - heartbeatInterval > 0
 * - tickMinInterval > 0
 * - maxConsecutiveHeartbeatFailures >= 0 (0 means unbounded)
 * - maxSessionLifetime is null (no limit) or > 0
 * - heartbeatStopTimeout > 0
 */
public record CoordinationOptions(
    Duration heartbeatInterval,
    Duration tickMinInterval,
    int maxConsecutiveHeartbeatFailures,
    Duration maxSessionLifetime,
    Duration heartbeatStopTimeout
) {
    public static final String PREFIX = "coordinator.";
    public static final String HEARTBEAT_INTERVAL = PREFIX + "heartbeat-interval";
    public static final String TICK_MIN_INTERVAL = PREFIX + "tick-min-interval";
    public static final String MAX_CONSECUTIVE_HEARTBEAT_FAILURES = PREFIX + "max-consecutive-heartbeat-failures";
    public static final String MAX_SESSION_LIFETIME = PREFIX + "max-session-lifetime";
    public static final String HEARTBEAT_STOP_TIMEOUT = PREFIX + "heartbeat-stop-timeout";

    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(30);
    public static final Duration DEFAULT_TICK_MIN_INTERVAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_HEARTBEAT_STOP_TIMEOUT = Duration.ofSeconds(30);

    public CoordinationOptions {
        Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        Objects.requireNonNull(tickMinInterval, "tickMinInterval");
        Objects.requireNonNull(heartbeatStopTimeout, "heartbeatStopTimeout");
        if (heartbeatInterval.isZero() || heartbeatInterval.isNegative()) {
            throw new IllegalArgumentException("Heartbeat interval must be > 0, got " + heartbeatInterval);
        }
        if (tickMinInterval.isZero() || tickMinInterval.isNegative()) {
            throw new IllegalArgumentException("Tick minimum interval must be > 0, got " + tickMinInterval);
        }
        if (maxConsecutiveHeartbeatFailures < 0) {
            throw new IllegalArgumentException("Max consecutive heartbeat failures must be >= 0");
        }
        if (maxSessionLifetime != null && (maxSessionLifetime.isZero() || maxSessionLifetime.isNegative())) {
            throw new IllegalArgumentException("Max session lifetime must be > 0 when set, got " + maxSessionLifetime);
        }
        if (heartbeatStopTimeout.isZero() || heartbeatStopTimeout.isNegative()) {
            throw new IllegalArgumentException("Heartbeat stop timeout must be > 0, got " + heartbeatStopTimeout);
        }
    }

    /**
     * Options with only the two intervals set; heartbeat failures are retried forever
     * and sessions never time out.
     */
    public static CoordinationOptions of(Duration heartbeatInterval, Duration tickMinInterval) {
        return new CoordinationOptions(
            heartbeatInterval, tickMinInterval, 0, null, DEFAULT_HEARTBEAT_STOP_TIMEOUT);
    }

    /**
     * Default options: heartbeat every 30s, tick at most once per second.
     */
    public static CoordinationOptions defaults() {
        return builder().build();
    }

    /**
     * Read options from properties; missing keys keep their defaults.
     * Durations are ISO-8601 ({@code PT5S}) or plain milliseconds ({@code 5000}).
     */
    public static CoordinationOptions fromProperties(Properties properties) {
        Builder builder = builder();
        String heartbeat = properties.getProperty(HEARTBEAT_INTERVAL);
        if (heartbeat != null) {
            builder.heartbeatInterval(parseDuration(HEARTBEAT_INTERVAL, heartbeat));
        }
        String tick = properties.getProperty(TICK_MIN_INTERVAL);
        if (tick != null) {
            builder.tickMinInterval(parseDuration(TICK_MIN_INTERVAL, tick));
        }
        String failures = properties.getProperty(MAX_CONSECUTIVE_HEARTBEAT_FAILURES);
        if (failures != null) {
            try {
                builder.maxConsecutiveHeartbeatFailures(Integer.parseInt(failures.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                    "Invalid value for " + MAX_CONSECUTIVE_HEARTBEAT_FAILURES + ": " + failures, e);
            }
        }
        String lifetime = properties.getProperty(MAX_SESSION_LIFETIME);
        if (lifetime != null && !lifetime.isBlank()) {
            builder.maxSessionLifetime(parseDuration(MAX_SESSION_LIFETIME, lifetime));
        }
        String stopTimeout = properties.getProperty(HEARTBEAT_STOP_TIMEOUT);
        if (stopTimeout != null) {
            builder.heartbeatStopTimeout(parseDuration(HEARTBEAT_STOP_TIMEOUT, stopTimeout));
        }
        return builder.build();
    }

    static Duration parseDuration(String key, String value) {
        String trimmed = value.trim();
        try {
            if (trimmed.chars().allMatch(Character::isDigit) && !trimmed.isEmpty()) {
                return Duration.ofMillis(Long.parseLong(trimmed));
            }
            return Duration.parse(trimmed);
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid duration for " + key + ": " + value, e);
        }
    }

    public boolean hasHeartbeatFailureLimit() {
        return maxConsecutiveHeartbeatFailures > 0;
    }

    public boolean hasSessionLifetime() {
        return maxSessionLifetime != null;
    }

    /**
     * Builder for CoordinationOptions.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration heartbeatInterval = DEFAULT_HEARTBEAT_INTERVAL;
        private Duration tickMinInterval = DEFAULT_TICK_MIN_INTERVAL;
        private int maxConsecutiveHeartbeatFailures = 0;
        private Duration maxSessionLifetime = null;
        private Duration heartbeatStopTimeout = DEFAULT_HEARTBEAT_STOP_TIMEOUT;

        public Builder heartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        public Builder tickMinInterval(Duration tickMinInterval) {
            this.tickMinInterval = tickMinInterval;
            return this;
        }

        public Builder maxConsecutiveHeartbeatFailures(int maxConsecutiveHeartbeatFailures) {
            this.maxConsecutiveHeartbeatFailures = maxConsecutiveHeartbeatFailures;
            return this;
        }

        public Builder maxSessionLifetime(Duration maxSessionLifetime) {
            this.maxSessionLifetime = maxSessionLifetime;
            return this;
        }

        /**
         * How long closing a session waits for an in-flight heartbeat call.
         */
        public Builder heartbeatStopTimeout(Duration heartbeatStopTimeout) {
            this.heartbeatStopTimeout = heartbeatStopTimeout;
            return this;
        }

        public CoordinationOptions build() {
            return new CoordinationOptions(
                heartbeatInterval, tickMinInterval,
                maxConsecutiveHeartbeatFailures, maxSessionLifetime,
                heartbeatStopTimeout
            );
        }
    }
}
