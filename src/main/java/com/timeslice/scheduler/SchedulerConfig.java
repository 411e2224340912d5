package com.timeslice.scheduler;

import com.timeslice.clock.SystemTimeSource;
import com.timeslice.clock.TimeSource;

import java.util.Objects;

/**
 * Centralized configuration for a {@link TaskScheduler}.
 *
 * Uses Builder pattern for clean, validated construction.
 * Immutable after creation - thread-safe.
 *
 * Example usage:
 * SchedulerConfig config = new SchedulerConfig.Builder()
 *     .timeQuantum(2.0)
 *     .timeSource(new VirtualTimeSource())
 *     .build();
 *
 * TaskScheduler scheduler = new TaskScheduler(config);
 */
public class SchedulerConfig {

    public static final double DEFAULT_TIME_QUANTUM = 2.0;
    public static final long DEFAULT_IDLE_POLL_INTERVAL_MS = 100;
    public static final long DEFAULT_STOP_TIMEOUT_MS = 1000;
    public static final long DEFAULT_LOOP_PAUSE_MS = 10;

    private final double timeQuantum;
    private final long idlePollIntervalMs;
    private final long stopTimeoutMs;
    private final long loopPauseMs;
    private final TimeSource timeSource;

    /**
     * Private constructor - use Builder to create instances.
     */
    private SchedulerConfig(Builder builder) {
        this.timeQuantum = builder.timeQuantum;
        this.idlePollIntervalMs = builder.idlePollIntervalMs;
        this.stopTimeoutMs = builder.stopTimeoutMs;
        this.loopPauseMs = builder.loopPauseMs;
        this.timeSource = builder.timeSource;
    }

    /**
     * @return configuration with every default (2s quantum, system clock)
     */
    public static SchedulerConfig defaults() {
        return new Builder().build();
    }

    /**
     * Seconds of simulated work granted per slice.
     */
    public double getTimeQuantum() {
        return timeQuantum;
    }

    /**
     * Upper bound of a single idle wait, in milliseconds.
     * The loop is normally woken earlier by addTask() or stop().
     */
    public long getIdlePollIntervalMs() {
        return idlePollIntervalMs;
    }

    /**
     * How long stop() waits for the execution thread to terminate.
     */
    public long getStopTimeoutMs() {
        return stopTimeoutMs;
    }

    /**
     * Pause between two slices, keeps the loop from spinning.
     * Real time, not simulated: the virtual clock is not advanced by it.
     */
    public long getLoopPauseMs() {
        return loopPauseMs;
    }

    public TimeSource getTimeSource() {
        return timeSource;
    }

    @Override
    public String toString() {
        return "SchedulerConfig{" +
                "timeQuantum=" + timeQuantum +
                ", idlePollIntervalMs=" + idlePollIntervalMs +
                ", stopTimeoutMs=" + stopTimeoutMs +
                ", loopPauseMs=" + loopPauseMs +
                ", timeSource=" + timeSource.getName() +
                '}';
    }

    /**
     * Builder for creating SchedulerConfig instances.
     * Provides fluent API with validation and sensible defaults.
     */
    public static class Builder {
        private double timeQuantum = DEFAULT_TIME_QUANTUM;
        private long idlePollIntervalMs = DEFAULT_IDLE_POLL_INTERVAL_MS;
        private long stopTimeoutMs = DEFAULT_STOP_TIMEOUT_MS;
        private long loopPauseMs = DEFAULT_LOOP_PAUSE_MS;
        private TimeSource timeSource = new SystemTimeSource();

        /**
         * Sets the time quantum in seconds.
         * Default: 2.0
         */
        public Builder timeQuantum(double seconds) {
            if (!(seconds > 0)) {
                throw new IllegalArgumentException("timeQuantum must be positive, got " + seconds);
            }
            this.timeQuantum = seconds;
            return this;
        }

        /**
         * Default: 100 ms
         */
        public Builder idlePollIntervalMs(long millis) {
            if (millis <= 0) {
                throw new IllegalArgumentException("idlePollIntervalMs must be positive");
            }
            this.idlePollIntervalMs = millis;
            return this;
        }

        /**
         * Default: 1000 ms
         */
        public Builder stopTimeoutMs(long millis) {
            if (millis < 0) {
                throw new IllegalArgumentException("stopTimeoutMs cannot be negative");
            }
            this.stopTimeoutMs = millis;
            return this;
        }

        /**
         * Default: 10 ms. Zero disables the pause.
         */
        public Builder loopPauseMs(long millis) {
            if (millis < 0) {
                throw new IllegalArgumentException("loopPauseMs cannot be negative");
            }
            this.loopPauseMs = millis;
            return this;
        }

        /**
         * Default: SystemTimeSource
         */
        public Builder timeSource(TimeSource timeSource) {
            this.timeSource = Objects.requireNonNull(timeSource, "timeSource cannot be null");
            return this;
        }

        public SchedulerConfig build() {
            // Validation already done in setters
            return new SchedulerConfig(this);
        }
    }
}
