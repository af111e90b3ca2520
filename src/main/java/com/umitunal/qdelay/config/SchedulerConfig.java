package com.umitunal.qdelay.config;

import java.time.Clock;
import java.util.Objects;

/**
 * Behavioural switches for the scheduler front end.
 */
public class SchedulerConfig {
    private final boolean dynamic;
    private final boolean inline;
    private final Clock clock;

    private SchedulerConfig(Builder builder) {
        this.dynamic = builder.dynamic;
        this.inline = builder.inline;
        this.clock = builder.clock;
    }

    public boolean isDynamic() { return dynamic; }
    public boolean isInline() { return inline; }
    public Clock getClock() { return clock; }

    public static SchedulerConfig defaults() {
        return newBuilder().build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private boolean dynamic = false;
        private boolean inline = false;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        /**
         * Persist every bulk-assigned schedule to the registry so other
         * processes can pick it up.
         * Default: false
         */
        public Builder withDynamic(boolean enable) {
            this.dynamic = enable;
            return this;
        }

        /**
         * Hand jobs straight to the executor instead of storing them.
         * Meant for tests and development.
         * Default: false
         */
        public Builder withInline(boolean enable) {
            this.inline = enable;
            return this;
        }

        /**
         * Time source for relative scheduling and polling.
         * Default: system UTC clock
         */
        public Builder withClock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock cannot be null");
            return this;
        }

        public SchedulerConfig build() {
            return new SchedulerConfig(this);
        }
    }
}
