package io.eventfanout.server.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing policy of event stream connections.
 *
 * <p>Use {@link #builder()} to override individual values:
 * <pre>{@code
 * EventStreamSettings settings = EventStreamSettings.builder()
 *     .keepaliveInterval(Duration.ofSeconds(20))
 *     .maxLifetime(Duration.ofSeconds(90))
 *     .build();
 * }</pre>
 */
public final class EventStreamSettings {

    public static final Duration DEFAULT_KEEPALIVE_INTERVAL = Duration.ofSeconds(15);
    public static final Duration DEFAULT_MAX_LIFETIME = Duration.ofSeconds(60);
    public static final Duration DEFAULT_PUSH_WAIT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_POLL_TICK = Duration.ofSeconds(1);
    public static final Duration DEFAULT_POLL_CHECK_INTERVAL = Duration.ofSeconds(2);
    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofSeconds(2);
    public static final Duration DEFAULT_DIRTY_TOKEN_TTL = Duration.ofSeconds(120);
    public static final Duration DEFAULT_SLOW_PROVIDER_THRESHOLD = Duration.ofSeconds(1);

    private final Duration keepaliveInterval;
    private final Duration maxLifetime;
    private final Duration pushWait;
    private final Duration pollTick;
    private final Duration pollCheckInterval;
    private final Duration sweepInterval;
    private final Duration dirtyTokenTtl;
    private final Duration slowProviderThreshold;

    private EventStreamSettings(Builder b) {
        this.keepaliveInterval = positive(b.keepaliveInterval, "keepaliveInterval");
        this.maxLifetime = positive(b.maxLifetime, "maxLifetime");
        this.pushWait = positive(b.pushWait, "pushWait");
        this.pollTick = positive(b.pollTick, "pollTick");
        this.pollCheckInterval = positive(b.pollCheckInterval, "pollCheckInterval");
        this.sweepInterval = positive(b.sweepInterval, "sweepInterval");
        this.dirtyTokenTtl = positive(b.dirtyTokenTtl, "dirtyTokenTtl");
        this.slowProviderThreshold = positive(b.slowProviderThreshold, "slowProviderThreshold");
    }

    public static EventStreamSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Idle time after which a keepalive comment is written. Default: 15 seconds. */
    public Duration keepaliveInterval() {
        return keepaliveInterval;
    }

    /** Hard cap on a connection's lifetime; clients reconnect afterwards. Default: 60 seconds. */
    public Duration maxLifetime() {
        return maxLifetime;
    }

    /** Longest single wait on a push subscription. Default: 5 seconds. */
    public Duration pushWait() {
        return pushWait;
    }

    /** Sleep between iterations of the polling loop. Default: 1 second. */
    public Duration pollTick() {
        return pollTick;
    }

    /** How often the polling loop reads dirty tokens. Default: 2 seconds. */
    public Duration pollCheckInterval() {
        return pollCheckInterval;
    }

    /** How often pushing connections poll every provider without a signal. Default: 2 seconds. */
    public Duration sweepInterval() {
        return sweepInterval;
    }

    /** Expiry of tokens written by {@link DirtyNotifier}. Default: 120 seconds. */
    public Duration dirtyTokenTtl() {
        return dirtyTokenTtl;
    }

    /** Provider calls slower than this are logged. Default: 1 second. */
    public Duration slowProviderThreshold() {
        return slowProviderThreshold;
    }

    @Override
    public String toString() {
        return "EventStreamSettings{keepaliveInterval=" + keepaliveInterval
                + ", maxLifetime=" + maxLifetime
                + ", pushWait=" + pushWait
                + ", pollTick=" + pollTick
                + ", pollCheckInterval=" + pollCheckInterval
                + ", sweepInterval=" + sweepInterval
                + ", dirtyTokenTtl=" + dirtyTokenTtl
                + ", slowProviderThreshold=" + slowProviderThreshold + "}";
    }

    private static Duration positive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative() || d.isZero()) throw new IllegalArgumentException(name + " must be > 0");
        return d;
    }

    /**
     * Builder for {@link EventStreamSettings}.
     */
    public static final class Builder {
        private Duration keepaliveInterval = DEFAULT_KEEPALIVE_INTERVAL;
        private Duration maxLifetime = DEFAULT_MAX_LIFETIME;
        private Duration pushWait = DEFAULT_PUSH_WAIT;
        private Duration pollTick = DEFAULT_POLL_TICK;
        private Duration pollCheckInterval = DEFAULT_POLL_CHECK_INTERVAL;
        private Duration sweepInterval = DEFAULT_SWEEP_INTERVAL;
        private Duration dirtyTokenTtl = DEFAULT_DIRTY_TOKEN_TTL;
        private Duration slowProviderThreshold = DEFAULT_SLOW_PROVIDER_THRESHOLD;

        private Builder() {
        }

        public Builder keepaliveInterval(Duration keepaliveInterval) {
            this.keepaliveInterval = keepaliveInterval;
            return this;
        }

        public Builder maxLifetime(Duration maxLifetime) {
            this.maxLifetime = maxLifetime;
            return this;
        }

        public Builder pushWait(Duration pushWait) {
            this.pushWait = pushWait;
            return this;
        }

        public Builder pollTick(Duration pollTick) {
            this.pollTick = pollTick;
            return this;
        }

        public Builder pollCheckInterval(Duration pollCheckInterval) {
            this.pollCheckInterval = pollCheckInterval;
            return this;
        }

        public Builder sweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
            return this;
        }

        public Builder dirtyTokenTtl(Duration dirtyTokenTtl) {
            this.dirtyTokenTtl = dirtyTokenTtl;
            return this;
        }

        public Builder slowProviderThreshold(Duration slowProviderThreshold) {
            this.slowProviderThreshold = slowProviderThreshold;
            return this;
        }

        public EventStreamSettings build() {
            return new EventStreamSettings(this);
        }
    }
}
