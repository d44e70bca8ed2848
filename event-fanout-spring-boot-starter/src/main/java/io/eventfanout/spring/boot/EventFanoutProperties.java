package io.eventfanout.spring.boot;

import io.eventfanout.server.core.EventStreamSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties under {@code event-fanout}.
 */
@ConfigurationProperties("event-fanout")
public class EventFanoutProperties {

    /** Whether to configure the event stream endpoint at all. */
    private boolean enabled = true;

    /** Servlet mapping of the stream endpoint. */
    private String path = "/events/stream";

    private Duration keepaliveInterval = EventStreamSettings.DEFAULT_KEEPALIVE_INTERVAL;
    private Duration maxLifetime = EventStreamSettings.DEFAULT_MAX_LIFETIME;
    private Duration pushWait = EventStreamSettings.DEFAULT_PUSH_WAIT;
    private Duration pollTick = EventStreamSettings.DEFAULT_POLL_TICK;
    private Duration pollCheckInterval = EventStreamSettings.DEFAULT_POLL_CHECK_INTERVAL;
    private Duration sweepInterval = EventStreamSettings.DEFAULT_SWEEP_INTERVAL;
    private Duration dirtyTokenTtl = EventStreamSettings.DEFAULT_DIRTY_TOKEN_TTL;
    private Duration slowProviderThreshold = EventStreamSettings.DEFAULT_SLOW_PROVIDER_THRESHOLD;

    public EventStreamSettings toSettings() {
        return EventStreamSettings.builder()
                .keepaliveInterval(keepaliveInterval)
                .maxLifetime(maxLifetime)
                .pushWait(pushWait)
                .pollTick(pollTick)
                .pollCheckInterval(pollCheckInterval)
                .sweepInterval(sweepInterval)
                .dirtyTokenTtl(dirtyTokenTtl)
                .slowProviderThreshold(slowProviderThreshold)
                .build();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public Duration getKeepaliveInterval() {
        return keepaliveInterval;
    }

    public void setKeepaliveInterval(Duration keepaliveInterval) {
        this.keepaliveInterval = keepaliveInterval;
    }

    public Duration getMaxLifetime() {
        return maxLifetime;
    }

    public void setMaxLifetime(Duration maxLifetime) {
        this.maxLifetime = maxLifetime;
    }

    public Duration getPushWait() {
        return pushWait;
    }

    public void setPushWait(Duration pushWait) {
        this.pushWait = pushWait;
    }

    public Duration getPollTick() {
        return pollTick;
    }

    public void setPollTick(Duration pollTick) {
        this.pollTick = pollTick;
    }

    public Duration getPollCheckInterval() {
        return pollCheckInterval;
    }

    public void setPollCheckInterval(Duration pollCheckInterval) {
        this.pollCheckInterval = pollCheckInterval;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
        this.sweepInterval = sweepInterval;
    }

    public Duration getDirtyTokenTtl() {
        return dirtyTokenTtl;
    }

    public void setDirtyTokenTtl(Duration dirtyTokenTtl) {
        this.dirtyTokenTtl = dirtyTokenTtl;
    }

    public Duration getSlowProviderThreshold() {
        return slowProviderThreshold;
    }

    public void setSlowProviderThreshold(Duration slowProviderThreshold) {
        this.slowProviderThreshold = slowProviderThreshold;
    }
}
