package io.sessionstreams.spring.webflux.starter;

import io.sessionstreams.server.core.HeartbeatScheduler;
import io.sessionstreams.server.core.InMemorySessionEventLog;
import io.sessionstreams.server.core.RetentionSweeper;
import io.sessionstreams.server.core.SessionConnection;
import io.sessionstreams.server.core.SessionStreamsHandler;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

/**
 * Settings bound from {@code session-streams.*}.
 */
@ConfigurationProperties("session-streams")
public class SessionStreamsProperties {

    /** Interval between heartbeat comments on an open stream. */
    private Duration heartbeatInterval = HeartbeatScheduler.DEFAULT_INTERVAL;

    /** Idle time after which a session's buffered events are dropped. */
    private Duration sessionTimeout = RetentionSweeper.DEFAULT_SESSION_TIMEOUT;

    /** Minimum time between two retention sweeps. */
    private Duration sweepInterval = RetentionSweeper.DEFAULT_SWEEP_INTERVAL;

    /** Events kept per session for replay. */
    private int maxEventsPerSession = InMemorySessionEventLog.DEFAULT_MAX_EVENTS_PER_SESSION;

    /** Frames a connection may have waiting before it is dropped as too slow. */
    private int maxQueuedFrames = SessionConnection.DEFAULT_MAX_QUEUED_FRAMES;

    /** Largest accepted POST body. */
    private DataSize maxBodySize = DataSize.ofBytes(SessionStreamsHandler.DEFAULT_MAX_BODY_SIZE);

    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public void setHeartbeatInterval(Duration heartbeatInterval) {
        this.heartbeatInterval = heartbeatInterval;
    }

    public Duration getSessionTimeout() {
        return sessionTimeout;
    }

    public void setSessionTimeout(Duration sessionTimeout) {
        this.sessionTimeout = sessionTimeout;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
        this.sweepInterval = sweepInterval;
    }

    public int getMaxEventsPerSession() {
        return maxEventsPerSession;
    }

    public void setMaxEventsPerSession(int maxEventsPerSession) {
        this.maxEventsPerSession = maxEventsPerSession;
    }

    public int getMaxQueuedFrames() {
        return maxQueuedFrames;
    }

    public void setMaxQueuedFrames(int maxQueuedFrames) {
        this.maxQueuedFrames = maxQueuedFrames;
    }

    public DataSize getMaxBodySize() {
        return maxBodySize;
    }

    public void setMaxBodySize(DataSize maxBodySize) {
        this.maxBodySize = maxBodySize;
    }
}
