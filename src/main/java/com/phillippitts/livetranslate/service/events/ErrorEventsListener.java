package com.phillippitts.livetranslate.service.events;

import com.phillippitts.livetranslate.service.metrics.StreamingMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central handler for collaborator failure events. Every event is counted; logging is
 * throttled per component and message so a failing engine does not flood the log.
 */
@Component
class ErrorEventsListener {

    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final StreamingMetrics metrics;
    private final Clock clock;

    @Autowired
    ErrorEventsListener(StreamingMetrics metrics) {
        this(metrics, Clock.systemUTC());
    }

    ErrorEventsListener(StreamingMetrics metrics, Clock clock) {
        this.metrics = metrics;
        this.clock = clock;
    }

    @EventListener
    void onEngineFailure(EngineFailureEvent e) {
        metrics.incrementCollaboratorFailure(e.engine());
        String key = e.engine() + '-' + e.message();
        if (shouldLog(key)) {
            LOG.warn("Collaborator failure: engine={}, message={}, context={}, cause={}",
                    e.engine(), e.message(), e.context(), e.cause() == null ? "none" : e.cause().toString());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
