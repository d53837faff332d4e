package com.phillippitts.livetranslate.service.events;

import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Map;

/**
 * Null-safe helper for publishing {@link EngineFailureEvent}s. Collaborators built without a
 * publisher (plain unit tests) simply publish nothing.
 */
public final class EngineEventPublisher {

    private EngineEventPublisher() {
        // Utility class - prevent instantiation
    }

    public static void publishFailure(ApplicationEventPublisher publisher,
                                      String engineName,
                                      String message,
                                      Throwable cause,
                                      Map<String, String> context) {
        if (publisher != null) {
            publisher.publishEvent(new EngineFailureEvent(engineName, Instant.now(), message, cause, context));
        }
    }

    public static void publishFailure(ApplicationEventPublisher publisher,
                                      String engineName,
                                      String message,
                                      Throwable cause) {
        publishFailure(publisher, engineName, message, cause, null);
    }
}
