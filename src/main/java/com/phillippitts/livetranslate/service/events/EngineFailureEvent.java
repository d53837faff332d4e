package com.phillippitts.livetranslate.service.events;

import java.time.Instant;
import java.util.Map;

/**
 * Published when a collaborator (whisper.cpp, translation API, decoder) fails.
 *
 * <p>PII note: never put transcript text in {@code context}; technical diagnostics only.
 *
 * @param engine  failing component, e.g. "whisper" or "translation"
 * @param at      when the failure happened
 * @param message short description
 * @param cause   underlying exception (nullable)
 * @param context extra key/value diagnostics (nullable)
 */
public record EngineFailureEvent(
        String engine,
        Instant at,
        String message,
        Throwable cause,
        Map<String, String> context
) {
    public EngineFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
