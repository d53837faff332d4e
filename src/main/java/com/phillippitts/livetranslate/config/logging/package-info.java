/**
 * Logging support.
 *
 * <p>Log4j2 is configured by {@code log4j2-spring.xml}. Every line written while handling a
 * WebSocket message or running a processing job carries the {@code sessionId} MDC key, set by
 * {@link com.phillippitts.livetranslate.config.logging.SessionMdc} and copied onto pool threads
 * by the task decorator in {@link com.phillippitts.livetranslate.config.ThreadPoolConfig}.
 */
package com.phillippitts.livetranslate.config.logging;
