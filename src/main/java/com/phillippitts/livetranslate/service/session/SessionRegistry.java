package com.phillippitts.livetranslate.service.session;

import com.phillippitts.livetranslate.config.properties.StreamingProperties;
import com.phillippitts.livetranslate.service.metrics.StreamingMetrics;
import com.phillippitts.livetranslate.service.processing.ProcessingDispatcher;
import com.phillippitts.livetranslate.service.translation.LanguageCatalog;
import com.phillippitts.livetranslate.util.SerialExecutor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Creates and tracks {@link StreamingSession}s, one per connection.
 *
 * <p>Sessions share the {@code sessionExecutor} pool; each gets its own {@link SerialExecutor}
 * over it so that its messages are handled one at a time.
 */
@Component
public class SessionRegistry {

    private static final Logger LOG = LogManager.getLogger(SessionRegistry.class);

    private final Map<String, StreamingSession> sessions = new ConcurrentHashMap<>();
    private final ProcessingDispatcher dispatcher;
    private final LanguageCatalog languages;
    private final StreamingMetrics metrics;
    private final StreamingProperties props;
    private final Executor sessionExecutor;

    public SessionRegistry(ProcessingDispatcher dispatcher,
                           LanguageCatalog languages,
                           StreamingMetrics metrics,
                           StreamingProperties props,
                           @Qualifier("sessionExecutor") Executor sessionExecutor) {
        this.dispatcher = dispatcher;
        this.languages = languages;
        this.metrics = metrics;
        this.props = props;
        this.sessionExecutor = sessionExecutor;
    }

    public StreamingSession open(ResultSink sink) {
        String id = UUID.randomUUID().toString();
        StreamingSession session = new StreamingSession(
                id,
                SessionSettings.from(props),
                dispatcher,
                new ResultEmitter(sink, props.isTranslateInterim()),
                languages,
                metrics,
                new SerialExecutor(sessionExecutor),
                this::remove);
        sessions.put(id, session);
        metrics.sessionOpened();
        LOG.info("Session {} opened ({} active)", id, sessions.size());
        return session;
    }

    public Optional<StreamingSession> get(String id) {
        return Optional.ofNullable(sessions.get(id));
    }

    /** Closes the session if it is still open. Safe to call more than once. */
    public void close(String id) {
        StreamingSession session = sessions.get(id);
        if (session != null) {
            session.close();
        }
    }

    public int count() {
        return sessions.size();
    }

    private void remove(StreamingSession session) {
        if (sessions.remove(session.id()) != null) {
            metrics.sessionClosed();
        }
    }
}
