package com.phillippitts.livetranslate.service.session;

import com.phillippitts.livetranslate.domain.message.OutboundMessage;

/**
 * Ordered outbound channel of one session. Called only from the session's serial executor,
 * so messages arrive in the order they were emitted.
 */
@FunctionalInterface
public interface ResultSink {

    void send(OutboundMessage message);
}
