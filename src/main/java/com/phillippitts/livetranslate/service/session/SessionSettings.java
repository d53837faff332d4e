package com.phillippitts.livetranslate.service.session;

import com.phillippitts.livetranslate.config.properties.StreamingProperties;

/**
 * Process-wide limits a session enforces, copied from {@link StreamingProperties} at creation.
 *
 * @param interimThresholdBytes buffered bytes that trigger an interim pass
 * @param maxChunkBytes         largest accepted chunk
 * @param maxBufferBytes        largest buffer a session may hold
 */
public record SessionSettings(int interimThresholdBytes, int maxChunkBytes, int maxBufferBytes) {

    public static SessionSettings from(StreamingProperties props) {
        return new SessionSettings(props.getInterimThresholdBytes(), props.getMaxChunkBytes(),
                props.getMaxBufferBytes());
    }
}
