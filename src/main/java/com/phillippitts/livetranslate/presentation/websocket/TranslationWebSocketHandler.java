package com.phillippitts.livetranslate.presentation.websocket;

import com.phillippitts.livetranslate.config.logging.SessionMdc;
import com.phillippitts.livetranslate.config.properties.StreamingProperties;
import com.phillippitts.livetranslate.domain.message.OutboundMessage;
import com.phillippitts.livetranslate.exception.MalformedMessageException;
import com.phillippitts.livetranslate.service.session.ResultSink;
import com.phillippitts.livetranslate.service.session.SessionRegistry;
import com.phillippitts.livetranslate.service.session.StreamingSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * WebSocket boundary of the streaming protocol.
 *
 * <p>Transport threads only parse frames and hand them to the connection's
 * {@link StreamingSession}, which queues them; no processing happens here. Outbound messages
 * are written from the session's serial executor through a
 * {@link ConcurrentWebSocketSessionDecorator}, which buffers a slow client up to the
 * configured limits.
 */
@Component
public class TranslationWebSocketHandler extends TextWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(TranslationWebSocketHandler.class);

    static final String SESSION_ATTRIBUTE = "livetranslate.session";

    private final SessionRegistry registry;
    private final MessageCodec codec;
    private final StreamingProperties props;

    public TranslationWebSocketHandler(SessionRegistry registry, MessageCodec codec, StreamingProperties props) {
        this.registry = registry;
        this.codec = codec;
        this.props = props;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession webSocket) {
        WebSocketSession outbound = new ConcurrentWebSocketSessionDecorator(
                webSocket, props.getSendTimeLimitMs(), props.getSendBufferSizeLimit());
        StreamingSession session = registry.open(new WebSocketResultSink(outbound));
        webSocket.getAttributes().put(SESSION_ATTRIBUTE, session);
        try (SessionMdc ignored = SessionMdc.open(session.id())) {
            LOG.info("Connection {} from {}", webSocket.getId(), webSocket.getRemoteAddress());
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession webSocket, TextMessage message) throws IOException {
        StreamingSession session = session(webSocket);
        if (session == null) {
            return;
        }
        InboundMessage inbound;
        try {
            inbound = codec.decode(message.getPayload());
        } catch (MalformedMessageException e) {
            try (SessionMdc ignored = SessionMdc.open(session.id())) {
                LOG.debug("Rejecting malformed message: {}", e.getMessage());
            }
            session.rejectMalformed(e.getMessage());
            return;
        }
        if (inbound instanceof InboundMessage.Config config) {
            session.configure(config.sourceLanguage(), config.targetLanguage());
        } else if (inbound instanceof InboundMessage.Chunk chunk) {
            session.appendChunk(chunk.data());
        } else if (inbound instanceof InboundMessage.Flush) {
            session.flush();
        } else if (inbound instanceof InboundMessage.Close) {
            session.close();
            webSocket.close(CloseStatus.NORMAL);
        }
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession webSocket, BinaryMessage message) {
        StreamingSession session = session(webSocket);
        if (session == null) {
            return;
        }
        ByteBuffer payload = message.getPayload();
        byte[] bytes = new byte[payload.remaining()];
        payload.get(bytes);
        session.appendChunk(bytes);
    }

    @Override
    public void handleTransportError(WebSocketSession webSocket, Throwable exception) {
        LOG.warn("Transport error on connection {}: {}", webSocket.getId(), exception.toString());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession webSocket, CloseStatus status) {
        StreamingSession session = session(webSocket);
        if (session != null) {
            try (SessionMdc ignored = SessionMdc.open(session.id())) {
                LOG.info("Connection {} closed: {}", webSocket.getId(), status);
            }
            registry.close(session.id());
        }
    }

    private static StreamingSession session(WebSocketSession webSocket) {
        return (StreamingSession) webSocket.getAttributes().get(SESSION_ATTRIBUTE);
    }

    /** Writes encoded messages to one connection; a failed write closes the connection and ends the session. */
    private final class WebSocketResultSink implements ResultSink {

        private final WebSocketSession outbound;

        private WebSocketResultSink(WebSocketSession outbound) {
            this.outbound = outbound;
        }

        @Override
        public void send(OutboundMessage message) {
            if (!outbound.isOpen()) {
                LOG.debug("Connection {} already closed; dropping {}", outbound.getId(), message.type());
                return;
            }
            try {
                outbound.sendMessage(new TextMessage(codec.encode(message)));
            } catch (IOException | RuntimeException e) {
                // includes SessionLimitExceededException from a client that stopped reading
                LOG.warn("Failed to send {} on connection {}: {}", message.type(), outbound.getId(), e.toString());
                abandon();
            }
        }

        private void abandon() {
            try {
                outbound.close(CloseStatus.SESSION_NOT_RELIABLE);
            } catch (IOException e) {
                LOG.warn("Failed to close connection {}: {}", outbound.getId(), e.toString());
            }
            StreamingSession session = session(outbound);
            if (session != null) {
                registry.close(session.id());
            }
        }
    }
}
