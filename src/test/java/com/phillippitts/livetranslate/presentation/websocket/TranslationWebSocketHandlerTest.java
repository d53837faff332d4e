package com.phillippitts.livetranslate.presentation.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.livetranslate.config.properties.StreamingProperties;
import com.phillippitts.livetranslate.config.properties.TranslationProperties;
import com.phillippitts.livetranslate.service.metrics.StreamingMetrics;
import com.phillippitts.livetranslate.service.processing.ProcessingDispatcher;
import com.phillippitts.livetranslate.service.processing.TranscriptionPipeline;
import com.phillippitts.livetranslate.service.session.SessionRegistry;
import com.phillippitts.livetranslate.service.session.SessionState;
import com.phillippitts.livetranslate.service.session.StreamingSession;
import com.phillippitts.livetranslate.service.translation.LanguageCatalog;
import com.phillippitts.livetranslate.testutil.FakeChunkDecoder;
import com.phillippitts.livetranslate.testutil.FakeSttEngine;
import com.phillippitts.livetranslate.testutil.FakeTranslator;
import com.phillippitts.livetranslate.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TranslationWebSocketHandlerTest {

    private final Map<String, Object> attributes = new HashMap<>();
    private WebSocketSession webSocket;
    private SessionRegistry registry;
    private TranslationWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        StreamingProperties props = new StreamingProperties();
        StreamingMetrics metrics = new StreamingMetrics(new SimpleMeterRegistry());
        TranscriptionPipeline pipeline = new TranscriptionPipeline(new FakeChunkDecoder(),
                new FakeSttEngine("hi", "en"), new FakeTranslator(), props, metrics);
        registry = new SessionRegistry(new ProcessingDispatcher(pipeline, new SyncExecutor()),
                new LanguageCatalog(new TranslationProperties()), metrics, props, new SyncExecutor());
        handler = new TranslationWebSocketHandler(registry, new MessageCodec(new ObjectMapper()), props);

        webSocket = mock(WebSocketSession.class);
        when(webSocket.getId()).thenReturn("ws-1");
        when(webSocket.getAttributes()).thenReturn(attributes);
        when(webSocket.isOpen()).thenReturn(true);
    }

    @Test
    void slowClientThatExceedsSendLimitsIsDisconnectedAndSessionEnded() throws Exception {
        doThrow(new SessionLimitExceededException("Send time limit exceeded", CloseStatus.SESSION_NOT_RELIABLE))
                .when(webSocket).sendMessage(any(WebSocketMessage.class));

        handler.afterConnectionEstablished(webSocket);
        StreamingSession session = (StreamingSession) attributes.get(TranslationWebSocketHandler.SESSION_ATTRIBUTE);
        handler.handleTextMessage(webSocket, new TextMessage("{\"type\":\"config\",\"target_language\":\"ar\"}"));

        verify(webSocket).close(CloseStatus.SESSION_NOT_RELIABLE);
        assertThat(session.state()).isEqualTo(SessionState.CLOSED);
        assertThat(registry.count()).isZero();
    }

    @Test
    void failedWriteClosesConnectionAndEndsSession() throws Exception {
        doThrow(new IOException("broken pipe")).when(webSocket).sendMessage(any(WebSocketMessage.class));

        handler.afterConnectionEstablished(webSocket);
        handler.handleTextMessage(webSocket, new TextMessage("{\"type\":\"config\",\"target_language\":\"ar\"}"));

        verify(webSocket).close(CloseStatus.SESSION_NOT_RELIABLE);
        assertThat(registry.count()).isZero();
    }
}
