package com.phillippitts.livetranslate.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.livetranslate.config.IntegrationTestConfiguration;
import com.phillippitts.livetranslate.service.session.SessionRegistry;
import com.phillippitts.livetranslate.testutil.TestAudio;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.context.annotation.Import;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Base64;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Drives the streaming protocol over a real WebSocket connection against the running
 * application, with fake decode, transcription and translation collaborators.
 */
@Tag("integration")
@Import(IntegrationTestConfiguration.class)
@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {
        "stt.validation.enabled=false",
        "streaming.interim-threshold-bytes=3200",
        "streaming.min-duration-ms=50"
    }
)
class StreamingWebSocketIntegrationTest {

    private static final long TIMEOUT_SECONDS = 10;

    @LocalServerPort
    private int port;

    @Autowired
    private SessionRegistry registry;

    private final ObjectMapper mapper = new ObjectMapper();
    private final BlockingQueue<String> received = new LinkedBlockingQueue<>();
    private WebSocketSession ws;

    @BeforeEach
    void connect() throws Exception {
        ws = new StandardWebSocketClient()
                .execute(new TextWebSocketHandler() {
                    @Override
                    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
                        received.add(message.getPayload());
                    }
                }, "ws://localhost:" + port + "/ws/transcribe-translate")
                .get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    @AfterEach
    void disconnect() throws Exception {
        if (ws.isOpen()) {
            ws.close();
        }
    }

    private void send(String json) throws Exception {
        ws.sendMessage(new TextMessage(json));
    }

    private JsonNode next() throws Exception {
        String payload = received.poll(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        assertThat(payload).as("expected a server message").isNotNull();
        return mapper.readTree(payload);
    }

    private static String chunk(byte[] data) {
        return "{\"type\":\"chunk\",\"data\":\"" + Base64.getEncoder().encodeToString(data)
                + "\",\"encoding\":\"base64\"}";
    }

    @Test
    void configureStreamAndFlush() throws Exception {
        send("{\"type\":\"config\",\"source_language\":\"auto\",\"target_language\":\"ar\"}");
        JsonNode ack = next();
        assertThat(ack.get("type").asText()).isEqualTo("config_ack");
        assertThat(ack.get("config").get("source_language").isNull()).isTrue();
        assertThat(ack.get("config").get("target_language").asText()).isEqualTo("ar");

        send(chunk(TestAudio.tone(1600)));
        send(chunk(TestAudio.tone(1600)));
        JsonNode interim = next();
        assertThat(interim.get("type").asText()).isEqualTo("interim");
        assertThat(interim.get("text").asText()).isEqualTo("hello world");
        assertThat(interim.get("detected_language").asText()).isEqualTo("en");
        assertThat(interim.get("translated_text").asText()).isEqualTo("[ar] hello world");

        send("{\"type\":\"flush\"}");
        JsonNode fin = next();
        assertThat(fin.get("type").asText()).isEqualTo("final");
        assertThat(fin.get("original_text").asText()).isEqualTo("hello world");
        assertThat(fin.get("translated_text").asText()).isEqualTo("[ar] hello world");
        assertThat(fin.get("target_language").asText()).isEqualTo("ar");
        assertThat(fin.get("translation_skipped").asBoolean()).isFalse();
    }

    @Test
    void binaryFramesAreTreatedAsChunks() throws Exception {
        send("{\"type\":\"config\",\"target_language\":\"en\"}");
        assertThat(next().get("type").asText()).isEqualTo("config_ack");

        ws.sendMessage(new BinaryMessage(TestAudio.tone(3000)));
        send("{\"type\":\"flush\"}");

        JsonNode fin = next();
        assertThat(fin.get("type").asText()).isEqualTo("final");
        assertThat(fin.get("original_text").asText()).isEqualTo("hello world");
        assertThat(fin.get("translated_text").asText()).isEqualTo("hello world");
    }

    @Test
    void malformedAndPrematureMessagesAreAnsweredWithErrors() throws Exception {
        send("{not json");
        assertThat(next().get("type").asText()).isEqualTo("error");

        send(chunk(TestAudio.tone(800)));
        JsonNode notConfigured = next();
        assertThat(notConfigured.get("type").asText()).isEqualTo("error");
        assertThat(notConfigured.get("detail").asText()).contains("not configured");

        send("{\"type\":\"config\",\"target_language\":\"xx\"}");
        assertThat(next().get("detail").asText()).contains("Unsupported target_language");

        assertThat(ws.isOpen()).isTrue();
    }

    @Test
    void closeMessageEndsSessionAndConnection() throws Exception {
        send("{\"type\":\"config\",\"target_language\":\"ar\"}");
        assertThat(next().get("type").asText()).isEqualTo("config_ack");
        assertThat(registry.count()).isGreaterThanOrEqualTo(1);

        send("{\"type\":\"close\"}");

        await().atMost(TIMEOUT_SECONDS, TimeUnit.SECONDS).until(() -> !ws.isOpen());
        await().atMost(TIMEOUT_SECONDS, TimeUnit.SECONDS).until(() -> registry.count() == 0);
        assertThat(received).isEmpty();
    }

    @Test
    void clientDisconnectClosesSession() throws Exception {
        send("{\"type\":\"config\",\"target_language\":\"ar\"}");
        next();

        ws.close(CloseStatus.NORMAL);

        await().atMost(TIMEOUT_SECONDS, TimeUnit.SECONDS).until(() -> registry.count() == 0);
    }
}
