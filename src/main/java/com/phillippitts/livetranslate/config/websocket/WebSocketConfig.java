package com.phillippitts.livetranslate.config.websocket;

import com.phillippitts.livetranslate.config.properties.StreamingProperties;
import com.phillippitts.livetranslate.presentation.websocket.TranslationWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Registers the streaming endpoint at {@code streaming.websocket-path}.
 *
 * <p>Container frame limits are sized from {@code streaming.max-chunk-bytes}: binary frames carry
 * a raw chunk, text frames a base64 one (4/3 of the size plus the JSON envelope).
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private static final int ENVELOPE_BYTES = 4096;

    private final TranslationWebSocketHandler handler;
    private final StreamingProperties props;

    public WebSocketConfig(TranslationWebSocketHandler handler, StreamingProperties props) {
        this.handler = handler;
        this.props = props;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, props.getWebsocketPath())
                .setAllowedOriginPatterns(props.getAllowedOrigins().toArray(new String[0]));
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        int maxChunk = props.getMaxChunkBytes();
        container.setMaxBinaryMessageBufferSize(maxChunk + ENVELOPE_BYTES);
        container.setMaxTextMessageBufferSize(maxChunk / 3 * 4 + ENVELOPE_BYTES);
        return container;
    }
}
