package com.phillippitts.livetranslate.config;

import com.phillippitts.livetranslate.service.audio.decode.ChunkDecoder;
import com.phillippitts.livetranslate.service.stt.SttEngine;
import com.phillippitts.livetranslate.service.translation.Translator;
import com.phillippitts.livetranslate.testutil.FakeChunkDecoder;
import com.phillippitts.livetranslate.testutil.FakeSttEngine;
import com.phillippitts.livetranslate.testutil.FakeTranslator;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/**
 * Test doubles for the three collaborators, so integration tests need neither whisper.cpp
 * nor a translation server.
 *
 * <p>All beans are {@code @Primary} and take precedence over the production implementations.
 * Decoding is the identity (chunks are sent as raw PCM), transcription always returns
 * "hello world" in English and translation prefixes the target code.
 */
@TestConfiguration
public class IntegrationTestConfiguration {

    @Bean
    @Primary
    public ChunkDecoder testChunkDecoder() {
        return new FakeChunkDecoder();
    }

    @Bean
    @Primary
    public SttEngine testSttEngine() {
        return new FakeSttEngine("hello world", "en");
    }

    @Bean
    @Primary
    public Translator testTranslator() {
        return new FakeTranslator();
    }
}
