package com.phillippitts.livetranslate.service.session;

import com.phillippitts.livetranslate.config.properties.StreamingProperties;
import com.phillippitts.livetranslate.config.properties.ThreadPoolProperties;
import com.phillippitts.livetranslate.config.ThreadPoolConfig;
import com.phillippitts.livetranslate.domain.message.ErrorMessage;
import com.phillippitts.livetranslate.domain.message.FinalMessage;
import com.phillippitts.livetranslate.service.metrics.StreamingMetrics;
import com.phillippitts.livetranslate.service.processing.ProcessingDispatcher;
import com.phillippitts.livetranslate.service.processing.TranscriptionPipeline;
import com.phillippitts.livetranslate.service.translation.LanguageCatalog;
import com.phillippitts.livetranslate.config.properties.TranslationProperties;
import com.phillippitts.livetranslate.testutil.FakeChunkDecoder;
import com.phillippitts.livetranslate.testutil.FakeSttEngine;
import com.phillippitts.livetranslate.testutil.FakeTranslator;
import com.phillippitts.livetranslate.testutil.RecordingResultSink;
import com.phillippitts.livetranslate.testutil.TestAudio;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Sessions driven from many threads against real pools.
 */
class SessionConcurrencyTest {

    private static final int THRESHOLD = 3200;

    private FakeChunkDecoder decoder;
    private FakeSttEngine engine;
    private SimpleMeterRegistry meters;
    private ThreadPoolTaskExecutor processingPool;
    private ThreadPoolTaskExecutor sessionPool;
    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        decoder = new FakeChunkDecoder();
        engine = new FakeSttEngine("hello world", "en");
        engine.delayMs = 20;
        meters = new SimpleMeterRegistry();
        StreamingMetrics metrics = new StreamingMetrics(meters);

        ThreadPoolProperties pools = new ThreadPoolProperties();
        pools.getProcessing().setCorePoolSize(1);
        pools.getProcessing().setMaxPoolSize(1);
        ThreadPoolConfig config = new ThreadPoolConfig(pools);
        processingPool = (ThreadPoolTaskExecutor) config.processingExecutor();
        sessionPool = (ThreadPoolTaskExecutor) config.sessionExecutor();

        StreamingProperties props = new StreamingProperties();
        props.setInterimThresholdBytes(THRESHOLD);
        props.setMinDurationMs(50);
        TranscriptionPipeline pipeline = new TranscriptionPipeline(decoder, engine, new FakeTranslator(), props,
                metrics);
        registry = new SessionRegistry(new ProcessingDispatcher(pipeline, processingPool),
                new LanguageCatalog(new TranslationProperties()), metrics, props, sessionPool);
    }

    @AfterEach
    void tearDown() {
        processingPool.shutdown();
        sessionPool.shutdown();
    }

    @Test
    void concurrentChunksNeverOverlapJobsOfOneSession() throws InterruptedException {
        RecordingResultSink sink = new RecordingResultSink();
        StreamingSession session = registry.open(sink);
        session.configure(null, "ar");

        int writers = 8;
        int chunksPerWriter = 10;
        ExecutorService clients = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        for (int w = 0; w < writers; w++) {
            clients.execute(() -> {
                try {
                    start.await();
                    for (int i = 0; i < chunksPerWriter; i++) {
                        session.appendChunk(TestAudio.tone(800));
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }
        start.countDown();
        clients.shutdown();
        assertThat(clients.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        session.flush();

        await().atMost(10, TimeUnit.SECONDS)
                .until(() -> !sink.ofType(FinalMessage.class).isEmpty());

        assertThat(engine.maxConcurrentCalls()).isEqualTo(1);
        assertThat(sink.ofType(ErrorMessage.class)).isEmpty();
        int decodedBytes = decoder.decodedSizes.stream().mapToInt(Integer::intValue).sum();
        assertThat(decodedBytes).isEqualTo(writers * chunksPerWriter * 800);
    }

    @Test
    void saturatedPoolDelaysButNeverFailsJobs() {
        List<RecordingResultSink> sinks = new ArrayList<>();
        for (int i = 0; i < 2; i++) {
            RecordingResultSink sink = new RecordingResultSink();
            sinks.add(sink);
            StreamingSession session = registry.open(sink);
            session.configure(null, "ar");
            for (int c = 0; c < 4; c++) {
                session.appendChunk(TestAudio.tone(THRESHOLD));
            }
            session.flush();
        }

        await().atMost(10, TimeUnit.SECONDS)
                .until(() -> sinks.stream().allMatch(s -> !s.ofType(FinalMessage.class).isEmpty()));

        for (RecordingResultSink sink : sinks) {
            assertThat(sink.ofType(ErrorMessage.class)).isEmpty();
            assertThat(sink.last(FinalMessage.class).originalText()).isEqualTo("hello world");
        }
        double recordedJobs = meters.find("livetranslate.jobs").counters().stream()
                .mapToDouble(c -> c.count()).sum();
        assertThat(recordedJobs).isEqualTo(decoder.decodedSizes.size());
        assertThat(registry.count()).isEqualTo(2);
    }
}
