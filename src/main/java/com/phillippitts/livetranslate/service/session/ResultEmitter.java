package com.phillippitts.livetranslate.service.session;

import com.phillippitts.livetranslate.domain.PartialTranscript;
import com.phillippitts.livetranslate.domain.ProcessingOutcome;
import com.phillippitts.livetranslate.domain.SessionConfig;
import com.phillippitts.livetranslate.domain.message.ConfigAckMessage;
import com.phillippitts.livetranslate.domain.message.ErrorMessage;
import com.phillippitts.livetranslate.domain.message.FinalMessage;
import com.phillippitts.livetranslate.domain.message.InterimMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Maps session events and job outcomes to exactly one outbound message each and writes them to
 * the session's {@link ResultSink}.
 */
public class ResultEmitter {

    private static final Logger LOG = LogManager.getLogger(ResultEmitter.class);

    private final ResultSink sink;
    private final boolean includeInterimTranslation;

    public ResultEmitter(ResultSink sink, boolean includeInterimTranslation) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.includeInterimTranslation = includeInterimTranslation;
    }

    public void configAck(SessionConfig config) {
        sink.send(ConfigAckMessage.of(config));
    }

    public void interim(ProcessingOutcome outcome) {
        InterimMessage message = includeInterimTranslation
                ? new InterimMessage(outcome.originalText(), outcome.detectedLanguage(), outcome.translatedText(),
                        outcome.targetLanguage(), outcome.translationSkipped())
                : InterimMessage.untranslated(outcome.originalText(), outcome.detectedLanguage());
        sink.send(message);
    }

    public void fin(ProcessingOutcome outcome) {
        sink.send(new FinalMessage(outcome.originalText(), outcome.translatedText(), outcome.detectedLanguage(),
                outcome.targetLanguage(), outcome.translationSkipped()));
    }

    /** Final answered from stored text, without a processing job. */
    public void fin(PartialTranscript partial) {
        sink.send(new FinalMessage(partial.text(), partial.translatedText(), partial.detectedLanguage(),
                partial.targetLanguage(), partial.translationSkipped()));
    }

    public void error(String detail) {
        LOG.debug("Sending error: {}", detail);
        sink.send(new ErrorMessage(detail));
    }
}
