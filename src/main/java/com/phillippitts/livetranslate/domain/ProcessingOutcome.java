package com.phillippitts.livetranslate.domain;

import java.util.Objects;

/**
 * Typed result of a {@link ProcessingJob}. Collaborator exceptions never escape a job;
 * they become a {@link Status#FAILED} outcome carrying a reason.
 *
 * @param status             what happened
 * @param kind               interim or final
 * @param submittedBytes     number of buffered bytes the job consumed
 * @param originalText       transcribed text (empty unless SUCCESS, or a final fallback)
 * @param detectedLanguage   language of {@code originalText}
 * @param translatedText     translated text (equals original when translation was skipped or unnecessary)
 * @param targetLanguage     target language at submission time
 * @param translationSkipped true when the language pair had no model
 * @param reason             failure reason, only for FAILED
 */
public record ProcessingOutcome(
        Status status,
        JobKind kind,
        int submittedBytes,
        String originalText,
        String detectedLanguage,
        String translatedText,
        String targetLanguage,
        boolean translationSkipped,
        String reason
) {

    public enum Status {
        SUCCESS,
        NO_AUDIO,
        TOO_SHORT,
        FAILED;

        public String tag() {
            return name().toLowerCase();
        }
    }

    public ProcessingOutcome {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        originalText = originalText == null ? "" : originalText;
        translatedText = translatedText == null ? "" : translatedText;
    }

    public static ProcessingOutcome success(ProcessingJob job, TranscriptionResult transcription,
                                            TranslationResult translation) {
        return new ProcessingOutcome(Status.SUCCESS, job.kind(), job.size(), transcription.text(),
                transcription.detectedLanguage(), translation.text(), job.config().targetLanguage(),
                translation.skipped(), null);
    }

    public static ProcessingOutcome noAudio(ProcessingJob job) {
        return empty(Status.NO_AUDIO, job, null);
    }

    public static ProcessingOutcome tooShort(ProcessingJob job) {
        return empty(Status.TOO_SHORT, job, null);
    }

    public static ProcessingOutcome failed(ProcessingJob job, String reason) {
        return empty(Status.FAILED, job, reason == null ? "processing failed" : reason);
    }

    private static ProcessingOutcome empty(Status status, ProcessingJob job, String reason) {
        String language = job.config().hasSourceHint()
                ? job.config().sourceLanguage()
                : TranscriptionResult.UNKNOWN_LANGUAGE;
        return new ProcessingOutcome(status, job.kind(), job.size(), "", language, "",
                job.config().targetLanguage(), false, reason);
    }

    /** Replaces the text of this outcome with a fallback, keeping status and byte accounting. */
    public ProcessingOutcome withFallback(PartialTranscript fallback) {
        return new ProcessingOutcome(status, kind, submittedBytes, fallback.text(), fallback.detectedLanguage(),
                fallback.translatedText(), targetLanguage, fallback.translationSkipped(), reason);
    }

    public boolean hasText() {
        return status == Status.SUCCESS && !originalText.isBlank();
    }
}
