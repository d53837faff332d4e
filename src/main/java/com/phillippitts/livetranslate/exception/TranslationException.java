package com.phillippitts.livetranslate.exception;

/**
 * Thrown when the translation service fails (HTTP error, timeout, unreadable response).
 */
public class TranslationException extends LiveTranslateException {

    private final String sourceLanguage;
    private final String targetLanguage;

    public TranslationException(String message, String sourceLanguage, String targetLanguage) {
        super(message + " (" + sourceLanguage + "->" + targetLanguage + ")");
        this.sourceLanguage = sourceLanguage;
        this.targetLanguage = targetLanguage;
    }

    public TranslationException(String message, String sourceLanguage, String targetLanguage, Throwable cause) {
        super(message + " (" + sourceLanguage + "->" + targetLanguage + ")", cause);
        this.sourceLanguage = sourceLanguage;
        this.targetLanguage = targetLanguage;
    }

    public String getSourceLanguage() {
        return sourceLanguage;
    }

    public String getTargetLanguage() {
        return targetLanguage;
    }
}
