package com.phillippitts.livetranslate.exception;

/**
 * Thrown when the whisper.cpp model or binary cannot be found at the configured path.
 * This is a fatal error that prevents the application from starting.
 */
public class ModelNotFoundException extends LiveTranslateException {

    private final String modelPath;

    public ModelNotFoundException(String modelPath) {
        super("STT model not found at path: " + modelPath);
        this.modelPath = modelPath;
    }

    public ModelNotFoundException(String modelPath, Throwable cause) {
        super("STT model not found at path: " + modelPath, cause);
        this.modelPath = modelPath;
    }

    public String getModelPath() {
        return modelPath;
    }
}
