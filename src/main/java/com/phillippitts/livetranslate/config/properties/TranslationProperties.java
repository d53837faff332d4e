package com.phillippitts.livetranslate.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Translation service settings, bound from {@code translation.*}.
 *
 * <p>Example application.properties:
 * <pre>
 * translation.base-url=http://localhost:5000
 * translation.api-key=
 * translation.timeout-ms=5000
 * translation.supported-languages=en,ar
 * translation.supported-pairs=en-ar,ar-en
 * </pre>
 */
@ConfigurationProperties(prefix = "translation")
@Validated
public class TranslationProperties {

    @NotBlank(message = "Translation base URL must not be blank")
    private String baseUrl = "http://localhost:5000";

    /** Optional LibreTranslate API key. */
    private String apiKey;

    @Positive(message = "Translation timeout must be positive")
    private int timeoutMs = 5000;

    @NotEmpty(message = "At least one supported language is required")
    private List<String> supportedLanguages = new ArrayList<>(List.of("en", "ar"));

    /** Language pairs with a model, written {@code source-target}. */
    private List<String> supportedPairs = new ArrayList<>(List.of("en-ar", "ar-en"));

    public boolean isSupportedLanguage(String code) {
        return code != null && supportedLanguages.contains(code.toLowerCase(Locale.ROOT));
    }

    public boolean isSupportedPair(String source, String target) {
        if (source == null || target == null) {
            return false;
        }
        return supportedPairs.contains(source.toLowerCase(Locale.ROOT) + "-" + target.toLowerCase(Locale.ROOT));
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(int timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public List<String> getSupportedLanguages() {
        return supportedLanguages;
    }

    public void setSupportedLanguages(List<String> supportedLanguages) {
        this.supportedLanguages = supportedLanguages;
    }

    public List<String> getSupportedPairs() {
        return supportedPairs;
    }

    public void setSupportedPairs(List<String> supportedPairs) {
        this.supportedPairs = supportedPairs;
    }
}
