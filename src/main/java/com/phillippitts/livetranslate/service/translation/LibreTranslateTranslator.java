package com.phillippitts.livetranslate.service.translation;

import com.phillippitts.livetranslate.config.properties.TranslationProperties;
import com.phillippitts.livetranslate.exception.TranslationException;
import com.phillippitts.livetranslate.exception.UnsupportedLanguagePairException;
import com.phillippitts.livetranslate.service.events.EngineEventPublisher;
import com.phillippitts.livetranslate.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link Translator} for a LibreTranslate-compatible HTTP API.
 *
 * <p>Request per sentence: {@code POST /translate} with
 * {@code {"q": ..., "source": ..., "target": ..., "format": "text", "api_key": ...}}; the response
 * carries {@code translatedText}. Sentences are translated one by one and the non-blank results
 * joined with a space. If every sentence comes back blank the original text is returned.
 *
 * <p>Pairs outside {@code translation.supported-pairs} are rejected up front with
 * {@link UnsupportedLanguagePairException} without calling the service.
 */
@Component
public class LibreTranslateTranslator implements Translator {

    private static final Logger LOG = LogManager.getLogger(LibreTranslateTranslator.class);
    private static final String ENGINE = "translation";

    private final RestClient client;
    private final TranslationProperties props;
    private final ApplicationEventPublisher publisher;

    public LibreTranslateTranslator(@Qualifier("translationRestClient") RestClient client,
                                    TranslationProperties props,
                                    ApplicationEventPublisher publisher) {
        this.client = Objects.requireNonNull(client, "client");
        this.props = Objects.requireNonNull(props, "props");
        this.publisher = publisher;
    }

    @Override
    public boolean supports(String sourceLanguage, String targetLanguage) {
        return props.isSupportedPair(sourceLanguage, targetLanguage);
    }

    @Override
    public String translate(String text, String sourceLanguage, String targetLanguage) {
        if (!supports(sourceLanguage, targetLanguage)) {
            throw new UnsupportedLanguagePairException(sourceLanguage, targetLanguage);
        }
        if (text == null || text.isBlank()) {
            return "";
        }
        long start = System.nanoTime();
        List<String> translated = new ArrayList<>();
        for (String sentence : SentenceSplitter.split(text)) {
            String t = translateSentence(sentence, sourceLanguage, targetLanguage);
            if (!t.isBlank()) {
                translated.add(t.trim());
            }
        }
        LOG.debug("Translated {} chars {}->{} in {} ms", text.length(), sourceLanguage, targetLanguage,
                TimeUtils.elapsedMillis(start));
        return translated.isEmpty() ? text : String.join(" ", translated);
    }

    private String translateSentence(String sentence, String source, String target) {
        JSONObject body = new JSONObject()
                .put("q", sentence)
                .put("source", source)
                .put("target", target)
                .put("format", "text");
        if (props.getApiKey() != null && !props.getApiKey().isBlank()) {
            body.put("api_key", props.getApiKey());
        }
        try {
            String response = client.post()
                    .uri("/translate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(body.toString())
                    .retrieve()
                    .body(String.class);
            if (response == null || response.isBlank()) {
                throw new TranslationException("Empty response from translation service", source, target);
            }
            return new JSONObject(response).optString("translatedText", "");
        } catch (RestClientException | JSONException e) {
            EngineEventPublisher.publishFailure(publisher, ENGINE, "translate failure", e,
                    Map.of("baseUrl", props.getBaseUrl(), "pair", source + "-" + target));
            throw new TranslationException("Translation request failed: " + e.getMessage(), source, target, e);
        }
    }
}
