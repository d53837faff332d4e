package com.phillippitts.livetranslate.service.translation;

import com.phillippitts.livetranslate.config.properties.TranslationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Languages clients may select, from {@code translation.supported-languages}.
 */
@Component
public class LanguageCatalog {

    private final TranslationProperties props;

    public LanguageCatalog(TranslationProperties props) {
        this.props = props;
    }

    public boolean isSupported(String code) {
        return props.isSupportedLanguage(code);
    }

    /** Code to English display name, in configuration order (e.g. {@code en -> English}). */
    public Map<String, String> displayNames() {
        Map<String, String> names = new LinkedHashMap<>();
        for (String code : props.getSupportedLanguages()) {
            String name = Locale.forLanguageTag(code).getDisplayLanguage(Locale.ENGLISH);
            names.put(code, name.isBlank() ? code : name);
        }
        return names;
    }
}
