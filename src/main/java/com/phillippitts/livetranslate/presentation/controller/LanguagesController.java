package com.phillippitts.livetranslate.presentation.controller;

import com.phillippitts.livetranslate.service.translation.LanguageCatalog;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Lists the languages a client may pass as {@code source_language} or {@code target_language}.
 */
@RestController
@RequestMapping("/api")
class LanguagesController {

    private final LanguageCatalog languages;

    LanguagesController(LanguageCatalog languages) {
        this.languages = languages;
    }

    @GetMapping("/languages")
    ResponseEntity<Map<String, Object>> languages() {
        return ResponseEntity.ok(Map.of("supported_languages", languages.displayNames()));
    }
}
