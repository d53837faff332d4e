package com.phillippitts.livetranslate.service.stt.whisper;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Parses the JSON written by whisper.cpp ({@code -oj}).
 *
 * <p>Current whisper.cpp layout:
 * <pre>
 * {
 *   "result": { "language": "en" },
 *   "transcription": [ { "text": " Hello" }, { "text": " world." } ]
 * }
 * </pre>
 * Older builds and wrappers emit a top-level {@code text} or a {@code segments} array; both are
 * accepted as well.
 */
final class WhisperJsonParser {

    private WhisperJsonParser() {}

    /**
     * Joins all segment texts with single spaces.
     *
     * @param json raw JSON; blank input yields ""
     * @throws JSONException if the JSON is not an object
     */
    static String extractText(String json) {
        if (json == null || json.isBlank()) {
            return "";
        }
        JSONObject obj = new JSONObject(json);
        JSONArray segments = obj.optJSONArray("transcription");
        if (segments == null) {
            segments = obj.optJSONArray("segments");
        }
        if (segments != null) {
            return joinSegments(segments);
        }
        return obj.optString("text", "").trim();
    }

    /**
     * Language reported by whisper.cpp, or null when absent.
     *
     * @throws JSONException if the JSON is not an object
     */
    static String extractLanguage(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        JSONObject obj = new JSONObject(json);
        JSONObject result = obj.optJSONObject("result");
        String lang = result != null ? result.optString("language", "") : obj.optString("language", "");
        return lang.isBlank() ? null : lang.trim();
    }

    private static String joinSegments(JSONArray segments) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < segments.length(); i++) {
            JSONObject seg = segments.optJSONObject(i);
            if (seg == null) {
                continue;
            }
            String t = seg.optString("text", "").trim();
            if (t.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(t);
        }
        return sb.toString();
    }
}
