package com.linlay.agentroom.provider;

import org.springframework.http.HttpHeaders;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Masks credentials in provider traffic logs and in API key displays.
 * <p>
 * Covers Authorization / x-api-key style headers, JSON secret fields and bearer tokens.
 * Stateless.
 */
public final class LlmLogSanitizer {

    private static final Pattern JSON_SECRET_VALUE_PATTERN = Pattern.compile(
            "(?i)(\"(?:authorization|api[_-]?key|access[_-]?token|token|secret|password)\"\\s*:\\s*)\"([^\"]*)\""
    );
    private static final Pattern BEARER_TOKEN_PATTERN = Pattern.compile("(?i)(Bearer\\s+)[A-Za-z0-9._\\-+/=]+");
    private static final int KEY_MASK_THRESHOLD = 8;
    private static final int KEY_VISIBLE_SUFFIX = 4;

    private LlmLogSanitizer() {
    }

    public static HttpHeaders maskHeaders(HttpHeaders headers, boolean maskSensitive) {
        HttpHeaders safeHeaders = new HttpHeaders();
        if (headers == null) {
            return safeHeaders;
        }
        safeHeaders.putAll(headers);
        if (!maskSensitive) {
            return safeHeaders;
        }
        for (String key : List.of(HttpHeaders.AUTHORIZATION, "x-api-key", "x-goog-api-key", "Api-Key")) {
            if (safeHeaders.containsKey(key)) {
                safeHeaders.set(key, "***");
            }
        }
        return safeHeaders;
    }

    public static String maskText(String text, boolean maskSensitive) {
        if (text == null || text.isEmpty() || !maskSensitive) {
            return text == null ? "" : text;
        }
        String masked = JSON_SECRET_VALUE_PATTERN.matcher(text).replaceAll("$1\"***\"");
        return BEARER_TOKEN_PATTERN.matcher(masked).replaceAll("$1***");
    }

    public static String maskApiKey(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return "(none)";
        }
        if (apiKey.length() <= KEY_MASK_THRESHOLD) {
            return "****";
        }
        return "****" + apiKey.substring(apiKey.length() - KEY_VISIBLE_SUFFIX);
    }
}
