package com.linlay.agentroom.context;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Known context window sizes. The first family name contained in the model id wins, so more
 * specific names are listed first.
 */
public final class ModelContextWindows {

    public static final int FALLBACK = 4096;

    private static final Map<String, Integer> WINDOWS = new LinkedHashMap<>();

    static {
        WINDOWS.put("gemini-1.5-pro", 2_000_000);
        WINDOWS.put("gemini-1.5-flash", 1_000_000);
        WINDOWS.put("gemini-1.0-pro", 32_768);
        WINDOWS.put("claude-3", 200_000);
        WINDOWS.put("claude-2", 100_000);
        WINDOWS.put("gpt-4o", 128_000);
        WINDOWS.put("gpt-4-turbo", 128_000);
        WINDOWS.put("gpt-4", 8_192);
        WINDOWS.put("gpt-3.5-turbo", 16_385);
    }

    private ModelContextWindows() {
    }

    public static int maxContext(String modelId) {
        if (modelId == null || modelId.isBlank()) {
            return FALLBACK;
        }
        String normalized = modelId.trim().toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Integer> entry : WINDOWS.entrySet()) {
            if (normalized.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return FALLBACK;
    }
}
