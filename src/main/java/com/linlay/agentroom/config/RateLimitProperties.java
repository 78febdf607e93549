package com.linlay.agentroom.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "agent.rate-limit")
public class RateLimitProperties {

    private boolean autoRetry = true;
    private int maxRetries = 3;
    private double backoffMultiplier = 2.0;
    private Duration baseDelay = Duration.ofSeconds(1);
    private Map<String, Limit> providers = new LinkedHashMap<>();

    public static Map<String, Limit> defaultLimits() {
        Map<String, Limit> defaults = new LinkedHashMap<>();
        defaults.put("gemini", new Limit(100, Duration.ofSeconds(60)));
        defaults.put("anthropic", new Limit(50, Duration.ofSeconds(60)));
        defaults.put("openai", new Limit(60, Duration.ofSeconds(60)));
        // local runtime
        defaults.put("ollama", new Limit(1000, Duration.ofSeconds(60)));
        return defaults;
    }

    /**
     * Built-in defaults overlaid with the configured entries.
     */
    public Map<String, Limit> effectiveLimits() {
        Map<String, Limit> merged = defaultLimits();
        providers.forEach((key, limit) -> {
            if (key != null && !key.isBlank() && limit != null) {
                merged.put(key.trim(), limit);
            }
        });
        return merged;
    }

    public boolean isAutoRetry() {
        return autoRetry;
    }

    public void setAutoRetry(boolean autoRetry) {
        this.autoRetry = autoRetry;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = Math.max(0, maxRetries);
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier > 0 ? backoffMultiplier : 2.0;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public void setBaseDelay(Duration baseDelay) {
        this.baseDelay = baseDelay == null || baseDelay.isNegative() ? Duration.ofSeconds(1) : baseDelay;
    }

    public Map<String, Limit> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, Limit> providers) {
        this.providers = providers == null ? new LinkedHashMap<>() : providers;
    }

    public static class Limit {
        private int limit = 100;
        private Duration window = Duration.ofSeconds(60);

        public Limit() {
        }

        public Limit(int limit, Duration window) {
            this.limit = limit;
            this.window = window;
        }

        public int getLimit() {
            return limit;
        }

        public void setLimit(int limit) {
            this.limit = limit;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public double refillRatePerSecond() {
            double seconds = window == null ? 0 : window.toMillis() / 1000.0;
            if (limit <= 0 || seconds <= 0) {
                throw new ConfigurationException("Invalid rate limit: limit=" + limit + ", window=" + window);
            }
            return limit / seconds;
        }
    }
}
