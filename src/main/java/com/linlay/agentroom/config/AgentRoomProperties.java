package com.linlay.agentroom.config;

import com.linlay.agentroom.agent.DispatchPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/* agent definitions, e.g.
```yaml
agent:
  default-agent: Architect
  agents:
    Coder:
      provider: openai
      model: gpt-4o
      api-key-env: OPENAI_API_KEY
      system-prompt: You are a coder
```
*/

@Validated
@ConfigurationProperties(prefix = "agent")
public class AgentRoomProperties {

    private String defaultAgent = "Architect";
    private DispatchPolicy dispatchPolicy = DispatchPolicy.ALL_MENTIONS;
    private Map<String, AgentConfig> agents = new LinkedHashMap<>();
    private ContextConfig context = new ContextConfig();

    public String getDefaultAgent() {
        return defaultAgent;
    }

    public void setDefaultAgent(String defaultAgent) {
        this.defaultAgent = defaultAgent;
    }

    public DispatchPolicy getDispatchPolicy() {
        return dispatchPolicy;
    }

    public void setDispatchPolicy(DispatchPolicy dispatchPolicy) {
        this.dispatchPolicy = dispatchPolicy == null ? DispatchPolicy.ALL_MENTIONS : dispatchPolicy;
    }

    public Map<String, AgentConfig> getAgents() {
        return agents;
    }

    public void setAgents(Map<String, AgentConfig> agents) {
        this.agents = agents == null ? new LinkedHashMap<>() : agents;
    }

    public ContextConfig getContext() {
        return context;
    }

    public void setContext(ContextConfig context) {
        this.context = context == null ? new ContextConfig() : context;
    }

    public static class AgentConfig {
        private String provider;
        private String model;
        private String apiKeyEnv;
        private String systemPrompt = "";
        private double temperature = 0.7;
        private int maxTokens = 4096;
        private String baseUrl;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }

        public String getSystemPrompt() {
            return systemPrompt;
        }

        public void setSystemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }

    public static class ContextConfig {
        private int preserveFirstN = 0;
        private int historyLimit = 50;

        public int getPreserveFirstN() {
            return preserveFirstN;
        }

        public void setPreserveFirstN(int preserveFirstN) {
            this.preserveFirstN = Math.max(0, preserveFirstN);
        }

        public int getHistoryLimit() {
            return historyLimit;
        }

        public void setHistoryLimit(int historyLimit) {
            this.historyLimit = historyLimit > 0 ? historyLimit : 50;
        }
    }
}
