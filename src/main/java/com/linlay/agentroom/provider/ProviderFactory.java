package com.linlay.agentroom.provider;

import com.linlay.agentroom.agent.AgentProfile;
import com.linlay.agentroom.config.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.anthropic.AnthropicChatOptions;
import org.springframework.ai.anthropic.api.AnthropicApi;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * Builds a {@link ChatProvider} for an agent profile. Gemini and Ollama are reached through their
 * OpenAI-compatible endpoints.
 */
@Component
public class ProviderFactory {

    private static final Logger log = LoggerFactory.getLogger(ProviderFactory.class);

    static final String OPENAI = "openai";
    static final String ANTHROPIC = "anthropic";
    static final String GEMINI = "gemini";
    static final String OLLAMA = "ollama";
    static final List<String> SUPPORTED = List.of(GEMINI, ANTHROPIC, OPENAI, OLLAMA);

    private static final String OPENAI_BASE_URL = "https://api.openai.com";
    private static final String GEMINI_BASE_URL = "https://generativelanguage.googleapis.com/v1beta/openai";
    private static final String GEMINI_COMPLETIONS_PATH = "/chat/completions";
    private static final String OLLAMA_BASE_URL = "http://localhost:11434";
    private static final String ANTHROPIC_BASE_URL = "https://api.anthropic.com";
    private static final String OLLAMA_PLACEHOLDER_KEY = "ollama";

    private final RestClient.Builder restClientBuilder;
    private final WebClient.Builder webClientBuilder;

    public ProviderFactory() {
        this(RestClient.builder(), WebClient.builder());
    }

    @Autowired
    public ProviderFactory(RestClient.Builder providerRestClientBuilder, WebClient.Builder providerWebClientBuilder) {
        this.restClientBuilder = providerRestClientBuilder;
        this.webClientBuilder = providerWebClientBuilder;
    }

    public ChatProvider create(AgentProfile profile, String apiKey) {
        String providerId = profile.providerId();
        if (!SUPPORTED.contains(providerId)) {
            throw new UnknownProviderException(providerId, SUPPORTED);
        }
        if (!StringUtils.hasText(profile.modelId())) {
            throw new ConfigurationException("Missing model for agent '" + profile.name() + "'");
        }
        if (requiresApiKey(providerId) && !StringUtils.hasText(apiKey)) {
            throw new ConfigurationException("Missing api key for agent '" + profile.name() + "' (" + providerId + ")");
        }

        ChatModel chatModel = switch (providerId) {
            case ANTHROPIC -> anthropicModel(profile, apiKey);
            case GEMINI -> openAiCompatibleModel(profile, apiKey, GEMINI_BASE_URL, GEMINI_COMPLETIONS_PATH);
            case OLLAMA -> openAiCompatibleModel(profile,
                    StringUtils.hasText(apiKey) ? apiKey : OLLAMA_PLACEHOLDER_KEY, OLLAMA_BASE_URL, null);
            default -> openAiCompatibleModel(profile, apiKey, OPENAI_BASE_URL, null);
        };
        log.info("Created provider handle for agent '{}' ({}/{}, key {})",
                profile.name(), providerId, profile.modelId(), LlmLogSanitizer.maskApiKey(apiKey));
        return new SpringAiChatProvider(providerId, profile.modelId(), chatModel);
    }

    /**
     * Local runtimes accept anonymous requests.
     */
    public static boolean requiresApiKey(String providerId) {
        return !OLLAMA.equals(providerId);
    }

    private ChatModel openAiCompatibleModel(
            AgentProfile profile,
            String apiKey,
            String defaultBaseUrl,
            String completionsPath
    ) {
        OpenAiApi.Builder apiBuilder = OpenAiApi.builder()
                .baseUrl(StringUtils.hasText(profile.baseUrl()) ? profile.baseUrl() : defaultBaseUrl)
                .apiKey(apiKey)
                .restClientBuilder(restClientBuilder)
                .webClientBuilder(webClientBuilder);
        if (completionsPath != null && !StringUtils.hasText(profile.baseUrl())) {
            apiBuilder.completionsPath(completionsPath);
        }

        OpenAiChatOptions options = OpenAiChatOptions.builder()
                .model(profile.modelId())
                .temperature(profile.temperature())
                .maxTokens(profile.maxTokens())
                .build();

        return OpenAiChatModel.builder()
                .openAiApi(apiBuilder.build())
                .defaultOptions(options)
                .build();
    }

    private ChatModel anthropicModel(AgentProfile profile, String apiKey) {
        AnthropicApi api = AnthropicApi.builder()
                .baseUrl(StringUtils.hasText(profile.baseUrl()) ? profile.baseUrl() : ANTHROPIC_BASE_URL)
                .apiKey(apiKey)
                .restClientBuilder(restClientBuilder)
                .webClientBuilder(webClientBuilder)
                .build();

        AnthropicChatOptions options = AnthropicChatOptions.builder()
                .model(profile.modelId())
                .temperature(profile.temperature())
                .maxTokens(profile.maxTokens())
                .build();

        return AnthropicChatModel.builder()
                .anthropicApi(api)
                .defaultOptions(options)
                .build();
    }
}
