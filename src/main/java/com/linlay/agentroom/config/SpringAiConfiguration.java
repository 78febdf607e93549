package com.linlay.agentroom.config;

import com.linlay.agentroom.provider.ProviderTrafficLogger;
import io.netty.handler.logging.LogLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.client.RestClient;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.transport.logging.AdvancedByteBufFormat;

import java.time.Duration;

/**
 * HTTP client builders handed to every Spring AI provider handle.
 */
@Configuration
public class SpringAiConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SpringAiConfiguration.class);
    private static final String WIRETAP_LOGGER = "com.linlay.agentroom.provider.wiretap";

    @Bean
    public ProviderTrafficLogger providerTrafficLogger(LlmInteractionLogProperties logProperties) {
        return new ProviderTrafficLogger(logProperties);
    }

    @Bean
    public RestClient.Builder providerRestClientBuilder(
            LlmInteractionLogProperties logProperties,
            ProviderTrafficLogger providerTrafficLogger) {
        RestClient.Builder builder = RestClient.builder();
        return logProperties.isEnabled() ? builder.requestInterceptor(providerTrafficLogger) : builder;
    }

    @Bean(destroyMethod = "dispose")
    public ConnectionProvider providerConnectionProvider() {
        return ConnectionProvider.builder("provider-pool")
                .maxIdleTime(Duration.ofSeconds(30))
                .maxLifeTime(Duration.ofMinutes(5))
                .evictInBackground(Duration.ofSeconds(30))
                .build();
    }

    @Bean
    public WebClient.Builder providerWebClientBuilder(
            LlmInteractionLogProperties logProperties,
            ConnectionProvider providerConnectionProvider,
            ProviderTrafficLogger providerTrafficLogger) {
        HttpClient httpClient = HttpClient.create(providerConnectionProvider);
        // raw frames are never masked
        if (logProperties.isEnabled() && !logProperties.isMaskSensitive()) {
            log.warn("Provider traffic logging runs unmasked; api keys will appear in '{}'", WIRETAP_LOGGER);
            httpClient = httpClient.wiretap(WIRETAP_LOGGER, LogLevel.DEBUG, AdvancedByteBufFormat.TEXTUAL);
        }
        WebClient.Builder builder = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient));
        return logProperties.isEnabled() ? builder.filter(providerTrafficLogger) : builder;
    }
}
