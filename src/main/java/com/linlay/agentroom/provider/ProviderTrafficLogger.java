package com.linlay.agentroom.provider;

import com.linlay.agentroom.config.LlmInteractionLogProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Logs provider calls made through both the blocking and the reactive HTTP client: one info line
 * per exchange (method, url, status, elapsed), masked headers and request body at debug.
 * Response bodies are never read so streamed replies stay untouched.
 */
public class ProviderTrafficLogger implements ClientHttpRequestInterceptor, ExchangeFilterFunction {

    private static final Logger log = LoggerFactory.getLogger(ProviderTrafficLogger.class);

    private final boolean maskSensitive;
    private final int maxBodyChars;

    public ProviderTrafficLogger(LlmInteractionLogProperties properties) {
        this.maskSensitive = properties.isMaskSensitive();
        this.maxBodyChars = Math.max(0, properties.getMaxBodyChars());
    }

    @Override
    public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution)
            throws IOException {
        if (log.isDebugEnabled()) {
            log.debug("[provider-http] {} {} headers={}", request.getMethod(), request.getURI(),
                    LlmLogSanitizer.maskHeaders(request.getHeaders(), maskSensitive));
            log.debug("[provider-http] body:\n{}", bodyExcerpt(new String(body, StandardCharsets.UTF_8)));
        }
        long started = System.nanoTime();
        try {
            ClientHttpResponse response = execution.execute(request, body);
            log.info("[provider-http] {} {} -> {} in {} ms", request.getMethod(), request.getURI(),
                    response.getStatusCode().value(), elapsedMillis(started));
            return response;
        } catch (IOException ex) {
            log.warn("[provider-http] {} {} failed after {} ms: {}", request.getMethod(), request.getURI(),
                    elapsedMillis(started), ex.getMessage());
            throw ex;
        }
    }

    @Override
    public Mono<ClientResponse> filter(ClientRequest request, ExchangeFunction next) {
        if (log.isDebugEnabled()) {
            log.debug("[provider-stream] {} {} headers={}", request.method(), request.url(),
                    LlmLogSanitizer.maskHeaders(request.headers(), maskSensitive));
        }
        return Mono.defer(() -> {
            long started = System.nanoTime();
            return next.exchange(request)
                    .doOnNext(response -> log.info("[provider-stream] {} {} -> {} in {} ms", request.method(),
                            request.url(), response.statusCode().value(), elapsedMillis(started)))
                    .doOnError(ex -> log.warn("[provider-stream] {} {} failed after {} ms: {}", request.method(),
                            request.url(), elapsedMillis(started), ex.getMessage()));
        });
    }

    String bodyExcerpt(String body) {
        String masked = LlmLogSanitizer.maskText(body, maskSensitive);
        if (masked.length() <= maxBodyChars) {
            return masked;
        }
        return masked.substring(0, maxBodyChars) + "...(" + (masked.length() - maxBodyChars) + " more chars)";
    }

    private static long elapsedMillis(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }
}
