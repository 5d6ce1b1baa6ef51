package com.payment.observability.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.observability.core.exception.AiServiceException;
import com.payment.observability.core.exception.NormalizationException;
import com.payment.observability.core.exception.NormalizationTimeoutException;
import com.payment.observability.core.exception.RateLimitExceededException;
import com.payment.observability.core.exception.ValidationException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.net.SocketTimeoutException;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Structured extraction with a primary and an optional secondary model.
 * <p>
 * Each model path runs under its own retry (transient failures only: HTTP 429, HTTP 5xx, I/O and
 * timeouts) wrapped in a circuit breaker. When the primary path gives up, the same request goes to the
 * secondary model. Output that parses or validates badly is terminal and never retried or failed over.
 */
@Slf4j
public class StructuredExtractionClient {

    static final String PRIMARY_INSTANCE = "llm-primary";
    static final String SECONDARY_INSTANCE = "llm-secondary";

    private final ChatModelClient primary;
    private final ChatModelClient secondary;
    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final AiRetrySettings settings;

    private final Retry primaryRetry;
    private final Retry secondaryRetry;
    private final CircuitBreaker primaryCircuitBreaker;
    private final CircuitBreaker secondaryCircuitBreaker;

    public StructuredExtractionClient(ChatModelClient primary,
                                      ChatModelClient secondary,
                                      RetryRegistry retryRegistry,
                                      CircuitBreakerRegistry circuitBreakerRegistry,
                                      ObjectMapper objectMapper,
                                      Validator validator,
                                      AiRetrySettings settings) {
        this.primary = primary;
        this.secondary = secondary;
        this.objectMapper = objectMapper;
        this.validator = validator;
        this.settings = settings;

        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(settings.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        settings.getInitialBackoff().toMillis(),
                        settings.getBackoffMultiplier(),
                        settings.getMaxBackoff().toMillis()))
                .retryOnException(StructuredExtractionClient::isTransient)
                .build();
        this.primaryRetry = retryRegistry.retry(PRIMARY_INSTANCE, retryConfig);
        this.primaryCircuitBreaker = circuitBreakerRegistry.circuitBreaker(PRIMARY_INSTANCE);
        this.secondaryRetry = secondary != null ? retryRegistry.retry(SECONDARY_INSTANCE, retryConfig) : null;
        this.secondaryCircuitBreaker = secondary != null ? circuitBreakerRegistry.circuitBreaker(SECONDARY_INSTANCE) : null;

        log.info("Structured extraction configured primaryModel={} secondaryModel={} maxAttempts={} timeoutSeconds={}",
                primary.getModelName(), secondary != null ? secondary.getModelName() : "none",
                settings.getMaxAttempts(), settings.getTimeoutSeconds());
    }

    /**
     * Runs the extraction and maps the model answer onto {@code outputType}.
     *
     * @throws RateLimitExceededException     when the last model path was rate limited
     * @throws NormalizationTimeoutException  when the last model path timed out
     * @throws AiServiceException             for any other model failure
     * @throws ValidationException            when the answer does not fit {@code outputType}
     */
    public <T> ExtractionResult<T> extract(String systemPrompt, String userContent, Class<T> outputType) {
        String content;
        String modelUsed;
        boolean fallbackUsed = false;
        try {
            content = call(primary, primaryRetry, primaryCircuitBreaker, systemPrompt, userContent);
            modelUsed = primary.getModelName();
        } catch (NormalizationException e) {
            throw e;
        } catch (RuntimeException primaryFailure) {
            if (secondary == null) {
                throw translate(primaryFailure, primary.getModelName());
            }
            log.warn("Primary model {} failed ({}), failing over to secondary model {}",
                    primary.getModelName(), primaryFailure.getMessage(), secondary.getModelName());
            try {
                content = call(secondary, secondaryRetry, secondaryCircuitBreaker, systemPrompt, userContent);
            } catch (NormalizationException e) {
                throw e;
            } catch (RuntimeException secondaryFailure) {
                throw translate(secondaryFailure, secondary.getModelName());
            }
            modelUsed = secondary.getModelName();
            fallbackUsed = true;
        }

        T output = parseAndValidate(content, outputType, modelUsed);
        return ExtractionResult.<T>builder()
                .output(output)
                .modelUsed(modelUsed)
                .fallbackUsed(fallbackUsed)
                .build();
    }

    private String call(ChatModelClient model, Retry retry, CircuitBreaker circuitBreaker,
                        String systemPrompt, String userContent) {
        Supplier<String> supplier = () -> model.complete(systemPrompt, userContent);
        Supplier<String> withRetry = Retry.decorateSupplier(retry, supplier);
        Supplier<String> withCb = CircuitBreaker.decorateSupplier(circuitBreaker, withRetry);
        return withCb.get();
    }

    private <T> T parseAndValidate(String content, Class<T> outputType, String modelUsed) {
        T output;
        try {
            output = objectMapper.readValue(stripCodeFence(content), outputType);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Model " + modelUsed + " returned output that does not match "
                    + outputType.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
        if (output == null) {
            throw new ValidationException("Model " + modelUsed + " returned an empty " + outputType.getSimpleName());
        }
        Set<ConstraintViolation<T>> violations = validator.validate(output);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw new ValidationException("Model " + modelUsed + " output failed validation: " + details);
        }
        return output;
    }

    static boolean isTransient(Throwable t) {
        return t instanceof HttpClientErrorException.TooManyRequests
                || t instanceof HttpServerErrorException
                || t instanceof ResourceAccessException;
    }

    private RuntimeException translate(RuntimeException e, String modelName) {
        if (e instanceof HttpClientErrorException.TooManyRequests) {
            HttpClientErrorException tooMany = (HttpClientErrorException) e;
            return new RateLimitExceededException("Model " + modelName + " rate limit exceeded",
                    retryAfterSeconds(tooMany.getResponseHeaders()), e);
        }
        if (isTimeout(e)) {
            return new NormalizationTimeoutException("Model " + modelName + " timed out after "
                    + settings.getTimeoutSeconds() + "s", settings.getTimeoutSeconds(), e);
        }
        if (e instanceof CallNotPermittedException) {
            return new AiServiceException("Circuit breaker open for model " + modelName, e);
        }
        return new AiServiceException("Model " + modelName + " call failed: " + e.getMessage(), e);
    }

    private static boolean isTimeout(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof SocketTimeoutException) return true;
            current = current.getCause();
        }
        return false;
    }

    private static Long retryAfterSeconds(HttpHeaders headers) {
        if (headers == null) return null;
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null || value.isBlank()) return null;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric Retry-After header: {}", value);
            return null;
        }
    }

    private static String stripCodeFence(String content) {
        String trimmed = content.trim();
        if (!trimmed.startsWith("```")) return trimmed;
        int firstNewline = trimmed.indexOf('\n');
        int closing = trimmed.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) return trimmed;
        return trimmed.substring(firstNewline + 1, closing).trim();
    }
}
