package com.airouter.provider;

import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Maps whatever a provider call failed with onto {@link ProviderErrorType}.
 */
public final class ProviderErrorClassifier {

    private static final int MAX_DETAIL_LENGTH = 200;

    // Upper bound for a parsed Retry-After hint, well inside what Instant arithmetic accepts
    static final Duration MAX_RETRY_AFTER = Duration.ofDays(1);

    // Throttling signals some vendors send with a status other than 429
    private static final List<String> RATE_LIMIT_MARKERS = List.of(
            "rate_limit_error", "rate_limit_exceeded", "resource_exhausted", "too many requests");

    private ProviderErrorClassifier() {
    }

    public static ProviderException classify(Throwable error) {
        if (error instanceof ProviderException providerException) {
            return providerException;
        }
        if (error instanceof TimeoutException) {
            return new ProviderException(ProviderErrorType.TIMEOUT, "Timed out waiting for response", error);
        }
        if (error instanceof WebClientResponseException responseException) {
            return classifyResponse(responseException);
        }
        if (error instanceof WebClientRequestException requestException) {
            Throwable root = requestException.getMostSpecificCause();
            if (root instanceof TimeoutException) {
                return new ProviderException(ProviderErrorType.TIMEOUT, "Timed out waiting for response", error);
            }
            return new ProviderException(ProviderErrorType.TRANSPORT,
                    "Connection failed: " + describe(root), error);
        }
        return new ProviderException(ProviderErrorType.TRANSPORT, describe(error), error);
    }

    /**
     * Error embedded in an HTTP 200 body, as OpenAI-compatible gateways sometimes do.
     */
    public static ProviderException fromErrorBody(String code, String message) {
        String detail = "Provider error" + (code != null ? " " + code : "") + ": " + truncate(message);
        if ("401".equals(code) || "403".equals(code) || isAuthenticationSignal(code)) {
            return new ProviderException(ProviderErrorType.AUTHENTICATION, detail);
        }
        if ("429".equals(code) || isRateLimitSignal(code) || isRateLimitSignal(message)) {
            return new ProviderException(ProviderErrorType.RATE_LIMIT, detail);
        }
        return new ProviderException(ProviderErrorType.TRANSPORT, detail);
    }

    private static ProviderException classifyResponse(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        String body = e.getResponseBodyAsString();
        String detail = "HTTP " + status + (body.isBlank() ? "" : ": " + truncate(body));

        if (status == 401 || status == 403) {
            return new ProviderException(ProviderErrorType.AUTHENTICATION, detail, e);
        }
        if (status == 429 || isRateLimitSignal(body)) {
            return new ProviderException(ProviderErrorType.RATE_LIMIT, detail,
                    parseRetryAfter(e.getHeaders()), e);
        }
        return new ProviderException(ProviderErrorType.TRANSPORT, detail, e);
    }

    static boolean isRateLimitSignal(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return RATE_LIMIT_MARKERS.stream().anyMatch(lower::contains);
    }

    private static boolean isAuthenticationSignal(String code) {
        if (code == null) {
            return false;
        }
        String lower = code.toLowerCase(Locale.ROOT);
        return lower.contains("authentication") || lower.contains("permission") || lower.contains("invalid_api_key");
    }

    // Only the delta-seconds form; HTTP-date values fall back to the configured cooldown
    static Duration parseRetryAfter(HttpHeaders headers) {
        String value = headers != null ? headers.getFirst(HttpHeaders.RETRY_AFTER) : null;
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty() || !trimmed.chars().allMatch(Character::isDigit)) {
            return null;
        }
        // anything longer than 9 digits is past the ceiling and may not even fit in a long
        long seconds = trimmed.length() > 9 ? Long.MAX_VALUE : Long.parseLong(trimmed);
        if (seconds == 0) {
            return null;
        }
        return seconds >= MAX_RETRY_AFTER.getSeconds() ? MAX_RETRY_AFTER : Duration.ofSeconds(seconds);
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null ? truncate(message) : error.getClass().getSimpleName();
    }

    static String truncate(String value) {
        if (value == null) {
            return "";
        }
        String singleLine = value.replaceAll("\\s+", " ").trim();
        return singleLine.length() <= MAX_DETAIL_LENGTH ? singleLine : singleLine.substring(0, MAX_DETAIL_LENGTH) + "...";
    }
}
