package com.airouter.service;

import com.airouter.config.RouterProperties;
import com.airouter.model.AttemptOutcome;
import com.airouter.model.GenerationErrorCode;
import com.airouter.model.GenerationModels;
import com.airouter.model.RoutingStrategy;
import com.airouter.model.StatsModels;
import com.airouter.provider.AdapterRegistry;
import com.airouter.provider.ProviderErrorClassifier;
import com.airouter.provider.ProviderErrorType;
import com.airouter.provider.ProviderException;
import com.airouter.provider.ProviderRequest;
import com.airouter.provider.ProviderResponse;
import com.airouter.registry.ProviderConfig;
import com.airouter.registry.ProviderRegistry;
import com.airouter.registry.ProviderState;
import com.airouter.resilience.ProviderCircuitBreaker;
import com.airouter.resilience.ProviderRateLimiter;
import com.airouter.selection.SelectionCursor;
import com.airouter.selection.SelectionStrategyEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class RoutingService {

    private final ProviderRegistry registry;
    private final SelectionStrategyEngine selectionEngine;
    private final AdapterRegistry adapterRegistry;
    private final ProviderCircuitBreaker circuitBreaker;
    private final ProviderRateLimiter rateLimiter;
    private final StatsCollector statsCollector;
    private final RouterProperties properties;
    private final Clock clock;

    /**
     * Runs the fallback loop for one request. Provider failures never surface as errors:
     * the returned Mono always completes with a result, successful or not.
     */
    public Mono<GenerationModels.GenerationResult> generate(GenerationModels.GenerationRequest request) {
        return Mono.defer(() -> {
            RoutingStrategy strategy = request.getStrategy() != null
                    ? request.getStrategy()
                    : properties.getRouting().getDefaultStrategy();
            int budget = attemptBudget(request.getMaxAttempts());
            SelectionCursor cursor = selectionEngine.openCursor(
                    strategy, request.getPreferredProviders(), request.getAllowedProviders());
            Execution execution = new Execution(request, strategy, cursor, budget, System.nanoTime());

            log.info("Routing generation request: strategy={}, budget={}, model={}",
                    strategy.getValue(), budget, request.getModel());

            return attemptNext(execution)
                    .doOnNext(result -> statsCollector.recordRequest(result.isSuccess(), result.getResponseTimeSeconds()))
                    .doOnCancel(() -> log.info("Generation request cancelled after {} completed attempts",
                            execution.attempts.size()));
        });
    }

    public StatsModels.AggregateStats getStats() {
        return statsCollector.getStats();
    }

    public Map<String, StatsModels.HealthSnapshot> getProviderHealth() {
        return statsCollector.getProviderHealth();
    }

    public void resetStats() {
        statsCollector.reset();
    }

    int attemptBudget(Integer requestedMaxAttempts) {
        int requested = requestedMaxAttempts != null && requestedMaxAttempts > 0
                ? requestedMaxAttempts
                : properties.getRouting().getMaxAttemptsCeiling();
        return Math.min(requested, registry.configuredCount());
    }

    private Mono<GenerationModels.GenerationResult> attemptNext(Execution execution) {
        if (execution.attempts.size() >= execution.budget) {
            return Mono.just(exhausted(execution));
        }
        Optional<ProviderState> next = selectionEngine.next(execution.cursor);
        if (next.isEmpty()) {
            return Mono.just(exhausted(execution));
        }

        ProviderState state = next.get();
        ProviderConfig config = state.getConfig();
        ProviderRequest providerRequest = toProviderRequest(execution.request, config);
        int attemptIndex = execution.attempts.size();
        execution.cursor.markAttempted(state.getId());

        if (attemptIndex > 0) {
            log.info("Falling back to provider {} (attempt {}/{})", state.getId(), attemptIndex + 1, execution.budget);
        }

        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();

        return Mono.defer(() -> adapterRegistry.forKind(config.getAdapterKind()).send(config, providerRequest))
                .switchIfEmpty(Mono.error(() -> new ProviderException(ProviderErrorType.TRANSPORT, "Provider returned no response")))
                .timeout(config.getTimeout())
                .map(AttemptResult::success)
                .onErrorResume(e -> Mono.just(AttemptResult.failure(ProviderErrorClassifier.classify(e))))
                .flatMap(result -> {
                    double elapsed = secondsSince(startNanos);
                    if (result.response() != null) {
                        return Mono.just(onSuccess(execution, state, result.response(), startedAt, elapsed, attemptIndex));
                    }
                    onFailure(execution, state, result.error(), startedAt, elapsed, attemptIndex);
                    return attemptNext(execution);
                });
    }

    private GenerationModels.GenerationResult onSuccess(Execution execution,
                                                        ProviderState state,
                                                        ProviderResponse response,
                                                        Instant startedAt,
                                                        double elapsed,
                                                        int attemptIndex) {
        circuitBreaker.recordSuccess(state, elapsed);
        statsCollector.recordAttempt(state.getId(), AttemptOutcome.SUCCESS, elapsed, attemptIndex);
        execution.attempts.add(GenerationModels.AttemptRecord.builder()
                .providerId(state.getId())
                .outcome(AttemptOutcome.SUCCESS)
                .startedAt(startedAt)
                .responseTimeSeconds(elapsed)
                .build());

        log.info("Generation succeeded via {} in {}s after {} attempt(s)",
                state.getId(), String.format("%.2f", elapsed), execution.attempts.size());

        ProviderConfig config = state.getConfig();
        return GenerationModels.GenerationResult.builder()
                .success(true)
                .content(response.getContent())
                .providerId(state.getId())
                .providerName(config.getDisplayName())
                .model(response.getModel() != null ? response.getModel() : modelFor(execution.request, config))
                .strategy(execution.strategy)
                .responseTimeSeconds(secondsSince(execution.startNanos))
                .tokensUsed(response.getTokensUsed())
                .attempts(List.copyOf(execution.attempts))
                .build();
    }

    private void onFailure(Execution execution,
                           ProviderState state,
                           ProviderException error,
                           Instant startedAt,
                           double elapsed,
                           int attemptIndex) {
        AttemptOutcome outcome = outcomeOf(error.getType());
        String detail = error.getMessage();

        if (outcome == AttemptOutcome.RATE_LIMITED) {
            rateLimiter.recordRateLimit(state, error.getRetryAfter(), detail);
        } else {
            circuitBreaker.recordFailure(state, error, elapsed);
        }
        statsCollector.recordAttempt(state.getId(), outcome, elapsed, attemptIndex);
        execution.attempts.add(GenerationModels.AttemptRecord.builder()
                .providerId(state.getId())
                .outcome(outcome)
                .startedAt(startedAt)
                .responseTimeSeconds(elapsed)
                .error(detail)
                .build());

        log.warn("Provider {} failed: {} ({})", state.getId(), outcome.getValue(), detail);
    }

    private GenerationModels.GenerationResult exhausted(Execution execution) {
        boolean attempted = !execution.attempts.isEmpty();
        String error = attempted
                ? "All providers failed: " + execution.attempts.stream()
                        .map(a -> a.getProviderId() + ": " + a.getOutcome().getValue()
                                + (a.getError() != null ? " (" + a.getError() + ")" : ""))
                        .collect(Collectors.joining("; "))
                : "No eligible providers available";

        log.error("Generation failed after {} attempt(s): {}", execution.attempts.size(), error);

        return GenerationModels.GenerationResult.builder()
                .success(false)
                .strategy(execution.strategy)
                .responseTimeSeconds(secondsSince(execution.startNanos))
                .attempts(List.copyOf(execution.attempts))
                .error(error)
                .errorCode(attempted ? GenerationErrorCode.ALL_PROVIDERS_EXHAUSTED : GenerationErrorCode.NO_ELIGIBLE_PROVIDERS)
                .build();
    }

    private ProviderRequest toProviderRequest(GenerationModels.GenerationRequest request, ProviderConfig config) {
        return ProviderRequest.builder()
                .prompt(request.getPrompt())
                .systemPrompt(request.getSystemPrompt())
                .model(modelFor(request, config))
                .maxTokens(request.getMaxTokens() != null ? request.getMaxTokens() : config.getMaxTokens())
                .temperature(request.getTemperature() != null ? request.getTemperature() : config.getTemperature())
                .build();
    }

    private static String modelFor(GenerationModels.GenerationRequest request, ProviderConfig config) {
        return request.getModel() != null && !request.getModel().isBlank() ? request.getModel() : config.getDefaultModel();
    }

    static AttemptOutcome outcomeOf(ProviderErrorType type) {
        return switch (type) {
            case AUTHENTICATION -> AttemptOutcome.AUTH_ERROR;
            case RATE_LIMIT -> AttemptOutcome.RATE_LIMITED;
            case TIMEOUT -> AttemptOutcome.TIMEOUT;
            case TRANSPORT -> AttemptOutcome.NETWORK_ERROR;
        };
    }

    private static double secondsSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    private record AttemptResult(ProviderResponse response, ProviderException error) {
        static AttemptResult success(ProviderResponse response) {
            return new AttemptResult(response, null);
        }

        static AttemptResult failure(ProviderException error) {
            return new AttemptResult(null, error);
        }
    }

    // Per-request state; attempts run one after another so no locking is needed
    private static final class Execution {
        final GenerationModels.GenerationRequest request;
        final RoutingStrategy strategy;
        final SelectionCursor cursor;
        final int budget;
        final long startNanos;
        final List<GenerationModels.AttemptRecord> attempts = new ArrayList<>();

        Execution(GenerationModels.GenerationRequest request,
                  RoutingStrategy strategy,
                  SelectionCursor cursor,
                  int budget,
                  long startNanos) {
            this.request = request;
            this.strategy = strategy;
            this.cursor = cursor;
            this.budget = budget;
            this.startNanos = startNanos;
        }
    }
}
