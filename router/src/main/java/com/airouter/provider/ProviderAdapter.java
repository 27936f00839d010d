package com.airouter.provider;

import com.airouter.registry.ProviderConfig;
import reactor.core.publisher.Mono;

/**
 * Translates the uniform request into one vendor's API call.
 *
 * <p>Implementations are stateless and shared by all providers of their kind. Failures are
 * emitted as errors; the router classifies them with {@link ProviderErrorClassifier}, so an
 * adapter only needs to raise {@link ProviderException} for failures that arrive inside a
 * successful HTTP response. Timeouts are applied by the caller.
 */
public interface ProviderAdapter {

    AdapterKind getKind();

    Mono<ProviderResponse> send(ProviderConfig config, ProviderRequest request);
}
