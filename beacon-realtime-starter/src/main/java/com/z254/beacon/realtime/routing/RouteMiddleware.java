package com.z254.beacon.realtime.routing;

import reactor.core.publisher.Mono;

/**
 * Wraps handler execution. Call {@code next} to continue the chain, or return a result
 * directly to short-circuit it.
 */
@FunctionalInterface
public interface RouteMiddleware {

    Mono<HandlerResult> apply(RouteRequest request, ConnectionContext context, RouteHandler next);
}
