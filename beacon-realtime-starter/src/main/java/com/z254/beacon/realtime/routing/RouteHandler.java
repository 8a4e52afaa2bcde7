package com.z254.beacon.realtime.routing;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.function.BiFunction;

/**
 * Application logic bound to a route. May complete asynchronously; the router never
 * blocks other connections while a handler is pending.
 */
@FunctionalInterface
public interface RouteHandler {

    Mono<HandlerResult> handle(RouteRequest request, ConnectionContext context);

    /**
     * Adapt a synchronous, non-blocking handler.
     */
    static RouteHandler sync(BiFunction<RouteRequest, ConnectionContext, HandlerResult> function) {
        return (request, context) -> Mono.fromCallable(() -> function.apply(request, context));
    }

    /**
     * Adapt a handler that blocks (database, file or remote calls) by running it on the
     * bounded elastic scheduler.
     */
    static RouteHandler blocking(BiFunction<RouteRequest, ConnectionContext, HandlerResult> function) {
        return (request, context) -> Mono.fromCallable(() -> function.apply(request, context))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
