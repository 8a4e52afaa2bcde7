package com.z254.beacon.realtime.routing;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Logs every dispatched request with its duration; failures are logged at warn.
 */
@Slf4j
public class RequestLoggingMiddleware implements RouteMiddleware {

    @Override
    public Mono<HandlerResult> apply(RouteRequest request, ConnectionContext context, RouteHandler next) {
        return Mono.defer(() -> {
            long start = System.nanoTime();
            return next.handle(request, context)
                    .doOnSuccess(result -> {
                        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
                        if (result != null && !result.isOk()) {
                            log.warn("{} {} - {} ({}ms): {}", request.getMethod(), request.getUrl(),
                                    result.getErrorKind().getWireName(), elapsedMs, result.getErrorMessage());
                        } else {
                            log.debug("{} {} - {}ms", request.getMethod(), request.getUrl(), elapsedMs);
                        }
                    })
                    .doOnError(e -> log.warn("{} {} - Failed: {}", request.getMethod(), request.getUrl(), e.getMessage()));
        });
    }
}
