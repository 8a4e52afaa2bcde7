package com.z254.beacon.realtime.routing;

import com.z254.beacon.realtime.observability.RealtimeMetrics;
import com.z254.beacon.realtime.protocol.Envelope;
import com.z254.beacon.realtime.protocol.EnvelopeCodec;
import com.z254.beacon.realtime.protocol.EnvelopeEncodingException;
import com.z254.beacon.realtime.protocol.ErrorEnvelope;
import com.z254.beacon.realtime.protocol.ErrorKind;
import com.z254.beacon.realtime.protocol.RequestEnvelope;
import com.z254.beacon.realtime.protocol.ResponseEnvelope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Dispatches request envelopes to handlers registered by method and path pattern.
 *
 * <p>Routes are tried in registration order and the first match wins. Overlapping
 * patterns are not detected. Dispatch never signals an error: unmatched requests become
 * {@link ErrorKind#NOT_FOUND} and handler faults become {@link ErrorKind#HANDLER_FAILURE}.
 */
@Slf4j
public class RealtimeRouter {

    private final EnvelopeCodec codec;
    private final RealtimeMetrics metrics;
    private final List<Route> routes = new CopyOnWriteArrayList<>();
    private final List<RouteMiddleware> globalMiddlewares = new CopyOnWriteArrayList<>();

    public RealtimeRouter(EnvelopeCodec codec, RealtimeMetrics metrics) {
        this.codec = codec;
        this.metrics = metrics;
    }

    // --------------------------------------------------------------------------------------------
    // Registration
    // --------------------------------------------------------------------------------------------

    public RealtimeRouter on(String method, String pattern, RouteHandler handler, RouteMiddleware... middlewares) {
        String normalized = method.trim().toUpperCase(Locale.ROOT);
        Route route = new Route(normalized, RoutePattern.compile(pattern), handler, List.of(middlewares));
        routes.add(route);
        log.debug("Registering route: {} {}", normalized, pattern);
        return this;
    }

    public RealtimeRouter on(HttpMethod method, String pattern, RouteHandler handler, RouteMiddleware... middlewares) {
        return on(method.name(), pattern, handler, middlewares);
    }

    public RealtimeRouter get(String pattern, RouteHandler handler, RouteMiddleware... middlewares) {
        return on(HttpMethod.GET, pattern, handler, middlewares);
    }

    public RealtimeRouter post(String pattern, RouteHandler handler, RouteMiddleware... middlewares) {
        return on(HttpMethod.POST, pattern, handler, middlewares);
    }

    public RealtimeRouter put(String pattern, RouteHandler handler, RouteMiddleware... middlewares) {
        return on(HttpMethod.PUT, pattern, handler, middlewares);
    }

    public RealtimeRouter delete(String pattern, RouteHandler handler, RouteMiddleware... middlewares) {
        return on(HttpMethod.DELETE, pattern, handler, middlewares);
    }

    /**
     * Add a middleware that wraps every route, ahead of route-specific middlewares.
     */
    public RealtimeRouter use(RouteMiddleware middleware) {
        globalMiddlewares.add(middleware);
        return this;
    }

    public List<String> describeRoutes() {
        return routes.stream()
                .map(route -> route.method() + " " + route.pattern().getSource())
                .toList();
    }

    // --------------------------------------------------------------------------------------------
    // Dispatch
    // --------------------------------------------------------------------------------------------

    /**
     * Find the first route matching {@code method} and {@code path}.
     */
    public Optional<RouteMatch> match(String method, String path) {
        String normalized = method.toUpperCase(Locale.ROOT);
        for (Route route : routes) {
            if (!route.method().equals(normalized)) {
                continue;
            }
            Optional<Map<String, String>> params = route.pattern().match(path);
            if (params.isPresent()) {
                return Optional.of(new RouteMatch(route, params.get()));
            }
        }
        return Optional.empty();
    }

    /**
     * Run the handler for a request.
     *
     * @return the envelope to send back, or empty for a successful fire-and-forget request
     */
    public Mono<Envelope> dispatch(RequestEnvelope request, ConnectionContext context) {
        return Mono.defer(() -> {
            ParsedUrl url = ParsedUrl.parse(request.getPath());
            String method = request.getMethod() == null ? RequestEnvelope.DEFAULT_METHOD : request.getMethod();
            Optional<RouteMatch> match = match(method, url.path());

            if (match.isEmpty()) {
                log.debug("No route matched for: {} {}", method, request.getPath());
                metrics.requestHandled("not_found");
                return Mono.just(failure(request.getId(), ErrorKind.NOT_FOUND,
                        "No route matched for: " + method + " " + request.getPath()));
            }

            Route route = match.get().route();
            RouteRequest routeRequest = RouteRequest.builder()
                    .id(request.getId())
                    .method(method)
                    .path(url.path())
                    .url(request.getPath())
                    .params(match.get().params())
                    .query(url.query())
                    .body(request.getBody())
                    .build();

            List<RouteMiddleware> chain = new ArrayList<>(globalMiddlewares);
            chain.addAll(route.middlewares());

            return Mono.defer(() -> invoke(chain, 0, route.handler(), routeRequest, context))
                    .defaultIfEmpty(HandlerResult.empty())
                    .onErrorResume(e -> {
                        log.error("Handler failed for {} {}", method, request.getPath(), e);
                        return Mono.just(HandlerResult.error(ErrorKind.HANDLER_FAILURE, describe(e)));
                    })
                    .flatMap(result -> Mono.justOrEmpty(toEnvelope(request.getId(), result)));
        }).onErrorResume(e -> {
            log.error("Dispatch failed for {} {}", request.getMethod(), request.getPath(), e);
            metrics.requestHandled("handler_failure");
            return Mono.just(failure(request.getId(), ErrorKind.HANDLER_FAILURE, describe(e)));
        });
    }

    private Mono<HandlerResult> invoke(List<RouteMiddleware> chain, int index, RouteHandler handler,
                                       RouteRequest request, ConnectionContext context) {
        if (index == chain.size()) {
            return handler.handle(request, context);
        }
        RouteMiddleware middleware = chain.get(index);
        return middleware.apply(request, context,
                (nextRequest, nextContext) -> Mono.defer(
                        () -> invoke(chain, index + 1, handler, nextRequest, nextContext)));
    }

    private Envelope toEnvelope(String id, HandlerResult result) {
        if (!result.isOk()) {
            metrics.requestHandled(result.getErrorKind().getWireName());
            return failure(id, result.getErrorKind(), result.getErrorMessage());
        }
        metrics.requestHandled("ok");
        if (id == null) {
            return null;
        }
        try {
            return ResponseEnvelope.success(id, codec.toTree(result.getData()));
        } catch (EnvelopeEncodingException e) {
            log.error("Failed to serialize response for request {}", id, e);
            return failure(id, ErrorKind.HANDLER_FAILURE, e.getMessage());
        }
    }

    private static Envelope failure(String id, ErrorKind kind, String message) {
        if (id == null) {
            return ErrorEnvelope.builder().kind(kind).error(message).build();
        }
        return ResponseEnvelope.failure(id, kind, message);
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    // --------------------------------------------------------------------------------------------
    // Internal types
    // --------------------------------------------------------------------------------------------

    record Route(String method, RoutePattern pattern, RouteHandler handler, List<RouteMiddleware> middlewares) {
    }

    /**
     * A route selected for a request, with its captured path parameters.
     */
    public record RouteMatch(Route route, Map<String, String> params) {

        public String pattern() {
            return route.pattern().getSource();
        }
    }

    /**
     * Request path split into path and decoded query parameters. Absolute URLs are accepted.
     */
    record ParsedUrl(String path, Map<String, String> query) {

        static ParsedUrl parse(String url) {
            String raw = url;
            if (raw.startsWith("http://") || raw.startsWith("https://")) {
                try {
                    URI uri = URI.create(raw);
                    String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
                    return new ParsedUrl(path, parseQuery(uri.getRawQuery()));
                } catch (IllegalArgumentException e) {
                    log.debug("Could not parse absolute URL {}: {}", url, e.getMessage());
                }
            }
            int hash = raw.indexOf('#');
            if (hash >= 0) {
                raw = raw.substring(0, hash);
            }
            int question = raw.indexOf('?');
            if (question < 0) {
                return new ParsedUrl(raw, Map.of());
            }
            return new ParsedUrl(raw.substring(0, question), parseQuery(raw.substring(question + 1)));
        }

        private static Map<String, String> parseQuery(String query) {
            if (query == null || query.isEmpty()) {
                return Map.of();
            }
            Map<String, String> params = new LinkedHashMap<>();
            for (String pair : query.split("&")) {
                if (pair.isEmpty()) {
                    continue;
                }
                int eq = pair.indexOf('=');
                String key = eq < 0 ? pair : pair.substring(0, eq);
                String value = eq < 0 ? "" : pair.substring(eq + 1);
                params.putIfAbsent(decode(key), decode(value));
            }
            return Collections.unmodifiableMap(params);
        }

        private static String decode(String value) {
            String spaced = value.replace('+', ' ');
            try {
                return UriUtils.decode(spaced, StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e) {
                return spaced;
            }
        }
    }
}
