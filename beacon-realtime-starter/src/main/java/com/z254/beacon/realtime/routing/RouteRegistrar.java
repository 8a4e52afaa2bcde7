package com.z254.beacon.realtime.routing;

/**
 * Contributes routes during startup. Every registrar bean is applied to the shared
 * {@link RealtimeRouter} once, in {@link org.springframework.core.annotation.Order} order.
 */
@FunctionalInterface
public interface RouteRegistrar {

    void register(RealtimeRouter router);
}
