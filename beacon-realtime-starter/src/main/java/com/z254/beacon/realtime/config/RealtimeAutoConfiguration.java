package com.z254.beacon.realtime.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.beacon.realtime.broadcast.BroadcastEngine;
import com.z254.beacon.realtime.client.RealtimeClientFactory;
import com.z254.beacon.realtime.connection.ConnectionListener;
import com.z254.beacon.realtime.connection.ConnectionRegistry;
import com.z254.beacon.realtime.observability.RealtimeMetrics;
import com.z254.beacon.realtime.protocol.EnvelopeCodec;
import com.z254.beacon.realtime.routing.RealtimeRouter;
import com.z254.beacon.realtime.routing.RequestLoggingMiddleware;
import com.z254.beacon.realtime.routing.RouteRegistrar;
import com.z254.beacon.realtime.state.WatchedStateFactory;
import com.z254.beacon.realtime.websocket.InboundMessageProcessor;
import com.z254.beacon.realtime.websocket.RealtimeWebSocketHandler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.web.reactive.WebFluxAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

/**
 * Auto-configuration for the BEACON realtime layer.
 * <p>
 * Provides:
 * <ul>
 *   <li>Connection registry and broadcast engine</li>
 *   <li>Request router, populated from every {@link RouteRegistrar} bean</li>
 *   <li>WebSocket endpoint at {@code beacon.realtime.path}; the handler adapter comes from WebFlux</li>
 *   <li>Watched state factory</li>
 *   <li>Client factory using {@code beacon.realtime.client.request-timeout}</li>
 * </ul>
 */
@AutoConfiguration(after = {JacksonAutoConfiguration.class, WebFluxAutoConfiguration.class})
@EnableConfigurationProperties(RealtimeProperties.class)
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
@ConditionalOnProperty(prefix = "beacon.realtime", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RealtimeAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RealtimeAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public EnvelopeCodec envelopeCodec(ObjectProvider<ObjectMapper> objectMapper) {
        return new EnvelopeCodec(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public ConnectionRegistry connectionRegistry() {
        return new ConnectionRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public RealtimeMetrics realtimeMetrics(ObjectProvider<MeterRegistry> meterRegistry, ConnectionRegistry registry) {
        return new RealtimeMetrics(meterRegistry.getIfAvailable(SimpleMeterRegistry::new), registry);
    }

    @Bean
    @ConditionalOnMissingBean
    public BroadcastEngine broadcastEngine(ConnectionRegistry registry, EnvelopeCodec codec, RealtimeMetrics metrics) {
        return new BroadcastEngine(registry, codec, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public RealtimeRouter realtimeRouter(EnvelopeCodec codec, RealtimeMetrics metrics, RealtimeProperties properties,
                                         ObjectProvider<RouteRegistrar> registrars) {
        RealtimeRouter router = new RealtimeRouter(codec, metrics);
        if (properties.isLogRequests()) {
            router.use(new RequestLoggingMiddleware());
        }
        registrars.orderedStream().forEach(registrar -> registrar.register(router));
        log.info("BEACON realtime router configured with {} route(s)", router.describeRoutes().size());
        return router;
    }

    @Bean
    @ConditionalOnMissingBean
    public InboundMessageProcessor inboundMessageProcessor(EnvelopeCodec codec, RealtimeRouter router,
                                                           ConnectionRegistry registry, BroadcastEngine broadcastEngine,
                                                           RealtimeMetrics metrics) {
        return new InboundMessageProcessor(codec, router, registry, broadcastEngine, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public RealtimeWebSocketHandler realtimeWebSocketHandler(ConnectionRegistry registry,
                                                             InboundMessageProcessor processor,
                                                             RealtimeMetrics metrics,
                                                             ObjectProvider<ConnectionListener> listeners,
                                                             RealtimeProperties properties) {
        List<ConnectionListener> ordered = listeners.orderedStream().toList();
        return new RealtimeWebSocketHandler(registry, processor, metrics, ordered,
                properties.getSendQueueCapacity(), properties.getMaxInFlightRequests());
    }

    @Bean
    @ConditionalOnMissingBean
    public WatchedStateFactory watchedStateFactory(BroadcastEngine broadcastEngine, EnvelopeCodec codec,
                                                   RealtimeMetrics metrics) {
        return new WatchedStateFactory(broadcastEngine, codec, metrics, Schedulers.parallel());
    }

    @Bean
    @ConditionalOnMissingBean
    public RealtimeClientFactory realtimeClientFactory(EnvelopeCodec codec, RealtimeProperties properties) {
        return new RealtimeClientFactory(codec, properties.getClient().getRequestTimeout());
    }

    @Bean
    public HandlerMapping realtimeHandlerMapping(RealtimeWebSocketHandler handler, RealtimeProperties properties) {
        log.info("BEACON realtime endpoint mapped at {}", properties.getPath());
        return new SimpleUrlHandlerMapping(Map.of(properties.getPath(), handler), properties.getHandlerMappingOrder());
    }
}
