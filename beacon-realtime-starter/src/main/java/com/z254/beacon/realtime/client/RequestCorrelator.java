package com.z254.beacon.realtime.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.z254.beacon.realtime.protocol.ErrorKind;
import com.z254.beacon.realtime.protocol.ResponseEnvelope;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pairs outbound requests with their responses by correlation id.
 *
 * <p>Every pending entry is completed exactly once: by its response, by its timeout, or by
 * {@link #failAll}. Whichever removes the entry from the pending map first wins; later
 * arrivals for the same id are discarded.
 */
@Slf4j
public class RequestCorrelator {

    private final String prefix = UUID.randomUUID().toString().substring(0, 8);
    private final AtomicLong sequence = new AtomicLong();
    private final Map<String, Pending> pending = new ConcurrentHashMap<>();
    private final Scheduler scheduler;

    public RequestCorrelator() {
        this(Schedulers.parallel());
    }

    public RequestCorrelator(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Register a new pending request. The timeout starts now, whether or not anyone
     * has subscribed to the response yet.
     */
    public PendingRequest open(Duration timeout) {
        String id = prefix + "-" + sequence.incrementAndGet();
        Pending entry = new Pending();
        pending.put(id, entry);
        entry.timeoutTask = scheduler.schedule(() -> expire(id, timeout), timeout.toMillis(), TimeUnit.MILLISECONDS);
        return new PendingRequest(id, entry.sink.asMono());
    }

    /**
     * Complete the request a response belongs to.
     *
     * @return false if the id is unknown or already completed
     */
    public boolean complete(ResponseEnvelope response) {
        Pending entry = take(response.getId());
        if (entry == null) {
            return false;
        }
        if (response.isOk()) {
            entry.sink.tryEmitValue(response.getData() == null ? NullNode.getInstance() : response.getData());
        } else {
            ErrorKind kind = response.getKind() == null ? ErrorKind.HANDLER_FAILURE : response.getKind();
            entry.sink.tryEmitError(new RemoteRequestException(kind, response.getError()));
        }
        return true;
    }

    public boolean fail(String id, Throwable error) {
        Pending entry = take(id);
        if (entry == null) {
            return false;
        }
        entry.sink.tryEmitError(error);
        return true;
    }

    /**
     * Fail every pending request, typically because the socket closed.
     *
     * @return number of requests failed
     */
    public int failAll(Throwable cause) {
        List<String> ids = new ArrayList<>(pending.keySet());
        int failed = 0;
        for (String id : ids) {
            if (fail(id, cause)) {
                failed++;
            }
        }
        if (failed > 0) {
            log.debug("Failed {} pending request(s): {}", failed, cause.getMessage());
        }
        return failed;
    }

    public int pendingCount() {
        return pending.size();
    }

    private Pending take(String id) {
        Pending entry = id == null ? null : pending.remove(id);
        if (entry == null) {
            log.debug("Discarding response for unknown correlation id {}", id);
            return null;
        }
        Disposable task = entry.timeoutTask;
        if (task != null) {
            task.dispose();
        }
        return entry;
    }

    private void expire(String id, Duration timeout) {
        Pending entry = pending.remove(id);
        if (entry != null) {
            log.debug("Request {} timed out after {}ms", id, timeout.toMillis());
            entry.sink.tryEmitError(new RequestTimeoutException(id, timeout));
        }
    }

    private static final class Pending {
        final Sinks.One<JsonNode> sink = Sinks.one();
        volatile Disposable timeoutTask;
    }
}
