package com.hrms.messaging.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hrms.messaging.event.EventEnvelope;
import com.hrms.messaging.event.EventEnvelopeCodec;
import com.hrms.messaging.event.MalformedEventException;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.kafka.core.KafkaTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/*
 * ============================================================================
 * CORRELATED REQUEST BRIDGE - CODE FLOW
 * ============================================================================
 *
 *   request(ids)
 *         │
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 1. ids empty? → resolve []          │  (bus untouched)
 *   └─────────────────────────────────────┘
 *         │
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 2. new correlationId                │
 *   │    pendingRequests[id] = pending    │
 *   │    schedule timeout timer           │
 *   └─────────────────────────────────────┘
 *         │
 *         ▼
 *   ┌─────────────────────────────────────┐
 *   │ 3. publish REQUEST on request topic │──── send fails → take entry, reject
 *   └─────────────────────────────────────┘
 *         │
 *         ▼
 *   caller holds the future ...
 *
 *   reply listener ─► onResponse(json) ─► take entry ─► resolve
 *   timer          ─► expire(id)       ─► take entry ─► reject TIMEOUT
 *   shutdown()     ─► take every entry ─► reject SHUTTING_DOWN
 *
 * "take entry" is always pendingRequests.remove(id): exactly one of the
 * paths above gets the entry, so a future is completed at most once.
 * ============================================================================
 */

/**
 * Turns the fire-and-forget bus into a request/response call.
 *
 * A request event carrying a fresh correlation id is published on the channel's
 * request topic, and the returned future completes when the reply with the same
 * correlation id is handed to {@link #onResponse(String)}, when the channel
 * timeout elapses, or when the bridge shuts down.
 *
 * @param <T> type of the result items carried in the reply
 */
@Slf4j
public class CorrelatedRequestBridge<T> {

    static final String HEADER_EVENT_TYPE = "eventType";
    static final String HEADER_SOURCE = "source";
    static final String HEADER_VERSION = "version";
    static final String HEADER_CORRELATION_ID = "correlationId";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final EventEnvelopeCodec codec;
    private final RpcChannelProperties channel;
    private final Class<T> itemType;
    private final Clock clock;
    private final ScheduledExecutorService timeoutScheduler;
    private final Map<String, PendingRequest<T>> pendingRequests = new ConcurrentHashMap<>();
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    private final AtomicLong timedOut = new AtomicLong();

    public CorrelatedRequestBridge(KafkaTemplate<String, String> kafkaTemplate,
                                   EventEnvelopeCodec codec,
                                   RpcChannelProperties channel,
                                   Class<T> itemType,
                                   Clock clock) {
        this.kafkaTemplate = kafkaTemplate;
        this.codec = codec;
        this.channel = channel;
        this.itemType = itemType;
        this.clock = clock;
        this.timeoutScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "rpc-timeout-" + channel.getRequestType());
            thread.setDaemon(true);
            return thread;
        });
        log.info("Correlated request bridge ready: {} -> {} (reply topic {}, timeout {})",
                channel.getRequestType(), channel.getRequestTopic(),
                channel.getResponseTopic(), channel.getTimeout());
    }

    /**
     * Publishes a request for the given ids and returns a future of the reply's items.
     */
    public CompletableFuture<List<T>> request(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        if (shuttingDown.get()) {
            return CompletableFuture.failedFuture(
                    new RpcException(RpcErrorCode.SHUTTING_DOWN, null, "Request bridge is shutting down"));
        }

        String correlationId = UUID.randomUUID().toString();
        Duration timeout = channel.getTimeout();
        Instant now = clock.instant();
        PendingRequest<T> pending = new PendingRequest<>(correlationId, now, now.plus(timeout));

        if (pendingRequests.putIfAbsent(correlationId, pending) != null) {
            // UUID collision; never reuse a correlation id
            return CompletableFuture.failedFuture(new RpcException(RpcErrorCode.PUBLISH_FAILED,
                    correlationId, "Correlation id already in use"));
        }

        try {
            pending.attachTimer(timeoutScheduler.schedule(
                    () -> expire(correlationId), timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            reject(correlationId, new RpcException(RpcErrorCode.SHUTTING_DOWN, correlationId,
                    "Request bridge is shutting down", e));
            return pending.getFuture().copy();
        }

        // shutdown() may have drained the map between the check above and the put
        if (shuttingDown.get()) {
            reject(correlationId, new RpcException(RpcErrorCode.SHUTTING_DOWN, correlationId,
                    "Request bridge is shutting down"));
            return pending.getFuture().copy();
        }

        publish(correlationId, new LinkedHashSet<>(ids), now);
        return pending.getFuture().copy();
    }

    private void publish(String correlationId, Collection<String> ids, Instant now) {
        ObjectNode data = (ObjectNode) codec.toTree(Map.of(
                "requestId", correlationId,
                "requestedBy", channel.getSource(),
                "requestedAt", now.toString()));
        data.set("ids", codec.toTree(ids));

        try {
            EventEnvelope envelope = EventEnvelope.create(
                    channel.getRequestType(), channel.getSource(), correlationId, data, now);
            ProducerRecord<String, String> record =
                    new ProducerRecord<>(channel.getRequestTopic(), envelope.id(), codec.write(envelope));
            record.headers()
                    .add(HEADER_EVENT_TYPE, bytes(envelope.type()))
                    .add(HEADER_SOURCE, bytes(envelope.source()))
                    .add(HEADER_VERSION, bytes(envelope.version()))
                    .add(HEADER_CORRELATION_ID, bytes(correlationId));

            log.debug("Publishing {} {} for {} ids", envelope.type(), correlationId, ids.size());

            kafkaTemplate.send(record).whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("Failed to publish {} {}", channel.getRequestType(), correlationId, ex);
                    reject(correlationId, new RpcException(RpcErrorCode.PUBLISH_FAILED, correlationId,
                            "Failed to publish request " + correlationId, ex));
                }
            });
        } catch (RuntimeException e) {
            log.error("Failed to publish {} {}", channel.getRequestType(), correlationId, e);
            reject(correlationId, new RpcException(RpcErrorCode.PUBLISH_FAILED, correlationId,
                    "Failed to publish request " + correlationId, e));
        }
    }

    /**
     * Handles one payload from the reply topic. Replies that cannot be matched to a
     * live request (late, duplicate or foreign) are logged and dropped.
     */
    public void onResponse(String payload) {
        EventEnvelope reply;
        try {
            reply = codec.read(payload);
        } catch (MalformedEventException e) {
            log.warn("Dropping malformed reply on {}: {}", channel.getResponseTopic(), e.getMessage());
            return;
        }

        if (!channel.getResponseType().equals(reply.type())) {
            log.debug("Ignoring event {} of type {}", reply.id(), reply.type());
            return;
        }

        PendingRequest<T> pending = pendingRequests.remove(reply.correlationId());
        if (pending == null) {
            log.warn("Received reply for unknown request {}", reply.correlationId());
            return;
        }

        JsonNode items = reply.data().get(channel.getItemsField());
        try {
            List<T> results = codec.toList(items, itemType);
            pending.resolve(results);
            log.debug("Reply {} resolved with {} items after {} ms", reply.correlationId(), results.size(),
                    Duration.between(pending.getCreatedAt(), clock.instant()).toMillis());
        } catch (MalformedEventException e) {
            log.warn("Reply {} has no '{}' array", reply.correlationId(), channel.getItemsField());
            pending.reject(new RpcException(RpcErrorCode.MALFORMED_REPLY, reply.correlationId(),
                    "Reply " + reply.correlationId() + " is malformed", e));
        }
    }

    private void expire(String correlationId) {
        PendingRequest<T> pending = pendingRequests.remove(correlationId);
        if (pending == null) {
            return;
        }
        timedOut.incrementAndGet();
        log.warn("{} {} timed out after {}", channel.getRequestType(), correlationId, channel.getTimeout());
        pending.reject(new RpcException(RpcErrorCode.TIMEOUT, correlationId,
                channel.getRequestType() + " request timeout: " + correlationId));
    }

    private void reject(String correlationId, RpcException error) {
        PendingRequest<T> pending = pendingRequests.remove(correlationId);
        if (pending != null) {
            pending.reject(error);
        }
    }

    /**
     * Rejects every in-flight request with {@link RpcErrorCode#SHUTTING_DOWN}
     * and stops the timeout scheduler. New requests are refused afterwards.
     */
    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        int rejected = 0;
        for (String correlationId : List.copyOf(pendingRequests.keySet())) {
            PendingRequest<T> pending = pendingRequests.remove(correlationId);
            if (pending != null) {
                pending.reject(new RpcException(RpcErrorCode.SHUTTING_DOWN, correlationId,
                        "Request bridge is shutting down"));
                rejected++;
            }
        }
        timeoutScheduler.shutdownNow();
        log.info("Correlated request bridge for {} stopped, {} pending requests rejected",
                channel.getRequestType(), rejected);
    }

    public int pendingCount() {
        return pendingRequests.size();
    }

    /** Requests rejected because no reply arrived in time. */
    public long timedOutCount() {
        return timedOut.get();
    }

    boolean timeoutSchedulerStopped() {
        return timeoutScheduler.isShutdown();
    }

    private static byte[] bytes(String value) {
        return value == null ? new byte[0] : value.getBytes(StandardCharsets.UTF_8);
    }
}
