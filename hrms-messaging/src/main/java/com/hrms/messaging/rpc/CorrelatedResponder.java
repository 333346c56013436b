package com.hrms.messaging.rpc;

import com.hrms.messaging.event.EventEnvelope;
import com.hrms.messaging.event.EventEnvelopeCodec;
import com.hrms.messaging.event.MalformedEventException;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.kafka.core.KafkaTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.concurrent.CompletableFuture;

/**
 * Replier side of a correlated exchange.
 *
 * Consumes request events from the channel's request topic, hands them to a
 * {@link RequestHandler} and publishes the result on the reply topic under the
 * request's correlation id. When the handler fails nothing is published and the
 * requester's own deadline applies.
 */
@Slf4j
public class CorrelatedResponder {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final EventEnvelopeCodec codec;
    private final RpcChannelProperties channel;
    private final String source;
    private final RequestHandler handler;
    private final Clock clock;

    public CorrelatedResponder(KafkaTemplate<String, String> kafkaTemplate,
                               EventEnvelopeCodec codec,
                               RpcChannelProperties channel,
                               String source,
                               RequestHandler handler,
                               Clock clock) {
        this.kafkaTemplate = kafkaTemplate;
        this.codec = codec;
        this.channel = channel;
        this.source = source;
        this.handler = handler;
        this.clock = clock;
    }

    /**
     * Handles one payload from the request topic.
     *
     * @return the publish future, or {@code null} when no reply was sent
     */
    public CompletableFuture<?> onRequest(String payload) {
        EventEnvelope request;
        try {
            request = codec.read(payload);
        } catch (MalformedEventException e) {
            log.warn("Dropping malformed request on {}: {}", channel.getRequestTopic(), e.getMessage());
            return null;
        }

        if (!channel.getRequestType().equals(request.type())) {
            log.debug("Ignoring event {} of type {}", request.id(), request.type());
            return null;
        }

        Object result;
        try {
            result = handler.handle(request);
        } catch (RuntimeException e) {
            log.error("Handler failed for {} {}", request.type(), request.correlationId(), e);
            return null;
        }

        EventEnvelope reply = EventEnvelope.create(channel.getResponseType(), source,
                request.correlationId(), codec.toTree(result), clock.instant());
        ProducerRecord<String, String> record =
                new ProducerRecord<>(channel.getResponseTopic(), reply.id(), codec.write(reply));
        record.headers()
                .add(CorrelatedRequestBridge.HEADER_EVENT_TYPE, reply.type().getBytes(StandardCharsets.UTF_8))
                .add(CorrelatedRequestBridge.HEADER_CORRELATION_ID,
                        reply.correlationId().getBytes(StandardCharsets.UTF_8));

        log.debug("Replying to {} from {}", request.correlationId(), request.source());
        return kafkaTemplate.send(record).whenComplete((sent, ex) -> {
            if (ex != null) {
                log.error("Failed to publish reply for {}", request.correlationId(), ex);
            }
        });
    }
}
