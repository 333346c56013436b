package com.hrms.messaging.rpc;

import com.hrms.messaging.event.EventEnvelope;

/**
 * Domain side of a correlated exchange: given a validated request event,
 * produce the reply's {@code data} payload.
 */
@FunctionalInterface
public interface RequestHandler {

    Object handle(EventEnvelope request);
}
