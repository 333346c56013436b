package com.hrms.messaging.rpc;

/**
 * Outcome kinds for a correlated request that did not produce a reply.
 */
public enum RpcErrorCode {

    // No reply arrived before the deadline
    TIMEOUT,

    // The bridge was stopped while the request was in flight
    SHUTTING_DOWN,

    // The request event could not be handed to the bus
    PUBLISH_FAILED,

    // A reply arrived but its payload did not have the expected shape
    MALFORMED_REPLY
}
