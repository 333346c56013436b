package com.hrms.messaging.rpc;

import lombok.Getter;
import lombok.Setter;

import java.time.Duration;

/**
 * Settings for one correlated request/response channel on the bus.
 */
@Getter
@Setter
public class RpcChannelProperties {

    /** Topic request events are published to. */
    private String requestTopic;

    /** Topic reply events are consumed from. */
    private String responseTopic;

    private String requestType;

    private String responseType;

    /** Name of the array field inside the reply's {@code data} holding the results. */
    private String itemsField;

    /** Value written to {@code source} on outgoing events. */
    private String source = "hrms-service";

    private Duration timeout = Duration.ofSeconds(10);
}
