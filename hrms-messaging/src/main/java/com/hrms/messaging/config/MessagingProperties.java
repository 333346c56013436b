package com.hrms.messaging.config;

import com.hrms.messaging.event.EventTypes;
import com.hrms.messaging.rpc.RpcChannelProperties;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Bus channel configuration ({@code hrms.messaging.*}).
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "hrms.messaging")
public class MessagingProperties {

    private RpcChannelProperties employee = defaultEmployeeChannel();

    private static RpcChannelProperties defaultEmployeeChannel() {
        RpcChannelProperties channel = new RpcChannelProperties();
        channel.setRequestTopic(KafkaTopics.EMPLOYEE_REQUESTS);
        channel.setResponseTopic(KafkaTopics.EMPLOYEE_RESPONSES);
        channel.setRequestType(EventTypes.EMPLOYEE_FETCH_REQUEST);
        channel.setResponseType(EventTypes.EMPLOYEE_FETCH_RESPONSE);
        channel.setItemsField("employees");
        return channel;
    }
}
