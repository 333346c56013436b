package com.hrms.messaging.employee;

import com.hrms.messaging.rpc.CorrelatedRequestBridge;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;

/**
 * Long-lived subscriber on the employee reply topic.
 *
 * The consumer group is unique per process: every replica must see the replies
 * to its own requests, so replies are broadcast rather than load-balanced.
 */
@Slf4j
public class EmployeeReplyListener {

    private final CorrelatedRequestBridge<EmployeeInfo> bridge;

    public EmployeeReplyListener(CorrelatedRequestBridge<EmployeeInfo> bridge) {
        this.bridge = bridge;
    }

    @KafkaListener(
            id = "employee-replies",
            topics = "${hrms.messaging.employee.response-topic:employee-responses}",
            groupId = "${spring.application.name:hrms}-employee-replies-${random.uuid}",
            containerFactory = "rpcListenerContainerFactory"
    )
    public void onReply(String payload) {
        bridge.onResponse(payload);
    }
}
