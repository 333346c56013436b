package com.hrms.messaging.employee;

import com.hrms.messaging.rpc.CorrelatedResponder;
import org.springframework.kafka.annotation.KafkaListener;

/**
 * Employee-service side of the lookup channel. Instances share one consumer
 * group so each request is answered once.
 */
public class EmployeeRequestListener {

    private final CorrelatedResponder responder;

    public EmployeeRequestListener(CorrelatedResponder responder) {
        this.responder = responder;
    }

    @KafkaListener(
            id = "employee-requests",
            topics = "${hrms.messaging.employee.request-topic:employee-requests}",
            groupId = "${spring.application.name:hrms}-employee-requests",
            containerFactory = "rpcListenerContainerFactory"
    )
    public void onRequest(String payload) {
        responder.onRequest(payload);
    }
}
