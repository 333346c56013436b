package com.hrms.messaging.config;

import com.hrms.messaging.employee.EmployeeDirectoryClient;
import com.hrms.messaging.employee.EmployeeInfo;
import com.hrms.messaging.employee.EmployeeReplyListener;
import com.hrms.messaging.employee.EmployeeRequestListener;
import com.hrms.messaging.event.EventEnvelopeCodec;
import com.hrms.messaging.rpc.CorrelatedRequestBridge;
import com.hrms.messaging.rpc.CorrelatedResponder;
import com.hrms.messaging.rpc.RequestHandler;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Clock;
import java.util.Map;

/**
 * Wires the request/response bridge over Kafka for any service that has this
 * module on its classpath.
 *
 * Runs after Boot's Kafka auto-configuration and leaves its {@code kafkaTemplate}
 * and factories in place. The rpc template and listener factory start from the
 * same {@code spring.kafka.*} settings; events travel as JSON strings and the
 * envelope codec owns (de)serialization, so both sides force String serializers.
 */
@AutoConfiguration(after = KafkaAutoConfiguration.class)
@EnableKafka
@EnableConfigurationProperties({MessagingProperties.class, KafkaProperties.class})
@ConditionalOnProperty(prefix = "hrms.messaging", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MessagingAutoConfiguration {

    // ==================== PRODUCER ====================

    /**
     * The template copies the base factory with the String serializers applied
     * and closes that copy when it is destroyed.
     */
    @Bean
    @ConditionalOnMissingBean(name = "rpcKafkaTemplate")
    public KafkaTemplate<String, String> rpcKafkaTemplate(KafkaProperties kafkaProperties) {
        Map<String, Object> config = kafkaProperties.buildProducerProperties(null);
        config.putIfAbsent(ProducerConfig.ACKS_CONFIG, "all");
        Map<String, Object> overrides = Map.of(
                ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class,
                ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        return new KafkaTemplate<>(new DefaultKafkaProducerFactory<>(config), overrides);
    }

    // ==================== CONSUMER ====================

    static Map<String, Object> rpcConsumerProperties(KafkaProperties kafkaProperties) {
        Map<String, Object> config = kafkaProperties.buildConsumerProperties(null);
        config.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        config.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        // only replies to requests made by this process matter
        config.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
        return config;
    }

    @Bean
    @ConditionalOnMissingBean(name = "rpcListenerContainerFactory")
    public ConcurrentKafkaListenerContainerFactory<String, String> rpcListenerContainerFactory(
            KafkaProperties kafkaProperties) {
        ConcurrentKafkaListenerContainerFactory<String, String> factory =
                new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(new DefaultKafkaConsumerFactory<>(rpcConsumerProperties(kafkaProperties)));
        factory.setAutoStartup(kafkaProperties.getListener().isAutoStartup());
        return factory;
    }

    // ==================== EMPLOYEE CHANNEL ====================

    @Bean
    @ConditionalOnMissingBean
    public EventEnvelopeCodec eventEnvelopeCodec() {
        return new EventEnvelopeCodec();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CorrelatedRequestBridge<EmployeeInfo> employeeRequestBridge(
            @Qualifier("rpcKafkaTemplate") KafkaTemplate<String, String> rpcKafkaTemplate,
            EventEnvelopeCodec codec,
            MessagingProperties properties,
            Clock clock) {
        return new CorrelatedRequestBridge<>(rpcKafkaTemplate, codec, properties.getEmployee(),
                EmployeeInfo.class, clock);
    }

    @Bean
    public EmployeeReplyListener employeeReplyListener(CorrelatedRequestBridge<EmployeeInfo> employeeRequestBridge) {
        return new EmployeeReplyListener(employeeRequestBridge);
    }

    @Bean
    public EmployeeDirectoryClient employeeDirectoryClient(
            CorrelatedRequestBridge<EmployeeInfo> employeeRequestBridge) {
        return new EmployeeDirectoryClient(employeeRequestBridge);
    }

    /**
     * Registered only in the service that answers employee lookups, i.e. the one
     * declaring a {@link RequestHandler} bean named {@code employeeRequestHandler}.
     */
    @Bean
    @ConditionalOnBean(name = "employeeRequestHandler")
    public EmployeeRequestListener employeeRequestListener(
            @Qualifier("rpcKafkaTemplate") KafkaTemplate<String, String> rpcKafkaTemplate,
            EventEnvelopeCodec codec,
            MessagingProperties properties,
            @Qualifier("employeeRequestHandler") RequestHandler employeeRequestHandler,
            Clock clock) {
        return new EmployeeRequestListener(new CorrelatedResponder(rpcKafkaTemplate, codec,
                properties.getEmployee(), properties.getEmployee().getSource(), employeeRequestHandler, clock));
    }
}
