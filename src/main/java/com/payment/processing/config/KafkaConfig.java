package com.payment.processing.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.payment.processing.messaging.PaymentIntentUpdate;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Serializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka producer for payment intent updates. JSON on the wire so the aggregate
 * side does not need these classes to read them.
 */
@Slf4j
@Configuration
public class KafkaConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Value("${payment.kafka.producer.max-block-ms:5000}")
    private long maxBlockMs;

    @Bean
    public ProducerFactory<String, PaymentIntentUpdate> paymentIntentUpdateProducerFactory() {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        // send() must not stall an actor mailbox when the cluster is unreachable
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, maxBlockMs);
        return new DefaultKafkaProducerFactory<>(props, new StringSerializer(), jsonSerializer(updateObjectMapper()));
    }

    @Bean
    public KafkaTemplate<String, PaymentIntentUpdate> paymentIntentUpdateKafkaTemplate(
            ProducerFactory<String, PaymentIntentUpdate> paymentIntentUpdateProducerFactory) {
        return new KafkaTemplate<>(paymentIntentUpdateProducerFactory);
    }

    /** Not a bean: a second ObjectMapper bean would switch off Boot's own. */
    static ObjectMapper updateObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    static Serializer<PaymentIntentUpdate> jsonSerializer(ObjectMapper objectMapper) {
        return (topic, data) -> {
            if (data == null) {
                return null;
            }
            try {
                byte[] result = objectMapper.writeValueAsBytes(data);
                log.debug("Serialized PaymentIntentUpdate (topic={}, length={}, eventId={})", topic, result.length, data.getEventId());
                return result;
            } catch (Exception e) {
                log.error("Serialization failed for topic={}", topic, e);
                throw new SerializationException("Failed to serialize PaymentIntentUpdate", e);
            }
        };
    }
}
