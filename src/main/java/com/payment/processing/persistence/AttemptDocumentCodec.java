package com.payment.processing.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.payment.processing.domain.PaymentAttempt;
import org.springframework.stereotype.Component;

/**
 * Serializes {@link PaymentAttempt} to/from the JSON document column. Unknown
 * properties are ignored so older rows keep loading after fields are added.
 */
@Component
public class AttemptDocumentCodec {

    private final ObjectMapper mapper;

    public AttemptDocumentCodec() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String toJson(PaymentAttempt attempt) {
        try {
            return mapper.writeValueAsString(attempt);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize payment attempt " + attempt.getPaymentIntentId(), e);
        }
    }

    public PaymentAttempt fromJson(String document) {
        try {
            return mapper.readValue(document, PaymentAttempt.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not deserialize payment attempt document", e);
        }
    }
}
