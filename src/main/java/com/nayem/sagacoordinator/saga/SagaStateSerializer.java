package com.nayem.sagacoordinator.saga;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.List;

/**
 * JSON codec for the durable parts of a saga: the step definition, the
 * execution log and the whole transaction record.
 * <p>
 * Works on a private copy of the supplied {@link ObjectMapper} so that the
 * application's mapper settings do not change the stored format. Timestamps
 * are written as ISO-8601 strings. Any codec failure surfaces as
 * {@link PersistenceException}, including unknown status values.
 * </p>
 */
public class SagaStateSerializer {

    private static final TypeReference<List<SagaStep>> STEP_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public SagaStateSerializer() {
        this(new ObjectMapper());
    }

    public SagaStateSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String writeDefinition(List<SagaStep> steps) {
        return write(steps, "saga definition");
    }

    public List<SagaStep> readDefinition(String json) {
        try {
            return List.copyOf(objectMapper.readValue(json, STEP_LIST));
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to deserialize saga definition", e);
        }
    }

    public String writeLog(ExecutionLog log) {
        return write(log, "execution log");
    }

    public ExecutionLog readLog(String json) {
        return read(json, ExecutionLog.class, "execution log");
    }

    public String writeTransaction(SagaTransaction transaction) {
        return write(transaction, "saga transaction " + transaction.transactionId());
    }

    public SagaTransaction readTransaction(String json) {
        return read(json, SagaTransaction.class, "saga transaction");
    }

    private String write(Object value, String what) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize " + what, e);
        }
    }

    private <T> T read(String json, Class<T> type, String what) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to deserialize " + what, e);
        }
    }
}
