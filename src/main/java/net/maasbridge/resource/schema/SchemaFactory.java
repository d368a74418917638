package net.maasbridge.resource.schema;

import jakarta.validation.Validator;
import java.util.List;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

/**
 * Builds record-backed schemas sharing the application's {@link ObjectMapper} and {@link Validator}.
 */
@Component
public class SchemaFactory {

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public SchemaFactory(ObjectMapper objectMapper, Validator validator) {
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    /** Parameters that tolerate extra keys (detail URIs may carry unrelated query parameters). */
    public <T> Schema<T> parameters(Class<T> type) {
        return new BeanSchema<>(type, objectMapper, validator, false);
    }

    /** Parameters that reject unknown keys (list filters). */
    public <T> Schema<T> strictParameters(Class<T> type) {
        return new BeanSchema<>(type, objectMapper, validator, true);
    }

    /** Backend payload; unmodelled backend fields are dropped. */
    public <T> Schema<T> payload(Class<T> type) {
        return new BeanSchema<>(type, objectMapper, validator, false);
    }

    public <T> Schema<List<T>> payloadList(Class<T> type) {
        return new ListSchema<>(payload(type));
    }
}
