package net.maasbridge.resource.schema;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.ObjectReader;

/**
 * Schema backed by a Java record: Jackson performs shape checks and scalar coercion, then
 * Jakarta Bean Validation checks the constraints declared on the record components.
 *
 * @param <T> record type
 */
public final class BeanSchema<T> implements Schema<T> {

    private final Class<T> type;
    private final ObjectReader reader;
    private final Validator validator;

    /**
     * @param strict when true, keys the record does not declare are rejected
     */
    public BeanSchema(Class<T> type, ObjectMapper mapper, Validator validator, boolean strict) {
        this.type = type;
        ObjectReader base = mapper.readerFor(type);
        this.reader = strict
                ? base.with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                : base.without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.validator = validator;
    }

    @Override
    public T validate(JsonNode input) {
        if (input == null || !input.isObject()) {
            throw new SchemaValidationException(List.of(new SchemaIssue(
                    "", "Expected object, received " + describe(input), SchemaIssue.INVALID_TYPE)));
        }
        T value;
        try {
            value = reader.readValue(input);
        } catch (JacksonException e) {
            throw new SchemaValidationException(List.of(SchemaIssue.fromJackson(e)), e);
        }
        Set<ConstraintViolation<T>> violations = validator.validate(value);
        if (!violations.isEmpty()) {
            List<SchemaIssue> issues = violations.stream()
                    .map(SchemaIssue::fromViolation)
                    .sorted(Comparator.comparing(SchemaIssue::path).thenComparing(SchemaIssue::message))
                    .toList();
            throw new SchemaValidationException(issues);
        }
        return value;
    }

    public Class<T> getType() {
        return type;
    }

    static String describe(JsonNode input) {
        if (input == null || input.isMissingNode()) {
            return "nothing";
        }
        return input.getNodeType().name().toLowerCase(Locale.ROOT);
    }
}
