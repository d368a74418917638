package net.maasbridge.resource.schema;

import tools.jackson.databind.JsonNode;

/**
 * Validates and converts a JSON tree into a typed value.
 *
 * <p>Coercion (for example the query string {@code "10"} into an {@code Integer}) happens as part
 * of validation, so callers receive either a fully typed value or a {@link SchemaValidationException}.
 *
 * @param <T> validated type
 */
@FunctionalInterface
public interface Schema<T> {

    T validate(JsonNode input);
}
