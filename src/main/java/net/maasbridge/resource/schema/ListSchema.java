package net.maasbridge.resource.schema;

import java.util.ArrayList;
import java.util.List;
import tools.jackson.databind.JsonNode;

/**
 * Validates a JSON array element by element; issue paths are prefixed with the element index.
 * All elements are checked so a single failure reports every bad entry.
 */
public final class ListSchema<T> implements Schema<List<T>> {

    private final Schema<T> elementSchema;

    public ListSchema(Schema<T> elementSchema) {
        this.elementSchema = elementSchema;
    }

    @Override
    public List<T> validate(JsonNode input) {
        if (input == null || !input.isArray()) {
            throw new SchemaValidationException(List.of(new SchemaIssue(
                    "", "Expected array, received " + BeanSchema.describe(input), SchemaIssue.INVALID_TYPE)));
        }
        List<T> values = new ArrayList<>(input.size());
        List<SchemaIssue> issues = new ArrayList<>();
        for (int i = 0; i < input.size(); i++) {
            try {
                values.add(elementSchema.validate(input.get(i)));
            } catch (SchemaValidationException e) {
                String index = String.valueOf(i);
                e.getIssues().forEach(issue -> issues.add(issue.prefixed(index)));
            }
        }
        if (!issues.isEmpty()) {
            throw new SchemaValidationException(issues);
        }
        return List.copyOf(values);
    }
}
