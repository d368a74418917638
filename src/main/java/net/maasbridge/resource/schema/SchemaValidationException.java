package net.maasbridge.resource.schema;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised by a {@link Schema} when input does not have the expected shape.
 *
 * <p>Never crosses a handler boundary: parameter failures become {@code invalid_parameters},
 * payload failures become {@code validation_error}.
 */
public class SchemaValidationException extends RuntimeException {

    private final List<SchemaIssue> issues;

    public SchemaValidationException(List<SchemaIssue> issues) {
        this(issues, null);
    }

    public SchemaValidationException(List<SchemaIssue> issues, Throwable cause) {
        super(summarize(issues), cause);
        this.issues = List.copyOf(issues);
    }

    public List<SchemaIssue> getIssues() {
        return issues;
    }

    private static String summarize(List<SchemaIssue> issues) {
        return issues.stream()
                .map(issue -> issue.path().isEmpty() ? issue.message() : issue.path() + ": " + issue.message())
                .collect(Collectors.joining("; "));
    }
}
