package net.maasbridge.resource.schema;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Path;
import java.util.List;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.exc.UnrecognizedPropertyException;

/**
 * One structured validation issue.
 *
 * @param path    dotted location of the offending value using JSON property names
 *                ({@code zone.name}, {@code 3.system_id}); empty for the root
 * @param message human-readable description
 * @param code    short machine-readable category ({@code invalid_type}, {@code constraint}, ...)
 */
public record SchemaIssue(String path, String message, String code) {

    public static final String INVALID_TYPE = "invalid_type";
    public static final String CONSTRAINT = "constraint";
    public static final String UNRECOGNIZED_KEY = "unrecognized_key";

    public SchemaIssue prefixed(String prefix) {
        return new SchemaIssue(path.isEmpty() ? prefix : prefix + "." + path, message, code);
    }

    static SchemaIssue fromViolation(ConstraintViolation<?> violation) {
        StringBuilder path = new StringBuilder();
        for (Path.Node node : violation.getPropertyPath()) {
            if (node.getIndex() != null) {
                appendSegment(path, String.valueOf(node.getIndex()));
            }
            if (node.getName() != null) {
                appendSegment(path, toJsonName(node.getName()));
            }
        }
        return new SchemaIssue(path.toString(), violation.getMessage(), CONSTRAINT);
    }

    static SchemaIssue fromJackson(JacksonException e) {
        StringBuilder path = new StringBuilder();
        List<JacksonException.Reference> references = e.getPath();
        for (JacksonException.Reference reference : references) {
            if (reference.getPropertyName() != null) {
                appendSegment(path, reference.getPropertyName());
            } else if (reference.getIndex() >= 0) {
                appendSegment(path, String.valueOf(reference.getIndex()));
            }
        }
        String code = e instanceof UnrecognizedPropertyException ? UNRECOGNIZED_KEY : INVALID_TYPE;
        return new SchemaIssue(path.toString(), e.getOriginalMessage(), code);
    }

    private static void appendSegment(StringBuilder path, String segment) {
        if (path.length() > 0) {
            path.append('.');
        }
        path.append(segment);
    }

    /** Payload and parameter records use snake_case JSON names for camelCase components. */
    static String toJsonName(String javaName) {
        StringBuilder out = new StringBuilder(javaName.length() + 4);
        for (char c : javaName.toCharArray()) {
            if (Character.isUpperCase(c)) {
                out.append('_').append(Character.toLowerCase(c));
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }
}
