/**
 * Compiled resource URI template
 *
 * @author William Callahan
 *
 * Features:
 * - Literal segments plus {name}, {name?} and {name:a|b} placeholders
 * - Compiles to one anchored, case-sensitive regular expression
 * - Required placeholders never match an empty segment or cross a '/'
 * - Optional placeholders may be empty, taking their adjacent '/' with them
 * - Placeholder values are returned verbatim (no percent-decoding)
 */
package net.maasbridge.resource.template;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public final class UriTemplate {

    private static final Pattern PLACEHOLDER =
            Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_]*)(\\?)?(?::([^}]*))?}");

    private final String template;
    private final List<Placeholder> placeholders;
    private final Pattern pattern;

    /**
     * One placeholder of a template.
     *
     * @param name          unique name within the template
     * @param optional      whether the segment may be absent
     * @param allowedValues ordered literal alternatives, empty when unconstrained
     */
    public record Placeholder(String name, boolean optional, List<String> allowedValues) {
        public Placeholder {
            allowedValues = List.copyOf(allowedValues);
        }
    }

    private UriTemplate(String template, List<Placeholder> placeholders, Pattern pattern) {
        this.template = template;
        this.placeholders = List.copyOf(placeholders);
        this.pattern = pattern;
    }

    /**
     * Compiles a template such as {@code maas://machine/{system_id}/details}.
     *
     * @throws IllegalArgumentException for duplicate names, empty enum alternatives or stray braces
     */
    public static UriTemplate compile(String template) {
        Objects.requireNonNull(template, "template");
        List<Object> tokens = tokenize(template);
        List<Placeholder> placeholders = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (Object token : tokens) {
            if (token instanceof Placeholder placeholder) {
                if (!names.add(placeholder.name())) {
                    throw new IllegalArgumentException(
                            "Duplicate placeholder '" + placeholder.name() + "' in template " + template);
                }
                placeholders.add(placeholder);
            }
        }
        return new UriTemplate(template, placeholders, Pattern.compile(toRegex(tokens)));
    }

    private static List<Object> tokenize(String template) {
        List<Object> tokens = new ArrayList<>();
        Matcher m = PLACEHOLDER.matcher(template);
        int cursor = 0;
        while (m.find()) {
            addLiteral(tokens, template, template.substring(cursor, m.start()));
            List<String> alternatives = List.of();
            if (m.group(3) != null) {
                alternatives = Arrays.asList(m.group(3).split("\\|", -1));
                if (alternatives.stream().anyMatch(String::isEmpty)) {
                    throw new IllegalArgumentException("Empty enum alternative in template " + template);
                }
            }
            tokens.add(new Placeholder(m.group(1), m.group(2) != null, alternatives));
            cursor = m.end();
        }
        addLiteral(tokens, template, template.substring(cursor));
        return tokens;
    }

    private static void addLiteral(List<Object> tokens, String template, String literal) {
        if (literal.indexOf('{') >= 0 || literal.indexOf('}') >= 0) {
            throw new IllegalArgumentException("Malformed placeholder in template " + template);
        }
        if (!literal.isEmpty()) {
            tokens.add(literal);
        }
    }

    private static String toRegex(List<Object> source) {
        List<Object> tokens = new ArrayList<>(source);
        StringBuilder regex = new StringBuilder();
        int literalStart = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Object token = tokens.get(i);
            if (token instanceof String literal) {
                literalStart = regex.length();
                if (!literal.isEmpty()) {
                    regex.append(Pattern.quote(literal));
                }
                continue;
            }
            Placeholder placeholder = (Placeholder) token;
            String capture = capture(placeholder);
            if (!placeholder.optional()) {
                regex.append(capture);
                continue;
            }
            Object next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;
            if (next instanceof String nextLiteral && nextLiteral.startsWith("/")) {
                // {name?}/rest : the segment and its trailing separator vanish together
                regex.append("(?:").append(capture).append("/)?");
                tokens.set(i + 1, nextLiteral.substring(1));
            } else if (next == null && i > 0 && tokens.get(i - 1) instanceof String previous
                    && previous.endsWith("/")) {
                // prefix/{name?} at the end : the leading separator is optional as well
                regex.setLength(literalStart);
                String trimmed = previous.substring(0, previous.length() - 1);
                if (!trimmed.isEmpty()) {
                    regex.append(Pattern.quote(trimmed));
                }
                regex.append("(?:/").append(capture).append(")?");
            } else {
                regex.append(capture);
            }
        }
        return regex.toString();
    }

    private static String capture(Placeholder placeholder) {
        if (!placeholder.allowedValues().isEmpty()) {
            return placeholder.allowedValues().stream()
                    .map(Pattern::quote)
                    .collect(Collectors.joining("|", "(", ")"));
        }
        return placeholder.optional() ? "([^/]*)" : "([^/]+)";
    }

    /**
     * Matches a concrete URI. The query string and fragment are excluded from path matching;
     * the query is parsed separately into the result.
     *
     * @return the extracted variables, or empty when the URI does not fit the template
     */
    public Optional<UriTemplateMatch> match(String uri) {
        if (uri == null) {
            return Optional.empty();
        }
        String withoutFragment = uri;
        int hash = uri.indexOf('#');
        if (hash >= 0) {
            withoutFragment = uri.substring(0, hash);
        }
        String path = withoutFragment;
        String rawQuery = null;
        int question = withoutFragment.indexOf('?');
        if (question >= 0) {
            path = withoutFragment.substring(0, question);
            rawQuery = withoutFragment.substring(question + 1);
        }
        Matcher matcher = pattern.matcher(path);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        Map<String, String> variables = new LinkedHashMap<>();
        for (int i = 0; i < placeholders.size(); i++) {
            String value = matcher.group(i + 1);
            variables.put(placeholders.get(i).name(), value == null ? "" : value);
        }
        return Optional.of(new UriTemplateMatch(path, variables, QueryStringParser.parse(rawQuery)));
    }

    public boolean matches(String uri) {
        return match(uri).isPresent();
    }

    public String template() {
        return template;
    }

    public List<Placeholder> placeholders() {
        return placeholders;
    }

    @Override
    public String toString() {
        return template;
    }
}
