package net.maasbridge.resource.template;

import java.util.Map;

/**
 * Result of matching a concrete URI against a {@link UriTemplate}.
 *
 * @param path       the URI with query string and fragment removed
 * @param variables  placeholder name to extracted value; optional placeholders that matched
 *                   nothing map to the empty string
 * @param query      flat query parameters of the URI (last value wins for repeated keys)
 */
public record UriTemplateMatch(String path, Map<String, String> variables, Map<String, String> query) {

    public UriTemplateMatch {
        variables = Map.copyOf(variables);
        query = Map.copyOf(query);
    }

    public String variable(String name) {
        return variables.get(name);
    }
}
