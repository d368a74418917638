package net.maasbridge.resource.cache;

import jakarta.annotation.Nullable;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Structured cache key.
 *
 * <p>Kind and resource id are kept as separate components so that invalidation by kind or by
 * kind plus id compares fields rather than parsing strings. {@link #render()} gives the flat
 * form {@code kind:path[:id][:query]} used in logs.
 *
 * @param kind       resource kind label
 * @param path       canonical URI path (no query)
 * @param resourceId id the entry belongs to, null for list entries
 * @param query      sorted, form-encoded {@code a=1&b=2} rendering of the key-relevant query parameters
 */
public record CacheKey(String kind, String path, @Nullable String resourceId, String query) {

    /**
     * Derives the key for a request. Only query parameters allowed by {@code options} participate,
     * sorted by name, so parameter order on the URI never changes the key.
     */
    public static CacheKey of(String kind,
                              String path,
                              @Nullable String resourceId,
                              Map<String, String> query,
                              ResourceCacheOptions options) {
        String renderedQuery = "";
        if (options.includeQueryParams() && query != null && !query.isEmpty()) {
            Map<String, String> relevant = new TreeMap<>();
            query.forEach((name, value) -> {
                if (options.keyQueryParams().isEmpty() || options.keyQueryParams().contains(name)) {
                    relevant.put(name, value);
                }
            });
            renderedQuery = relevant.entrySet().stream()
                    .map(entry -> encode(entry.getKey()) + "=" + encode(entry.getValue()))
                    .collect(Collectors.joining("&"));
        }
        return new CacheKey(kind, path, resourceId, renderedQuery);
    }

    private static String encode(@Nullable String value) {
        return value == null ? "" : URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    public boolean belongsTo(String otherKind, @Nullable String otherId) {
        if (!kind.equals(otherKind)) {
            return false;
        }
        return otherId == null || otherId.equals(resourceId);
    }

    public String render() {
        StringBuilder rendered = new StringBuilder(kind).append(':').append(path);
        if (resourceId != null) {
            rendered.append(':').append(resourceId);
        }
        if (!query.isEmpty()) {
            rendered.append(':').append(query);
        }
        return rendered.toString();
    }

    @Override
    public String toString() {
        return render();
    }
}
