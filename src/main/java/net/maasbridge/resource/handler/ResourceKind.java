package net.maasbridge.resource.handler;

import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import lombok.Builder;
import lombok.Value;
import net.maasbridge.resource.cache.ResourceCacheOptions;
import net.maasbridge.resource.schema.Schema;

/**
 * Everything that distinguishes one addressable resource kind from another.
 *
 * <p>Kinds are values handed to the single generic {@link ResourceHandler}; there is no handler
 * subclass per kind. {@code idExtractor} is set for kinds addressed by one resource id (detail
 * kinds and id-scoped collections such as a tag's machines); it drives the missing-id check,
 * 404 rewriting, cache key scoping and id-scoped invalidation.
 *
 * @param <P> validated parameter type
 * @param <T> validated payload type
 */
@Value
@Builder
public class ResourceKind<P, T> {

    /** Human-readable kind, used in messages, cache keys and TTL lookup ("Machine", "Machines"). */
    String label;

    String template;

    Variant variant;

    Schema<P> parameterSchema;

    Schema<T> payloadSchema;

    Function<P, String> idExtractor;

    ResourceFetcher<P> fetcher;

    @Builder.Default
    ResourceCacheOptions defaultCacheOptions = ResourceCacheOptions.defaults();

    /** Query parameter names that narrow a list; their presence triggers invalidation of the kind. */
    @Builder.Default
    Set<String> filterParameters = Set.of();

    String description;

    /** Name of the addressed resource in failure messages when it differs from the label. */
    String subject;

    public enum Variant {
        /** Single resource addressed by its id. */
        DETAIL,
        /** Collection that forwards its validated query to the backend as filters. */
        LIST
    }

    public boolean isIdScoped() {
        return idExtractor != null;
    }

    public String subjectLabel() {
        return subject != null ? subject : label;
    }

    /** Root element name for XML rendering: the label in lower camel case. */
    public String xmlRootName() {
        String compact = label.replace(" ", "");
        return compact.substring(0, 1).toLowerCase(Locale.ROOT) + compact.substring(1);
    }
}
