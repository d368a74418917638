package net.maasbridge.model.query;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Query parameter names shared by every list resource.
 */
public final class ListQueryParameters {

    public static final Set<String> PAGINATION = Set.of("limit", "offset", "page", "per_page", "sort", "order");

    private ListQueryParameters() {
    }

    /** Pagination names plus the kind's filter names, i.e. every name that may shape a list response. */
    public static Set<String> withPagination(Set<String> filters) {
        Set<String> all = new LinkedHashSet<>(PAGINATION);
        all.addAll(filters);
        return Set.copyOf(all);
    }
}
