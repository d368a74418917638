package net.maasbridge.model.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.Set;

/**
 * Accepted query parameters of {@code maas://tags/list}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TagListQuery(
        String name,
        String definition,
        @JsonProperty("kernel_opts") String kernelOpts,
        @Positive Integer limit,
        @PositiveOrZero Integer offset,
        @Positive Integer page,
        @JsonProperty("per_page") @Positive Integer perPage,
        String sort,
        @Pattern(regexp = "asc|desc", message = "must be asc or desc") String order) {

    public static final Set<String> FILTERS = Set.of("name", "definition", "kernel_opts");
}
