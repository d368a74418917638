package net.maasbridge.model.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.Set;

/**
 * Accepted query parameters of {@code maas://subnets/list}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubnetListQuery(
        String cidr,
        String name,
        String vlan,
        String space,
        @JsonProperty("vlan_vid") @Min(0) @Max(4095) Integer vlanVid,
        @Positive Integer limit,
        @PositiveOrZero Integer offset,
        @Positive Integer page,
        @JsonProperty("per_page") @Positive Integer perPage,
        String sort,
        @Pattern(regexp = "asc|desc", message = "must be asc or desc") String order) {

    public static final Set<String> FILTERS = Set.of("cidr", "name", "vlan", "space", "vlan_vid");
}
