package net.maasbridge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;

/**
 * MAAS machine as returned by {@code GET /machines/} and {@code GET /machines/<system_id>/}.
 * Only the fields the bridge serves are modelled; other backend fields are dropped.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Machine(
        @JsonProperty("system_id") @NotBlank String systemId,
        @NotBlank String hostname,
        String fqdn,
        Integer status,
        @JsonProperty("status_name") String statusName,
        String architecture,
        @JsonProperty("cpu_count") @PositiveOrZero Integer cpuCount,
        @PositiveOrZero Long memory,
        String osystem,
        @JsonProperty("distro_series") String distroSeries,
        @JsonProperty("power_state") String powerState,
        String owner,
        ResourceRef zone,
        ResourceRef pool,
        ResourceRef domain,
        @JsonProperty("tag_names") List<String> tagNames,
        @JsonProperty("ip_addresses") List<String> ipAddresses) {
}
