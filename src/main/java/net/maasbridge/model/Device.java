package net.maasbridge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import java.util.List;

/**
 * MAAS device (non-deployable node registered for IP and DNS management).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Device(
        @JsonProperty("system_id") @NotBlank String systemId,
        @NotBlank String hostname,
        String fqdn,
        String owner,
        String parent,
        ResourceRef zone,
        ResourceRef domain,
        @JsonProperty("ip_addresses") List<String> ipAddresses,
        @JsonProperty("tag_names") List<String> tagNames) {
}
