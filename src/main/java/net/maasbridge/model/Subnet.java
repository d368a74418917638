package net.maasbridge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * MAAS subnet.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Subnet(
        @NotNull Integer id,
        @NotBlank String name,
        @NotBlank String cidr,
        Vlan vlan,
        String space,
        @JsonProperty("gateway_ip") String gatewayIp,
        @JsonProperty("dns_servers") List<String> dnsServers,
        Boolean managed,
        @JsonProperty("active_discovery") Boolean activeDiscovery,
        @JsonProperty("allow_dns") Boolean allowDns,
        @JsonProperty("allow_proxy") Boolean allowProxy) {

    /**
     * VLAN the subnet is attached to.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Vlan(Integer id, Integer vid, String name, String fabric) {
    }
}
