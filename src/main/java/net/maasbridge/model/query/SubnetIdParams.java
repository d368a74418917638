package net.maasbridge.model.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * Path parameters of subnet detail URIs.
 */
public record SubnetIdParams(
        @JsonProperty("subnet_id")
        @NotNull
        @Pattern(regexp = IdPatterns.RESOURCE_ID, message = "Subnet ID must contain only letters, digits, underscores or hyphens")
        String subnetId) {
}
