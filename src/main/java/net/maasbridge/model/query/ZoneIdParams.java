package net.maasbridge.model.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * Path parameters of zone detail URIs.
 */
public record ZoneIdParams(
        @JsonProperty("zone_id")
        @NotNull
        @Pattern(regexp = IdPatterns.RESOURCE_ID, message = "Zone ID must contain only letters, digits, underscores or hyphens")
        String zoneId) {
}
