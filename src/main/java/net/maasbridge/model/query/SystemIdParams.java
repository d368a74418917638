package net.maasbridge.model.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * Path parameters of machine and device detail URIs. System ids are short alphanumeric tokens.
 */
public record SystemIdParams(
        @JsonProperty("system_id")
        @NotNull
        @Pattern(regexp = IdPatterns.RESOURCE_ID, message = "System ID must contain only letters, digits, underscores or hyphens")
        String systemId) {
}
