package net.maasbridge.model.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * Path parameters of domain detail URIs.
 */
public record DomainIdParams(
        @JsonProperty("domain_id")
        @NotNull
        @Pattern(regexp = IdPatterns.RESOURCE_ID, message = "Domain ID must contain only letters, digits, underscores or hyphens")
        String domainId) {
}
