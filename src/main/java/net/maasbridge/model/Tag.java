package net.maasbridge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * MAAS tag; {@code definition} is the optional XPath expression for automatic tags.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Tag(
        @NotBlank String name,
        String definition,
        String comment,
        @JsonProperty("kernel_opts") String kernelOpts) {
}
