package net.maasbridge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * MAAS availability zone.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Zone(@NotNull Integer id, @NotBlank String name, String description) {
}
