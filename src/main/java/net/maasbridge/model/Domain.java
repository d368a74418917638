package net.maasbridge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * MAAS DNS domain.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Domain(
        @NotNull Integer id,
        @NotBlank String name,
        Boolean authoritative,
        @PositiveOrZero Integer ttl,
        @JsonProperty("resource_record_count") Integer resourceRecordCount,
        @JsonProperty("is_default") Boolean isDefault) {
}
