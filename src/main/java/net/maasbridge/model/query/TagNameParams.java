package net.maasbridge.model.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * Path parameters of tag URIs. Tag names are restricted to letters, digits, underscore and hyphen.
 */
public record TagNameParams(
        @JsonProperty("tag_name")
        @NotNull
        @Pattern(regexp = "^[a-zA-Z0-9_-]+$", message = "Tag name must contain only letters, digits, underscores or hyphens")
        String tagName) {
}
