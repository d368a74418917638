package net.maasbridge.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Compact reference to a related MAAS object (zone, pool, domain) as embedded in machine and device payloads.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResourceRef(Integer id, String name) {
}
