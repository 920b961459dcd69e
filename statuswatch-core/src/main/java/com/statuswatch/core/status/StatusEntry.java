package com.statuswatch.core.status;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * A named record from a status document: a machine, container, unit or subordinate.
 *
 * @param name entity id (machine id, container id or unit name)
 * @param data the entity's record as it appears in the status tree
 */
public record StatusEntry(String name, JsonNode data) {

    /**
     * Compact constructor with validation.
     */
    public StatusEntry {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(data, "data must not be null");
    }

    /**
     * Returns a text field of the record, or {@code null} when absent.
     *
     * @param field field name
     * @return field text or null
     */
    public String text(String field) {
        JsonNode node = data.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
