package com.statuswatch.core.status;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * The kind of sub-status a {@link StatusItem} describes.
 *
 * <p>Each kind maps to the status-text field holding it, plus any legacy field names older
 * controllers emit.
 */
public enum StatusKind {
    APPLICATION("application-status", "service-status"),
    WORKLOAD("workload-status"),
    MACHINE("machine-status"),
    AGENT("juju-status", "agent-status");

    private final String field;
    private final List<String> legacyFields;

    StatusKind(String field, String... legacyFields) {
        this.field = field;
        this.legacyFields = List.of(legacyFields);
    }

    /**
     * Returns the primary status-text field for this kind.
     *
     * @return field name, e.g. {@code machine-status}
     */
    public String field() {
        return field;
    }

    /**
     * Selects this kind's sub-mapping from an entity record.
     *
     * <p>If the record has no sub-mapping under the primary or a legacy field name, the
     * record itself is the field set.
     *
     * @param record entity record
     * @return the status fields
     */
    public JsonNode select(JsonNode record) {
        JsonNode node = record.get(field);
        if (node != null && node.isObject()) {
            return node;
        }
        for (String legacy : legacyFields) {
            node = record.get(legacy);
            if (node != null && node.isObject()) {
                return node;
            }
        }
        return record;
    }
}
