package com.statuswatch.core.status;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * One observable sub-status of an entity: its kind, the entity name and the status fields.
 *
 * <p>Fields normally include {@code current}, and optionally {@code message},
 * {@code since} and {@code version}.
 *
 * @param kind which sub-status this is
 * @param itemName machine id, container id, application name or unit name
 * @param fields the status fields
 */
public record StatusItem(StatusKind kind, String itemName, JsonNode fields) {

    private static final Logger log = LoggerFactory.getLogger(StatusItem.class);

    private static final Pattern CONTROLLER_SINCE = Pattern.compile("\\d{1,2} [A-Za-z]{3} \\d{4} .*");
    private static final DateTimeFormatter CONTROLLER_FORMAT =
        DateTimeFormatter.ofPattern("d MMM yyyy HH:mm:ssXXX", Locale.ENGLISH);

    /**
     * Compact constructor with validation.
     */
    public StatusItem {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(itemName, "itemName must not be null");
        Objects.requireNonNull(fields, "fields must not be null");
    }

    /**
     * Creates an item from an entity record, selecting the sub-mapping for {@code kind}.
     *
     * @param kind status kind
     * @param itemName entity name
     * @param record the entity's full record
     * @return status item
     */
    public static StatusItem of(StatusKind kind, String itemName, JsonNode record) {
        return new StatusItem(kind, itemName, kind.select(record));
    }

    public String current() {
        return text("current");
    }

    public String message() {
        return text("message");
    }

    public String since() {
        return text("since");
    }

    public String version() {
        return text("version");
    }

    /**
     * Parses the {@code since} field.
     *
     * <p>Accepts the controller's {@code 19 Aug 2016 05:36:42Z} form (any offset) and ISO-8601.
     *
     * @return the instant, or empty when the field is absent or unparseable
     */
    public Optional<Instant> sinceInstant() {
        String since = since();
        if (since == null) {
            return Optional.empty();
        }
        DateTimeFormatter format = CONTROLLER_SINCE.matcher(since).matches()
            ? CONTROLLER_FORMAT
            : DateTimeFormatter.ISO_OFFSET_DATE_TIME;
        try {
            return Optional.of(OffsetDateTime.parse(since, format).toInstant());
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable since value for {}: {}", itemName, since);
            return Optional.empty();
        }
    }

    private String text(String field) {
        JsonNode node = fields.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
