package com.questrail.cabin.advisor.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.cabin.advisor.internal.time.WallClock;
import com.questrail.cabin.api.ActionEvent;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Objects;

/**
 * ActionEventDecoder
 * -----------------------------------------------------------------------------
 * Decodes one {@code vehicle/actions} payload into an {@link ActionEvent}.
 *
 * <pre>
 *   {"action": "climate_increase", "timestamp": "2024-05-01T08:30:00", "value": 23}
 * </pre>
 *
 * <ul>
 *   <li>{@code timestamp} is optional; when absent or null the wall clock's
 *       current instant is used. A timestamp without an offset is read in the
 *       wall clock's zone.</li>
 *   <li>{@code value} is optional; absent and {@code null} both mean "no value".</li>
 *   <li>Unknown action names are accepted unchanged.</li>
 *   <li>Unknown fields are ignored.</li>
 * </ul>
 *
 * <p>Every failure is reported as {@link ActionDecodeException}.</p>
 */
public final class ActionEventDecoder
{
    private final WallClock wallClock;
    private final ObjectMapper objectMapper;

    public ActionEventDecoder(WallClock wallClock) {
        this(wallClock, new ObjectMapper());
    }

    public ActionEventDecoder(WallClock wallClock, ObjectMapper objectMapper) {
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public ActionEvent decode(byte[] payload) {
        Objects.requireNonNull(payload, "payload");

        final JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (IOException e) {
            throw new ActionDecodeException("Payload is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ActionDecodeException("Payload is not a JSON object");
        }

        return new ActionEvent(
                decodeAction(root.get("action")),
                decodeTimestamp(root.get("timestamp")),
                decodeValue(root.get("value")));
    }

    private static String decodeAction(JsonNode node) {
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw new ActionDecodeException("Missing or blank 'action'");
        }
        return node.asText();
    }

    private Instant decodeTimestamp(JsonNode node) {
        if (node == null || node.isNull()) {
            return wallClock.now();
        }
        if (!node.isTextual()) {
            throw new ActionDecodeException("'timestamp' must be an ISO-8601 string");
        }
        String text = node.asText();
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(text, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return zoned.toInstant();
            }
            return ((LocalDateTime) parsed).atZone(wallClock.zone()).toInstant();
        } catch (DateTimeParseException e) {
            throw new ActionDecodeException("Unparseable 'timestamp': " + text, e);
        }
    }

    private static Double decodeValue(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isNumber()) {
            throw new ActionDecodeException("'value' must be a number or null");
        }
        return node.doubleValue();
    }
}
