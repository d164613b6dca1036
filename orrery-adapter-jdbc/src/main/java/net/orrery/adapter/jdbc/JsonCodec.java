package net.orrery.adapter.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import net.orrery.core.model.StateDetails;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** JSON columns: run parameters, tags and state details. */
public final class JsonCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};
    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {};

    private JsonCodec() {
    }

    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize JSON", e);
        }
    }

    public static Map<String, Object> toMap(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return MAPPER.readValue(json, MAP);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt JSON object column: " + json, e);
        }
    }

    public static List<String> toStrings(String json) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return MAPPER.readValue(json, STRINGS);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt JSON array column: " + json, e);
        }
    }

    /** {@code {"scheduled_time": "...", "schedule_id": "...", "auto_scheduled": true}} */
    public static String detailsToJson(StateDetails d) {
        ObjectNode node = MAPPER.createObjectNode();
        if (d.scheduledTime() != null) node.put("scheduled_time", d.scheduledTime().toString());
        if (d.scheduleId() != null) node.put("schedule_id", d.scheduleId().toString());
        node.put("auto_scheduled", d.autoScheduled());
        return node.toString();
    }

    public static StateDetails detailsFromJson(String json) {
        if (json == null || json.isBlank()) return StateDetails.empty();
        try {
            JsonNode node = MAPPER.readTree(json);
            JsonNode time = node.get("scheduled_time");
            JsonNode schedule = node.get("schedule_id");
            return new StateDetails(
                    time == null || time.isNull() ? null : Instant.parse(time.asText()),
                    schedule == null || schedule.isNull() ? null : UUID.fromString(schedule.asText()),
                    node.path("auto_scheduled").asBoolean(false)
            );
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt state_details column: " + json, e);
        }
    }
}
