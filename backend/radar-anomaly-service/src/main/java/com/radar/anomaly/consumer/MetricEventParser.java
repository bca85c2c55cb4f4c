package com.radar.anomaly.consumer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.radar.anomaly.model.MetricEvent;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Parses metric event JSON:
 * {@code {"workspace_id", "metric_type", "value", "timestamp", "tags"}}. The timestamp may be an
 * ISO-8601 string or epoch milliseconds.
 */
@Component
public class MetricEventParser {

    private static final Logger log = LoggerFactory.getLogger(MetricEventParser.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    public Optional<MetricEvent> parse(String payload) {
        if (payload == null || payload.isBlank()) return Optional.empty();
        try {
            JsonNode node = objectMapper.readTree(payload);
            String workspaceId = text(node, "workspace_id");
            String metricType = text(node, "metric_type");
            JsonNode valueNode = node.get("value");
            if (workspaceId == null || metricType == null || valueNode == null || !valueNode.isNumber()) {
                log.debug("Metric event missing required fields: {}", payload);
                return Optional.empty();
            }
            double value = valueNode.asDouble();
            if (!Double.isFinite(value)) return Optional.empty();
            Instant timestamp = timestamp(node.get("timestamp"));
            if (timestamp == null) {
                log.debug("Metric event has no usable timestamp: {}", payload);
                return Optional.empty();
            }
            Map<String, String> tags = new HashMap<>();
            JsonNode tagsNode = node.get("tags");
            if (tagsNode != null && tagsNode.isObject()) {
                tagsNode.fields().forEachRemaining(e -> tags.put(e.getKey(), e.getValue().asText()));
            }
            return Optional.of(new MetricEvent(workspaceId, metricType, value, timestamp, tags));
        } catch (Exception e) {
            log.debug("Unparseable metric event: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return null;
        String s = v.asText("").trim();
        return s.isEmpty() ? null : s;
    }

    private static Instant timestamp(JsonNode v) {
        if (v == null || v.isNull()) return null;
        if (v.isNumber()) return Instant.ofEpochMilli(v.asLong());
        try {
            return Instant.parse(v.asText());
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
