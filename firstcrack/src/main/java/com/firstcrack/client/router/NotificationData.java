package com.firstcrack.client.router;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.firstcrack.domain.action.ActionId;
import com.firstcrack.domain.action.ActionRegistry;
import com.firstcrack.domain.brew.BrewType;
import com.firstcrack.domain.stage.NotificationCategory;
import com.firstcrack.domain.stage.StageId;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Typed view of the all-string data map a stage notification carries.
 *
 * Parsed once, when the interaction is decoded. Absent or unparseable values
 * take the defaults below; nothing here throws on bad input.
 * <pre>
 *  type         brew_stage
 *  stage        heating
 *  brewType     espresso
 *  dose         18.0
 *  temperature  93.0
 *  pressure     9.0
 *  elapsedTime  0
 *  actions      none
 *  category     derived from stage
 * </pre>
 * brewId, title and body default to null, "" and "". remainingTime,
 * progress, imageUrl, videoUrl and deepLink stay null when absent.
 */
public record NotificationData(
    String type,
    StageId stage,
    String brewId,
    String title,
    String body,
    BrewType brewType,
    BigDecimal dose,
    BigDecimal temperature,
    BigDecimal pressure,
    int elapsedTime,
    Integer remainingTime,
    Integer progress,
    String imageUrl,
    String videoUrl,
    List<ActionId> actions,
    String deepLink,
    NotificationCategory category
) {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ActionRegistry ACTIONS = new ActionRegistry();

    public static final String DEFAULT_TYPE = "brew_stage";
    public static final String TYPE_COMPLETE = "brew_complete";
    public static final StageId DEFAULT_STAGE = StageId.HEATING;
    public static final BrewType DEFAULT_BREW_TYPE = BrewType.ESPRESSO;
    public static final BigDecimal DEFAULT_DOSE = new BigDecimal("18.0");
    public static final BigDecimal DEFAULT_TEMPERATURE = new BigDecimal("93.0");
    public static final BigDecimal DEFAULT_PRESSURE = new BigDecimal("9.0");

    public NotificationData {
        actions = actions != null ? List.copyOf(actions) : List.of();
    }

    public static NotificationData fromDataMap(Map<String, String> data) {
        Map<String, String> map = data != null ? data : Map.of();

        StageId stage = StageId.fromWire(text(map, "stage")).orElse(DEFAULT_STAGE);
        String category = text(map, "category");
        NotificationCategory parsedCategory = NotificationCategory.forStage(stage);
        if (category != null) {
            for (NotificationCategory candidate : NotificationCategory.values()) {
                if (candidate.name().equals(category)) {
                    parsedCategory = candidate;
                }
            }
        }

        return new NotificationData(
            orDefault(text(map, "type"), DEFAULT_TYPE),
            stage,
            text(map, "brewId"),
            orDefault(text(map, "title"), ""),
            orDefault(text(map, "body"), ""),
            BrewType.fromWire(text(map, "brewType")).orElse(DEFAULT_BREW_TYPE),
            decimal(map, "dose", DEFAULT_DOSE),
            decimal(map, "temperature", DEFAULT_TEMPERATURE),
            decimal(map, "pressure", DEFAULT_PRESSURE),
            integer(map, "elapsedTime", 0),
            integer(map, "remainingTime", null),
            integer(map, "progress", null),
            text(map, "imageUrl"),
            text(map, "videoUrl"),
            actions(text(map, "actions")),
            text(map, "deepLink"),
            parsedCategory);
    }

    public boolean isComplete() {
        return TYPE_COMPLETE.equals(type);
    }

    public boolean hasActions() {
        return !actions.isEmpty();
    }

    /**
     * Decodes the string-encoded actions array. Elements are either
     * {@code {"id": ...}} objects or bare wire ids; unknown ids are skipped.
     */
    static List<ActionId> actions(String encoded) {
        if (encoded == null) {
            return List.of();
        }
        JsonNode node;
        try {
            node = MAPPER.readTree(encoded);
        } catch (JsonProcessingException e) {
            return List.of();
        }
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<ActionId> result = new ArrayList<>();
        for (JsonNode element : node) {
            JsonNode id = element.isObject() ? element.get("id") : element;
            if (id != null && id.isTextual()) {
                ACTIONS.tryResolve(id.asText())
                    .filter(action -> action != ActionId.DEFAULT)
                    .ifPresent(result::add);
            }
        }
        return result;
    }

    private static String text(Map<String, String> map, String key) {
        String value = map.get(key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static String orDefault(String value, String fallback) {
        return value != null ? value : fallback;
    }

    private static BigDecimal decimal(Map<String, String> map, String key, BigDecimal fallback) {
        String value = text(map, key);
        if (value == null) {
            return fallback;
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static Integer integer(Map<String, String> map, String key, Integer fallback) {
        String value = text(map, key);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
