package com.prizeflow.allocation.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.prizeflow.allocation.engine.CriteriaSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Lenient decoder for the {@code criteria_json} document of a category.
 * Unknown fields are dropped, malformed values of known fields are treated as absent.
 * Decoding never throws on stored data.
 */
public final class CriteriaSetJsonCodec {

    private static final Logger log = LoggerFactory.getLogger(CriteriaSetJsonCodec.class);

    private static final String FIELD_GENDER = "gender";
    private static final String FIELD_MIN_AGE = "min_age";
    private static final String FIELD_MAX_AGE = "max_age";
    private static final String FIELD_MIN_RATING = "min_rating";
    private static final String FIELD_MAX_RATING = "max_rating";
    private static final String FIELD_UNRATED_ONLY = "unrated_only";
    private static final String FIELD_ALLOWED_DISABILITIES = "allowed_disabilities";
    private static final String FIELD_ALLOWED_STATES = "allowed_states";
    private static final String FIELD_ALLOWED_CITIES = "allowed_cities";
    private static final String FIELD_ALLOWED_CLUBS = "allowed_clubs";
    private static final String FIELD_ALLOWED_GROUPS = "allowed_groups";
    private static final String FIELD_ALLOWED_TYPES = "allowed_types";

    private static final Set<String> KNOWN_FIELDS = Set.of(
            FIELD_GENDER,
            FIELD_MIN_AGE,
            FIELD_MAX_AGE,
            FIELD_MIN_RATING,
            FIELD_MAX_RATING,
            FIELD_UNRATED_ONLY,
            FIELD_ALLOWED_DISABILITIES,
            FIELD_ALLOWED_STATES,
            FIELD_ALLOWED_CITIES,
            FIELD_ALLOWED_CLUBS,
            FIELD_ALLOWED_GROUPS,
            FIELD_ALLOWED_TYPES
    );

    private static final Set<String> OPEN_GENDER_VALUES = Set.of("", "OPEN", "ANY", "ALL");

    private CriteriaSetJsonCodec() {
    }

    public static CriteriaSet fromJson(JsonNode criteriaJson) {
        if (criteriaJson == null || criteriaJson.isNull() || criteriaJson.isMissingNode()) {
            return CriteriaSet.UNCONSTRAINED;
        }
        if (!criteriaJson.isObject()) {
            log.warn("[alloc.criteria] ignoring non-object criteria document: {}", criteriaJson.getNodeType());
            return CriteriaSet.UNCONSTRAINED;
        }

        logUnknownFields(criteriaJson);

        return new CriteriaSet(
                optionalGender(criteriaJson),
                optionalInt(criteriaJson, FIELD_MIN_AGE),
                optionalInt(criteriaJson, FIELD_MAX_AGE),
                optionalInt(criteriaJson, FIELD_MIN_RATING),
                optionalInt(criteriaJson, FIELD_MAX_RATING),
                optionalFlag(criteriaJson, FIELD_UNRATED_ONLY),
                optionalTextList(criteriaJson, FIELD_ALLOWED_DISABILITIES),
                optionalTextList(criteriaJson, FIELD_ALLOWED_STATES),
                optionalTextList(criteriaJson, FIELD_ALLOWED_CITIES),
                optionalTextList(criteriaJson, FIELD_ALLOWED_CLUBS),
                optionalTextList(criteriaJson, FIELD_ALLOWED_GROUPS),
                optionalTextList(criteriaJson, FIELD_ALLOWED_TYPES)
        );
    }

    public static ObjectNode toJson(CriteriaSet criteria) {
        if (criteria == null) {
            throw new IllegalArgumentException("Criteria set is required");
        }

        ObjectNode root = JsonNodeFactory.instance.objectNode();
        if (criteria.gender() != null) {
            root.put(FIELD_GENDER, criteria.gender().name());
        }
        putIfPresent(root, FIELD_MIN_AGE, criteria.minAge());
        putIfPresent(root, FIELD_MAX_AGE, criteria.maxAge());
        putIfPresent(root, FIELD_MIN_RATING, criteria.minRating());
        putIfPresent(root, FIELD_MAX_RATING, criteria.maxRating());
        if (criteria.unratedOnly()) {
            root.put(FIELD_UNRATED_ONLY, true);
        }
        putListIfPresent(root, FIELD_ALLOWED_DISABILITIES, criteria.allowedDisabilities());
        putListIfPresent(root, FIELD_ALLOWED_STATES, criteria.allowedStates());
        putListIfPresent(root, FIELD_ALLOWED_CITIES, criteria.allowedCities());
        putListIfPresent(root, FIELD_ALLOWED_CLUBS, criteria.allowedClubs());
        putListIfPresent(root, FIELD_ALLOWED_GROUPS, criteria.allowedGroups());
        putListIfPresent(root, FIELD_ALLOWED_TYPES, criteria.allowedTypes());
        return root;
    }

    private static Gender optionalGender(JsonNode root) {
        JsonNode genderNode = root.get(FIELD_GENDER);
        if (genderNode == null || genderNode.isNull()) {
            return null;
        }
        if (!genderNode.isTextual()) {
            log.warn("[alloc.criteria] field '{}' is not textual, treating as absent", FIELD_GENDER);
            return null;
        }

        String value = genderNode.textValue().trim().toUpperCase(Locale.ROOT);
        if (OPEN_GENDER_VALUES.contains(value)) {
            return null;
        }
        return switch (value) {
            case "M", "MALE" -> Gender.M;
            case "F", "FEMALE", "GIRL" -> Gender.F;
            case "OTHER" -> Gender.OTHER;
            default -> {
                log.warn("[alloc.criteria] unrecognized gender '{}', treating as absent", genderNode.textValue());
                yield null;
            }
        };
    }

    private static Integer optionalInt(JsonNode root, String fieldName) {
        JsonNode valueNode = root.get(fieldName);
        if (valueNode == null || valueNode.isNull()) {
            return null;
        }
        if (valueNode.isIntegralNumber() && valueNode.canConvertToInt()) {
            return valueNode.intValue();
        }
        if (valueNode.isTextual()) {
            String text = valueNode.textValue().trim();
            if (text.isEmpty()) {
                return null;
            }
            try {
                return Integer.parseInt(text);
            } catch (NumberFormatException ex) {
                log.warn("[alloc.criteria] field '{}' is not an integer ('{}'), treating as absent", fieldName, text);
                return null;
            }
        }
        log.warn("[alloc.criteria] field '{}' is not an integer, treating as absent", fieldName);
        return null;
    }

    private static boolean optionalFlag(JsonNode root, String fieldName) {
        JsonNode valueNode = root.get(fieldName);
        if (valueNode == null || valueNode.isNull()) {
            return false;
        }
        if (valueNode.isBoolean()) {
            return valueNode.booleanValue();
        }
        log.warn("[alloc.criteria] field '{}' is not a boolean, treating as absent", fieldName);
        return false;
    }

    private static List<String> optionalTextList(JsonNode root, String fieldName) {
        JsonNode listNode = root.get(fieldName);
        if (listNode == null || listNode.isNull()) {
            return List.of();
        }
        if (!listNode.isArray()) {
            log.warn("[alloc.criteria] field '{}' is not an array, treating as absent", fieldName);
            return List.of();
        }

        List<String> values = new ArrayList<>();
        for (JsonNode element : listNode) {
            if (element.isTextual() && !element.textValue().isBlank()) {
                values.add(element.textValue().trim());
            } else if (!element.isNull()) {
                log.warn("[alloc.criteria] dropping non-text entry in '{}'", fieldName);
            }
        }
        return values;
    }

    private static void logUnknownFields(JsonNode node) {
        var fieldIterator = node.fieldNames();
        while (fieldIterator.hasNext()) {
            String fieldName = fieldIterator.next();
            if (!KNOWN_FIELDS.contains(fieldName)) {
                log.debug("[alloc.criteria] ignoring unknown criteria field '{}'", fieldName);
            }
        }
    }

    private static void putIfPresent(ObjectNode root, String fieldName, Integer value) {
        if (value != null) {
            root.put(fieldName, value);
        }
    }

    private static void putListIfPresent(ObjectNode root, String fieldName, List<String> values) {
        if (values == null || values.isEmpty()) {
            return;
        }
        ArrayNode array = root.putArray(fieldName);
        values.forEach(array::add);
    }
}
