package io.github.drompincen.eligibility.protocol.api;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Field definitions of the cumulative slot store, per topic. Travel destinations are a list of
 * sub-records described by {@link #DESTINATION_FIELDS}.
 */
public final class SlotSchema {

    public enum FieldType {
        DATE,
        BOOLEAN,
        STRING,
        STRING_LIST,
        DESTINATION_LIST
    }

    public static final Map<String, FieldType> DESTINATION_FIELDS = fields(
            "country", FieldType.STRING,
            "region", FieldType.STRING,
            "return_date", FieldType.DATE);

    private static final Map<Topic, Map<String, FieldType>> TOPIC_FIELDS = new EnumMap<>(Topic.class);

    static {
        TOPIC_FIELDS.put(Topic.VACCINE, fields(
                "date", FieldType.DATE,
                "type", FieldType.STRING,
                "other_recent", FieldType.BOOLEAN));
        TOPIC_FIELDS.put(Topic.TATTOO, fields(
                "date", FieldType.DATE,
                "licensed_studio", FieldType.BOOLEAN,
                "location", FieldType.STRING));
        TOPIC_FIELDS.put(Topic.TRAVEL, fields(
                "recent", FieldType.BOOLEAN,
                "destinations", FieldType.DESTINATION_LIST,
                "return_date", FieldType.DATE));
        TOPIC_FIELDS.put(Topic.DONATION, fields(
                "last_date", FieldType.DATE,
                "type", FieldType.STRING));
        TOPIC_FIELDS.put(Topic.MEDICATION, fields(
                "current", FieldType.BOOLEAN,
                "names", FieldType.STRING_LIST,
                "antibiotics", FieldType.BOOLEAN));
        TOPIC_FIELDS.put(Topic.SYMPTOMS, fields(
                "present", FieldType.BOOLEAN,
                "description", FieldType.STRING,
                "onset_date", FieldType.DATE));
    }

    private SlotSchema() {}

    public static Map<String, FieldType> fieldsOf(Topic topic) {
        return TOPIC_FIELDS.get(topic);
    }

    public static Optional<FieldType> fieldType(Topic topic, String field) {
        return Optional.ofNullable(TOPIC_FIELDS.get(topic).get(field));
    }

    public static List<String> dateFields(Topic topic) {
        return TOPIC_FIELDS.get(topic).entrySet().stream()
                .filter(e -> e.getValue() == FieldType.DATE)
                .map(Map.Entry::getKey)
                .toList();
    }

    private static Map<String, FieldType> fields(Object... pairs) {
        Map<String, FieldType> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((String) pairs[i], (FieldType) pairs[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }
}
