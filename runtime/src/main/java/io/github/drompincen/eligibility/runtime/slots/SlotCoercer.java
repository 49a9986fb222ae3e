package io.github.drompincen.eligibility.runtime.slots;

import io.github.drompincen.eligibility.protocol.api.SlotSchema;
import io.github.drompincen.eligibility.protocol.api.SlotSchema.FieldType;
import io.github.drompincen.eligibility.protocol.api.Topic;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conforms an untrusted slot delta to {@link SlotSchema}. Unknown topics and fields are
 * dropped, values of the wrong shape are coerced where the intent is clear and dropped
 * otherwise.
 */
public final class SlotCoercer {

    private static final Pattern ISO_DATE = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2})");
    private static final Set<String> TRUE_WORDS = Set.of("true", "yes", "y");
    private static final Set<String> FALSE_WORDS = Set.of("false", "no", "n", "none", "never");

    private SlotCoercer() {}

    public static Map<String, Map<String, Object>> coerce(Object rawSlots) {
        Map<String, Map<String, Object>> out = new LinkedHashMap<>();
        if (!(rawSlots instanceof Map<?, ?> topics)) {
            return out;
        }
        for (Map.Entry<?, ?> entry : topics.entrySet()) {
            Optional<Topic> topic = Topic.fromKey(String.valueOf(entry.getKey()));
            if (topic.isEmpty() || !(entry.getValue() instanceof Map<?, ?> fields)) {
                continue;
            }
            Map<String, Object> coerced = coerceFields(fields, SlotSchema.fieldsOf(topic.get()));
            out.put(topic.get().key(), coerced);
        }
        return out;
    }

    private static Map<String, Object> coerceFields(Map<?, ?> fields, Map<String, FieldType> schema) {
        Map<String, Object> coerced = new LinkedHashMap<>();
        for (Map.Entry<?, ?> field : fields.entrySet()) {
            String name = String.valueOf(field.getKey()).trim().toLowerCase(Locale.ROOT);
            FieldType type = schema.get(name);
            if (type == null) {
                continue;
            }
            Object value = coerceValue(field.getValue(), type);
            if (value != null) {
                coerced.put(name, value);
            }
        }
        return coerced;
    }

    static Object coerceValue(Object value, FieldType type) {
        if (value == null) {
            return null;
        }
        return switch (type) {
            case DATE -> coerceDate(value);
            case BOOLEAN -> coerceBoolean(value);
            case STRING -> coerceString(value);
            case STRING_LIST -> coerceStringList(value);
            case DESTINATION_LIST -> coerceDestinations(value);
        };
    }

    public static String coerceDate(Object value) {
        if (!(value instanceof String s)) {
            return null;
        }
        Matcher m = ISO_DATE.matcher(s.trim());
        if (!m.find()) {
            return null;
        }
        try {
            return LocalDate.parse(m.group(1)).toString();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Boolean coerceBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.intValue() != 0;
        }
        String s = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
        if (TRUE_WORDS.contains(s)) return Boolean.TRUE;
        if (FALSE_WORDS.contains(s)) return Boolean.FALSE;
        return null;
    }

    private static String coerceString(Object value) {
        if (value instanceof String s) {
            String trimmed = s.trim();
            return trimmed.isEmpty() ? null : trimmed;
        }
        if (value instanceof Number || value instanceof Boolean) {
            return String.valueOf(value);
        }
        return null;
    }

    private static List<String> coerceStringList(Object value) {
        List<String> out = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                String s = coerceString(item);
                if (s != null) out.add(s);
            }
        } else {
            String s = coerceString(value);
            if (s != null) out.add(s);
        }
        return out.isEmpty() ? null : out;
    }

    private static List<Map<String, Object>> coerceDestinations(Object value) {
        List<?> items = value instanceof List<?> list ? list : List.of(value);
        List<Map<String, Object>> out = new ArrayList<>();
        for (Object item : items) {
            Map<String, Object> destination;
            if (item instanceof Map<?, ?> m) {
                destination = coerceFields(m, SlotSchema.DESTINATION_FIELDS);
            } else {
                String country = coerceString(item);
                destination = new LinkedHashMap<>();
                if (country != null) destination.put("country", country);
            }
            if (!destination.isEmpty()) {
                out.add(destination);
            }
        }
        return out.isEmpty() ? null : out;
    }
}
