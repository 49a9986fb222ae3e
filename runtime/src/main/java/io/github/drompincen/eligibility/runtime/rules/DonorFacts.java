package io.github.drompincen.eligibility.runtime.rules;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Typed reads over the opaque donor record. Accepts the key spellings seen in donor exports.
 */
final class DonorFacts {

    private final Map<String, Object> donor;

    DonorFacts(Map<String, Object> donor) {
        this.donor = donor != null ? donor : Map.of();
    }

    String sex() {
        Object value = donor.get("sex");
        if (value == null) value = donor.get("gender");
        if (value == null) return "";
        String s = String.valueOf(value).trim().toUpperCase(Locale.ROOT);
        if (s.startsWith("F")) return "F";
        if (s.startsWith("M")) return "M";
        return s;
    }

    OptionalDouble hemoglobin() {
        return number("hb_g_dl", "hemoglobin", "hb");
    }

    OptionalDouble systolic() {
        OptionalDouble direct = number("systolic_bp", "systolic");
        return direct.isPresent() ? direct : bloodPressurePart(0);
    }

    OptionalDouble diastolic() {
        OptionalDouble direct = number("diastolic_bp", "diastolic");
        return direct.isPresent() ? direct : bloodPressurePart(1);
    }

    OptionalDouble bmi() {
        return number("bmi");
    }

    OptionalDouble age() {
        return number("age");
    }

    List<String> flags() {
        Object value = donor.get("questionnaire_flags");
        List<String> flags = new ArrayList<>();
        if (value instanceof Collection<?> items) {
            items.forEach(item -> flags.add(String.valueOf(item).trim().toLowerCase(Locale.ROOT)));
        } else if (value instanceof String s && !s.isBlank()) {
            for (String part : s.split("[,;]")) {
                if (!part.isBlank()) flags.add(part.trim().toLowerCase(Locale.ROOT));
            }
        }
        return flags;
    }

    private OptionalDouble number(String... keys) {
        for (String key : keys) {
            OptionalDouble parsed = parse(donor.get(key));
            if (parsed.isPresent()) return parsed;
        }
        return OptionalDouble.empty();
    }

    private OptionalDouble bloodPressurePart(int index) {
        Object bp = donor.get("blood_pressure");
        if (!(bp instanceof String s) || !s.contains("/")) {
            return OptionalDouble.empty();
        }
        String[] parts = s.split("/");
        return index < parts.length ? parse(parts[index]) : OptionalDouble.empty();
    }

    static OptionalDouble parse(Object value) {
        if (value instanceof Number n) {
            return OptionalDouble.of(n.doubleValue());
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return OptionalDouble.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }
}
