package io.github.drompincen.eligibility.runtime.decision;

import io.github.drompincen.eligibility.protocol.api.Decision;
import io.github.drompincen.eligibility.protocol.api.DecisionLabel;
import io.github.drompincen.eligibility.protocol.api.RuleCitation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps loosely-typed decision output onto a canonical {@link Decision}. Pure and idempotent:
 * normalizing {@code normalize(x).toMap()} returns {@code normalize(x)}.
 */
@Component
public class DecisionNormalizer {

    static final double DEFAULT_CONFIDENCE = 0.5;

    private static final Map<String, DecisionLabel> ALIASES = Map.ofEntries(
            Map.entry("eligible", DecisionLabel.ELIGIBLE),
            Map.entry("ok", DecisionLabel.ELIGIBLE),
            Map.entry("yes", DecisionLabel.ELIGIBLE),
            Map.entry("ineligible", DecisionLabel.INELIGIBLE),
            Map.entry("no", DecisionLabel.INELIGIBLE),
            Map.entry("defer", DecisionLabel.DEFER),
            Map.entry("deferred", DecisionLabel.DEFER),
            Map.entry("temporary deferral", DecisionLabel.DEFER),
            Map.entry("needmoreinfo", DecisionLabel.NEED_MORE_INFO),
            Map.entry("need_more_info", DecisionLabel.NEED_MORE_INFO),
            Map.entry("need more info", DecisionLabel.NEED_MORE_INFO),
            Map.entry("clarify", DecisionLabel.NEED_MORE_INFO));

    static final List<String> LABEL_KEYS = List.of("decision", "label", "status");
    private static final List<String> NESTED_LABEL_KEYS = List.of("label", "status");

    public Decision normalize(Map<String, ?> raw) {
        Map<String, ?> source = raw != null ? raw : Map.of();

        Object labelValue = first(source, LABEL_KEYS);
        if (labelValue instanceof Map<?, ?> nested) {
            labelValue = first(nested, NESTED_LABEL_KEYS);
        }
        DecisionLabel label = canonicalLabel(labelValue == null ? "" : String.valueOf(labelValue));

        Object rationale = source.get("rationale");
        List<String> missing = stringList(source.get("missing_fields"));
        if (missing.size() > Decision.MAX_MISSING_FIELDS) {
            missing = missing.subList(0, Decision.MAX_MISSING_FIELDS);
        }

        return new Decision(
                label,
                confidence(source.get("confidence")),
                rationale == null ? "" : String.valueOf(rationale),
                missing,
                stringList(source.get("safety_flags")),
                citations(source.get("rule_citations")),
                optionalString(source.get("used_model")),
                optionalString(source.get("final_status")));
    }

    public static DecisionLabel canonicalLabel(String value) {
        String s = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        DecisionLabel alias = ALIASES.get(s);
        if (alias != null) {
            return alias;
        }
        if ((s.contains("need") && s.contains("info")) || s.contains("clarify")) {
            return DecisionLabel.NEED_MORE_INFO;
        }
        if (s.contains("defer")) {
            return DecisionLabel.DEFER;
        }
        if (s.contains("inelig") || s.contains("not elig") || s.contains("not allow") || s.contains("cannot")) {
            return DecisionLabel.INELIGIBLE;
        }
        if (s.contains("elig") || s.contains("allow") || s.contains("can donate")) {
            return DecisionLabel.ELIGIBLE;
        }
        return DecisionLabel.NEED_MORE_INFO;
    }

    static double confidence(Object value) {
        double c;
        if (value instanceof Number n) {
            c = n.doubleValue();
        } else if (value instanceof String s) {
            try {
                c = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                c = DEFAULT_CONFIDENCE;
            }
        } else {
            c = DEFAULT_CONFIDENCE;
        }
        if (Double.isNaN(c) || Double.isInfinite(c)) {
            c = DEFAULT_CONFIDENCE;
        }
        return Math.max(0.0, Math.min(1.0, c));
    }

    private static Object first(Map<?, ?> map, List<String> keys) {
        for (String key : keys) {
            Object value = map.get(key);
            if (value != null) return value;
        }
        return null;
    }

    private static List<String> stringList(Object value) {
        List<String> out = new ArrayList<>();
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                if (item != null && !String.valueOf(item).isBlank()) out.add(String.valueOf(item));
            }
        } else if (value != null && !String.valueOf(value).isBlank()) {
            out.add(String.valueOf(value));
        }
        return out;
    }

    private static List<RuleCitation> citations(Object value) {
        LinkedHashSet<RuleCitation> out = new LinkedHashSet<>();
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                RuleCitation citation = citation(item);
                if (citation != null) out.add(citation);
            }
        }
        return new ArrayList<>(out);
    }

    static RuleCitation citation(Object item) {
        if (item instanceof RuleCitation c) {
            return c;
        }
        if (item instanceof Map<?, ?> m) {
            Object docId = m.get("doc_id") != null ? m.get("doc_id") : m.get("id");
            if (docId == null || String.valueOf(docId).isBlank()) return null;
            Object text = m.get("text");
            return new RuleCitation(String.valueOf(docId), text != null ? String.valueOf(text) : "");
        }
        if (item != null && !String.valueOf(item).isBlank()) {
            return RuleCitation.of(String.valueOf(item));
        }
        return null;
    }

    private static String optionalString(Object value) {
        return value != null ? String.valueOf(value) : null;
    }
}
