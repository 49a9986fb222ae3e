package io.github.drompincen.eligibility.runtime.clarify;

import io.github.drompincen.eligibility.protocol.api.SlotSchema;
import io.github.drompincen.eligibility.protocol.api.Topic;
import io.github.drompincen.eligibility.runtime.slots.SlotCoercer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Deterministic veto over clarifying questions proposed by the {@link ClarifierJudge}. A
 * candidate survives only when no rule below objects to it.
 */
@Component
public class ClarifyFilter {

    private static final Logger log = LoggerFactory.getLogger(ClarifyFilter.class);
    public static final int MAX_ASKS = 3;

    private static final Map<Topic, String> AFFIRMING_FLAGS = Map.of(
            Topic.TRAVEL, "recent",
            Topic.MEDICATION, "current",
            Topic.SYMPTOMS, "present");

    public enum Veto {
        POLICY_QUESTION,
        DATE_KNOWN,
        TYPE_KNOWN,
        OTHER_VACCINATIONS_DENIED,
        TRAVEL_NOT_RAISED,
        TRAVEL_DENIED,
        LAST_DONATION_NOT_RAISED,
        LAST_DONATION_KNOWN,
        NO_SYMPTOMS_MENTIONED,
        TOPIC_NEGATED
    }

    public List<String> filter(List<String> candidates, String rawText,
                               Map<String, Map<String, Object>> slots, Map<String, Object> donor) {
        List<String> kept = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (String candidate : candidates) {
            if (candidate == null || candidate.isBlank() || !seen.add(candidate.trim())) {
                continue;
            }
            Optional<Veto> veto = veto(candidate, rawText, slots, donor);
            if (veto.isPresent()) {
                log.debug("Dropped clarifying question '{}' ({}, patterns v{}/v{})", candidate, veto.get(),
                        TopicPatterns.VERSION, ClarifyPatterns.VERSION);
                continue;
            }
            kept.add(candidate.trim());
            if (kept.size() == MAX_ASKS) break;
        }
        return kept;
    }

    public Optional<Veto> veto(String candidate, String rawText,
                               Map<String, Map<String, Object>> slots, Map<String, Object> donor) {
        String raw = rawText != null ? rawText : "";
        Map<String, Map<String, Object>> known = slots != null ? slots : Map.of();
        Map<String, Object> record = donor != null ? donor : Map.of();
        Set<Topic> candidateTopics = TopicPatterns.mentioned(candidate);

        if (ClarifyPatterns.isPolicyQuestion(candidate)) {
            return Optional.of(Veto.POLICY_QUESTION);
        }
        for (Topic topic : candidateTopics) {
            if (currentlyNegated(raw, topic, known)) return Optional.of(Veto.TOPIC_NEGATED);
        }
        if (ClarifyPatterns.isDateAsk(candidate)
                && (ClarifyPatterns.containsConcreteDate(raw) || dateKnown(candidateTopics, known))) {
            return Optional.of(Veto.DATE_KNOWN);
        }
        if (ClarifyPatterns.isConfirmTypeAsk(candidate) && present(field(known, Topic.VACCINE, "type"))) {
            return Optional.of(Veto.TYPE_KNOWN);
        }
        if (ClarifyPatterns.isOtherVaccinationsAsk(candidate)
                && (TopicPatterns.otherVaccinationsDenied(raw)
                || Boolean.FALSE.equals(field(known, Topic.VACCINE, "other_recent")))) {
            return Optional.of(Veto.OTHER_VACCINATIONS_DENIED);
        }
        if (candidateTopics.contains(Topic.TRAVEL)) {
            if (currentlyNegated(raw, Topic.TRAVEL, known)
                    || Boolean.FALSE.equals(field(known, Topic.TRAVEL, "recent"))) {
                return Optional.of(Veto.TRAVEL_DENIED);
            }
            if (!TopicPatterns.mentions(raw, Topic.TRAVEL) && !known.containsKey(Topic.TRAVEL.key())) {
                return Optional.of(Veto.TRAVEL_NOT_RAISED);
            }
        }
        if (ClarifyPatterns.isLastDonationAsk(candidate)) {
            if (present(record.get("last_donation_date")) || present(record.get("last_donation"))
                    || present(field(known, Topic.DONATION, "last_date"))) {
                return Optional.of(Veto.LAST_DONATION_KNOWN);
            }
            if (!TopicPatterns.mentions(raw, Topic.DONATION) && !known.containsKey(Topic.DONATION.key())) {
                return Optional.of(Veto.LAST_DONATION_NOT_RAISED);
            }
        }
        if (ClarifyPatterns.isGenericConditionsAsk(candidate) && !TopicPatterns.mentions(raw, Topic.SYMPTOMS)) {
            return Optional.of(Veto.NO_SYMPTOMS_MENTIONED);
        }
        return Optional.empty();
    }

    /**
     * A topic counts as denied only if the latest utterance that touches it is a denial and no
     * slot affirms it. Utterances are the lines of {@code raw}, oldest first.
     */
    static boolean currentlyNegated(String raw, Topic topic, Map<String, Map<String, Object>> slots) {
        if (affirmed(topic, slots)) {
            return false;
        }
        String[] utterances = raw.split("\\R");
        for (int i = utterances.length - 1; i >= 0; i--) {
            if (TopicPatterns.negates(utterances[i], topic)) return true;
            if (TopicPatterns.mentions(utterances[i], topic)) return false;
        }
        return false;
    }

    private static boolean affirmed(Topic topic, Map<String, Map<String, Object>> slots) {
        String flag = AFFIRMING_FLAGS.get(topic);
        if (flag != null && Boolean.TRUE.equals(field(slots, topic, flag))) {
            return true;
        }
        return topic == Topic.TRAVEL && field(slots, topic, "destinations") instanceof List<?> d && !d.isEmpty();
    }

    private static boolean dateKnown(Set<Topic> candidateTopics, Map<String, Map<String, Object>> slots) {
        Set<Topic> scope = candidateTopics.isEmpty() ? Set.of(Topic.values()) : candidateTopics;
        for (Topic topic : scope) {
            for (String field : SlotSchema.dateFields(topic)) {
                if (SlotCoercer.coerceDate(field(slots, topic, field)) != null) return true;
            }
            if (topic == Topic.TRAVEL && field(slots, topic, "destinations") instanceof List<?> destinations) {
                for (Object destination : destinations) {
                    if (destination instanceof Map<?, ?> d && SlotCoercer.coerceDate(d.get("return_date")) != null) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private static Object field(Map<String, Map<String, Object>> slots, Topic topic, String field) {
        Map<String, Object> fields = slots.get(topic.key());
        return fields != null ? fields.get(field) : null;
    }

    private static boolean present(Object value) {
        return value != null && !(value instanceof String s && s.isBlank());
    }
}
