package io.github.drompincen.eligibility.runtime.slots;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.eligibility.protocol.api.SlotSchema;
import io.github.drompincen.eligibility.protocol.api.Topic;
import io.github.drompincen.eligibility.runtime.agent.graph.ConversationState;
import io.github.drompincen.eligibility.runtime.agent.llm.ModelPrompt;
import io.github.drompincen.eligibility.runtime.agent.llm.ModelReply;
import io.github.drompincen.eligibility.runtime.agent.llm.StructuredModelClient;
import io.github.drompincen.eligibility.runtime.config.EligibilityProperties;
import io.github.drompincen.eligibility.runtime.json.JsonPayloads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns free-text answers into structured slot facts. The model is the only source of facts;
 * when it fails or returns nothing usable the stored slots stay as they were.
 */
@Component
public class SlotExtractor {

    private static final Logger log = LoggerFactory.getLogger(SlotExtractor.class);
    public static final String AGENT_ID = "slot-extractor";
    private static final int HISTORY_WINDOW = 5;

    private static final String SYSTEM_PROMPT = """
            You extract structured facts for a blood-donor eligibility assistant.
            Return a single JSON object and nothing else:
            {"topics_detected": ["<topic>", ...], "slots": {"<topic>": {"<field>": <value>}}}

            Rules:
            - Only record facts the user explicitly stated in the question or the recent history. Never guess.
            - Explicit negations ("no", "none", "never", "I didn't") become false for yes/no fields,
              or the string "none" for text fields.
            - Dates must be ISO-8601 (YYYY-MM-DD). Resolve relative dates ("last week", "3 months ago")
              against today's date given in the input. If a date cannot be resolved, omit the field.
            - Omit any field you have no fact for. Do not repeat facts already present in known_slots
              unless the user corrected them.

            Topics and fields:
            %s
            """;

    private final StructuredModelClient modelClient;
    private final ObjectMapper objectMapper;
    private final EligibilityProperties properties;
    private final Clock clock;

    public SlotExtractor(StructuredModelClient modelClient, ObjectMapper objectMapper,
                         EligibilityProperties properties, Clock clock) {
        this.modelClient = modelClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    public SlotExtraction extract(String question, List<String> history, Map<String, Map<String, Object>> slots) {
        if (question == null || question.isBlank()) {
            return SlotExtraction.unchanged();
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("today", LocalDate.now(clock).toString());
        payload.put("question", question != null ? question : "");
        payload.put("history", history != null ? history : List.of());
        payload.put("known_slots", slots != null ? slots : Map.of());

        ModelReply reply = modelClient.request(new ModelPrompt(AGENT_ID, properties.models().extractor(),
                SYSTEM_PROMPT.formatted(describeSchema()), JsonPayloads.write(objectMapper, payload), 0.0, true));
        if (!reply.hasJson()) {
            log.debug("Slot extraction produced no usable JSON; keeping stored slots");
            return SlotExtraction.unchanged();
        }

        Map<String, Map<String, Object>> delta = SlotCoercer.coerce(reply.json().get("slots"));
        Set<String> topics = new LinkedHashSet<>();
        if (reply.json().get("topics_detected") instanceof List<?> detected) {
            for (Object item : detected) {
                Topic.fromKey(String.valueOf(item)).ifPresent(t -> topics.add(t.key()));
            }
        }
        topics.addAll(delta.keySet());
        return new SlotExtraction(topics, delta, true);
    }

    /**
     * Runs extraction for the current turn and folds the result into the state.
     *
     * @param priorHistory questions asked before this turn, oldest first
     */
    public void apply(ConversationState state, List<String> priorHistory) {
        int from = Math.max(0, priorHistory.size() - HISTORY_WINDOW);
        SlotExtraction extraction = extract(state.getQuestion(),
                priorHistory.subList(from, priorHistory.size()), state.getSlots());
        state.setTopics(extraction.topics());
        if (extraction.succeeded()) {
            state.setSlots(SlotMerger.mergeTopics(state.getSlots(), extraction.delta()));
        }
        log.debug("[{}] topics={} slotTopics={}", state.getSessionId(), extraction.topics(), state.getSlots().keySet());
    }

    static String describeSchema() {
        StringBuilder sb = new StringBuilder();
        for (Topic topic : Topic.values()) {
            String fields = SlotSchema.fieldsOf(topic).entrySet().stream()
                    .map(e -> e.getKey() + " (" + describe(e.getValue()) + ")")
                    .collect(Collectors.joining(", "));
            sb.append("- ").append(topic.key()).append(": ").append(fields).append('\n');
        }
        return sb.toString();
    }

    private static String describe(SlotSchema.FieldType type) {
        return switch (type) {
            case DATE -> "ISO date";
            case BOOLEAN -> "true/false";
            case STRING -> "text";
            case STRING_LIST -> "list of text";
            case DESTINATION_LIST -> "list of {country, region, return_date}";
        };
    }
}
