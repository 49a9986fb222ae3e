package io.github.drompincen.eligibility.runtime.agent.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.eligibility.protocol.api.Topic;
import io.github.drompincen.eligibility.runtime.clarify.ClarifierJudge;
import io.github.drompincen.eligibility.runtime.clarify.TopicPatterns;
import io.github.drompincen.eligibility.runtime.decision.DecisionSynthesizer;
import io.github.drompincen.eligibility.runtime.decision.SelfReflector;
import io.github.drompincen.eligibility.runtime.json.JsonPayloads;
import io.github.drompincen.eligibility.runtime.json.JsonRecovery;
import io.github.drompincen.eligibility.runtime.slots.SlotExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic stand-in for a real provider, for demos and offline runs. Replies are derived
 * from the stage's JSON payload with keyword rules.
 *
 * Activate with: ELIGIBILITY_LLM_PROVIDER=fake
 */
@Service
@ConditionalOnProperty(name = "eligibility.llm.provider", havingValue = "fake")
public class FakeLlmService implements LlmService {

    private static final Logger log = LoggerFactory.getLogger(FakeLlmService.class);
    private static final Pattern ISO_DATE = Pattern.compile("\\b(\\d{4}-\\d{2}-\\d{2})\\b");

    private final ObjectMapper objectMapper;
    private final JsonRecovery jsonRecovery;

    public FakeLlmService(ObjectMapper objectMapper, JsonRecovery jsonRecovery) {
        this.objectMapper = objectMapper;
        this.jsonRecovery = jsonRecovery;
    }

    @Override
    public String blockingResponse(ModelPrompt prompt) {
        Map<String, Object> payload = jsonRecovery.recover(prompt.user());
        String agentId = prompt.agentId() != null ? prompt.agentId() : "unknown";
        Map<String, Object> reply = switch (agentId) {
            case SlotExtractor.AGENT_ID -> extract(payload);
            case ClarifierJudge.AGENT_ID -> clarify(payload);
            case DecisionSynthesizer.AGENT_ID -> decide(payload);
            case SelfReflector.AGENT_ID -> reflect(payload);
            default -> Map.of();
        };
        log.debug("[FAKE LLM] agent={} reply={}", agentId, reply);
        return JsonPayloads.write(objectMapper, reply);
    }

    @Override
    public boolean supportsStrictJson() {
        return true;
    }

    @Override
    public String getProviderInfo() {
        return "Fake";
    }

    private Map<String, Object> extract(Map<String, Object> payload) {
        String question = String.valueOf(payload.getOrDefault("question", ""));
        Set<Topic> mentioned = TopicPatterns.mentioned(question);
        Set<Topic> negated = TopicPatterns.negated(question);
        Matcher date = ISO_DATE.matcher(question);
        String firstDate = date.find() ? date.group(1) : null;

        List<String> topics = new ArrayList<>();
        Map<String, Object> slots = new LinkedHashMap<>();
        for (Topic topic : mentioned) {
            topics.add(topic.key());
            Map<String, Object> fields = new LinkedHashMap<>();
            if (firstDate != null) {
                switch (topic) {
                    case VACCINE, TATTOO -> fields.put("date", firstDate);
                    case TRAVEL -> fields.put("return_date", firstDate);
                    case DONATION -> fields.put("last_date", firstDate);
                    case SYMPTOMS -> fields.put("onset_date", firstDate);
                    default -> { }
                }
            }
            if (topic == Topic.TATTOO && question.toLowerCase().contains("licensed")) {
                fields.put("licensed_studio", !question.toLowerCase().contains("unlicensed"));
            }
            if (!fields.isEmpty()) slots.put(topic.key(), fields);
        }
        for (Topic topic : negated) {
            if (!topics.contains(topic.key())) topics.add(topic.key());
            switch (topic) {
                case TRAVEL -> slots.put(topic.key(), Map.of("recent", false));
                case MEDICATION -> slots.put(topic.key(), Map.of("current", false));
                case SYMPTOMS -> slots.put(topic.key(), Map.of("present", false));
                default -> { }
            }
        }
        if (TopicPatterns.otherVaccinationsDenied(question)) {
            Map<String, Object> vaccine = new LinkedHashMap<>();
            if (slots.get(Topic.VACCINE.key()) instanceof Map<?, ?> existing) {
                existing.forEach((k, v) -> vaccine.put(String.valueOf(k), v));
            }
            vaccine.put("other_recent", false);
            slots.put(Topic.VACCINE.key(), vaccine);
        }
        return Map.of("topics_detected", topics, "slots", slots);
    }

    private Map<String, Object> clarify(Map<String, Object> payload) {
        List<String> asks = new ArrayList<>();
        Object topics = payload.get("topics");
        Map<?, ?> slots = payload.get("known_slots") instanceof Map<?, ?> m ? m : Map.of();
        if (topics instanceof List<?> list && list.contains(Topic.TATTOO.key())) {
            Map<?, ?> tattoo = slots.get(Topic.TATTOO.key()) instanceof Map<?, ?> t ? t : Map.of();
            if (tattoo.get("date") == null) asks.add("When did you get the tattoo?");
            if (tattoo.get("licensed_studio") == null) asks.add("Was it done at a licensed studio?");
        }
        return asks.isEmpty()
                ? Map.of("decision", "answer", "missing_slots", List.of(), "reason", "Enough information", "confidence", 0.8)
                : Map.of("decision", "clarify", "missing_slots", asks, "reason", "Tattoo details are missing",
                "confidence", 0.7);
    }

    private Map<String, Object> decide(Map<String, Object> payload) {
        Map<?, ?> precheck = payload.get("precheck") instanceof Map<?, ?> m ? m : Map.of();
        Object status = precheck.get("status");
        String label = status == null ? "NeedMoreInfo" : switch (String.valueOf(status)) {
            case "ineligible" -> "Ineligible";
            case "require_medical_clearance" -> "Defer";
            default -> "Eligible";
        };
        Object reasons = precheck.get("reasons");
        String rationale = status == null
                ? "No donor record was provided, so eligibility cannot be determined yet."
                : "Rule precheck: " + reasons;
        return Map.of(
                "decision", label,
                "confidence", status == null ? 0.4 : 0.8,
                "rationale", rationale,
                "missing_fields", status == null ? List.of("donor record") : List.of(),
                "safety_flags", List.of());
    }

    private Map<String, Object> reflect(Map<String, Object> payload) {
        return payload.get("draft") instanceof Map<?, ?> draft ? castDraft(draft) : Map.of();
    }

    private static Map<String, Object> castDraft(Map<?, ?> draft) {
        Map<String, Object> copy = new LinkedHashMap<>();
        draft.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }
}
