package io.github.drompincen.eligibility.runtime.decision;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.eligibility.protocol.api.Decision;
import io.github.drompincen.eligibility.runtime.agent.graph.ConversationState;
import io.github.drompincen.eligibility.runtime.agent.llm.ModelPrompt;
import io.github.drompincen.eligibility.runtime.agent.llm.ModelReply;
import io.github.drompincen.eligibility.runtime.agent.llm.StructuredModelClient;
import io.github.drompincen.eligibility.runtime.config.EligibilityProperties;
import io.github.drompincen.eligibility.runtime.json.JsonPayloads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class DecisionSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(DecisionSynthesizer.class);
    public static final String AGENT_ID = "decision";
    static final String UNPARSABLE = "unparsable output";

    private static final String SYSTEM_PROMPT = """
            You are a blood-donation eligibility assistant. Using the donor record, the rule precheck,
            the retrieved policy evidence and the facts the user has given, decide whether the donor can
            give blood. Return a single JSON object and nothing else:
            {"decision": "Eligible" | "Ineligible" | "Defer" | "NeedMoreInfo",
             "confidence": <0..1>, "rationale": "<explanation for the user>",
             "missing_fields": ["<fact still needed>", ...], "safety_flags": ["<flag>", ...]}

            Hard rules:
            - Never assume values that were not stated. When an essential fact is missing, prefer
              NeedMoreInfo and list it in missing_fields (at most 3) over guessing.
            - If the retrieved evidence contradicts the rule precheck, explain the conflict in the
              rationale and lower the confidence.
            - If the conversation contains red-flag health content, populate safety_flags.
            - Base waiting periods and deferral lengths on the retrieved evidence only.
            """;

    private final StructuredModelClient modelClient;
    private final DecisionNormalizer normalizer;
    private final ObjectMapper objectMapper;
    private final EligibilityProperties properties;

    public DecisionSynthesizer(StructuredModelClient modelClient, DecisionNormalizer normalizer,
                               ObjectMapper objectMapper, EligibilityProperties properties) {
        this.modelClient = modelClient;
        this.normalizer = normalizer;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public Decision synthesize(ConversationState state) {
        return normalizer.normalize(draft(state));
    }

    /** Raw decision map with per-key defaults applied; not yet normalized. */
    Map<String, Object> draft(ConversationState state) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("donor", state.getDonor());
        payload.put("donor_summary", state.getDonorSummary());
        payload.put("precheck", state.getPrecheck());
        payload.put("retrieved", state.getRetrieved());
        payload.put("slots", state.getSlots());
        payload.put("question", state.getQuestion());

        ModelReply reply = modelClient.request(new ModelPrompt(AGENT_ID, properties.models().decision(),
                SYSTEM_PROMPT, JsonPayloads.write(objectMapper, payload), 0.1, true));
        if (reply.failed()) {
            log.warn("[{}] decision model failed: {}", state.getSessionId(), reply.error());
            return fallback("Decision model unavailable: " + reply.error());
        }
        if (reply.json().isEmpty()) {
            log.warn("[{}] decision output unparseable ({} chars)", state.getSessionId(), reply.rawText().length());
            return fallback(reply.rawText().isBlank() ? UNPARSABLE : reply.rawText());
        }

        Map<String, Object> draft = new LinkedHashMap<>(reply.json());
        draft.putIfAbsent("decision", "NeedMoreInfo");
        draft.putIfAbsent("confidence", DecisionNormalizer.DEFAULT_CONFIDENCE);
        draft.putIfAbsent("rationale", "");
        draft.putIfAbsent("missing_fields", List.of());
        draft.putIfAbsent("safety_flags", List.of());
        return draft;
    }

    static Map<String, Object> fallback(String rationale) {
        Map<String, Object> draft = new LinkedHashMap<>();
        draft.put("decision", "NeedMoreInfo");
        draft.put("confidence", 0.4);
        draft.put("rationale", rationale);
        draft.put("missing_fields", List.of());
        draft.put("safety_flags", List.of());
        return draft;
    }
}
