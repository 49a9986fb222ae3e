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
import java.util.Map;
import java.util.Optional;

/**
 * Second-opinion pass over the synthesized decision. Reflection failures never surface; the
 * prior decision simply stays in place.
 */
@Component
public class SelfReflector {

    private static final Logger log = LoggerFactory.getLogger(SelfReflector.class);
    public static final String AGENT_ID = "reflector";

    private static final String SYSTEM_PROMPT = """
            You review a draft blood-donation eligibility decision. Check it against the donor summary,
            the rule precheck and the policy evidence. Correct the label, confidence, rationale,
            missing_fields or safety_flags if they are wrong or unsupported; keep them otherwise.
            Return a single JSON object with the same keys as the draft and nothing else.
            """;

    private final StructuredModelClient modelClient;
    private final DecisionNormalizer normalizer;
    private final ObjectMapper objectMapper;
    private final EligibilityProperties properties;

    public SelfReflector(StructuredModelClient modelClient, DecisionNormalizer normalizer,
                         ObjectMapper objectMapper, EligibilityProperties properties) {
        this.modelClient = modelClient;
        this.normalizer = normalizer;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /** Returns the revised decision, or empty when the prior decision stands. */
    public Optional<Decision> reflect(ConversationState state) {
        Decision current = state.getDecision();
        if (current == null) {
            return Optional.empty();
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("draft", current.toMap());
        payload.put("donor_summary", state.getDonorSummary());
        payload.put("precheck", state.getPrecheck());
        payload.put("evidence", state.getRetrieved().text());
        payload.put("question", state.getQuestion());

        ModelReply reply = modelClient.request(new ModelPrompt(AGENT_ID, properties.models().reflector(),
                SYSTEM_PROMPT, JsonPayloads.write(objectMapper, payload), 0.0, true));
        if (!reply.hasJson()) {
            log.debug("[{}] reflection produced nothing usable, keeping decision", state.getSessionId());
            return Optional.empty();
        }

        Map<String, Object> revision = new LinkedHashMap<>();
        reply.json().forEach((key, value) -> {
            if (value != null) revision.put(key, value);
        });
        Map<String, Object> merged = current.toMap();
        // a revised label under any alias replaces the draft's label
        if (DecisionNormalizer.LABEL_KEYS.stream().anyMatch(revision::containsKey)) {
            DecisionNormalizer.LABEL_KEYS.forEach(merged::remove);
        }
        merged.putAll(revision);
        return Optional.of(normalizer.normalize(merged));
    }
}
