package io.github.drompincen.eligibility.runtime.clarify;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.eligibility.runtime.agent.graph.ConversationState;
import io.github.drompincen.eligibility.runtime.agent.llm.ModelPrompt;
import io.github.drompincen.eligibility.runtime.agent.llm.ModelReply;
import io.github.drompincen.eligibility.runtime.agent.llm.StructuredModelClient;
import io.github.drompincen.eligibility.runtime.config.EligibilityProperties;
import io.github.drompincen.eligibility.runtime.json.JsonPayloads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Asks a model whether the user must supply more facts before a decision can be made. Fails
 * open: anything unusable becomes an {@code answer} verdict.
 */
@Component
public class ClarifierJudge {

    private static final Logger log = LoggerFactory.getLogger(ClarifierJudge.class);
    public static final String AGENT_ID = "clarifier";
    public static final String EMPTY_QUESTION_ASK = "Please provide your question.";
    static final int MAX_ASKS = 3;
    static final int MAX_REASON_LENGTH = 200;

    private static final String SYSTEM_PROMPT = """
            You decide whether a blood-donation eligibility assistant can answer now or must first ask
            the user for missing personal facts. Return a single JSON object and nothing else:
            {"decision": "answer" | "clarify", "missing_slots": ["<question to the user>", ...],
             "reason": "<short explanation>", "confidence": <0..1>}

            Policy (authoritative, follow it exactly):
            - Consider only topics the user explicitly raised or affirmed. Ignore topics nobody mentioned.
            - A topic the user explicitly negated ("no other vaccines", "I haven't travelled") is satisfied.
              Never ask about it again.
            - Never ask the user for general policy facts such as waiting periods or deferral lengths.
              The assistant answers those itself.
            - Ask only when an essential user-specific fact is missing for an active topic: an exact date,
              the vaccine type, whether a tattoo studio was licensed, a travel destination, whether
              symptoms are present.
            - Facts already present in known_slots or in the donor record are known. Do not re-ask them.
            - Ask at most 3 short questions. If nothing essential is missing, decide "answer".
            """;

    private final StructuredModelClient modelClient;
    private final ObjectMapper objectMapper;
    private final EligibilityProperties properties;

    public ClarifierJudge(StructuredModelClient modelClient, ObjectMapper objectMapper,
                          EligibilityProperties properties) {
        this.modelClient = modelClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public ClarifierVerdict judge(ConversationState state) {
        boolean donorSelected = !state.getDonor().isEmpty();
        if (state.getQuestion().isBlank()) {
            return donorSelected
                    ? ClarifierVerdict.answer("No question; deciding from the donor record.", 0.0)
                    : new ClarifierVerdict(ClarifierVerdict.Mode.CLARIFY, List.of(EMPTY_QUESTION_ASK),
                    "No question was provided.", 0.0);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("question", state.getQuestion());
        payload.put("history", state.getHistory());
        payload.put("known_slots", state.getSlots());
        payload.put("topics", state.getTopics());
        payload.put("donor_selected", donorSelected);
        payload.put("precheck_available", state.getPrecheck() != null);

        ModelReply reply = modelClient.request(new ModelPrompt(AGENT_ID, properties.models().clarifier(),
                SYSTEM_PROMPT, JsonPayloads.write(objectMapper, payload), 0.0, true));
        if (!reply.hasJson()) {
            log.warn("[{}] clarifier output unusable, answering directly", state.getSessionId());
            return ClarifierVerdict.answer("Clarifier output unavailable.", 0.0);
        }
        return interpret(reply.json());
    }

    static ClarifierVerdict interpret(Map<String, Object> json) {
        String decision = String.valueOf(json.getOrDefault("decision", "answer")).trim().toLowerCase(Locale.ROOT);
        ClarifierVerdict.Mode mode = "clarify".equals(decision) ? ClarifierVerdict.Mode.CLARIFY
                : ClarifierVerdict.Mode.ANSWER;

        List<String> asks = new ArrayList<>();
        if (json.get("missing_slots") instanceof List<?> raw) {
            for (Object item : raw) {
                if (item == null) continue;
                String ask = String.valueOf(item).trim();
                if (!ask.isEmpty() && asks.size() < MAX_ASKS) asks.add(ask);
            }
        }

        String reason = json.get("reason") != null ? String.valueOf(json.get("reason")) : "";
        if (reason.length() > MAX_REASON_LENGTH) {
            reason = reason.substring(0, MAX_REASON_LENGTH);
        }

        if (mode == ClarifierVerdict.Mode.CLARIFY && asks.isEmpty()) {
            mode = ClarifierVerdict.Mode.ANSWER;
        }
        return new ClarifierVerdict(mode, asks, reason, confidence(json.get("confidence")));
    }

    private static double confidence(Object value) {
        double c;
        if (value instanceof Number n) {
            c = n.doubleValue();
        } else if (value instanceof String s) {
            try {
                c = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                c = 0.0;
            }
        } else {
            c = 0.0;
        }
        if (Double.isNaN(c) || Double.isInfinite(c)) return 0.0;
        return Math.max(0.0, Math.min(1.0, c));
    }
}
