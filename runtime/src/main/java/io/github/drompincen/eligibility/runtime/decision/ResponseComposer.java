package io.github.drompincen.eligibility.runtime.decision;

import io.github.drompincen.eligibility.protocol.api.Decision;
import io.github.drompincen.eligibility.protocol.api.DecisionLabel;
import io.github.drompincen.eligibility.protocol.api.Precheck;
import io.github.drompincen.eligibility.protocol.api.PrecheckStatus;
import io.github.drompincen.eligibility.protocol.api.RuleCitation;
import io.github.drompincen.eligibility.runtime.agent.graph.ConversationState;
import io.github.drompincen.eligibility.runtime.guardrail.GuardrailService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Finalizes the active decision into the shape returned to the caller.
 */
@Component
public class ResponseComposer {

    private static final Logger log = LoggerFactory.getLogger(ResponseComposer.class);
    public static final String PRECHECK_CONFLICT = "precheck_conflict";
    static final double CONFLICT_MAX_CONFIDENCE = 0.5;

    private final DecisionNormalizer normalizer;
    private final GuardrailService guardrails;

    public ResponseComposer(DecisionNormalizer normalizer, GuardrailService guardrails) {
        this.normalizer = normalizer;
        this.guardrails = guardrails;
    }

    public Decision compose(ConversationState state) {
        Decision active = state.getDecision() != null ? state.getDecision()
                : Decision.needMoreInfo(DecisionNormalizer.DEFAULT_CONFIDENCE, "");
        Decision decision = normalizer.normalize(active.toMap()).withUsedModel(state.getUsedModel());

        Map<String, RuleCitation> citations = new LinkedHashMap<>();
        decision.ruleCitations().forEach(c -> citations.putIfAbsent(c.docId(), c));
        for (Object raw : state.getRetrieved().citations()) {
            RuleCitation citation = DecisionNormalizer.citation(raw);
            if (citation != null) {
                citations.putIfAbsent(citation.docId(), RuleCitation.of(citation.docId()));
            }
        }
        decision = decision.withRuleCitations(new ArrayList<>(citations.values()));

        LinkedHashSet<String> flags = new LinkedHashSet<>(decision.safetyFlags());
        flags.addAll(state.getSafetyFlags());

        if (state.getPrecheck() != null && state.getPrecheck().status() == PrecheckStatus.INELIGIBLE
                && decision.label() == DecisionLabel.ELIGIBLE) {
            log.warn("[{}] decision Eligible conflicts with precheck {}, downgrading",
                    state.getSessionId(), state.getPrecheck().reasons());
            decision = decision.withLabel(DecisionLabel.NEED_MORE_INFO)
                    .withConfidence(Math.min(decision.confidence(), CONFLICT_MAX_CONFIDENCE));
            flags.add(PRECHECK_CONFLICT);
        }

        decision = decision.withSafetyFlags(new ArrayList<>(flags))
                .withRationale(guardrails.redact(decision.rationale()));
        return decision.withFinalStatus(finalStatus(decision.label().display(), state.getPrecheck()));
    }

    /**
     * The canonical label when there is one, otherwise the precheck outcome. The precheck may
     * arrive as a {@link Precheck}, a sequence whose first element is the status, or a map with
     * a {@code status} key.
     */
    public static String finalStatus(Object label, Object precheck) {
        if (label instanceof DecisionLabel l) {
            return l.display();
        }
        if (label instanceof String s && DecisionLabel.fromDisplay(s).isPresent()) {
            return s;
        }
        if (precheck instanceof Precheck p && p.status() != null) {
            return p.status().value();
        }
        if (precheck instanceof List<?> list && !list.isEmpty() && list.get(0) != null) {
            return String.valueOf(list.get(0));
        }
        if (precheck instanceof Map<?, ?> map && map.get("status") != null) {
            return String.valueOf(map.get("status"));
        }
        return DecisionLabel.NEED_MORE_INFO.display();
    }
}
