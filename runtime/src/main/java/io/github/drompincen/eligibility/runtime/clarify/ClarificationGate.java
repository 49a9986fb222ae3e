package io.github.drompincen.eligibility.runtime.clarify;

import io.github.drompincen.eligibility.protocol.api.Decision;
import io.github.drompincen.eligibility.protocol.api.DecisionLabel;
import io.github.drompincen.eligibility.runtime.agent.graph.ConversationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Combines the judge and the filter. Produces a {@code NeedMoreInfo} decision only when the
 * judge wants to clarify and at least one of its questions survives the filter.
 */
@Component
public class ClarificationGate {

    private static final Logger log = LoggerFactory.getLogger(ClarificationGate.class);
    static final double MAX_CLARIFY_CONFIDENCE = 0.6;

    private final ClarifierJudge judge;
    private final ClarifyFilter filter;

    public ClarificationGate(ClarifierJudge judge, ClarifyFilter filter) {
        this.judge = judge;
        this.filter = filter;
    }

    public Optional<Decision> evaluate(ConversationState state) {
        ClarifierVerdict verdict = judge.judge(state);
        if (!verdict.wantsClarification()) {
            state.setClarification(verdict);
            return Optional.empty();
        }

        String rawText = String.join("\n", state.getHistory()) + "\n" + state.getQuestion();
        List<String> asks = filter.filter(verdict.missingSlots(), rawText, state.getSlots(), state.getDonor());
        ClarifierVerdict filtered = verdict.withMissingSlots(asks);
        state.setClarification(filtered);
        if (asks.isEmpty()) {
            log.debug("[{}] all {} clarifying questions vetoed, answering", state.getSessionId(),
                    verdict.missingSlots().size());
            return Optional.empty();
        }
        return Optional.of(new Decision(DecisionLabel.NEED_MORE_INFO,
                Math.min(verdict.confidence(), MAX_CLARIFY_CONFIDENCE), verdict.reason(),
                asks, List.of(), List.of(), null, null));
    }
}
