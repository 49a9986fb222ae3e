package io.github.drompincen.eligibility.runtime.agent.graph;

import io.github.drompincen.eligibility.protocol.api.Decision;
import io.github.drompincen.eligibility.protocol.api.RetrievedEvidence;
import io.github.drompincen.eligibility.protocol.api.TurnRequest;
import io.github.drompincen.eligibility.runtime.agent.TurnCancelledException;
import io.github.drompincen.eligibility.runtime.clarify.ClarificationGate;
import io.github.drompincen.eligibility.runtime.config.EligibilityProperties;
import io.github.drompincen.eligibility.runtime.decision.DecisionSynthesizer;
import io.github.drompincen.eligibility.runtime.decision.ResponseComposer;
import io.github.drompincen.eligibility.runtime.decision.SelfReflector;
import io.github.drompincen.eligibility.runtime.guardrail.GuardrailService;
import io.github.drompincen.eligibility.runtime.guardrail.GuardrailVerdict;
import io.github.drompincen.eligibility.runtime.retrieval.EvidenceRetriever;
import io.github.drompincen.eligibility.runtime.rules.DonorSummarizer;
import io.github.drompincen.eligibility.runtime.rules.RuleEngine;
import io.github.drompincen.eligibility.runtime.slots.SlotExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs one turn as an explicit state machine over {@link PipelineStage}. Guardrail blocks and
 * clarification requests jump straight to COMPOSE. A stage failure is converted into a
 * {@code NeedMoreInfo} decision instead of aborting the turn.
 */
@Component
public class EligibilityPipeline {

    private static final Logger log = LoggerFactory.getLogger(EligibilityPipeline.class);
    public static final String GUARDRAILS_MODEL = "guardrails";
    public static final String PIPELINE_MODEL = "pipeline";
    static final String CONTEXT_QUERY_PREFIX = "Eligibility determination context for donor: ";
    static final double BLOCKED_CONFIDENCE = 0.95;
    static final double STAGE_FAILURE_CONFIDENCE = 0.3;

    private final GuardrailService guardrails;
    private final SlotExtractor slotExtractor;
    private final RuleEngine ruleEngine;
    private final DonorSummarizer donorSummarizer;
    private final EvidenceRetriever retriever;
    private final ClarificationGate clarificationGate;
    private final DecisionSynthesizer synthesizer;
    private final SelfReflector reflector;
    private final ResponseComposer composer;
    private final EligibilityProperties.Models models;

    public EligibilityPipeline(GuardrailService guardrails,
                               SlotExtractor slotExtractor,
                               RuleEngine ruleEngine,
                               DonorSummarizer donorSummarizer,
                               EvidenceRetriever retriever,
                               ClarificationGate clarificationGate,
                               DecisionSynthesizer synthesizer,
                               SelfReflector reflector,
                               ResponseComposer composer,
                               EligibilityProperties properties) {
        this.guardrails = guardrails;
        this.slotExtractor = slotExtractor;
        this.ruleEngine = ruleEngine;
        this.donorSummarizer = donorSummarizer;
        this.retriever = retriever;
        this.clarificationGate = clarificationGate;
        this.synthesizer = synthesizer;
        this.reflector = reflector;
        this.composer = composer;
        this.models = properties.models();
    }

    /** Mutates {@code state} in place and returns it with the composed decision. */
    public ConversationState run(ConversationState state, TurnRequest request) {
        Turn turn = new Turn(state, request);
        PipelineStage stage = PipelineStage.INGEST;
        List<String> path = new ArrayList<>();

        while (stage != PipelineStage.END) {
            if (Thread.currentThread().isInterrupted()) {
                throw new TurnCancelledException(state.getSessionId());
            }
            path.add(stage.name());
            try {
                stage = step(stage, turn);
            } catch (TurnCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("[{}] stage {} failed: {}", state.getSessionId(), stage, e.getMessage(), e);
                stage = recover(stage, state);
            }
        }

        state.setStagePath(path);
        log.info("[{}] turn finished: path={} decision={} model={}", state.getSessionId(), path,
                state.getDecision() != null ? state.getDecision().label() : null, state.getUsedModel());
        return state;
    }

    private PipelineStage step(PipelineStage stage, Turn turn) {
        ConversationState state = turn.state;
        return switch (stage) {
            case INGEST -> {
                ingest(turn);
                yield PipelineStage.GUARDRAIL_CHECK;
            }
            case GUARDRAIL_CHECK -> guardrailCheck(state);
            case SLOT_EXTRACT -> {
                slotExtractor.apply(state, turn.priorHistory);
                yield PipelineStage.PRECHECK;
            }
            case PRECHECK -> {
                if (!state.getDonor().isEmpty()) {
                    state.setDonorSummary(donorSummarizer.summarize(state.getDonor()));
                    state.setPrecheck(ruleEngine.compute(state.getDonor()));
                }
                yield PipelineStage.RETRIEVE;
            }
            case RETRIEVE -> {
                state.setRetrieved(retrieve(state));
                yield PipelineStage.CLARIFY_GATE;
            }
            case CLARIFY_GATE -> {
                Optional<Decision> clarify = clarificationGate.evaluate(state);
                if (clarify.isPresent()) {
                    state.setDecision(clarify.get());
                    state.setUsedModel(models.clarifier());
                    yield PipelineStage.COMPOSE;
                }
                yield PipelineStage.SYNTHESIZE;
            }
            case SYNTHESIZE -> {
                state.setDecision(synthesizer.synthesize(state));
                state.setUsedModel(models.decision());
                yield PipelineStage.REFLECT;
            }
            case REFLECT -> {
                reflector.reflect(state).ifPresent(revised -> {
                    state.setDecision(revised);
                    state.setUsedModel(models.reflector());
                });
                yield PipelineStage.COMPOSE;
            }
            case COMPOSE -> {
                state.setDecision(composer.compose(state));
                yield PipelineStage.END;
            }
            case END -> PipelineStage.END;
        };
    }

    private void ingest(Turn turn) {
        ConversationState state = turn.state;
        TurnRequest request = turn.request;
        state.resetTurn();
        if (request.donor() != null && !request.donor().isEmpty()) {
            state.setDonor(request.donor());
        }
        String question = request.question() != null ? request.question().trim() : "";
        state.setQuestion(question);
        turn.priorHistory = List.copyOf(state.getHistory());
        state.appendHistory(question);
    }

    private PipelineStage guardrailCheck(ConversationState state) {
        GuardrailVerdict verdict = guardrails.check(state.getQuestion(), state.getDonor());
        if (!verdict.blocked()) {
            return PipelineStage.SLOT_EXTRACT;
        }
        state.setBlocked(true);
        state.addSafetyFlag(verdict.safetyFlag());
        state.setDecision(Decision.needMoreInfo(BLOCKED_CONFIDENCE, verdict.message())
                .withSafetyFlags(List.of(verdict.safetyFlag())));
        state.setUsedModel(GUARDRAILS_MODEL);
        return PipelineStage.COMPOSE;
    }

    private RetrievedEvidence retrieve(ConversationState state) {
        String query = state.getQuestion().isBlank()
                ? CONTEXT_QUERY_PREFIX + state.getDonorSummary()
                : state.getQuestion();
        try {
            return retriever.query(query, state.getDonorSummary());
        } catch (RuntimeException e) {
            log.warn("[{}] retrieval failed, continuing with precheck only: {}", state.getSessionId(), e.getMessage());
            return RetrievedEvidence.empty();
        }
    }

    private PipelineStage recover(PipelineStage failed, ConversationState state) {
        if (failed == PipelineStage.COMPOSE) {
            if (state.getDecision() == null) {
                state.setDecision(Decision.needMoreInfo(STAGE_FAILURE_CONFIDENCE,
                        "The request could not be completed; please try again."));
            }
            return PipelineStage.END;
        }
        state.setDecision(Decision.needMoreInfo(STAGE_FAILURE_CONFIDENCE,
                "The eligibility check could not be completed (" + failed.name().toLowerCase() + " step failed). "
                        + "Please try again or provide more details."));
        state.setUsedModel(PIPELINE_MODEL);
        return PipelineStage.COMPOSE;
    }

    private static final class Turn {
        private final ConversationState state;
        private final TurnRequest request;
        private List<String> priorHistory = List.of();

        private Turn(ConversationState state, TurnRequest request) {
            this.state = state;
            this.request = request;
        }
    }
}
