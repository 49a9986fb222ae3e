package io.github.drompincen.eligibility.runtime.decision;

import io.github.drompincen.eligibility.protocol.api.Decision;
import io.github.drompincen.eligibility.protocol.api.DecisionLabel;
import io.github.drompincen.eligibility.protocol.api.Precheck;
import io.github.drompincen.eligibility.protocol.api.PrecheckStatus;
import io.github.drompincen.eligibility.protocol.api.RetrievedEvidence;
import io.github.drompincen.eligibility.protocol.api.RuleCitation;
import io.github.drompincen.eligibility.runtime.agent.graph.ConversationState;
import io.github.drompincen.eligibility.runtime.config.EligibilityProperties;
import io.github.drompincen.eligibility.runtime.guardrail.GuardrailService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseComposerTest {

    private ResponseComposer composer;
    private ConversationState state;

    @BeforeEach
    void setUp() {
        composer = new ResponseComposer(new DecisionNormalizer(), new GuardrailService(EligibilityProperties.defaults()));
        state = ConversationState.create("s1");
    }

    private static Decision decision(DecisionLabel label, double confidence, String rationale) {
        return new Decision(label, confidence, rationale, List.of(), List.of(), List.of(), null, null);
    }

    @Test
    void mergesRetrievedCitationsWithoutDuplicates() {
        state.setDecision(decision(DecisionLabel.DEFER, 0.7, "Wait 4 months.")
                .withRuleCitations(List.of(new RuleCitation("rules.md - Tattoos", "4 months"))));
        state.setRetrieved(new RetrievedEvidence("text", List.of("rules.md - Tattoos", Map.of("doc_id", "rules.md - Travel"))));
        state.setUsedModel("gpt-4o-mini");

        Decision out = composer.compose(state);

        assertThat(out.ruleCitations()).containsExactly(
                new RuleCitation("rules.md - Tattoos", "4 months"),
                new RuleCitation("rules.md - Travel", ""));
        assertThat(out.usedModel()).isEqualTo("gpt-4o-mini");
        assertThat(out.finalStatus()).isEqualTo("Defer");
    }

    @Test
    void eligibleAgainstIneligiblePrecheckIsDowngraded() {
        state.setPrecheck(new Precheck(PrecheckStatus.INELIGIBLE, List.of("Low Hb: 11.8 g/dL")));
        state.setDecision(decision(DecisionLabel.ELIGIBLE, 0.9, "Fine."));

        Decision out = composer.compose(state);

        assertThat(out.label()).isEqualTo(DecisionLabel.NEED_MORE_INFO);
        assertThat(out.confidence()).isEqualTo(0.5);
        assertThat(out.safetyFlags()).contains(ResponseComposer.PRECHECK_CONFLICT);
        assertThat(out.finalStatus()).isEqualTo("NeedMoreInfo");
    }

    @Test
    void ineligibleDecisionWithIneligiblePrecheckIsKept() {
        state.setPrecheck(new Precheck(PrecheckStatus.INELIGIBLE, List.of("Low Hb: 11.8 g/dL")));
        state.setDecision(decision(DecisionLabel.INELIGIBLE, 0.9, "Hemoglobin too low."));

        Decision out = composer.compose(state);

        assertThat(out.label()).isEqualTo(DecisionLabel.INELIGIBLE);
        assertThat(out.confidence()).isEqualTo(0.9);
        assertThat(out.safetyFlags()).doesNotContain(ResponseComposer.PRECHECK_CONFLICT);
    }

    @Test
    void stateSafetyFlagsAreMerged() {
        state.setDecision(decision(DecisionLabel.NEED_MORE_INFO, 0.95, "Seek care.")
                .withSafetyFlags(List.of("red_flag_detected")));
        state.addSafetyFlag("red_flag_detected");
        state.addSafetyFlag("prompt_injection_detected");

        assertThat(composer.compose(state).safetyFlags())
                .containsExactly("red_flag_detected", "prompt_injection_detected");
    }

    @Test
    void rationaleIsRedacted() {
        state.setDecision(decision(DecisionLabel.DEFER, 0.7,
                "Donor D10234 should call 555-123-4567 or write to donor@example.org [rules.md - Travel]"));

        String rationale = composer.compose(state).rationale();

        assertThat(rationale).contains("[REDACTED_DONOR_ID]", "[REDACTED_PHONE]", "[REDACTED_EMAIL]", "[rules.md - Travel]");
        assertThat(rationale).doesNotContain("D10234", "555-123-4567", "donor@example.org");
    }

    @Test
    void missingDecisionBecomesNeedMoreInfo() {
        Decision out = composer.compose(state);

        assertThat(out.label()).isEqualTo(DecisionLabel.NEED_MORE_INFO);
        assertThat(out.confidence()).isEqualTo(0.5);
        assertThat(out.finalStatus()).isEqualTo("NeedMoreInfo");
    }

    @Test
    void finalStatusFallsBackToPrecheck() {
        assertThat(ResponseComposer.finalStatus(DecisionLabel.DEFER, null)).isEqualTo("Defer");
        assertThat(ResponseComposer.finalStatus("Eligible", null)).isEqualTo("Eligible");
        assertThat(ResponseComposer.finalStatus(null, new Precheck(PrecheckStatus.ELIGIBLE, List.of())))
                .isEqualTo("eligible");
        assertThat(ResponseComposer.finalStatus("maybe", List.of("ineligible", List.of("Low Hb"))))
                .isEqualTo("ineligible");
        assertThat(ResponseComposer.finalStatus(null, Map.of("status", "require_medical_clearance")))
                .isEqualTo("require_medical_clearance");
        assertThat(ResponseComposer.finalStatus(null, null)).isEqualTo("NeedMoreInfo");
    }
}
