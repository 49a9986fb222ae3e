package io.github.drompincen.eligibility.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DecisionTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void nullCollectionsBecomeEmpty() {
        Decision decision = new Decision(null, 0.5, null, null, null, null, null, null);

        assertThat(decision.label()).isEqualTo(DecisionLabel.NEED_MORE_INFO);
        assertThat(decision.rationale()).isEmpty();
        assertThat(decision.missingFields()).isEmpty();
        assertThat(decision.safetyFlags()).isEmpty();
        assertThat(decision.ruleCitations()).isEmpty();
    }

    @Test
    void toMapUsesWireKeys() {
        Decision decision = new Decision(DecisionLabel.DEFER, 0.7, "tattoo within 4 months",
                List.of("tattoo date"), List.of(), List.of(RuleCitation.of("eligibility_rules.md")),
                "gpt-4o-mini", "Defer");

        Map<String, Object> map = decision.toMap();

        assertThat(map).containsEntry("decision", "Defer")
                .containsEntry("confidence", 0.7)
                .containsEntry("missing_fields", List.of("tattoo date"))
                .containsEntry("used_model", "gpt-4o-mini")
                .containsEntry("final_status", "Defer");
        assertThat(map.get("rule_citations"))
                .isEqualTo(List.of(Map.of("doc_id", "eligibility_rules.md", "text", "")));
    }

    @Test
    void jsonUsesSnakeCaseKeys() throws Exception {
        Decision decision = new Decision(DecisionLabel.ELIGIBLE, 0.9, "ok",
                List.of(), List.of("none"), List.of(), "m", "Eligible");

        JsonNode node = objectMapper.readTree(objectMapper.writeValueAsString(decision));

        assertThat(node.get("decision").asText()).isEqualTo("Eligible");
        assertThat(node.has("missing_fields")).isTrue();
        assertThat(node.has("safety_flags")).isTrue();
        assertThat(node.get("final_status").asText()).isEqualTo("Eligible");
    }

    @Test
    void turnResponseFallsBackToLabelForFinalStatus() {
        TurnResponse response = TurnResponse.of(Decision.needMoreInfo(0.4, "missing data"));

        assertThat(response.finalStatus()).isEqualTo("NeedMoreInfo");
        assertThat(response.usedModel()).isEmpty();
    }
}
