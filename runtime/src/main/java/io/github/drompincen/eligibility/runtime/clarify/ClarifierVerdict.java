package io.github.drompincen.eligibility.runtime.clarify;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

public record ClarifierVerdict(
        Mode mode,
        List<String> missingSlots,
        String reason,
        double confidence
) {
    public enum Mode { ANSWER, CLARIFY }

    public ClarifierVerdict {
        mode = mode != null ? mode : Mode.ANSWER;
        missingSlots = missingSlots != null ? List.copyOf(missingSlots) : List.of();
        reason = reason != null ? reason : "";
    }

    public static ClarifierVerdict answer(String reason, double confidence) {
        return new ClarifierVerdict(Mode.ANSWER, List.of(), reason, confidence);
    }

    public ClarifierVerdict withMissingSlots(List<String> asks) {
        return new ClarifierVerdict(mode, asks, reason, confidence);
    }

    @JsonIgnore
    public boolean wantsClarification() {
        return mode == Mode.CLARIFY && !missingSlots.isEmpty();
    }
}
