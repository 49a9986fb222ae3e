package io.github.drompincen.eligibility.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum DecisionLabel {
    ELIGIBLE("Eligible"),
    INELIGIBLE("Ineligible"),
    DEFER("Defer"),
    NEED_MORE_INFO("NeedMoreInfo");

    private final String display;

    DecisionLabel(String display) {
        this.display = display;
    }

    @JsonValue
    public String display() { return display; }

    /** Exact match on the canonical display value. */
    public static Optional<DecisionLabel> fromDisplay(String value) {
        if (value == null) return Optional.empty();
        for (DecisionLabel label : values()) {
            if (label.display.equals(value)) return Optional.of(label);
        }
        return Optional.empty();
    }

    @JsonCreator
    static DecisionLabel fromJson(String value) {
        return fromDisplay(value).orElse(NEED_MORE_INFO);
    }

    @Override
    public String toString() { return display; }
}
