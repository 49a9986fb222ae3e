package io.github.drompincen.eligibility.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PrecheckStatus {
    ELIGIBLE("eligible"),
    INELIGIBLE("ineligible"),
    REQUIRE_MEDICAL_CLEARANCE("require_medical_clearance");

    private final String value;

    PrecheckStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() { return value; }

    @JsonCreator
    public static PrecheckStatus fromValue(String value) {
        for (PrecheckStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) return status;
        }
        throw new IllegalArgumentException("Unknown precheck status: " + value);
    }
}
