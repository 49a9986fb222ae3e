package io.github.drompincen.eligibility.runtime.rules;

import io.github.drompincen.eligibility.protocol.api.Precheck;

import java.util.Map;

public interface RuleEngine {

    /** Deterministic threshold check over the donor record. Must not perform I/O. */
    Precheck compute(Map<String, Object> donor);
}
