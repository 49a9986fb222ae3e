package io.github.drompincen.eligibility.protocol.api;

import java.util.List;

public record Precheck(
        PrecheckStatus status,
        List<String> reasons
) {
    public Precheck {
        reasons = reasons != null ? List.copyOf(reasons) : List.of();
    }
}
