package io.github.drompincen.eligibility.protocol.api;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

public record SessionStateDto(
        String sessionId,
        int turnNo,
        List<String> history,
        Map<String, Map<String, Object>> slots,
        Set<String> topics,
        Precheck precheck,
        Decision decision,
        String usedModel,
        Instant updatedAt
) {}
