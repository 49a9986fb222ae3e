package io.github.drompincen.eligibility.runtime.slots;

import java.util.Map;
import java.util.Set;

public record SlotExtraction(
        Set<String> topics,
        Map<String, Map<String, Object>> delta,
        boolean succeeded
) {
    public SlotExtraction {
        topics = topics != null ? Set.copyOf(topics) : Set.of();
        delta = delta != null ? delta : Map.of();
    }

    public static SlotExtraction unchanged() {
        return new SlotExtraction(Set.of(), Map.of(), false);
    }
}
