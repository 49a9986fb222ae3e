package io.github.drompincen.eligibility.runtime.slots;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SlotMergerTest {

    private static Map<String, Object> map(Object... pairs) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            m.put((String) pairs[i], pairs[i + 1]);
        }
        return m;
    }

    private static List<Map<String, Object>> samples() {
        List<Map<String, Object>> samples = new ArrayList<>();
        samples.add(map());
        samples.add(map("tattoo", map("date", "2025-03-01", "licensed_studio", true)));
        samples.add(map("tattoo", map("date", null, "location", "")));
        samples.add(map("tattoo", map("date", "2025-04-02")));
        samples.add(map("vaccine", map("type", "flu", "other_recent", false)));
        samples.add(map("medication", map("names", List.of("aspirin", "ibuprofen"))));
        samples.add(map("medication", map("names", List.of("ibuprofen", "warfarin"))));
        samples.add(map("medication", map("names", List.of())));
        samples.add(map("travel", map("recent", true,
                "destinations", List.of(map("country", "Kenya", "return_date", "2025-02-10")))));
        samples.add(map("travel", map("destinations", List.of(map("country", "Kenya", "return_date", "2025-02-10"),
                map("country", "Peru")))));
        samples.add(map("symptoms", "none"));
        samples.add(map("symptoms", map("present", false)));
        return samples;
    }

    @Test
    void mergeIsIdempotent() {
        for (Map<String, Object> base : samples()) {
            for (Map<String, Object> delta : samples()) {
                Map<String, Object> once = SlotMerger.deepMerge(base, delta);
                Map<String, Object> twice = SlotMerger.deepMerge(once, delta);
                assertThat(twice).as("merge(%s, %s)", base, delta).isEqualTo(once);
            }
        }
    }

    @Test
    void mergeNeverErasesConcreteValues() {
        for (Map<String, Object> base : samples()) {
            for (Map<String, Object> delta : samples()) {
                Map<String, Object> merged = SlotMerger.deepMerge(base, delta);
                assertConcreteValuesSurvive(base, merged, "merge(" + base + ", " + delta + ")");
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static void assertConcreteValuesSurvive(Map<String, Object> base, Map<String, Object> merged, String ctx) {
        for (Map.Entry<String, Object> e : base.entrySet()) {
            Object before = e.getValue();
            if (!SlotMerger.isConcrete(before)) continue;
            Object after = merged.get(e.getKey());
            assertThat(SlotMerger.isConcrete(after)).as(ctx + " key " + e.getKey()).isTrue();
            if (before instanceof Map<?, ?> b && after instanceof Map<?, ?> a) {
                assertConcreteValuesSurvive((Map<String, Object>) b, (Map<String, Object>) a, ctx);
            }
        }
    }

    @Test
    void nullAndBlankDeltaValuesAreIgnored() {
        Map<String, Object> base = map("tattoo", map("date", "2025-03-01", "location", "Berlin"));
        Map<String, Object> delta = map("tattoo", map("date", null, "location", ""));

        assertThat(SlotMerger.deepMerge(base, delta)).isEqualTo(base);
    }

    @Test
    void listsAreUnionedInInsertionOrder() {
        Map<String, Object> merged = SlotMerger.deepMerge(
                map("medication", map("names", List.of("aspirin", "ibuprofen"))),
                map("medication", map("names", List.of("ibuprofen", "warfarin"))));

        assertThat(merged).isEqualTo(map("medication", map("names", List.of("aspirin", "ibuprofen", "warfarin"))));
    }

    @Test
    void concreteDeltaOverwritesScalar() {
        Map<String, Object> merged = SlotMerger.deepMerge(
                map("tattoo", map("date", "2025-03-01", "licensed_studio", true)),
                map("tattoo", map("date", "2025-04-02", "licensed_studio", false)));

        assertThat(merged).isEqualTo(map("tattoo", map("date", "2025-04-02", "licensed_studio", false)));
    }

    @Test
    void inputsAreNotMutated() {
        Map<String, Object> inner = new HashMap<>(Map.of("names", new ArrayList<>(List.of("aspirin"))));
        Map<String, Object> base = map("medication", inner);

        SlotMerger.deepMerge(base, map("medication", map("names", List.of("warfarin"))));

        assertThat(inner.get("names")).isEqualTo(List.of("aspirin"));
    }

    @Test
    void nullDeltaReturnsCopyOfBase() {
        Map<String, Object> base = map("vaccine", map("type", "flu"));

        Map<String, Object> merged = SlotMerger.deepMerge(base, null);

        assertThat(merged).isEqualTo(base).isNotSameAs(base);
    }

    @Test
    void isConcreteRules() {
        assertThat(Arrays.asList(null, "", List.of(), Map.of()))
                .allSatisfy(v -> assertThat(SlotMerger.isConcrete(v)).isFalse());
        assertThat(List.of("none", false, 0, List.of("x")))
                .allSatisfy(v -> assertThat(SlotMerger.isConcrete(v)).isTrue());
    }
}
