package io.github.drompincen.eligibility.runtime.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.eligibility.runtime.agent.graph.ConversationState;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryCheckpointStoreTest {

    private final InMemoryCheckpointStore store = new InMemoryCheckpointStore(new ConversationStateCodec(new ObjectMapper()));

    @Test
    void returnsWhatWasPut() {
        ConversationState state = ConversationStateCodecTest.sampleState();

        store.put("s1", state);

        assertThat(store.get("s1")).get().usingRecursiveComparison().isEqualTo(state);
        assertThat(store.get("other")).isEmpty();
    }

    @Test
    void storedStateCannotBeAliased() {
        ConversationState state = ConversationStateCodecTest.sampleState();
        store.put("s1", state);

        state.appendHistory("changed after put");
        store.get("s1").orElseThrow().getSlots().put("travel", Map.of("recent", true));

        ConversationState stored = store.get("s1").orElseThrow();
        assertThat(stored.getHistory()).doesNotContain("changed after put");
        assertThat(stored.getSlots()).doesNotContainKey("travel");
    }

    @Test
    void sessionsAreIsolated() {
        ConversationState a = ConversationState.create("a");
        a.appendHistory("question a");
        store.put("a", a);
        store.put("b", ConversationState.create("b"));

        assertThat(store.get("b").orElseThrow().getHistory()).isEmpty();
    }

    @Test
    void deleteReportsWhetherCheckpointExisted() {
        store.put("s1", ConversationState.create("s1"));

        assertThat(store.delete("s1")).isTrue();
        assertThat(store.delete("s1")).isFalse();
        assertThat(store.get("s1")).isEmpty();
    }
}
