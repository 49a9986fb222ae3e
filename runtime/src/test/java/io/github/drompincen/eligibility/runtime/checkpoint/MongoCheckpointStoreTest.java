package io.github.drompincen.eligibility.runtime.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.eligibility.persistence.document.ConversationCheckpointDocument;
import io.github.drompincen.eligibility.persistence.repository.ConversationCheckpointRepository;
import io.github.drompincen.eligibility.runtime.agent.graph.ConversationState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.OptimisticLockingFailureException;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MongoCheckpointStoreTest {

    @Mock private ConversationCheckpointRepository repository;

    private ConversationStateCodec codec;
    private MongoCheckpointStore store;

    @BeforeEach
    void setUp() {
        codec = new ConversationStateCodec(new ObjectMapper());
        store = new MongoCheckpointStore(repository, codec);
    }

    @Test
    void putCreatesDocumentForNewSession() {
        when(repository.findById("s1")).thenReturn(Optional.empty());
        ConversationState state = ConversationStateCodecTest.sampleState();

        store.put("s1", state);

        ArgumentCaptor<ConversationCheckpointDocument> captor = ArgumentCaptor.forClass(ConversationCheckpointDocument.class);
        verify(repository).save(captor.capture());
        ConversationCheckpointDocument saved = captor.getValue();
        assertThat(saved.getSessionId()).isEqualTo("s1");
        assertThat(saved.getTurnNo()).isEqualTo(2);
        assertThat(saved.getCreatedAt()).isNotNull();
        assertThat(codec.read(saved.getState())).usingRecursiveComparison().isEqualTo(state);
    }

    @Test
    void putUpdatesExistingDocument() {
        ConversationCheckpointDocument existing = new ConversationCheckpointDocument();
        existing.setSessionId("s1");
        existing.setCreatedAt(Instant.parse("2025-01-01T00:00:00Z"));
        existing.setVersion(4L);
        when(repository.findById("s1")).thenReturn(Optional.of(existing));

        store.put("s1", ConversationState.create("s1"));

        verify(repository).save(existing);
        assertThat(existing.getCreatedAt()).isEqualTo(Instant.parse("2025-01-01T00:00:00Z"));
        assertThat(existing.getVersion()).isEqualTo(4L);
        assertThat(existing.getUpdatedAt()).isNotNull();
    }

    @Test
    void versionConflictIsRetriedOnTheLatestDocument() {
        ConversationCheckpointDocument stale = new ConversationCheckpointDocument();
        stale.setSessionId("s1");
        stale.setVersion(4L);
        ConversationCheckpointDocument latest = new ConversationCheckpointDocument();
        latest.setSessionId("s1");
        latest.setVersion(5L);
        when(repository.findById("s1")).thenReturn(Optional.of(stale), Optional.of(latest));
        when(repository.save(any()))
                .thenThrow(new OptimisticLockingFailureException("version 4 is stale"))
                .thenAnswer(invocation -> invocation.getArgument(0));

        store.put("s1", ConversationStateCodecTest.sampleState());

        verify(repository).save(stale);
        verify(repository).save(latest);
        assertThat(latest.getVersion()).isEqualTo(5L);
        assertThat(latest.getTurnNo()).isEqualTo(2);
    }

    @Test
    void repeatedVersionConflictPropagates() {
        when(repository.findById("s1")).thenReturn(Optional.empty());
        when(repository.save(any())).thenThrow(new OptimisticLockingFailureException("conflict"));

        assertThatThrownBy(() -> store.put("s1", ConversationStateCodecTest.sampleState()))
                .isInstanceOf(OptimisticLockingFailureException.class);
        verify(repository, times(2)).save(any());
    }

    @Test
    void getReadsStoredState() {
        ConversationCheckpointDocument doc = new ConversationCheckpointDocument();
        doc.setState(codec.write(ConversationStateCodecTest.sampleState()));
        when(repository.findById("s1")).thenReturn(Optional.of(doc));

        assertThat(store.get("s1")).get().extracting(ConversationState::getTurnNo).isEqualTo(2);
    }

    @Test
    void unreadableCheckpointStartsFresh() {
        ConversationCheckpointDocument doc = new ConversationCheckpointDocument();
        doc.setState("{broken");
        when(repository.findById("s1")).thenReturn(Optional.of(doc));

        assertThat(store.get("s1")).isEmpty();
    }

    @Test
    void deleteOnlyRemovesExistingCheckpoints() {
        when(repository.existsById("missing")).thenReturn(false);
        when(repository.existsById("s1")).thenReturn(true);

        assertThat(store.delete("missing")).isFalse();
        assertThat(store.delete("s1")).isTrue();

        verify(repository, never()).deleteById("missing");
        verify(repository).deleteById("s1");
        verify(repository, never()).save(any());
    }
}
