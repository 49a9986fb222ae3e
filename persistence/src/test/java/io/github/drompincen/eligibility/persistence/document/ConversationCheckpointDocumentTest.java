package io.github.drompincen.eligibility.persistence.document;

import org.junit.jupiter.api.Test;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ConversationCheckpointDocumentTest {

    @Test
    void checkpointFieldsPreserved() {
        ConversationCheckpointDocument doc = new ConversationCheckpointDocument();
        Instant created = Instant.now();
        Instant updated = created.plusSeconds(5);

        doc.setSessionId("s1");
        doc.setTurnNo(3);
        doc.setCreatedAt(created);
        doc.setUpdatedAt(updated);
        doc.setState("{\"sessionId\":\"s1\"}");
        doc.setVersion(2L);

        assertThat(doc.getSessionId()).isEqualTo("s1");
        assertThat(doc.getTurnNo()).isEqualTo(3);
        assertThat(doc.getState()).contains("s1");
        assertThat(doc.getVersion()).isEqualTo(2L);
        assertThat(doc.getUpdatedAt()).isAfter(doc.getCreatedAt());
    }

    @Test
    void sessionIdIsTheDocumentKeyAndVersionIsOptimistic() throws Exception {
        assertThat(ConversationCheckpointDocument.class.getAnnotation(Document.class).collection())
                .isEqualTo("conversation_checkpoints");
        assertThat(ConversationCheckpointDocument.class.getDeclaredField("sessionId")
                .isAnnotationPresent(Id.class)).isTrue();
        assertThat(ConversationCheckpointDocument.class.getDeclaredField("version")
                .isAnnotationPresent(Version.class)).isTrue();
    }
}
