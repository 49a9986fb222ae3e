package io.github.drompincen.eligibility.runtime.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.drompincen.eligibility.runtime.agent.graph.ConversationState;
import org.springframework.stereotype.Component;

/**
 * JSON form of {@link ConversationState} shared by the checkpoint stores. Reading back what was
 * written also serves as the deep copy a turn works on.
 */
@Component
public class ConversationStateCodec {

    private final ObjectMapper objectMapper;

    public ConversationStateCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String write(ConversationState state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize state of session " + state.getSessionId(), e);
        }
    }

    public ConversationState read(String json) {
        try {
            return objectMapper.readValue(json, ConversationState.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot deserialize conversation state", e);
        }
    }

    public ConversationState copy(ConversationState state) {
        return read(write(state));
    }
}
