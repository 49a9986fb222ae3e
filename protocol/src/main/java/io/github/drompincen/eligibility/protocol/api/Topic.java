package io.github.drompincen.eligibility.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum Topic {
    VACCINE("vaccine"),
    TATTOO("tattoo"),
    TRAVEL("travel"),
    DONATION("donation"),
    MEDICATION("medication"),
    SYMPTOMS("symptoms");

    private final String key;

    Topic(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() { return key; }

    public static Optional<Topic> fromKey(String key) {
        if (key == null) return Optional.empty();
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (Topic topic : values()) {
            if (topic.key.equals(normalized)) return Optional.of(topic);
        }
        return Optional.empty();
    }

    @JsonCreator
    static Topic fromJson(String key) {
        return fromKey(key).orElseThrow(() -> new IllegalArgumentException("Unknown topic: " + key));
    }
}
