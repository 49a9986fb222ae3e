package io.github.drompincen.eligibility.runtime.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a JSON object out of free-form model output. Attempts run in order: a fenced
 * {@code ```json} block, the whole text, then the outermost brace span. Anything that is
 * not an object yields an empty map.
 */
@Component
public class JsonRecovery {

    private static final Logger log = LoggerFactory.getLogger(JsonRecovery.class);
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final Pattern FENCED_JSON = Pattern.compile("```json\\s*(.*?)```",
            Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    private final ObjectMapper objectMapper;
    private final List<Function<String, Optional<String>>> candidates;

    public JsonRecovery(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.candidates = List.of(this::fencedBlock, Optional::of, this::braceSpan);
    }

    public Map<String, Object> recover(String text) {
        if (text == null || text.isBlank()) {
            return new LinkedHashMap<>();
        }
        for (Function<String, Optional<String>> candidate : candidates) {
            Optional<Map<String, Object>> parsed = candidate.apply(text).flatMap(this::parseObject);
            if (parsed.isPresent()) {
                return parsed.get();
            }
        }
        log.debug("No JSON object recoverable from model output ({} chars)", text.length());
        return new LinkedHashMap<>();
    }

    private Optional<String> fencedBlock(String text) {
        Matcher m = FENCED_JSON.matcher(text);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    private Optional<String> braceSpan(String text) {
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        return start >= 0 && end > start ? Optional.of(text.substring(start, end + 1)) : Optional.empty();
    }

    private Optional<Map<String, Object>> parseObject(String candidate) {
        String trimmed = candidate.trim();
        if (!trimmed.startsWith("{")) {
            return Optional.empty();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(trimmed, MAP_TYPE);
            return Optional.ofNullable(parsed);
        } catch (JsonProcessingException e) {
            log.trace("Candidate is not a JSON object: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
