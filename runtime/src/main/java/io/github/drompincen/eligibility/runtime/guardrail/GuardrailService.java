package io.github.drompincen.eligibility.runtime.guardrail;

import io.github.drompincen.eligibility.runtime.config.EligibilityProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Red-flag and prompt-injection screening. Red flags are matched as whole words or phrases
 * against the question and the donor record values; injection patterns only against the question.
 */
@Service
public class GuardrailService {

    private static final Logger log = LoggerFactory.getLogger(GuardrailService.class);

    private final List<Pattern> redFlags;
    private final List<Pattern> injections;
    private final EligibilityProperties.Guardrails settings;
    private final PiiRedactor.Level redactionLevel;

    public GuardrailService(EligibilityProperties properties) {
        this.settings = properties.guardrails();
        this.redFlags = settings.redFlagPatterns().stream()
                .map(p -> Pattern.compile("\\b" + Pattern.quote(p) + "\\b", Pattern.CASE_INSENSITIVE))
                .toList();
        this.injections = settings.injectionPatterns().stream()
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
                .toList();
        this.redactionLevel = PiiRedactor.Level.parse(settings.redactionLevel());
        log.info("Guardrails loaded: {} red-flag patterns, {} injection patterns, redaction={}",
                redFlags.size(), injections.size(), redactionLevel);
    }

    public GuardrailVerdict check(String question, Map<String, Object> donor) {
        if (looksLikePromptInjection(question)) {
            log.warn("Prompt injection pattern matched; refusing");
            return new GuardrailVerdict(true, GuardrailVerdict.PROMPT_INJECTION, settings.injectionRefusal());
        }
        String donorText = donor == null ? "" : donor.values().stream()
                .map(String::valueOf)
                .collect(Collectors.joining(" "));
        if (redFlagHit(question + " " + donorText)) {
            log.warn("Red-flag content detected; escalating");
            return new GuardrailVerdict(true, GuardrailVerdict.RED_FLAG, settings.escalationMessage());
        }
        return GuardrailVerdict.pass();
    }

    public boolean redFlagHit(String text) {
        if (text == null || text.isBlank()) return false;
        return redFlags.stream().anyMatch(p -> p.matcher(text).find());
    }

    public boolean looksLikePromptInjection(String text) {
        if (text == null || text.isBlank()) return false;
        return injections.stream().anyMatch(p -> p.matcher(text).find());
    }

    public String redact(String text) {
        return PiiRedactor.redact(text, redactionLevel);
    }

    public String escalationMessage() {
        return settings.escalationMessage();
    }

    public String injectionRefusal() {
        return settings.injectionRefusal();
    }
}
