package io.github.drompincen.eligibility.runtime.retrieval;

import io.github.drompincen.eligibility.protocol.api.RetrievedEvidence;
import io.github.drompincen.eligibility.runtime.config.EligibilityProperties;
import io.github.drompincen.eligibility.runtime.guardrail.GuardrailService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lexical lookup over markdown policy documents on the classpath. Each heading starts a
 * section; sections are ranked by query-term overlap, heading matches weighted higher.
 */
@Component
public class PolicyDocumentRetriever implements EvidenceRetriever {

    private static final Logger log = LoggerFactory.getLogger(PolicyDocumentRetriever.class);
    private static final int HEADING_WEIGHT = 3;
    private static final int MIN_TERM_LENGTH = 3;
    private static final Set<String> STOPWORDS = Set.of(
            "the", "and", "for", "can", "you", "your", "are", "was", "were", "have", "has", "had", "did",
            "does", "what", "when", "how", "who", "which", "with", "this", "that", "from", "about", "after",
            "before", "long", "will", "would", "could", "should", "donate", "donor", "blood", "give", "still",
            "any", "not", "but", "got", "get", "been", "there", "their", "they", "them", "its");

    private final GuardrailService guardrails;
    private final int topK;
    private final List<PolicySection> sections;

    public PolicyDocumentRetriever(EligibilityProperties properties, GuardrailService guardrails) {
        this(properties, guardrails, new PathMatchingResourcePatternResolver());
    }

    PolicyDocumentRetriever(EligibilityProperties properties, GuardrailService guardrails,
                            ResourcePatternResolver resolver) {
        this.guardrails = guardrails;
        this.topK = properties.retrieval().topK();
        this.sections = load(resolver, properties.retrieval().location());
        log.info("Loaded {} policy sections from {}", sections.size(), properties.retrieval().location());
    }

    @Override
    public RetrievedEvidence query(String question, String context) {
        String q = question != null ? question : "";
        if (guardrails.looksLikePromptInjection(q)) {
            return new RetrievedEvidence(guardrails.injectionRefusal(), List.of());
        }
        if (guardrails.redFlagHit(q)) {
            return new RetrievedEvidence(guardrails.escalationMessage(), List.of());
        }

        Set<String> terms = terms(q + " " + (context != null ? context : ""));
        if (terms.isEmpty()) {
            return RetrievedEvidence.empty();
        }
        List<Map.Entry<PolicySection, Integer>> ranked = sections.stream()
                .map(s -> Map.entry(s, score(s, terms)))
                .filter(e -> e.getValue() > 0)
                .sorted(Map.Entry.<PolicySection, Integer>comparingByValue(Comparator.reverseOrder()))
                .limit(topK)
                .toList();
        if (ranked.isEmpty()) {
            return RetrievedEvidence.empty();
        }

        String text = ranked.stream()
                .map(e -> "[" + e.getKey().docId() + "]\n" + e.getKey().body().trim())
                .collect(Collectors.joining("\n\n"));
        List<Object> citations = new ArrayList<>();
        ranked.forEach(e -> citations.add(e.getKey().docId()));
        return new RetrievedEvidence(text, citations);
    }

    List<PolicySection> sections() {
        return sections;
    }

    private static int score(PolicySection section, Set<String> terms) {
        Set<String> heading = terms(section.heading());
        Set<String> body = terms(section.body());
        int score = 0;
        for (String term : terms) {
            if (heading.stream().anyMatch(h -> h.startsWith(term) || term.startsWith(h))) score += HEADING_WEIGHT;
            if (body.contains(term)) score += 1;
        }
        return score;
    }

    static Set<String> terms(String text) {
        Set<String> terms = new LinkedHashSet<>();
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (token.length() >= MIN_TERM_LENGTH && !STOPWORDS.contains(token)) {
                terms.add(token);
            }
        }
        return terms;
    }

    static List<PolicySection> parse(String fileName, String markdown) {
        List<PolicySection> parsed = new ArrayList<>();
        String heading = null;
        StringBuilder body = new StringBuilder();
        for (String line : markdown.split("\\R")) {
            if (line.startsWith("#")) {
                if (heading != null && !body.toString().isBlank()) {
                    parsed.add(new PolicySection(fileName + " - " + heading, heading, body.toString()));
                }
                heading = line.replaceFirst("^#+\\s*", "").trim();
                body.setLength(0);
            } else if (heading != null) {
                body.append(line).append('\n');
            }
        }
        if (heading != null && !body.toString().isBlank()) {
            parsed.add(new PolicySection(fileName + " - " + heading, heading, body.toString()));
        }
        return parsed;
    }

    private static List<PolicySection> load(ResourcePatternResolver resolver, String location) {
        List<PolicySection> loaded = new ArrayList<>();
        Resource[] resources;
        try {
            resources = resolver.getResources(location);
        } catch (IOException e) {
            log.warn("No policy documents found at {}: {}", location, e.getMessage());
            return loaded;
        }
        for (Resource resource : resources) {
            try (InputStream in = resource.getInputStream()) {
                String name = resource.getFilename() != null ? resource.getFilename() : resource.getDescription();
                loaded.addAll(parse(name, new String(in.readAllBytes(), StandardCharsets.UTF_8)));
            } catch (IOException e) {
                log.warn("Skipping unreadable policy document {}: {}", resource.getDescription(), e.getMessage());
            }
        }
        return loaded;
    }
}
