package io.github.drompincen.eligibility.runtime.config;

import io.github.drompincen.eligibility.runtime.agent.llm.LlmConfigurationException;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Explicit runtime configuration handed to every stage. Nothing reads provider credentials
 * or model ids from the environment directly.
 */
@ConfigurationProperties(prefix = "eligibility")
public record EligibilityProperties(
        Llm llm,
        Models models,
        Turn turn,
        Checkpoint checkpoint,
        Guardrails guardrails,
        Retrieval retrieval
) {
    public EligibilityProperties {
        llm = llm != null ? llm : new Llm(null, null, null, null, null, null, null);
        models = models != null ? models : new Models(null, null, null, null);
        turn = turn != null ? turn : new Turn(null, null);
        checkpoint = checkpoint != null ? checkpoint : new Checkpoint(null);
        guardrails = guardrails != null ? guardrails : new Guardrails(null, null, null, null, null);
        retrieval = retrieval != null ? retrieval : new Retrieval(null, null);
    }

    public static EligibilityProperties defaults() {
        return new EligibilityProperties(null, null, null, null, null, null);
    }

    public record Llm(
            String provider,
            String apiKey,
            String baseUrl,
            Boolean strictJson,
            Duration connectTimeout,
            Duration readTimeout,
            Integer maxTokens
    ) {
        public static final List<String> PROVIDERS = List.of("openai", "anthropic", "fake");

        public Llm {
            provider = provider != null && !provider.isBlank() ? provider.trim().toLowerCase() : "openai";
            if (!PROVIDERS.contains(provider)) {
                throw new LlmConfigurationException("Unknown eligibility.llm.provider '" + provider
                        + "', expected one of " + PROVIDERS);
            }
            strictJson = strictJson != null ? strictJson : Boolean.TRUE;
            connectTimeout = connectTimeout != null ? connectTimeout : Duration.ofSeconds(5);
            readTimeout = readTimeout != null ? readTimeout : Duration.ofSeconds(30);
            maxTokens = maxTokens != null ? maxTokens : 1024;
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    public record Models(
            String extractor,
            String clarifier,
            String decision,
            String reflector
    ) {
        private static final String DEFAULT_MODEL = "gpt-4o-mini";

        public Models {
            extractor = extractor != null ? extractor : DEFAULT_MODEL;
            clarifier = clarifier != null ? clarifier : DEFAULT_MODEL;
            decision = decision != null ? decision : DEFAULT_MODEL;
            reflector = reflector != null ? reflector : decision;
        }
    }

    public record Turn(
            Duration timeout,
            Duration lockWait
    ) {
        public Turn {
            timeout = timeout != null ? timeout : Duration.ofSeconds(60);
            lockWait = lockWait != null ? lockWait : Duration.ofSeconds(5);
        }
    }

    public record Checkpoint(String store) {
        public Checkpoint {
            store = store != null ? store : "mongo";
        }
    }

    public record Guardrails(
            List<String> redFlagPatterns,
            String escalationMessage,
            List<String> injectionPatterns,
            String injectionRefusal,
            String redactionLevel
    ) {
        public Guardrails {
            redFlagPatterns = redFlagPatterns != null ? List.copyOf(redFlagPatterns) : List.of(
                    "chest pain", "suicide", "suicidal", "kill myself", "self harm", "self-harm",
                    "overdose", "fainted", "unconscious", "seizure", "can't breathe",
                    "difficulty breathing", "severe bleeding", "coughing blood");
            escalationMessage = escalationMessage != null ? escalationMessage
                    : "Your message mentions symptoms that may need urgent care. "
                    + "Please contact emergency services or a clinician now rather than relying on this assistant.";
            injectionPatterns = injectionPatterns != null ? List.copyOf(injectionPatterns) : List.of(
                    "ignore (previous|prior) (instructions|rules)",
                    "reveal (system|hidden) prompt",
                    "show (the )?(full|entire) (document|policy)",
                    "print (all )?context",
                    "exfiltrate|leak|bypass (guardrails|safety)",
                    "\\bbase64\\b|curl\\s+http");
            injectionRefusal = injectionRefusal != null ? injectionRefusal
                    : "I can't comply with that request. I will answer based only on allowed policy summaries "
                    + "and won't reveal internal prompts or full documents.";
            redactionLevel = redactionLevel != null ? redactionLevel : "standard";
        }
    }

    public record Retrieval(
            Integer topK,
            String location
    ) {
        public Retrieval {
            topK = topK != null ? topK : 3;
            location = location != null ? location : "classpath*:policy/*.md";
        }
    }
}
