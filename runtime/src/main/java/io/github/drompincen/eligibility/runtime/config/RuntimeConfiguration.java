package io.github.drompincen.eligibility.runtime.config;

import io.github.drompincen.eligibility.runtime.agent.llm.LlmConfigurationException;
import io.github.drompincen.eligibility.runtime.agent.llm.LlmService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(EligibilityProperties.class)
public class RuntimeConfiguration {

    @Bean
    Clock clock() {
        return Clock.systemDefaultZone();
    }

    /** Stands in for the provider beans when none matches, so startup names the bad setting. */
    @Bean
    @ConditionalOnExpression("!'${eligibility.llm.provider:openai}'.trim().toLowerCase().matches('openai|anthropic|fake')")
    LlmService unknownLlmProvider(@Value("${eligibility.llm.provider}") String provider) {
        throw new LlmConfigurationException("Unknown eligibility.llm.provider '" + provider
                + "', expected one of " + EligibilityProperties.Llm.PROVIDERS);
    }
}
