package io.github.drompincen.eligibility.runtime.rules;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.OptionalDouble;

@Component
public class DonorSummarizer {

    /** One-line summary, e.g. {@code sex:F age:34 hb:11.8 bp:118/76 bmi:22.4 flags:none}. */
    public String summarize(Map<String, Object> donor) {
        DonorFacts facts = new DonorFacts(donor);
        String sex = facts.sex().isEmpty() ? "?" : facts.sex();
        String flags = facts.flags().isEmpty() ? "none" : String.join(",", facts.flags());
        return "sex:" + sex
                + " age:" + whole(facts.age())
                + " hb:" + decimal(facts.hemoglobin())
                + " bp:" + whole(facts.systolic()) + "/" + whole(facts.diastolic())
                + " bmi:" + decimal(facts.bmi())
                + " flags:" + flags;
    }

    private static String whole(OptionalDouble value) {
        return value.isPresent() ? String.valueOf(Math.round(value.getAsDouble())) : "?";
    }

    private static String decimal(OptionalDouble value) {
        return value.isPresent() ? ThresholdRuleEngine.format(value.getAsDouble()) : "?";
    }
}
