package io.github.drompincen.eligibility.runtime.rules;

import io.github.drompincen.eligibility.protocol.api.Precheck;
import io.github.drompincen.eligibility.protocol.api.PrecheckStatus;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Hemoglobin, blood pressure, BMI and questionnaire-flag thresholds. Values missing from the
 * donor record are not checked.
 */
@Component
public class ThresholdRuleEngine implements RuleEngine {

    static final double MIN_HB_FEMALE = 12.5;
    static final double MIN_HB_MALE = 13.0;
    static final double MAX_SYSTOLIC = 180;
    static final double MAX_DIASTOLIC = 110;
    static final double MAX_BMI = 45;
    static final Set<String> CLEARANCE_FLAGS = Set.of("tattoo_3m", "recent_surgery", "recent_antibiotics");
    static final String PASS_REASON = "Meets basic precheck thresholds";

    @Override
    public Precheck compute(Map<String, Object> donor) {
        DonorFacts facts = new DonorFacts(donor);
        PrecheckStatus status = PrecheckStatus.ELIGIBLE;
        List<String> reasons = new ArrayList<>();

        OptionalDouble hb = facts.hemoglobin();
        String sex = facts.sex();
        if (hb.isPresent()) {
            double threshold = "F".equals(sex) ? MIN_HB_FEMALE : "M".equals(sex) ? MIN_HB_MALE : Double.NaN;
            if (!Double.isNaN(threshold) && hb.getAsDouble() < threshold) {
                status = PrecheckStatus.INELIGIBLE;
                reasons.add("Low Hb: " + format(hb.getAsDouble()) + " g/dL");
            }
        }

        OptionalDouble sys = facts.systolic();
        OptionalDouble dia = facts.diastolic();
        if ((sys.isPresent() && sys.getAsDouble() >= MAX_SYSTOLIC)
                || (dia.isPresent() && dia.getAsDouble() >= MAX_DIASTOLIC)) {
            status = PrecheckStatus.INELIGIBLE;
            reasons.add("Very high blood pressure: " + formatOrUnknown(sys) + "/" + formatOrUnknown(dia) + " mmHg");
        }

        boolean riskFlag = facts.flags().stream().anyMatch(CLEARANCE_FLAGS::contains);
        boolean highBmi = facts.bmi().isPresent() && facts.bmi().getAsDouble() >= MAX_BMI;
        if (riskFlag || highBmi) {
            if (status != PrecheckStatus.INELIGIBLE) {
                status = PrecheckStatus.REQUIRE_MEDICAL_CLEARANCE;
            }
            reasons.add("Recent risk factor flags or high BMI");
        }

        if (reasons.isEmpty()) {
            reasons.add(PASS_REASON);
        }
        return new Precheck(status, reasons);
    }

    static String format(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return String.valueOf((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static String formatOrUnknown(OptionalDouble value) {
        return value.isPresent() ? format(value.getAsDouble()) : "?";
    }
}
