package io.github.drompincen.eligibility.runtime.guardrail;

public record GuardrailVerdict(
        boolean blocked,
        String safetyFlag,
        String message
) {
    public static final String RED_FLAG = "red_flag_detected";
    public static final String PROMPT_INJECTION = "prompt_injection_detected";

    public static GuardrailVerdict pass() {
        return new GuardrailVerdict(false, null, null);
    }
}
