package io.github.drompincen.eligibility.runtime.agent.graph;

public enum PipelineStage {
    INGEST,
    GUARDRAIL_CHECK,
    SLOT_EXTRACT,
    PRECHECK,
    RETRIEVE,
    CLARIFY_GATE,
    SYNTHESIZE,
    REFLECT,
    COMPOSE,
    END
}
