package io.github.drompincen.eligibility.runtime.agent.graph;

import io.github.drompincen.eligibility.protocol.api.Decision;
import io.github.drompincen.eligibility.protocol.api.Precheck;
import io.github.drompincen.eligibility.protocol.api.RetrievedEvidence;
import io.github.drompincen.eligibility.protocol.api.SessionStateDto;
import io.github.drompincen.eligibility.runtime.clarify.ClarifierVerdict;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything the pipeline knows about one session. Slots, topics and history accumulate
 * across turns; the remaining fields are rebuilt on every turn.
 */
public class ConversationState {

    public static final int MAX_HISTORY = 6;

    private String sessionId;
    private int turnNo;
    private Map<String, Object> donor;
    private String question;
    private List<String> history;
    private Map<String, Map<String, Object>> slots;
    private Set<String> topics;
    private Precheck precheck;
    private String donorSummary;
    private RetrievedEvidence retrieved;
    private ClarifierVerdict clarification;
    private Decision decision;
    private String usedModel;
    private boolean blocked;
    private List<String> safetyFlags;
    private List<String> stagePath;
    private Instant updatedAt;

    public ConversationState() {
        this.donor = new LinkedHashMap<>();
        this.question = "";
        this.history = new ArrayList<>();
        this.slots = new LinkedHashMap<>();
        this.topics = new LinkedHashSet<>();
        this.donorSummary = "";
        this.retrieved = RetrievedEvidence.empty();
        this.safetyFlags = new ArrayList<>();
        this.stagePath = new ArrayList<>();
    }

    public static ConversationState create(String sessionId) {
        ConversationState state = new ConversationState();
        state.sessionId = sessionId;
        return state;
    }

    /** Clears the per-turn fields before a new question is processed. */
    public void resetTurn() {
        this.topics = new LinkedHashSet<>();
        this.precheck = null;
        this.donorSummary = "";
        this.retrieved = RetrievedEvidence.empty();
        this.clarification = null;
        this.decision = null;
        this.usedModel = null;
        this.blocked = false;
        this.safetyFlags = new ArrayList<>();
        this.stagePath = new ArrayList<>();
    }

    public void appendHistory(String entry) {
        if (entry == null || entry.isBlank()) {
            return;
        }
        history.add(entry);
        while (history.size() > MAX_HISTORY) {
            history.remove(0);
        }
    }

    public List<String> recentHistory(int count) {
        int from = Math.max(0, history.size() - count);
        return List.copyOf(history.subList(from, history.size()));
    }

    public void addSafetyFlag(String flag) {
        if (flag != null && !safetyFlags.contains(flag)) {
            safetyFlags.add(flag);
        }
    }

    public SessionStateDto toDto() {
        return new SessionStateDto(sessionId, turnNo, List.copyOf(history), slots, topics,
                precheck, decision, usedModel, updatedAt);
    }

    // Getters and setters
    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }
    public int getTurnNo() { return turnNo; }
    public void setTurnNo(int turnNo) { this.turnNo = turnNo; }
    public Map<String, Object> getDonor() { return donor; }
    public void setDonor(Map<String, Object> donor) { this.donor = donor != null ? new LinkedHashMap<>(donor) : new LinkedHashMap<>(); }
    public String getQuestion() { return question; }
    public void setQuestion(String question) { this.question = question != null ? question : ""; }
    public List<String> getHistory() { return history; }
    public void setHistory(List<String> history) { this.history = history != null ? new ArrayList<>(history) : new ArrayList<>(); }
    public Map<String, Map<String, Object>> getSlots() { return slots; }
    public void setSlots(Map<String, Map<String, Object>> slots) { this.slots = slots != null ? new LinkedHashMap<>(slots) : new LinkedHashMap<>(); }
    public Set<String> getTopics() { return topics; }
    public void setTopics(Set<String> topics) { this.topics = topics != null ? new LinkedHashSet<>(topics) : new LinkedHashSet<>(); }
    public Precheck getPrecheck() { return precheck; }
    public void setPrecheck(Precheck precheck) { this.precheck = precheck; }
    public String getDonorSummary() { return donorSummary; }
    public void setDonorSummary(String donorSummary) { this.donorSummary = donorSummary != null ? donorSummary : ""; }
    public RetrievedEvidence getRetrieved() { return retrieved; }
    public void setRetrieved(RetrievedEvidence retrieved) { this.retrieved = retrieved != null ? retrieved : RetrievedEvidence.empty(); }
    public ClarifierVerdict getClarification() { return clarification; }
    public void setClarification(ClarifierVerdict clarification) { this.clarification = clarification; }
    public Decision getDecision() { return decision; }
    public void setDecision(Decision decision) { this.decision = decision; }
    public String getUsedModel() { return usedModel; }
    public void setUsedModel(String usedModel) { this.usedModel = usedModel; }
    public boolean isBlocked() { return blocked; }
    public void setBlocked(boolean blocked) { this.blocked = blocked; }
    public List<String> getSafetyFlags() { return safetyFlags; }
    public void setSafetyFlags(List<String> safetyFlags) { this.safetyFlags = safetyFlags != null ? new ArrayList<>(safetyFlags) : new ArrayList<>(); }
    public List<String> getStagePath() { return stagePath; }
    public void setStagePath(List<String> stagePath) { this.stagePath = stagePath != null ? new ArrayList<>(stagePath) : new ArrayList<>(); }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
