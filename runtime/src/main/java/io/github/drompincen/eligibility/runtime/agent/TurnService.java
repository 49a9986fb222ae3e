package io.github.drompincen.eligibility.runtime.agent;

import io.github.drompincen.eligibility.protocol.api.Decision;
import io.github.drompincen.eligibility.protocol.api.TurnRequest;
import io.github.drompincen.eligibility.protocol.api.TurnResponse;
import io.github.drompincen.eligibility.runtime.agent.graph.ConversationState;
import io.github.drompincen.eligibility.runtime.agent.graph.EligibilityPipeline;
import io.github.drompincen.eligibility.runtime.checkpoint.CheckpointStore;
import io.github.drompincen.eligibility.runtime.config.EligibilityProperties;
import io.github.drompincen.eligibility.runtime.lock.SessionLockService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point for one conversational turn: serializes turns per session, loads the checkpoint,
 * runs the pipeline under a deadline and persists the result only if the turn was not cancelled.
 */
@Service
public class TurnService {

    private static final Logger log = LoggerFactory.getLogger(TurnService.class);
    static final String TURN_SERVICE_MODEL = "turn-service";
    static final String BUSY_RATIONALE =
            "Another message for this conversation is still being processed. Please retry in a moment.";
    static final String TIMEOUT_RATIONALE =
            "The eligibility check took too long and was cancelled. Please ask again.";
    static final String FAILURE_RATIONALE =
            "The eligibility check could not be completed. Please ask again.";

    private final SessionLockService lockService;
    private final CheckpointStore checkpointStore;
    private final EligibilityPipeline pipeline;
    private final Clock clock;
    private final Duration timeout;
    private final Duration lockWait;
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "eligibility-turn");
        t.setDaemon(true);
        return t;
    });

    public TurnService(SessionLockService lockService,
                       CheckpointStore checkpointStore,
                       EligibilityPipeline pipeline,
                       EligibilityProperties properties,
                       Clock clock) {
        this.lockService = lockService;
        this.checkpointStore = checkpointStore;
        this.pipeline = pipeline;
        this.clock = clock;
        this.timeout = properties.turn().timeout();
        this.lockWait = properties.turn().lockWait();
    }

    public TurnResponse handle(TurnRequest request) {
        String sessionId = request.sessionId();
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }

        Optional<String> lockOwner = lockService.tryAcquire(sessionId, lockWait);
        if (lockOwner.isEmpty()) {
            log.warn("Session {} is busy, rejecting concurrent turn", sessionId);
            return degraded(BUSY_RATIONALE);
        }

        TurnExecution execution = new TurnExecution();
        Future<ConversationState> future = executor.submit(() -> runTurn(sessionId, request, execution));
        try {
            ConversationState state = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return TurnResponse.of(state.getDecision());
        } catch (TimeoutException e) {
            if (execution.cancel()) {
                future.cancel(true);
                log.warn("Turn for session {} timed out after {}; nothing persisted", sessionId, timeout);
                return degraded(TIMEOUT_RATIONALE);
            }
            // commit already started, let it finish
            return awaitCommitted(sessionId, future);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            execution.cancel();
            future.cancel(true);
            return degraded(TIMEOUT_RATIONALE);
        } catch (ExecutionException e) {
            log.error("Turn for session {} failed", sessionId, e.getCause());
            return degraded(FAILURE_RATIONALE);
        } finally {
            lockService.release(sessionId, lockOwner.get());
        }
    }

    public Optional<ConversationState> currentState(String sessionId) {
        return checkpointStore.get(sessionId);
    }

    public boolean reset(String sessionId) {
        boolean existed = checkpointStore.delete(sessionId);
        log.info("Session {} reset (existed={})", sessionId, existed);
        return existed;
    }

    private ConversationState runTurn(String sessionId, TurnRequest request, TurnExecution execution) {
        ConversationState state = checkpointStore.get(sessionId)
                .orElseGet(() -> ConversationState.create(sessionId));
        log.info("Turn {} starting for session {}", state.getTurnNo() + 1, sessionId);

        pipeline.run(state, request);

        if (!execution.beginCommit()) {
            throw new TurnCancelledException(sessionId);
        }
        state.setTurnNo(state.getTurnNo() + 1);
        state.setUpdatedAt(clock.instant());
        try {
            checkpointStore.put(sessionId, state);
        } catch (RuntimeException e) {
            log.error("Failed to checkpoint session {} at turn {}", sessionId, state.getTurnNo(), e);
        }
        return state;
    }

    private TurnResponse awaitCommitted(String sessionId, Future<ConversationState> future) {
        try {
            return TurnResponse.of(future.get().getDecision());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return degraded(TIMEOUT_RATIONALE);
        } catch (ExecutionException e) {
            log.error("Turn for session {} failed while committing", sessionId, e.getCause());
            return degraded(FAILURE_RATIONALE);
        }
    }

    private static TurnResponse degraded(String rationale) {
        return TurnResponse.of(Decision.needMoreInfo(0.0, rationale).withUsedModel(TURN_SERVICE_MODEL));
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    /** Settles the race between committing a finished turn and cancelling it on timeout. */
    static final class TurnExecution {

        enum Phase { RUNNING, COMMITTING, CANCELLED }

        private final AtomicReference<Phase> phase = new AtomicReference<>(Phase.RUNNING);

        boolean beginCommit() {
            return phase.compareAndSet(Phase.RUNNING, Phase.COMMITTING);
        }

        boolean cancel() {
            return phase.compareAndSet(Phase.RUNNING, Phase.CANCELLED);
        }

        Phase phase() {
            return phase.get();
        }
    }
}
