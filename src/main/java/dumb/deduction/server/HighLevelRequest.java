package dumb.deduction.server;

import dumb.deduction.backend.ProverMessage;
import dumb.deduction.proof.ProofState;
import dumb.deduction.proof.ProofStep;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A request to the prover, correlated with its diagnostics through its sequence number.
 * The analyses accumulated from the diagnostics are turned into a {@link ProverResponse}
 * once {@link #isComplete()}.
 */
public abstract class HighLevelRequest {

    private static final Logger logger = LoggerFactory.getLogger(HighLevelRequest.class);

    public static final String CONTEXT_PREFIX = "context #";
    public static final String TARGETS_PREFIX = "targets #";
    public static final String EFFECTIVE_CODE_PREFIX = "EFFECTIVE CODE";

    private int seqNum = -1;
    private boolean prepared;
    protected final List<String> hypoAnalyses = new ArrayList<>();
    protected @Nullable String targetsAnalysis;
    protected final List<ProverMessage> errors = new ArrayList<>();
    protected boolean failed;
    protected boolean noGoals;
    private CompletableFuture<Void> proofReceived = new CompletableFuture<>();

    public abstract String requestType();

    /** Whole file to sync, with analysis code tagged by the current sequence number. */
    public abstract String fileContents();

    /** Side effects to run once, before the first send. */
    protected void prepare() {
    }

    final synchronized void prepareOnce() {
        if (!prepared) {
            prepared = true;
            prepare();
        }
    }

    public synchronized int seqNum() {
        return seqNum;
    }

    synchronized void setSeqNum(int seqNum) {
        this.seqNum = seqNum;
    }

    public String analysisCode() {
        var n = seqNum();
        return "targets_analysis " + n + ",\nall_goals {hypo_analysis " + n + "},\n";
    }

    public synchronized void storeHypoAnalysis(String text, int line) {
        hypoAnalyses.add(text);
    }

    public synchronized void storeTargetsAnalysis(String text, int line) {
        if (targetsAnalysis != null)
            logger.warn("Second targets analysis for request #{} at line {}", seqNum, line);
        targetsAnalysis = text;
    }

    public synchronized void processEffectiveCode(String text) {
        logger.debug("Ignoring effective code for {} request #{}", requestType(), seqNum);
    }

    public synchronized void recordError(ProverMessage msg) {
        errors.add(msg);
        failed = true;
    }

    public synchronized void markNoGoals() {
        noGoals = true;
    }

    /** Number of goals announced by the targets analysis, -1 before it arrives. */
    public synchronized int expectedNbGoals() {
        return targetsAnalysis == null ? -1 : countGoals(targetsAnalysis);
    }

    static int countGoals(String targets) {
        int count = 0;
        for (int i = targets.indexOf(ProofState.GOAL_SEPARATOR); i >= 0;
             i = targets.indexOf(ProofState.GOAL_SEPARATOR, i + ProofState.GOAL_SEPARATOR.length()))
            count++;
        return count;
    }

    public synchronized boolean isComplete() {
        if (failed || noGoals) return true;
        return targetsAnalysis != null && hypoAnalyses.size() >= expectedNbGoals();
    }

    public synchronized List<ProverMessage> errors() {
        return List.copyOf(errors);
    }

    synchronized void setProofReceived() {
        proofReceived.complete(null);
    }

    public synchronized CompletableFuture<Void> proofReceived() {
        return proofReceived;
    }

    /** Forgets what a previous trial accumulated, before the request is sent again. */
    public synchronized void reset() {
        hypoAnalyses.clear();
        targetsAnalysis = null;
        errors.clear();
        failed = false;
        noGoals = false;
        if (!proofReceived.isDone()) proofReceived.cancel(false);
        proofReceived = new CompletableFuture<>();
    }

    protected @Nullable ProofStep proofStep() {
        return null;
    }

    protected Map<Integer, Integer> effectiveCode() {
        return Map.of();
    }

    public synchronized ProverResponse response() {
        return new ProverResponse(proofStep(), hypoAnalyses, targetsAnalysis,
                errors.isEmpty() ? ProverResponse.ErrorType.NONE : ProverResponse.ErrorType.PROOF_ERROR,
                errors, effectiveCode());
    }

    @Override
    public String toString() {
        return requestType() + "#" + seqNum();
    }
}
