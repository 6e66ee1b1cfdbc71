package dumb.deduction.server;

import dumb.deduction.Configuration;
import dumb.deduction.Event;
import dumb.deduction.Events;
import dumb.deduction.backend.BackendException;
import dumb.deduction.backend.ProverBackend;
import dumb.deduction.backend.ProverMessage;
import dumb.deduction.backend.SyncRequest;
import dumb.deduction.backend.SyncResponse;
import dumb.deduction.proof.Course;
import dumb.deduction.proof.Exercise;
import dumb.deduction.proof.ProofStep;
import dumb.deduction.proof.Statement;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeoutException;

import static java.util.Objects.requireNonNull;
import static java.util.Optional.ofNullable;

/**
 * High-level access to the prover: every request goes through the {@link ServerQueue}, gets a
 * fresh sequence number and collects the diagnostics tagged with it until it is complete.
 * Backend messages and request bookkeeping are handled on the scheduler thread.
 */
public class ServerInterface {

    private static final Logger logger = LoggerFactory.getLogger(ServerInterface.class);

    public static final String FILE_NAME = "deduction_lean";
    public static final String UNRESOLVED_TEXT = "tactic failed, there are unsolved goals";
    public static final String NO_GOALS_TEXT = "tactic failed, there are no goals to be solved";
    public static final String USES_SORRY = " uses sorry";

    private final ProverBackend backend;
    private final Events events;
    private final Configuration config;
    private final ScheduledExecutorService scheduler;
    private final ServerQueue queue;

    private int requestSeqNum = -1;
    private final Map<Integer, HighLevelRequest> pendingRequests = new HashMap<>();
    private volatile @Nullable VirtualFile leanFile;
    private volatile boolean running;

    public ServerInterface(ProverBackend backend, Events events, Configuration config, ScheduledExecutorService scheduler) {
        this.backend = requireNonNull(backend);
        this.events = requireNonNull(events);
        this.config = requireNonNull(config);
        this.scheduler = requireNonNull(scheduler);
        this.queue = new ServerQueue(scheduler, events, config.timeoutMillis(), config.startingTimeoutMillis(), config.nbTrials());
    }

    public void start() throws BackendException {
        backend.onMessage(msg -> scheduler.execute(() -> onMessage(msg)));
        backend.onRunningChange(r -> scheduler.execute(() -> onRunningChange(r)));
        backend.start();
    }

    public void stop() {
        queue.clear();
        backend.stop();
    }

    public ServerQueue queue() {
        return queue;
    }

    public @Nullable VirtualFile leanFile() {
        return leanFile;
    }

    public boolean isRunning() {
        return running;
    }

    public CompletableFuture<ProverResponse> setExercise(ProofStep proofStep, Exercise exercise) {
        logger.info("Set exercise to {}", exercise.statement().name());
        var request = new ExerciseRequest(proofStep, exercise);
        leanFile = request.virtualFile();
        return submit(request, false);
    }

    public CompletableFuture<ProverResponse> codeInsert(String label, ProofStep proofStep) {
        var file = leanFile;
        if (file == null)
            return CompletableFuture.failedFuture(new IllegalStateException("No exercise set"));
        return submit(new ProofStepRequest(proofStep, label, file), false);
    }

    /**
     * Queues initial proof state requests for {@code statements}, at most
     * {@link Configuration#maxCapacity()} statements per request.
     */
    public CompletableFuture<Void> setStatements(Course course, List<Statement> statements, boolean onTop) {
        var chunks = new ArrayList<List<Statement>>();
        for (int i = 0; i < statements.size(); i += config.maxCapacity())
            chunks.add(List.copyOf(statements.subList(i, Math.min(i + config.maxCapacity(), statements.size()))));
        logger.debug("{} statement(s) in {} request(s)", statements.size(), chunks.size());
        // on top, the last chunk added runs first
        if (onTop) Collections.reverse(chunks);
        var all = chunks.stream()
                .map(c -> submit(new InitialProofStateRequest(course, c), onTop))
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(all);
    }

    /** Replaces the code of the last proof step without asking the prover. */
    public void historyReplace(String code) {
        var file = leanFile;
        if (file == null || code.isBlank()) return;
        if (file.replaceLast(ProofStep.of(code).normalizedCode()))
            events.emit(new Event.FileChangedEvent(file.innerContents()));
    }

    /** Takes the last proof step out of the file. */
    public boolean historyUndo() {
        var file = leanFile;
        return file != null && changed(file, file.undo());
    }

    public boolean historyRedo() {
        var file = leanFile;
        return file != null && changed(file, file.redo());
    }

    /** Takes the last proof step out of the file if it is the one labelled {@code label}. */
    public boolean historyUndo(String label) {
        var file = leanFile;
        return file != null && changed(file, file.undo(label));
    }

    private boolean changed(VirtualFile file, boolean changed) {
        if (changed) events.emit(new Event.FileChangedEvent(file.innerContents()));
        return changed;
    }

    /** Cancels the running task and every queued one. */
    public void cancelPending() {
        queue.clear();
        queue.cancelCurrentTask();
    }

    CompletableFuture<ProverResponse> submit(HighLevelRequest request, boolean onTop) {
        var result = new CompletableFuture<ProverResponse>();
        scheduler.execute(() -> {
            register(request);
            queue.addTask(request.requestType(), () -> trial(request, result), () -> retry(request), onTop)
                    // done completes on the scheduler, so this runs before the next task starts
                    .whenComplete((r, e) -> {
                        if (e != null) abandon(request, result, e);
                    });
        });
        return result;
    }

    private void register(HighLevelRequest request) {
        request.setSeqNum(++requestSeqNum);
        pendingRequests.put(request.seqNum(), request);
        if (pendingRequests.size() > 1)
            logger.warn("{} requests pending", pendingRequests.size());
    }

    /** A new trial gets a new sequence number, so late messages of the previous one are dropped. */
    private void retry(HighLevelRequest request) {
        var old = request.seqNum();
        pendingRequests.remove(old);
        backend.discardPending();
        request.reset();
        register(request);
        logger.debug("Retrying {} (was #{})", request, old);
    }

    private CompletableFuture<?> trial(HighLevelRequest request, CompletableFuture<ProverResponse> result) {
        request.prepareOnce();
        if (!(request instanceof InitialProofStateRequest))
            ofNullable(leanFile).ifPresent(f -> events.emit(new Event.FileChangedEvent(f.innerContents())));
        var seq = request.seqNum();
        var proofReceived = request.proofReceived();
        var sync = new SyncRequest(seq, FILE_NAME, request.fileContents());
        return backend.send(sync).thenCompose(resp -> {
            if (!resp.accepted()) {
                logger.warn("Unexpected prover response to #{}: {}", seq, resp.message());
                return CompletableFuture.completedFuture(null);
            }
            if (SyncResponse.FILE_UNCHANGED.equals(resp.message()))
                logger.warn("File unchanged for #{}", seq);
            return proofReceived;
        }).thenRunAsync(() -> deliver(request, seq, result), scheduler);
    }

    private void deliver(HighLevelRequest request, int seq, CompletableFuture<ProverResponse> result) {
        pendingRequests.remove(seq);
        var response = request.response();
        if (request instanceof ProofStepRequest p && p.effectiveCodeReceived())
            events.emit(new Event.EffectiveCodeEvent(seq, response.effectiveCode()));
        if (request instanceof InitialProofStateRequest i)
            events.emit(new Event.InitialProofStatesEvent(i.proofStates()));
        events.emit(new Event.ProverResponseEvent(request.requestType(), seq, response));
        result.complete(response);
    }

    private void abandon(HighLevelRequest request, CompletableFuture<ProverResponse> result, Throwable error) {
        pendingRequests.remove(request.seqNum());
        var cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof TimeoutException) {
            var response = ProverResponse.timeout(request.proofStep());
            events.emit(new Event.ProverResponseEvent(request.requestType(), request.seqNum(), response));
            result.complete(response);
        } else {
            logger.info("{} dropped: {}", request, cause.toString());
            result.completeExceptionally(cause);
        }
    }

    void onMessage(ProverMessage msg) {
        queue.extendDeadline();
        var request = pendingRequests.get(msg.seqNum());
        if (request == null) {
            logger.warn("Pending requests are {}: ignoring message for #{}", pendingRequests.keySet(), msg.seqNum());
            return;
        }
        var text = msg.text();
        switch (msg.severity()) {
            case ERROR -> {
                logger.error("Prover error at line {}: {}", msg.posLine(), text);
                filterError(msg, request);
            }
            case WARNING -> {
                if (!text.endsWith(USES_SORRY))
                    logger.warn("Prover warning at line {}: {}", msg.posLine(), text);
            }
            case INFORMATION -> {
                if (text.startsWith(HighLevelRequest.CONTEXT_PREFIX))
                    request.storeHypoAnalysis(text, msg.posLine());
                else if (text.startsWith(HighLevelRequest.TARGETS_PREFIX))
                    request.storeTargetsAnalysis(text, msg.posLine());
                else if (text.startsWith(HighLevelRequest.EFFECTIVE_CODE_PREFIX))
                    request.processEffectiveCode(text);
            }
        }
        checkRequestComplete(msg.seqNum());
    }

    private void filterError(ProverMessage msg, HighLevelRequest request) {
        if (msg.text().startsWith(NO_GOALS_TEXT)) request.markNoGoals();
        else if (!msg.text().startsWith(UNRESOLVED_TEXT)) request.recordError(msg);
    }

    private void checkRequestComplete(int seq) {
        var request = pendingRequests.get(seq);
        if (request != null && request.isComplete()) {
            pendingRequests.remove(seq);
            request.setProofReceived();
        }
    }

    private void onRunningChange(boolean isRunning) {
        queue.extendDeadline();
        if (isRunning != running) {
            logger.info("New prover state: {}", isRunning ? "running" : "idle");
            running = isRunning;
            events.emit(new Event.BackendStateEvent(isRunning));
        }
    }
}
