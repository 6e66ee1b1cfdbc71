package dumb.deduction;

import dumb.deduction.editor.Display;
import dumb.deduction.editor.Editor;
import dumb.deduction.pattern.PatternParser;
import dumb.deduction.proof.ProofStep;
import dumb.deduction.server.ProverResponse;
import dumb.deduction.server.ServerInterface;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * Single consumer of user actions: edits go to the {@link Editor}, proof actions to the
 * {@link ServerInterface}. Runs until {@link UserAction.WindowClosed}.
 */
public class Coordinator implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(Coordinator.class);

    private final BlockingQueue<UserAction> actions = new LinkedBlockingQueue<>();
    private final Editor editor;
    private final ServerInterface server;
    private volatile @Nullable ProverResponse lastResponse;
    private volatile Consumer<String> onDisplay = s -> {
    };

    public Coordinator(Editor editor, ServerInterface server) {
        this.editor = requireNonNull(editor);
        this.server = requireNonNull(server);
    }

    /** Receives the marked rendering of the expression after each action. */
    public void onDisplay(Consumer<String> listener) {
        this.onDisplay = requireNonNull(listener);
    }

    public void post(UserAction action) {
        actions.add(requireNonNull(action));
    }

    public Editor editor() {
        return editor;
    }

    public @Nullable ProverResponse lastResponse() {
        return lastResponse;
    }

    @Override
    public void run() {
        try {
            while (dispatch(actions.take())) {
                var shown = Display.marked(editor.current());
                logger.debug("Expression: {}", shown);
                onDisplay.accept(shown);
            }
            logger.info("Window closed, dispatch loop ended");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Dispatch loop interrupted");
        }
    }

    /** @return false when the loop must end */
    boolean dispatch(UserAction action) {
        if (action instanceof UserAction.InsertFragment a) {
            try {
                editor.insert(PatternParser.parse(a.pattern()));
            } catch (PatternParser.ParseException e) {
                logger.warn("Bad fragment '{}': {}", a.pattern(), e.getMessage());
            }
        } else if (action instanceof UserAction.MoveCursor a) {
            editor.move(a.direction());
        } else if (action instanceof UserAction.ClearMarked) {
            editor.clearMarked();
        } else if (action instanceof UserAction.InsertParentheses) {
            editor.insertParentheses();
        } else if (action instanceof UserAction.SubmitCode a) {
            track(server.codeInsert(a.label(), a.step()).whenComplete((r, e) -> {
                // a rejected step must not reach the next request
                if ((e != null || r.isError()) && server.historyUndo(a.label()))
                    logger.info("Step {} taken back", a.label());
            }));
        } else if (action instanceof UserAction.StatementTriggered a) {
            track(server.setExercise(ProofStep.of(""), a.exercise()));
        } else if (action instanceof UserAction.CancelPending) {
            server.cancelPending();
        } else if (action instanceof UserAction.Undo) {
            editor.undo();
        } else if (action instanceof UserAction.Redo) {
            editor.redo();
        } else if (action instanceof UserAction.HistoryUndo) {
            server.historyUndo();
        } else if (action instanceof UserAction.HistoryRedo) {
            server.historyRedo();
        } else if (action instanceof UserAction.WindowClosed) {
            return false;
        }
        return true;
    }

    private void track(CompletableFuture<ProverResponse> response) {
        response.whenComplete((r, e) -> {
            if (e != null) {
                logger.warn("Request failed: {}", e.toString());
            } else {
                lastResponse = r;
                logger.info("Prover answered: {} ({} goal(s))", r.errorType(), r.hypoAnalyses().size());
            }
        });
    }
}
