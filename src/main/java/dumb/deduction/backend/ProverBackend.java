package dumb.deduction.backend;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Transport to the proof checker. Responses to {@link #send} arrive on the returned future;
 * diagnostics arrive asynchronously through the {@link #onMessage} listener.
 */
public interface ProverBackend {

    void start() throws BackendException;

    CompletableFuture<SyncResponse> send(SyncRequest request);

    void onMessage(Consumer<ProverMessage> listener);

    void onRunningChange(Consumer<Boolean> listener);

    /** Fails every response still awaited, e.g. before a request is sent again. */
    void discardPending();

    void stop();
}
