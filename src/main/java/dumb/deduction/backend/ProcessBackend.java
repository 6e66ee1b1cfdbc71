package dumb.deduction.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import dumb.deduction.util.Json;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Optional.ofNullable;

/**
 * Runs the prover as a child process speaking one JSON document per line on stdin/stdout.
 */
public class ProcessBackend implements ProverBackend {

    private static final Logger logger = LoggerFactory.getLogger(ProcessBackend.class);

    private final List<String> command;
    private final ConcurrentMap<Integer, CompletableFuture<SyncResponse>> pending = new ConcurrentHashMap<>();
    private final List<Consumer<ProverMessage>> messageListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<Boolean>> runningListeners = new CopyOnWriteArrayList<>();
    private @Nullable Process process;
    private @Nullable Writer writer;

    public ProcessBackend(List<String> command) {
        this.command = List.copyOf(command);
    }

    @Override
    public synchronized void start() throws BackendException {
        if (process != null) throw new BackendException("Backend already started");
        try {
            process = new ProcessBuilder(command).redirectError(ProcessBuilder.Redirect.INHERIT).start();
        } catch (IOException e) {
            throw new BackendException("Cannot launch " + String.join(" ", command), e);
        }
        logger.info("Started prover: {}", String.join(" ", command));
        attach(process.getInputStream(), process.getOutputStream());
    }

    synchronized void attach(InputStream in, OutputStream out) {
        writer = new BufferedWriter(new OutputStreamWriter(out, UTF_8));
        var reader = new Thread(() -> readLoop(in), "prover-reader");
        reader.setDaemon(true);
        reader.start();
    }

    @Override
    public CompletableFuture<SyncResponse> send(SyncRequest request) {
        var future = new CompletableFuture<SyncResponse>();
        ofNullable(pending.put(request.seqNum(), future))
                .ifPresent(old -> old.completeExceptionally(new CancellationException("Superseded by a new sync")));
        try {
            synchronized (this) {
                if (writer == null) throw new IOException("Backend not started");
                writer.write(Json.str(request));
                writer.write('\n');
                writer.flush();
            }
            logger.debug("Sent sync #{} ({} chars)", request.seqNum(), request.content().length());
        } catch (IOException e) {
            pending.remove(request.seqNum(), future);
            future.completeExceptionally(new BackendException("Cannot write to prover", e));
        }
        return future;
    }

    @Override
    public void onMessage(Consumer<ProverMessage> listener) {
        messageListeners.add(listener);
    }

    @Override
    public void onRunningChange(Consumer<Boolean> listener) {
        runningListeners.add(listener);
    }

    @Override
    public void discardPending() {
        pending.keySet().forEach(seq -> ofNullable(pending.remove(seq))
                .ifPresent(f -> f.completeExceptionally(new CancellationException("Discarded sync #" + seq))));
    }

    @Override
    public synchronized void stop() {
        discardPending();
        if (writer != null) {
            try {
                writer.close();
            } catch (IOException e) {
                logger.warn("Error closing prover input: {}", e.getMessage());
            }
            writer = null;
        }
        if (process != null) {
            process.destroy();
            process = null;
            logger.info("Stopped prover");
        }
    }

    private void readLoop(InputStream in) {
        try (var reader = new BufferedReader(new InputStreamReader(in, UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) handleLine(line);
            }
        } catch (IOException e) {
            logger.warn("Prover output closed: {}", e.getMessage());
        } finally {
            discardPending();
        }
    }

    void handleLine(String line) {
        JsonNode n;
        try {
            n = Json.tree(line);
        } catch (JsonProcessingException e) {
            logger.warn("Dropping unparseable prover line: {}", line);
            return;
        }
        var kind = n.path("response").asText("");
        switch (kind) {
            case "ok", "error" -> completeSync(kind, n);
            case "all_messages" -> n.path("msgs").forEach(this::dispatchMessage);
            case "current_tasks" -> {
                var running = n.path("is_running").asBoolean(false);
                runningListeners.forEach(l -> l.accept(running));
            }
            default -> logger.warn("Unknown prover response '{}'", kind);
        }
    }

    private void completeSync(String kind, JsonNode n) {
        var seq = n.path("seq_num").asInt(-1);
        var future = pending.remove(seq);
        if (future == null) {
            logger.warn("Response for unknown sync #{}", seq);
            return;
        }
        var message = n.path("message").asText("");
        if (kind.equals("error")) {
            logger.error("Prover rejected sync #{}: {}", seq, message);
            future.completeExceptionally(new BackendException(message));
        } else {
            future.complete(new SyncResponse(seq, kind, message));
        }
    }

    private void dispatchMessage(JsonNode m) {
        if (!m.hasNonNull("seq_num") || !m.get("seq_num").canConvertToInt()) {
            logger.warn("Dropping prover message without sequence number: {}", m);
            return;
        }
        try {
            var msg = Json.obj(m, ProverMessage.class);
            messageListeners.forEach(l -> l.accept(msg));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            logger.warn("Dropping malformed prover message {}: {}", m, e.getMessage());
        }
    }
}
