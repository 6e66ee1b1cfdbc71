package dumb.deduction.server;

import dumb.deduction.Event;
import dumb.deduction.Events;
import dumb.deduction.backend.ProverBackend;
import dumb.deduction.backend.ProverMessage;
import dumb.deduction.backend.SyncRequest;
import dumb.deduction.backend.SyncResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.fail;

abstract class AbstractServerTest {

    private static final long WAIT_TIMEOUT_SECONDS = 5;
    private static final long WAIT_INTERVAL_MILLIS = 10;

    protected ScheduledExecutorService scheduler;
    protected ExecutorService eventExecutor;
    protected Events events;
    protected final List<Event> emitted = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUpExecutors() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        eventExecutor = Executors.newSingleThreadExecutor();
        events = new Events(eventExecutor);
        events.on(Event.ProverResponseEvent.class, emitted::add);
        events.on(Event.QueueEndedEvent.class, emitted::add);
        events.on(Event.EffectiveCodeEvent.class, emitted::add);
        events.on(Event.InitialProofStatesEvent.class, emitted::add);
        events.on(Event.FileChangedEvent.class, emitted::add);
        events.on(Event.BackendStateEvent.class, emitted::add);
    }

    @AfterEach
    void tearDownExecutors() throws InterruptedException {
        scheduler.shutdownNow();
        eventExecutor.shutdownNow();
        scheduler.awaitTermination(1, TimeUnit.SECONDS);
        eventExecutor.awaitTermination(1, TimeUnit.SECONDS);
    }

    protected static void waitCondition(BooleanSupplier condition, String description) {
        var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(WAIT_TIMEOUT_SECONDS);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline)
                fail("Timed out waiting for " + description);
            try {
                Thread.sleep(WAIT_INTERVAL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted waiting for " + description);
            }
        }
    }

    protected <T extends Event> List<T> emitted(Class<T> type) {
        return emitted.stream().filter(type::isInstance).map(type::cast).toList();
    }

    /** Records syncs and lets the test answer them and inject diagnostics. */
    static class FakeBackend implements ProverBackend {

        final BlockingQueue<SyncRequest> sent = new LinkedBlockingQueue<>();
        final Map<Integer, CompletableFuture<SyncResponse>> pending = new ConcurrentHashMap<>();
        final AtomicInteger discarded = new AtomicInteger();
        private final List<Consumer<ProverMessage>> messageListeners = new CopyOnWriteArrayList<>();
        private final List<Consumer<Boolean>> runningListeners = new CopyOnWriteArrayList<>();
        volatile boolean started;

        @Override
        public void start() {
            started = true;
        }

        @Override
        public CompletableFuture<SyncResponse> send(SyncRequest request) {
            var f = new CompletableFuture<SyncResponse>();
            pending.put(request.seqNum(), f);
            sent.add(request);
            return f;
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
            discarded.incrementAndGet();
            pending.values().forEach(f -> f.cancel(false));
            pending.clear();
        }

        @Override
        public void stop() {
            discardPending();
        }

        SyncRequest nextSync() throws InterruptedException {
            var r = sent.poll(WAIT_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            assertNotNull(r, "no sync sent");
            return r;
        }

        void accept(int seq) {
            respond(seq, SyncResponse.FILE_INVALIDATED);
        }

        void respond(int seq, String message) {
            var f = pending.remove(seq);
            if (f != null) f.complete(new SyncResponse(seq, "ok", message));
        }

        void message(int seq, ProverMessage.Severity severity, int line, String text) {
            var msg = new ProverMessage(seq, severity, line, 0, text);
            messageListeners.forEach(l -> l.accept(msg));
        }

        void running(boolean running) {
            runningListeners.forEach(l -> l.accept(running));
        }
    }
}
