package dumb.deduction;

import dumb.deduction.backend.BackendException;
import dumb.deduction.backend.ProcessBackend;
import dumb.deduction.backend.ProverBackend;
import dumb.deduction.editor.Editor;
import dumb.deduction.pattern.Shapes;
import dumb.deduction.server.ServerInterface;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * One proof session: configuration, shapes, events, prover connection, editor and dispatch loop.
 */
public class Deduction {

    private static final Logger logger = LoggerFactory.getLogger(Deduction.class);
    private static final long EXECUTOR_SHUTDOWN_TIMEOUT_SECONDS = 2;

    public final Configuration config;
    public final Shapes shapes;
    public final Events events;
    public final ServerInterface server;
    public final Editor editor;
    public final Coordinator coordinator;
    private final ScheduledExecutorService scheduler;

    public Deduction(Configuration config, ProverBackend backend) {
        this.config = config;
        this.shapes = Shapes.standard();
        this.events = new Events(Executors.newSingleThreadExecutor(r -> daemon(r, "events")));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> daemon(r, "server"));
        this.server = new ServerInterface(backend, events, config, scheduler);
        this.editor = new Editor(shapes, config);
        this.coordinator = new Coordinator(editor, server);
    }

    private static Thread daemon(Runnable r, String name) {
        var t = new Thread(r, name);
        t.setDaemon(true);
        return t;
    }

    public void start() throws BackendException {
        events.on(Event.ProverResponseEvent.class, e -> logger.debug("{} #{}: {}", e.requestType(), e.seqNum(), e.response().errorType()));
        server.start();
    }

    public void stop() {
        server.stop();
        shutdownExecutor(scheduler, "Server scheduler");
        shutdownExecutor(events.exe, "Events");
    }

    private static void shutdownExecutor(ExecutorService executor, String name) {
        if (executor.isShutdown()) return;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(EXECUTOR_SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.error("{} did not terminate gracefully, forcing shutdown.", name);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            logger.error("Interrupted while waiting for {} shutdown.", name);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static void main(String[] args) {
        @Nullable Path configFile = null;
        for (var i = 0; i < args.length; i++) {
            try {
                switch (args[i]) {
                    case "-c", "--config" -> configFile = Path.of(args[++i]);
                    default -> logger.warn("Unknown option: {}", args[i]);
                }
            } catch (ArrayIndexOutOfBoundsException e) {
                logger.error("Missing value for {}", args[i - 1]);
                printUsageAndExit();
            }
        }

        var config = Configuration.load(configFile);
        var session = new Deduction(config, new ProcessBackend(config.backendCommand()));
        try {
            session.start();
        } catch (BackendException e) {
            logger.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
        }
        session.coordinator.onDisplay(System.out::println);
        var loop = new Thread(session.coordinator, "dispatch");
        loop.start();
        try (var in = new BufferedReader(new InputStreamReader(System.in, UTF_8))) {
            String line;
            while (loop.isAlive() && (line = in.readLine()) != null) {
                UserAction.parse(line).ifPresentOrElse(session.coordinator::post,
                        () -> System.out.println("?"));
            }
            session.coordinator.post(new UserAction.WindowClosed());
            loop.join();
        } catch (IOException e) {
            logger.error("Console read failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            session.stop();
        }
    }

    private static void printUsageAndExit() {
        System.err.printf("Usage: java %s [-c config.json]%n", Deduction.class.getName());
        System.exit(1);
    }
}
