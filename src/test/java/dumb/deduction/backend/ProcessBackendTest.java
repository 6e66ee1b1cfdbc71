package dumb.deduction.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.deduction.util.Json;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.*;

class ProcessBackendTest {

    private ProcessBackend backend;
    private PipedOutputStream proverOut;
    private BufferedReader proverIn;
    private final List<ProverMessage> messages = new CopyOnWriteArrayList<>();
    private final List<Boolean> states = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        backend = new ProcessBackend(List.of("unused"));
        backend.onMessage(messages::add);
        backend.onRunningChange(states::add);

        var toBackend = new PipedInputStream();
        proverOut = new PipedOutputStream(toBackend);
        var fromBackend = new PipedInputStream();
        var backendOut = new PipedOutputStream(fromBackend);
        proverIn = new BufferedReader(new InputStreamReader(fromBackend, UTF_8));
        backend.attach(toBackend, backendOut);
    }

    @AfterEach
    void tearDown() throws IOException {
        backend.stop();
        proverOut.close();
    }

    private void reply(String line) throws IOException {
        proverOut.write((line + "\n").getBytes(UTF_8));
        proverOut.flush();
    }

    @Test
    void sendsOneJsonLinePerSync() throws Exception {
        var future = backend.send(new SyncRequest(3, "f", "line1\nline2\n"));
        var line = proverIn.readLine();
        var n = Json.tree(line);
        assertEquals("sync", n.get("command").asText());
        assertEquals(3, n.get("seq_num").asInt());
        assertEquals("f", n.get("file_name").asText());
        assertEquals("line1\nline2\n", n.get("content").asText());

        reply("{\"response\":\"ok\",\"seq_num\":3,\"message\":\"file invalidated\"}");
        var response = future.get(5, TimeUnit.SECONDS);
        assertTrue(response.accepted());
        assertEquals(3, response.seqNum());
    }

    @Test
    void errorResponseFailsTheSync() throws Exception {
        var future = backend.send(new SyncRequest(1, "f", ""));
        proverIn.readLine();
        reply("{\"response\":\"error\",\"seq_num\":1,\"message\":\"bad file\"}");
        var e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(BackendException.class, e.getCause());
    }

    @Test
    void dispatchesMessagesAndTaskState() {
        backend.handleLine("{\"response\":\"all_messages\",\"msgs\":[" +
                "{\"seq_num\":4,\"severity\":\"information\",\"pos_line\":7,\"pos_col\":2,\"text\":\"targets # x\"}," +
                "{\"seq_num\":4,\"severity\":\"error\",\"pos_line\":8,\"pos_col\":0,\"text\":\"oops\"}]}");
        backend.handleLine("{\"response\":\"current_tasks\",\"is_running\":true}");

        assertEquals(2, messages.size());
        assertEquals(new ProverMessage(4, ProverMessage.Severity.INFORMATION, 7, 2, "targets # x"), messages.get(0));
        assertEquals(ProverMessage.Severity.ERROR, messages.get(1).severity());
        assertEquals(List.of(true), states);
    }

    @Test
    void dropsGarbage() {
        backend.handleLine("not json");
        backend.handleLine("{\"response\":\"mystery\"}");
        backend.handleLine("{\"response\":\"all_messages\",\"msgs\":[{\"seq_num\":1,\"severity\":\"loud\",\"text\":\"x\"}]}");
        assertTrue(messages.isEmpty());
        assertTrue(states.isEmpty());
    }

    @Test
    void dropsMessagesWithoutSequenceNumber() {
        backend.handleLine("{\"response\":\"all_messages\",\"msgs\":[" +
                "{\"severity\":\"error\",\"pos_line\":3,\"pos_col\":0,\"text\":\"stray\"}," +
                "{\"seq_num\":null,\"severity\":\"error\",\"text\":\"null seq\"}," +
                "{\"seq_num\":\"two\",\"severity\":\"error\",\"text\":\"named seq\"}," +
                "{\"seq_num\":0,\"severity\":\"information\",\"text\":\"kept\"}]}");

        assertEquals(1, messages.size());
        assertEquals(0, messages.get(0).seqNum());
        assertEquals("kept", messages.get(0).text());
    }

    @Test
    void discardPendingCancelsAwaitedSyncs() throws IOException {
        var future = backend.send(new SyncRequest(9, "f", ""));
        proverIn.readLine();
        backend.discardPending();
        assertTrue(future.isCompletedExceptionally());
    }

    @Test
    void sendBeforeStartFails() {
        var idle = new ProcessBackend(List.of("unused"));
        var future = idle.send(new SyncRequest(0, "f", ""));
        assertTrue(future.isCompletedExceptionally());
    }

    @Test
    void messageJsonUsesProtocolNames() throws JsonProcessingException {
        var msg = new ProverMessage(2, ProverMessage.Severity.WARNING, 5, 1, "declaration uses sorry");
        var n = Json.node(msg);
        assertEquals("warning", n.get("severity").asText());
        assertEquals(5, n.get("pos_line").asInt());
        assertEquals(msg, Json.obj(Json.str(msg), ProverMessage.class));
    }
}
