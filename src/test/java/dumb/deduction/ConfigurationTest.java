package dumb.deduction;

import dumb.deduction.util.Json;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigurationTest {

    @Test
    void defaults() {
        var c = new Configuration();
        assertEquals(10_000, c.timeoutMillis());
        assertEquals(20_000, c.startingTimeoutMillis());
        assertEquals(2, c.nbTrials());
        assertEquals(10, c.maxCapacity());
        assertEquals(List.of("lean", "--server"), c.backendCommand());
        assertFalse(c.checkTypes());
        assertTrue(c.genericGrouping());
    }

    @Test
    void missingFieldsTakeDefaults() throws Exception {
        try (var in = getClass().getClassLoader().getResourceAsStream("test-config.json")) {
            assertNotNull(in);
            var c = Json.the.readValue(in, Configuration.class);
            assertEquals(200, c.timeoutMillis());
            assertEquals(3, c.nbTrials());
            assertTrue(c.checkTypes());
            assertEquals(20_000, c.startingTimeoutMillis());
            assertEquals(10, c.maxCapacity());
            assertTrue(c.genericGrouping());
        }
    }

    @Test
    void loadsFileThenClasspathThenDefaults(@TempDir Path dir) throws Exception {
        var file = dir.resolve("custom.json");
        Files.writeString(file, "{\"maxCapacity\": 4, \"backendCommand\": [\"prover\"]}");
        var c = Configuration.load(file);
        assertEquals(4, c.maxCapacity());
        assertEquals(List.of("prover"), c.backendCommand());

        var fallback = Configuration.load(dir.resolve("missing.json"));
        assertEquals(new Configuration(), fallback);
        assertEquals(new Configuration(), Configuration.load(null));
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class,
                () -> new Configuration(0, 20, 2, 10, List.of("lean"), false, true));
        assertThrows(IllegalArgumentException.class,
                () -> new Configuration(10, 20, 0, 10, List.of("lean"), false, true));
        assertThrows(IllegalArgumentException.class,
                () -> new Configuration(10, 20, 2, 0, List.of("lean"), false, true));
    }

    @Test
    void serializesToJson() {
        var n = Json.node(new Configuration());
        assertEquals(10.0, n.get("timeoutSeconds").asDouble());
        assertEquals("lean", n.get("backendCommand").get(0).asText());
    }
}
