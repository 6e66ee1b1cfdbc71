package dumb.deduction.proof;

import dumb.deduction.util.Json;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProofRecordsTest {

    @Test
    void courseLinesAreOneBasedAndInclusive() {
        var course = new Course("c", "l1\nl2\nl3", List.of());
        assertEquals("l1\nl2\n", course.linesUpTo(2));
        assertEquals("", course.linesUpTo(0));
        assertEquals("l1\nl2\nl3\n", course.linesUpTo(10));
    }

    @Test
    void proofStepCodeEndsWithComma() {
        assertEquals("simp,\n", ProofStep.of("simp").normalizedCode());
        assertEquals("simp,\n", ProofStep.of("  simp,\n").normalizedCode());
        assertThrows(IllegalArgumentException.class, () -> new ProofStep("x", -1));
    }

    @Test
    void statementLinesAreValidated() {
        assertThrows(IllegalArgumentException.class, () -> new Statement("s", 0, 1, "lemma s"));
        assertThrows(IllegalArgumentException.class, () -> new Statement("s", 5, 4, "lemma s"));
        assertThrows(NullPointerException.class, () -> new Statement(null, 1, 2, "lemma s"));
    }

    @Test
    void courseReadsFromJson() throws Exception {
        var json = """
                {"name": "logic", "content": "lemma a : true :=\\nbegin\\nend\\n",
                 "statements": [{"name": "a", "lemmaLine": 1, "beginLine": 2, "lemma": "lemma a : true :="}],
                 "author": "ignored"}
                """;
        var course = Json.obj(json, Course.class);
        assertEquals("logic", course.name());
        assertEquals(1, course.statements().size());
        assertEquals(2, course.statements().get(0).beginLine());
        assertEquals("lemma a : true :=\nbegin\n", course.linesUpTo(2));
    }
}
