package dumb.deduction.pattern;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static dumb.deduction.pattern.Kinds.*;
import static org.junit.jupiter.api.Assertions.*;

class PriorityTest {

    @Test
    void comparesClasses() {
        assertEquals(Priority.HIGHER, Priority.of(MULT, SUM));
        assertEquals(Priority.LOWER, Priority.of(SUM, MULT));
        assertEquals(Priority.SAME, Priority.of(SUM, DIFFERENCE));
        assertEquals(Priority.SAME, Priority.of(PROP_LESS, PROP_EQUAL));
        assertEquals(Priority.HIGHER, Priority.of(PROP_EQUAL, PROP_AND));
        assertEquals(Priority.HIGHER, Priority.of(COMPOSITE_NUMBER, POINT));
        assertEquals(Priority.LOWER, Priority.of(PROP_IFF, PROP_OR));
    }

    @Test
    void unrankedKindsAreIncomparable() {
        assertEquals(Priority.INCOMPARABLE, Priority.of(SUM, CONSTANT));
        assertEquals(Priority.INCOMPARABLE, Priority.of(METAVAR, MULT));
        assertEquals(Priority.INCOMPARABLE, Priority.of(APPLICATION, NUMBER));
    }

    @Test
    void leftOperandMayHaveSamePriority() {
        assertTrue(Priority.canBeLeftChild(SUM, SUM));
        assertTrue(Priority.canBeLeftChild(SUM, MULT));
        assertFalse(Priority.canBeLeftChild(MULT, SUM));
        assertTrue(Priority.canBeLeftChild(MULT, METAVAR));
    }

    @Test
    void rightOperandMustBindTighter() {
        assertFalse(Priority.canBeRightChild(SUM, DIFFERENCE));
        assertFalse(Priority.canBeRightChild(MULT, SUM));
        assertTrue(Priority.canBeRightChild(SUM, MULT));
        assertTrue(Priority.canBeRightChild(PROP_IMPLIES, PROP_AND));
        assertTrue(Priority.canBeRightChild(SUM, NUMBER));
    }

    @ParameterizedTest
    @ValueSource(strings = {SUM, MULT, PROP_EQUAL, PROP_AND, PROP_IMPLIES, POINT})
    void sameKindNestsOnTheLeftOnly(String kind) {
        assertEquals(Priority.SAME, Priority.of(kind, kind));
        assertTrue(Priority.canBeLeftChild(kind, kind));
        assertFalse(Priority.canBeRightChild(kind, kind));
    }
}
