package org.puneet.searchspace.unit;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Test;
import org.puneet.searchspace.parameter.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.List;
import java.util.Map;

class ParameterTest {

    @Test
    void testRangeValidateAndTypes() {
        RangeParameter x = new RangeParameter("x", ParameterType.FLOAT, 0.0, 1.0);
        assertEquals(ParameterKind.RANGE, x.getKind());
        assertTrue(x.validate(0.5));
        assertTrue(x.validate(1));
        assertFalse(x.validate(1.5));
        assertFalse(x.validate("0.5"));
        assertFalse(x.validate(null));
        assertTrue(x.isNumeric());
        assertEquals(Double.class, x.getJavaType());
    }

    @Test
    void testIntRangeTypeChecks() {
        RangeParameter n = new RangeParameter("n", ParameterType.INT, 0, 10);
        assertTrue(n.isValidType(3));
        assertTrue(n.isValidType(3L));
        assertTrue(n.isValidType(3.0));
        assertFalse(n.isValidType(3.5));
        assertFalse(n.isValidType("3"));
        assertEquals(Integer.class, n.getJavaType());
    }

    @Test
    void testIntCastTruncatesTowardZero() {
        RangeParameter n = new RangeParameter("n", ParameterType.INT, -10, 10);
        assertEquals(-2, n.cast(-2.7));
        assertEquals(2, n.cast(2.7));
        assertEquals(4, n.cast(4));
        assertNull(n.cast(null));
    }

    @Test
    void testIntRangeMustFitInInt() {
        assertThrows(IllegalArgumentException.class,
                () -> new RangeParameter("n", ParameterType.INT, 0, 1e10));
        assertThrows(IllegalArgumentException.class,
                () -> new RangeParameter("n", ParameterType.INT, -1e10, 0));

        RangeParameter n = new RangeParameter("n", ParameterType.INT, 0, Integer.MAX_VALUE);
        assertEquals(1073741824, n.midpoint());
        assertTrue(n.validate(Integer.MAX_VALUE));
        assertFalse(n.isValidType(5_000_000_000L));
        assertFalse(n.isValidType(5e9));
        assertFalse(n.validate(5_000_000_000L));
        assertThrows(IllegalArgumentException.class, () -> n.cast(5_000_000_000L));
        RandomGenerator rng = new Well19937c(11L);
        for (int i = 0; i < 50; i++) {
            assertTrue(n.validate(n.sample(rng)));
        }
    }

    @Test
    void testRangeCastRoundsToDigits() {
        RangeParameter x = new RangeParameter("x", ParameterType.FLOAT, 0.0, 1.0,
                false, false, 2, false, null);
        assertEquals(0.12, (Double) x.cast(0.12345), 1e-12);
        assertEquals(1.0, x.cast(1));
    }

    @Test
    void testRangeMidpoints() {
        assertEquals(0.5, (Double) new RangeParameter("x", ParameterType.FLOAT, 0.0, 1.0).midpoint(), 1e-12);
        RangeParameter log = new RangeParameter("lr", ParameterType.FLOAT, 1.0, 100.0,
                true, false, null, false, null);
        assertEquals(10.0, (Double) log.midpoint(), 1e-9);
        RangeParameter logit = new RangeParameter("p", ParameterType.FLOAT, 0.2, 0.8,
                false, true, null, false, null);
        assertEquals(0.5, (Double) logit.midpoint(), 1e-9);
        assertEquals(5, new RangeParameter("n", ParameterType.INT, 0, 10).midpoint());
        assertEquals(3, new RangeParameter("m", ParameterType.INT, 1, 4).midpoint());
    }

    @Test
    void testRangeSampleStaysInDomain() {
        RandomGenerator rng = new Well19937c(7L);
        RangeParameter x = new RangeParameter("x", ParameterType.FLOAT, -1.0, 1.0);
        RangeParameter n = new RangeParameter("n", ParameterType.INT, 0, 3);
        for (int i = 0; i < 200; i++) {
            assertTrue(x.validate(x.sample(rng)));
            Object drawn = n.sample(rng);
            assertTrue(drawn instanceof Integer);
            assertTrue(n.validate(drawn));
        }
    }

    @Test
    void testInvalidRangeDefinitions() {
        assertThrows(IllegalArgumentException.class,
                () -> new RangeParameter("x", ParameterType.FLOAT, 1.0, 1.0));
        assertThrows(IllegalArgumentException.class,
                () -> new RangeParameter("x", ParameterType.STRING, 0.0, 1.0));
        assertThrows(IllegalArgumentException.class,
                () -> new RangeParameter("x", ParameterType.INT, 0.0, 1.5));
        assertThrows(IllegalArgumentException.class,
                () -> new RangeParameter("x", ParameterType.FLOAT, 0.0, 1.0, true, false, null, false, null));
        assertThrows(IllegalArgumentException.class,
                () -> new RangeParameter("x", ParameterType.FLOAT, 0.1, 0.9, true, true, null, false, null));
        assertThrows(IllegalArgumentException.class,
                () -> new RangeParameter("x", ParameterType.FLOAT, 0.0, 1.0, false, false, null, true, null));
        assertThrows(IllegalArgumentException.class,
                () -> new RangeParameter(" ", ParameterType.FLOAT, 0.0, 1.0));
    }

    @Test
    void testChoiceParameter() {
        ChoiceParameter c = new ChoiceParameter("c", ParameterType.STRING, List.of("a", "b", "c"));
        assertEquals(ParameterKind.CHOICE, c.getKind());
        assertFalse(c.isOrdered());
        assertTrue(c.validate("b"));
        assertFalse(c.validate("d"));
        assertFalse(c.validate(1));
        assertEquals("b", c.midpoint());
        assertFalse(c.isHierarchical());

        ChoiceParameter numeric = new ChoiceParameter("k", ParameterType.INT, List.of(1, 2, 3));
        assertTrue(numeric.isOrdered());
        assertTrue(numeric.validate(2.0));
        ChoiceParameter pair = new ChoiceParameter("p", ParameterType.STRING, List.of("on", "off"));
        assertTrue(pair.isOrdered());
    }

    @Test
    void testChoiceRemovesDuplicatesAndRequiresTwoValues() {
        ChoiceParameter c = new ChoiceParameter("c", ParameterType.STRING, List.of("a", "a", "b"));
        assertEquals(List.of("a", "b"), c.getValues());
        assertThrows(IllegalArgumentException.class,
                () -> new ChoiceParameter("c", ParameterType.STRING, List.of("a", "a")));
        assertThrows(IllegalArgumentException.class,
                () -> new ChoiceParameter("c", ParameterType.INT, List.of("a", "b")));
    }

    @Test
    void testChoiceSampleDrawsDeclaredValues() {
        ChoiceParameter c = new ChoiceParameter("c", ParameterType.STRING, List.of("a", "b", "c"));
        RandomGenerator rng = new Well19937c(3L);
        for (int i = 0; i < 50; i++) {
            assertTrue(c.getValues().contains(c.sample(rng)));
        }
    }

    @Test
    void testHierarchicalChoice() {
        ChoiceParameter model = new ChoiceParameter("model", ParameterType.STRING, List.of("A", "B"),
                Map.of("A", List.of("lr")));
        assertTrue(model.isHierarchical());
        assertEquals(List.of("lr"), model.getDependents().get("A"));
        assertTrue(model.getFlags().contains("hierarchical"));

        assertThrows(IllegalArgumentException.class, () -> new ChoiceParameter("model",
                ParameterType.STRING, List.of("A", "B"), Map.of("Z", List.of("lr"))));
        assertThrows(IllegalArgumentException.class, () -> new ChoiceParameter("model",
                ParameterType.STRING, List.of("A", "B"), Map.of("A", List.of("model"))));
    }

    @Test
    void testFixedParameter() {
        FixedParameter f = new FixedParameter("f", ParameterType.BOOL, true);
        assertEquals(ParameterKind.FIXED, f.getKind());
        assertTrue(f.validate(true));
        assertFalse(f.validate(false));
        assertEquals(Boolean.TRUE, f.midpoint());
        assertEquals(Boolean.TRUE, f.sample(new Well19937c(1L)));
        assertEquals("value=true", f.domainRepr());
        assertThrows(IllegalArgumentException.class, () -> new FixedParameter("f", ParameterType.INT, "x"));
    }

    @Test
    void testCopyAndEquality() {
        ChoiceParameter task = new ChoiceParameter("task", ParameterType.INT, List.of(0, 1), null,
                true, false, 0, null);
        ChoiceParameter copy = task.copy();
        assertNotSame(task, copy);
        assertEquals(task, copy);
        assertEquals(task.hashCode(), copy.hashCode());
        assertNotEquals(new RangeParameter("x", ParameterType.FLOAT, 0.0, 1.0),
                new RangeParameter("x", ParameterType.FLOAT, 0.0, 2.0));
    }

    @Test
    void testSummary() {
        Map<String, Object> summary = new RangeParameter("x", ParameterType.FLOAT, 0.0, 1.0).summary();
        assertEquals("x", summary.get("name"));
        assertEquals("Range", summary.get("type"));
        assertEquals("range=[0.0, 1.0]", summary.get("domain"));
        assertEquals("float", summary.get("parameter_type"));
        assertFalse(summary.containsKey("flags"));

        RangeParameter fidelity = new RangeParameter("fid", ParameterType.FLOAT, 0.0, 1.0,
                false, false, null, true, 1.0);
        Map<String, Object> fidelitySummary = fidelity.summary();
        assertEquals("fidelity", fidelitySummary.get("flags"));
        assertEquals(1.0, fidelitySummary.get("target_value"));
    }
}
