package org.puneet.searchspace.unit;

import org.apache.commons.math3.random.RandomGenerator;
import org.junit.jupiter.api.Test;
import org.puneet.searchspace.constraint.ParameterConstraint;
import org.puneet.searchspace.util.SearchSpaceConfig;
import static org.junit.jupiter.api.Assertions.*;
import java.util.Map;

class SearchSpaceConfigTest {

    @Test
    void testValuesFromTestProperties() {
        assertEquals(42L, SearchSpaceConfig.getRandomSeed());
        assertEquals(1e-8, SearchSpaceConfig.getConstraintTolerance());
        assertTrue(SearchSpaceConfig.isNamesOnlyInErrors());
    }

    @Test
    void testRandomGeneratorIsReproducible() {
        RandomGenerator first = SearchSpaceConfig.newRandomGenerator();
        RandomGenerator second = SearchSpaceConfig.newRandomGenerator();
        for (int i = 0; i < 5; i++) {
            assertEquals(first.nextDouble(), second.nextDouble());
        }
    }

    @Test
    void testConstraintToleranceAppliedToChecks() {
        ParameterConstraint constraint = new ParameterConstraint(Map.of("x", 1.0, "y", 1.0), 1.0);
        assertTrue(constraint.check(Map.of("x", 0.5, "y", 0.5 + 5e-9)));
        assertFalse(constraint.check(Map.of("x", 0.5, "y", 0.5 + 1e-6)));
        assertEquals(SearchSpaceConfig.getConstraintTolerance(), SearchSpaceConfig.getConstraintTolerance());
    }
}
