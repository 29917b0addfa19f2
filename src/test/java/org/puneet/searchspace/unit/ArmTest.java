package org.puneet.searchspace.unit;

import org.junit.jupiter.api.Test;
import org.puneet.searchspace.core.Arm;
import org.puneet.searchspace.core.ObservationFeatures;
import static org.junit.jupiter.api.Assertions.*;
import java.util.HashMap;
import java.util.Map;

class ArmTest {

    @Test
    void testArmKeepsNullValues() {
        Map<String, Object> parameters = new HashMap<>();
        parameters.put("x", null);
        Arm arm = new Arm(parameters, "0_0");
        assertTrue(arm.getParameters().containsKey("x"));
        assertNull(arm.getParameters().get("x"));
        assertTrue(arm.hasName());
        assertFalse(new Arm(Map.of("x", 1.0)).hasName());
    }

    @Test
    void testArmIsImmutable() {
        Map<String, Object> parameters = new HashMap<>();
        parameters.put("x", 0.5);
        Arm arm = new Arm(parameters);
        parameters.put("x", 0.9);
        assertEquals(0.5, arm.getParameters().get("x"));
        assertThrows(UnsupportedOperationException.class, () -> arm.getParameters().put("y", 1.0));
        assertEquals(arm, arm.copy());
        assertThrows(IllegalArgumentException.class, () -> new Arm(null));
    }

    @Test
    void testObservationFeatures() {
        ObservationFeatures features = new ObservationFeatures(Map.of("x", 0.5), 3, Map.of("x", 0.5, "y", 1.0));
        assertEquals(3, features.getTrialIndex());
        assertTrue(features.hasFullParameterization());

        ObservationFeatures replaced = features.withParameters(Map.of("x", 0.1));
        assertEquals(0.1, replaced.getParameters().get("x"));
        assertEquals(features.getFullParameterization(), replaced.getFullParameterization());
        assertEquals(0.5, features.getParameters().get("x"));

        ObservationFeatures copy = features.copy();
        assertEquals(features, copy);
        copy.getParameters().put("y", 2.0);
        assertNotEquals(features, copy);

        ObservationFeatures recorded = new ObservationFeatures(Map.of("x", 0.5), 4, null)
                .withFullParameterization(Map.of("x", 0.5, "y", 1.0));
        assertEquals(4, recorded.getTrialIndex());
        assertEquals(Map.of("x", 0.5, "y", 1.0), recorded.getFullParameterization());

        assertFalse(new ObservationFeatures(Map.of()).hasFullParameterization());
        assertThrows(UnsupportedOperationException.class,
                () -> features.getFullParameterization().put("z", 0.0));
    }
}
