package org.puneet.searchspace.unit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.puneet.searchspace.core.RobustSearchSpace;
import org.puneet.searchspace.distribution.ParameterDistribution;
import org.puneet.searchspace.exceptions.SearchSpaceOperationException;
import org.puneet.searchspace.exceptions.SearchSpaceOperationException.ErrorCode;
import org.puneet.searchspace.exceptions.ValidationException;
import org.puneet.searchspace.exceptions.ValidationException.ValidationType;
import org.puneet.searchspace.parameter.ChoiceParameter;
import org.puneet.searchspace.parameter.ParameterType;
import org.puneet.searchspace.parameter.RangeParameter;
import static org.junit.jupiter.api.Assertions.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

class RobustSearchSpaceTest {

    private RangeParameter x;
    private RangeParameter y;
    private RangeParameter temperature;

    @BeforeEach
    void setUp() {
        x = new RangeParameter("x", ParameterType.FLOAT, 0.0, 1.0);
        y = new RangeParameter("y", ParameterType.FLOAT, 0.0, 1.0);
        temperature = new RangeParameter("T", ParameterType.FLOAT, 0.0, 10.0);
    }

    private static ParameterDistribution normal(boolean multiplicative, String... names) {
        return new ParameterDistribution(List.of(names), ParameterDistribution.NORMAL,
                Map.of("loc", multiplicative ? 1.0 : 0.0, "scale", 0.1), multiplicative);
    }

    @Test
    void testEnvironmentalVariableScenario() throws Exception {
        RobustSearchSpace space = new RobustSearchSpace(List.of(x),
                List.of(normal(false, "T"), normal(false, "x")), 8, List.of(temperature), null);
        assertTrue(space.isEnvironmentalVariable("T"));
        assertFalse(space.isEnvironmentalVariable("x"));
        assertTrue(space.isRobust());
        assertFalse(space.isMultiplicative());
        assertEquals(8, space.getNumSamples());
        assertEquals(1, space.getEnvironmentalDistributions().size());
        assertEquals(1, space.getPerturbationDistributions().size());
        assertEquals(List.of("x", "T"), new ArrayList<>(space.getParameters().keySet()));
        assertEquals(List.of("T", "x"), new ArrayList<>(space.getDistributionalParameters()));
    }

    @Test
    void testMembershipIncludesEnvironmentalVariables() throws Exception {
        RobustSearchSpace space = new RobustSearchSpace(List.of(x),
                List.of(normal(false, "T")), 4, List.of(temperature), null);
        assertTrue(space.checkMembership(Map.of("x", 0.5, "T", 5.0)));
        assertFalse(space.checkMembership(Map.of("x", 0.5)));
    }

    @Test
    void testPolarity() throws Exception {
        RobustSearchSpace multiplicative = new RobustSearchSpace(List.of(x, y),
                List.of(normal(true, "x"), normal(true, "y")), 4);
        assertTrue(multiplicative.isMultiplicative());

        RobustSearchSpace additive = new RobustSearchSpace(List.of(x, y),
                List.of(normal(false, "x"), normal(false, "y")), 4);
        assertFalse(additive.isMultiplicative());

        SearchSpaceOperationException mixed = assertThrows(SearchSpaceOperationException.class,
                () -> new RobustSearchSpace(List.of(x, y), List.of(normal(false, "x"), normal(true, "y")), 4));
        assertEquals(ErrorCode.MIXED_POLARITY, mixed.getErrorCode());
    }

    @Test
    void testArgumentChecks() {
        ValidationException noDistributions = assertThrows(ValidationException.class,
                () -> new RobustSearchSpace(List.of(x), List.of(), 4));
        assertEquals(ValidationType.DISTRIBUTION_VALIDATION, noDistributions.getValidationType());

        ValidationException samples = assertThrows(ValidationException.class,
                () -> new RobustSearchSpace(List.of(x), List.of(normal(false, "x")), 0));
        assertEquals(ValidationType.DEFINITION_VALIDATION, samples.getValidationType());

        assertThrows(ValidationException.class, () -> new RobustSearchSpace(List.of(x),
                List.of(normal(false, "T")), 4, List.of(temperature, temperature.copy()), null));

        RangeParameter clash = new RangeParameter("x", ParameterType.FLOAT, 0.0, 1.0);
        ValidationException repeated = assertThrows(ValidationException.class, () -> new RobustSearchSpace(
                List.of(x), List.of(normal(false, "x")), 4, List.of(clash), null));
        assertTrue(repeated.getMessage().contains("should not be repeated"));
    }

    @Test
    void testDistributionAssignmentRules() {
        ValidationException twice = assertThrows(ValidationException.class,
                () -> new RobustSearchSpace(List.of(x, y), List.of(normal(false, "x", "y"), normal(false, "y")), 4));
        assertEquals(ValidationType.DISTRIBUTION_VALIDATION, twice.getValidationType());

        ValidationException uncovered = assertThrows(ValidationException.class, () -> new RobustSearchSpace(
                List.of(x), List.of(normal(false, "x")), 4, List.of(temperature), null));
        assertTrue(uncovered.getMessage().contains("must have a distribution"));

        SearchSpaceOperationException mixed = assertThrows(SearchSpaceOperationException.class,
                () -> new RobustSearchSpace(List.of(x), List.of(normal(false, "x", "T")), 4,
                        List.of(temperature), null));
        assertEquals(ErrorCode.MIXED_DISTRIBUTION, mixed.getErrorCode());

        ValidationException multiplicativeEnv = assertThrows(ValidationException.class,
                () -> new RobustSearchSpace(List.of(x), List.of(normal(true, "T")), 4, List.of(temperature), null));
        assertTrue(multiplicativeEnv.getMessage().contains("multiplicative=false"));

        ChoiceParameter choice = new ChoiceParameter("c", ParameterType.FLOAT, List.of(0.0, 1.0));
        ValidationException nonRange = assertThrows(ValidationException.class,
                () -> new RobustSearchSpace(List.of(choice), List.of(normal(false, "c")), 4));
        assertTrue(nonRange.getMessage().contains("range parameters"));

        assertThrows(ValidationException.class,
                () -> new RobustSearchSpace(List.of(x), List.of(normal(false, "ghost")), 4));
    }

    @Test
    void testUpdateParameterIsUnsupported() throws Exception {
        RobustSearchSpace space = new RobustSearchSpace(List.of(x), List.of(normal(false, "x")), 4);
        SearchSpaceOperationException ex = assertThrows(SearchSpaceOperationException.class,
                () -> space.updateParameter(new RangeParameter("x", ParameterType.FLOAT, 0.0, 2.0)));
        assertEquals(ErrorCode.IMMUTABLE_PARAMETERS, ex.getErrorCode());
        assertTrue(ex.getMessage().contains("RobustSearchSpace does not support `updateParameter`."));
    }

    @Test
    void testCopy() throws Exception {
        RobustSearchSpace space = new RobustSearchSpace(List.of(x),
                List.of(normal(false, "T"), normal(true, "x")), 6, List.of(temperature), null);
        RobustSearchSpace copy = space.copy();
        assertEquals(space, copy);
        assertNotSame(space.getEnvironmentalVariables().get("T"), copy.getEnvironmentalVariables().get("T"));
        assertNotSame(space.getParameterDistributions().get(0), copy.getParameterDistributions().get(0));
        assertTrue(copy.isMultiplicative());
        assertTrue(copy.toString().contains("environmental_variables="));
    }
}
