package org.puneet.searchspace.unit;

import org.junit.jupiter.api.Test;
import org.puneet.searchspace.core.RobustSearchSpace;
import org.puneet.searchspace.core.SearchSpace;
import org.puneet.searchspace.digest.RobustSearchSpaceDigest;
import org.puneet.searchspace.digest.SearchSpaceDigest;
import org.puneet.searchspace.digest.SearchSpaceDigestExtractor;
import org.puneet.searchspace.distribution.ParameterDistribution;
import org.puneet.searchspace.exceptions.SearchSpaceOperationException;
import org.puneet.searchspace.exceptions.SearchSpaceOperationException.ErrorCode;
import org.puneet.searchspace.parameter.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.List;
import java.util.Map;

class SearchSpaceDigestExtractorTest {

    private static SearchSpace mixedSpace() throws Exception {
        return new SearchSpace(List.of(
                new RangeParameter("x", ParameterType.FLOAT, 0.0, 1.0),
                new RangeParameter("n", ParameterType.INT, 1, 3),
                new ChoiceParameter("k", ParameterType.INT, List.of(1, 2, 4)),
                new ChoiceParameter("cat", ParameterType.FLOAT, List.of(0.0, 1.0, 2.0), false,
                        false, false, null, null),
                new ChoiceParameter("task", ParameterType.INT, List.of(0, 1), null, true, false, 0, null),
                new RangeParameter("fid", ParameterType.FLOAT, 0.0, 1.0, false, false, null, true, 1.0)));
    }

    private static RobustSearchSpace robustSpace(boolean multiplicative) throws Exception {
        RangeParameter x = new RangeParameter("x", ParameterType.FLOAT, 0.0, 1.0);
        RangeParameter y = new RangeParameter("y", ParameterType.FLOAT, 0.0, 1.0);
        RangeParameter temperature = new RangeParameter("T", ParameterType.FLOAT, 0.0, 10.0);
        ParameterDistribution noise = new ParameterDistribution(List.of("x"), ParameterDistribution.NORMAL,
                Map.of("loc", multiplicative ? 1.0 : 0.0, "scale", 0.1), multiplicative);
        ParameterDistribution environment = new ParameterDistribution(List.of("T"),
                ParameterDistribution.UNIFORM, Map.of("loc", 2.0, "scale", 1.0), false);
        return new RobustSearchSpace(List.of(x, y), List.of(noise, environment), 8, List.of(temperature), null);
    }

    @Test
    void testDigestOfMixedSpace() throws Exception {
        SearchSpaceDigest digest = SearchSpaceDigestExtractor.extract(mixedSpace());
        assertEquals(List.of("x", "n", "k", "cat", "task", "fid"), digest.getFeatureNames());
        assertArrayEquals(new double[]{0.0, 1.0}, digest.getBounds(0));
        assertArrayEquals(new double[]{1.0, 3.0}, digest.getBounds(1));
        assertArrayEquals(new double[]{1.0, 4.0}, digest.getBounds(2));
        assertArrayEquals(new double[]{0.0, 2.0}, digest.getBounds(3));
        assertEquals(List.of(1, 2), digest.getOrdinalFeatures());
        assertEquals(List.of(3), digest.getCategoricalFeatures());
        assertEquals(List.of(4), digest.getTaskFeatures());
        assertEquals(List.of(5), digest.getFidelityFeatures());
        assertEquals(List.of(1, 2, 3), digest.getDiscreteChoices().get(1));
        assertEquals(List.of(1, 2, 4), digest.getDiscreteChoices().get(2));
        assertEquals(List.of(0.0, 1.0, 2.0), digest.getDiscreteChoices().get(3));
        assertFalse(digest.getDiscreteChoices().containsKey(0));
        assertEquals(Map.of(4, 0, 5, 1.0), digest.getTargetValues());
        assertNull(digest.getRobustDigest());
    }

    @Test
    void testDigestOfSelectedParameters() throws Exception {
        SearchSpaceDigest digest = SearchSpaceDigestExtractor.extractSearchSpaceDigest(mixedSpace(),
                List.of("fid", "x"));
        assertEquals(List.of("fid", "x"), digest.getFeatureNames());
        assertEquals(List.of(0), digest.getFidelityFeatures());
    }

    @Test
    void testIntRangeEndingAtIntMaximum() throws Exception {
        SearchSpace space = new SearchSpace(List.of(
                new RangeParameter("n", ParameterType.INT, Integer.MAX_VALUE - 2, Integer.MAX_VALUE)));
        SearchSpaceDigest digest = SearchSpaceDigestExtractor.extract(space);
        assertEquals(List.of(Integer.MAX_VALUE - 2, Integer.MAX_VALUE - 1, Integer.MAX_VALUE),
                digest.getDiscreteChoices().get(0));
    }

    @Test
    void testUnsupportedParameters() throws Exception {
        SearchSpace space = new SearchSpace(List.of(
                new RangeParameter("lr", ParameterType.FLOAT, 0.001, 0.1, true, false, null, false, null),
                new FixedParameter("f", ParameterType.FLOAT, 1.0),
                new ChoiceParameter("s", ParameterType.STRING, List.of("a", "b"))));
        for (String name : List.of("lr", "f", "s", "ghost")) {
            SearchSpaceOperationException ex = assertThrows(SearchSpaceOperationException.class,
                    () -> SearchSpaceDigestExtractor.extractSearchSpaceDigest(space, List.of(name)));
            assertEquals(ErrorCode.UNSUPPORTED_DIGEST, ex.getErrorCode());
        }
    }

    @Test
    void testRobustDigestWithAdditivePerturbations() throws Exception {
        SearchSpaceDigest digest = SearchSpaceDigestExtractor.extract(robustSpace(false));
        RobustSearchSpaceDigest robust = digest.getRobustDigest();
        assertNotNull(robust);
        assertEquals(List.of("T"), robust.getEnvironmentalVariables());
        assertFalse(robust.isMultiplicative());

        double[][] perturbations = robust.getSampleParamPerturbations().get();
        assertEquals(8, perturbations.length);
        assertEquals(2, perturbations[0].length);
        for (double[] row : perturbations) {
            assertEquals(0.0, row[1]);
        }

        double[][] environmental = robust.getSampleEnvironmental().get();
        assertEquals(8, environmental.length);
        assertEquals(1, environmental[0].length);
        for (double[] row : environmental) {
            assertTrue(row[0] >= 2.0 && row[0] <= 3.0);
        }
    }

    @Test
    void testRobustDigestWithMultiplicativePerturbations() throws Exception {
        RobustSearchSpaceDigest robust = SearchSpaceDigestExtractor.extract(robustSpace(true)).getRobustDigest();
        assertTrue(robust.isMultiplicative());
        for (double[] row : robust.getSampleParamPerturbations().get()) {
            assertEquals(1.0, row[1]);
        }
    }

    @Test
    void testRobustDigestRequiresTrailingEnvironmentalVariables() throws Exception {
        RobustSearchSpace space = robustSpace(false);
        assertThrows(SearchSpaceOperationException.class,
                () -> SearchSpaceDigestExtractor.extractRobustDigest(space, List.of("T", "x", "y")));
        assertThrows(SearchSpaceOperationException.class,
                () -> SearchSpaceDigestExtractor.extractRobustDigest(space, List.of("y", "T")));
        assertNull(SearchSpaceDigestExtractor.extractRobustDigest(mixedSpace(), List.of("x")));
    }

    @Test
    void testRobustDigestNeedsASampler() {
        assertThrows(IllegalArgumentException.class,
                () -> new RobustSearchSpaceDigest(null, null, List.of(), false));
        RobustSearchSpaceDigest digest = new RobustSearchSpaceDigest(() -> new double[1][1], null, null, true);
        assertTrue(digest.getEnvironmentalVariables().isEmpty());
        assertNull(digest.getSampleEnvironmental());
    }

    @Test
    void testDigestIsImmutable() throws Exception {
        SearchSpaceDigest digest = SearchSpaceDigestExtractor.extract(mixedSpace());
        digest.getBounds().get(0)[1] = 42.0;
        assertEquals(1.0, digest.getBounds(0)[1]);
        assertThrows(UnsupportedOperationException.class, () -> digest.getFeatureNames().add("z"));
        assertThrows(UnsupportedOperationException.class, () -> digest.getOrdinalFeatures().add(9));
        assertThrows(IllegalArgumentException.class,
                () -> new SearchSpaceDigest(List.of("a", "b"), List.of(new double[]{0.0, 1.0})));
    }
}
