package org.puneet.searchspace.digest;

import org.apache.commons.math3.random.RandomGenerator;
import org.puneet.searchspace.core.RobustSearchSpace;
import org.puneet.searchspace.core.SearchSpace;
import org.puneet.searchspace.distribution.ParameterDistribution;
import org.puneet.searchspace.exceptions.SearchSpaceOperationException;
import org.puneet.searchspace.exceptions.ValidationException;
import org.puneet.searchspace.parameter.ChoiceParameter;
import org.puneet.searchspace.parameter.Parameter;
import org.puneet.searchspace.parameter.ParameterType;
import org.puneet.searchspace.parameter.RangeParameter;
import org.puneet.searchspace.util.SearchSpaceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Supplier;

/**
 * Builds {@link SearchSpaceDigest}s from search spaces. Extraction is a read-only
 * projection: the space is expected to be all-numeric already (choice parameters with
 * numeric values, range parameters on a linear scale), and parameters that cannot be
 * represented are rejected rather than transformed.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class SearchSpaceDigestExtractor {

    private static final Logger logger = LoggerFactory.getLogger(SearchSpaceDigestExtractor.class);

    private SearchSpaceDigestExtractor() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Digest of the whole space, with features in the space's parameter order.
     *
     * @param searchSpace the space to project
     * @return the digest, including the robust digest for robust spaces
     * @throws SearchSpaceOperationException if a parameter cannot be represented
     */
    public static SearchSpaceDigest extract(SearchSpace searchSpace) throws SearchSpaceOperationException {
        return extractSearchSpaceDigest(searchSpace, new ArrayList<>(searchSpace.getParameters().keySet()));
    }

    /**
     * Digest of the named parameters, in the given order.
     *
     * <p>Choice parameters become task, ordinal or categorical features with their
     * values as discrete choices and bounds spanning them. Range parameters contribute
     * their bounds; integer ranges are also ordinal with every integer in range as a
     * discrete choice. Fidelity parameters, and task parameters with a target value,
     * record that target value.</p>
     *
     * @param searchSpace the space to project
     * @param parameterNames the features, in digest order
     * @return the digest
     * @throws SearchSpaceOperationException if a parameter is unknown, fixed, a log-scale
     *         range, or a choice with non-numeric values
     */
    public static SearchSpaceDigest extractSearchSpaceDigest(SearchSpace searchSpace, List<String> parameterNames)
            throws SearchSpaceOperationException {
        List<double[]> bounds = new ArrayList<>();
        List<Integer> ordinal = new ArrayList<>();
        List<Integer> categorical = new ArrayList<>();
        Map<Integer, List<Number>> discreteChoices = new LinkedHashMap<>();
        List<Integer> task = new ArrayList<>();
        List<Integer> fidelity = new ArrayList<>();
        Map<Integer, Object> targetValues = new LinkedHashMap<>();

        for (int i = 0; i < parameterNames.size(); i++) {
            Parameter parameter = lookup(searchSpace, parameterNames.get(i));
            switch (parameter.getKind()) {
                case CHOICE: {
                    ChoiceParameter choice = (ChoiceParameter) parameter;
                    List<Number> values = numericValues(choice);
                    if (choice.isTask()) {
                        task.add(i);
                        if (choice.getTargetValue() != null) {
                            targetValues.put(i, choice.getTargetValue());
                        }
                    } else if (choice.isOrdered()) {
                        ordinal.add(i);
                    } else {
                        categorical.add(i);
                    }
                    discreteChoices.put(i, values);
                    double lower = Double.POSITIVE_INFINITY;
                    double upper = Double.NEGATIVE_INFINITY;
                    for (Number value : values) {
                        lower = Math.min(lower, value.doubleValue());
                        upper = Math.max(upper, value.doubleValue());
                    }
                    bounds.add(new double[]{lower, upper});
                    break;
                }
                case RANGE: {
                    RangeParameter range = (RangeParameter) parameter;
                    if (range.isLogScale()) {
                        throw SearchSpaceOperationException.unsupportedDigest(range.toString(),
                                "log-scale parameters must be transformed before extracting a digest");
                    }
                    if (range.getParameterType() == ParameterType.INT) {
                        ordinal.add(i);
                        List<Number> choices = new ArrayList<>();
                        for (long v = (long) range.getLower(); v <= (long) range.getUpper(); v++) {
                            choices.add((int) v);
                        }
                        discreteChoices.put(i, choices);
                    }
                    bounds.add(new double[]{range.getLower(), range.getUpper()});
                    break;
                }
                default:
                    throw SearchSpaceOperationException.unsupportedDigest(parameter.toString(),
                            "fixed parameters must be removed before extracting a digest");
            }
            if (parameter.isFidelity()) {
                fidelity.add(i);
                targetValues.put(i, parameter.getTargetValue());
            }
        }

        RobustSearchSpaceDigest robustDigest = extractRobustDigest(searchSpace, parameterNames);
        logger.debug("Extracted digest of {} features ({} ordinal, {} categorical, {} task, {} fidelity)",
                parameterNames.size(), ordinal.size(), categorical.size(), task.size(), fidelity.size());
        return new SearchSpaceDigest(parameterNames, bounds, ordinal, categorical, discreteChoices,
                task, fidelity, targetValues, robustDigest);
    }

    /**
     * Robust part of the digest. Environmental variables must be the trailing features;
     * the perturbation sampler returns one column per non-environmental feature,
     * filled with ones for multiplicative and zeros for additive perturbations wherever
     * no distribution applies.
     *
     * @param searchSpace the space to project
     * @param parameterNames the features, in digest order
     * @return the robust digest, or null if the space is not robust
     * @throws SearchSpaceOperationException if a distributional parameter is not among
     *         the features, or environmental variables are not the trailing features
     */
    public static RobustSearchSpaceDigest extractRobustDigest(SearchSpace searchSpace, List<String> parameterNames)
            throws SearchSpaceOperationException {
        if (!searchSpace.isRobust()) {
            return null;
        }
        RobustSearchSpace robust = (RobustSearchSpace) searchSpace;
        for (String name : robust.getDistributionalParameters()) {
            if (!parameterNames.contains(name)) {
                throw SearchSpaceOperationException.unsupportedDigest(name,
                        "all distributional parameters must be included in the digest features");
            }
        }

        int numSamples = robust.getNumSamples();
        int numEnvironmental = robust.getEnvironmentalVariables().size();
        int numNonEnvironmental = parameterNames.size() - numEnvironmental;
        List<String> environmentalNames = new ArrayList<>(
                parameterNames.subList(Math.max(numNonEnvironmental, 0), parameterNames.size()));

        Supplier<double[][]> sampleEnvironmental = null;
        if (numEnvironmental > 0) {
            if (numNonEnvironmental < 0
                    || !new HashSet<>(environmentalNames).equals(robust.getEnvironmentalVariables().keySet())) {
                throw SearchSpaceOperationException.unsupportedDigest(environmentalNames.toString(),
                        "environmental variables must be the last entries of the digest features");
            }
            sampleEnvironmental = sampler(robust.getEnvironmentalDistributions(), environmentalNames,
                    numSamples, 0.0);
        }

        Supplier<double[][]> sampleParamPerturbations = null;
        if (!robust.getPerturbationDistributions().isEmpty()) {
            List<String> perturbedNames = parameterNames.subList(0, numNonEnvironmental);
            sampleParamPerturbations = sampler(robust.getPerturbationDistributions(), perturbedNames,
                    numSamples, robust.isMultiplicative() ? 1.0 : 0.0);
        }

        return new RobustSearchSpaceDigest(sampleParamPerturbations, sampleEnvironmental,
                environmentalNames, robust.isMultiplicative());
    }

    private static Supplier<double[][]> sampler(List<ParameterDistribution> distributions,
                                                 List<String> columns, int numSamples, double fill) {
        List<String> columnNames = new ArrayList<>(columns);
        RandomGenerator rng = SearchSpaceConfig.newRandomGenerator();
        return () -> {
            double[][] samples = new double[numSamples][columnNames.size()];
            for (double[] row : samples) {
                Arrays.fill(row, fill);
            }
            for (ParameterDistribution distribution : distributions) {
                double[][] drawn = distribution.sample(numSamples, rng);
                List<String> covered = distribution.getParameters();
                for (int j = 0; j < covered.size(); j++) {
                    int column = columnNames.indexOf(covered.get(j));
                    for (int row = 0; row < numSamples; row++) {
                        samples[row][column] = drawn[row][j];
                    }
                }
            }
            return samples;
        };
    }

    private static Parameter lookup(SearchSpace searchSpace, String name) throws SearchSpaceOperationException {
        try {
            return searchSpace.getParameter(name);
        } catch (ValidationException e) {
            throw new SearchSpaceOperationException(SearchSpaceOperationException.ErrorCode.UNSUPPORTED_DIGEST,
                    e.getMessage(), name, e);
        }
    }

    private static List<Number> numericValues(ChoiceParameter choice) throws SearchSpaceOperationException {
        List<Number> values = new ArrayList<>();
        for (Object value : choice.getValues()) {
            if (!(value instanceof Number)) {
                throw SearchSpaceOperationException.unsupportedDigest(choice.toString(),
                        "choice values must be numeric; encode non-numeric choices before extracting a digest");
            }
            values.add((Number) value);
        }
        return values;
    }
}
