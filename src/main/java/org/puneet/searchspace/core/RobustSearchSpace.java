package org.puneet.searchspace.core;

import org.puneet.searchspace.constraint.ParameterConstraint;
import org.puneet.searchspace.distribution.ParameterDistribution;
import org.puneet.searchspace.exceptions.SearchSpaceOperationException;
import org.puneet.searchspace.exceptions.SearchSpaceOperationException.ErrorCode;
import org.puneet.searchspace.exceptions.ValidationException;
import org.puneet.searchspace.parameter.Parameter;
import org.puneet.searchspace.parameter.ParameterKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Search space for robust optimization. Besides ordinary parameters it declares
 * environmental variables, which are drawn from distributions rather than chosen,
 * and input noise distributions (perturbations) over ordinary parameters.
 *
 * <p>Distributions are bound at construction, so parameters cannot be redefined
 * afterwards.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class RobustSearchSpace extends SearchSpace {

    private static final Logger logger = LoggerFactory.getLogger(RobustSearchSpace.class);

    private final List<ParameterDistribution> parameterDistributions;
    private final int numSamples;
    private final Map<String, Parameter> environmentalVariables;
    private final Set<String> distributionalParameters;
    private final List<ParameterDistribution> environmentalDistributions;
    private final List<ParameterDistribution> perturbationDistributions;
    private final boolean multiplicative;

    public RobustSearchSpace(List<? extends Parameter> parameters,
                             List<ParameterDistribution> parameterDistributions,
                             int numSamples) throws ValidationException, SearchSpaceOperationException {
        this(parameters, parameterDistributions, numSamples, null, null);
    }

    /**
     * Creates a robust search space.
     *
     * @param parameters the ordinary parameters
     * @param parameterDistributions distributions over environmental variables or
     *        perturbations of ordinary parameters, at least one
     * @param numSamples number of samples drawn from the distributions, positive
     * @param environmentalVariables environmental variables, may be null
     * @param parameterConstraints constraints over the ordinary parameters, may be null
     * @throws ValidationException if the definition or the distribution assignment is invalid
     * @throws SearchSpaceOperationException if a distribution mixes environmental and
     *         ordinary parameters, or perturbation distributions mix polarities
     */
    public RobustSearchSpace(List<? extends Parameter> parameters,
                             List<ParameterDistribution> parameterDistributions,
                             int numSamples,
                             List<? extends Parameter> environmentalVariables,
                             List<? extends ParameterConstraint> parameterConstraints)
            throws ValidationException, SearchSpaceOperationException {
        super(checkArguments(parameters, parameterDistributions, numSamples, environmentalVariables),
                parameterConstraints);
        this.parameterDistributions = Collections.unmodifiableList(new ArrayList<>(parameterDistributions));
        this.numSamples = numSamples;
        Map<String, Parameter> envByName = new LinkedHashMap<>();
        if (environmentalVariables != null) {
            for (Parameter variable : environmentalVariables) {
                envByName.put(variable.getName(), variable);
            }
        }
        this.environmentalVariables = envByName;

        // distribution consistency
        Set<String> covered = new LinkedHashSet<>();
        for (ParameterDistribution distribution : this.parameterDistributions) {
            Set<String> duplicates = new LinkedHashSet<>(distribution.getParameters());
            duplicates.retainAll(covered);
            if (!duplicates.isEmpty()) {
                throw ValidationException.invalidDistribution(String.format(
                        "Received multiple parameter distributions for parameters %s. Make sure that "
                                + "there is at most one distribution specified for any given parameter "
                                + "or environmental variable.", duplicates));
            }
            covered.addAll(distribution.getParameters());
        }
        this.distributionalParameters = Collections.unmodifiableSet(covered);

        if (!covered.containsAll(envByName.keySet())) {
            throw ValidationException.invalidDistribution(
                    "All environmental variables must have a distribution specified.");
        }

        List<ParameterDistribution> environmental = new ArrayList<>();
        List<ParameterDistribution> perturbation = new ArrayList<>();
        for (ParameterDistribution distribution : this.parameterDistributions) {
            int envCount = 0;
            for (String name : distribution.getParameters()) {
                if (envByName.containsKey(name)) {
                    envCount++;
                }
            }
            if (envCount > 0 && envCount < distribution.getParameters().size()) {
                throw new SearchSpaceOperationException(ErrorCode.MIXED_DISTRIBUTION, String.format(
                        "A ParameterDistribution must represent either the distribution of a set of "
                                + "environmental variables or a set of parameter perturbations. "
                                + "Offending distribution: %s.", distribution),
                        distribution.getParameters().toString());
            }
            if (envCount > 0) {
                environmental.add(distribution);
            } else {
                perturbation.add(distribution);
            }
        }
        for (ParameterDistribution distribution : environmental) {
            if (distribution.isMultiplicative()) {
                throw ValidationException.invalidDistribution(
                        "Distributions of environmental variables must have multiplicative=false.");
            }
        }
        this.environmentalDistributions = Collections.unmodifiableList(environmental);
        this.perturbationDistributions = Collections.unmodifiableList(perturbation);

        Map<String, Parameter> all = getParameters();
        for (String name : covered) {
            Parameter parameter = all.get(name);
            if (parameter == null) {
                throw ValidationException.invalidDistribution(String.format(
                        "Distribution covers `%s`, which is neither a parameter nor an "
                                + "environmental variable.", name));
            }
            if (parameter.getKind() != ParameterKind.RANGE) {
                throw ValidationException.invalidDistribution(String.format(
                        "All parameters with an associated distribution must be range parameters, "
                                + "got %s.", parameter));
            }
        }

        int multiplicativeCount = 0;
        for (ParameterDistribution distribution : perturbation) {
            if (distribution.isMultiplicative()) {
                multiplicativeCount++;
            }
        }
        if (multiplicativeCount > 0 && multiplicativeCount < perturbation.size()) {
            throw new SearchSpaceOperationException(ErrorCode.MIXED_POLARITY,
                    "Non-environmental parameter distributions must be either all multiplicative "
                            + "or all additive.", perturbation.toString());
        }
        this.multiplicative = multiplicativeCount > 0;

        logger.info("Created robust search space with {} parameters, {} environmental variables, "
                        + "{} distributions and {} samples",
                getOwnParameters().size(), envByName.size(), this.parameterDistributions.size(), numSamples);
    }

    private static List<? extends Parameter> checkArguments(List<? extends Parameter> parameters,
                                                            List<ParameterDistribution> distributions,
                                                            int numSamples,
                                                            List<? extends Parameter> environmentalVariables)
            throws ValidationException {
        if (distributions == null || distributions.isEmpty()) {
            throw ValidationException.invalidDistribution(
                    "RobustSearchSpace requires at least one distributional parameter. Use SearchSpace instead.");
        }
        if (numSamples < 1) {
            throw ValidationException.invalidDefinition(
                    "`numSamples` must be a positive integer, got: " + numSamples);
        }
        if (environmentalVariables != null) {
            Set<String> envNames = new HashSet<>();
            for (Parameter variable : environmentalVariables) {
                if (!envNames.add(variable.getName())) {
                    throw ValidationException.invalidDefinition("Environmental variable names must be unique!");
                }
            }
            if (parameters != null) {
                for (Parameter parameter : parameters) {
                    if (envNames.contains(parameter.getName())) {
                        throw ValidationException.invalidDefinition(String.format(
                                "Environmental variable %s should not be repeated in parameters.",
                                parameter.getName()));
                    }
                }
            }
        }
        return parameters;
    }

    @Override
    public boolean isRobust() {
        return true;
    }

    /**
     * Ordinary parameters followed by environmental variables.
     *
     * @return an unmodifiable view in declaration order
     */
    @Override
    public Map<String, Parameter> getParameters() {
        if (environmentalVariables == null || environmentalVariables.isEmpty()) {
            return getOwnParameters();
        }
        Map<String, Parameter> all = new LinkedHashMap<>(getOwnParameters());
        all.putAll(environmentalVariables);
        return Collections.unmodifiableMap(all);
    }

    /**
     * Always fails: distributions are bound to parameter definitions at construction.
     *
     * @param parameter the rejected definition
     * @throws SearchSpaceOperationException always
     */
    @Override
    public void updateParameter(Parameter parameter) throws SearchSpaceOperationException {
        throw SearchSpaceOperationException.unsupportedOperation(getClass().getSimpleName(), "updateParameter");
    }

    public boolean isEnvironmentalVariable(String parameterName) {
        return environmentalVariables.containsKey(parameterName);
    }

    public Map<String, Parameter> getEnvironmentalVariables() {
        return Collections.unmodifiableMap(environmentalVariables);
    }

    public List<ParameterDistribution> getParameterDistributions() {
        return parameterDistributions;
    }

    public List<ParameterDistribution> getEnvironmentalDistributions() {
        return environmentalDistributions;
    }

    public List<ParameterDistribution> getPerturbationDistributions() {
        return perturbationDistributions;
    }

    /**
     * Names of all parameters and environmental variables covered by a distribution.
     *
     * @return an unmodifiable set in distribution order
     */
    public Set<String> getDistributionalParameters() {
        return distributionalParameters;
    }

    public int getNumSamples() {
        return numSamples;
    }

    /**
     * Polarity shared by all perturbation distributions; false when there are none.
     *
     * @return whether perturbations multiply parameter values
     */
    public boolean isMultiplicative() {
        return multiplicative;
    }

    @Override
    public RobustSearchSpace copy() throws ValidationException {
        List<ParameterDistribution> distributions = new ArrayList<>();
        for (ParameterDistribution distribution : parameterDistributions) {
            distributions.add(distribution.copy());
        }
        try {
            return new RobustSearchSpace(copyParameters(getOwnParameters().values()), distributions,
                    numSamples, copyParameters(environmentalVariables.values()), copyConstraints());
        } catch (SearchSpaceOperationException e) {
            throw new IllegalStateException("Copy of a valid robust search space failed validation", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        RobustSearchSpace that = (RobustSearchSpace) o;
        return numSamples == that.numSamples &&
               parameterDistributions.equals(that.parameterDistributions) &&
               environmentalVariables.equals(that.environmentalVariables);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), parameterDistributions, numSamples);
    }

    @Override
    public String toString() {
        return "RobustSearchSpace(parameters=" + new ArrayList<>(getOwnParameters().values())
                + ", parameter_distributions=" + parameterDistributions
                + ", num_samples=" + numSamples
                + ", environmental_variables=" + new ArrayList<>(environmentalVariables.values())
                + ", parameter_constraints=" + getParameterConstraints() + ")";
    }
}
