package org.puneet.searchspace.distribution;

import org.apache.commons.math3.distribution.LogNormalDistribution;
import org.apache.commons.math3.distribution.MultivariateNormalDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.RealDistribution;
import org.apache.commons.math3.distribution.UniformRealDistribution;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.util.*;

/**
 * Probability distribution over one or more parameters of a robust search space.
 * Describes either the distribution of environmental variables or the input noise
 * (perturbation) applied to ordinary parameters; {@code multiplicative} perturbations
 * scale the parameter value, additive ones are added to it.
 *
 * <p>Supported distribution classes and their arguments:</p>
 * <ul>
 *   <li>{@code normal}: {@code loc}, {@code scale}</li>
 *   <li>{@code uniform}: {@code loc}, {@code scale}, covering {@code [loc, loc + scale]}</li>
 *   <li>{@code lognormal}: {@code scale}, {@code shape}</li>
 *   <li>{@code multivariate_normal}: {@code mean} (list), {@code cov} (list of lists)</li>
 * </ul>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class ParameterDistribution {

    public static final String NORMAL = "normal";
    public static final String UNIFORM = "uniform";
    public static final String LOGNORMAL = "lognormal";
    public static final String MULTIVARIATE_NORMAL = "multivariate_normal";

    private final List<String> parameters;
    private final String distributionClass;
    private final Map<String, Object> distributionParameters;
    private final boolean multiplicative;

    /**
     * Creates a distribution and checks that it can be instantiated.
     *
     * @param parameters names of the parameters the distribution covers
     * @param distributionClass one of the supported class names
     * @param distributionParameters arguments of the distribution class
     * @param multiplicative whether samples multiply (true) or add to (false) parameter values
     * @throws IllegalArgumentException if the class is unknown or its arguments are invalid
     */
    public ParameterDistribution(List<String> parameters, String distributionClass,
                                 Map<String, ?> distributionParameters, boolean multiplicative) {
        if (parameters == null || parameters.isEmpty()) {
            throw new IllegalArgumentException("A parameter distribution must cover at least one parameter");
        }
        if (new HashSet<>(parameters).size() < parameters.size()) {
            throw new IllegalArgumentException("Parameters of a distribution must be unique, got: " + parameters);
        }
        if (distributionClass == null) {
            throw new IllegalArgumentException("Distribution class is required");
        }
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.distributionClass = distributionClass;
        this.distributionParameters = distributionParameters == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(distributionParameters));
        this.multiplicative = multiplicative;

        // fail fast on unusable definitions
        sample(1, new Well19937c(0L));
    }

    /**
     * Draws samples for all covered parameters.
     *
     * @param numSamples number of rows to draw
     * @param rng random generator backing the draw
     * @return a {@code numSamples x parameters.size()} matrix; column j belongs to
     *         {@code getParameters().get(j)}
     * @throws IllegalArgumentException if the distribution cannot be instantiated
     */
    public double[][] sample(int numSamples, RandomGenerator rng) {
        if (numSamples < 1) {
            throw new IllegalArgumentException("Number of samples must be positive, got: " + numSamples);
        }
        int dimension = parameters.size();
        double[][] samples = new double[numSamples][dimension];
        try {
            if (MULTIVARIATE_NORMAL.equals(distributionClass)) {
                MultivariateNormalDistribution mvn = multivariateNormal(rng);
                for (int i = 0; i < numSamples; i++) {
                    samples[i] = mvn.sample();
                }
                return samples;
            }
            RealDistribution univariate = univariate(rng);
            for (int i = 0; i < numSamples; i++) {
                for (int j = 0; j < dimension; j++) {
                    samples[i][j] = univariate.sample();
                }
            }
            return samples;
        } catch (MathIllegalArgumentException e) {
            throw new IllegalArgumentException(
                "Invalid arguments for " + distributionClass + " distribution: " + distributionParameters, e);
        }
    }

    private RealDistribution univariate(RandomGenerator rng) {
        switch (distributionClass) {
            case NORMAL:
                return new NormalDistribution(rng, number("loc"), number("scale"));
            case UNIFORM: {
                double loc = number("loc");
                return new UniformRealDistribution(rng, loc, loc + number("scale"));
            }
            case LOGNORMAL:
                return new LogNormalDistribution(rng, number("scale"), number("shape"));
            default:
                throw new IllegalArgumentException("Unsupported distribution class: " + distributionClass
                    + ". Supported: " + List.of(NORMAL, UNIFORM, LOGNORMAL, MULTIVARIATE_NORMAL));
        }
    }

    private MultivariateNormalDistribution multivariateNormal(RandomGenerator rng) {
        double[] mean = vector(distributionParameters.get("mean"), "mean");
        Object covObject = distributionParameters.get("cov");
        if (!(covObject instanceof List)) {
            throw new IllegalArgumentException("multivariate_normal requires `cov` as a list of lists");
        }
        List<?> rows = (List<?>) covObject;
        double[][] cov = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {
            cov[i] = vector(rows.get(i), "cov");
        }
        if (mean.length != parameters.size() || cov.length != parameters.size()) {
            throw new IllegalArgumentException(String.format(
                "multivariate_normal dimension %d does not match the %d covered parameters",
                mean.length, parameters.size()));
        }
        return new MultivariateNormalDistribution(rng, mean, cov);
    }

    private double number(String key) {
        Object value = distributionParameters.get(key);
        if (value == null) {
            throw new IllegalArgumentException(distributionClass + " distribution requires argument `"
                + key + "`, got: " + distributionParameters);
        }
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException("Distribution argument `" + key + "` must be numeric, got: " + value);
        }
        return ((Number) value).doubleValue();
    }

    private static double[] vector(Object value, String key) {
        if (!(value instanceof List)) {
            throw new IllegalArgumentException("Distribution argument `" + key + "` must be a list, got: " + value);
        }
        List<?> list = (List<?>) value;
        double[] result = new double[list.size()];
        for (int i = 0; i < list.size(); i++) {
            Object element = list.get(i);
            if (!(element instanceof Number)) {
                throw new IllegalArgumentException(
                    "Distribution argument `" + key + "` must contain numbers, got: " + element);
            }
            result[i] = ((Number) element).doubleValue();
        }
        return result;
    }

    public List<String> getParameters() {
        return parameters;
    }

    public String getDistributionClass() {
        return distributionClass;
    }

    public Map<String, Object> getDistributionParameters() {
        return distributionParameters;
    }

    public boolean isMultiplicative() {
        return multiplicative;
    }

    public ParameterDistribution copy() {
        return new ParameterDistribution(parameters, distributionClass, distributionParameters, multiplicative);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParameterDistribution that = (ParameterDistribution) o;
        return multiplicative == that.multiplicative &&
               parameters.equals(that.parameters) &&
               distributionClass.equals(that.distributionClass) &&
               distributionParameters.equals(that.distributionParameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parameters, distributionClass, distributionParameters, multiplicative);
    }

    @Override
    public String toString() {
        return String.format("ParameterDistribution(parameters=%s, distribution_class=%s, "
                + "distribution_parameters=%s, multiplicative=%s)",
                parameters, distributionClass, distributionParameters, multiplicative);
    }
}
