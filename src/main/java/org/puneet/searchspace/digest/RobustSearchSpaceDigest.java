package org.puneet.searchspace.digest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/**
 * Properties specific to robust search spaces, attached to a {@link SearchSpaceDigest}.
 *
 * <p>Each sampler takes no input and returns a {@code numSamples x d} matrix, where
 * {@code d} is the number of non-environmental features for the perturbation sampler
 * and the number of environmental variables for the environmental sampler.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class RobustSearchSpaceDigest {

    private final Supplier<double[][]> sampleParamPerturbations;
    private final Supplier<double[][]> sampleEnvironmental;
    private final List<String> environmentalVariables;
    private final boolean multiplicative;

    /**
     * @param sampleParamPerturbations sampler of input perturbations, may be null
     * @param sampleEnvironmental sampler of environmental variables, may be null
     * @param environmentalVariables environmental variable names, in feature order
     * @param multiplicative whether perturbations multiply parameter values
     * @throws IllegalArgumentException if both samplers are null
     */
    public RobustSearchSpaceDigest(Supplier<double[][]> sampleParamPerturbations,
                                   Supplier<double[][]> sampleEnvironmental,
                                   List<String> environmentalVariables,
                                   boolean multiplicative) {
        if (sampleParamPerturbations == null && sampleEnvironmental == null) {
            throw new IllegalArgumentException("RobustSearchSpaceDigest must be initialized with at least "
                    + "one of the perturbation sampler and the environmental sampler");
        }
        this.sampleParamPerturbations = sampleParamPerturbations;
        this.sampleEnvironmental = sampleEnvironmental;
        this.environmentalVariables = environmentalVariables == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(environmentalVariables));
        this.multiplicative = multiplicative;
    }

    public Supplier<double[][]> getSampleParamPerturbations() {
        return sampleParamPerturbations;
    }

    public Supplier<double[][]> getSampleEnvironmental() {
        return sampleEnvironmental;
    }

    public List<String> getEnvironmentalVariables() {
        return environmentalVariables;
    }

    public boolean isMultiplicative() {
        return multiplicative;
    }

    @Override
    public String toString() {
        return "RobustSearchSpaceDigest(perturbations=" + (sampleParamPerturbations != null)
                + ", environmental=" + (sampleEnvironmental != null)
                + ", environmental_variables=" + environmentalVariables
                + ", multiplicative=" + multiplicative + ")";
    }
}
