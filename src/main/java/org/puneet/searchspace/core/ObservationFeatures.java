package org.puneet.searchspace.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Parameterization of one observed point, as exchanged with the modeling layer.
 *
 * <p>When a hierarchical search space casts features to its tree shape it keeps the
 * pre-cast parameterization in {@link #getFullParameterization()}, so that
 * flattening can restore values removed by the cast.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class ObservationFeatures {

    private Map<String, Object> parameters;
    private final Integer trialIndex;
    private final Map<String, Object> fullParameterization;

    public ObservationFeatures(Map<String, ?> parameters) {
        this(parameters, null, null);
    }

    /**
     * @param parameters parameter name to value
     * @param trialIndex index of the trial the observation belongs to, may be null
     * @param fullParameterization parameterization before hierarchical casting, may be null
     * @throws IllegalArgumentException if the parameterization is null
     */
    public ObservationFeatures(Map<String, ?> parameters, Integer trialIndex,
                               Map<String, ?> fullParameterization) {
        if (parameters == null) {
            throw new IllegalArgumentException("Observation feature parameters must not be null");
        }
        this.parameters = new LinkedHashMap<>(parameters);
        this.trialIndex = trialIndex;
        this.fullParameterization = fullParameterization == null
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(fullParameterization));
    }

    /**
     * Mutable parameterization of this observation.
     *
     * @return the live parameter mapping
     */
    public Map<String, Object> getParameters() {
        return parameters;
    }

    public void setParameters(Map<String, ?> parameters) {
        if (parameters == null) {
            throw new IllegalArgumentException("Observation feature parameters must not be null");
        }
        this.parameters = new LinkedHashMap<>(parameters);
    }

    public Integer getTrialIndex() {
        return trialIndex;
    }

    /**
     * Parameterization recorded before hierarchical casting.
     *
     * @return the unmodifiable full parameterization, or null if none was recorded
     */
    public Map<String, Object> getFullParameterization() {
        return fullParameterization;
    }

    public boolean hasFullParameterization() {
        return fullParameterization != null;
    }

    /**
     * Copy of these features with a different parameterization and the same trial
     * index and full parameterization.
     *
     * @param replacement the new parameterization
     * @return new observation features
     */
    public ObservationFeatures withParameters(Map<String, ?> replacement) {
        return new ObservationFeatures(replacement, trialIndex, fullParameterization);
    }

    /**
     * Copy of these features recording the given full parameterization.
     *
     * @param full the parameterization to record
     * @return new observation features
     */
    public ObservationFeatures withFullParameterization(Map<String, ?> full) {
        return new ObservationFeatures(parameters, trialIndex, full);
    }

    public ObservationFeatures copy() {
        return new ObservationFeatures(parameters, trialIndex, fullParameterization);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ObservationFeatures that = (ObservationFeatures) o;
        return parameters.equals(that.parameters) &&
               Objects.equals(trialIndex, that.trialIndex) &&
               Objects.equals(fullParameterization, that.fullParameterization);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parameters, trialIndex, fullParameterization);
    }

    @Override
    public String toString() {
        return "ObservationFeatures(parameters=" + parameters
                + (trialIndex != null ? ", trial_index=" + trialIndex : "")
                + (fullParameterization != null ? ", full_parameterization=" + fullParameterization : "")
                + ")";
    }
}
