package org.puneet.searchspace.digest;

import java.util.*;

/**
 * Lightweight, array-oriented snapshot of a search space for model fitting. The
 * position of a name in {@link #getFeatureNames()} is the index used by every other
 * field. Instances are immutable and hold no reference to the source space.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class SearchSpaceDigest {

    private final List<String> featureNames;
    private final List<double[]> bounds;
    private final List<Integer> ordinalFeatures;
    private final List<Integer> categoricalFeatures;
    private final Map<Integer, List<Number>> discreteChoices;
    private final List<Integer> taskFeatures;
    private final List<Integer> fidelityFeatures;
    private final Map<Integer, Object> targetValues;
    private final RobustSearchSpaceDigest robustDigest;

    public SearchSpaceDigest(List<String> featureNames, List<double[]> bounds) {
        this(featureNames, bounds, null, null, null, null, null, null, null);
    }

    /**
     * Creates a digest. Null collections are treated as empty.
     *
     * @param featureNames feature names, defining the index of each feature
     * @param bounds inclusive {@code {lower, upper}} pair per feature
     * @param ordinalFeatures indices of ordinal discrete features
     * @param categoricalFeatures indices of categorical discrete features
     * @param discreteChoices allowed values per discrete feature index
     * @param taskFeatures indices of task features
     * @param fidelityFeatures indices of fidelity features
     * @param targetValues target value per fidelity or task feature index
     * @param robustDigest robust properties, may be null
     * @throws IllegalArgumentException if bounds and feature names differ in length
     */
    public SearchSpaceDigest(List<String> featureNames, List<double[]> bounds,
                             List<Integer> ordinalFeatures, List<Integer> categoricalFeatures,
                             Map<Integer, List<Number>> discreteChoices,
                             List<Integer> taskFeatures, List<Integer> fidelityFeatures,
                             Map<Integer, Object> targetValues, RobustSearchSpaceDigest robustDigest) {
        if (featureNames == null || bounds == null || featureNames.size() != bounds.size()) {
            throw new IllegalArgumentException("Every feature needs exactly one pair of bounds");
        }
        List<double[]> boundsCopy = new ArrayList<>();
        for (double[] pair : bounds) {
            if (pair == null || pair.length != 2) {
                throw new IllegalArgumentException("Bounds must be {lower, upper} pairs");
            }
            boundsCopy.add(pair.clone());
        }
        Map<Integer, List<Number>> choicesCopy = new TreeMap<>();
        if (discreteChoices != null) {
            for (Map.Entry<Integer, List<Number>> entry : discreteChoices.entrySet()) {
                choicesCopy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
            }
        }
        this.featureNames = Collections.unmodifiableList(new ArrayList<>(featureNames));
        this.bounds = Collections.unmodifiableList(boundsCopy);
        this.ordinalFeatures = unmodifiable(ordinalFeatures);
        this.categoricalFeatures = unmodifiable(categoricalFeatures);
        this.discreteChoices = Collections.unmodifiableMap(choicesCopy);
        this.taskFeatures = unmodifiable(taskFeatures);
        this.fidelityFeatures = unmodifiable(fidelityFeatures);
        this.targetValues = targetValues == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(targetValues));
        this.robustDigest = robustDigest;
    }

    private static List<Integer> unmodifiable(List<Integer> indices) {
        return indices == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(indices));
    }

    public List<String> getFeatureNames() {
        return featureNames;
    }

    /**
     * Inclusive bounds per feature index. The returned arrays are copies.
     *
     * @return {@code {lower, upper}} pairs in feature order
     */
    public List<double[]> getBounds() {
        List<double[]> copies = new ArrayList<>();
        for (double[] pair : bounds) {
            copies.add(pair.clone());
        }
        return copies;
    }

    public double[] getBounds(int featureIndex) {
        return bounds.get(featureIndex).clone();
    }

    public List<Integer> getOrdinalFeatures() {
        return ordinalFeatures;
    }

    public List<Integer> getCategoricalFeatures() {
        return categoricalFeatures;
    }

    public Map<Integer, List<Number>> getDiscreteChoices() {
        return discreteChoices;
    }

    public List<Integer> getTaskFeatures() {
        return taskFeatures;
    }

    public List<Integer> getFidelityFeatures() {
        return fidelityFeatures;
    }

    public Map<Integer, Object> getTargetValues() {
        return targetValues;
    }

    public RobustSearchSpaceDigest getRobustDigest() {
        return robustDigest;
    }

    public boolean hasRobustDigest() {
        return robustDigest != null;
    }

    @Override
    public String toString() {
        StringJoiner boundsText = new StringJoiner(", ", "[", "]");
        for (double[] pair : bounds) {
            boundsText.add(Arrays.toString(pair));
        }
        return "SearchSpaceDigest(feature_names=" + featureNames
                + ", bounds=" + boundsText
                + ", ordinal_features=" + ordinalFeatures
                + ", categorical_features=" + categoricalFeatures
                + ", discrete_choices=" + discreteChoices
                + ", task_features=" + taskFeatures
                + ", fidelity_features=" + fidelityFeatures
                + ", target_values=" + targetValues
                + ", robust_digest=" + robustDigest + ")";
    }
}
