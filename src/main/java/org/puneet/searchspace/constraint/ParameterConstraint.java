package org.puneet.searchspace.constraint;

import org.puneet.searchspace.parameter.Parameter;
import org.puneet.searchspace.util.SearchSpaceConfig;

import java.util.*;
import java.util.function.Function;

/**
 * Linear constraint {@code sum(coefficient_i * x_i) <= bound} over numeric parameters,
 * identified by name.
 *
 * <p>Subclasses that hold {@link Parameter} objects rather than names
 * ({@link OrderConstraint}, {@link SumConstraint}) are rebound by the owning search
 * space so that they always reference the space's own instances.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class ParameterConstraint {

    private final Map<String, Double> constraintDict;
    private final double bound;

    /**
     * Creates a generic linear constraint.
     *
     * @param constraintDict parameter name to coefficient
     * @param bound upper bound of the weighted sum
     * @throws IllegalArgumentException if no coefficient is given or the bound is not finite
     */
    public ParameterConstraint(Map<String, Double> constraintDict, double bound) {
        if (constraintDict == null || constraintDict.isEmpty()) {
            throw new IllegalArgumentException("A parameter constraint needs at least one coefficient");
        }
        if (!Double.isFinite(bound)) {
            throw new IllegalArgumentException("Constraint bound must be finite, got: " + bound);
        }
        for (Map.Entry<String, Double> entry : constraintDict.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null || !Double.isFinite(entry.getValue())) {
                throw new IllegalArgumentException("Invalid constraint coefficient: " + entry);
            }
        }
        this.constraintDict = Collections.unmodifiableMap(new LinkedHashMap<>(constraintDict));
        this.bound = bound;
    }

    /**
     * Whether the numeric values satisfy this constraint. The constraint only binds
     * when every parameter it references is present; otherwise it is vacuously
     * satisfied.
     *
     * @param numericValues parameter name to numeric value
     * @return true if the weighted sum does not exceed the bound
     */
    public boolean check(Map<String, Double> numericValues) {
        double weightedSum = 0.0;
        for (Map.Entry<String, Double> entry : constraintDict.entrySet()) {
            Double value = numericValues.get(entry.getKey());
            if (value == null) {
                return true;
            }
            weightedSum += entry.getValue() * value;
        }
        return weightedSum <= bound + SearchSpaceConfig.getConstraintTolerance();
    }

    /**
     * Coefficients by parameter name.
     *
     * @return an unmodifiable, insertion-ordered mapping
     */
    public Map<String, Double> getConstraintDict() {
        return constraintDict;
    }

    public double getBound() {
        return bound;
    }

    public Set<String> getParameterNames() {
        return constraintDict.keySet();
    }

    /**
     * Parameter objects this constraint holds. Name-based constraints hold none.
     *
     * @return the bound parameter objects, empty for generic constraints
     */
    public List<Parameter> getParameters() {
        return Collections.emptyList();
    }

    /**
     * Whether this constraint holds parameter objects that must agree with the
     * owning search space.
     *
     * @return true for order and sum constraints
     */
    public boolean isParameterBound() {
        return false;
    }

    /**
     * Replaces held parameter objects with the instances returned by the lookup.
     *
     * @param lookup parameter name to the owning search space's instance
     */
    public void rebindParameters(Function<String, Parameter> lookup) {
        // nothing to rebind
    }

    /**
     * Deep copy of this constraint.
     *
     * @return an equal, independent instance
     */
    public ParameterConstraint copy() {
        return new ParameterConstraint(constraintDict, bound);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParameterConstraint that = (ParameterConstraint) o;
        return Double.compare(that.bound, bound) == 0 &&
               constraintDict.equals(that.constraintDict);
    }

    @Override
    public int hashCode() {
        return Objects.hash(constraintDict, bound);
    }

    @Override
    public String toString() {
        StringJoiner terms = new StringJoiner(" + ");
        for (Map.Entry<String, Double> entry : constraintDict.entrySet()) {
            terms.add(entry.getValue() + "*" + entry.getKey());
        }
        return "ParameterConstraint(" + terms + " <= " + bound + ")";
    }
}
