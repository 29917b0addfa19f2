package org.puneet.searchspace.constraint;

import org.puneet.searchspace.parameter.Parameter;

import java.util.*;
import java.util.function.Function;

/**
 * Constraint on the plain sum of numeric parameters, either
 * {@code sum <= bound} or {@code sum >= bound}.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class SumConstraint extends ParameterConstraint {

    private final List<Parameter> parameters;
    private final boolean upperBound;
    private final double sumBound;

    /**
     * @param parameters the summed parameters, numeric and distinct
     * @param upperBound true for {@code sum <= bound}, false for {@code sum >= bound}
     * @param bound the bound on the sum
     * @throws IllegalArgumentException if a parameter is non-numeric or repeated
     */
    public SumConstraint(List<Parameter> parameters, boolean upperBound, double bound) {
        super(coefficients(parameters, upperBound), upperBound ? bound : -bound);
        this.parameters = new ArrayList<>(parameters);
        this.upperBound = upperBound;
        this.sumBound = bound;
    }

    private static Map<String, Double> coefficients(List<Parameter> parameters, boolean upperBound) {
        if (parameters == null || parameters.isEmpty()) {
            throw new IllegalArgumentException("Sum constraint requires at least one parameter");
        }
        Map<String, Double> dict = new LinkedHashMap<>();
        double weight = upperBound ? 1.0 : -1.0;
        for (Parameter parameter : parameters) {
            if (!parameter.isNumeric()) {
                throw new IllegalArgumentException(
                    "Sum constraints only apply to numeric parameters, got " + parameter.getName());
            }
            if (dict.put(parameter.getName(), weight) != null) {
                throw new IllegalArgumentException(
                    "Parameter " + parameter.getName() + " appears more than once in sum constraint");
            }
        }
        return dict;
    }

    @Override
    public List<Parameter> getParameters() {
        return Collections.unmodifiableList(parameters);
    }

    @Override
    public boolean isParameterBound() {
        return true;
    }

    @Override
    public void rebindParameters(Function<String, Parameter> lookup) {
        for (int i = 0; i < parameters.size(); i++) {
            parameters.set(i, lookup.apply(parameters.get(i).getName()));
        }
    }

    public boolean isUpperBound() {
        return upperBound;
    }

    /**
     * The bound on the plain sum, before the sign flip applied to lower bounds.
     *
     * @return the user-facing bound
     */
    public double getSumBound() {
        return sumBound;
    }

    @Override
    public SumConstraint copy() {
        List<Parameter> copies = new ArrayList<>();
        for (Parameter parameter : parameters) {
            copies.add(parameter.copy());
        }
        return new SumConstraint(copies, upperBound, sumBound);
    }

    @Override
    public String toString() {
        StringJoiner names = new StringJoiner(" + ");
        for (Parameter parameter : parameters) {
            names.add(parameter.getName());
        }
        return "SumConstraint(" + names + (upperBound ? " <= " : " >= ") + sumBound + ")";
    }
}
