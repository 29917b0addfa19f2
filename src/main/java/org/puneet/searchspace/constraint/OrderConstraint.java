package org.puneet.searchspace.constraint;

import org.puneet.searchspace.parameter.Parameter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Constraint {@code lower <= upper} between two numeric parameters.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class OrderConstraint extends ParameterConstraint {

    private Parameter lowerParameter;
    private Parameter upperParameter;

    /**
     * @param lowerParameter parameter that must not exceed the other
     * @param upperParameter parameter that must not fall below the other
     * @throws IllegalArgumentException if either parameter is non-numeric or both are the same
     */
    public OrderConstraint(Parameter lowerParameter, Parameter upperParameter) {
        super(coefficients(lowerParameter, upperParameter), 0.0);
        this.lowerParameter = lowerParameter;
        this.upperParameter = upperParameter;
    }

    private static Map<String, Double> coefficients(Parameter lower, Parameter upper) {
        if (lower == null || upper == null) {
            throw new IllegalArgumentException("Order constraint requires two parameters");
        }
        if (!lower.isNumeric() || !upper.isNumeric()) {
            throw new IllegalArgumentException(String.format(
                "Order constraints only apply to numeric parameters, got %s and %s",
                lower.getName(), upper.getName()));
        }
        if (lower.getName().equals(upper.getName())) {
            throw new IllegalArgumentException(
                "Order constraint must reference two distinct parameters, got " + lower.getName() + " twice");
        }
        Map<String, Double> dict = new LinkedHashMap<>();
        dict.put(lower.getName(), 1.0);
        dict.put(upper.getName(), -1.0);
        return dict;
    }

    public Parameter getLowerParameter() {
        return lowerParameter;
    }

    public Parameter getUpperParameter() {
        return upperParameter;
    }

    @Override
    public List<Parameter> getParameters() {
        return List.of(lowerParameter, upperParameter);
    }

    @Override
    public boolean isParameterBound() {
        return true;
    }

    @Override
    public void rebindParameters(Function<String, Parameter> lookup) {
        lowerParameter = lookup.apply(lowerParameter.getName());
        upperParameter = lookup.apply(upperParameter.getName());
    }

    @Override
    public OrderConstraint copy() {
        return new OrderConstraint(lowerParameter.copy(), upperParameter.copy());
    }

    @Override
    public String toString() {
        return "OrderConstraint(" + lowerParameter.getName() + " <= " + upperParameter.getName() + ")";
    }
}
