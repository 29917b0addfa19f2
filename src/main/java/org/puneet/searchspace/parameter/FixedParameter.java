package org.puneet.searchspace.parameter;

import org.apache.commons.math3.random.RandomGenerator;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parameter pinned to a single value. A fixed parameter may still be hierarchical,
 * in which case its dependents are always applicable.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class FixedParameter extends Parameter {

    private final Object value;

    public FixedParameter(String name, ParameterType parameterType, Object value) {
        this(name, parameterType, value, false, null, null);
    }

    public FixedParameter(String name, ParameterType parameterType, Object value,
                          Map<?, ? extends List<String>> dependents) {
        this(name, parameterType, value, false, null, dependents);
    }

    /**
     * Creates a fixed parameter with all options.
     *
     * @param name the parameter name
     * @param parameterType the value type
     * @param value the single allowed value
     * @param fidelity whether the parameter is a fidelity parameter
     * @param targetValue target fidelity value, may be null
     * @param dependents dependents keyed by the fixed value, may be null
     * @throws IllegalArgumentException if the definition is invalid
     */
    public FixedParameter(String name, ParameterType parameterType, Object value,
                          boolean fidelity, Object targetValue,
                          Map<?, ? extends List<String>> dependents) {
        super(name, parameterType, fidelity, targetValue, dependents);
        if (!isValidType(value)) {
            throw new IllegalArgumentException(String.format(
                "Value %s of fixed parameter %s is not of type %s", value, name, parameterType));
        }
        this.value = cast(value);
        requireDependentKeysInDomain();
    }

    @Override
    public ParameterKind getKind() {
        return ParameterKind.FIXED;
    }

    @Override
    public boolean validate(Object candidate) {
        if (!isValidType(candidate)) {
            return false;
        }
        return Objects.equals(cast(candidate), value);
    }

    @Override
    public Object midpoint() {
        return value;
    }

    @Override
    public Object sample(RandomGenerator rng) {
        return value;
    }

    @Override
    public FixedParameter copy() {
        return new FixedParameter(getName(), getParameterType(), value, isFidelity(),
                getTargetValue(), getDependents());
    }

    @Override
    public String domainRepr() {
        return "value=" + value;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        FixedParameter that = (FixedParameter) o;
        return Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), value);
    }
}
