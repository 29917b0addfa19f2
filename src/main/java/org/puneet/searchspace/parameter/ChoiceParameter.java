package org.puneet.searchspace.parameter;

import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Parameter taking one of a finite, ordered list of values. Choice parameters may be
 * ordinal or categorical, may mark a task dimension, and may be hierarchical.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class ChoiceParameter extends Parameter {

    private static final Logger logger = LoggerFactory.getLogger(ChoiceParameter.class);

    private final List<Object> values;
    private final boolean ordered;
    private final boolean task;

    /**
     * Creates a non-hierarchical choice parameter whose ordering is inferred.
     *
     * @param name the parameter name
     * @param parameterType the value type
     * @param values the allowed values, at least two distinct ones
     * @throws IllegalArgumentException if the definition is invalid
     */
    public ChoiceParameter(String name, ParameterType parameterType, List<?> values) {
        this(name, parameterType, values, null, false, false, null, null);
    }

    /**
     * Creates a possibly hierarchical choice parameter whose ordering is inferred.
     *
     * @param name the parameter name
     * @param parameterType the value type
     * @param values the allowed values, at least two distinct ones
     * @param dependents value to dependent parameter names, may be null
     * @throws IllegalArgumentException if the definition is invalid
     */
    public ChoiceParameter(String name, ParameterType parameterType, List<?> values,
                           Map<?, ? extends List<String>> dependents) {
        this(name, parameterType, values, null, false, false, null, dependents);
    }

    /**
     * Creates a choice parameter with all options.
     *
     * @param name the parameter name
     * @param parameterType the value type
     * @param values the allowed values, at least two distinct ones
     * @param ordered whether values are ordinal; null infers it (numeric, boolean or
     *                two-valued parameters are ordered)
     * @param task whether the parameter indexes tasks
     * @param fidelity whether the parameter is a fidelity parameter
     * @param targetValue target value for task or fidelity parameters, may be null
     * @param dependents value to dependent parameter names, may be null
     * @throws IllegalArgumentException if the definition is invalid
     */
    public ChoiceParameter(String name, ParameterType parameterType, List<?> values, Boolean ordered,
                           boolean task, boolean fidelity, Object targetValue,
                           Map<?, ? extends List<String>> dependents) {
        super(name, parameterType, fidelity, targetValue, dependents);

        if (values == null) {
            throw new IllegalArgumentException("Values of choice parameter " + name + " must not be null");
        }
        List<Object> distinct = new ArrayList<>();
        for (Object value : values) {
            if (!isValidType(value)) {
                throw new IllegalArgumentException(String.format(
                    "Value %s of choice parameter %s is not of type %s", value, name, parameterType));
            }
            Object cast = cast(value);
            if (distinct.contains(cast)) {
                logger.warn("Duplicate value {} of choice parameter {} removed", cast, name);
                continue;
            }
            distinct.add(cast);
        }
        if (distinct.size() < 2) {
            throw new IllegalArgumentException(
                "Choice parameter " + name + " requires at least two distinct values; "
                    + "use a FixedParameter for a single value");
        }

        this.values = Collections.unmodifiableList(distinct);
        this.ordered = ordered != null ? ordered
                : parameterType.isNumeric() || parameterType == ParameterType.BOOL || distinct.size() == 2;
        this.task = task;

        requireTargetValueInDomain();
        requireDependentKeysInDomain();
    }

    @Override
    public ParameterKind getKind() {
        return ParameterKind.CHOICE;
    }

    @Override
    public boolean validate(Object value) {
        if (!isValidType(value)) {
            return false;
        }
        return values.contains(cast(value));
    }

    /**
     * Element in the middle of the declared value order.
     */
    @Override
    public Object midpoint() {
        return values.get(values.size() / 2);
    }

    @Override
    public Object sample(RandomGenerator rng) {
        return values.get(rng.nextInt(values.size()));
    }

    @Override
    public ChoiceParameter copy() {
        return new ChoiceParameter(getName(), getParameterType(), values, ordered, task,
                isFidelity(), getTargetValue(), getDependents());
    }

    @Override
    public String domainRepr() {
        return "values=" + values;
    }

    @Override
    public List<String> getFlags() {
        List<String> flags = super.getFlags();
        if (ordered) {
            flags.add(0, "ordered");
        }
        if (task) {
            flags.add(0, "task");
        }
        return flags;
    }

    /**
     * Allowed values in declared order.
     *
     * @return an unmodifiable list of values of this parameter's Java type
     */
    public List<Object> getValues() {
        return values;
    }

    public boolean isOrdered() {
        return ordered;
    }

    public boolean isTask() {
        return task;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        ChoiceParameter that = (ChoiceParameter) o;
        return ordered == that.ordered &&
               task == that.task &&
               values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), values, ordered, task);
    }
}
