package org.puneet.searchspace.parameter;

import org.apache.commons.math3.random.RandomGenerator;

import java.util.*;

/**
 * Base class of all parameter kinds. A parameter has a name that is unique within
 * a search space, a declared value type and a domain; choice and fixed parameters
 * may additionally be hierarchical, naming per value the parameters that become
 * relevant when that value is taken.
 *
 * <p>Parameters are value objects: two parameters are equal when all of their
 * fields are equal. Search spaces own their parameter instances; constraints are
 * rebound to those instances when registered.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public abstract class Parameter {

    private final String name;
    private final ParameterType parameterType;
    private final boolean fidelity;
    private final Object targetValue;
    private final Map<Object, List<String>> dependents;

    /**
     * Creates the shared part of a parameter.
     *
     * @param name the parameter name
     * @param parameterType the declared value type
     * @param fidelity whether the parameter is a fidelity parameter
     * @param targetValue target value for fidelity or task parameters, may be null
     * @param dependents value to dependent parameter names, may be null
     * @throws IllegalArgumentException if the name is blank, the type is missing, or a
     *         fidelity parameter lacks a target value
     */
    protected Parameter(String name, ParameterType parameterType, boolean fidelity,
                        Object targetValue, Map<?, ? extends List<String>> dependents) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Parameter name must be a non-empty string");
        }
        if (parameterType == null) {
            throw new IllegalArgumentException("Parameter type is required for parameter " + name);
        }
        if (fidelity && targetValue == null) {
            throw new IllegalArgumentException(
                "Target value is required for fidelity parameter " + name);
        }
        this.name = name;
        this.parameterType = parameterType;
        this.fidelity = fidelity;
        this.targetValue = castValue(parameterType, targetValue);

        Map<Object, List<String>> deps = new LinkedHashMap<>();
        if (dependents != null) {
            for (Map.Entry<?, ? extends List<String>> entry : dependents.entrySet()) {
                if (entry.getValue() == null) {
                    throw new IllegalArgumentException(
                        "Dependents of value " + entry.getKey() + " of parameter " + name + " must not be null");
                }
                if (entry.getValue().contains(name)) {
                    throw new IllegalArgumentException("Parameter " + name + " cannot depend on itself");
                }
                deps.put(castValue(parameterType, entry.getKey()),
                         Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
            }
        }
        this.dependents = Collections.unmodifiableMap(deps);
    }

    /**
     * Kind tag of this parameter.
     *
     * @return the domain kind
     */
    public abstract ParameterKind getKind();

    /**
     * Whether the given value has a valid type and lies in this parameter's domain.
     *
     * @param value the value to check, may be null
     * @return true if the value belongs to the domain
     */
    public abstract boolean validate(Object value);

    /**
     * Deterministic representative of the domain, used to complete partial
     * parameterizations.
     *
     * @return a value of this parameter's Java type
     */
    public abstract Object midpoint();

    /**
     * Random value drawn uniformly from the domain.
     *
     * @param rng the random generator to draw from
     * @return a value of this parameter's Java type
     */
    public abstract Object sample(RandomGenerator rng);

    /**
     * Deep copy of this parameter.
     *
     * @return an equal, independent instance
     */
    public abstract Parameter copy();

    /**
     * Short rendering of the domain, e.g. {@code range=[0.0, 1.0]}.
     *
     * @return the domain rendering
     */
    public abstract String domainRepr();

    /**
     * Whether the value's runtime type is acceptable for this parameter. FLOAT
     * parameters accept any number, INT parameters accept integral numbers.
     *
     * @param value the value to check
     * @return true if the value could be cast without losing information
     */
    public boolean isValidType(Object value) {
        if (value == null) {
            return false;
        }
        return switch (parameterType) {
            case INT -> isIntegral(value);
            case FLOAT -> value instanceof Number;
            case STRING -> value instanceof String;
            case BOOL -> value instanceof Boolean;
        };
    }

    /**
     * Casts the value to this parameter's canonical Java type.
     *
     * @param value the value to cast, may be null
     * @return the cast value, or null if the value is null
     * @throws IllegalArgumentException if the value cannot be converted
     */
    public Object cast(Object value) {
        return castValue(parameterType, value);
    }

    public String getName() {
        return name;
    }

    public ParameterType getParameterType() {
        return parameterType;
    }

    public Class<?> getJavaType() {
        return parameterType.getJavaType();
    }

    public boolean isNumeric() {
        return parameterType.isNumeric();
    }

    public boolean isFidelity() {
        return fidelity;
    }

    public Object getTargetValue() {
        return targetValue;
    }

    public boolean isHierarchical() {
        return !dependents.isEmpty();
    }

    /**
     * Mapping from parameter value to the names of the parameters that become
     * applicable when this parameter takes that value.
     *
     * @return an unmodifiable, possibly empty mapping
     */
    public Map<Object, List<String>> getDependents() {
        return dependents;
    }

    /**
     * Flags rendered in summaries.
     *
     * @return flag names, in display order
     */
    public List<String> getFlags() {
        List<String> flags = new ArrayList<>();
        if (fidelity) {
            flags.add("fidelity");
        }
        if (isHierarchical()) {
            flags.add("hierarchical");
        }
        return flags;
    }

    /**
     * One summary row describing this parameter. Keys without a value are omitted.
     *
     * @return ordered column values keyed by summary field
     */
    public Map<String, Object> summary() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("name", name);
        row.put("type", getKind().name().charAt(0) + getKind().name().substring(1).toLowerCase());
        row.put("domain", domainRepr());
        row.put("parameter_type", parameterType.name().toLowerCase());
        List<String> flags = getFlags();
        if (!flags.isEmpty()) {
            row.put("flags", String.join(", ", flags));
        }
        if (targetValue != null) {
            row.put("target_value", targetValue);
        }
        if (isHierarchical()) {
            row.put("dependents", dependents);
        }
        return row;
    }

    /**
     * Checks that every dependents key is a member of the domain. Subclasses call
     * this once their domain fields are set.
     *
     * @throws IllegalArgumentException if a key is outside the domain
     */
    protected void requireDependentKeysInDomain() {
        for (Object key : dependents.keySet()) {
            if (!validate(key)) {
                throw new IllegalArgumentException(String.format(
                    "Dependents of parameter %s reference value %s, which is not in its domain %s",
                    name, key, domainRepr()));
            }
        }
    }

    /**
     * Checks that the target value, when present, lies in the domain.
     *
     * @throws IllegalArgumentException if the target value is outside the domain
     */
    protected void requireTargetValueInDomain() {
        if (targetValue != null && !validate(targetValue)) {
            throw new IllegalArgumentException(String.format(
                "Target value %s of parameter %s is not in its domain %s", targetValue, name, domainRepr()));
        }
    }

    /**
     * Converts a value to the canonical Java type of the given parameter type.
     * Integer conversion truncates toward zero.
     *
     * @param type the target type
     * @param value the value to convert, may be null
     * @return the converted value, or null
     * @throws IllegalArgumentException if the value cannot be converted
     */
    protected static Object castValue(ParameterType type, Object value) {
        if (value == null) {
            return null;
        }
        try {
            return switch (type) {
                case INT -> {
                    if (value instanceof Integer) {
                        yield value;
                    }
                    if (value instanceof Number) {
                        yield toInt(value, ((Number) value).doubleValue());
                    }
                    if (value instanceof Boolean) {
                        yield ((Boolean) value) ? 1 : 0;
                    }
                    yield toInt(value, Double.parseDouble(value.toString().trim()));
                }
                case FLOAT -> {
                    if (value instanceof Number) {
                        yield ((Number) value).doubleValue();
                    }
                    if (value instanceof Boolean) {
                        yield ((Boolean) value) ? 1.0 : 0.0;
                    }
                    yield Double.parseDouble(value.toString().trim());
                }
                case STRING -> value.toString();
                case BOOL -> {
                    if (value instanceof Boolean) {
                        yield value;
                    }
                    if (value instanceof Number) {
                        yield ((Number) value).doubleValue() != 0.0;
                    }
                    String text = value.toString().trim();
                    if (text.equalsIgnoreCase("true")) {
                        yield Boolean.TRUE;
                    }
                    if (text.equalsIgnoreCase("false")) {
                        yield Boolean.FALSE;
                    }
                    throw new IllegalArgumentException("Not a boolean: " + value);
                }
            };
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                "Cannot cast " + value + " to " + type.name().toLowerCase(), e);
        }
    }

    private static int toInt(Object original, double value) {
        double truncated = value < 0 ? Math.ceil(value) : Math.floor(value);
        if (Double.isNaN(value) || truncated < Integer.MIN_VALUE || truncated > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Cannot cast " + original + " to int: out of range");
        }
        return (int) truncated;
    }

    protected static String formatNumber(ParameterType type, double value) {
        if (type == ParameterType.INT) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    private static boolean isIntegral(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return true;
        }
        if (value instanceof Long) {
            long l = (Long) value;
            return l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return d == Math.rint(d) && d >= Integer.MIN_VALUE && d <= Integer.MAX_VALUE;
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Parameter that = (Parameter) o;
        return fidelity == that.fidelity &&
               name.equals(that.name) &&
               parameterType == that.parameterType &&
               Objects.equals(targetValue, that.targetValue) &&
               dependents.equals(that.dependents);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, parameterType, fidelity, targetValue, dependents);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getSimpleName())
          .append("(name='").append(name).append("'")
          .append(", parameter_type=").append(parameterType)
          .append(", ").append(domainRepr());
        for (String flag : getFlags()) {
            if (!flag.equals("hierarchical")) {
                sb.append(", ").append(flag).append("=True");
            }
        }
        if (targetValue != null) {
            sb.append(", target_value=").append(targetValue);
        }
        if (isHierarchical()) {
            sb.append(", dependents=").append(dependents);
        }
        sb.append(")");
        return sb.toString();
    }
}
