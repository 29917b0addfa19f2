package org.puneet.searchspace.core;

import org.puneet.searchspace.constraint.ParameterConstraint;
import org.puneet.searchspace.exceptions.SearchSpaceOperationException;
import org.puneet.searchspace.exceptions.ValidationException;
import org.puneet.searchspace.parameter.Parameter;
import org.puneet.searchspace.parameter.ParameterKind;
import org.puneet.searchspace.parameter.RangeParameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Declared domain of an experiment: a set of uniquely named parameters and the
 * linear constraints between them.
 *
 * <p>The search space is the sole owner of its parameter instances. Order and sum
 * constraints hold parameter objects, and are rebound to the space's instances
 * whenever they are registered.</p>
 *
 * <p>Membership checks come in two modes selected by a {@code raiseError} flag: the
 * boolean mode returns {@code false} on the first violation, the raising mode throws a
 * {@link ValidationException} describing it.</p>
 *
 * <p>Instances are not thread-safe. Read-only operations may run concurrently as long
 * as no mutation is in flight; callers needing concurrent access during mutation should
 * work on {@link #copy()} instances.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class SearchSpace {

    private static final Logger logger = LoggerFactory.getLogger(SearchSpace.class);

    /** Parameter summary keys mapped to the column names of {@link #summaryTable()}. */
    public static final Map<String, String> SUMMARY_COLUMNS;

    /** Cell value used for columns a parameter does not populate. */
    public static final String SUMMARY_MISSING_VALUE = "None";

    static {
        Map<String, String> columns = new LinkedHashMap<>();
        columns.put("name", "Name");
        columns.put("type", "Type");
        columns.put("domain", "Domain");
        columns.put("parameter_type", "Datatype");
        columns.put("flags", "Flags");
        columns.put("target_value", "Target Value");
        columns.put("dependents", "Dependent Parameters");
        SUMMARY_COLUMNS = Collections.unmodifiableMap(columns);
    }

    private final Map<String, Parameter> parameters;
    private List<ParameterConstraint> parameterConstraints;

    /**
     * Creates an unconstrained search space.
     *
     * @param parameters the parameters, with unique names
     * @throws ValidationException if parameter names are not unique
     */
    public SearchSpace(List<? extends Parameter> parameters) throws ValidationException {
        this(parameters, null);
    }

    /**
     * Creates a search space.
     *
     * @param parameters the parameters, with unique names
     * @param parameterConstraints constraints over the parameters, may be null
     * @throws ValidationException if parameter names are not unique or a constraint
     *         references an unknown or diverging parameter
     */
    public SearchSpace(List<? extends Parameter> parameters,
                       List<? extends ParameterConstraint> parameterConstraints)
            throws ValidationException {
        if (parameters == null) {
            throw ValidationException.invalidDefinition("Search space parameters must not be null");
        }
        Map<String, Parameter> byName = new LinkedHashMap<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (Parameter parameter : parameters) {
            if (byName.put(parameter.getName(), parameter) != null) {
                duplicates.add(parameter.getName());
            }
        }
        if (!duplicates.isEmpty()) {
            throw ValidationException.duplicateParameters(duplicates);
        }
        this.parameters = byName;
        this.parameterConstraints = new ArrayList<>();
        setParameterConstraints(parameterConstraints == null
                ? Collections.<ParameterConstraint>emptyList()
                : parameterConstraints);

        logger.debug("Created {} with {} parameters and {} constraints",
                getClass().getSimpleName(), byName.size(), this.parameterConstraints.size());
    }

    public boolean isHierarchical() {
        return false;
    }

    public boolean isRobust() {
        return false;
    }

    /**
     * All parameters of this space by name, in declaration order.
     *
     * @return an unmodifiable view
     */
    public Map<String, Parameter> getParameters() {
        return Collections.unmodifiableMap(parameters);
    }

    /**
     * Looks up a parameter by name.
     *
     * @param name the parameter name
     * @return the parameter instance owned by this space
     * @throws ValidationException if no parameter has that name
     */
    public Parameter getParameter(String name) throws ValidationException {
        Parameter parameter = getParameters().get(name);
        if (parameter == null) {
            throw ValidationException.unknownParameter(name);
        }
        return parameter;
    }

    public boolean hasParameter(String name) {
        return getParameters().containsKey(name);
    }

    /**
     * Range parameters of this space, in declaration order.
     *
     * @return name to range parameter
     */
    public Map<String, RangeParameter> getRangeParameters() {
        Map<String, RangeParameter> ranges = new LinkedHashMap<>();
        for (Parameter parameter : getParameters().values()) {
            if (parameter.getKind() == ParameterKind.RANGE) {
                ranges.put(parameter.getName(), (RangeParameter) parameter);
            }
        }
        return ranges;
    }

    /**
     * Parameters whose value is not fixed.
     *
     * @return name to parameter, in declaration order
     */
    public Map<String, Parameter> getTunableParameters() {
        Map<String, Parameter> tunable = new LinkedHashMap<>();
        for (Parameter parameter : getParameters().values()) {
            if (parameter.getKind() != ParameterKind.FIXED) {
                tunable.put(parameter.getName(), parameter);
            }
        }
        return tunable;
    }

    public List<ParameterConstraint> getParameterConstraints() {
        return Collections.unmodifiableList(parameterConstraints);
    }

    /**
     * Replaces all constraints. Constraints are validated against this space and
     * rebound to its parameter instances; on failure the space is left unchanged.
     *
     * @param constraints the new constraints
     * @throws ValidationException if a constraint references an unknown parameter, or
     *         holds a parameter whose definition differs from this space's
     */
    public void setParameterConstraints(List<? extends ParameterConstraint> constraints)
            throws ValidationException {
        validateParameterConstraints(constraints);
        for (ParameterConstraint constraint : constraints) {
            constraint.rebindParameters(parameters::get);
        }
        this.parameterConstraints = new ArrayList<>(constraints);
    }

    /**
     * Appends constraints after validating and rebinding them.
     *
     * @param constraints the additional constraints
     * @throws ValidationException under the same conditions as
     *         {@link #setParameterConstraints(List)}
     */
    public void addParameterConstraints(List<? extends ParameterConstraint> constraints)
            throws ValidationException {
        List<ParameterConstraint> combined = new ArrayList<>(parameterConstraints);
        combined.addAll(constraints);
        setParameterConstraints(combined);
    }

    /**
     * Adds a new parameter.
     *
     * @param parameter the parameter to add
     * @throws ValidationException if a parameter with the same name exists
     */
    public void addParameter(Parameter parameter) throws ValidationException {
        if (getParameters().containsKey(parameter.getName())) {
            throw ValidationException.parameterAlreadyExists(parameter.getName());
        }
        parameters.put(parameter.getName(), parameter);
        logger.debug("Added parameter {}", parameter.getName());
    }

    /**
     * Replaces the definition of an existing parameter. Only the domain and metadata
     * may change; the value type must stay the same. Constraints holding the previous
     * instance are rebound to the new one.
     *
     * @param parameter the new definition
     * @throws ValidationException if no parameter with that name exists
     * @throws SearchSpaceOperationException if the value type would change
     */
    public void updateParameter(Parameter parameter)
            throws ValidationException, SearchSpaceOperationException {
        Parameter previous = parameters.get(parameter.getName());
        if (previous == null) {
            throw ValidationException.unknownParameter(parameter.getName());
        }
        if (previous.getParameterType() != parameter.getParameterType()) {
            throw SearchSpaceOperationException.parameterTypeChange(
                    parameter.getName(), previous.getParameterType(), parameter.getParameterType());
        }
        parameters.put(parameter.getName(), parameter);
        for (ParameterConstraint constraint : parameterConstraints) {
            constraint.rebindParameters(parameters::get);
        }
        logger.debug("Updated parameter {}", parameter.getName());
    }

    /**
     * Whether the parameterization names exactly the parameters of this space.
     *
     * @param parameterization parameter name to value
     * @param raiseError whether to throw instead of returning false
     * @return true if the key set equals the declared names
     * @throws ValidationException if raising and the key sets differ
     */
    public boolean checkAllParametersPresent(Map<String, ?> parameterization, boolean raiseError)
            throws ValidationException {
        Set<String> provided = parameterization.keySet();
        Set<String> expected = getParameters().keySet();
        if (!provided.equals(expected)) {
            if (raiseError) {
                throw ValidationException.missingParameters(
                        new LinkedHashSet<>(provided), new LinkedHashSet<>(expected));
            }
            return false;
        }
        return true;
    }

    /**
     * Non-raising membership check requiring every parameter to be present.
     *
     * @param parameterization parameter name to value
     * @return true if the parameterization belongs to this space
     */
    public boolean checkMembership(Map<String, ?> parameterization) {
        try {
            return checkMembership(parameterization, false, true);
        } catch (ValidationException e) {
            // unreachable in boolean mode except for hierarchical casting failures
            logger.debug("Membership check failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Whether the parameterization belongs to this space: every value lies in its
     * parameter's domain and all constraints hold. Constraints are evaluated on the
     * numeric values widened to double, after all domain checks passed.
     *
     * @param parameterization parameter name to value
     * @param raiseError whether to throw instead of returning false
     * @param checkAllParametersPresent whether every declared parameter must be present
     * @return true if the parameterization belongs to this space
     * @throws ValidationException if raising and the parameterization does not belong
     */
    public boolean checkMembership(Map<String, ?> parameterization, boolean raiseError,
                                   boolean checkAllParametersPresent) throws ValidationException {
        if (checkAllParametersPresent && !checkAllParametersPresent(parameterization, raiseError)) {
            return false;
        }

        Map<String, Parameter> declared = getParameters();
        for (Map.Entry<String, ?> entry : parameterization.entrySet()) {
            Parameter parameter = declared.get(entry.getKey());
            if (parameter == null) {
                if (raiseError) {
                    throw ValidationException.unknownParameter(entry.getKey());
                }
                return false;
            }
            if (!parameter.validate(entry.getValue())) {
                if (raiseError) {
                    throw ValidationException.invalidValue(
                            parameter.getName(), entry.getValue(), parameter.toString());
                }
                return false;
            }
        }

        // constraints only see numeric parameters
        Map<String, Double> numericValues = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : parameterization.entrySet()) {
            if (declared.get(entry.getKey()).isNumeric()) {
                numericValues.put(entry.getKey(), ((Number) entry.getValue()).doubleValue());
            }
        }
        for (ParameterConstraint constraint : parameterConstraints) {
            if (!constraint.check(numericValues)) {
                if (raiseError) {
                    throw ValidationException.constraintViolation(constraint.toString(), numericValues);
                }
                return false;
            }
        }
        return true;
    }

    /**
     * Whether every value has a type acceptable for its parameter.
     *
     * @param parameterization parameter name to value
     * @param allowNone whether null values are accepted
     * @param allowExtraParams whether names not declared in this space are accepted
     * @param raiseError whether to throw instead of returning false
     * @return true if all types are acceptable
     * @throws ValidationException if raising and a type or name is rejected
     */
    public boolean checkTypes(Map<String, ?> parameterization, boolean allowNone,
                              boolean allowExtraParams, boolean raiseError)
            throws ValidationException {
        Map<String, Parameter> declared = getParameters();
        for (Map.Entry<String, ?> entry : parameterization.entrySet()) {
            Parameter parameter = declared.get(entry.getKey());
            if (parameter == null) {
                if (allowExtraParams) {
                    continue;
                }
                if (raiseError) {
                    throw ValidationException.unknownParameter(entry.getKey());
                }
                return false;
            }
            Object value = entry.getValue();
            if (value == null && allowNone) {
                continue;
            }
            if (!parameter.isValidType(value)) {
                if (raiseError) {
                    throw ValidationException.invalidValue(parameter.getName(), value, parameter.toString());
                }
                return false;
            }
        }
        return true;
    }

    /**
     * Casts the arm's values to the declared types. Names not declared in this space
     * keep their raw value, and values outside a domain are tolerated.
     *
     * @param arm the arm to cast
     * @return a new arm with the same name
     * @throws ValidationException if a subclass rejects the parameterization
     */
    public Arm castArm(Arm arm) throws ValidationException {
        Map<String, Parameter> declared = getParameters();
        Map<String, Object> cast = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : arm.getParameters().entrySet()) {
            Parameter parameter = declared.get(entry.getKey());
            cast.put(entry.getKey(), parameter == null ? entry.getValue() : parameter.cast(entry.getValue()));
        }
        return new Arm(cast, arm.hasName() ? arm.getName() : null);
    }

    /**
     * Arm with every declared parameter unset.
     *
     * @return an unnamed arm mapping every name to null
     */
    public Arm outOfDesignArm() {
        return constructArmUnchecked(null);
    }

    /**
     * Builds an arm with every declared parameter present, overlaying the given values
     * onto unset defaults.
     *
     * @param values values to overlay, may be null; null values stay unset
     * @param name the arm name, may be null
     * @return the constructed arm
     * @throws ValidationException if a name is unknown or a value lies outside its domain
     */
    public Arm constructArm(Map<String, ?> values, String name) throws ValidationException {
        Map<String, Parameter> declared = getParameters();
        if (values != null) {
            for (Map.Entry<String, ?> entry : values.entrySet()) {
                Parameter parameter = declared.get(entry.getKey());
                if (parameter == null) {
                    throw ValidationException.unknownParameter(entry.getKey());
                }
                if (entry.getValue() != null && !parameter.validate(entry.getValue())) {
                    throw ValidationException.invalidValue(
                            parameter.getName(), entry.getValue(), parameter.toString());
                }
            }
        }
        Arm arm = constructArmUnchecked(values);
        return name == null ? arm : new Arm(arm.getParameters(), name);
    }

    public Arm constructArm(Map<String, ?> values) throws ValidationException {
        return constructArm(values, null);
    }

    private Arm constructArmUnchecked(Map<String, ?> values) {
        Map<String, Object> finalParameters = new LinkedHashMap<>();
        for (String parameterName : getParameters().keySet()) {
            finalParameters.put(parameterName, null);
        }
        if (values != null) {
            finalParameters.putAll(values);
        }
        return new Arm(finalParameters);
    }

    /**
     * Strict validation: the parameterization must pass the raising membership check,
     * and every required value must be an instance of its parameter's Java type. An
     * {@code Integer} is therefore rejected for a FLOAT parameter here even though
     * membership accepts it.
     *
     * @param parameterization parameter name to value
     * @throws ValidationException if the parameterization is not a member, or a value
     *         has the wrong runtime type
     */
    public void validateMembership(Map<String, ?> parameterization) throws ValidationException {
        checkMembership(parameterization, true, true);
        for (Map.Entry<String, Parameter> entry : getParameters().entrySet()) {
            if (!isValueRequired(entry.getKey(), parameterization)) {
                continue;
            }
            Object value = parameterization.get(entry.getKey());
            Class<?> javaType = entry.getValue().getJavaType();
            if (!javaType.isInstance(value)) {
                throw ValidationException.typeMismatch(entry.getKey(), value, javaType);
            }
        }
    }

    /**
     * Whether strict validation requires a value for the named parameter.
     *
     * @param parameterName a declared parameter name
     * @param parameterization the parameterization being validated
     * @return true for every parameter of a flat space
     */
    protected boolean isValueRequired(String parameterName, Map<String, ?> parameterization) {
        return true;
    }

    /**
     * Deep copy of this space: parameters and constraints are copied, and the copied
     * constraints are bound to the copied parameters.
     *
     * @return an equal, independent search space
     * @throws ValidationException if the copy cannot be constructed
     */
    public SearchSpace copy() throws ValidationException {
        return new SearchSpace(copyParameters(parameters.values()), copyConstraints());
    }

    protected static List<Parameter> copyParameters(Collection<Parameter> source) {
        List<Parameter> copies = new ArrayList<>();
        for (Parameter parameter : source) {
            copies.add(parameter.copy());
        }
        return copies;
    }

    protected List<ParameterConstraint> copyConstraints() {
        List<ParameterConstraint> copies = new ArrayList<>();
        for (ParameterConstraint constraint : parameterConstraints) {
            copies.add(constraint.copy());
        }
        return copies;
    }

    /**
     * Parameters declared directly on this space, excluding any variables a subclass
     * adds to {@link #getParameters()}.
     *
     * @return an unmodifiable view in declaration order
     */
    protected Map<String, Parameter> getOwnParameters() {
        return Collections.unmodifiableMap(parameters);
    }

    /**
     * One row per parameter, keyed by column name. Only columns that at least one
     * parameter populates are present, in the order of {@link #SUMMARY_COLUMNS};
     * cells a parameter does not populate hold {@value #SUMMARY_MISSING_VALUE}.
     *
     * @return the summary rows in parameter order
     */
    public List<Map<String, Object>> summaryTable() {
        List<Map<String, Object>> records = new ArrayList<>();
        Set<String> populated = new HashSet<>();
        for (Parameter parameter : getParameters().values()) {
            Map<String, Object> record = parameter.summary();
            populated.addAll(record.keySet());
            records.add(record);
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Map<String, Object> record : records) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (Map.Entry<String, String> column : SUMMARY_COLUMNS.entrySet()) {
                if (populated.contains(column.getKey())) {
                    Object value = record.get(column.getKey());
                    row.put(column.getValue(), value == null ? SUMMARY_MISSING_VALUE : value);
                }
            }
            rows.add(row);
        }
        return rows;
    }

    private void validateParameterConstraints(List<? extends ParameterConstraint> constraints)
            throws ValidationException {
        for (ParameterConstraint constraint : constraints) {
            if (constraint.isParameterBound()) {
                for (Parameter parameter : constraint.getParameters()) {
                    Parameter own = parameters.get(parameter.getName());
                    if (own == null) {
                        throw ValidationException.unknownParameter(parameter.getName());
                    }
                    if (!parameter.equals(own)) {
                        throw ValidationException.constraintDefinitionMismatch(
                                parameter.getName(), parameter, own);
                    }
                }
            } else {
                for (String parameterName : constraint.getParameterNames()) {
                    if (!parameters.containsKey(parameterName)) {
                        throw ValidationException.unknownParameter(parameterName);
                    }
                }
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SearchSpace that = (SearchSpace) o;
        return getParameters().equals(that.getParameters()) &&
               parameterConstraints.equals(that.parameterConstraints);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getParameters(), parameterConstraints);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(parameters=" + new ArrayList<>(parameters.values())
                + ", parameter_constraints=" + parameterConstraints + ")";
    }
}
