package org.puneet.searchspace.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A candidate point: an ordered mapping from parameter name to value plus an
 * optional name. A {@code null} value means the parameter is unset.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class Arm {

    private final Map<String, Object> parameters;
    private final String name;

    public Arm(Map<String, ?> parameters) {
        this(parameters, null);
    }

    /**
     * @param parameters parameter name to value; null values are allowed
     * @param name the arm name, may be null
     * @throws IllegalArgumentException if the parameterization is null
     */
    public Arm(Map<String, ?> parameters, String name) {
        if (parameters == null) {
            throw new IllegalArgumentException("Arm parameters must not be null");
        }
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.name = name;
    }

    /**
     * Parameterization of this arm.
     *
     * @return an unmodifiable, insertion-ordered mapping which may contain null values
     */
    public Map<String, Object> getParameters() {
        return parameters;
    }

    /**
     * @return the arm name, or null for unnamed arms
     */
    public String getName() {
        return name;
    }

    public boolean hasName() {
        return name != null;
    }

    public Arm copy() {
        return new Arm(parameters, name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Arm arm = (Arm) o;
        return parameters.equals(arm.parameters) && Objects.equals(name, arm.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parameters, name);
    }

    @Override
    public String toString() {
        return "Arm(" + (name != null ? "name='" + name + "', " : "") + "parameters=" + parameters + ")";
    }
}
