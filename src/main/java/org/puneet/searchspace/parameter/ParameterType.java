package org.puneet.searchspace.parameter;

/**
 * Value types a parameter can declare, together with the Java type values of that
 * parameter must have to pass strict validation.
 */
public enum ParameterType {
    INT(Integer.class),
    FLOAT(Double.class),
    STRING(String.class),
    BOOL(Boolean.class);

    private final Class<?> javaType;

    ParameterType(Class<?> javaType) {
        this.javaType = javaType;
    }

    public Class<?> getJavaType() {
        return javaType;
    }

    public boolean isNumeric() {
        return this == INT || this == FLOAT;
    }
}
