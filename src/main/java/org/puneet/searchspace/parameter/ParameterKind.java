package org.puneet.searchspace.parameter;

/**
 * Closed set of parameter domain kinds.
 */
public enum ParameterKind {
    /** Continuous or integer interval. */
    RANGE,
    /** Finite list of values. */
    CHOICE,
    /** Single value. */
    FIXED
}
