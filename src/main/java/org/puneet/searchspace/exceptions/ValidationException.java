package org.puneet.searchspace.exceptions;

import java.io.Serial;
import java.io.Serializable;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Validation exception raised by search spaces.
 * Covers definition errors (duplicate or unknown parameters, diverging constraint
 * definitions), domain and constraint violations of candidate parameterizations,
 * strict type mismatches, and structural errors of hierarchical search spaces.
 *
 * <p>The non-raising entry points of a search space report the same failures as
 * {@code false} and never construct this exception.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class ValidationException extends Exception implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private static final Logger LOGGER = Logger.getLogger(ValidationException.class.getName());

    /** Metadata key holding the parameterization that failed validation. */
    public static final String PARAMETERIZATION_KEY = "parameterization";

    /** Metadata key holding the rendered hierarchical structure. */
    public static final String HIERARCHY_KEY = "hierarchicalStructure";

    /**
     * Types of validation failures
     */
    public enum ValidationType {
        DEFINITION_VALIDATION("SS001", "Search space definition is invalid"),
        MISSING_PARAMETER_VALIDATION("SS002", "Parameterization does not match the search space parameters"),
        DOMAIN_VALIDATION("SS003", "Value outside of parameter domain"),
        CONSTRAINT_VALIDATION("SS004", "Parameter constraint violated"),
        TYPE_VALIDATION("SS005", "Value type does not match parameter type"),
        HIERARCHY_VALIDATION("SS006", "Parameterization violates the hierarchical structure"),
        STRUCTURE_VALIDATION("SS007", "Hierarchical structure is not a valid tree"),
        DISTRIBUTION_VALIDATION("SS008", "Parameter distributions are invalid");

        private final String code;
        private final String description;

        ValidationType(String code, String description) {
            this.code = code;
            this.description = description;
        }

        public String getCode() {
            return code;
        }

        public String getDescription() {
            return description;
        }

        /**
         * Whether this type describes a broken search space definition rather
         * than a rejected candidate.
         *
         * @return true for definition, structure and distribution failures
         */
        public boolean isDefinitionLevel() {
            return this == DEFINITION_VALIDATION
                    || this == STRUCTURE_VALIDATION
                    || this == DISTRIBUTION_VALIDATION;
        }
    }

    /**
     * Validation error details
     */
    public static class ValidationError implements Serializable {
        @Serial
        private static final long serialVersionUID = 1L;

        private final String fieldName;
        private final Object actualValue;
        private final Object expectedValue;
        private final String constraint;

        public ValidationError(String fieldName, Object actualValue,
                               Object expectedValue, String constraint) {
            this.fieldName = fieldName;
            this.actualValue = actualValue;
            this.expectedValue = expectedValue;
            this.constraint = constraint;
        }

        public String getFieldName() {
            return fieldName;
        }

        public Object getActualValue() {
            return actualValue;
        }

        public Object getExpectedValue() {
            return expectedValue;
        }

        public String getConstraint() {
            return constraint;
        }

        @Override
        public String toString() {
            return String.format("Field '%s': expected %s %s, but got %s",
                    fieldName, constraint, expectedValue, actualValue);
        }
    }

    private final ValidationType validationType;
    private final List<ValidationError> validationErrors;
    private final LocalDateTime timestamp;
    private final Map<String, Object> metadata;

    /**
     * Constructs a new ValidationException with type and message.
     *
     * @param validationType The type of validation that failed
     * @param message The detailed error message
     * @throws NullPointerException if validationType is null
     */
    public ValidationException(ValidationType validationType, String message) {
        this(validationType, message, new ArrayList<>(), null, new HashMap<>());
    }

    /**
     * Constructs a new ValidationException with type, message, and validation errors.
     *
     * @param validationType The type of validation that failed
     * @param message The detailed error message
     * @param validationErrors List of specific validation errors
     * @throws NullPointerException if validationType is null
     */
    public ValidationException(ValidationType validationType, String message,
                               List<ValidationError> validationErrors) {
        this(validationType, message, validationErrors, null, new HashMap<>());
    }

    /**
     * Constructs a new ValidationException with all parameters.
     *
     * @param validationType The type of validation that failed
     * @param message The detailed error message
     * @param validationErrors List of specific validation errors
     * @param cause The underlying cause
     * @param metadata Additional metadata for debugging
     * @throws NullPointerException if validationType is null
     */
    public ValidationException(ValidationType validationType, String message,
                               List<ValidationError> validationErrors,
                               Throwable cause, Map<String, Object> metadata) {
        super(formatMessage(validationType, message), cause);

        Objects.requireNonNull(validationType, "Validation type cannot be null");

        this.validationType = validationType;
        this.validationErrors = validationErrors != null ?
                new ArrayList<>(validationErrors) : new ArrayList<>();
        this.timestamp = LocalDateTime.now();
        this.metadata = metadata != null ? new HashMap<>(metadata) : new HashMap<>();

        logException();
    }

    /**
     * Creates an exception for parameter names declared more than once.
     *
     * @param duplicates The duplicated names
     * @return A new ValidationException configured for definition validation
     */
    public static ValidationException duplicateParameters(Collection<String> duplicates) {
        String message = String.format("Parameter names must be unique; duplicated: %s", duplicates);
        List<ValidationError> errors = new ArrayList<>();
        for (String name : duplicates) {
            errors.add(new ValidationError(name, name, "unique name", "UNIQUE"));
        }
        return new ValidationException(ValidationType.DEFINITION_VALIDATION, message, errors);
    }

    /**
     * Creates an exception for adding a parameter whose name is already declared.
     *
     * @param parameterName The colliding name
     * @return A new ValidationException configured for definition validation
     */
    public static ValidationException parameterAlreadyExists(String parameterName) {
        String message = String.format(
                "Parameter `%s` already exists in search space. "
                        + "Use `updateParameter` to update an existing parameter.", parameterName);
        List<ValidationError> errors = List.of(
                new ValidationError(parameterName, parameterName, "absent name", "UNIQUE"));
        return new ValidationException(ValidationType.DEFINITION_VALIDATION, message, errors);
    }

    /**
     * Creates an exception for a reference to a parameter the search space does not declare.
     *
     * @param parameterName The unknown name
     * @return A new ValidationException configured for definition validation
     */
    public static ValidationException unknownParameter(String parameterName) {
        String message = String.format("`%s` does not exist in search space.", parameterName);
        List<ValidationError> errors = List.of(
                new ValidationError(parameterName, parameterName, "declared parameter", "EXISTS"));
        return new ValidationException(ValidationType.DEFINITION_VALIDATION, message, errors);
    }

    /**
     * Creates an exception for a constraint whose parameter definition diverges from
     * the search space definition of the same name.
     *
     * @param parameterName The parameter name
     * @param constraintDefinition The definition carried by the constraint
     * @param spaceDefinition The definition held by the search space
     * @return A new ValidationException configured for definition validation
     */
    public static ValidationException constraintDefinitionMismatch(String parameterName,
                                                                   Object constraintDefinition,
                                                                   Object spaceDefinition) {
        String message = String.format(
                "Parameter constraint's definition of '%s' does not match the SearchSpace's definition",
                parameterName);
        List<ValidationError> errors = List.of(
                new ValidationError(parameterName, constraintDefinition, spaceDefinition, "EQUALS"));
        return new ValidationException(ValidationType.DEFINITION_VALIDATION, message, errors);
    }

    /**
     * Creates an exception for an invalid search space definition not covered by
     * a more specific factory.
     *
     * @param message The reason
     * @return A new ValidationException configured for definition validation
     */
    public static ValidationException invalidDefinition(String message) {
        return new ValidationException(ValidationType.DEFINITION_VALIDATION, message);
    }

    /**
     * Creates an exception for a parameterization whose keys differ from the
     * declared parameter names.
     *
     * @param provided Names present in the parameterization
     * @param expected Names declared by the search space
     * @return A new ValidationException configured for missing parameter validation
     */
    public static ValidationException missingParameters(Set<String> provided, Set<String> expected) {
        String message = String.format(
                "Parameterization has parameters: %s, but search space has parameters: %s.",
                provided, expected);
        List<ValidationError> errors = List.of(
                new ValidationError("parameters", provided, expected, "EXACT"));
        return new ValidationException(ValidationType.MISSING_PARAMETER_VALIDATION, message, errors);
    }

    /**
     * Creates an exception for a value outside of a parameter domain.
     *
     * @param parameterName The parameter name
     * @param value The rejected value
     * @param parameterDescription The parameter rendering including its domain
     * @return A new ValidationException configured for domain validation
     */
    public static ValidationException invalidValue(String parameterName, Object value,
                                                   String parameterDescription) {
        String message = String.format("%s is not a valid value for parameter %s",
                value, parameterDescription);
        List<ValidationError> errors = List.of(
                new ValidationError(parameterName, value, parameterDescription, "DOMAIN"));
        return new ValidationException(ValidationType.DOMAIN_VALIDATION, message, errors);
    }

    /**
     * Creates an exception for a violated parameter constraint.
     *
     * @param constraint The rendered constraint
     * @param numericValues The numeric values the constraint was evaluated on
     * @return A new ValidationException configured for constraint validation
     */
    public static ValidationException constraintViolation(String constraint,
                                                          Map<String, Double> numericValues) {
        String message = String.format("Parameter constraint %s is violated.", constraint);
        List<ValidationError> errors = List.of(
                new ValidationError(constraint, numericValues, "satisfied", "CONSTRAINT"));
        return new ValidationException(ValidationType.CONSTRAINT_VALIDATION, message, errors);
    }

    /**
     * Creates an exception for a value whose runtime type differs from the
     * parameter's declared type.
     *
     * @param parameterName The parameter name
     * @param value The offending value
     * @param expectedType The declared Java type
     * @return A new ValidationException configured for type validation
     */
    public static ValidationException typeMismatch(String parameterName, Object value,
                                                   Class<?> expectedType) {
        String actualType = value == null ? "null" : value.getClass().getSimpleName();
        String message = String.format(
                "Value for parameter %s: %s is of type %s, expected %s. If the intention was to "
                        + "have the parameter be of type %s, declare it with that parameter type.",
                parameterName, value, actualType, expectedType.getSimpleName(), actualType);
        List<ValidationError> errors = List.of(
                new ValidationError(parameterName, actualType, expectedType.getSimpleName(), "TYPE"));
        return new ValidationException(ValidationType.TYPE_VALIDATION, message, errors);
    }

    /**
     * Creates an exception for a parameterization that does not fit the dependency
     * tree of a hierarchical search space.
     *
     * @param type Either {@link ValidationType#HIERARCHY_VALIDATION} or
     *             {@link ValidationType#TYPE_VALIDATION}
     * @param reason The specific reason
     * @param parameterization The offending parameterization
     * @param hierarchicalStructure The rendered dependency tree
     * @return A new ValidationException carrying the parameterization and tree as metadata
     */
    public static ValidationException hierarchyViolation(ValidationType type, String reason,
                                                         Map<String, ?> parameterization,
                                                         String hierarchicalStructure) {
        String message = String.format(
                "Parameterization %s violates the hierarchical structure of the search space:%n%s%s",
                parameterization, hierarchicalStructure, reason);
        Map<String, Object> metadata = new HashMap<>();
        metadata.put(PARAMETERIZATION_KEY, new LinkedHashMap<>(parameterization));
        metadata.put(HIERARCHY_KEY, hierarchicalStructure);
        return new ValidationException(type, message, new ArrayList<>(), null, metadata);
    }

    /**
     * Creates an exception for a dependency structure that is not a single tree.
     *
     * @param message The reason
     * @return A new ValidationException configured for structure validation
     */
    public static ValidationException structureViolation(String message) {
        return new ValidationException(ValidationType.STRUCTURE_VALIDATION, message);
    }

    /**
     * Creates an exception for an invalid assignment of parameter distributions.
     *
     * @param message The reason
     * @return A new ValidationException configured for distribution validation
     */
    public static ValidationException invalidDistribution(String message) {
        return new ValidationException(ValidationType.DISTRIBUTION_VALIDATION, message);
    }

    /**
     * Formats the exception message with the validation code.
     *
     * @param validationType The validation type
     * @param message The base message
     * @return A formatted error message
     */
    private static String formatMessage(ValidationType validationType, String message) {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(validationType.getCode()).append("] ");
        sb.append(validationType.getDescription());

        if (message != null && !message.isEmpty()) {
            sb.append(": ").append(message);
        }

        return sb.toString();
    }

    /**
     * Logs the exception details. Candidate rejections are logged at FINE since
     * raising-mode membership checks may run once per candidate.
     */
    private void logException() {
        Level level = validationType.isDefinitionLevel() ? Level.WARNING : Level.FINE;
        if (LOGGER.isLoggable(level)) {
            LOGGER.log(level, String.format(
                    "ValidationException created: [%s] %s at %s",
                    validationType.getCode(),
                    getMessage(),
                    timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)));

            if (!validationErrors.isEmpty() && LOGGER.isLoggable(Level.FINER)) {
                for (ValidationError error : validationErrors) {
                    LOGGER.finer("  - " + error);
                }
            }
        }
    }

    public ValidationType getValidationType() {
        return validationType;
    }

    /**
     * Gets the list of validation errors.
     *
     * @return An unmodifiable list of validation errors
     */
    public List<ValidationError> getValidationErrors() {
        return Collections.unmodifiableList(validationErrors);
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    /**
     * Gets the metadata associated with this exception.
     *
     * @return An unmodifiable map of metadata
     */
    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public boolean hasValidationErrors() {
        return !validationErrors.isEmpty();
    }

    /**
     * Gets a detailed string representation for logging.
     *
     * @return A detailed string representation
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("ValidationException Details:\n");
        sb.append("  Type: ").append(validationType.getCode()).append(" - ")
          .append(validationType.getDescription()).append("\n");
        sb.append("  Message: ").append(getMessage()).append("\n");
        sb.append("  Timestamp: ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("\n");

        if (!validationErrors.isEmpty()) {
            sb.append("  Validation Errors (").append(validationErrors.size()).append("):\n");
            for (ValidationError error : validationErrors) {
                sb.append("    - ").append(error).append("\n");
            }
        }

        if (!metadata.isEmpty()) {
            sb.append("  Metadata:\n");
            for (Map.Entry<String, Object> entry : metadata.entrySet()) {
                sb.append("    ").append(entry.getKey()).append(": ")
                  .append(entry.getValue()).append("\n");
            }
        }

        if (getCause() != null) {
            sb.append("  Cause: ").append(getCause().getClass().getName())
              .append(" - ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("ValidationException[type=%s, errors=%d, timestamp=%s]: %s",
                validationType.getCode(),
                validationErrors.size(),
                timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME),
                getMessage());
    }
}
