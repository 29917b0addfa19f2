package org.puneet.searchspace.exceptions;

import java.io.Serial;
import java.io.Serializable;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Configuration-level exception for operations a search space does not support,
 * such as changing the type of a declared parameter, redefining parameters of a
 * robust search space, or combining parameter distributions in ways the robust
 * formulation cannot represent.
 *
 * <p>Kept separate from {@link ValidationException} so callers can tell a rejected
 * candidate apart from an unsupported request.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class SearchSpaceOperationException extends Exception implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private static final Logger LOGGER = Logger.getLogger(SearchSpaceOperationException.class.getName());

    /**
     * Error codes for unsupported search space operations
     */
    public enum ErrorCode {
        PARAMETER_TYPE_CHANGE("SSO001", "Parameter type cannot be changed"),
        IMMUTABLE_PARAMETERS("SSO002", "Parameters of this search space cannot be redefined"),
        MIXED_DISTRIBUTION("SSO003", "Distribution mixes environmental variables and parameters"),
        MIXED_POLARITY("SSO004", "Perturbation distributions mix multiplicative and additive noise"),
        UNSUPPORTED_DIGEST("SSO005", "Search space cannot be represented as a digest"),
        UNKNOWN("SSO999", "Unsupported operation");

        private final String code;
        private final String description;

        ErrorCode(String code, String description) {
            this.code = code;
            this.description = description;
        }

        public String getCode() {
            return code;
        }

        public String getDescription() {
            return description;
        }
    }

    private final ErrorCode errorCode;
    private final String context;
    private final LocalDateTime timestamp;

    /**
     * Constructs a new SearchSpaceOperationException with error code and message.
     *
     * @param errorCode The specific error code
     * @param message The detailed error message
     * @throws NullPointerException if errorCode is null
     */
    public SearchSpaceOperationException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    /**
     * Constructs a new SearchSpaceOperationException with error code, message, and context.
     *
     * @param errorCode The specific error code
     * @param message The detailed error message
     * @param context Additional context information (e.g., parameter or distribution)
     * @throws NullPointerException if errorCode is null
     */
    public SearchSpaceOperationException(ErrorCode errorCode, String message, String context) {
        this(errorCode, message, context, null);
    }

    /**
     * Constructs a new SearchSpaceOperationException with all parameters.
     *
     * @param errorCode The specific error code
     * @param message The detailed error message
     * @param context Additional context information
     * @param cause The underlying cause of the exception
     * @throws NullPointerException if errorCode is null
     */
    public SearchSpaceOperationException(ErrorCode errorCode, String message,
                                         String context, Throwable cause) {
        super(formatMessage(errorCode, message, context), cause);

        Objects.requireNonNull(errorCode, "Error code cannot be null");

        this.errorCode = errorCode;
        this.context = context;
        this.timestamp = LocalDateTime.now();

        logException();
    }

    /**
     * Creates an exception for an attempt to change the type of a declared parameter.
     *
     * @param parameterName The parameter name
     * @param previousType The declared type
     * @param requestedType The requested type
     * @return A new SearchSpaceOperationException configured for type changes
     */
    public static SearchSpaceOperationException parameterTypeChange(String parameterName,
                                                                    Object previousType,
                                                                    Object requestedType) {
        String message = String.format("Parameter `%s` has type %s. Cannot update to type %s.",
                parameterName, previousType, requestedType);
        return new SearchSpaceOperationException(
                ErrorCode.PARAMETER_TYPE_CHANGE, message, "Parameter: " + parameterName);
    }

    /**
     * Creates an exception for a search space type that rejects an operation outright.
     *
     * @param spaceType The simple name of the search space class
     * @param operation The rejected operation
     * @return A new SearchSpaceOperationException configured for immutable parameters
     */
    public static SearchSpaceOperationException unsupportedOperation(String spaceType, String operation) {
        String message = String.format("%s does not support `%s`.", spaceType, operation);
        return new SearchSpaceOperationException(ErrorCode.IMMUTABLE_PARAMETERS, message, spaceType);
    }

    /**
     * Creates an exception for a parameter that cannot appear in a digest.
     *
     * @param parameter The rendered parameter
     * @param reason Why it cannot be represented
     * @return A new SearchSpaceOperationException configured for digest extraction
     */
    public static SearchSpaceOperationException unsupportedDigest(String parameter, String reason) {
        String message = String.format("%s: %s", parameter, reason);
        return new SearchSpaceOperationException(ErrorCode.UNSUPPORTED_DIGEST, message, parameter);
    }

    private static String formatMessage(ErrorCode errorCode, String message, String context) {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(errorCode.getCode()).append("] ");
        sb.append(errorCode.getDescription());

        if (message != null && !message.isEmpty()) {
            sb.append(": ").append(message);
        }

        if (context != null && !context.isEmpty()) {
            sb.append(" | Context: ").append(context);
        }

        return sb.toString();
    }

    private void logException() {
        if (LOGGER.isLoggable(Level.WARNING)) {
            LOGGER.log(Level.WARNING, String.format(
                    "SearchSpaceOperationException created: [%s] %s at %s",
                    errorCode.getCode(),
                    getMessage(),
                    timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)));
        }
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Gets the context information associated with this exception.
     *
     * @return The context string, may be null
     */
    public String getContext() {
        return context;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    /**
     * Gets a detailed string representation of this exception for logging.
     *
     * @return A detailed string representation
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("SearchSpaceOperationException Details:\n");
        sb.append("  Error Code: ").append(errorCode.getCode()).append("\n");
        sb.append("  Description: ").append(errorCode.getDescription()).append("\n");
        sb.append("  Message: ").append(getMessage()).append("\n");
        sb.append("  Timestamp: ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("\n");

        if (context != null) {
            sb.append("  Context: ").append(context).append("\n");
        }

        if (getCause() != null) {
            sb.append("  Cause: ").append(getCause().getClass().getName())
              .append(" - ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("SearchSpaceOperationException[code=%s, timestamp=%s]: %s",
                errorCode.getCode(),
                timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME),
                getMessage());
    }
}
