package co.fanki.servicecore.shared;

import java.util.Optional;

/**
 * Base exception for every structured failure raised by the service.
 *
 * <p>Carries a human message, a classification {@link ErrorCode} and
 * optional free-form details. Anything that renders or logs failures only
 * needs these three values and never the concrete subtype.</p>
 *
 * <p>Instances are immutable. Subclasses pre-fill the message and code for
 * a single failure scenario and add nothing else.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class CoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Longest details value kept, in characters. */
    static final int MAX_DETAILS_LENGTH = 4096;

    static final String TRUNCATION_MARKER = "... [truncated]";

    private final ErrorCode code;

    private final String details;

    /**
     * Creates a new exception without details.
     *
     * @param message the human readable message
     * @param theCode the classification code
     */
    public CoreException(final String message, final ErrorCode theCode) {
        this(message, theCode, null);
    }

    /**
     * Creates a new exception with details.
     *
     * @param message the human readable message
     * @param theCode the classification code
     * @param theDetails the diagnostic details, may be null
     */
    public CoreException(final String message, final ErrorCode theCode,
            final String theDetails) {
        // A null cause is fixed here so initCause cannot attach one later.
        super(message, null);
        this.code = theCode;
        this.details = cap(theDetails);
    }

    /**
     * Returns the classification code.
     *
     * @return the error code
     */
    public ErrorCode code() {
        return code;
    }

    /**
     * Returns the diagnostic details, if any.
     *
     * @return the details
     */
    public Optional<String> details() {
        return Optional.ofNullable(details);
    }

    /**
     * Converts a lower level failure into a details string.
     *
     * <p>Only the string form is kept, the failure itself is not
     * referenced afterwards.</p>
     *
     * @param failure the failure to describe, may be null
     * @return the string representation of the failure
     */
    protected static String describe(final Throwable failure) {
        return String.valueOf(failure);
    }

    private static String cap(final String value) {
        if (value == null || value.length() <= MAX_DETAILS_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_DETAILS_LENGTH) + TRUNCATION_MARKER;
    }

    @Override
    public String toString() {
        final StringBuilder text = new StringBuilder(getClass().getSimpleName())
                .append('[').append(code == null ? null : code.value())
                .append("]: ").append(getMessage());
        if (details != null) {
            text.append(" (").append(details).append(')');
        }
        return text.toString();
    }

}
