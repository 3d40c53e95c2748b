package co.fanki.servicecore.shared;

import java.util.Optional;

/**
 * Stable classification codes for failures reported by the service.
 *
 * <p>Codes are part of the public contract: callers match on
 * {@link #value()} to handle failures programmatically. Members are only
 * ever appended; an existing member is never renamed, removed or given a
 * different meaning.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ErrorCode {

    /**
     * An external client could not be brought into a usable state.
     */
    CLIENT_INITIALIZATION_ERROR("CLIENT_INITIALIZATION_ERROR"),

    /**
     * The caller input or a precondition was invalid.
     */
    VALIDATION_ERROR("VALIDATION_ERROR"),

    /**
     * The requested route or resource does not exist.
     */
    NOT_FOUND("NOT_FOUND"),

    /**
     * Unclassified failure.
     */
    INTERNAL_ERROR("INTERNAL_ERROR");

    private final String value;

    ErrorCode(final String theValue) {
        this.value = theValue;
    }

    /**
     * Returns the wire representation of this code.
     *
     * @return the stable string value
     */
    public String value() {
        return value;
    }

    /**
     * Looks up a code by its wire representation.
     *
     * @param value the wire value, may be null
     * @return the matching code, or empty if none matches
     */
    public static Optional<ErrorCode> fromValue(final String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        final String candidate = value.trim();
        for (final ErrorCode code : values()) {
            if (code.value.equals(candidate)) {
                return Optional.of(code);
            }
        }
        return Optional.empty();
    }

}
