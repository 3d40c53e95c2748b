package co.fanki.servicecore.config;

import co.fanki.servicecore.shared.CoreException;
import co.fanki.servicecore.shared.ErrorCode;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Error payload returned to clients for every failed request.
 *
 * @param code the stable error code
 * @param message the human readable message
 * @param details the diagnostic details, omitted when absent
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorPayload(
        String code,
        String message,
        String details
) {

    /**
     * Builds the payload of a structured failure.
     *
     * <p>Reads only the code, message and details, so every subtype
     * renders the same way.</p>
     *
     * @param error the failure to render
     * @return the payload
     */
    public static ErrorPayload from(final CoreException error) {
        final ErrorCode code = error.code() != null
                ? error.code() : ErrorCode.INTERNAL_ERROR;
        return new ErrorPayload(code.value(), error.getMessage(),
                error.details().orElse(null));
    }

    /**
     * Builds a payload without details.
     *
     * @param code the error code
     * @param message the message
     * @return the payload
     */
    public static ErrorPayload of(final ErrorCode code, final String message) {
        return new ErrorPayload(code.value(), message, null);
    }

}
