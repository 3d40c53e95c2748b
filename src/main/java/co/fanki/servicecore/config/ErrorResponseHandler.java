package co.fanki.servicecore.config;

import co.fanki.servicecore.shared.CoreException;
import co.fanki.servicecore.shared.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Translates failures raised while handling a request into
 * {@link ErrorPayload} payloads.
 *
 * <p>Structured failures are rendered from their code, message and
 * details only. Anything else is reported as a generic internal error and
 * its content is not exposed.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestControllerAdvice
public class ErrorResponseHandler {

    private static final Logger LOG = LoggerFactory.getLogger(
            ErrorResponseHandler.class);

    static final String INTERNAL_ERROR_MESSAGE = "An unexpected error occurred.";

    /**
     * Renders a structured failure.
     *
     * @param e the failure
     * @return the error response
     */
    @ExceptionHandler(CoreException.class)
    public ResponseEntity<ErrorPayload> handleCoreException(
            final CoreException e) {
        LOG.warn("Request failed: {}", e.toString());
        final ErrorPayload body = ErrorPayload.from(e);
        return ResponseEntity.status(statusOf(e.code())).body(body);
    }

    /**
     * Renders a failed precondition as a validation error.
     *
     * @param e the failure
     * @return the error response
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorPayload> handleIllegalArgument(
            final IllegalArgumentException e) {
        LOG.warn("Invalid request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorPayload.of(ErrorCode.VALIDATION_ERROR,
                        e.getMessage()));
    }

    /**
     * Renders any other failure.
     *
     * <p>Failures the web framework already classifies, such as an unknown
     * route or an unsupported method, keep their status.</p>
     *
     * @param e the failure
     * @return the error response
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorPayload> handleUnexpected(final Exception e) {
        if (e instanceof ErrorResponse framework) {
            final HttpStatusCode status = framework.getStatusCode();
            LOG.debug("Request rejected with {}: {}", status.value(),
                    e.getMessage());
            final ErrorCode code = codeOf(status);
            final String message = framework.getBody().getDetail() != null
                    ? framework.getBody().getDetail()
                    : e.getMessage();
            return ResponseEntity.status(status)
                    .body(ErrorPayload.of(code, message));
        }

        LOG.error("Unexpected error while handling request", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorPayload.of(ErrorCode.INTERNAL_ERROR,
                        INTERNAL_ERROR_MESSAGE));
    }

    /**
     * Maps an error code to the HTTP status it is reported with.
     *
     * @param code the error code, may be null
     * @return the HTTP status
     */
    static HttpStatus statusOf(final ErrorCode code) {
        if (code == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return switch (code) {
            case VALIDATION_ERROR -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CLIENT_INITIALIZATION_ERROR -> HttpStatus.SERVICE_UNAVAILABLE;
            case INTERNAL_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static ErrorCode codeOf(final HttpStatusCode status) {
        if (status.value() == HttpStatus.NOT_FOUND.value()) {
            return ErrorCode.NOT_FOUND;
        }
        if (status.is4xxClientError()) {
            return ErrorCode.VALIDATION_ERROR;
        }
        return ErrorCode.INTERNAL_ERROR;
    }

}
