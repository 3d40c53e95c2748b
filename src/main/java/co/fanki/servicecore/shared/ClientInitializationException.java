package co.fanki.servicecore.shared;

/**
 * Raised when an external client could not be constructed.
 *
 * <p>The operation that needed the client is expected to abort. The
 * lower level failure is kept only as its string form in the details.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ClientInitializationException extends CoreException {

    private static final long serialVersionUID = 1L;

    /** Message shared by every client initialization failure. */
    public static final String MESSAGE = "The client initialization failed.";

    /**
     * Creates a new exception from a description of the failure.
     *
     * @param details what went wrong
     */
    public ClientInitializationException(final String details) {
        super(MESSAGE, ErrorCode.CLIENT_INITIALIZATION_ERROR,
                String.valueOf(details));
    }

    /**
     * Creates a new exception from the failure raised by the client.
     *
     * @param failure the failure raised while building the client
     */
    public ClientInitializationException(final Throwable failure) {
        super(MESSAGE, ErrorCode.CLIENT_INITIALIZATION_ERROR,
                describe(failure));
    }

}
