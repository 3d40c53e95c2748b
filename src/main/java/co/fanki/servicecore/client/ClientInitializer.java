package co.fanki.servicecore.client;

import co.fanki.servicecore.shared.ClientInitializationException;
import co.fanki.servicecore.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates external clients and reports failures as
 * {@link ClientInitializationException}.
 *
 * <p>This is the wrap site for client construction: the original failure
 * is logged with its stack trace here and only its string form travels
 * upward in the exception details.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ClientInitializer {

    private static final Logger LOG = LoggerFactory.getLogger(
            ClientInitializer.class);

    private ClientInitializer() {
        // Utility class, not instantiable
    }

    /**
     * Runs the factory and returns the client it builds.
     *
     * @param clientName the name of the client, used in logs and details
     * @param factory the factory that builds the client
     * @param <T> the client type
     * @return the created client, never null
     * @throws ClientInitializationException if the factory fails or
     *     returns null
     */
    public static <T> T initialize(final String clientName,
            final ClientFactory<T> factory) {
        Preconditions.requireNonBlank(clientName, "Client name is required");
        Preconditions.requireNonNull(factory, "Client factory is required");

        LOG.debug("Initializing client: {}", clientName);

        final T client;
        try {
            client = factory.create();
        } catch (final ClientInitializationException e) {
            LOG.error("Client {} failed to initialize: {}",
                    clientName, e.details().orElse(e.getMessage()));
            throw e;
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.error("Client {} initialization was interrupted", clientName);
            throw new ClientInitializationException(e);
        } catch (final Exception e) {
            LOG.error("Client {} failed to initialize", clientName, e);
            throw new ClientInitializationException(e);
        }

        if (client == null) {
            LOG.error("Client {} factory returned no instance", clientName);
            throw new ClientInitializationException(
                    "Factory for client " + clientName + " returned null");
        }

        LOG.info("Client {} initialized", clientName);
        return client;
    }

}
