package co.fanki.servicecore.client;

/**
 * Builds a client for an external dependency.
 *
 * @param <T> the client type
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@FunctionalInterface
public interface ClientFactory<T> {

    /**
     * Creates the client.
     *
     * @return the ready to use client
     * @throws Exception if the client cannot be created
     */
    T create() throws Exception;

}
