package co.fanki.servicecore.client;

import co.fanki.servicecore.shared.ClientInitializationException;
import co.fanki.servicecore.shared.Preconditions;

/**
 * Holds a client that is created on first use.
 *
 * <p>Creation goes through {@link ClientInitializer}. A failed creation is
 * not remembered: the next call to {@link #get()} tries again.</p>
 *
 * @param <T> the client type
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class LazyClient<T> {

    private final String name;

    private final ClientFactory<T> factory;

    private volatile T client;

    /**
     * Creates a new LazyClient.
     *
     * @param theName the client name
     * @param theFactory the factory that builds the client
     */
    public LazyClient(final String theName, final ClientFactory<T> theFactory) {
        this.name = Preconditions.requireNonBlank(theName,
                "Client name is required");
        this.factory = Preconditions.requireNonNull(theFactory,
                "Client factory is required");
    }

    /**
     * Returns the client, creating it if needed.
     *
     * @return the client
     * @throws ClientInitializationException if the client cannot be created
     */
    public T get() {
        T current = client;
        if (current == null) {
            synchronized (this) {
                current = client;
                if (current == null) {
                    current = ClientInitializer.initialize(name, factory);
                    client = current;
                }
            }
        }
        return current;
    }

    /**
     * Checks whether the client has been created.
     *
     * @return true once a call to {@link #get()} succeeded
     */
    public boolean isInitialized() {
        return client != null;
    }

    /**
     * Returns the client name.
     *
     * @return the name
     */
    public String name() {
        return name;
    }

}
