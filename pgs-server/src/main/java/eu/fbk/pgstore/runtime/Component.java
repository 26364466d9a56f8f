package eu.fbk.pgstore.runtime;

import java.io.Closeable;
import java.io.IOException;

/**
 * A PgStore component.
 * <p>
 * This interface defines the basic lifecycle of a component accessing external resources:
 * </p>
 * <ul>
 * <li>The {@code Component} instance is created with its configuration. In case the configuration
 * is incorrect, an exception is thrown; otherwise, the component is configured but still inactive:
 * no persistent data is modified and no resource that needs to be later freed is allocated.</li>
 * <li>Method {@link #init()} is called to make the component operational; differently from the
 * constructor, {@code init()} is allowed to allocate resources such as connection pools.</li>
 * <li>Method {@link #close()} is called to dispose the component and free allocated resources.
 * It can be called at any time after instantiation, even before initialization, and calling it
 * more than once has no effect. Closing a component has no impact on stored data.</li>
 * </ul>
 */
public interface Component extends Closeable {

    /**
     * Initializes the {@code Component}, allocating the resources it needs to become functional.
     *
     * @throws IOException
     *             in case initialization fails
     * @throws IllegalStateException
     *             in case the component has already been initialized or closed
     */
    void init() throws IOException, IllegalStateException;

    /**
     * Closes this {@code Component} object, freeing any allocated resource and aborting ongoing
     * operations. Calling this method on a closed or non-initialized component has no effect.
     */
    @Override
    void close();

}
