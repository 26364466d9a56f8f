package eu.fbk.pgstore.triplestore;

import java.io.IOException;

import eu.fbk.pgstore.runtime.Component;
import eu.fbk.pgstore.runtime.DataCorruptedException;

/**
 * A storage for triples organized in named graphs and quoted graphs (formulae).
 * <p>
 * A <tt>TripleStore</tt> object abstracts the access to a persistent store of RDF statements,
 * where each statement belongs to a context. Access to its contents occurs in the scope of a
 * {@link TripleTransaction}, which can either be read-only or read/write. Note that a
 * {@code TripleStore} obeys the general contract and lifecycle of {@link Component}.
 * </p>
 * <p>
 * Besides transactions, a {@code TripleStore} exposes the management of the persistent
 * structures it relies on: {@link #open(boolean)} to initialize the component and possibly create
 * those structures, {@link #exists()} to check for them, {@link #reset()} to (re)create them
 * empty and {@link #destroy()} to remove them.
 * </p>
 * <p>
 * As a special kind of <tt>IOException</tt>, implementations may throw a
 * {@link DataCorruptedException} in case the persistent structures are found missing or
 * corrupted. A {@link #reset()} call followed by re-population allows recovering from it.
 * </p>
 */
public interface TripleStore extends Component {

    /** Outcome of {@link TripleStore#open(boolean)}. */
    enum Status {

        /** The store exists and can be accessed. */
        VALID_STORE,

        /** The store does not exist or could not be checked. */
        NO_STORE

    }

    /**
     * Opens the store, initializing the component if not already done. If {@code create} is
     * true the persistent structures are created, or emptied if they already exist.
     *
     * @param create
     *            true if persistent structures should be (re)initialized
     * @return {@link Status#VALID_STORE} if the store exists after the operation,
     *         {@link Status#NO_STORE} if it does not or its existence could not be checked
     * @throws IOException
     *             if the backend cannot be reached or creation fails
     */
    Status open(boolean create) throws IOException;

    /**
     * Checks whether all the persistent structures of the store exist.
     *
     * @return true if the store exists
     * @throws IOException
     *             in case the check cannot be performed
     */
    boolean exists() throws IOException;

    /**
     * Begins a new read-only / read-write transaction. Transactions must be ended as soon as
     * possible, in order to release the backend resources they hold.
     *
     * @param readOnly
     *            <tt>true</tt> if the transaction is not allowed to modify the store
     * @return the created transaction
     * @throws DataCorruptedException
     *             in case the persistent structures are damaged or missing
     * @throws IOException
     *             if another IO error occurs while starting the transaction
     */
    TripleTransaction begin(boolean readOnly) throws DataCorruptedException, IOException;

    /**
     * Resets the store contents: persistent structures are created if missing, otherwise they are
     * emptied on a best-effort basis. On success, the store is left empty.
     *
     * @throws IOException
     *             if structures cannot be created
     */
    void reset() throws IOException;

    /**
     * Removes all the persistent structures of the store. The operation is idempotent and
     * best-effort: failures on single structures are logged and counted, and removal continues
     * with the remaining ones.
     *
     * @return the number of structures that could not be removed
     * @throws IOException
     *             if the backend cannot be reached
     */
    int destroy() throws IOException;

}
