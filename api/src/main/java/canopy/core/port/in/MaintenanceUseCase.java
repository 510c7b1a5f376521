package canopy.core.port.in;

/**
 * Administrative operations on the engine's shared state.
 */
public interface MaintenanceUseCase {

    /**
     * Drop every cached estimate. Counters are kept.
     */
    void clearCache();

    /**
     * Drop expired cached estimates.
     *
     * @return number of entries purged
     */
    int purgeExpiredCache();

    /**
     * Discard a client's rate limit windows.
     *
     * @param clientId the client identity
     * @return true if the client had state
     */
    boolean resetClient(String clientId);

    /**
     * Discard every client's rate limit windows.
     */
    void resetAllClients();
}
