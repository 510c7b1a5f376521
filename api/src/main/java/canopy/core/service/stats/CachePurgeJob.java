package canopy.core.service.stats;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import org.jboss.logging.Logger;

import canopy.core.port.in.MaintenanceUseCase;

/**
 * Periodically drops expired result cache entries.
 *
 * <p>Expiry is otherwise lazy, so entries nobody asks for again would stay
 * resident until capacity pressure evicted them.
 */
@ApplicationScoped
public class CachePurgeJob {

    private static final Logger LOG = Logger.getLogger(CachePurgeJob.class);

    private final MaintenanceUseCase maintenance;

    @Inject
    public CachePurgeJob(MaintenanceUseCase maintenance) {
        this.maintenance = maintenance;
    }

    @Scheduled(
            every = "${canopy.cache.purge-interval:PT5M}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void purgeExpired() {
        final var purged = maintenance.purgeExpiredCache();
        if (purged > 0) {
            LOG.debugv("Scheduled purge dropped {0} expired cache entries", purged);
        }
    }
}
