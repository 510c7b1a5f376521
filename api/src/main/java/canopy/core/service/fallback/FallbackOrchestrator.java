package canopy.core.service.fallback;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import canopy.core.cache.LocalCache;
import canopy.core.config.CacheConfig;
import canopy.core.config.FallbackConfig;
import canopy.core.exception.ChainExhaustedException;
import canopy.core.model.estimate.AttemptOutcome;
import canopy.core.model.estimate.AttemptRecord;
import canopy.core.model.estimate.CachedEstimate;
import canopy.core.model.estimate.EstimateRequest;
import canopy.core.model.estimate.EstimateResult;
import canopy.core.model.estimate.NutrientEstimate;
import canopy.core.model.estimate.ProviderReading;
import canopy.core.model.estimate.RequestKey;
import canopy.core.model.selection.ProviderPlan;
import canopy.core.port.in.EstimateUseCase;
import canopy.core.port.out.BaselineEstimator;
import canopy.core.port.out.Metrics;
import canopy.core.port.out.ReadingCalibrator;
import canopy.core.service.selection.ProviderSelectionPolicy;
import canopy.core.service.selection.SelectionContextResolver;
import canopy.core.service.stats.FallbackStatistics;

/**
 * Answers estimate requests from the cache or the provider chain.
 *
 * <p>Request flow:
 * <ol>
 *   <li>Build the cache key and consult the result cache. A hit is returned as is,
 *       without touching any provider.</li>
 *   <li>Classify the request and let the selection policy order the chain.</li>
 *   <li>Walk the ordered providers, each with its own timeout and retry budget.
 *       The first usable reading wins; the others are not attempted or are cancelled.</li>
 *   <li>If every provider fails, ask the baseline estimator.</li>
 *   <li>Calibrate the reading. Provider answers are cached; baseline answers are not.</li>
 * </ol>
 *
 * <p>The fallback level reported for an answer is the provider's position in the
 * default chain, whatever order the policy chose for this request.
 *
 * <p>Every request is counted exactly once: as a success, as a failure, or as a
 * failure when the caller cancels it mid-walk.
 */
@ApplicationScoped
public class FallbackOrchestrator implements EstimateUseCase {

    private static final Logger LOG = Logger.getLogger(FallbackOrchestrator.class);

    private final ProviderChain chain;
    private final ProviderSelectionPolicy policy;
    private final SelectionContextResolver contextResolver;
    private final LocalCache<RequestKey, CachedEstimate> cache;
    private final BaselineEstimator baseline;
    private final ReadingCalibrator calibrator;
    private final FallbackStatistics statistics;
    private final Metrics metrics;
    private final Clock clock;
    private final AttemptRunner attemptRunner;
    private final int keyPrecision;
    private final int raceWidth;

    @Inject
    public FallbackOrchestrator(
            ProviderChain chain,
            ProviderSelectionPolicy policy,
            SelectionContextResolver contextResolver,
            LocalCache<RequestKey, CachedEstimate> cache,
            BaselineEstimator baseline,
            ReadingCalibrator calibrator,
            FallbackStatistics statistics,
            Metrics metrics,
            Clock clock,
            FallbackConfig fallbackConfig,
            CacheConfig cacheConfig) {
        this.chain = chain;
        this.policy = policy;
        this.contextResolver = contextResolver;
        this.cache = cache;
        this.baseline = baseline;
        this.calibrator = calibrator;
        this.statistics = statistics;
        this.metrics = metrics;
        this.clock = clock;
        this.attemptRunner = new AttemptRunner(
                clock, metrics, fallbackConfig.backoff().initial(), fallbackConfig.backoff().max());
        this.keyPrecision = cacheConfig.keyPrecision();
        this.raceWidth = fallbackConfig.raceWidth();
    }

    @Override
    public Uni<EstimateResult> handle(EstimateRequest request) {
        return Uni.createFrom().deferred(() -> {
            final var startNanos = System.nanoTime();
            final var key = RequestKey.of(request, keyPrecision);
            final var counted = new AtomicBoolean();

            final var cached = cache.get(key);
            metrics.recordCacheLookup(cached.isPresent());
            if (cached.isPresent()) {
                return Uni.createFrom().item(answerFromCache(key, cached.get(), startNanos));
            }

            return contextResolver
                    .resolve(request)
                    .map(context -> policy.plan(chain.defaultOrder(), context, request.location()))
                    .flatMap(plan -> walk(request, key, plan, startNanos, counted))
                    .onFailure()
                    .invoke(failure -> countFailure(counted, "none", startNanos))
                    .onCancellation()
                    .invoke(() -> {
                        if (countFailure(counted, "cancelled", startNanos)) {
                            LOG.debugv("Request {0} cancelled by the caller", key);
                        }
                    });
        });
    }

    private boolean countFailure(AtomicBoolean counted, String source, long startNanos) {
        if (!counted.compareAndSet(false, true)) {
            return false;
        }
        final var latency = elapsedSince(startNanos);
        statistics.recordFailure(latency);
        metrics.recordRequest("failure", source, latency.toMillis());
        return true;
    }

    private EstimateResult answerFromCache(RequestKey key, CachedEstimate hit, long startNanos) {
        final var latency = elapsedSince(startNanos);
        statistics.recordCacheHit(latency);
        metrics.recordRequest("success", "cache", latency.toMillis());
        LOG.debugv("Answered {0} from cache ({1})", key, hit.providerName());
        return new EstimateResult(
                hit.estimate(), hit.providerName(), hit.fallbackLevel(), true, List.of(), "", latency);
    }

    private Uni<EstimateResult> walk(
            EstimateRequest request, RequestKey key, ProviderPlan plan, long startNanos, AtomicBoolean counted) {
        final var log = new AttemptLog();
        final var now = clock.instant();
        for (final var skipped : plan.excluded()) {
            final var name = skipped.provider().name();
            log.record(AttemptRecord.skipped(name, now, skipped.reason()));
            metrics.recordAttempt(name, AttemptOutcome.SKIPPED, 0);
            LOG.debugv("Skipping provider {0}: {1}", name, skipped.reason());
        }
        LOG.debugv("Provider order for {0}: {1} ({2})", key, plan.orderedNames(), plan.reason());

        final var ordered = plan.ordered().stream()
                .map(descriptor -> chain.link(descriptor.name()).orElseThrow())
                .toList();
        final var race = new ProviderRace(
                ordered, link -> attemptRunner.run(link, request, log, plan.timeoutFactor()), raceWidth);

        return race.run().map(win -> {
            if (win.isPresent()) {
                final var link = win.get().link();
                final var estimate = calibrator.calibrate(win.get().reading(), request);
                cache.put(key, new CachedEstimate(estimate, link.name(), link.level()));
                LOG.infov("Provider {0} answered at fallback level {1}", link.name(), link.level());
                return complete(estimate, link.name(), link.level(), "provider", log, plan, startNanos, counted);
            }

            final var reading = askBaseline(request, log);
            final var estimate = calibrator.calibrate(reading, request);
            LOG.infov("All providers failed for {0}, answered from baseline", key);
            return complete(
                    estimate,
                    BaselineEstimator.NAME,
                    chain.baselineLevel(),
                    "baseline",
                    log,
                    plan,
                    startNanos,
                    counted);
        });
    }

    private ProviderReading askBaseline(EstimateRequest request, AttemptLog log) {
        final var startedAt = clock.instant();
        final var startNanos = System.nanoTime();
        try {
            final var reading = baseline.estimate(request);
            if (reading == null) {
                throw new IllegalStateException("Baseline estimator returned no reading");
            }
            log.record(new AttemptRecord(
                    BaselineEstimator.NAME, 1, startedAt, AttemptOutcome.SUCCESS, elapsedSince(startNanos), ""));
            return reading;
        } catch (RuntimeException e) {
            final var latency = elapsedSince(startNanos);
            log.record(new AttemptRecord(
                    BaselineEstimator.NAME, 1, startedAt, AttemptOutcome.ERROR, latency, e.getMessage()));
            LOG.errorv(e, "Baseline estimator failed after every provider failed");
            throw new ChainExhaustedException("Every provider and the baseline estimator failed", e);
        }
    }

    private EstimateResult complete(
            NutrientEstimate estimate,
            String providerName,
            int level,
            String source,
            AttemptLog log,
            ProviderPlan plan,
            long startNanos,
            AtomicBoolean counted) {
        final var latency = elapsedSince(startNanos);
        final var result = new EstimateResult(
                estimate, providerName, level, false, log.seal(), plan.reason(), latency);
        if (counted.compareAndSet(false, true)) {
            statistics.recordSuccess(providerName, level, latency);
            metrics.recordRequest("success", source, latency.toMillis());
        }
        return result;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
