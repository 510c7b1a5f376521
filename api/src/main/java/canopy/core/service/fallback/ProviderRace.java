package canopy.core.service.fallback;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.subscription.Cancellable;
import io.smallrye.mutiny.subscription.UniEmitter;

import canopy.core.model.estimate.ProviderReading;

/**
 * Walks an ordered list of providers, keeping up to {@code width} of them in flight.
 *
 * <p>Providers are started in order as a sliding window over the list. A provider
 * that succeeds wins only once every provider ahead of it has failed, so when
 * several succeed the earliest in the order is always chosen. With a width of 1
 * the walk is strictly sequential.
 *
 * <p>When the race settles, every attempt still in flight is cancelled and its
 * result, should it still arrive, is ignored. Cancelling the returned {@link Uni}
 * cancels all in-flight attempts as well.
 *
 * <p>Single use: one instance per request.
 */
final class ProviderRace {

    /**
     * The winning provider and its reading.
     */
    record Win(ProviderChain.Link link, ProviderReading reading) {}

    private enum Status {
        PENDING,
        RUNNING,
        SUCCEEDED,
        FAILED
    }

    private final List<ProviderChain.Link> order;
    private final Function<ProviderChain.Link, Uni<ProviderReading>> attempt;
    private final int width;

    private final Status[] status;
    private final ProviderReading[] readings;
    private final Cancellable[] inFlight;
    private boolean settled;
    private UniEmitter<? super Optional<Win>> emitter;

    ProviderRace(
            List<ProviderChain.Link> order, Function<ProviderChain.Link, Uni<ProviderReading>> attempt, int width) {
        if (width < 1) {
            throw new IllegalArgumentException("width must be at least 1, got: " + width);
        }
        this.order = List.copyOf(order);
        this.attempt = attempt;
        this.width = width;
        this.status = new Status[this.order.size()];
        this.readings = new ProviderReading[this.order.size()];
        this.inFlight = new Cancellable[this.order.size()];
        Arrays.fill(status, Status.PENDING);
    }

    /**
     * Runs the race.
     *
     * @return the winner, or empty when every provider failed
     */
    Uni<Optional<Win>> run() {
        return Uni.createFrom().emitter(em -> {
            Runnable next;
            synchronized (this) {
                emitter = em;
                next = evaluate();
            }
            em.onTermination(this::cancelAll);
            next.run();
        });
    }

    private void onSuccess(int index, ProviderReading reading) {
        Runnable next;
        synchronized (this) {
            if (settled) {
                return;
            }
            status[index] = Status.SUCCEEDED;
            readings[index] = reading;
            inFlight[index] = null;
            next = evaluate();
        }
        next.run();
    }

    private void onFailure(int index) {
        Runnable next;
        synchronized (this) {
            if (settled) {
                return;
            }
            status[index] = Status.FAILED;
            inFlight[index] = null;
            next = evaluate();
        }
        next.run();
    }

    // Caller holds the lock. The returned action runs outside it.
    private Runnable evaluate() {
        var head = 0;
        while (head < order.size() && status[head] == Status.FAILED) {
            head++;
        }

        if (head == order.size()) {
            settled = true;
            final var done = emitter;
            return () -> done.complete(Optional.empty());
        }

        if (status[head] == Status.SUCCEEDED) {
            settled = true;
            final var losers = drainInFlight();
            final var win = new Win(order.get(head), readings[head]);
            final var done = emitter;
            return () -> {
                losers.forEach(Cancellable::cancel);
                done.complete(Optional.of(win));
            };
        }

        final var toLaunch = new ArrayList<Integer>();
        final var end = Math.min(order.size(), head + width);
        for (var i = head; i < end; i++) {
            if (status[i] == Status.PENDING) {
                status[i] = Status.RUNNING;
                toLaunch.add(i);
            }
        }
        return () -> toLaunch.forEach(this::launch);
    }

    private void launch(int index) {
        synchronized (this) {
            if (settled) {
                return;
            }
        }
        final var cancellable = attempt.apply(order.get(index))
                .subscribe()
                .with(reading -> onSuccess(index, reading), failure -> onFailure(index));

        var cancelNow = false;
        synchronized (this) {
            if (settled) {
                cancelNow = true;
            } else if (status[index] == Status.RUNNING) {
                inFlight[index] = cancellable;
            }
        }
        if (cancelNow) {
            cancellable.cancel();
        }
    }

    private void cancelAll() {
        List<Cancellable> pending;
        synchronized (this) {
            settled = true;
            pending = drainInFlight();
        }
        pending.forEach(Cancellable::cancel);
    }

    private List<Cancellable> drainInFlight() {
        final var drained = new ArrayList<Cancellable>();
        for (var i = 0; i < inFlight.length; i++) {
            if (inFlight[i] != null) {
                drained.add(inFlight[i]);
                inFlight[i] = null;
            }
        }
        return drained;
    }
}
