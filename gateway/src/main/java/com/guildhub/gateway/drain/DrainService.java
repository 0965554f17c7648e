package com.guildhub.gateway.drain;

import com.guildhub.gateway.metrics.MetricsService;
import com.guildhub.gateway.registry.CloseCodes;
import com.guildhub.gateway.registry.ConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Takes the node out of service: new upgrades are refused and every live connection is closed
 * with {@link CloseCodes#GOING_AWAY} so clients reconnect elsewhere.
 * <p>
 * Upgrades already past the draining check when the drain starts are refused by the registry,
 * which stops admission in the same serialized step that takes the snapshot.
 * </p>
 */
public class DrainService {
    private static final Logger log = LoggerFactory.getLogger(DrainService.class);

    private final ConnectionRegistry registry;
    private final MetricsService metricsService;
    private final Duration drainTimeout;
    private final AtomicBoolean isDraining = new AtomicBoolean(false);
    private final AtomicBoolean isDrainComplete = new AtomicBoolean(false);

    public DrainService(ConnectionRegistry registry, MetricsService metricsService, Duration drainTimeout) {
        this.registry = registry;
        this.metricsService = metricsService;
        this.drainTimeout = drainTimeout;
    }

    /**
     * Starts draining. Later calls return immediately.
     *
     * @return Mono completing when every connection present at the start has been closed
     */
    public Mono<Void> startDrain() {
        if (!isDraining.compareAndSet(false, true)) {
            log.warn("Drain already in progress");
            return Mono.empty();
        }

        return registry.closeAdmission()
            .doOnNext(snapshot -> log.warn("Drain mode activated, closing {} connection(s)", snapshot.size()))
            .flatMapMany(Flux::fromIterable)
            .concatMap(connection -> {
                metricsService.recordForcedClose("drain");
                connection.close(CloseCodes.GOING_AWAY, "server shutting down");
                return registry.remove(connection);
            })
            .filter(Boolean::booleanValue)
            .count()
            .timeout(drainTimeout)
            .doOnSuccess(closed -> {
                isDrainComplete.set(true);
                log.info("Drain complete, {} connection(s) closed", closed);
            })
            .doOnError(err -> log.error("Drain did not finish within {}s, {} connection(s) remain",
                drainTimeout.toSeconds(), registry.size(), err))
            .then();
    }

    public boolean isDraining() {
        return isDraining.get();
    }

    public boolean isDrainComplete() {
        return isDrainComplete.get();
    }

    public int getRemainingConnections() {
        return registry.size();
    }
}
