package com.guildhub.gateway.liveness;

import com.guildhub.gateway.metrics.MetricsService;
import com.guildhub.gateway.registry.CloseCodes;
import com.guildhub.gateway.registry.Connection;
import com.guildhub.gateway.registry.ConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Evicts connections that stop sending heartbeats.
 * <p>
 * A connection's deadline is its last heartbeat (or its connect time, if none arrived yet) plus
 * the grace period. A periodic sweep closes every connection past its deadline with
 * {@link CloseCodes#HEARTBEAT_TIMEOUT} and removes it from the registry, which in turn drives the
 * presence transition if it was the user's last connection.
 * </p>
 */
public class LivenessSupervisor {
    private static final Logger log = LoggerFactory.getLogger(LivenessSupervisor.class);

    private final ConnectionRegistry registry;
    private final MetricsService metricsService;
    private final Clock clock;
    private final Duration grace;
    private final Duration sweepInterval;

    private Disposable sweepTask;

    public LivenessSupervisor(ConnectionRegistry registry, MetricsService metricsService, Clock clock,
                              Duration grace, Duration sweepInterval) {
        this.registry = registry;
        this.metricsService = metricsService;
        this.clock = clock;
        this.grace = grace;
        this.sweepInterval = sweepInterval;
    }

    public void start() {
        log.info("Liveness supervisor started (grace={}s, sweep every {}s)",
            grace.toSeconds(), sweepInterval.toSeconds());

        sweepTask = Flux.interval(sweepInterval, sweepInterval, Schedulers.parallel())
            .concatMap(tick -> sweep()
                .onErrorResume(err -> {
                    log.error("Liveness sweep failed", err);
                    return Mono.just(0);
                }))
            .subscribe();
    }

    /**
     * Records a heartbeat from the connection.
     *
     * @param connection connection that sent {@code heartbeat}
     */
    public void onHeartbeat(Connection connection) {
        connection.touch(clock.millis());
    }

    /**
     * Closes and removes every connection past its deadline.
     *
     * @return number of connections evicted
     */
    public Mono<Integer> sweep() {
        return Mono.defer(() -> {
            long now = clock.millis();
            long graceMillis = grace.toMillis();

            List<Connection> expired = new ArrayList<>();
            for (Connection connection : registry.allConnections()) {
                if (now - connection.getLastHeartbeatMillis() > graceMillis) {
                    expired.add(connection);
                }
            }

            if (expired.isEmpty()) {
                return Mono.just(0);
            }

            return Flux.fromIterable(expired)
                .concatMap(connection -> {
                    log.warn("Connection {} of user {} missed heartbeats for {} ms, evicting",
                        connection.getId(), connection.getUserId(), now - connection.getLastHeartbeatMillis());
                    metricsService.recordForcedClose("liveness_timeout");
                    connection.close(CloseCodes.HEARTBEAT_TIMEOUT, "heartbeat timeout");
                    return registry.remove(connection);
                })
                .filter(Boolean::booleanValue)
                .count()
                .map(Long::intValue);
        });
    }

    public void stop() {
        if (sweepTask != null) {
            sweepTask.dispose();
        }
        log.info("Liveness supervisor stopped");
    }
}
