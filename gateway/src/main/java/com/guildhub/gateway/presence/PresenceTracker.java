package com.guildhub.gateway.presence;

import com.guildhub.core.msg.Envelope;
import com.guildhub.core.msg.Ops;
import com.guildhub.core.msg.Payloads;
import com.guildhub.core.presence.PresenceStatus;
import com.guildhub.gateway.broadcast.IEventPublisher;
import com.guildhub.gateway.metrics.MetricsService;
import com.guildhub.gateway.registry.RegistryListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Tracks derived and manual presence per user and broadcasts changes.
 * <p>
 * Occupancy transitions arrive from the connection registry:
 * <ul>
 *   <li>First connection: {@code presence_update} with the user's manual status to everyone,
 *       unless the user is invisible.</li>
 *   <li>Last disconnect: {@code presence_update offline} to everyone. The manual status is kept
 *       for the next session.</li>
 *   <li>Manual change: everyone else gets the visible status, the user's own connections get the
 *       real one.</li>
 * </ul>
 * Registered callbacks run after the broadcast on a separate scheduler; a failing callback is
 * logged and never affects the transition or other callbacks.
 * </p>
 */
public class PresenceTracker implements RegistryListener {
    private static final Logger log = LoggerFactory.getLogger(PresenceTracker.class);

    private final IEventPublisher publisher;
    private final MetricsService metricsService;
    private final Scheduler callbackScheduler;

    private final Map<String, PresenceRecord> records = new ConcurrentHashMap<>();

    private final List<UserPresenceCallback> firstConnectCallbacks = new CopyOnWriteArrayList<>();
    private final List<UserPresenceCallback> disconnectCallbacks = new CopyOnWriteArrayList<>();
    private final List<ManualPresenceCallback> manualCallbacks = new CopyOnWriteArrayList<>();

    public PresenceTracker(IEventPublisher publisher, MetricsService metricsService) {
        this(publisher, metricsService, Schedulers.boundedElastic());
    }

    public PresenceTracker(IEventPublisher publisher, MetricsService metricsService, Scheduler callbackScheduler) {
        this.publisher = publisher;
        this.metricsService = metricsService;
        this.callbackScheduler = callbackScheduler;
    }

    public void onUserFirstConnect(UserPresenceCallback callback) {
        firstConnectCallbacks.add(callback);
    }

    public void onUserFullyDisconnected(UserPresenceCallback callback) {
        disconnectCallbacks.add(callback);
    }

    public void onManualPresenceChange(ManualPresenceCallback callback) {
        manualCallbacks.add(callback);
    }

    /**
     * Seeds the manual status from the stored preference before the user's connection is
     * registered. Ignored while the user already has live connections, since the in-memory status
     * is authoritative then.
     *
     * @param userId user identifier
     * @param stored stored manual status
     */
    public void restorePreference(String userId, PresenceStatus stored) {
        records.compute(userId, (id, current) -> {
            PresenceRecord record = current != null ? current : PresenceRecord.initial(id);
            if (record.isConnected()) {
                return record;
            }
            return record.withManual(stored);
        });
    }

    @Override
    public void onFirstConnection(String userId) {
        PresenceRecord record = records.compute(userId, (id, current) ->
            (current != null ? current : PresenceRecord.initial(id)).withDerivedStatus(PresenceStatus.ONLINE)
        );

        if (record.isInvisible()) {
            log.debug("User {} connected invisible, no presence broadcast", userId);
        } else {
            publisher.toAll(presence(userId, record.getManualStatus()));
            log.debug("User {} came online as {}", userId, record.getManualStatus().wireName());
        }

        for (UserPresenceCallback callback : firstConnectCallbacks) {
            dispatch("first-connect", userId, () -> callback.handle(userId));
        }
    }

    @Override
    public void onFullyDisconnected(String userId) {
        records.computeIfPresent(userId, (id, current) -> current.withDerivedStatus(PresenceStatus.OFFLINE));

        publisher.toAll(presence(userId, PresenceStatus.OFFLINE));
        log.debug("User {} went offline", userId);

        for (UserPresenceCallback callback : disconnectCallbacks) {
            dispatch("full-disconnect", userId, () -> callback.handle(userId));
        }
    }

    /**
     * Applies a status the user picked.
     *
     * @param userId user identifier
     * @param status manual status; {@code offline} is treated as {@code invisible}
     */
    public void setManualStatus(String userId, PresenceStatus status) {
        PresenceStatus manual = status == PresenceStatus.OFFLINE ? PresenceStatus.INVISIBLE : status;

        records.compute(userId, (id, current) ->
            (current != null ? current : PresenceRecord.initial(id)).withManual(manual)
        );

        publisher.toAllExcept(userId, presence(userId, manual.visible()));
        publisher.toUser(userId, presence(userId, manual));
        log.info("User {} set presence to {}", userId, manual.wireName());

        for (ManualPresenceCallback callback : manualCallbacks) {
            dispatch("manual-change", userId, () -> callback.handle(userId, manual));
        }
    }

    /**
     * Status the user sees for themselves.
     */
    public PresenceStatus statusOf(String userId) {
        PresenceRecord record = records.get(userId);
        return record == null ? PresenceStatus.OFFLINE : record.effectiveStatus();
    }

    public boolean isInvisible(String userId) {
        PresenceRecord record = records.get(userId);
        return record != null && record.isInvisible();
    }

    /**
     * Filters online users down to those others may see as online.
     *
     * @param onlineUserIds users with at least one live connection
     * @return users that are not invisible, sorted
     */
    public List<String> visibleOnline(Collection<String> onlineUserIds) {
        return onlineUserIds.stream()
            .filter(userId -> !isInvisible(userId))
            .sorted()
            .collect(Collectors.toList());
    }

    private static Envelope presence(String userId, PresenceStatus status) {
        return Envelope.of(Ops.PRESENCE_UPDATE, new Payloads.Presence(userId, status));
    }

    private void dispatch(String transition, String userId, CallbackInvocation invocation) {
        Mono.defer(invocation::invoke)
            .subscribeOn(callbackScheduler)
            .subscribe(
                null,
                err -> {
                    metricsService.recordPresenceCallbackFailure();
                    log.error("Presence {} callback failed for user {}", transition, userId, err);
                }
            );
    }

    @FunctionalInterface
    private interface CallbackInvocation {
        Mono<Void> invoke();
    }
}
