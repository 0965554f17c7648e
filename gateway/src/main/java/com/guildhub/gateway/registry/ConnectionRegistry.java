package com.guildhub.gateway.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Authoritative set of live connections on this node, indexed by user and by server.
 * <p>
 * Mutations are serialized on a single-threaded scheduler, so per-user occupancy transitions are
 * detected without races: the first add for a user fires
 * {@link RegistryListener#onFirstConnection(String)} and the removal of the last connection fires
 * {@link RegistryListener#onFullyDisconnected(String)}, each exactly once per transition.
 * </p>
 * <p>
 * The write lock is held only while the indexes change. Listeners run after it is released. Reads
 * take the read lock and return copies, so callers may iterate without holding anything.
 * </p>
 */
public class ConnectionRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Scheduler mutationScheduler;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<RegistryListener> listeners = new CopyOnWriteArrayList<>();

    // Written only on the mutation scheduler
    private volatile boolean admissionClosed;

    // Guarded by lock
    private final Map<String, Connection> byId = new HashMap<>();
    private final Map<String, Set<Connection>> byUser = new HashMap<>();
    private final Map<String, Set<Connection>> byServer = new HashMap<>();

    public ConnectionRegistry() {
        this(Schedulers.newSingle("hub-registry"));
    }

    public ConnectionRegistry(Scheduler mutationScheduler) {
        this.mutationScheduler = mutationScheduler;
    }

    public void addListener(RegistryListener listener) {
        listeners.add(listener);
    }

    /**
     * Admits a connection. A connection closed before this runs is not admitted, and nothing is
     * admitted once {@link #closeAdmission()} has run.
     *
     * @param connection connection to admit
     * @return true if the connection is now live
     */
    public Mono<Boolean> add(Connection connection) {
        return Mono.fromCallable(() -> doAdd(connection)).subscribeOn(mutationScheduler);
    }

    /**
     * Removes a connection and closes its outbound stream. Idempotent.
     *
     * @param connection connection to remove
     * @return true if this call removed it
     */
    public Mono<Boolean> remove(Connection connection) {
        return Mono.fromCallable(() -> doRemove(connection)).subscribeOn(mutationScheduler);
    }

    /**
     * Stops admitting connections and returns the live ones at that instant. Every later
     * {@link #add(Connection)} returns false, so the snapshot is final.
     *
     * @return connections live when admission closed
     */
    public Mono<List<Connection>> closeAdmission() {
        return Mono.fromCallable(() -> {
            admissionClosed = true;
            return allConnections();
        }).subscribeOn(mutationScheduler);
    }

    public boolean isAdmissionClosed() {
        return admissionClosed;
    }

    private boolean doAdd(Connection connection) {
        if (connection.isClosed()) {
            log.debug("Connection {} closed before registration, not admitting", connection.getId());
            return false;
        }
        if (admissionClosed) {
            log.info("Admission closed, refusing connection {} of user {}", connection.getId(), connection.getUserId());
            return false;
        }

        boolean first;
        lock.writeLock().lock();
        try {
            if (byId.putIfAbsent(connection.getId(), connection) != null) {
                return false;
            }
            Set<Connection> own = byUser.computeIfAbsent(connection.getUserId(), k -> new LinkedHashSet<>());
            first = own.isEmpty();
            own.add(connection);
            for (String serverId : connection.getServerIds()) {
                byServer.computeIfAbsent(serverId, k -> new LinkedHashSet<>()).add(connection);
            }
        } finally {
            lock.writeLock().unlock();
        }

        log.info("Connection {} registered for user {} (servers={})",
            connection.getId(), connection.getUserId(), connection.getServerIds().size());

        if (first) {
            for (RegistryListener listener : listeners) {
                notify(() -> listener.onFirstConnection(connection.getUserId()), "first-connection", connection);
            }
        }
        return true;
    }

    private boolean doRemove(Connection connection) {
        // No frame is accepted once removal has begun
        connection.markClosed();

        boolean last;
        lock.writeLock().lock();
        try {
            if (byId.remove(connection.getId()) == null) {
                return false;
            }
            Set<Connection> own = byUser.get(connection.getUserId());
            own.remove(connection);
            last = own.isEmpty();
            if (last) {
                byUser.remove(connection.getUserId());
            }
            for (String serverId : connection.getServerIds()) {
                Set<Connection> members = byServer.get(serverId);
                if (members != null) {
                    members.remove(connection);
                    if (members.isEmpty()) {
                        byServer.remove(serverId);
                    }
                }
            }
        } finally {
            lock.writeLock().unlock();
        }

        log.info("Connection {} removed for user {}", connection.getId(), connection.getUserId());

        if (last) {
            for (RegistryListener listener : listeners) {
                notify(() -> listener.onFullyDisconnected(connection.getUserId()), "full-disconnect", connection);
            }
        }
        return true;
    }

    private void notify(Runnable action, String transition, Connection connection) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.error("Registry listener failed on {} for user {}", transition, connection.getUserId(), e);
        }
    }

    /**
     * Live connections of one user.
     */
    public Set<Connection> connectionsOf(String userId) {
        lock.readLock().lock();
        try {
            Set<Connection> own = byUser.get(userId);
            return own == null ? Set.of() : new LinkedHashSet<>(own);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Live connections whose captured membership includes the server.
     */
    public Set<Connection> connectionsInServer(String serverId) {
        lock.readLock().lock();
        try {
            Set<Connection> members = byServer.get(serverId);
            return members == null ? Set.of() : new LinkedHashSet<>(members);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Connection> allConnections() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(byId.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Users with at least one live connection, regardless of invisibility.
     */
    public Set<String> onlineUserIds() {
        lock.readLock().lock();
        try {
            return new HashSet<>(byUser.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> usersInServer(String serverId) {
        Set<String> userIds = new LinkedHashSet<>();
        for (Connection connection : connectionsInServer(serverId)) {
            userIds.add(connection.getUserId());
        }
        return userIds;
    }

    public boolean isOnline(String userId) {
        lock.readLock().lock();
        try {
            return byUser.containsKey(userId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Connection> find(String connectionId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(byId.get(connectionId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return byId.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int onlineUserCount() {
        lock.readLock().lock();
        try {
            return byUser.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void dispose() {
        mutationScheduler.dispose();
    }
}
