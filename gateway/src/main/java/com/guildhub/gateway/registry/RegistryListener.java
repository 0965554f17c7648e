package com.guildhub.gateway.registry;

/**
 * Receives per-user occupancy transitions detected by the {@link ConnectionRegistry}.
 * <p>
 * Invoked on the registry's mutation thread; implementations must not block.
 * </p>
 */
public interface RegistryListener {

    /**
     * The user went from zero to one live connection.
     */
    void onFirstConnection(String userId);

    /**
     * The user's last live connection was removed.
     */
    void onFullyDisconnected(String userId);
}
