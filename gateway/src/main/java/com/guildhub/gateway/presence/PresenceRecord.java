package com.guildhub.gateway.presence;

import com.guildhub.core.presence.PresenceStatus;
import lombok.Value;
import lombok.With;

/**
 * In-memory presence of one user.
 * <p>
 * {@code derivedStatus} follows occupancy ({@code online} while any connection is live, else
 * {@code offline}). {@code manualStatus} is the user's choice and survives disconnects.
 * {@code invisible} is true exactly when the manual status is {@code invisible}.
 * </p>
 */
@Value
@With
public class PresenceRecord {
    String userId;
    PresenceStatus derivedStatus;
    PresenceStatus manualStatus;
    boolean invisible;

    public static PresenceRecord initial(String userId) {
        return new PresenceRecord(userId, PresenceStatus.OFFLINE, PresenceStatus.ONLINE, false);
    }

    public PresenceRecord withManual(PresenceStatus status) {
        return withManualStatus(status).withInvisible(status == PresenceStatus.INVISIBLE);
    }

    public boolean isConnected() {
        return derivedStatus != PresenceStatus.OFFLINE;
    }

    /**
     * Status the user sees for themselves.
     */
    public PresenceStatus effectiveStatus() {
        return isConnected() ? manualStatus : PresenceStatus.OFFLINE;
    }
}
