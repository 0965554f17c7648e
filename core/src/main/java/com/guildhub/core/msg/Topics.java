package com.guildhub.core.msg;

public final class Topics {
    private Topics() {
    }

    /**
     * Domain events to fan out (PublishRequest messages).
     * Published by domain services, consumed by every gateway node.
     */
    public static final String HUB_EVENTS = "hub.events";
}
