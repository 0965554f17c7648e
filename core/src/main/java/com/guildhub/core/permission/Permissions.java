package com.guildhub.core.permission;

/**
 * Permission bits carried by roles and channel overrides.
 * <p>
 * Bit values are part of the public API: clients and the REST layer exchange them as plain
 * integers, so existing values must never be renumbered.
 * </p>
 */
public final class Permissions {
    private Permissions() {
    }

    public static final long MANAGE_CHANNELS = 1L;
    public static final long MANAGE_ROLES = 1L << 1;
    public static final long KICK_MEMBERS = 1L << 2;
    public static final long BAN_MEMBERS = 1L << 3;
    public static final long MANAGE_MESSAGES = 1L << 4;
    public static final long SEND_MESSAGES = 1L << 5;
    public static final long CONNECT_VOICE = 1L << 6;
    public static final long SPEAK = 1L << 7;
    public static final long STREAM = 1L << 8;

    /**
     * Grants every permission and bypasses channel overrides entirely.
     */
    public static final long ADMINISTRATOR = 1L << 9;
    public static final long MANAGE_INVITES = 1L << 10;
    public static final long READ_MESSAGES = 1L << 11;
    public static final long VIEW_CHANNEL = 1L << 12;

    /**
     * Every defined permission bit.
     */
    public static final long ALL = (1L << 13) - 1;

    /**
     * Bits a channel override may grant or deny. Anything outside this set is server-wide only.
     */
    public static final long CHANNEL_OVERRIDABLE = SEND_MESSAGES | READ_MESSAGES | MANAGE_MESSAGES
        | CONNECT_VOICE | SPEAK | STREAM | VIEW_CHANNEL;

    /**
     * Checks a single permission, treating the administrator bit as granting everything.
     *
     * @param permissions effective permission mask
     * @param permission  bit to check
     * @return true if granted
     */
    public static boolean has(long permissions, long permission) {
        if ((permissions & ADMINISTRATOR) != 0) {
            return true;
        }
        return (permissions & permission) != 0;
    }
}
