package io.objection.core;

/**
 * Objection protocol constants (field names and reserved path segments).
 *
 * <p>This module intentionally contains no transport bindings. It only models protocol-level concerns
 * shared by the dispatcher and generated renderer bindings.
 */
public final class Protocol {
    private Protocol() {}

    // Request fields
    public static final String F_SESSION_ID = "sessionId";
    public static final String F_EVENTS = "events";
    public static final String F_EVENT_PATH = "eventPath";

    // Action fields
    public static final String F_ACTION_PATH = "actionPath";
    public static final String F_DEBUG_SYMBOL = "debugSymbol";

    // Shared by events and actions
    public static final String F_KEY = "key";
    public static final String F_DATA = "data";

    /** First incoming segment that marks the session bootstrap (mount) event. */
    public static final String MOUNT_EVENT = "root_app_ready";

    /** Outgoing path that replaces the whole rendered tree. */
    public static final String ROOT_MOUNT = "root_mount";

    /** Outgoing path that surfaces a protocol or handler error to the renderer. */
    public static final String ROOT_ERROR = "root_error";

    /** Literal top-level scope every {@link Client} starts from. */
    public static final String ROOT_SCOPE = "main";
}
