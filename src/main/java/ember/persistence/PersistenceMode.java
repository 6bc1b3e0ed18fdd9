package ember.persistence;

public enum PersistenceMode {
    /** Nothing is loaded or saved; state dies with the process. */
    NONE,
    /** Periodic full snapshots, loaded on startup. */
    SNAPSHOT,
    /** Every write command logged and replayed on startup. */
    APPEND_ONLY
}
