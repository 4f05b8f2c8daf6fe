package gr.core.model;

public enum Decision {
    /** Cost fits in the bucket right now. */
    ALLOW,
    /** Cost fits in the bucket's capacity but not in its current tokens. */
    REJECT,
    /** Cost exceeds capacity; no amount of waiting helps. */
    UNSATISFIABLE
}
