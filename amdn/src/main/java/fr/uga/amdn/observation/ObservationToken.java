package fr.uga.amdn.observation;

/**
 * The kind of observation a trace was tokenized with.
 */
public enum ObservationToken {
    IDENTITY,
    PARTIAL,
    NOISY,
    NOISY_PARTIAL,
    ACTION_ONLY,
    NOISY_PARTIAL_DISORDERED_PARALLEL
}
