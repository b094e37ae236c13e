package fr.uga.amdn.extract;

/**
 * The available model extraction techniques.
 */
public enum ExtractionMode {
    AMDN
}
