package fr.uga.amdn.extract;

import fr.uga.amdn.model.Model;
import fr.uga.amdn.observation.ObservationLists;

/**
 * Extracts a model with the technique selected by an {@link ExtractionMode}.
 */
public final class Extract {

    private Extract() {
    }

    public static Model extract(ObservationLists observations, ExtractionMode mode, ExtractionSettings settings) {
        if (observations.isEmpty()) {
            throw new EmptyObservationException();
        }
        return extractor(mode, settings).extract(observations);
    }

    public static Extractor extractor(ExtractionMode mode, ExtractionSettings settings) {
        switch (mode) {
            case AMDN:
                return new Amdn(settings);
            default:
                throw new IllegalArgumentException("Unsupported extraction mode " + mode);
        }
    }
}
