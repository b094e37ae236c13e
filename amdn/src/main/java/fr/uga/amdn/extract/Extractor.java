package fr.uga.amdn.extract;

import fr.uga.amdn.model.Model;
import fr.uga.amdn.observation.ObservationLists;

/**
 * A model extraction technique.
 */
public interface Extractor {

    Model extract(ObservationLists observations);
}
