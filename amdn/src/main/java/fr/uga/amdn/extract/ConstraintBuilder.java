package fr.uga.amdn.extract;

import fr.uga.amdn.formula.ConstraintSet;
import fr.uga.amdn.observation.ObservationLists;

/**
 * Derives weighted constraints from the observations. Implementations only read the observations, so several
 * builders can run at the same time.
 */
public interface ConstraintBuilder {

    ConstraintSet build(ObservationLists observations);
}
