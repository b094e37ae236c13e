package fr.uga.amdn.formula;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Insertion-ordered association of formulas (arena ids) to weights.
 *
 * <p>The first weight registered for a formula is kept: later registrations of the same formula, from the same
 * builder or from a merged set, are ignored.</p>
 */
public final class ConstraintSet {

    private static final Logger LOGGER = LogManager.getLogger(ConstraintSet.class.getName());

    private final Map<Integer, Weight> constraints = new LinkedHashMap<>();

    /**
     * Registers a constraint unless the formula is already present.
     *
     * @return true if the constraint was added
     */
    public boolean add(int formula, Weight weight) {
        Weight existing = this.constraints.putIfAbsent(formula, weight);
        if (existing == null) {
            return true;
        }
        if (!existing.equals(weight) && LOGGER.isDebugEnabled()) {
            LOGGER.debug("Formula #{} already weighted {}, ignoring weight {}", formula, existing, weight);
        }
        return false;
    }

    /**
     * Registers a soft constraint. A weight that is not strictly positive contributes nothing and is skipped.
     */
    public boolean addSoft(int formula, double weight) {
        if (!(weight > 0.0)) {
            return false;
        }
        return add(formula, Weight.soft(weight));
    }

    public boolean addHard(int formula) {
        return add(formula, Weight.HARD);
    }

    /**
     * Adds every constraint of {@code other}, in its order, after the constraints of this set.
     */
    public ConstraintSet merge(ConstraintSet other) {
        for (Map.Entry<Integer, Weight> entry : other.constraints.entrySet()) {
            add(entry.getKey(), entry.getValue());
        }
        return this;
    }

    public static ConstraintSet mergeAll(List<ConstraintSet> sets) {
        ConstraintSet merged = new ConstraintSet();
        for (ConstraintSet set : sets) {
            merged.merge(set);
        }
        return merged;
    }

    public Weight weightOf(int formula) {
        return this.constraints.get(formula);
    }

    public boolean contains(int formula) {
        return this.constraints.containsKey(formula);
    }

    public List<Integer> hardFormulas() {
        List<Integer> hard = new ArrayList<>();
        for (Map.Entry<Integer, Weight> entry : this.constraints.entrySet()) {
            if (entry.getValue().isHard()) {
                hard.add(entry.getKey());
            }
        }
        return hard;
    }

    public Map<Integer, Double> softFormulas() {
        Map<Integer, Double> soft = new LinkedHashMap<>();
        for (Map.Entry<Integer, Weight> entry : this.constraints.entrySet()) {
            if (!entry.getValue().isHard()) {
                soft.put(entry.getKey(), entry.getValue().getValue());
            }
        }
        return soft;
    }

    public Map<Integer, Weight> asMap() {
        return Collections.unmodifiableMap(this.constraints);
    }

    public int size() {
        return this.constraints.size();
    }

    public boolean isEmpty() {
        return this.constraints.isEmpty();
    }
}
