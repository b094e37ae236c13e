package fr.uga.amdn.extract;

import fr.uga.amdn.cnf.WeightedCnf;
import fr.uga.amdn.formula.ConstraintSet;

/**
 * The output of the encoding step: the weighted CNF handed to the solver, the table decoding its variables, and
 * the merged constraints it was produced from.
 */
public final class EncodedProblem {

    private final WeightedCnf cnf;
    private final DecodeTable decodeTable;
    private final ConstraintSet constraints;

    public EncodedProblem(WeightedCnf cnf, DecodeTable decodeTable, ConstraintSet constraints) {
        this.cnf = cnf;
        this.decodeTable = decodeTable;
        this.constraints = constraints;
    }

    public WeightedCnf getCnf() {
        return this.cnf;
    }

    public DecodeTable getDecodeTable() {
        return this.decodeTable;
    }

    public ConstraintSet getConstraints() {
        return this.constraints;
    }
}
