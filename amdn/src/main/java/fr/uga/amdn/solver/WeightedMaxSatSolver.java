package fr.uga.amdn.solver;

import fr.uga.amdn.cnf.WeightedCnf;

/**
 * A weighted MaxSAT engine: finds an assignment satisfying every hard clause and maximizing the weight of the
 * satisfied soft clauses.
 */
public interface WeightedMaxSatSolver {

    /**
     * @throws NoFeasibleModelException if the hard clauses are unsatisfiable
     * @throws SolverTimeoutException if no optimum was proven within the time limit
     * @throws SolverException on any other failure
     */
    Assignment solve(WeightedCnf cnf);
}
