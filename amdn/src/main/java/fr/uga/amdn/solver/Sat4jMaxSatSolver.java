package fr.uga.amdn.solver;

import fr.uga.amdn.cnf.WeightedClause;
import fr.uga.amdn.cnf.WeightedCnf;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.sat4j.core.VecInt;
import org.sat4j.maxsat.WeightedMaxSatDecorator;
import org.sat4j.pb.PseudoOptDecorator;
import org.sat4j.pb.SolverFactory;
import org.sat4j.specs.ContradictionException;
import org.sat4j.specs.TimeoutException;

import java.math.BigInteger;

/**
 * Weighted MaxSAT with sat4j: the clauses go to a {@link WeightedMaxSatDecorator} over the default
 * pseudo-boolean solver, and better solutions are searched until none is left or the time limit, shared by the
 * whole search, runs out.
 */
public class Sat4jMaxSatSolver implements WeightedMaxSatSolver {

    private static final Logger LOGGER = LogManager.getLogger(Sat4jMaxSatSolver.class.getName());

    private final int timeoutSec;

    public Sat4jMaxSatSolver(int timeoutSec) {
        if (timeoutSec <= 0) {
            throw new IllegalArgumentException("The solver timeout must be positive, got " + timeoutSec);
        }
        this.timeoutSec = timeoutSec;
    }

    @Override
    public Assignment solve(WeightedCnf cnf) {
        long deadline = System.currentTimeMillis() + this.timeoutSec * 1000L;
        int nbVars = cnf.getVariableCount();
        if (nbVars == 0) {
            return new Assignment(new boolean[1], 0);
        }
        WeightedMaxSatDecorator solver = new WeightedMaxSatDecorator(SolverFactory.newDefault());
        solver.newVar(nbVars);
        solver.setExpectedNumberOfClauses(cnf.getClauses().size());

        LOGGER.debug("Adding {} soft and {} hard clauses over {} variables", cnf.countSoft(), cnf.countHard(), nbVars);
        try {
            for (WeightedClause clause : cnf.getClauses()) {
                if (clause.isHard()) {
                    solver.addHardClause(new VecInt(clause.getLiterals()));
                } else {
                    solver.addSoftClause(BigInteger.valueOf(clause.getWeight()), new VecInt(clause.getLiterals()));
                }
            }
        } catch (ContradictionException e) {
            throw new NoFeasibleModelException("The hard constraints contradict each other", e);
        }

        int[] model;
        try {
            model = cnf.countSoft() == 0 ? satisfy(solver, deadline) : optimize(new PseudoOptDecorator(solver), deadline);
        } catch (TimeoutException e) {
            throw new SolverTimeoutException("The solver did not converge within " + this.timeoutSec + " s", e);
        } catch (RuntimeException e) {
            throw new SolverException("The solver failed: " + e.getMessage(), e);
        }
        if (model == null) {
            throw new NoFeasibleModelException("No assignment satisfies the hard constraints");
        }
        Assignment assignment = Assignment.fromModel(model, nbVars, 0);
        long cost = cnf.cost(assignment.toArray());
        LOGGER.debug("Optimal assignment falsifies soft clauses of total weight {}", cost);
        return new Assignment(assignment.toArray(), cost);
    }

    private int[] satisfy(WeightedMaxSatDecorator solver, long deadline) throws TimeoutException {
        solver.setTimeoutMs(remaining(deadline));
        return solver.isSatisfiable() ? solver.model() : null;
    }

    // A sat4j timeout covers one call: each call gets the time left before the deadline
    private int[] optimize(PseudoOptDecorator problem, long deadline) throws TimeoutException {
        int[] best = null;
        try {
            problem.setTimeoutMs(remaining(deadline));
            while (problem.admitABetterSolution()) {
                best = problem.model();
                LOGGER.debug("Found a solution of cost {}", problem.getObjectiveValue());
                problem.discardCurrentSolution();
                problem.setTimeoutMs(remaining(deadline));
            }
        } catch (ContradictionException e) {
            // No better solution can exist, the last one is optimal
            LOGGER.debug("Optimum reached");
        }
        return best;
    }

    private static long remaining(long deadline) throws TimeoutException {
        long remaining = deadline - System.currentTimeMillis();
        if (remaining <= 0) {
            throw new TimeoutException("Time limit exhausted");
        }
        return remaining;
    }
}
