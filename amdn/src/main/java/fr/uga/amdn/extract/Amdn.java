package fr.uga.amdn.extract;

import fr.uga.amdn.formula.ConstraintSet;
import fr.uga.amdn.formula.FormulaArena;
import fr.uga.amdn.model.Model;
import fr.uga.amdn.observation.ObservationLists;
import fr.uga.amdn.observation.ObservationToken;
import fr.uga.amdn.solver.Assignment;
import fr.uga.amdn.solver.Sat4jMaxSatSolver;
import fr.uga.amdn.solver.WeightedMaxSatSolver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Learns an action model from noisy, partial, disordered and parallel observations.
 *
 * <p>Disorder, parallel and noise constraints are built from the traces, merged in that order, encoded into a
 * weighted CNF problem, solved with a weighted MaxSAT solver, and the optimal assignment is decoded into a
 * model.</p>
 */
public class Amdn implements Extractor {

    private static final Logger LOGGER = LogManager.getLogger(Amdn.class.getName());

    public static final String TECHNIQUE = "AMDN";

    private final ExtractionSettings settings;
    private final WeightedMaxSatSolver solver;

    public Amdn(ExtractionSettings settings) {
        this(settings, new Sat4jMaxSatSolver(settings.getTimeoutSec()));
    }

    public Amdn(ExtractionSettings settings, WeightedMaxSatSolver solver) {
        this.settings = settings;
        this.solver = solver;
    }

    @Override
    public Model extract(ObservationLists observations) {
        return solve(encode(observations), observations);
    }

    /**
     * Solves an encoded problem and decodes the optimal assignment.
     */
    public Model solve(EncodedProblem problem, ObservationLists observations) {
        LOGGER.info("Solving {} clauses over {} variables", problem.getCnf().getClauses().size(),
            problem.getCnf().getVariableCount());
        Assignment assignment = this.solver.solve(problem.getCnf());
        Model model = new ModelDecoder().decode(assignment, problem.getDecodeTable(), observations);
        LOGGER.info("Extracted a model of {} actions, soft cost {}", model.getActions().size(), assignment.getCost());
        return model;
    }

    /**
     * Builds and encodes the constraints without solving them.
     */
    public EncodedProblem encode(ObservationLists observations) {
        check(observations);
        LiteralFactory literals = new LiteralFactory(new FormulaArena(), observations.getPropositions(),
            observations.getActions());
        ConstraintSet constraints = buildConstraints(createBuilders(literals), observations);
        LOGGER.info("Built {} constraints from {} traces ({})", constraints.size(), observations.size(),
            this.settings);
        return new WcnfEncoder(literals, this.settings.getWeightScale()).encode(constraints);
    }

    static void check(ObservationLists observations) {
        if (observations.getToken() != ObservationToken.NOISY_PARTIAL_DISORDERED_PARALLEL) {
            throw new IncompatibleObservationTokenException(observations.getToken(), TECHNIQUE);
        }
        if (observations.isEmpty()) {
            throw new EmptyObservationException();
        }
    }

    /**
     * The builders, in merge order.
     */
    protected List<ConstraintBuilder> createBuilders(LiteralFactory literals) {
        return Arrays.asList(
            new DisorderConstraintBuilder(literals),
            new ParallelConstraintBuilder(literals),
            new NoiseConstraintBuilder(literals, this.settings.getOccurrenceThreshold()));
    }

    private ConstraintSet buildConstraints(List<ConstraintBuilder> builders, ObservationLists observations) {
        List<ConstraintSet> sets = new ArrayList<>();
        if (!this.settings.isParallelBuild()) {
            for (ConstraintBuilder builder : builders) {
                sets.add(builder.build(observations));
            }
            return ConstraintSet.mergeAll(sets);
        }
        List<CompletableFuture<ConstraintSet>> futures = new ArrayList<>();
        for (ConstraintBuilder builder : builders) {
            futures.add(CompletableFuture.supplyAsync(() -> builder.build(observations)));
        }
        try {
            // Merge in builder order, whatever order they finish in
            for (CompletableFuture<ConstraintSet> future : futures) {
                sets.add(future.join());
            }
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
        return ConstraintSet.mergeAll(sets);
    }
}
