package fr.uga.amdn.extract;

import fr.uga.amdn.cnf.TseitinTransformer;
import fr.uga.amdn.cnf.WeightedCnf;
import fr.uga.amdn.formula.ConstraintSet;
import fr.uga.amdn.formula.FormulaArena;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns merged constraints into a weighted CNF problem.
 *
 * <p>Decision literals are numbered first, in grid order, auxiliary variables after them. A soft formula that is a
 * clause becomes a soft clause. Any other soft formula is replaced by the auxiliary variable standing for it: the
 * clauses defining that variable are hard and the variable becomes a soft unit clause with the formula's weight.
 * Real weights are multiplied by the weight scale and rounded. When the smallest soft weight would then fall below
 * {@link #MIN_SCALED_WEIGHT}, the factor is raised until it does not, so that small weights keep their ratios.</p>
 */
public class WcnfEncoder {

    private static final Logger LOGGER = LogManager.getLogger(WcnfEncoder.class.getName());

    public static final double MIN_SCALED_WEIGHT = 100.0;

    private final LiteralFactory literals;
    private final double weightScale;

    public WcnfEncoder(LiteralFactory literals, double weightScale) {
        if (!(weightScale > 0.0) || Double.isInfinite(weightScale)) {
            throw new IllegalArgumentException("The weight scale must be strictly positive, got " + weightScale);
        }
        this.literals = literals;
        this.weightScale = weightScale;
    }

    public EncodedProblem encode(ConstraintSet constraints) {
        FormulaArena arena = this.literals.getArena();

        Map<Integer, Integer> numbers = new HashMap<>();
        Map<Integer, DecisionLiteral> decode = new HashMap<>();
        int variable = 1;
        for (DecisionLiteral literal : this.literals.getGrid()) {
            numbers.put(this.literals.literal(literal.getFluent(), literal.getAction(), literal.getRole()), variable);
            decode.put(variable, literal);
            variable++;
        }

        TseitinTransformer tseitin = new TseitinTransformer(arena, numbers);
        WeightedCnf.Builder cnf = new WeightedCnf.Builder().variableCount(numbers.size());

        Map<Integer, Double> softFormulas = constraints.softFormulas();
        double factor = scaleFactor(softFormulas.values());
        for (Map.Entry<Integer, Double> soft : softFormulas.entrySet()) {
            int formula = soft.getKey();
            long weight = scale(soft.getValue(), factor);
            if (arena.isClause(formula)) {
                cnf.addSoft(weight, tseitin.clauseOf(formula));
            } else {
                int root = tseitin.define(formula);
                for (int[] definition : tseitin.drainDefinitions()) {
                    cnf.addHard(definition);
                }
                cnf.addSoft(weight, root);
            }
        }

        for (int formula : constraints.hardFormulas()) {
            List<int[]> direct = tseitin.directClauses(formula);
            if (direct != null) {
                for (int[] clause : direct) {
                    cnf.addHard(clause);
                }
            } else {
                int root = tseitin.define(formula);
                for (int[] definition : tseitin.drainDefinitions()) {
                    cnf.addHard(definition);
                }
                cnf.addHard(root);
            }
        }

        WeightedCnf problem = cnf.variableCount(tseitin.getVariableCount()).build();
        LOGGER.debug("Encoded {} constraints into {} soft and {} hard clauses over {} variables ({} auxiliary), "
                + "hard weight {}", constraints.size(), problem.countSoft(), problem.countHard(),
            problem.getVariableCount(), tseitin.getAuxiliaryCount(), problem.getHardWeight());
        return new EncodedProblem(problem, new DecodeTable(decode), constraints);
    }

    /**
     * The configured weight scale, raised if needed so that the smallest weight scales to at least
     * {@link #MIN_SCALED_WEIGHT}.
     */
    double scaleFactor(Collection<Double> weights) {
        double smallest = Double.POSITIVE_INFINITY;
        for (double weight : weights) {
            smallest = Math.min(smallest, weight);
        }
        if (weights.isEmpty() || smallest * this.weightScale >= MIN_SCALED_WEIGHT) {
            return this.weightScale;
        }
        double factor = MIN_SCALED_WEIGHT / smallest;
        LOGGER.debug("Smallest soft weight {} raises the weight scale from {} to {}", smallest, this.weightScale,
            factor);
        return factor;
    }

    static long scale(double weight, double factor) {
        double scaled = weight * factor;
        if (scaled >= Long.MAX_VALUE) {
            throw new IllegalArgumentException("Weight " + weight + " overflows once scaled by " + factor);
        }
        return Math.max(1L, Math.round(scaled));
    }
}
