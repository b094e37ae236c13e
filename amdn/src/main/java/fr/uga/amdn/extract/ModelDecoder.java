package fr.uga.amdn.extract;

import fr.uga.amdn.model.LearnedAction;
import fr.uga.amdn.model.Model;
import fr.uga.amdn.observation.ObservationLists;
import fr.uga.amdn.solver.Assignment;
import fr.uga.amdn.trace.Action;
import fr.uga.amdn.trace.Fluent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads a model off a solver assignment. The assignment is taken as it is: among several optimal assignments the
 * one the solver returned wins, and a decision variable it did not report is false.
 */
public class ModelDecoder {

    private static final Logger LOGGER = LogManager.getLogger(ModelDecoder.class.getName());

    public Model decode(Assignment assignment, DecodeTable table, ObservationLists observations) {
        List<LearnedAction> actions = new ArrayList<>();
        for (Action action : observations.getActions()) {
            List<Fluent> precond = new ArrayList<>();
            List<Fluent> add = new ArrayList<>();
            List<Fluent> delete = new ArrayList<>();
            for (Fluent fluent : observations.getPropositions()) {
                if (holds(assignment, table, fluent, action, Role.PRECONDITION)) {
                    precond.add(fluent);
                }
                if (holds(assignment, table, fluent, action, Role.ADD)) {
                    add.add(fluent);
                }
                if (holds(assignment, table, fluent, action, Role.DELETE)) {
                    delete.add(fluent);
                }
            }
            actions.add(new LearnedAction(action, precond, add, delete));
        }
        LOGGER.debug("Decoded {} actions over {} fluents", actions.size(), observations.getPropositions().size());
        return new Model(observations.getPropositions(), actions);
    }

    private static boolean holds(Assignment assignment, DecodeTable table, Fluent fluent, Action action, Role role) {
        return assignment.isTrue(table.variableOf(new DecisionLiteral(fluent, action, role)));
    }
}
