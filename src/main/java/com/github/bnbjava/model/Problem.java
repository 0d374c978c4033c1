package com.github.bnbjava.model;

/**
 * <p>
 * A discrete optimisation problem instance: integer variables <code>0..size()-1</code>, each with an ordered domain
 * of candidate values, a feasibility test and an objective.
 * </p><p>
 * Implementations must be immutable, and pure with respect to a given {@link Assignment}, so that bounds and
 * branching decisions are reproducible and may be evaluated from several threads at once.
 * </p>
 */
public interface Problem {
    /**
     * @return the number of decision variables
     */
    int size();

    /**
     * The root domain of a variable. The order of the values is the order in which branching strategies explore them.
     *
     * @param variable a variable index
     * @return the ordered candidate values; may be empty, in which case the problem is infeasible
     */
    int[] domain(int variable);

    /**
     * @return whether the objective is minimized or maximized
     */
    Sense sense();

    /**
     * Test a (partial) assignment against the constraints. This is called for every node created during the search,
     * so for partial assignments it should be cheap and may be optimistic, but it must never reject an assignment
     * that has a feasible completion. For complete assignments it must be exact.
     *
     * @param assignment the assignment to test
     * @return false if no completion of the assignment can be feasible
     */
    boolean isFeasible(Assignment assignment);

    /**
     * Evaluate the objective. Only defined on complete, feasible assignments.
     *
     * @param assignment a complete, feasible assignment
     * @return the objective value
     */
    double objective(Assignment assignment);

    /**
     * @param assignment an assignment of this problem
     * @return true if every variable is decided
     */
    default boolean isComplete(Assignment assignment) {
        return assignment.isComplete();
    }
}
