package com.github.bnbjava.bound;

import com.github.bnbjava.model.Assignment;
import com.github.bnbjava.model.LinearProblem;
import com.github.bnbjava.model.Problem;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;
import org.ojalgo.optimisation.Variable;

import static com.github.bnbjava.Util.maxScale;
import static com.github.bnbjava.Util.newModel;
import static com.github.bnbjava.Util.roundBound;
import static com.github.bnbjava.model.Sense.MINIMIZE;
import static org.ojalgo.optimisation.Optimisation.State.INFEASIBLE;

/**
 * <p>
 * Continuous relaxation of a {@link LinearProblem}, solved with ojAlgo's LP solver.
 * </p><p>
 * Every variable is relaxed to the interval between the smallest and largest value of its remaining domain, and the
 * linear constraints are kept. The LP optimum is then an admissible bound. It is loosened by a small tolerance and
 * rounded to the decimal scale of the objective coefficients in the worse direction, which tightens it for integral
 * objectives (for example, an LP bound of 7.5 on a maximization with integer values becomes 7.)
 * </p>
 */
public class LinearRelaxationBound implements BoundOracle {
    /**
     * Default constructor.
     */
    public LinearRelaxationBound() {
    }

    @Override
    public double bound(Problem problem, Assignment assignment) {
        if (!(problem instanceof LinearProblem linear)) {
            throw new IllegalArgumentException("LinearRelaxationBound requires a LinearProblem.");
        }
        if (assignment.isComplete()) {
            return linear.objective(assignment);
        }

        var result = solve(linear, assignment);

        if (!result.getState().isFeasible()) {
            if (result.getState() == INFEASIBLE) {
                return linear.sense().worst();
            }
            throw new IllegalStateException("relaxation ended in state " + result.getState());
        }

        var scale = maxScale(linear.objectiveCoefficients());
        if (scale >= 0) {
            scale = Math.max(scale, maxScale(linear.objectiveConstant()));
        }
        return roundBound(result.getValue() + linear.objectiveConstant(), scale, linear.sense());
    }

    /**
     * Build the relaxation model. The objective constant is left out; ojAlgo optimises the weighted variables only.
     */
    static ExpressionsBasedModel buildModel(LinearProblem problem, Assignment assignment) {
        var model = newModel();
        var c = problem.objectiveCoefficients();
        var vars = new Variable[problem.size()];

        for (var v = 0; v < vars.length; v++) {
            vars[v] = model.newVariable("x" + v)
                    .lower(assignment.min(v))
                    .upper(assignment.max(v))
                    .weight(c[v]);
        }

        for (var constraint : problem.constraints()) {
            var expression = model.newExpression(constraint.name());
            var a = constraint.coefficients();

            if (Double.isFinite(constraint.lower())) {
                expression.lower(constraint.lower());
            }
            if (Double.isFinite(constraint.upper())) {
                expression.upper(constraint.upper());
            }
            for (var v = 0; v < a.length; v++) {
                if (a[v] != 0.0) {
                    expression.set(vars[v], a[v]);
                }
            }
        }
        return model;
    }

    static Optimisation.Result solve(LinearProblem problem, Assignment assignment) {
        var model = buildModel(problem, assignment);
        return problem.sense() == MINIMIZE ? model.minimise() : model.maximise();
    }
}
