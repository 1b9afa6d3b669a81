package nl.bytesoflife.fabcapacity.portfolio;

import nl.bytesoflife.fabcapacity.DataException;
import nl.bytesoflife.fabcapacity.model.CapExProject;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.linear.LinearConstraint;
import org.apache.commons.math3.optim.linear.LinearConstraintSet;
import org.apache.commons.math3.optim.linear.LinearObjectiveFunction;
import org.apache.commons.math3.optim.linear.NonNegativeConstraint;
import org.apache.commons.math3.optim.linear.Relationship;
import org.apache.commons.math3.optim.linear.SimplexSolver;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Allocates a capital budget across projects to maximize NPV.
 * <p>
 * Solves the LP relaxation with one fraction {@code a} in [0, 1] per project:
 * <pre>
 *   maximize   sum(npv * a)
 *   subject to sum(investment * a)              &lt;= budget
 *              sum(investment * a * riskWeight) &lt;= budget * riskHeadroom
 * </pre>
 * and rounds each fraction at the selection threshold for a go/no-go decision.
 * An infeasible or non-converging solve yields a {@link OptimizationStatus#FAILED}
 * result rather than an exception.
 */
public class PortfolioOptimizer {

    private static final Logger log = LoggerFactory.getLogger(PortfolioOptimizer.class);

    public static final double RISK_BUDGET_HEADROOM = 1.20;
    public static final double SELECTION_THRESHOLD = 0.5;
    public static final int DEFAULT_MAX_ITERATIONS = 1_000;

    private static final double FRACTION_EPSILON = 1e-9;

    private int maxIterations = DEFAULT_MAX_ITERATIONS;
    private double riskHeadroom = RISK_BUDGET_HEADROOM;

    public PortfolioOptimizer withMaxIterations(int maxIterations) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("Max iterations must be >= 1");
        }
        this.maxIterations = maxIterations;
        return this;
    }

    public PortfolioOptimizer withRiskHeadroom(double riskHeadroom) {
        if (!(riskHeadroom > 0)) {
            throw new IllegalArgumentException("Risk headroom must be > 0");
        }
        this.riskHeadroom = riskHeadroom;
        return this;
    }

    public OptimizationResult optimize(List<CapExProject> projects, double budgetUsd) {
        if (projects == null || projects.isEmpty()) {
            throw new DataException("CapEx project table is empty");
        }
        if (Double.isNaN(budgetUsd) || Double.isInfinite(budgetUsd)) {
            throw new IllegalArgumentException("Budget must be a finite amount but was " + budgetUsd);
        }

        int n = projects.size();
        double[] npv = new double[n];
        double[] investment = new double[n];
        double[] riskAdjusted = new double[n];
        for (int i = 0; i < n; i++) {
            CapExProject project = projects.get(i);
            npv[i] = project.npvUsd();
            investment[i] = project.investmentUsd();
            riskAdjusted[i] = project.investmentUsd() * project.riskLevel().getWeight();
        }

        List<LinearConstraint> constraints = new ArrayList<>(n + 2);
        constraints.add(new LinearConstraint(investment, Relationship.LEQ, budgetUsd));
        constraints.add(new LinearConstraint(riskAdjusted, Relationship.LEQ, budgetUsd * riskHeadroom));
        for (int i = 0; i < n; i++) {
            double[] upperBound = new double[n];
            upperBound[i] = 1.0;
            constraints.add(new LinearConstraint(upperBound, Relationship.LEQ, 1.0));
        }

        PointValuePair solution;
        try {
            solution = new SimplexSolver().optimize(
                    new MaxIter(maxIterations),
                    new LinearObjectiveFunction(npv, 0),
                    new LinearConstraintSet(constraints),
                    GoalType.MAXIMIZE,
                    new NonNegativeConstraint(true));
        } catch (MathIllegalStateException e) {
            log.warn("Portfolio optimization over {} projects with budget {} failed: {}",
                    n, budgetUsd, e.getMessage());
            return OptimizationResult.failed(budgetUsd, e.getMessage());
        }

        double[] fractions = solution.getPoint();
        List<ProjectAllocation> allocations = new ArrayList<>(n);
        boolean approximate = false;
        for (int i = 0; i < n; i++) {
            double fraction = cleanFraction(fractions[i]);
            if (fraction > FRACTION_EPSILON && fraction < 1 - FRACTION_EPSILON) {
                approximate = true;
            }
            CapExProject project = projects.get(i);
            allocations.add(new ProjectAllocation(
                    project,
                    fraction,
                    project.investmentUsd() * fraction,
                    project.npvUsd() * fraction,
                    fraction > SELECTION_THRESHOLD));
        }

        OptimizationResult result = OptimizationResult.optimal(budgetUsd, solution.getValue(), allocations, approximate);
        log.info("Portfolio optimization selected {} of {} projects, NPV {}, budget utilization {}%{}",
                result.getProjectsSelected(), n, result.getTotalNpvUsd(), result.getBudgetUtilizedPct(),
                approximate ? " (approximate binary selection)" : "");
        return result;
    }

    private static double cleanFraction(double value) {
        if (value < FRACTION_EPSILON) return 0.0;
        if (value > 1 - FRACTION_EPSILON) return 1.0;
        return value;
    }
}
