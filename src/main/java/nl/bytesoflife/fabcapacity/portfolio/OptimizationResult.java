package nl.bytesoflife.fabcapacity.portfolio;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Outcome of a portfolio optimization. A failed solve carries only the solver
 * message; the totals are zero and there is no allocation table.
 * <p>
 * Totals describe the continuous relaxation. The selected projects come from
 * rounding it, which is only an approximation of the 0/1 problem: when
 * {@link #isApproximate()} is set the selection may exceed the budget by
 * {@link #getBinaryBudgetOverrunUsd()}.
 */
public class OptimizationResult {

    private final OptimizationStatus status;
    private final String message;
    private final double budgetUsd;
    private final double totalNpvUsd;
    private final double totalInvestmentUsd;
    private final double binaryInvestmentUsd;
    private final List<String> selectedProjects;
    private final Double averageSelectedIrr;
    private final boolean approximate;
    private final List<ProjectAllocation> allocations;

    private OptimizationResult(OptimizationStatus status, String message, double budgetUsd,
                               double totalNpvUsd, double totalInvestmentUsd, double binaryInvestmentUsd,
                               List<String> selectedProjects, Double averageSelectedIrr,
                               boolean approximate, List<ProjectAllocation> allocations) {
        this.status = status;
        this.message = message;
        this.budgetUsd = budgetUsd;
        this.totalNpvUsd = totalNpvUsd;
        this.totalInvestmentUsd = totalInvestmentUsd;
        this.binaryInvestmentUsd = binaryInvestmentUsd;
        this.selectedProjects = List.copyOf(selectedProjects);
        this.averageSelectedIrr = averageSelectedIrr;
        this.approximate = approximate;
        this.allocations = allocations != null ? List.copyOf(allocations) : null;
    }

    static OptimizationResult optimal(double budgetUsd, double totalNpvUsd, List<ProjectAllocation> allocations,
                                      boolean approximate) {
        double totalInvestment = 0;
        double binaryInvestment = 0;
        double irrSum = 0;
        List<String> selected = new ArrayList<>();
        for (ProjectAllocation allocation : allocations) {
            totalInvestment += allocation.allocatedInvestmentUsd();
            if (allocation.selected()) {
                binaryInvestment += allocation.project().investmentUsd();
                irrSum += allocation.project().irrPercent();
                selected.add(allocation.project().projectName());
            }
        }
        Double averageIrr = selected.isEmpty() ? null : irrSum / selected.size();
        return new OptimizationResult(OptimizationStatus.OPTIMAL, "Optimal", budgetUsd,
                totalNpvUsd, totalInvestment, binaryInvestment, selected, averageIrr, approximate, allocations);
    }

    static OptimizationResult failed(double budgetUsd, String message) {
        return new OptimizationResult(OptimizationStatus.FAILED, message, budgetUsd,
                0, 0, 0, List.of(), null, false, null);
    }

    public OptimizationStatus getStatus() {
        return status;
    }

    public boolean isOptimal() {
        return status == OptimizationStatus.OPTIMAL;
    }

    public String getMessage() {
        return message;
    }

    public double getBudgetUsd() {
        return budgetUsd;
    }

    public double getTotalNpvUsd() {
        return totalNpvUsd;
    }

    public double getTotalInvestmentUsd() {
        return totalInvestmentUsd;
    }

    public double getBudgetUtilizedPct() {
        return budgetUsd > 0 ? totalInvestmentUsd / budgetUsd * 100 : 0;
    }

    public int getProjectsSelected() {
        return selectedProjects.size();
    }

    public List<String> getSelectedProjects() {
        return selectedProjects;
    }

    /**
     * Mean IRR of the selected projects, empty when nothing was selected.
     */
    public OptionalDouble getAverageSelectedIrr() {
        return averageSelectedIrr != null ? OptionalDouble.of(averageSelectedIrr) : OptionalDouble.empty();
    }

    public boolean isApproximate() {
        return approximate;
    }

    public double getBinaryInvestmentUsd() {
        return binaryInvestmentUsd;
    }

    public double getBinaryBudgetOverrunUsd() {
        return Math.max(0, binaryInvestmentUsd - budgetUsd);
    }

    /**
     * Per-project allocations, present only for an optimal solve.
     */
    public Optional<List<ProjectAllocation>> getAllocations() {
        return Optional.ofNullable(allocations);
    }

    @Override
    public String toString() {
        if (!isOptimal()) {
            return "Portfolio optimization failed: " + message;
        }
        StringBuilder sb = new StringBuilder("Portfolio optimization: ").append(status);
        if (approximate) sb.append(" (binary selection approximate)");
        sb.append(String.format(Locale.US, "%n  NPV: $%,.0f, investment: $%,.0f (%.1f%% of $%,.0f budget)",
                totalNpvUsd, totalInvestmentUsd, getBudgetUtilizedPct(), budgetUsd));
        sb.append(String.format(Locale.US, "%n  Selected %d project(s)", getProjectsSelected()));
        getAverageSelectedIrr().ifPresent(irr -> sb.append(String.format(Locale.US, ", avg IRR %.1f%%", irr)));
        for (String name : selectedProjects) {
            sb.append(System.lineSeparator()).append("  - ").append(name);
        }
        return sb.toString();
    }
}
