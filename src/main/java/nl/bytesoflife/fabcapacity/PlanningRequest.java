package nl.bytesoflife.fabcapacity;

import nl.bytesoflife.fabcapacity.risk.RiskSimulationSettings;

/**
 * Parameters of one planning run.
 *
 * @param targetOutputWpw  weekly output the bottleneck analysis is run against
 * @param trials           Monte Carlo trial count
 * @param horizonQuarters  forecast horizon recorded with the risk metrics
 * @param budgetUsd        CapEx budget
 * @param seed             seed of the Monte Carlo generator
 */
public record PlanningRequest(
        double targetOutputWpw,
        int trials,
        int horizonQuarters,
        double budgetUsd,
        long seed
) {
    public static final double DEFAULT_TARGET_OUTPUT_WPW = 18_000;
    public static final double DEFAULT_BUDGET_USD = 1_500_000_000d;
    public static final long DEFAULT_SEED = 42L;

    public static PlanningRequest defaults() {
        return new PlanningRequest(
                DEFAULT_TARGET_OUTPUT_WPW,
                RiskSimulationSettings.DEFAULT_TRIALS,
                RiskSimulationSettings.DEFAULT_HORIZON_QUARTERS,
                DEFAULT_BUDGET_USD,
                DEFAULT_SEED);
    }

    public PlanningRequest withTrials(int trials) {
        return new PlanningRequest(targetOutputWpw, trials, horizonQuarters, budgetUsd, seed);
    }

    public PlanningRequest withBudget(double budgetUsd) {
        return new PlanningRequest(targetOutputWpw, trials, horizonQuarters, budgetUsd, seed);
    }
}
