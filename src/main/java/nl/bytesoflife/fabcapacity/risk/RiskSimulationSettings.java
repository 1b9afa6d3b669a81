package nl.bytesoflife.fabcapacity.risk;

/**
 * Distribution parameters of the Monte Carlo risk simulation.
 *
 * @param demandVolatility     standard deviation of the normal demand multiplier (mean 1.0)
 * @param yieldMean            mean of the normal yield factor
 * @param yieldStdDev          standard deviation of the yield factor
 * @param yieldMin             lower clamp of the yield factor
 * @param yieldMax             upper clamp of the yield factor
 * @param availabilityAlpha    first shape parameter of the beta availability factor
 * @param availabilityBeta     second shape parameter of the beta availability factor
 * @param cycleTimeSigma       scale of the log-normal cycle-time multiplier (location 0)
 * @param weeksPerQuarter      quarterly-to-weekly demand divisor
 */
public record RiskSimulationSettings(
        double demandVolatility,
        double yieldMean,
        double yieldStdDev,
        double yieldMin,
        double yieldMax,
        double availabilityAlpha,
        double availabilityBeta,
        double cycleTimeSigma,
        int weeksPerQuarter
) {
    public static final int DEFAULT_TRIALS = 10_000;
    public static final int DEFAULT_HORIZON_QUARTERS = 4;

    public RiskSimulationSettings {
        if (!(demandVolatility > 0) || !(yieldStdDev > 0) || !(cycleTimeSigma > 0)) {
            throw new IllegalArgumentException("Volatility, yield deviation and cycle-time sigma must be > 0");
        }
        if (yieldMin > yieldMax) {
            throw new IllegalArgumentException("Yield clamp is empty: [" + yieldMin + ", " + yieldMax + "]");
        }
        if (!(availabilityAlpha > 0) || !(availabilityBeta > 0)) {
            throw new IllegalArgumentException("Beta shape parameters must be > 0");
        }
        if (weeksPerQuarter <= 0) {
            throw new IllegalArgumentException("Weeks per quarter must be > 0");
        }
    }

    public static RiskSimulationSettings defaults() {
        return new RiskSimulationSettings(0.15, 0.92, 0.05, 0.75, 0.98, 9, 1, 0.15, 13);
    }

    public RiskSimulationSettings withDemandVolatility(double volatility) {
        return new RiskSimulationSettings(volatility, yieldMean, yieldStdDev, yieldMin, yieldMax,
                availabilityAlpha, availabilityBeta, cycleTimeSigma, weeksPerQuarter);
    }

    public double clampYield(double yield) {
        return Math.max(yieldMin, Math.min(yieldMax, yield));
    }
}
