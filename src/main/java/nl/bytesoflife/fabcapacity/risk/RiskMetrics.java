package nl.bytesoflife.fabcapacity.risk;

/**
 * Summary statistics of a Monte Carlo run. All volumes are wafers per week.
 *
 * @param baselineCapacityWpw    current weekly output the trials start from
 * @param meanDemandWpw          current weekly demand the trials start from
 * @param meanShortfallWpw       mean shortfall
 * @param medianShortfallWpw     median shortfall
 * @param p95ShortfallWpw        95th percentile shortfall
 * @param p99ShortfallWpw        99th percentile shortfall
 * @param probabilityOfShortfall fraction of trials with a shortfall
 * @param serviceLevel           fraction of trials without a shortfall
 * @param meanUtilization        mean utilization
 * @param p95Utilization         95th percentile utilization
 * @param capacityAtRiskP5       5th percentile capacity
 * @param demandAtRiskP95        95th percentile demand
 * @param simulationCount        number of trials
 * @param horizonQuarters        forecast horizon the run was requested for
 */
public record RiskMetrics(
        double baselineCapacityWpw,
        double meanDemandWpw,
        double meanShortfallWpw,
        double medianShortfallWpw,
        double p95ShortfallWpw,
        double p99ShortfallWpw,
        double probabilityOfShortfall,
        double serviceLevel,
        double meanUtilization,
        double p95Utilization,
        double capacityAtRiskP5,
        double demandAtRiskP95,
        int simulationCount,
        int horizonQuarters
) {
}
