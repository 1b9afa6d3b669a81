package nl.bytesoflife.fabcapacity.scenario;

/**
 * Projection of one scenario. Volumes are wafers per week.
 *
 * @param scenario                   scenario name
 * @param demandGrowthRate           growth applied to current demand
 * @param assumedYield               yield applied to current output
 * @param projectedDemandWpw         current demand x (1 + growth)
 * @param effectiveCapacityWpw       current output x yield
 * @param capacityGapWpw             demand - capacity, negative when there is headroom
 * @param utilizationRate            min(demand / capacity, 1)
 * @param capacitySufficient         gap &lt;= 0
 * @param additionalCapacityNeededPct max(0, gap / capacity x 100)
 */
public record ScenarioRow(
        String scenario,
        double demandGrowthRate,
        double assumedYield,
        double projectedDemandWpw,
        double effectiveCapacityWpw,
        double capacityGapWpw,
        double utilizationRate,
        boolean capacitySufficient,
        double additionalCapacityNeededPct
) {
}
