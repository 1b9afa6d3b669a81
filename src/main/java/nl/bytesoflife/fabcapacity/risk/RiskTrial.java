package nl.bytesoflife.fabcapacity.risk;

/**
 * Outcome of one simulated week.
 *
 * @param demand              simulated weekly demand
 * @param capacity            simulated effective weekly capacity
 * @param shortfall           max(0, demand - capacity)
 * @param surplus             max(0, capacity - demand)
 * @param utilization         min(demand / capacity, 1)
 * @param yield               sampled yield factor
 * @param availability        sampled availability factor
 * @param cycleTimeMultiplier sampled cycle-time multiplier
 */
public record RiskTrial(
        double demand,
        double capacity,
        double shortfall,
        double surplus,
        double utilization,
        double yield,
        double availability,
        double cycleTimeMultiplier
) {
}
