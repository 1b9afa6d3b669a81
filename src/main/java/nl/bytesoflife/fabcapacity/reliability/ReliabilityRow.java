package nl.bytesoflife.fabcapacity.reliability;

/**
 * Failure statistics of one tool type over the whole operations history.
 *
 * @param toolType               tool type
 * @param totalFailures          tool-days with unplanned downtime
 * @param totalDowntimeHours     unplanned downtime summed over those days
 * @param meanDowntimeHours      mean downtime per failure
 * @param mtbfActualHours        all operating hours of the type / failures
 * @param mtbfTheoreticalHours   vendor MTBF from the equipment master
 * @param mtbfPerformancePct     actual / theoretical x 100
 * @param availabilityImpactPct  downtime / operating hours x 100
 */
public record ReliabilityRow(
        String toolType,
        int totalFailures,
        double totalDowntimeHours,
        double meanDowntimeHours,
        double mtbfActualHours,
        double mtbfTheoreticalHours,
        double mtbfPerformancePct,
        double availabilityImpactPct
) {
}
