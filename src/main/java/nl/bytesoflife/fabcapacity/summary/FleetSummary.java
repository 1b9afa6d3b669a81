package nl.bytesoflife.fabcapacity.summary;

import java.time.LocalDate;

/**
 * Executive snapshot of the fleet and the CapEx portfolio.
 *
 * @param totalTools            tools in the equipment master
 * @param activeTools           tools with status Active
 * @param averageAgeYears       mean tool age
 * @param assetValueUsd         summed tool cost
 * @param reportDate            latest operations day
 * @param fleetOee              mean OEE on the report date
 * @param fleetUtilization      mean utilization on the report date
 * @param dailyOutputWafers     total output on the report date
 * @param averageCycleTimeHours mean cycle time on the report date
 * @param capexInvestmentUsd    summed investment of all projects
 * @param capexNpvUsd           summed NPV of all projects
 * @param capexAverageIrr       mean IRR of all projects, or null without projects
 * @param projectsInProgress    projects with status In Progress
 */
public record FleetSummary(
        int totalTools,
        int activeTools,
        double averageAgeYears,
        double assetValueUsd,
        LocalDate reportDate,
        double fleetOee,
        double fleetUtilization,
        double dailyOutputWafers,
        double averageCycleTimeHours,
        double capexInvestmentUsd,
        double capexNpvUsd,
        Double capexAverageIrr,
        int projectsInProgress
) {
}
