package nl.bytesoflife.fabcapacity;

import nl.bytesoflife.fabcapacity.bottleneck.BottleneckRow;
import nl.bytesoflife.fabcapacity.portfolio.OptimizationResult;
import nl.bytesoflife.fabcapacity.reliability.ReliabilityRow;
import nl.bytesoflife.fabcapacity.risk.RiskAnalysis;
import nl.bytesoflife.fabcapacity.risk.RiskMetrics;
import nl.bytesoflife.fabcapacity.scenario.ScenarioRow;
import nl.bytesoflife.fabcapacity.summary.FleetSummary;

import java.util.List;
import java.util.Locale;

/**
 * All outputs of one planning run.
 */
public class CapacityPlanningReport {

    private final PlanningRequest request;
    private final FleetSummary fleetSummary;
    private final List<BottleneckRow> bottlenecks;
    private final RiskAnalysis risk;
    private final OptimizationResult portfolio;
    private final List<ScenarioRow> scenarios;
    private final List<ReliabilityRow> reliability;

    public CapacityPlanningReport(PlanningRequest request,
                                  FleetSummary fleetSummary,
                                  List<BottleneckRow> bottlenecks,
                                  RiskAnalysis risk,
                                  OptimizationResult portfolio,
                                  List<ScenarioRow> scenarios,
                                  List<ReliabilityRow> reliability) {
        this.request = request;
        this.fleetSummary = fleetSummary;
        this.bottlenecks = List.copyOf(bottlenecks);
        this.risk = risk;
        this.portfolio = portfolio;
        this.scenarios = List.copyOf(scenarios);
        this.reliability = List.copyOf(reliability);
    }

    public PlanningRequest getRequest() {
        return request;
    }

    public FleetSummary getFleetSummary() {
        return fleetSummary;
    }

    public List<BottleneckRow> getBottlenecks() {
        return bottlenecks;
    }

    public BottleneckRow getBindingConstraint() {
        return bottlenecks.get(0);
    }

    public RiskAnalysis getRisk() {
        return risk;
    }

    public OptimizationResult getPortfolio() {
        return portfolio;
    }

    public List<ScenarioRow> getScenarios() {
        return scenarios;
    }

    public List<ReliabilityRow> getReliability() {
        return reliability;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Capacity Planning Report:\n");

        FleetSummary fleet = fleetSummary;
        sb.append("\n  Fleet status (").append(fleet.reportDate()).append("):\n");
        sb.append(String.format(Locale.US, "  - Tools: %d (%d active), avg age %.1f years, asset value $%.2fB%n",
                fleet.totalTools(), fleet.activeTools(), fleet.averageAgeYears(), fleet.assetValueUsd() / 1e9));
        sb.append(String.format(Locale.US, "  - OEE %.1f%%, utilization %.1f%%, daily output %,.0f wafers, cycle time %.1fh%n",
                fleet.fleetOee() * 100, fleet.fleetUtilization() * 100,
                fleet.dailyOutputWafers(), fleet.averageCycleTimeHours()));

        sb.append(String.format(Locale.US, "%n  Bottlenecks at %,.0f WPW:%n", request.targetOutputWpw()));
        for (BottleneckRow row : bottlenecks) {
            sb.append(String.format(Locale.US, "  - %s: utilization %.1f%%, capacity %,.0f WPW, gap %,.0f WPW%s%n",
                    row.toolType(), row.utilizationAtTarget() * 100, row.effectiveCapacityWpw(),
                    row.capacityGapWpw(), row.bottleneck() ? " [BOTTLENECK]" : ""));
        }

        RiskMetrics metrics = risk.getMetrics();
        sb.append(String.format(Locale.US, "%n  Risk (%d trials):%n", metrics.simulationCount()));
        sb.append(String.format(Locale.US, "  - Service level %.1f%%, mean shortfall %,.0f WPW, p95 shortfall %,.0f WPW%n",
                metrics.serviceLevel() * 100, metrics.meanShortfallWpw(), metrics.p95ShortfallWpw()));

        sb.append("\n  ").append(portfolio.toString().replace("\n", "\n  ")).append("\n");

        sb.append("\n  Scenarios:\n");
        for (ScenarioRow row : scenarios) {
            sb.append(String.format(Locale.US, "  - %s: demand %,.0f WPW vs capacity %,.0f WPW, %s%n",
                    row.scenario(), row.projectedDemandWpw(), row.effectiveCapacityWpw(),
                    row.capacitySufficient() ? "sufficient"
                            : String.format(Locale.US, "needs +%.1f%%", row.additionalCapacityNeededPct())));
        }

        sb.append("\n  Reliability:\n");
        if (reliability.isEmpty()) {
            sb.append("  - No unplanned downtime recorded\n");
        }
        for (ReliabilityRow row : reliability) {
            sb.append(String.format(Locale.US, "  - %s: %d failures, MTBF %.0fh (%.1f%% of rated), availability impact %.2f%%%n",
                    row.toolType(), row.totalFailures(), row.mtbfActualHours(),
                    row.mtbfPerformancePct(), row.availabilityImpactPct()));
        }
        return sb.toString();
    }
}
