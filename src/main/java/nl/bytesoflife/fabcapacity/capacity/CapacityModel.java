package nl.bytesoflife.fabcapacity.capacity;

import nl.bytesoflife.fabcapacity.bottleneck.BottleneckAnalyzer;
import nl.bytesoflife.fabcapacity.bottleneck.BottleneckRow;
import nl.bytesoflife.fabcapacity.bottleneck.ProcessStepTable;
import nl.bytesoflife.fabcapacity.model.CapExProject;
import nl.bytesoflife.fabcapacity.model.EquipmentRecord;
import nl.bytesoflife.fabcapacity.model.FabDataset;
import nl.bytesoflife.fabcapacity.portfolio.OptimizationResult;
import nl.bytesoflife.fabcapacity.portfolio.PortfolioOptimizer;
import nl.bytesoflife.fabcapacity.risk.RiskAnalysis;
import nl.bytesoflife.fabcapacity.risk.RiskSimulationSettings;
import nl.bytesoflife.fabcapacity.risk.RiskSimulator;
import nl.bytesoflife.fabcapacity.scenario.ScenarioDefinition;
import nl.bytesoflife.fabcapacity.scenario.ScenarioEngine;
import nl.bytesoflife.fabcapacity.scenario.ScenarioRow;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Capacity baseline of a fab and entry point for the analyses built on it.
 * Every call recomputes the baseline from the dataset, so analyses are
 * independent of each other.
 *
 * <pre>
 * CapacityModel model = new CapacityModel(dataset)
 *     .withProcessSteps(BuiltinProcessSteps.semiconductorFab())
 *     .withParallelism(4);
 * List&lt;BottleneckRow&gt; bottlenecks = model.computeBottleneck(18_000);
 * RiskAnalysis risk = model.simulateRisk(10_000, 4, 42L);
 * </pre>
 */
public class CapacityModel {

    public static final double HOURS_PER_WEEK = 168;

    private final FabDataset dataset;
    private final BottleneckAnalyzer bottleneckAnalyzer = new BottleneckAnalyzer();
    private final RiskSimulator riskSimulator = new RiskSimulator();
    private final PortfolioOptimizer portfolioOptimizer = new PortfolioOptimizer();
    private final ScenarioEngine scenarioEngine = new ScenarioEngine();

    public CapacityModel(FabDataset dataset) {
        if (dataset == null) {
            throw new IllegalArgumentException("Dataset must not be null");
        }
        this.dataset = dataset;
    }

    public CapacityModel withProcessSteps(ProcessStepTable processSteps) {
        bottleneckAnalyzer.withProcessSteps(processSteps);
        return this;
    }

    public CapacityModel withRiskSettings(RiskSimulationSettings settings) {
        riskSimulator.withSettings(settings);
        return this;
    }

    public CapacityModel withParallelism(int threads) {
        riskSimulator.withParallelism(threads);
        return this;
    }

    public CapacityModel withScenarios(List<ScenarioDefinition> scenarios) {
        scenarioEngine.withScenarios(scenarios);
        return this;
    }

    public CapacityModel withMaxSolverIterations(int maxIterations) {
        portfolioOptimizer.withMaxIterations(maxIterations);
        return this;
    }

    public FabDataset getDataset() {
        return dataset;
    }

    /**
     * Installed capacity per tool type, in the order types first appear in the
     * equipment table. Empty when there is no equipment.
     */
    public List<CapacityRow> computeCapacity() {
        List<CapacityRow> rows = new ArrayList<>();
        for (Map.Entry<String, List<EquipmentRecord>> entry : dataset.getEquipmentByType().entrySet()) {
            List<EquipmentRecord> tools = entry.getValue();
            double throughput = tools.stream().mapToDouble(EquipmentRecord::throughputWph).sum();
            double meanTarget = tools.stream().mapToDouble(EquipmentRecord::utilizationTarget).average().orElse(0);
            rows.add(new CapacityRow(
                    entry.getKey(),
                    tools.size(),
                    throughput,
                    meanTarget,
                    throughput * HOURS_PER_WEEK * meanTarget));
        }
        return rows;
    }

    public WeeklyBaseline computeWeeklyBaseline() {
        return WeeklyBaseline.from(dataset, riskSimulator.getSettings().weeksPerQuarter());
    }

    public List<BottleneckRow> computeBottleneck(double targetOutputWpw) {
        return bottleneckAnalyzer.analyze(computeCapacity(), targetOutputWpw);
    }

    public RiskAnalysis simulateRisk(int trials, int horizonQuarters, long seed) {
        return simulateRisk(trials, horizonQuarters, new Well19937c(seed));
    }

    public RiskAnalysis simulateRisk(int trials, int horizonQuarters, RandomGenerator random) {
        return riskSimulator.simulate(computeWeeklyBaseline(), trials, horizonQuarters, random);
    }

    public OptimizationResult optimizePortfolio(double budgetUsd) {
        return optimizePortfolio(dataset.getProjects(), budgetUsd);
    }

    public OptimizationResult optimizePortfolio(List<CapExProject> projects, double budgetUsd) {
        return portfolioOptimizer.optimize(projects, budgetUsd);
    }

    public List<ScenarioRow> computeScenarios() {
        return scenarioEngine.project(computeWeeklyBaseline());
    }
}
