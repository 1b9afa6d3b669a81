package nl.bytesoflife.fabcapacity;

import nl.bytesoflife.fabcapacity.bottleneck.BottleneckRow;
import nl.bytesoflife.fabcapacity.capacity.CapacityModel;
import nl.bytesoflife.fabcapacity.model.FabDataset;
import nl.bytesoflife.fabcapacity.portfolio.OptimizationResult;
import nl.bytesoflife.fabcapacity.reliability.ReliabilityModel;
import nl.bytesoflife.fabcapacity.reliability.ReliabilityRow;
import nl.bytesoflife.fabcapacity.risk.RiskAnalysis;
import nl.bytesoflife.fabcapacity.scenario.ScenarioRow;
import nl.bytesoflife.fabcapacity.summary.FleetSummarizer;
import nl.bytesoflife.fabcapacity.summary.FleetSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Function;

/**
 * Runs every analysis over one dataset.
 */
public class CapacityPlanningRunner {

    private static final Logger log = LoggerFactory.getLogger(CapacityPlanningRunner.class);

    private Function<FabDataset, CapacityModel> modelFactory = CapacityModel::new;

    /**
     * Customizes the capacity model, e.g. {@code ds -> new CapacityModel(ds).withParallelism(4)}.
     */
    public CapacityPlanningRunner withModelFactory(Function<FabDataset, CapacityModel> modelFactory) {
        this.modelFactory = modelFactory;
        return this;
    }

    public CapacityPlanningReport run(FabDataset dataset, PlanningRequest request) {
        long start = System.currentTimeMillis();
        log.info("Starting planning run over {}", dataset);

        CapacityModel model = modelFactory.apply(dataset);
        FleetSummary fleet = new FleetSummarizer().summarize(dataset);

        List<BottleneckRow> bottlenecks = model.computeBottleneck(request.targetOutputWpw());
        log.info("Top bottleneck: {}", bottlenecks.get(0).toolType());

        RiskAnalysis risk = model.simulateRisk(request.trials(), request.horizonQuarters(), request.seed());
        OptimizationResult portfolio = model.optimizePortfolio(request.budgetUsd());
        List<ScenarioRow> scenarios = model.computeScenarios();
        List<ReliabilityRow> reliability = new ReliabilityModel(dataset).computeReliability();

        log.info("Planning run finished in {}ms", System.currentTimeMillis() - start);
        return new CapacityPlanningReport(request, fleet, bottlenecks, risk, portfolio, scenarios, reliability);
    }
}
