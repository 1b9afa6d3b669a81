package nl.bytesoflife.fabcapacity.scenario;

import nl.bytesoflife.fabcapacity.NumericException;
import nl.bytesoflife.fabcapacity.capacity.WeeklyBaseline;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic demand/yield projections against current output.
 */
public class ScenarioEngine {

    private List<ScenarioDefinition> scenarios = BuiltinScenarios.standard();

    public ScenarioEngine withScenarios(List<ScenarioDefinition> scenarios) {
        if (scenarios == null || scenarios.isEmpty()) {
            throw new IllegalArgumentException("At least one scenario is required");
        }
        this.scenarios = List.copyOf(scenarios);
        return this;
    }

    public List<ScenarioDefinition> getScenarios() {
        return scenarios;
    }

    public List<ScenarioRow> project(WeeklyBaseline baseline) {
        return project(baseline.capacityWpw(), baseline.demandWpw());
    }

    public List<ScenarioRow> project(double currentCapacityWpw, double currentDemandWpw) {
        List<ScenarioRow> rows = new ArrayList<>(scenarios.size());
        for (ScenarioDefinition scenario : scenarios) {
            double demand = currentDemandWpw * (1 + scenario.growthRate());
            double capacity = currentCapacityWpw * scenario.yield();
            NumericException.requirePositive(capacity, "Effective capacity of scenario " + scenario.name());

            double gap = demand - capacity;
            rows.add(new ScenarioRow(
                    scenario.name(),
                    scenario.growthRate(),
                    scenario.yield(),
                    demand,
                    capacity,
                    gap,
                    Math.min(demand / capacity, 1.0),
                    gap <= 0,
                    Math.max(0.0, gap / capacity * 100)));
        }
        return rows;
    }
}
