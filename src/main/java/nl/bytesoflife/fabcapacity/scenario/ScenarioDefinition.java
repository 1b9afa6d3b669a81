package nl.bytesoflife.fabcapacity.scenario;

/**
 * A named what-if assumption.
 *
 * @param name        scenario name
 * @param growthRate  demand growth over the planning year, e.g. 0.12 for +12%
 * @param yield       assumed line yield applied to current output
 */
public record ScenarioDefinition(String name, double growthRate, double yield) {

    public ScenarioDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Scenario name must not be blank");
        }
        if (yield < 0 || yield > 1) {
            throw new IllegalArgumentException("Yield must be within [0, 1] for scenario " + name);
        }
    }
}
