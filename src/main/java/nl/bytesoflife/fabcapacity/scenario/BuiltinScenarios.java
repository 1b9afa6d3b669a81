package nl.bytesoflife.fabcapacity.scenario;

import java.util.List;

/**
 * Factory for the built-in planning scenarios.
 */
public class BuiltinScenarios {

    private static final List<ScenarioDefinition> STANDARD = List.of(
            new ScenarioDefinition("Conservative", 0.05, 0.88),
            new ScenarioDefinition("Base Case", 0.12, 0.91),
            new ScenarioDefinition("Aggressive", 0.22, 0.93),
            new ScenarioDefinition("Stretch", 0.35, 0.95)
    );

    /**
     * Conservative (+5%, 88% yield), Base Case (+12%, 91%), Aggressive (+22%, 93%)
     * and Stretch (+35%, 95%).
     */
    public static List<ScenarioDefinition> standard() {
        return STANDARD;
    }
}
