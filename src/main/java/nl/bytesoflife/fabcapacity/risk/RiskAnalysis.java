package nl.bytesoflife.fabcapacity.risk;

import java.util.List;

/**
 * Metrics of a Monte Carlo run together with the per-trial table they were computed from.
 */
public class RiskAnalysis {

    private final RiskMetrics metrics;
    private final List<RiskTrial> trials;

    public RiskAnalysis(RiskMetrics metrics, List<RiskTrial> trials) {
        this.metrics = metrics;
        this.trials = List.copyOf(trials);
    }

    public RiskMetrics getMetrics() {
        return metrics;
    }

    public List<RiskTrial> getTrials() {
        return trials;
    }
}
