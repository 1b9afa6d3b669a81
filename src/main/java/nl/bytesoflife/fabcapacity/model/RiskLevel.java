package nl.bytesoflife.fabcapacity.model;

/**
 * Project risk category. The weight inflates a project's investment in the
 * risk-adjusted budget constraint of the portfolio optimizer.
 */
public enum RiskLevel {
    LOW(1.0),
    MEDIUM(1.3),
    HIGH(1.6);

    private final double weight;

    RiskLevel(double weight) {
        this.weight = weight;
    }

    public double getWeight() {
        return weight;
    }

    public static RiskLevel fromName(String name) {
        return switch (name.trim().toLowerCase()) {
            case "low" -> LOW;
            case "medium" -> MEDIUM;
            case "high" -> HIGH;
            default -> throw new IllegalArgumentException("Unknown risk level: " + name);
        };
    }
}
