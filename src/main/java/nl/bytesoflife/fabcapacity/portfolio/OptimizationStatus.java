package nl.bytesoflife.fabcapacity.portfolio;

public enum OptimizationStatus {
    OPTIMAL,
    FAILED
}
