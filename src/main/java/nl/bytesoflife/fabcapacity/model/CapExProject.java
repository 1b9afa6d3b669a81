package nl.bytesoflife.fabcapacity.model;

/**
 * A candidate capital project.
 *
 * @param projectId     project identifier (e.g. "CPX1000")
 * @param projectName   project name
 * @param investmentUsd full investment
 * @param npvUsd        net present value at full investment
 * @param irrPercent    internal rate of return in percent
 * @param riskLevel     risk category
 * @param status        lifecycle status ("Planning", "In Progress", "Completed")
 */
public record CapExProject(
        String projectId,
        String projectName,
        double investmentUsd,
        double npvUsd,
        double irrPercent,
        RiskLevel riskLevel,
        String status
) {
    public static final String STATUS_IN_PROGRESS = "In Progress";

    public CapExProject {
        if (projectName == null || projectName.isBlank()) {
            throw new IllegalArgumentException("Project name must not be blank");
        }
        if (investmentUsd < 0) {
            throw new IllegalArgumentException("Investment must be >= 0 for " + projectName);
        }
        if (riskLevel == null) {
            throw new IllegalArgumentException("Risk level must be set for " + projectName);
        }
    }

    public boolean isInProgress() {
        return STATUS_IN_PROGRESS.equalsIgnoreCase(status);
    }
}
