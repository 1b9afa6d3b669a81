package nl.bytesoflife.fabcapacity.portfolio;

import nl.bytesoflife.fabcapacity.model.CapExProject;

/**
 * Optimizer decision for one project. The source project is carried unchanged.
 *
 * @param project                the candidate project
 * @param allocationFraction     share of the project funded by the relaxed optimum, 0..1
 * @param allocatedInvestmentUsd investment x fraction
 * @param allocatedNpvUsd        NPV x fraction
 * @param selected               binary go/no-go, true when the fraction exceeds the selection threshold
 */
public record ProjectAllocation(
        CapExProject project,
        double allocationFraction,
        double allocatedInvestmentUsd,
        double allocatedNpvUsd,
        boolean selected
) {
}
