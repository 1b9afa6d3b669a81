package nl.bytesoflife.fabcapacity.risk;

import nl.bytesoflife.fabcapacity.DataException;
import nl.bytesoflife.fabcapacity.FabFixtures;
import nl.bytesoflife.fabcapacity.capacity.WeeklyBaseline;
import nl.bytesoflife.fabcapacity.model.FabDataset;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RiskSimulatorTest {

    private static final WeeklyBaseline BASELINE =
            new WeeklyBaseline(14_000, 10_000, LocalDate.of(2024, 6, 15), LocalDate.of(2024, 6, 30));

    @Test
    void sameSeedReproducesIdenticalMetrics() {
        RiskAnalysis first = new RiskSimulator().simulate(BASELINE, 5_000, 4, new Well19937c(42L));
        RiskAnalysis second = new RiskSimulator().simulate(BASELINE, 5_000, 4, new Well19937c(42L));

        assertEquals(first.getMetrics(), second.getMetrics());
        assertEquals(first.getTrials(), second.getTrials());
    }

    @Test
    void differentSeedsGiveDifferentSamples() {
        RiskAnalysis first = new RiskSimulator().simulate(BASELINE, 2_000, 4, new Well19937c(1L));
        RiskAnalysis second = new RiskSimulator().simulate(BASELINE, 2_000, 4, new Well19937c(2L));

        assertNotEquals(first.getTrials(), second.getTrials());
    }

    @ParameterizedTest
    @ValueSource(ints = {2, 3, 8})
    void parallelRunMatchesSequentialRun(int threads) {
        RiskAnalysis sequential = new RiskSimulator().simulate(BASELINE, 5_500, 4, new Well19937c(11L));
        RiskAnalysis parallel = new RiskSimulator()
                .withParallelism(threads)
                .simulate(BASELINE, 5_500, 4, new Well19937c(11L));

        assertEquals(sequential.getTrials(), parallel.getTrials());
        assertEquals(sequential.getMetrics(), parallel.getMetrics());
    }

    @Test
    void estimatesConvergeAcrossSeeds() {
        RiskMetrics a = new RiskSimulator().withParallelism(4)
                .simulate(BASELINE, 200_000, 4, new Well19937c(1L)).getMetrics();
        RiskMetrics b = new RiskSimulator().withParallelism(4)
                .simulate(BASELINE, 200_000, 4, new Well19937c(2L)).getMetrics();

        assertEquals(a.serviceLevel(), b.serviceLevel(), 0.01);
        assertEquals(a.meanShortfallWpw(), b.meanShortfallWpw(), 0.05 * a.meanShortfallWpw());
        assertEquals(a.meanUtilization(), b.meanUtilization(), 0.01);
    }

    @Test
    void metricsAreConsistentWithTrials() {
        RiskAnalysis analysis = new RiskSimulator().simulate(BASELINE, 2_500, 6, new Well19937c(3L));
        RiskMetrics metrics = analysis.getMetrics();
        List<RiskTrial> trials = analysis.getTrials();

        assertEquals(2_500, trials.size());
        assertEquals(2_500, metrics.simulationCount());
        assertEquals(6, metrics.horizonQuarters());
        assertEquals(14_000, metrics.baselineCapacityWpw());
        assertEquals(10_000, metrics.meanDemandWpw());
        assertEquals(1.0, metrics.serviceLevel() + metrics.probabilityOfShortfall(), 1e-12);

        long withShortfall = trials.stream().filter(t -> t.shortfall() > 0).count();
        assertEquals(withShortfall / 2_500.0, metrics.probabilityOfShortfall(), 1e-12);
        double meanShortfall = trials.stream().mapToDouble(RiskTrial::shortfall).average().orElseThrow();
        assertEquals(meanShortfall, metrics.meanShortfallWpw(), 1e-9);

        assertTrue(metrics.medianShortfallWpw() <= metrics.p95ShortfallWpw());
        assertTrue(metrics.p95ShortfallWpw() <= metrics.p99ShortfallWpw());
        assertTrue(metrics.p95Utilization() <= 1.0);
        assertTrue(metrics.capacityAtRiskP5() < metrics.baselineCapacityWpw());
    }

    @Test
    void everyTrialRespectsItsInvariants() {
        RiskSimulationSettings settings = RiskSimulationSettings.defaults();
        List<RiskTrial> trials = new RiskSimulator().simulate(BASELINE, 3_000, 4, new Well19937c(5L)).getTrials();

        for (RiskTrial trial : trials) {
            assertTrue(trial.yield() >= settings.yieldMin() && trial.yield() <= settings.yieldMax());
            assertTrue(trial.availability() >= 0 && trial.availability() <= 1);
            assertTrue(trial.cycleTimeMultiplier() > 0);
            assertTrue(trial.utilization() <= 1.0);
            assertTrue(trial.shortfall() >= 0 && trial.surplus() >= 0);
            assertTrue(trial.shortfall() == 0 || trial.surplus() == 0);
            double expected = BASELINE.capacityWpw() * trial.yield() * trial.availability()
                    / trial.cycleTimeMultiplier();
            assertEquals(expected, trial.capacity(), 1e-9);
        }
    }

    @Test
    void ampleCapacityGivesFullServiceLevel() {
        WeeklyBaseline ample = new WeeklyBaseline(1_000_000, 100, BASELINE.capacityDate(), BASELINE.demandQuarter());
        RiskMetrics metrics = new RiskSimulator().simulate(ample, 1_000, 4, new Well19937c(9L)).getMetrics();

        assertEquals(1.0, metrics.serviceLevel());
        assertEquals(0.0, metrics.meanShortfallWpw());
        assertEquals(0.0, metrics.p99ShortfallWpw());
    }

    @Test
    void higherVolatilityWidensDemandTail() {
        RiskMetrics calm = new RiskSimulator()
                .withSettings(RiskSimulationSettings.defaults().withDemandVolatility(0.05))
                .simulate(BASELINE, 5_000, 4, new Well19937c(21L)).getMetrics();
        RiskMetrics turbulent = new RiskSimulator()
                .withSettings(RiskSimulationSettings.defaults().withDemandVolatility(0.30))
                .simulate(BASELINE, 5_000, 4, new Well19937c(21L)).getMetrics();

        assertTrue(turbulent.demandAtRiskP95() > calm.demandAtRiskP95());
    }

    @Test
    void datasetBaselineIsDerivedFromLatestData() {
        FabDataset dataset = FabFixtures.riskDataset();
        RiskMetrics metrics = new RiskSimulator().simulate(dataset, 1_000, 4, new Well19937c(1L)).getMetrics();

        assertEquals(14_000, metrics.baselineCapacityWpw(), 1e-9);
        assertEquals(10_000, metrics.meanDemandWpw(), 1e-9);
    }

    @Test
    void emptyForecastIsADataError() {
        FabDataset dataset = new FabDataset()
                .addOperation(FabFixtures.op(FabFixtures.DAY_2, "CMP1", "CMP", 500, 24, 0));
        assertThrows(DataException.class,
                () -> new RiskSimulator().simulate(dataset, 100, 4, new Well19937c(1L)));
    }

    @Test
    void rejectsInvalidArguments() {
        RiskSimulator simulator = new RiskSimulator();
        assertThrows(IllegalArgumentException.class, () -> simulator.simulate(BASELINE, 0, 4, new Well19937c(1L)));
        assertThrows(IllegalArgumentException.class, () -> simulator.simulate(BASELINE, 10, 4, null));
        assertThrows(IllegalArgumentException.class, () -> simulator.withParallelism(0));
    }

    @Test
    void chunksSplitTrialsWithoutLoss() {
        List<RiskTrial> chunk = new RiskSimulator().runChunk(BASELINE, 37, 99L);
        assertEquals(37, chunk.size());
        assertEquals(2_345, new RiskSimulator().simulate(BASELINE, 2_345, 4, new Well19937c(4L)).getTrials().size());
    }
}
