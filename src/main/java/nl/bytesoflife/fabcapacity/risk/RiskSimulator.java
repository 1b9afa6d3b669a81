package nl.bytesoflife.fabcapacity.risk;

import nl.bytesoflife.fabcapacity.CapacityPlanningException;
import nl.bytesoflife.fabcapacity.capacity.WeeklyBaseline;
import nl.bytesoflife.fabcapacity.model.FabDataset;
import org.apache.commons.math3.distribution.BetaDistribution;
import org.apache.commons.math3.distribution.LogNormalDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Monte Carlo estimate of weekly capacity shortfall.
 * <p>
 * Every trial draws a demand multiplier, a yield factor, an availability factor
 * and a cycle-time multiplier, and compares the resulting demand and capacity.
 * Trials run in chunks of {@value #CHUNK_SIZE}; each chunk owns a generator seeded
 * from the caller's generator in chunk order, so a given seed reproduces the same
 * trials whatever the parallelism.
 */
public class RiskSimulator {

    private static final Logger log = LoggerFactory.getLogger(RiskSimulator.class);

    static final int CHUNK_SIZE = 1_000;

    private RiskSimulationSettings settings = RiskSimulationSettings.defaults();
    private int parallelism = 1;

    public RiskSimulator withSettings(RiskSimulationSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("Risk simulation settings must not be null");
        }
        this.settings = settings;
        return this;
    }

    public RiskSimulator withParallelism(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("Parallelism must be >= 1");
        }
        this.parallelism = threads;
        return this;
    }

    public RiskSimulationSettings getSettings() {
        return settings;
    }

    public RiskAnalysis simulate(FabDataset dataset, int trials, int horizonQuarters, RandomGenerator random) {
        return simulate(WeeklyBaseline.from(dataset, settings.weeksPerQuarter()), trials, horizonQuarters, random);
    }

    public RiskAnalysis simulate(WeeklyBaseline baseline, int trials, int horizonQuarters, RandomGenerator random) {
        if (trials < 1) {
            throw new IllegalArgumentException("Trial count must be >= 1 but was " + trials);
        }
        if (random == null) {
            throw new IllegalArgumentException("Random generator must not be null");
        }

        int chunkCount = (trials + CHUNK_SIZE - 1) / CHUNK_SIZE;
        long[] seeds = new long[chunkCount];
        for (int i = 0; i < chunkCount; i++) {
            seeds[i] = random.nextLong();
        }

        log.info("Running {} risk trials in {} chunks on {} thread(s), baseline {} WPW capacity / {} WPW demand",
                trials, chunkCount, parallelism, baseline.capacityWpw(), baseline.demandWpw());

        List<RiskTrial> results = parallelism == 1 || chunkCount == 1
                ? runSequential(baseline, trials, seeds)
                : runParallel(baseline, trials, seeds);

        RiskMetrics metrics = summarize(baseline, results, horizonQuarters);
        log.info("Risk simulation done: service level {}, mean shortfall {} WPW, p95 shortfall {} WPW",
                metrics.serviceLevel(), metrics.meanShortfallWpw(), metrics.p95ShortfallWpw());
        return new RiskAnalysis(metrics, results);
    }

    private List<RiskTrial> runSequential(WeeklyBaseline baseline, int trials, long[] seeds) {
        List<RiskTrial> results = new ArrayList<>(trials);
        for (int chunk = 0; chunk < seeds.length; chunk++) {
            results.addAll(runChunk(baseline, chunkLength(chunk, trials), seeds[chunk]));
        }
        return results;
    }

    private List<RiskTrial> runParallel(WeeklyBaseline baseline, int trials, long[] seeds) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, seeds.length));
        try {
            List<Future<List<RiskTrial>>> futures = new ArrayList<>(seeds.length);
            for (int chunk = 0; chunk < seeds.length; chunk++) {
                int length = chunkLength(chunk, trials);
                long seed = seeds[chunk];
                futures.add(executor.submit(() -> runChunk(baseline, length, seed)));
            }
            List<RiskTrial> results = new ArrayList<>(trials);
            for (Future<List<RiskTrial>> future : futures) {
                results.addAll(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CapacityPlanningException("Risk simulation was interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new CapacityPlanningException("Risk simulation chunk failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private static int chunkLength(int chunk, int trials) {
        return Math.min(CHUNK_SIZE, trials - chunk * CHUNK_SIZE);
    }

    List<RiskTrial> runChunk(WeeklyBaseline baseline, int length, long seed) {
        RandomGenerator rng = new Well19937c(seed);
        NormalDistribution demandShock = new NormalDistribution(rng, 1.0, settings.demandVolatility());
        NormalDistribution yieldShock = new NormalDistribution(rng, settings.yieldMean(), settings.yieldStdDev());
        BetaDistribution availabilityShock =
                new BetaDistribution(rng, settings.availabilityAlpha(), settings.availabilityBeta());
        LogNormalDistribution cycleTime = new LogNormalDistribution(rng, 0.0, settings.cycleTimeSigma());

        List<RiskTrial> trials = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            double demand = baseline.demandWpw() * demandShock.sample();
            double yield = settings.clampYield(yieldShock.sample());
            double availability = availabilityShock.sample();
            double cycleTimeMultiplier = cycleTime.sample();

            double capacity = baseline.capacityWpw() * yield * availability / cycleTimeMultiplier;
            trials.add(new RiskTrial(
                    demand,
                    capacity,
                    Math.max(0.0, demand - capacity),
                    Math.max(0.0, capacity - demand),
                    Math.min(demand / capacity, 1.0),
                    yield,
                    availability,
                    cycleTimeMultiplier));
        }
        log.debug("Chunk with seed {} produced {} trials", seed, length);
        return trials;
    }

    private static RiskMetrics summarize(WeeklyBaseline baseline, List<RiskTrial> trials, int horizonQuarters) {
        int n = trials.size();
        double[] shortfall = new double[n];
        double[] utilization = new double[n];
        double[] capacity = new double[n];
        double[] demand = new double[n];
        int shortfallCount = 0;
        for (int i = 0; i < n; i++) {
            RiskTrial trial = trials.get(i);
            shortfall[i] = trial.shortfall();
            utilization[i] = trial.utilization();
            capacity[i] = trial.capacity();
            demand[i] = trial.demand();
            if (trial.shortfall() > 0) shortfallCount++;
        }

        // R-7: linear interpolation between closest ranks
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        double probabilityOfShortfall = (double) shortfallCount / n;

        return new RiskMetrics(
                baseline.capacityWpw(),
                baseline.demandWpw(),
                StatUtils.mean(shortfall),
                quantile(percentile, shortfall, 50),
                quantile(percentile, shortfall, 95),
                quantile(percentile, shortfall, 99),
                probabilityOfShortfall,
                (double) (n - shortfallCount) / n,
                StatUtils.mean(utilization),
                quantile(percentile, utilization, 95),
                quantile(percentile, capacity, 5),
                quantile(percentile, demand, 95),
                n,
                horizonQuarters);
    }

    private static double quantile(Percentile percentile, double[] values, double p) {
        return percentile.evaluate(values, p);
    }
}
