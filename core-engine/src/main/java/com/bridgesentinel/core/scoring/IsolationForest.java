package com.bridgesentinel.core.scoring;

import com.bridgesentinel.core.config.ModelSettings;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Isolation forest estimator.
 *
 * <p>
 * Anomalies are few and different, so random axis-aligned splits isolate them
 * in fewer steps than normal rows. The forest grows {@code trees} isolation
 * trees, each on {@code sampleSize} rows drawn without replacement, to a height
 * limit of {@code ceil(log2(sampleSize))}.
 * </p>
 *
 * <h3>Scores</h3>
 * <p>
 * The raw score of a row is {@code -2^(-E[h(x)] / c(n))} where {@code E[h(x)]}
 * is the mean path length over all trees and {@code c(n)} the average path
 * length for the sample size. The decision value subtracts the
 * contamination quantile of the raw training scores.
 * </p>
 *
 * <h3>Determinism</h3>
 * <p>
 * Every random choice comes from a single {@link Well19937c} seeded with
 * {@code seed}, and trees are grown sequentially.
 * </p>
 *
 * @since 1.0.0
 */
public class IsolationForest implements AnomalyEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(IsolationForest.class);

    private final int trees;
    private final int sampleSize;
    private final double contamination;
    private final long seed;

    /**
     * @param settings model settings; must not be {@code null}
     * @throws IllegalArgumentException if {@code trees} or {@code sampleSize}
     *                                  are invalid
     */
    public IsolationForest(ModelSettings settings) {
        Objects.requireNonNull(settings, "ModelSettings must not be null");
        this.trees = settings.getTrees();
        this.sampleSize = settings.getSampleSize();
        this.contamination = settings.getContamination();
        this.seed = settings.getSeed();

        if (trees < 1) {
            throw new IllegalArgumentException("trees must be >= 1, got: " + trees);
        }
        if (sampleSize < 2) {
            throw new IllegalArgumentException("sampleSize must be >= 2, got: " + sampleSize);
        }
    }

    @Override
    public FittedEstimator fit(double[][] standardized) {
        Matrices.width(standardized);
        int rows = standardized.length;
        int subsample = Math.min(sampleSize, rows);
        int heightLimit = (int) Math.ceil(Math.log(Math.max(subsample, 2)) / Math.log(2));

        RandomGenerator rng = new Well19937c(seed);
        List<IsolationTree> forest = new ArrayList<>(trees);
        for (int t = 0; t < trees; t++) {
            int[] sample = sampleWithoutReplacement(rows, subsample, rng);
            forest.add(IsolationTree.grow(standardized, sample, heightLimit, rng));
        }

        Model unshifted = new Model(forest, subsample, 0.0);
        double[] raw = new double[rows];
        for (int i = 0; i < rows; i++) {
            raw[i] = unshifted.rawScore(standardized[i]);
        }
        double offset = ContaminationOffset.of(raw, contamination);

        LOG.debug("Isolation forest grown: trees={} subsample={} heightLimit={} offset={}",
                trees, subsample, heightLimit, offset);
        return new Model(forest, subsample, offset);
    }

    @Override
    public String getName() {
        return ModelSettings.TYPE_ISOLATION_FOREST;
    }

    private static int[] sampleWithoutReplacement(int population, int count, RandomGenerator rng) {
        int[] pool = new int[population];
        for (int i = 0; i < population; i++) {
            pool[i] = i;
        }
        for (int i = 0; i < count; i++) {
            int j = i + rng.nextInt(population - i);
            int tmp = pool[i];
            pool[i] = pool[j];
            pool[j] = tmp;
        }
        int[] sample = new int[count];
        System.arraycopy(pool, 0, sample, 0, count);
        return sample;
    }

    // ---------------------------------------------------------------
    // Fitted model
    // ---------------------------------------------------------------

    /**
     * The grown forest and its decision offset.
     */
    static final class Model implements FittedEstimator {

        private final List<IsolationTree> forest;
        private final double normaliser;
        private final double offset;

        private Model(List<IsolationTree> forest, int subsample, double offset) {
            this.forest = List.copyOf(forest);
            this.normaliser = IsolationTree.averagePathLength(Math.max(subsample, 2));
            this.offset = offset;
        }

        double rawScore(double[] x) {
            double total = 0.0;
            for (IsolationTree tree : forest) {
                total += tree.pathLength(x);
            }
            double meanPath = total / forest.size();
            return -Math.pow(2.0, -meanPath / normaliser);
        }

        @Override
        public double decisionFunction(double[] standardized) {
            return rawScore(standardized) - offset;
        }

        double getOffset() {
            return offset;
        }

        int size() {
            return forest.size();
        }
    }
}
