package com.bridgesentinel.core.scoring;

import com.bridgesentinel.core.config.ModelSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Fits a {@link FittedScoringModel} from a historical feature snapshot.
 *
 * <h3>Steps</h3>
 * <ol>
 * <li>Median imputation statistics from the raw snapshot</li>
 * <li>Mean and standard deviation from the imputed snapshot</li>
 * <li>Estimator fit on the standardized matrix</li>
 * </ol>
 *
 * <p>
 * The fitted model then scores the training rows once more to produce
 * {@link TrainingDiagnostics}.
 * </p>
 *
 * @since 1.0.0
 */
public class ModelTrainer {

    private static final Logger LOG = LoggerFactory.getLogger(ModelTrainer.class);

    private final AnomalyEstimator estimator;

    public ModelTrainer(ModelSettings settings) {
        this(EstimatorFactory.create(settings));
    }

    public ModelTrainer(AnomalyEstimator estimator) {
        this.estimator = Objects.requireNonNull(estimator, "estimator must not be null");
    }

    /**
     * Train on the given snapshot.
     *
     * @param snapshot raw feature rows, absent values as NaN; all rows must
     *                 have the same width
     * @return the fitted model and its diagnostics
     * @throws EmptyTrainingSetException if {@code snapshot} is empty
     * @throws IllegalArgumentException  if rows have inconsistent widths
     */
    public TrainingResult train(List<double[]> snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        if (snapshot.isEmpty()) {
            throw new EmptyTrainingSetException("No historical rows to train on");
        }

        double[][] raw = snapshot.toArray(new double[0][]);
        int width = Matrices.width(raw);

        MedianImputer imputer = MedianImputer.fit(raw);
        double[][] imputed = new double[raw.length][];
        for (int i = 0; i < raw.length; i++) {
            imputed[i] = imputer.transform(raw[i]);
        }
        LOG.info("Imputed missing values (median strategy) over {} feature(s)", width);

        StandardScaler scaler = StandardScaler.fit(imputed);
        double[][] standardized = new double[imputed.length][];
        for (int i = 0; i < imputed.length; i++) {
            standardized[i] = scaler.transform(imputed[i]);
        }
        LOG.info("Fitted standard scaler");

        LOG.info("Training {} estimator on {} row(s)...", estimator.getName(), raw.length);
        FittedEstimator fitted = estimator.fit(standardized);
        FittedScoringModel model = new FittedScoringModel(imputer, scaler, fitted, width);

        TrainingDiagnostics diagnostics = diagnose(fitted, standardized);
        LOG.info("Model trained: {} / {} training row(s) flagged ({}%), score range [{}, {}]",
                diagnostics.getAnomalies(), diagnostics.getRows(),
                String.format("%.1f", diagnostics.getAnomalyPercent()),
                String.format("%.4f", diagnostics.getMinScore()),
                String.format("%.4f", diagnostics.getMaxScore()));

        return new TrainingResult(model, diagnostics);
    }

    private static TrainingDiagnostics diagnose(FittedEstimator fitted, double[][] standardized) {
        int anomalies = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double[] row : standardized) {
            double decision = fitted.decisionFunction(row);
            if (decision < 0.0) {
                anomalies++;
            }
            min = Math.min(min, decision);
            max = Math.max(max, decision);
        }
        return new TrainingDiagnostics(standardized.length, anomalies, min, max);
    }
}
