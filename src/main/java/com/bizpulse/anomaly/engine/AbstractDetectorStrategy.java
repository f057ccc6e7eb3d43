package com.bizpulse.anomaly.engine;

import com.bizpulse.anomaly.model.AnomalyLabel;
import com.bizpulse.anomaly.model.DetectionResult;
import com.bizpulse.anomaly.model.FeatureMatrix;
import com.bizpulse.anomaly.model.ScoreOrientation;
import com.bizpulse.anomaly.model.TrainingOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Shared lifecycle for detector strategies.
 *
 * <p>Subclasses only implement {@link #fit} and {@link #evaluate}. This class turns every failure
 * mode (disabled, untrained, schema mismatch, exceptions) into the neutral result, and holds the
 * fitted model as an immutable snapshot that {@code train} replaces in one volatile write.</p>
 *
 * @param <M> the fitted model type; must not be mutated after {@link #fit} returns
 */
public abstract class AbstractDetectorStrategy<M> implements DetectorStrategy {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final String name;
    private final ScoreOrientation orientation;
    private final boolean enabled;

    private volatile Fitted<M> fitted;

    protected AbstractDetectorStrategy(String name, ScoreOrientation orientation, boolean enabled) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.orientation = Objects.requireNonNull(orientation, "orientation must not be null");
        this.enabled = enabled;
    }

    /**
     * Fit a model on non-empty training data.
     */
    protected abstract M fit(FeatureMatrix data);

    /**
     * Score non-empty data against a fitted model.
     */
    protected abstract DetectionResult evaluate(M model, FeatureMatrix data);

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isAvailable() {
        return enabled;
    }

    @Override
    public boolean isTrained() {
        return fitted != null;
    }

    @Override
    public ScoreOrientation scoreOrientation() {
        return orientation;
    }

    @Override
    public final TrainingOutcome train(FeatureMatrix data) {
        if (!isAvailable()) {
            log.warn("Strategy [{}] is disabled; skipping training", name);
            return TrainingOutcome.failed(name, "Strategy " + name + " is not available");
        }
        if (data == null || data.isEmpty()) {
            log.warn("Strategy [{}]: empty training data provided", name);
            return TrainingOutcome.failed(name, "Empty training data provided");
        }
        try {
            M model = fit(data);
            this.fitted = new Fitted<>(data.getColumns(), model);
            log.info("Strategy [{}] trained on {} rows x {} features", name, data.size(), data.featureCount());
            return TrainingOutcome.succeeded(name, describe(model));
        } catch (RuntimeException e) {
            log.error("Error training strategy [{}]: {}", name, e.getMessage(), e);
            return TrainingOutcome.failed(name, "Training error: " + e.getMessage());
        }
    }

    @Override
    public final DetectionResult detect(FeatureMatrix data) {
        int size = data == null ? 0 : data.size();
        Fitted<M> current = this.fitted;

        if (!isAvailable() || current == null) {
            log.warn("Strategy [{}] not trained or unavailable, returning neutral predictions", name);
            return DetectionResult.neutral(name, orientation, size);
        }
        if (size == 0) {
            return new DetectionResult(name, orientation, true, new AnomalyLabel[0], new double[0]);
        }
        if (!current.columns().equals(data.getColumns())) {
            log.warn("Strategy [{}]: schema {} differs from training schema {}, returning neutral predictions",
                    name, data.getColumns(), current.columns());
            return DetectionResult.neutral(name, orientation, size);
        }
        try {
            return evaluate(current.model(), data);
        } catch (RuntimeException e) {
            log.error("Error predicting with strategy [{}]: {}", name, e.getMessage(), e);
            return DetectionResult.neutral(name, orientation, size);
        }
    }

    /**
     * Short training summary for the outcome message.
     */
    protected String describe(M model) {
        return name + " trained successfully";
    }

    /**
     * Evaluate rows one at a time. A row whose evaluation throws is logged and reported as
     * normal with a zero score; the rest of the batch is unaffected.
     */
    protected DetectionResult perRow(int size, RowEvaluator evaluator) {
        AnomalyLabel[] labels = new AnomalyLabel[size];
        double[] scores = new double[size];
        for (int r = 0; r < size; r++) {
            try {
                RowOutcome outcome = evaluator.evaluate(r);
                labels[r] = outcome.label();
                scores[r] = outcome.score();
            } catch (RuntimeException e) {
                log.warn("Strategy [{}]: failed to score row {}, treating as normal: {}", name, r, e.getMessage());
                labels[r] = AnomalyLabel.NORMAL;
                scores[r] = 0.0;
            }
        }
        return new DetectionResult(name, orientation, true, labels, scores);
    }

    @FunctionalInterface
    protected interface RowEvaluator {
        RowOutcome evaluate(int row);
    }

    protected record RowOutcome(AnomalyLabel label, double score) {

        public static RowOutcome of(boolean anomalous, double score) {
            return new RowOutcome(AnomalyLabel.of(anomalous), score);
        }
    }

    private record Fitted<M>(List<String> columns, M model) {
    }
}
