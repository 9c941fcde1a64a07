package com.hba1cvalidation.ml;

import com.hba1cvalidation.exception.ModelNotTrainedException;
import com.hba1cvalidation.ml.tree.RegressionTreeBuilder;
import com.hba1cvalidation.ml.tree.TreeNode;
import com.hba1cvalidation.model.DisorderCategory;
import com.hba1cvalidation.model.LabField;
import com.hba1cvalidation.model.PatientRecord;
import com.hba1cvalidation.model.TrainingExample;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Gradient-boosted regression trees predicting how far the measured HbA1c is
 * from the value implied by actual glucose exposure.
 *
 * The model learns the residual (true - measured) so a disorder-free profile
 * predicts a correction near zero. When the RBC lifespan is not supplied, the
 * lifespan slot is filled from the disorder context: the true label at fit
 * time, the classifier's prediction at inference time.
 */
@Slf4j
public class HbA1cCorrector {

    public static final String MODEL_TYPE = "Gradient Boosting Regressor";

    static final double MIN_HBA1C = 3.0;
    static final double MAX_HBA1C = 20.0;
    private static final double NEGLIGIBLE_DELTA = 0.05;

    private final FeatureVectorizer vectorizer;
    private final ModelHyperparameters params;

    private volatile Ensemble ensemble;

    public HbA1cCorrector(FeatureVectorizer vectorizer, ModelHyperparameters params) {
        this.vectorizer = vectorizer;
        this.params = params;
    }

    public boolean isTrained() {
        return ensemble != null;
    }

    public void fit(List<TrainingExample> examples) {
        if (examples.isEmpty()) {
            throw new IllegalArgumentException("Cannot fit HbA1c corrector on an empty corpus");
        }
        int n = examples.size();
        double[][] x = new double[n][];
        double[] target = new double[n];
        double base = 0.0;
        for (int i = 0; i < n; i++) {
            TrainingExample example = examples.get(i);
            FeatureVector vector = vectorizer.vectorize(example.getRecord());
            x[i] = withLifespanContext(example.getRecord(), vector, Optional.of(example.getLabel())).toArray();
            target[i] = example.correctionResidual();
            base += target[i];
        }
        base /= n;

        int[] all = new int[n];
        double[] current = new double[n];
        for (int i = 0; i < n; i++) {
            all[i] = i;
            current[i] = base;
        }
        RegressionTreeBuilder builder = new RegressionTreeBuilder(
            params.getBoostingMaxDepth(), params.getBoostingMinSamplesLeaf());
        double learningRate = params.getBoostingLearningRate();
        double[] residual = new double[n];
        List<TreeNode> stages = new ArrayList<>(params.getBoostingStages());
        for (int m = 0; m < params.getBoostingStages(); m++) {
            for (int i = 0; i < n; i++) {
                residual[i] = target[i] - current[i];
            }
            TreeNode tree = builder.build(x, residual, all);
            for (int i = 0; i < n; i++) {
                current[i] += learningRate * tree.predict(x[i]);
            }
            stages.add(tree);
        }

        double sse = 0.0;
        for (int i = 0; i < n; i++) {
            double e = target[i] - current[i];
            sse += e * e;
        }
        ensemble = new Ensemble(base, learningRate, Collections.unmodifiableList(stages));
        log.info("HbA1c corrector fitted: {} stages on {} examples, training RMSE {}",
            stages.size(), n, String.format(Locale.ROOT, "%.4f", Math.sqrt(sse / n)));
    }

    public Hba1cCorrection predictCorrectedHba1c(PatientRecord record) {
        requireTrained();
        return predictCorrectedHba1c(record, vectorizer.vectorize(record), Optional.empty());
    }

    /**
     * @param disorderContext disorder used to impute an absent RBC lifespan
     */
    public Hba1cCorrection predictCorrectedHba1c(PatientRecord record, FeatureVector vector,
                                                 Optional<DisorderCategory> disorderContext) {
        Ensemble model = requireTrained();

        OptionalDouble observed = record.lab(LabField.RBC_LIFESPAN_DAYS);
        Hba1cCorrection.LifespanSource source;
        double lifespan;
        if (vector.isPresent(FeatureVectorizer.valueIndex(LabField.RBC_LIFESPAN_DAYS)) && observed.isPresent()) {
            source = Hba1cCorrection.LifespanSource.OBSERVED;
            lifespan = observed.getAsDouble();
        } else if (disorderContext.isPresent()) {
            source = Hba1cCorrection.LifespanSource.PREDICTED_DISORDER;
            lifespan = disorderContext.get().getTypicalLifespanDays();
        } else {
            source = Hba1cCorrection.LifespanSource.POPULATION_DEFAULT;
            lifespan = LabField.RBC_LIFESPAN_DAYS.getDefaultValue();
        }

        double[] x = withLifespanContext(record, vector, disorderContext).toArray();
        double reported = record.getHba1c();
        double corrected = clamp(reported + model.predict(x), reported);
        double delta = corrected - reported;

        return Hba1cCorrection.builder()
            .reportedHba1c(reported)
            .correctedHba1c(corrected)
            .delta(delta)
            .rbcLifespanDays(lifespan)
            .lifespanSource(source)
            .rationale(rationale(delta, lifespan, source, disorderContext))
            .build();
    }

    private FeatureVector withLifespanContext(PatientRecord record, FeatureVector vector,
                                              Optional<DisorderCategory> context) {
        boolean lifespanSupplied = vector.isPresent(FeatureVectorizer.valueIndex(LabField.RBC_LIFESPAN_DAYS));
        if (lifespanSupplied || context.isEmpty()) {
            return vector;
        }
        return vectorizer.withImputedLab(vector, LabField.RBC_LIFESPAN_DAYS, context.get().getTypicalLifespanDays());
    }

    private static String rationale(double delta, double lifespan, Hba1cCorrection.LifespanSource source,
                                    Optional<DisorderCategory> context) {
        String lifespanText = switch (source) {
            case OBSERVED -> String.format(Locale.ROOT, "observed RBC lifespan of %.0f days", lifespan);
            case PREDICTED_DISORDER -> String.format(Locale.ROOT,
                "RBC lifespan of %.0f days imputed from predicted %s", lifespan,
                context.map(DisorderCategory::getCode).orElse("disorder"));
            case POPULATION_DEFAULT -> String.format(Locale.ROOT,
                "RBC lifespan assumed normal at %.0f days", lifespan);
        };
        if (Math.abs(delta) < NEGLIGIBLE_DELTA) {
            return String.format(Locale.ROOT,
                "No material correction needed (%+.2f points); %s.", delta, lifespanText);
        }
        double deviation = DisorderCategory.NORMAL_RBC_LIFESPAN_DAYS - lifespan;
        String direction = delta < 0 ? "overestimates" : "underestimates";
        return String.format(Locale.ROOT,
            "Reported HbA1c likely %s glycemic exposure by %.2f points; %s, %.0f days %s the normal %.0f-day lifespan.",
            direction, Math.abs(delta), lifespanText, Math.abs(deviation),
            deviation >= 0 ? "short of" : "beyond", DisorderCategory.NORMAL_RBC_LIFESPAN_DAYS);
    }

    private static double clamp(double value, double reported) {
        return Math.max(Math.min(MIN_HBA1C, reported), Math.min(MAX_HBA1C, value));
    }

    private Ensemble requireTrained() {
        Ensemble model = ensemble;
        if (model == null) {
            throw new ModelNotTrainedException("HbA1c corrector has not been trained");
        }
        return model;
    }

    private static final class Ensemble {
        final double base;
        final double learningRate;
        final List<TreeNode> stages;

        Ensemble(double base, double learningRate, List<TreeNode> stages) {
            this.base = base;
            this.learningRate = learningRate;
            this.stages = stages;
        }

        double predict(double[] x) {
            double value = base;
            for (TreeNode tree : stages) {
                value += learningRate * tree.predict(x);
            }
            return value;
        }
    }
}
