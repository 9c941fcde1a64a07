package com.hba1cvalidation.ml;

import com.hba1cvalidation.exception.ModelNotTrainedException;
import com.hba1cvalidation.ml.tree.ClassificationTreeBuilder;
import com.hba1cvalidation.ml.tree.TreeNode;
import com.hba1cvalidation.model.DisorderCategory;
import com.hba1cvalidation.model.PatientRecord;
import com.hba1cvalidation.model.TrainingExample;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Random forest over the full feature vector predicting the {@link DisorderCategory}.
 *
 * Each tree is grown on a bootstrap sample with sqrt(p) candidate features per
 * split; per-tree randomness is seeded so fitting is reproducible. Ties between
 * top categories go to the earlier category in declaration order.
 */
@Slf4j
public class DisorderClassifier {

    public static final String MODEL_TYPE = "Random Forest Classifier";

    private static final DisorderCategory[] CATEGORIES = DisorderCategory.values();

    private final FeatureVectorizer vectorizer;
    private final ModelHyperparameters params;

    private volatile List<TreeNode> forest;

    public DisorderClassifier(FeatureVectorizer vectorizer, ModelHyperparameters params) {
        this.vectorizer = vectorizer;
        this.params = params;
    }

    public boolean isTrained() {
        return forest != null;
    }

    public List<String> getCategories() {
        return DisorderCategory.codes();
    }

    public void fit(List<TrainingExample> examples) {
        if (examples.isEmpty()) {
            throw new IllegalArgumentException("Cannot fit disorder classifier on an empty corpus");
        }
        int n = examples.size();
        double[][] x = new double[n][];
        int[] y = new int[n];
        for (int i = 0; i < n; i++) {
            TrainingExample example = examples.get(i);
            x[i] = vectorizer.vectorize(example.getRecord()).toArray();
            y[i] = example.getLabel().ordinal();
        }

        int featuresPerSplit = (int) Math.round(Math.sqrt(FeatureVectorizer.SIZE));
        List<TreeNode> trees = new ArrayList<>(params.getForestTrees());
        for (int t = 0; t < params.getForestTrees(); t++) {
            Random random = new Random(params.getSeed() * 1_000_003L + t);
            int[] bootstrap = new int[n];
            for (int i = 0; i < n; i++) {
                bootstrap[i] = random.nextInt(n);
            }
            ClassificationTreeBuilder builder = new ClassificationTreeBuilder(CATEGORIES.length,
                params.getForestMaxDepth(), params.getForestMinSamplesLeaf(), featuresPerSplit, random);
            trees.add(builder.build(x, y, bootstrap));
        }
        forest = Collections.unmodifiableList(trees);
        log.info("Disorder classifier fitted: {} trees on {} examples", trees.size(), n);
    }

    public DisorderPrediction predictDisorder(PatientRecord record) {
        requireTrained();
        return predictDisorder(vectorizer.vectorize(record));
    }

    public DisorderPrediction predictDisorder(FeatureVector vector) {
        List<TreeNode> trees = requireTrained();
        double[] x = vector.toArray();
        double[] sums = new double[CATEGORIES.length];
        for (TreeNode tree : trees) {
            tree.accumulate(x, sums);
        }
        double total = 0.0;
        for (double s : sums) {
            total += s;
        }

        Map<DisorderCategory, Double> probabilities = new EnumMap<>(DisorderCategory.class);
        DisorderCategory best = CATEGORIES[0];
        double bestProbability = -1.0;
        for (DisorderCategory category : CATEGORIES) {
            double p = sums[category.ordinal()] / total;
            probabilities.put(category, p);
            // strict comparison keeps the higher-priority category on ties
            if (p > bestProbability) {
                best = category;
                bestProbability = p;
            }
        }

        return DisorderPrediction.builder()
            .predictedCategory(best)
            .probabilities(Collections.unmodifiableMap(probabilities))
            .confidence(bestProbability)
            .build();
    }

    private List<TreeNode> requireTrained() {
        List<TreeNode> trees = forest;
        if (trees == null) {
            throw new ModelNotTrainedException("Disorder classifier has not been trained");
        }
        return trees;
    }
}
