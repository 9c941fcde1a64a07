package com.hba1cvalidation.ml;

import lombok.Value;

import java.time.Instant;

/**
 * A consistent set of fitted models, published as a unit.
 */
@Value
public class ModelSuite {

    FeatureVectorizer vectorizer;

    AnomalyDetector anomalyDetector;

    DisorderClassifier disorderClassifier;

    HbA1cCorrector hba1cCorrector;

    int trainingSize;

    Instant trainedAt;
}
