package com.alertengine.engine.scoring;

import com.alertengine.core.model.TrainingSample;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Logistic regression over the feature map, trained by full-batch gradient descent on the soft
 * labels carried by training samples. Training is deterministic for a given sample list.
 */
public final class LogisticFeedbackClassifier implements FeedbackClassifier {
    public static final int DEFAULT_EPOCHS = 200;
    public static final double DEFAULT_LEARNING_RATE = 0.5;
    private static final double L2_PENALTY = 0.001;

    private final Map<String, Double> weights;
    private final double bias;
    private final int trainedOn;

    LogisticFeedbackClassifier(Map<String, Double> weights, double bias, int trainedOn) {
        this.weights = Map.copyOf(weights);
        this.bias = bias;
        this.trainedOn = trainedOn;
    }

    public static LogisticFeedbackClassifier train(List<TrainingSample> samples) {
        return train(samples, DEFAULT_EPOCHS, DEFAULT_LEARNING_RATE);
    }

    public static LogisticFeedbackClassifier train(List<TrainingSample> samples, int epochs, double learningRate) {
        if (samples == null || samples.isEmpty()) {
            throw new IllegalArgumentException("Cannot train without samples");
        }
        TreeSet<String> names = new TreeSet<>();
        for (TrainingSample sample : samples) {
            names.addAll(sample.features().keySet());
        }
        Map<String, Double> weights = new TreeMap<>();
        for (String name : names) {
            weights.put(name, 0.0);
        }
        double bias = 0.0;
        int n = samples.size();

        for (int epoch = 0; epoch < epochs; epoch++) {
            Map<String, Double> gradients = new TreeMap<>();
            double biasGradient = 0.0;
            for (TrainingSample sample : samples) {
                double error = sigmoid(bias + dot(weights, sample.features()))
                        - ScoreVector.clamp(sample.feedbackScore());
                for (Map.Entry<String, Double> feature : sample.features().entrySet()) {
                    gradients.merge(feature.getKey(), error * feature.getValue(), Double::sum);
                }
                biasGradient += error;
            }
            for (String name : names) {
                double current = weights.get(name);
                double gradient = gradients.getOrDefault(name, 0.0) / n + L2_PENALTY * current;
                weights.put(name, current - learningRate * gradient);
            }
            bias -= learningRate * biasGradient / n;
        }
        return new LogisticFeedbackClassifier(weights, bias, n);
    }

    @Override
    public double predictUsefulness(Map<String, Double> features) {
        return sigmoid(bias + dot(weights, features));
    }

    @Override
    public int trainedOn() {
        return trainedOn;
    }

    public Map<String, Double> weights() {
        return weights;
    }

    public double bias() {
        return bias;
    }

    private static double dot(Map<String, Double> weights, Map<String, Double> features) {
        double sum = 0.0;
        for (Map.Entry<String, Double> feature : features.entrySet()) {
            Double weight = weights.get(feature.getKey());
            if (weight != null && feature.getValue() != null) {
                sum += weight * feature.getValue();
            }
        }
        return sum;
    }

    private static double sigmoid(double z) {
        return 1.0 / (1.0 + Math.exp(-z));
    }
}
