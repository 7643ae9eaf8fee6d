package com.forecastalpha.analysis.analytics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Isolation forest with automatic contamination: the decision score is {@code 0.5 - s(x)} where
 * {@code s(x) = 2^(-E[h(x)] / c(psi))}, so lower scores are more anomalous and negative scores
 * mark points that isolate faster than average.
 */
public final class IsolationForest {

    public static final int DEFAULT_TREES = 100;
    public static final int DEFAULT_SUBSAMPLE = 256;

    private static final double EULER_GAMMA = 0.5772156649015329d;

    private final List<Node> trees;
    private final int subsampleSize;

    private IsolationForest(List<Node> trees, int subsampleSize) {
        this.trees = trees;
        this.subsampleSize = subsampleSize;
    }

    public static IsolationForest fit(double[][] data, long seed) {
        return fit(data, DEFAULT_TREES, DEFAULT_SUBSAMPLE, seed);
    }

    /**
     * @param data       rows of feature vectors, all the same width
     * @param treeCount  number of isolation trees
     * @param subsample  rows drawn (without replacement) per tree, capped at the row count
     * @param seed       seed for every random draw, making the fit reproducible
     */
    public static IsolationForest fit(double[][] data, int treeCount, int subsample, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("cannot fit an isolation forest on an empty matrix");
        }
        int sampleSize = Math.min(subsample, data.length);
        int maxDepth = (int) Math.ceil(Math.log(Math.max(sampleSize, 2)) / Math.log(2));
        Random random = new Random(seed);
        List<Node> trees = new ArrayList<>(treeCount);
        for (int i = 0; i < treeCount; i++) {
            double[][] sample = subsample(data, sampleSize, random);
            trees.add(build(sample, 0, maxDepth, random));
        }
        return new IsolationForest(trees, sampleSize);
    }

    public double decisionScore(double[] point) {
        double averagePath = 0d;
        for (Node tree : trees) {
            averagePath += pathLength(tree, point, 0);
        }
        averagePath /= trees.size();
        double normaliser = averagePathLength(subsampleSize);
        double anomalyScore = normaliser <= 0 ? 0.5d : Math.pow(2d, -averagePath / normaliser);
        return 0.5d - anomalyScore;
    }

    public double[] decisionScores(double[][] data) {
        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            scores[i] = decisionScore(data[i]);
        }
        return scores;
    }

    /**
     * Average path length of an unsuccessful binary-search-tree lookup among {@code n} points.
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0d;
        }
        if (n == 2) {
            return 1d;
        }
        double harmonic = Math.log(n - 1d) + EULER_GAMMA;
        return 2d * harmonic - 2d * (n - 1d) / n;
    }

    private static double pathLength(Node node, double[] point, int depth) {
        if (node.isLeaf()) {
            return depth + averagePathLength(node.size);
        }
        Node next = point[node.feature] < node.split ? node.left : node.right;
        return pathLength(next, point, depth + 1);
    }

    private static Node build(double[][] rows, int depth, int maxDepth, Random random) {
        if (depth >= maxDepth || rows.length <= 1) {
            return Node.leaf(rows.length);
        }
        int width = rows[0].length;
        double[] min = new double[width];
        double[] max = new double[width];
        Arrays.fill(min, Double.POSITIVE_INFINITY);
        Arrays.fill(max, Double.NEGATIVE_INFINITY);
        for (double[] row : rows) {
            for (int f = 0; f < width; f++) {
                min[f] = Math.min(min[f], row[f]);
                max[f] = Math.max(max[f], row[f]);
            }
        }
        List<Integer> splittable = new ArrayList<>(width);
        for (int f = 0; f < width; f++) {
            if (max[f] > min[f]) {
                splittable.add(f);
            }
        }
        if (splittable.isEmpty()) {
            return Node.leaf(rows.length);
        }
        int feature = splittable.get(random.nextInt(splittable.size()));
        double split = min[feature] + random.nextDouble() * (max[feature] - min[feature]);
        List<double[]> left = new ArrayList<>();
        List<double[]> right = new ArrayList<>();
        for (double[] row : rows) {
            if (row[feature] < split) {
                left.add(row);
            } else {
                right.add(row);
            }
        }
        return Node.split(
                feature,
                split,
                rows.length,
                build(left.toArray(new double[0][]), depth + 1, maxDepth, random),
                build(right.toArray(new double[0][]), depth + 1, maxDepth, random)
        );
    }

    private static double[][] subsample(double[][] data, int size, Random random) {
        if (data.length <= size) {
            return Arrays.copyOf(data, data.length);
        }
        int[] indices = new int[data.length];
        for (int i = 0; i < data.length; i++) {
            indices[i] = i;
        }
        double[][] sample = new double[size][];
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }

    private static final class Node {
        private final int feature;
        private final double split;
        private final int size;
        private final Node left;
        private final Node right;

        private Node(int feature, double split, int size, Node left, Node right) {
            this.feature = feature;
            this.split = split;
            this.size = size;
            this.left = left;
            this.right = right;
        }

        static Node leaf(int size) {
            return new Node(-1, Double.NaN, size, null, null);
        }

        static Node split(int feature, double split, int size, Node left, Node right) {
            return new Node(feature, split, size, left, right);
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
