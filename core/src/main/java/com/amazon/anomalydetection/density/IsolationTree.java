/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.anomalydetection.density;

import static com.amazon.anomalydetection.CommonUtils.checkArgument;

import java.util.Random;

/**
 * A binary tree that isolates the points of a sub-sample with random
 * axis-parallel cuts. Each internal node picks a dimension uniformly among
 * those whose values still differ, and a split value uniformly within the
 * observed range of that dimension. A node becomes a leaf when it holds at most
 * one point, when its points are identical, or at the maximum depth.
 */
public class IsolationTree {

    /**
     * Euler-Mascheroni constant, used to approximate harmonic numbers.
     */
    public static final double EULER_CONSTANT = 0.5772156649;

    private final Node root;

    private final int maxDepth;

    private IsolationTree(Node root, int maxDepth) {
        this.root = root;
        this.maxDepth = maxDepth;
    }

    /**
     * @param points   the sub-sample; the tree keeps no reference to it
     * @param maxDepth the maximum number of edges from the root to a leaf
     * @param random   source of the cut choices
     * @return the tree
     */
    public static IsolationTree build(double[][] points, int maxDepth, Random random) {
        checkArgument(points.length > 0, "cannot build a tree without points");
        checkArgument(maxDepth >= 0, "maxDepth cannot be negative");
        int[] indices = new int[points.length];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = i;
        }
        return new IsolationTree(grow(points, indices, 0, indices.length, 0, maxDepth, random), maxDepth);
    }

    // partitions indices[from, to) in place
    private static Node grow(double[][] points, int[] indices, int from, int to, int depth, int maxDepth,
            Random random) {
        int size = to - from;
        if (size <= 1 || depth >= maxDepth) {
            return new Node(size);
        }
        int dimensions = points[indices[from]].length;
        double[] min = new double[dimensions];
        double[] max = new double[dimensions];
        for (int d = 0; d < dimensions; d++) {
            min[d] = Double.POSITIVE_INFINITY;
            max[d] = Double.NEGATIVE_INFINITY;
        }
        for (int i = from; i < to; i++) {
            double[] point = points[indices[i]];
            for (int d = 0; d < dimensions; d++) {
                min[d] = Math.min(min[d], point[d]);
                max[d] = Math.max(max[d], point[d]);
            }
        }
        int[] candidates = new int[dimensions];
        int candidateCount = 0;
        for (int d = 0; d < dimensions; d++) {
            if (max[d] > min[d]) {
                candidates[candidateCount++] = d;
            }
        }
        if (candidateCount == 0) {
            return new Node(size);
        }
        int dimension = candidates[random.nextInt(candidateCount)];
        Cut cut = new Cut(dimension, min[dimension] + random.nextDouble() * (max[dimension] - min[dimension]));

        int boundary = from;
        for (int i = from; i < to; i++) {
            if (Cut.isLeftOf(points[indices[i]], cut)) {
                int t = indices[i];
                indices[i] = indices[boundary];
                indices[boundary++] = t;
            }
        }
        return new Node(cut, grow(points, indices, from, boundary, depth + 1, maxDepth, random),
                grow(points, indices, boundary, to, depth + 1, maxDepth, random), size);
    }

    /**
     * The number of edges from the root to the leaf the point falls into, plus
     * the expected remaining path length {@link #averagePathLength(int)} when that
     * leaf holds more than one point.
     *
     * @param point a point of the tree's dimensionality
     * @return the adjusted path length
     */
    public double pathLength(double[] point) {
        Node node = root;
        int depth = 0;
        while (!node.isLeaf()) {
            node = Cut.isLeftOf(point, node.cut) ? node.left : node.right;
            ++depth;
        }
        return depth + averagePathLength(node.size);
    }

    /**
     * Expected path length of an unsuccessful search in a binary search tree over
     * {@code n} points: {@code 2 H(n-1) - 2 (n-1) / n} with
     * {@code H(i) ~ ln(i) + 0.5772156649}, 1 for two points and 0 below.
     *
     * @param n number of points
     * @return the normalizing path length
     */
    public static double averagePathLength(int n) {
        if (n > 2) {
            return 2 * (Math.log(n - 1.0) + EULER_CONSTANT) - 2.0 * (n - 1) / n;
        }
        return (n == 2) ? 1 : 0;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * @return the height of the tree
     */
    public int getDepth() {
        return depth(root);
    }

    private static int depth(Node node) {
        return node.isLeaf() ? 0 : 1 + Math.max(depth(node.left), depth(node.right));
    }

    private static class Node {
        private final Cut cut;
        private final Node left;
        private final Node right;
        private final int size;

        Node(int size) {
            this(null, null, null, size);
        }

        Node(Cut cut, Node left, Node right, int size) {
            this.cut = cut;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        boolean isLeaf() {
            return cut == null;
        }
    }
}
