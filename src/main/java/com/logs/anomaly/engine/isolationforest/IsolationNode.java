package com.logs.anomaly.engine.isolationforest;

public class IsolationNode {

    private final int splitFeature;
    private final double splitValue;
    private final IsolationNode left;
    private final IsolationNode right;
    private final int size; // rows that reached this node, leaves only

    private IsolationNode(int splitFeature, double splitValue,
                          IsolationNode left, IsolationNode right, int size) {
        this.splitFeature = splitFeature;
        this.splitValue = splitValue;
        this.left = left;
        this.right = right;
        this.size = size;
    }

    public static IsolationNode internalNode(int splitFeature, double splitValue,
                                             IsolationNode left, IsolationNode right) {
        return new IsolationNode(splitFeature, splitValue, left, right, 0);
    }

    public static IsolationNode externalNode(int size) {
        return new IsolationNode(-1, 0.0, null, null, size);
    }

    public boolean isExternal() {
        return left == null;
    }

    public double pathLength(double[] point, int currentDepth) {
        if (isExternal()) {
            return currentDepth + averagePathLength(size);
        }
        if (point[splitFeature] < splitValue) {
            return left.pathLength(point, currentDepth + 1);
        }
        return right.pathLength(point, currentDepth + 1);
    }

    /**
     * Average path length of an unsuccessful BST search over n points, used both to
     * normalise scores and to extend the path of leaves holding more than one row.
     * c(n) = 2H(n-1) - 2(n-1)/n where H(i) = ln(i) + Euler's constant (0.5772...)
     */
    public static double averagePathLength(int n) {
        if (n <= 1) return 0;
        if (n == 2) return 1;
        double harmonicNumber = Math.log(n - 1.0) + 0.5772156649;
        return 2.0 * harmonicNumber - (2.0 * (n - 1.0) / n);
    }

    public IsolationNode getLeft() { return left; }
    public IsolationNode getRight() { return right; }
    public int getSize() { return size; }
}
