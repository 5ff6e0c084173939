package com.splitdock.layouttree.tree;

/**
 * Clamp ranges and defaults shared by every layout node. Out-of-range values are clamped, never rejected;
 * NaN falls back to the default.
 */
public final class LayoutBounds {

    public static final double MIN_SPLIT_RATIO = 0.1;
    public static final double MAX_SPLIT_RATIO = 0.9;
    public static final double DEFAULT_SPLIT_RATIO = 0.5;

    public static final double MIN_SIZE = 50.0;
    public static final double MAX_SIZE = 1000.0;
    public static final double DEFAULT_MIN_SIZE = 150.0;

    private LayoutBounds() {
    }

    public static double clampSplitRatio(double ratio) {
        if (Double.isNaN(ratio)) return DEFAULT_SPLIT_RATIO;
        return Math.max(MIN_SPLIT_RATIO, Math.min(MAX_SPLIT_RATIO, ratio));
    }

    public static double clampMinSize(double size) {
        if (Double.isNaN(size)) return DEFAULT_MIN_SIZE;
        return Math.max(MIN_SIZE, Math.min(MAX_SIZE, size));
    }

    public static boolean isValidSplitRatio(double ratio) {
        return ratio >= MIN_SPLIT_RATIO && ratio <= MAX_SPLIT_RATIO;
    }
}
