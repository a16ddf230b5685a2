package com.panorama.homography;

/**
 * Matched point pairs: source point i corresponds to destination point i.
 * Coordinates are pixel (column, row). Instances are immutable.
 */
public class PointCorrespondences {
    private final double[] srcX, srcY;
    private final double[] dstX, dstY;

    private PointCorrespondences(double[] srcX, double[] srcY, double[] dstX, double[] dstY) {
        this.srcX = srcX;
        this.srcY = srcY;
        this.dstX = dstX;
        this.dstY = dstY;
    }

    /**
     * @param src N x 2 array of (x, y) source points
     * @param dst N x 2 array of (x, y) destination points
     */
    public static PointCorrespondences of(double[][] src, double[][] dst) {
        if (src == null || dst == null) {
            throw new IllegalArgumentException("Source and destination points are required");
        }
        if (src.length != dst.length) {
            throw new IllegalArgumentException("Source has " + src.length + " points but destination has " + dst.length);
        }
        int n = src.length;
        double[] sx = new double[n], sy = new double[n], dx = new double[n], dy = new double[n];
        for (int i = 0; i < n; i++) {
            if (src[i] == null || src[i].length != 2 || dst[i] == null || dst[i].length != 2) {
                throw new IllegalArgumentException("Point " + i + " is not an (x, y) pair");
            }
            sx[i] = src[i][0]; sy[i] = src[i][1];
            dx[i] = dst[i][0]; dy[i] = dst[i][1];
        }
        return new PointCorrespondences(sx, sy, dx, dy);
    }

    public int size() {
        return srcX.length;
    }

    public double srcX(int i) { return srcX[i]; }
    public double srcY(int i) { return srcY[i]; }
    public double dstX(int i) { return dstX[i]; }
    public double dstY(int i) { return dstY[i]; }

    /** Pairs at the given indices, in the given order. */
    public PointCorrespondences subset(int[] indices) {
        int n = indices.length;
        double[] sx = new double[n], sy = new double[n], dx = new double[n], dy = new double[n];
        for (int k = 0; k < n; k++) {
            int i = indices[k];
            sx[k] = srcX[i]; sy[k] = srcY[i];
            dx[k] = dstX[i]; dy[k] = dstY[i];
        }
        return new PointCorrespondences(sx, sy, dx, dy);
    }

    /** Same pairs with source and destination roles exchanged. */
    public PointCorrespondences swapped() {
        return new PointCorrespondences(dstX, dstY, srcX, srcY);
    }
}
