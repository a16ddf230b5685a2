package com.panorama.homography;

import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.opencv.opencv_core.Mat;

import java.util.Arrays;

import static org.bytedeco.opencv.global.opencv_core.*;

/**
 * 3x3 projective transform, defined up to a nonzero scale.
 * The stored scale is whatever produced the matrix; nothing here normalizes it implicitly.
 */
public class HomographyMatrix {
    private static final double EPS = 1e-10;

    private final double[][] data;

    public HomographyMatrix(double[][] data) {
        if (data == null || data.length != 3) {
            throw new IllegalArgumentException("Homography must be 3x3");
        }
        this.data = new double[3][];
        for (int r = 0; r < 3; r++) {
            if (data[r] == null || data[r].length != 3) {
                throw new IllegalArgumentException("Homography must be 3x3");
            }
            this.data[r] = data[r].clone();
        }
    }

    public static HomographyMatrix identity() {
        return new HomographyMatrix(new double[][]{{1, 0, 0}, {0, 1, 0}, {0, 0, 1}});
    }

    public static HomographyMatrix translation(double tx, double ty) {
        return new HomographyMatrix(new double[][]{{1, 0, tx}, {0, 1, ty}, {0, 0, 1}});
    }

    /** Row-major 9-vector, as produced by the DLT null-space solve. */
    public static HomographyMatrix fromRowMajor(double[] h) {
        if (h.length != 9) throw new IllegalArgumentException("Expected 9 coefficients, got " + h.length);
        return new HomographyMatrix(new double[][]{
                {h[0], h[1], h[2]},
                {h[3], h[4], h[5]},
                {h[6], h[7], h[8]}});
    }

    public static HomographyMatrix fromMat(Mat m) {
        if (m.rows() != 3 || m.cols() != 3 || m.type() != CV_64F) {
            throw new IllegalArgumentException("Expected a 3x3 CV_64F matrix");
        }
        double[][] d = new double[3][3];
        DoubleIndexer idx = m.createIndexer();
        for (int r = 0; r < 3; r++)
            for (int c = 0; c < 3; c++)
                d[r][c] = idx.get(r, c);
        idx.release();
        return new HomographyMatrix(d);
    }

    public Mat toMat() {
        Mat m = new Mat(3, 3, CV_64F);
        DoubleIndexer idx = m.createIndexer();
        for (int r = 0; r < 3; r++)
            for (int c = 0; c < 3; c++)
                idx.put(r, c, data[r][c]);
        idx.release();
        return m;
    }

    public double get(int row, int col) {
        return data[row][col];
    }

    public double[][] getData() {
        double[][] copy = new double[3][];
        for (int r = 0; r < 3; r++) copy[r] = data[r].clone();
        return copy;
    }

    /**
     * Maps (x, y) and divides by the homogeneous coordinate.
     * Returns null when the point maps to infinity.
     */
    public double[] project(double x, double y) {
        double z_prime = data[2][0] * x + data[2][1] * y + data[2][2];
        if (Math.abs(z_prime) < EPS) return null;

        double x_prime = (data[0][0] * x + data[0][1] * y + data[0][2]) / z_prime;
        double y_prime = (data[1][0] * x + data[1][1] * y + data[1][2]) / z_prime;

        return new double[]{x_prime, y_prime};
    }

    /** this * other, so {@code other} is applied first. */
    public HomographyMatrix multiply(HomographyMatrix other) {
        Mat a = toMat();
        Mat b = other.toMat();
        Mat product = new Mat();
        gemm(a, b, 1.0, new Mat(), 0.0, product);
        HomographyMatrix result = fromMat(product);
        a.release(); b.release(); product.release();
        return result;
    }

    public double frobeniusNorm() {
        Mat m = toMat();
        double n = norm(m, NORM_L2, new Mat());
        m.release();
        return n;
    }

    public HomographyMatrix scale(double factor) {
        double[][] d = getData();
        for (int r = 0; r < 3; r++)
            for (int c = 0; c < 3; c++)
                d[r][c] *= factor;
        return new HomographyMatrix(d);
    }

    @Override
    public String toString() {
        return Arrays.deepToString(data);
    }
}
