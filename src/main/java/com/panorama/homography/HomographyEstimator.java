package com.panorama.homography;

import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.SVD;

import static org.bytedeco.opencv.global.opencv_core.*;

/**
 * Direct linear transform: least-squares homography from exact correspondences.
 * <p>
 * Each pair contributes one x-row and one y-row to a 2N x 9 design matrix; the
 * homography is the right singular vector of the smallest singular value, read
 * row-major. Degenerate inputs (collinear or repeated points) are not detected here,
 * they just produce a poor fit that scoring rejects.
 */
public class HomographyEstimator {
    public static final int MIN_CORRESPONDENCES = 4;

    public HomographyMatrix estimateExact(PointCorrespondences matches) {
        int n = matches.size();
        if (n < MIN_CORRESPONDENCES) {
            throw new InsufficientCorrespondencesException(n, MIN_CORRESPONDENCES);
        }

        Mat A = designMatrix(matches);
        Mat w = new Mat(), u = new Mat(), vt = new Mat();
        SVDecomp(A, w, u, vt, SVD.FULL_UV);

        // singular values come sorted descending, so the last row of V^T spans the null space
        double[] h = new double[9];
        DoubleIndexer vtIdx = vt.createIndexer();
        for (int k = 0; k < 9; k++) h[k] = vtIdx.get(8, k);
        vtIdx.release();

        A.release(); w.release(); u.release(); vt.release();
        return HomographyMatrix.fromRowMajor(h);
    }

    static Mat designMatrix(PointCorrespondences matches) {
        int n = matches.size();
        Mat A = new Mat(2 * n, 9, CV_64F);
        DoubleIndexer a = A.createIndexer();
        for (int i = 0; i < n; i++) {
            double x = matches.srcX(i), y = matches.srcY(i);
            double u = matches.dstX(i), v = matches.dstY(i);

            long xr = 2L * i;
            a.put(xr, 0, x);  a.put(xr, 1, y);  a.put(xr, 2, 1);
            a.put(xr, 3, 0);  a.put(xr, 4, 0);  a.put(xr, 5, 0);
            a.put(xr, 6, -u * x); a.put(xr, 7, -u * y); a.put(xr, 8, -u);

            long yr = 2L * i + 1;
            a.put(yr, 0, 0);  a.put(yr, 1, 0);  a.put(yr, 2, 0);
            a.put(yr, 3, x);  a.put(yr, 4, y);  a.put(yr, 5, 1);
            a.put(yr, 6, -v * x); a.put(yr, 7, -v * y); a.put(yr, 8, -v);
        }
        a.release();
        return A;
    }
}
