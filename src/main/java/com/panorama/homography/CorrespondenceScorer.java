package com.panorama.homography;

import java.util.Arrays;

/**
 * Classifies correspondences as inliers/outliers under a homography.
 * A pair is an inlier iff the Euclidean distance between H(src) and dst is strictly below maxErr.
 */
public class CorrespondenceScorer {

    public FitScore score(HomographyMatrix H, PointCorrespondences matches, double maxErr) {
        int n = matches.size();
        if (n == 0) return new FitScore(0.0, FitScore.NO_INLIERS_MSE, 0);

        int inliers = 0;
        double sumSq = 0.0;
        for (int i = 0; i < n; i++) {
            double err = reprojectionError(H, matches, i);
            if (err < maxErr) {
                inliers++;
                sumSq += err * err;
            }
        }
        double distMse = inliers == 0 ? FitScore.NO_INLIERS_MSE : sumSq / inliers;
        return new FitScore((double) inliers / n, distMse, inliers);
    }

    public PointCorrespondences selectInliers(HomographyMatrix H, PointCorrespondences matches, double maxErr) {
        return matches.subset(inlierIndices(H, matches, maxErr));
    }

    public int[] inlierIndices(HomographyMatrix H, PointCorrespondences matches, double maxErr) {
        int[] idx = new int[matches.size()];
        int count = 0;
        for (int i = 0; i < matches.size(); i++) {
            if (reprojectionError(H, matches, i) < maxErr) idx[count++] = i;
        }
        return Arrays.copyOf(idx, count);
    }

    /** Infinite when the source point maps to infinity (or the matrix is not finite). */
    public static double reprojectionError(HomographyMatrix H, PointCorrespondences matches, int i) {
        double[] p = H.project(matches.srcX(i), matches.srcY(i));
        if (p == null) return Double.POSITIVE_INFINITY;
        double err = Math.hypot(p[0] - matches.dstX(i), p[1] - matches.dstY(i));
        return Double.isNaN(err) ? Double.POSITIVE_INFINITY : err;
    }
}
