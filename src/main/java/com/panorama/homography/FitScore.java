package com.panorama.homography;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * How well a homography explains a correspondence set.
 * distMse is the mean squared reprojection distance over inliers only, or
 * {@link #NO_INLIERS_MSE} when there are none.
 */
@Getter
@AllArgsConstructor
public class FitScore {
    public static final double NO_INLIERS_MSE = 1e9;

    private final double fitPercent;
    private final double distMse;
    private final int inlierCount;

    public boolean hasInliers() {
        return inlierCount > 0;
    }

    @Override
    public String toString() {
        return String.format("FitScore[fitPercent=%.4f, distMse=%.6f, inliers=%d]", fitPercent, distMse, inlierCount);
    }
}
