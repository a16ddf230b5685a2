package com.panorama.warper;

import org.bytedeco.opencv.opencv_core.Mat;

/**
 * Cubic interpolation of one channel from known samples.
 */
public interface ScatteredInterpolator {

    /**
     * @param knownCoords CV_64FC2 sample positions, (x, y) per element
     * @param knownValues CV_64FC1 sample values, same layout as {@code knownCoords}
     * @param queryCoords CV_64FC2 positions to evaluate, (x, y) per element
     * @return CV_64FC1 Mat shaped like {@code queryCoords}, holding NaN wherever a query falls
     * outside the convex hull of the known samples
     */
    Mat interpolate(Mat knownCoords, Mat knownValues, Mat queryCoords);
}
