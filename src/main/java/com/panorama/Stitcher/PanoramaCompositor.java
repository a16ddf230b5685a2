package com.panorama.Stitcher;

import com.panorama.homography.HomographyMatrix;
import com.panorama.homography.PointCorrespondences;
import com.panorama.homography.RansacResult;
import com.panorama.homography.RobustHomographyEstimator;
import com.panorama.imageOperation.ImageMats;
import com.panorama.warper.BackwardWarper;
import com.panorama.warper.WarpedImage;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.bytedeco.opencv.global.opencv_core.CV_64F;

/**
 * Two-image panorama: the source image is backward-warped onto a canvas sized to hold both
 * images, and the destination image is pasted over it at its padded offset.
 */
public class PanoramaCompositor {
    private static final Logger logger = LoggerFactory.getLogger(PanoramaCompositor.class);

    private final RobustHomographyEstimator ransac;
    private final PanoramaGeometry geometry;
    private final BackwardWarper backwardWarper;
    private final long maxCanvasPixels;

    public PanoramaCompositor(RobustHomographyEstimator ransac, PanoramaGeometry geometry,
                              BackwardWarper backwardWarper, long maxCanvasPixels) {
        this.ransac = ransac;
        this.geometry = geometry;
        this.backwardWarper = backwardWarper;
        this.maxCanvasPixels = maxCanvasPixels;
    }

    public Mat composePanorama(Mat src, Mat dst, PointCorrespondences matches, double inlierPercent, double maxErr) {
        return compose(src, dst, matches, inlierPercent, maxErr).getPanorama();
    }

    public PanoramaResult compose(Mat src, Mat dst, PointCorrespondences matches, double inlierPercent, double maxErr) {
        ImageMats.requireColorImage(src, "Source");
        ImageMats.requireColorImage(dst, "Destination");
        long start = System.currentTimeMillis();

        RansacResult forward = ransac.run(matches, inlierPercent, maxErr, null);
        PanoramaShape shape = geometry.computeCanvasGeometry(src, dst, forward.getHomography());
        if (shape.pixelCount() > maxCanvasPixels) {
            throw new IllegalArgumentException("Panorama canvas " + shape.getRows() + "x" + shape.getCols()
                    + " exceeds the limit of " + maxCanvasPixels + " pixels");
        }

        // fitted on its own from the swapped pairs rather than inverting the forward matrix
        RansacResult backward = ransac.run(matches.swapped(), inlierPercent, maxErr, null);
        PaddingDescriptor pad = shape.getPadding();
        HomographyMatrix translated = addTranslation(backward.getHomography(), pad.getPadLeft(), pad.getPadUp());

        WarpedImage warped = backwardWarper.warp(translated, src, shape.toCanvasShape());
        Mat canvas = warped.filledWith(0);

        // destination pixels always win in the overlap
        Mat dst64 = new Mat();
        dst.convertTo(dst64, CV_64F);
        Mat roi = new Mat(canvas, new Rect(pad.getPadLeft(), pad.getPadUp(), dst.cols(), dst.rows()));
        dst64.copyTo(roi);

        Mat panorama = ImageMats.clipToBytes(canvas);
        dst64.release(); roi.release(); canvas.release();
        warped.getValues().release(); warped.getGapMask().release();

        logger.info("Panorama {}x{} composed in {} ms ({} uncovered pixels)",
                shape.getRows(), shape.getCols(), System.currentTimeMillis() - start, warped.getGapCount());
        return new PanoramaResult(panorama, shape, forward, backward, warped.getGapCount());
    }

    /**
     * backward * T(-padLeft, -padUp), rescaled to unit Frobenius norm: canvas coordinates are
     * shifted back into destination coordinates before the backward mapping applies.
     */
    public static HomographyMatrix addTranslation(HomographyMatrix backward, int padLeft, int padUp) {
        HomographyMatrix composed = backward.multiply(HomographyMatrix.translation(-padLeft, -padUp));
        double norm = composed.frobeniusNorm();
        if (norm == 0 || !Double.isFinite(norm)) {
            throw new IllegalArgumentException("Backward homography is degenerate (Frobenius norm " + norm + ")");
        }
        return composed.scale(1.0 / norm);
    }
}
