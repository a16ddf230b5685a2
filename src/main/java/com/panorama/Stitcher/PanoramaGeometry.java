package com.panorama.Stitcher;

import com.panorama.homography.HomographyMatrix;
import com.panorama.imageOperation.ImageMats;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sizes the panorama canvas: the destination image padded just enough to also hold the
 * four projected corners of the source image.
 * <p>
 * Corners use 1-indexed pixel coordinates, (1, 1) to (cols, rows). A projected corner left of
 * column 1 or above row 1 pads by its distance to that first column or row; one past the
 * destination width or height pads by the overshoot. Each side takes the largest requirement
 * over the four corners, rounded up to whole pixels.
 */
public class PanoramaGeometry {
    private static final Logger logger = LoggerFactory.getLogger(PanoramaGeometry.class);
    // fitted homographies carry ~1e-12 noise; an excess this close to an integer is that integer
    private static final double SNAP_EPS = 1e-9;

    public PanoramaShape computeCanvasGeometry(Mat src, Mat dst, HomographyMatrix forward) {
        ImageMats.requireColorImage(src, "Source");
        ImageMats.requireColorImage(dst, "Destination");

        int srcRows = src.rows(), srcCols = src.cols();
        int dstRows = dst.rows(), dstCols = dst.cols();
        double[][] corners = {
                {1, 1},
                {srcCols, 1},
                {1, srcRows},
                {srcCols, srcRows}};

        double padUp = 0, padDown = 0, padLeft = 0, padRight = 0;
        for (double[] corner : corners) {
            double[] p = forward.project(corner[0], corner[1]);
            if (p == null || !Double.isFinite(p[0]) || !Double.isFinite(p[1])) {
                throw new IllegalArgumentException("Source corner (" + corner[0] + ", " + corner[1]
                        + ") maps to infinity; the homography cannot be rendered on a finite canvas");
            }
            double x = p[0], y = p[1];
            logger.debug("Corner ({}, {}) -> ({}, {})", corner[0], corner[1], x, y);

            if (y < 1) padUp = Math.max(padUp, 1 - y);
            if (x > dstCols) padRight = Math.max(padRight, x - dstCols);
            if (x < 1) padLeft = Math.max(padLeft, 1 - x);
            if (y > dstRows) padDown = Math.max(padDown, y - dstRows);
        }

        PaddingDescriptor padding = new PaddingDescriptor(
                toPixels(padUp), toPixels(padDown), toPixels(padLeft), toPixels(padRight));
        long rows = (long) dstRows + padding.getPadUp() + padding.getPadDown();
        long cols = (long) dstCols + padding.getPadLeft() + padding.getPadRight();
        if (rows > Integer.MAX_VALUE || cols > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Panorama canvas " + rows + "x" + cols + " is too large");
        }

        PanoramaShape shape = new PanoramaShape((int) rows, (int) cols, padding);
        logger.info("Panorama canvas {}x{} with {}", shape.getRows(), shape.getCols(), padding);
        return shape;
    }

    private static int toPixels(double pad) {
        double px = Math.max(0, Math.ceil(pad - SNAP_EPS));
        if (px > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Padding of " + pad + " pixels is too large");
        }
        return (int) px;
    }
}
