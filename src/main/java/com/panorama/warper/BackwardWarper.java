package com.panorama.warper;

import com.panorama.homography.HomographyMatrix;
import com.panorama.imageOperation.CanvasShape;
import com.panorama.imageOperation.ImageMats;
import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.stream.IntStream;

import static org.bytedeco.opencv.global.opencv_core.*;

/**
 * Backward mapping: each canvas pixel is sent through a canvas-to-source homography and its
 * color is interpolated from the source pixel grid, so no canvas pixel is left unvisited.
 * Pixels whose source coordinate falls outside the source image come back as gaps.
 */
public class BackwardWarper {
    private static final Logger logger = LoggerFactory.getLogger(BackwardWarper.class);

    private final ScatteredInterpolator interpolator;

    public BackwardWarper(ScatteredInterpolator interpolator) {
        this.interpolator = interpolator;
    }

    public WarpedImage warp(HomographyMatrix backward, Mat src, CanvasShape shape) {
        ImageMats.requireColorImage(src, "Source");
        ImageMats.requireShape(shape);

        Mat knownCoords = ImageMats.pixelGrid(src.rows(), src.cols());
        Mat queryCoords = sourceCoordinates(backward, shape);

        MatVector channels = new MatVector();
        split(src, channels);
        MatVector warpedChannels = new MatVector(channels.size());
        for (long i = 0; i < channels.size(); i++) {
            Mat known = new Mat();
            channels.get(i).convertTo(known, CV_64F);
            warpedChannels.put(i, interpolator.interpolate(knownCoords, known, queryCoords));
            known.release();
        }

        Mat values = new Mat();
        merge(warpedChannels, values);
        channels.close();
        warpedChannels.close();
        knownCoords.release();
        queryCoords.release();

        WarpedImage result = new WarpedImage(values);
        logger.debug("Backward warp onto {} canvas: {} gap pixel(s)", shape, result.getGapCount());
        return result;
    }

    /** CV_64FC2 canvas-shaped Mat of source (x, y); NaN where the homography sends a pixel to infinity. */
    static Mat sourceCoordinates(HomographyMatrix backward, CanvasShape shape) {
        int rows = shape.getRows(), cols = shape.getCols();
        Mat coords = new Mat(rows, cols, CV_64FC2);
        DoubleIndexer idx = coords.createIndexer();
        IntStream.range(0, rows).parallel().forEach(r -> {
            for (int c = 0; c < cols; c++) {
                double[] p = backward.project(c, r);
                idx.put(r, c, 0, p == null ? Double.NaN : p[0]);
                idx.put(r, c, 1, p == null ? Double.NaN : p[1]);
            }
        });
        idx.release();
        return coords;
    }
}
