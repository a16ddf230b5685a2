package com.panorama.imageOperation;

import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;

import static org.bytedeco.opencv.global.opencv_core.*;

/**
 * Small helpers around OpenCV Mats used as 3-channel 8-bit images.
 */
public class ImageMats {
    private ImageMats() {
    }

    public static void requireColorImage(Mat img, String name) {
        if (img == null || img.empty()) {
            throw new IllegalArgumentException(name + " image is empty");
        }
        if (img.type() != CV_8UC3) {
            throw new IllegalArgumentException(name + " image must be 8-bit with 3 channels, got type " + img.type());
        }
    }

    public static void requireShape(CanvasShape shape) {
        if (shape == null || shape.getRows() <= 0 || shape.getCols() <= 0) {
            throw new IllegalArgumentException("Canvas shape must be positive, got " + shape);
        }
        if (shape.getChannels() != 3) {
            throw new IllegalArgumentException("Only 3-channel canvases are supported, got " + shape.getChannels());
        }
    }

    public static Mat zeros(int rows, int cols, int type) {
        return new Mat(rows, cols, type, Scalar.all(0));
    }

    /**
     * rows x cols CV_64FC2 Mat whose element (r, c) is the pixel coordinate (x = c, y = r).
     */
    public static Mat pixelGrid(int rows, int cols) {
        Mat grid = new Mat(rows, cols, CV_64FC2);
        DoubleIndexer idx = grid.createIndexer();
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                idx.put(r, c, 0, c);
                idx.put(r, c, 1, r);
            }
        }
        idx.release();
        return grid;
    }

    /** Rounds and saturates every channel of a 3-channel Mat into [0, 255]. */
    public static Mat clipToBytes(Mat values) {
        Mat out = new Mat();
        values.convertTo(out, CV_8UC3);
        return out;
    }
}
