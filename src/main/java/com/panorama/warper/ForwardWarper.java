package com.panorama.warper;

import com.panorama.homography.HomographyMatrix;
import com.panorama.imageOperation.CanvasShape;
import com.panorama.imageOperation.ImageMats;
import org.bytedeco.javacpp.indexer.UByteIndexer;
import org.bytedeco.opencv.opencv_core.Mat;

import java.util.stream.IntStream;

import static org.bytedeco.opencv.global.opencv_core.CV_8UC3;

/**
 * Forward mapping: every source pixel (x, y) is planted at round(H [x, y, 1]) on a black canvas.
 * Targets outside the canvas are dropped. When several source pixels hit the same cell the one
 * visited last in row-major order wins; both strategies below keep that precedence.
 */
public class ForwardWarper {

    /** Pixel-by-pixel loop over the source image. */
    public Mat warpIterative(HomographyMatrix H, Mat src, CanvasShape shape) {
        ImageMats.requireColorImage(src, "Source");
        ImageMats.requireShape(shape);

        Mat dst = ImageMats.zeros(shape.getRows(), shape.getCols(), CV_8UC3);
        UByteIndexer s = src.createIndexer();
        UByteIndexer d = dst.createIndexer();
        for (int row = 0; row < src.rows(); row++) {
            for (int col = 0; col < src.cols(); col++) {
                int target = targetIndex(H, col, row, shape);
                if (target >= 0) copyPixel(s, row, col, d, target / shape.getCols(), target % shape.getCols());
            }
        }
        s.release();
        d.release();
        return dst;
    }

    /**
     * Projects all source pixels in one data-parallel pass, then plants them in a single
     * row-major pass so collisions resolve exactly as in {@link #warpIterative}.
     */
    public Mat warpBulk(HomographyMatrix H, Mat src, CanvasShape shape) {
        ImageMats.requireColorImage(src, "Source");
        ImageMats.requireShape(shape);

        int rows = src.rows(), cols = src.cols();
        int[] targets = new int[rows * cols];
        IntStream.range(0, rows).parallel().forEach(row -> {
            for (int col = 0; col < cols; col++) {
                targets[row * cols + col] = targetIndex(H, col, row, shape);
            }
        });

        Mat dst = ImageMats.zeros(shape.getRows(), shape.getCols(), CV_8UC3);
        UByteIndexer s = src.createIndexer();
        UByteIndexer d = dst.createIndexer();
        for (int i = 0; i < targets.length; i++) {
            int target = targets[i];
            if (target < 0) continue;
            copyPixel(s, i / cols, i % cols, d, target / shape.getCols(), target % shape.getCols());
        }
        s.release();
        d.release();
        return dst;
    }

    /**
     * Row-major canvas index that source pixel (x, y) lands on, or -1 if it falls off the canvas
     * or maps to infinity.
     */
    static int targetIndex(HomographyMatrix H, int x, int y, CanvasShape shape) {
        double[] p = H.project(x, y);
        if (p == null || !Double.isFinite(p[0]) || !Double.isFinite(p[1])) return -1;
        long tx = Math.round(p[0]);
        long ty = Math.round(p[1]);
        if (tx < 0 || tx >= shape.getCols() || ty < 0 || ty >= shape.getRows()) return -1;
        return (int) (ty * shape.getCols() + tx);
    }

    private static void copyPixel(UByteIndexer s, long srcRow, long srcCol, UByteIndexer d, long dstRow, long dstCol) {
        for (int ch = 0; ch < 3; ch++) {
            d.put(dstRow, dstCol, ch, s.get(srcRow, srcCol, ch));
        }
    }
}
