package com.panorama.warper;

import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.javacpp.indexer.FloatIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;

import static org.bytedeco.opencv.global.opencv_core.*;
import static org.bytedeco.opencv.global.opencv_imgproc.*;

/**
 * Bicubic {@link ScatteredInterpolator} backed by OpenCV {@code remap(INTER_CUBIC)}.
 * <p>
 * The known samples must cover a complete lattice with unit spacing (a pixel grid, in any
 * order), so their convex hull is the lattice bounding box. Integer-aligned queries return
 * the sample value exactly.
 */
public class CubicGridInterpolator implements ScatteredInterpolator {
    private static final double EPS = 1e-9;

    @Override
    public Mat interpolate(Mat knownCoords, Mat knownValues, Mat queryCoords) {
        if (knownCoords.type() != CV_64FC2 || queryCoords.type() != CV_64FC2 || knownValues.type() != CV_64FC1) {
            throw new IllegalArgumentException("Expected CV_64FC2 coordinates and CV_64FC1 values");
        }
        if (knownCoords.total() != knownValues.total() || knownCoords.total() == 0) {
            throw new IllegalArgumentException("Known coordinates and values must be non-empty and equally sized");
        }

        Lattice lattice = Lattice.of(knownCoords);
        Mat grid = lattice.scatter(knownCoords, knownValues);

        int qRows = queryCoords.rows(), qCols = queryCoords.cols();
        Mat mapX = new Mat(qRows, qCols, CV_32FC1);
        Mat mapY = new Mat(qRows, qCols, CV_32FC1);
        boolean[] inside = new boolean[qRows * qCols];

        DoubleIndexer q = queryCoords.createIndexer();
        FloatIndexer mx = mapX.createIndexer();
        FloatIndexer my = mapY.createIndexer();
        for (int r = 0; r < qRows; r++) {
            for (int c = 0; c < qCols; c++) {
                double x = q.get(r, c, 0);
                double y = q.get(r, c, 1);
                boolean in = lattice.contains(x, y);
                inside[r * qCols + c] = in;
                // outside points are overwritten with NaN below, keep their map entries harmless
                mx.put(r, c, in ? (float) (x - lattice.minX) : 0f);
                my.put(r, c, in ? (float) (y - lattice.minY) : 0f);
            }
        }
        q.release(); mx.release(); my.release();

        Mat out = new Mat();
        remap(grid, out, mapX, mapY, INTER_CUBIC, BORDER_REPLICATE, new Scalar());

        DoubleIndexer o = out.createIndexer();
        for (int r = 0; r < qRows; r++)
            for (int c = 0; c < qCols; c++)
                if (!inside[r * qCols + c]) o.put(r, c, Double.NaN);
        o.release();

        grid.release(); mapX.release(); mapY.release();
        return out;
    }

    private static class Lattice {
        final int minX, minY, width, height;
        final int maxX, maxY;

        Lattice(int minX, int minY, int maxX, int maxY) {
            this.minX = minX;
            this.minY = minY;
            this.maxX = maxX;
            this.maxY = maxY;
            this.width = maxX - minX + 1;
            this.height = maxY - minY + 1;
        }

        static Lattice of(Mat coords) {
            double minX = Double.MAX_VALUE, minY = Double.MAX_VALUE;
            double maxX = -Double.MAX_VALUE, maxY = -Double.MAX_VALUE;
            DoubleIndexer k = coords.createIndexer();
            for (int r = 0; r < coords.rows(); r++) {
                for (int c = 0; c < coords.cols(); c++) {
                    double x = k.get(r, c, 0), y = k.get(r, c, 1);
                    requireInteger(x);
                    requireInteger(y);
                    minX = Math.min(minX, x); maxX = Math.max(maxX, x);
                    minY = Math.min(minY, y); maxY = Math.max(maxY, y);
                }
            }
            k.release();
            Lattice lattice = new Lattice((int) Math.round(minX), (int) Math.round(minY),
                    (int) Math.round(maxX), (int) Math.round(maxY));
            if ((long) lattice.width * lattice.height != coords.total()) {
                throw new IllegalArgumentException("Known samples do not form a complete unit lattice");
            }
            return lattice;
        }

        private static void requireInteger(double v) {
            if (!Double.isFinite(v) || Math.abs(v - Math.rint(v)) > EPS) {
                throw new IllegalArgumentException("Known sample coordinate " + v + " is not on a unit lattice");
            }
        }

        Mat scatter(Mat coords, Mat values) {
            Mat grid = new Mat(height, width, CV_64FC1);
            boolean[] seen = new boolean[width * height];
            DoubleIndexer k = coords.createIndexer();
            DoubleIndexer v = values.createIndexer();
            DoubleIndexer g = grid.createIndexer();
            // values share the coordinates' layout
            long cols = coords.cols();
            for (long i = 0; i < coords.total(); i++) {
                long r = i / cols, c = i % cols;
                int gx = (int) Math.round(k.get(r, c, 0)) - minX;
                int gy = (int) Math.round(k.get(r, c, 1)) - minY;
                if (seen[gy * width + gx]) {
                    throw new IllegalArgumentException("Duplicate known sample at (" + (gx + minX) + ", " + (gy + minY) + ")");
                }
                seen[gy * width + gx] = true;
                g.put(gy, gx, v.get(r, c));
            }
            k.release(); v.release(); g.release();
            return grid;
        }

        boolean contains(double x, double y) {
            return x >= minX - EPS && x <= maxX + EPS && y >= minY - EPS && y <= maxY + EPS;
        }
    }
}
