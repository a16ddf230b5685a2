package com.panorama.warper;

import com.panorama.imageOperation.ImageMats;
import lombok.Getter;
import org.bytedeco.javacpp.indexer.UByteIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;
import org.bytedeco.opencv.opencv_core.Scalar;

import static org.bytedeco.opencv.global.opencv_core.*;

/**
 * Result of a backward warp: interpolated CV_64FC3 values, NaN where the interpolator left a gap,
 * and a CV_8UC1 mask that is 255 exactly at those gaps.
 */
@Getter
public class WarpedImage {
    private final Mat values;
    private final Mat gapMask;
    private final int gapCount;

    public WarpedImage(Mat values) {
        this.values = values;
        this.gapMask = nanMask(values);
        this.gapCount = countNonZero(gapMask);
    }

    public boolean isComplete() {
        return gapCount == 0;
    }

    /** Values unchanged, or {@link InterpolationGapException} if any pixel is a gap. */
    public Mat requireComplete() {
        if (gapCount > 0) {
            UByteIndexer m = gapMask.createIndexer();
            try {
                for (int r = 0; r < gapMask.rows(); r++)
                    for (int c = 0; c < gapMask.cols(); c++)
                        if (m.get(r, c) != 0) throw new InterpolationGapException(gapCount, r, c);
            } finally {
                m.release();
            }
        }
        return values;
    }

    /** Copy of the values with every gap pixel set to {@code fill} on all channels. */
    public Mat filledWith(double fill) {
        Mat filled = values.clone();
        if (gapCount > 0) {
            Mat fillValue = new Mat(1, 1, CV_64FC3, Scalar.all(fill));
            filled.setTo(fillValue, gapMask);
            fillValue.release();
        }
        return filled;
    }

    /** 8-bit image with gaps filled and every channel rounded and clipped to [0, 255]. */
    public Mat toImage(double fill) {
        Mat filled = filledWith(fill);
        Mat img = ImageMats.clipToBytes(filled);
        filled.release();
        return img;
    }

    private static Mat nanMask(Mat values) {
        MatVector channels = new MatVector();
        split(values, channels);
        Mat mask = ImageMats.zeros(values.rows(), values.cols(), CV_8UC1);
        for (long i = 0; i < channels.size(); i++) {
            Mat ch = channels.get(i);
            Mat notNan = new Mat();
            // NaN is the only value not equal to itself
            compare(ch, ch, notNan, CMP_EQ);
            Mat isNan = new Mat();
            bitwise_not(notNan, isNan);
            bitwise_or(mask, isNan, mask);
            notNan.release(); isNan.release();
        }
        channels.close();
        return mask;
    }
}
