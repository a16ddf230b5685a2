package com.panorama.Stitcher;

import com.panorama.homography.RansacResult;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.bytedeco.opencv.opencv_core.Mat;

@Getter
@AllArgsConstructor
public class PanoramaResult {
    /** CV_8UC3 panorama. */
    private final Mat panorama;
    private final PanoramaShape shape;
    private final RansacResult forward;
    private final RansacResult backward;
    /** Canvas pixels the warped source could not cover; they stay black. */
    private final int gapCount;
}
