package com.panorama.homography;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class RansacResult {
    private final HomographyMatrix homography;
    /** Score of {@link #homography} against the full correspondence set. */
    private final FitScore score;
    private final int iterations;
    private final int acceptedCandidates;
    /** True when no iteration reached the inlier fraction and the seed was returned unchanged. */
    private final boolean fallback;
}
