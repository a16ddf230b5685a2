package com.panorama.homography;

public final class RansacIterations {
    public static final double CONFIDENCE = 0.99;
    public static final int SAMPLE_SIZE = 4;
    // the statistical count is a lower bound under real noise
    public static final int SAFETY_FACTOR = 10;

    private RansacIterations() {
    }

    /**
     * k = (ceil(log(1 - p) / log(1 - w^n)) + 1) * 10, with p = 0.99 and n = 4.
     *
     * @param inlierPercent expected fraction w of correct correspondences, in (0, 1]
     */
    public static int count(double inlierPercent) {
        if (!(inlierPercent > 0.0 && inlierPercent <= 1.0)) {
            throw new IllegalArgumentException("inlierPercent must be in (0, 1], got " + inlierPercent);
        }
        double k = Math.ceil(Math.log(1 - CONFIDENCE) / Math.log(1 - Math.pow(inlierPercent, SAMPLE_SIZE)));
        // w == 1 gives log(0) = -inf, so the quotient and k are 0
        if (k > Integer.MAX_VALUE / SAFETY_FACTOR - 1) {
            throw new IllegalArgumentException("inlierPercent " + inlierPercent + " needs too many iterations");
        }
        return ((int) k + 1) * SAFETY_FACTOR;
    }
}
