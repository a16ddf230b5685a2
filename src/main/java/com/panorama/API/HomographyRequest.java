package com.panorama.API;

import lombok.Data;

/**
 * Matched points plus optional RANSAC overrides; absent overrides fall back to configuration.
 */
@Data
public class HomographyRequest {
    /** N x 2 source points, (x, y). */
    private double[][] src;
    /** N x 2 destination points, (x, y). */
    private double[][] dst;
    private Double inlierPercent;
    private Double maxErr;
    private boolean robust = true;
}
