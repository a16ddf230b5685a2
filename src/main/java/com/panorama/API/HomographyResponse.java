package com.panorama.API;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HomographyResponse {
    private double[][] homography;
    private double fitPercent;
    private double distMse;
    private int inliers;
    private boolean fallback;
}
