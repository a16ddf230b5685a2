package com.panorama.API;

import lombok.Data;

@Data
public class ForwardWarpRequest {
    private double[][] homography;
    private int rows;
    private int cols;
    /** "iterative" or "bulk". */
    private String strategy = "bulk";
}
