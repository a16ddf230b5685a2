package com.panorama.homography;

import lombok.Getter;

/**
 * Thrown when a fit is requested with fewer correspondences than a homography needs.
 */
@Getter
public class InsufficientCorrespondencesException extends IllegalArgumentException {
    private final int supplied;
    private final int required;

    public InsufficientCorrespondencesException(int supplied, int required) {
        super("Need at least " + required + " point correspondences, got " + supplied);
        this.supplied = supplied;
        this.required = required;
    }
}
