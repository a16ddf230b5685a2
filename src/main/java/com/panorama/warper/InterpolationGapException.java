package com.panorama.warper;

import lombok.Getter;

/**
 * Some destination pixels received no interpolated value because their source coordinate
 * lies outside the known samples.
 */
@Getter
public class InterpolationGapException extends RuntimeException {
    private final int gapCount;
    private final int firstRow;
    private final int firstCol;

    public InterpolationGapException(int gapCount, int firstRow, int firstCol) {
        super(gapCount + " pixel(s) could not be interpolated, first at row " + firstRow + ", col " + firstCol);
        this.gapCount = gapCount;
        this.firstRow = firstRow;
        this.firstCol = firstCol;
    }
}
