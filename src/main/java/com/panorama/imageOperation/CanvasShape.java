package com.panorama.imageOperation;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** rows x cols x channels of an output image. */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
public class CanvasShape {
    private final int rows;
    private final int cols;
    private final int channels;

    public static CanvasShape of(int rows, int cols) {
        return new CanvasShape(rows, cols, 3);
    }

    @Override
    public String toString() {
        return rows + "x" + cols + "x" + channels;
    }
}
