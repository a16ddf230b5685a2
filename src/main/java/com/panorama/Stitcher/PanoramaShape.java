package com.panorama.Stitcher;

import com.panorama.imageOperation.CanvasShape;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class PanoramaShape {
    private final int rows;
    private final int cols;
    private final PaddingDescriptor padding;

    public CanvasShape toCanvasShape() {
        return CanvasShape.of(rows, cols);
    }

    public long pixelCount() {
        return (long) rows * cols;
    }
}
