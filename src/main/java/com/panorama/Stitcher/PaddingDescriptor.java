package com.panorama.Stitcher;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Extra canvas, in pixels, around the destination image on each side. Never negative. */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class PaddingDescriptor {
    private final int padUp;
    private final int padDown;
    private final int padLeft;
    private final int padRight;
}
