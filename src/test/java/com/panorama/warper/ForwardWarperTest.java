package com.panorama.warper;

import com.panorama.TestImages;
import com.panorama.homography.HomographyMatrix;
import com.panorama.imageOperation.CanvasShape;
import com.panorama.imageOperation.ImageMats;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;
import static org.bytedeco.opencv.global.opencv_core.CV_8UC1;

class ForwardWarperTest {
    private final ForwardWarper warper = new ForwardWarper();

    @Test
    void identityCopiesSourceIntoTopLeftOfLargerCanvas() {
        Mat src = TestImages.noise(4, 5, 1);

        int[][][] out = TestImages.toArray(warper.warpIterative(HomographyMatrix.identity(), src, CanvasShape.of(6, 8)));
        int[][][] in = TestImages.toArray(src);

        for (int r = 0; r < 6; r++) {
            for (int c = 0; c < 8; c++) {
                int[] expected = r < 4 && c < 5 ? in[r][c] : new int[]{0, 0, 0};
                assertThat(out[r][c]).as("pixel (%d, %d)", r, c).containsExactly(expected);
            }
        }
    }

    @Test
    void translationDropsPixelsLeavingTheCanvas() {
        Mat src = TestImages.noise(4, 4, 2);

        int[][][] out = TestImages.toArray(warper.warpBulk(HomographyMatrix.translation(2, 1), src, CanvasShape.of(4, 4)));
        int[][][] in = TestImages.toArray(src);

        assertThat(out[1][2]).containsExactly(in[0][0]);
        assertThat(out[3][3]).containsExactly(in[2][1]);
        assertThat(out[0][3]).containsExactly(0, 0, 0);
        assertThat(out[2][1]).containsExactly(0, 0, 0);
    }

    @Test
    void lastSourcePixelInRowMajorOrderWinsCollisions() {
        Mat src = TestImages.noise(4, 4, 3);
        HomographyMatrix half = HomographyMatrix.fromRowMajor(new double[]{0.5, 0, 0, 0, 0.5, 0, 0, 0, 1});
        int[][][] in = TestImages.toArray(src);

        int[][][] iterative = TestImages.toArray(warper.warpIterative(half, src, CanvasShape.of(3, 3)));
        int[][][] bulk = TestImages.toArray(warper.warpBulk(half, src, CanvasShape.of(3, 3)));

        // round(0.5) = 1 and round(1.0) = 1, so source columns/rows 1 and 2 both land on 1
        assertThat(iterative[1][1]).containsExactly(in[2][2]);
        assertThat(iterative[0][0]).containsExactly(in[0][0]);
        assertThat(iterative[2][2]).containsExactly(in[3][3]);
        assertThat(bulk).isEqualTo(iterative);
    }

    @Test
    void iterativeAndBulkAgreeOnProjectiveHomography() {
        Mat src = TestImages.noise(30, 40, 4);
        HomographyMatrix H = new HomographyMatrix(new double[][]{
                {1.1, 0.2, 5}, {-0.1, 0.9, 8}, {1e-3, 5e-4, 1}});
        CanvasShape shape = CanvasShape.of(45, 55);

        assertThat(TestImages.toArray(warper.warpBulk(H, src, shape)))
                .isEqualTo(TestImages.toArray(warper.warpIterative(H, src, shape)));
    }

    @Test
    void targetIndexRejectsInfinityAndOffCanvasPoints() {
        HomographyMatrix toInfinity = new HomographyMatrix(new double[][]{{1, 0, 0}, {0, 1, 0}, {1, 0, 0}});
        CanvasShape shape = CanvasShape.of(3, 3);

        assertThat(ForwardWarper.targetIndex(toInfinity, 0, 1, shape)).isEqualTo(-1);
        assertThat(ForwardWarper.targetIndex(HomographyMatrix.translation(-1, 0), 0, 0, shape)).isEqualTo(-1);
        assertThat(ForwardWarper.targetIndex(HomographyMatrix.identity(), 2, 1, shape)).isEqualTo(5);
    }

    @Test
    void rejectsNonColorSource() {
        Mat gray = ImageMats.zeros(3, 3, CV_8UC1);

        assertThatThrownBy(() -> warper.warpBulk(HomographyMatrix.identity(), gray, CanvasShape.of(3, 3)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> warper.warpIterative(HomographyMatrix.identity(), TestImages.noise(2, 2, 0), CanvasShape.of(0, 3)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
