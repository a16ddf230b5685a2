package com.panorama.homography;

import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class HomographyEstimatorTest {
    private final HomographyEstimator estimator = new HomographyEstimator();
    private final CorrespondenceScorer scorer = new CorrespondenceScorer();

    @Test
    void translatedSquareGivesTranslationUpToScale() {
        PointCorrespondences square = PointCorrespondences.of(
                new double[][]{{0, 0}, {10, 0}, {10, 10}, {0, 10}},
                new double[][]{{5, 5}, {15, 5}, {15, 15}, {5, 15}});

        HomographyMatrix fitted = estimator.estimateExact(square);
        HomographyMatrix H = fitted.scale(1.0 / fitted.get(2, 2));

        double[][] expected = {{1, 0, 5}, {0, 1, 5}, {0, 0, 1}};
        for (int r = 0; r < 3; r++)
            for (int c = 0; c < 3; c++)
                assertThat(H.get(r, c)).isCloseTo(expected[r][c], within(1e-9));

        FitScore score = scorer.score(H, square, 0.5);
        assertThat(score.getFitPercent()).isEqualTo(1.0);
        assertThat(score.getDistMse()).isCloseTo(0.0, within(1e-12));
    }

    @Test
    void recoversProjectiveTransformFromExactPoints() {
        HomographyMatrix truth = new HomographyMatrix(new double[][]{
                {1.1, 0.05, 20}, {0.02, 0.95, -10}, {1e-4, 2e-4, 1}});
        double[][] src = {{0, 0}, {120, 5}, {10, 90}, {130, 110}, {60, 40}, {35, 75}, {95, 20}, {80, 100}};
        PointCorrespondences matches = PointCorrespondences.of(src, project(truth, src));

        HomographyMatrix H = estimator.estimateExact(matches);

        for (double[] p : src) {
            double[] expected = truth.project(p[0], p[1]);
            double[] actual = H.project(p[0], p[1]);
            assertThat(actual[0]).isCloseTo(expected[0], within(1e-6));
            assertThat(actual[1]).isCloseTo(expected[1], within(1e-6));
        }
        FitScore score = scorer.score(H, matches, 1e-3);
        assertThat(score.getFitPercent()).isEqualTo(1.0);
        assertThat(score.getDistMse()).isLessThan(1e-10);
    }

    @Test
    void fittedMatrixIsNotRescaled() {
        PointCorrespondences square = PointCorrespondences.of(
                new double[][]{{0, 0}, {10, 0}, {10, 10}, {0, 10}},
                new double[][]{{5, 5}, {15, 5}, {15, 15}, {5, 15}});

        // the null-space vector comes back with unit length
        assertThat(estimator.estimateExact(square).frobeniusNorm()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void designMatrixHasOneXRowAndOneYRowPerCorrespondence() {
        PointCorrespondences matches = PointCorrespondences.of(
                new double[][]{{2, 3}, {4, 5}, {6, 7}, {8, 1}},
                new double[][]{{10, 20}, {1, 1}, {1, 1}, {1, 1}});

        Mat A = HomographyEstimator.designMatrix(matches);
        assertThat(A.rows()).isEqualTo(8);
        assertThat(A.cols()).isEqualTo(9);

        DoubleIndexer a = A.createIndexer();
        double[] xRow = new double[9], yRow = new double[9];
        for (int k = 0; k < 9; k++) {
            xRow[k] = a.get(0, k);
            yRow[k] = a.get(1, k);
        }
        a.release();
        assertThat(xRow).containsExactly(2, 3, 1, 0, 0, 0, -20, -30, -10);
        assertThat(yRow).containsExactly(0, 0, 0, 2, 3, 1, -40, -60, -20);
    }

    @Test
    void fewerThanFourCorrespondencesAreRejected() {
        PointCorrespondences three = PointCorrespondences.of(
                new double[][]{{0, 0}, {1, 0}, {0, 1}},
                new double[][]{{0, 0}, {1, 0}, {0, 1}});

        assertThatThrownBy(() -> estimator.estimateExact(three))
                .isInstanceOf(InsufficientCorrespondencesException.class)
                .hasMessageContaining("at least 4")
                .extracting("supplied").isEqualTo(3);
    }

    @Test
    void mismatchedPointCountsAreRejected() {
        assertThatThrownBy(() -> PointCorrespondences.of(new double[][]{{0, 0}}, new double[][]{{0, 0}, {1, 1}}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    static double[][] project(HomographyMatrix H, double[][] points) {
        double[][] out = new double[points.length][];
        for (int i = 0; i < points.length; i++) out[i] = H.project(points[i][0], points[i][1]);
        return out;
    }
}
