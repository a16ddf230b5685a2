package com.panorama.homography;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class CorrespondenceScorerTest {
    private final CorrespondenceScorer scorer = new CorrespondenceScorer();

    // reprojection errors under identity: 0, 1, 3, 10
    private final PointCorrespondences matches = PointCorrespondences.of(
            new double[][]{{0, 0}, {10, 10}, {20, 20}, {30, 30}},
            new double[][]{{0, 0}, {11, 10}, {20, 23}, {36, 38}});

    @Test
    void scoresOnlyInliersInMse() {
        FitScore score = scorer.score(HomographyMatrix.identity(), matches, 2.0);

        assertThat(score.getInlierCount()).isEqualTo(2);
        assertThat(score.getFitPercent()).isEqualTo(0.5);
        assertThat(score.getDistMse()).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void errorEqualToThresholdIsAnOutlier() {
        PointCorrespondences pair = PointCorrespondences.of(new double[][]{{4, 4}}, new double[][]{{6, 4}});

        assertThat(scorer.score(HomographyMatrix.identity(), pair, 2.0).getInlierCount()).isZero();
        assertThat(scorer.score(HomographyMatrix.identity(), pair, 2.0 + 1e-9).getInlierCount()).isEqualTo(1);
    }

    @Test
    void noInliersGivesSentinelMse() {
        FitScore score = scorer.score(HomographyMatrix.translation(500, 500), matches, 1.0);

        assertThat(score.getFitPercent()).isZero();
        assertThat(score.getDistMse()).isEqualTo(FitScore.NO_INLIERS_MSE);
        assertThat(score.hasInliers()).isFalse();
    }

    @Test
    void pointsSentToInfinityAreOutliers() {
        // third row zeroes the homogeneous coordinate of (0, 0)
        HomographyMatrix H = new HomographyMatrix(new double[][]{{1, 0, 0}, {0, 1, 0}, {1, 0, 0}});

        assertThat(CorrespondenceScorer.reprojectionError(H, matches, 0)).isInfinite();
        assertThat(scorer.inlierIndices(H, matches, 1e6)).doesNotContain(0);
    }

    @Test
    void selectInliersKeepsMatchingPairsInOrder() {
        PointCorrespondences inliers = scorer.selectInliers(HomographyMatrix.identity(), matches, 5.0);

        assertThat(inliers.size()).isEqualTo(3);
        assertThat(inliers.srcX(2)).isEqualTo(20);
        assertThat(inliers.dstY(2)).isEqualTo(23);
    }

    @Test
    void fitPercentIsBoundedAndMonotoneInMaxErr() {
        Random random = new Random(3);
        double[][] src = new double[50][2], dst = new double[50][2];
        for (int i = 0; i < 50; i++) {
            src[i] = new double[]{random.nextDouble() * 200, random.nextDouble() * 200};
            dst[i] = new double[]{src[i][0] + random.nextGaussian() * 5, src[i][1] + random.nextGaussian() * 5};
        }
        PointCorrespondences noisy = PointCorrespondences.of(src, dst);
        HomographyMatrix H = new HomographyMatrix(new double[][]{{1.01, 0, 0.5}, {0, 0.99, -0.5}, {0, 0, 1}});

        double previous = 0;
        for (double maxErr = 0.25; maxErr <= 30; maxErr *= 1.5) {
            FitScore score = scorer.score(H, noisy, maxErr);
            assertThat(score.getFitPercent()).isBetween(0.0, 1.0);
            assertThat(score.getFitPercent()).isGreaterThanOrEqualTo(previous);
            assertThat(score.getDistMse() >= 0 || score.getDistMse() == FitScore.NO_INLIERS_MSE).isTrue();
            previous = score.getFitPercent();
        }
    }
}
