package com.panorama.homography;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * RANSAC around {@link HomographyEstimator} and {@link CorrespondenceScorer}.
 * <p>
 * Every iteration fits a minimal 4-point sample; a sample whose fit reaches the expected
 * inlier fraction is refit on all of its inliers and kept if its distMse is strictly the
 * lowest so far. Samples are drawn up front from the supplied {@link Random}, so a seeded
 * generator reproduces the result whether candidates are evaluated sequentially or in parallel.
 */
public class RobustHomographyEstimator {
    private static final Logger logger = LoggerFactory.getLogger(RobustHomographyEstimator.class);

    private final HomographyEstimator estimator;
    private final CorrespondenceScorer scorer;
    private final Random random;
    private final boolean parallel;

    public RobustHomographyEstimator(Random random) {
        this(new HomographyEstimator(), new CorrespondenceScorer(), random, false);
    }

    public RobustHomographyEstimator(HomographyEstimator estimator, CorrespondenceScorer scorer,
                                     Random random, boolean parallel) {
        this.estimator = estimator;
        this.scorer = scorer;
        this.random = random;
        this.parallel = parallel;
    }

    /** Falls back to the exact least-squares fit over all pairs when RANSAC finds nothing better. */
    public HomographyMatrix estimate(PointCorrespondences matches, double inlierPercent, double maxErr) {
        return run(matches, inlierPercent, maxErr, null).getHomography();
    }

    public HomographyMatrix estimate(PointCorrespondences matches, double inlierPercent, double maxErr,
                                     HomographyMatrix seed) {
        return run(matches, inlierPercent, maxErr, seed).getHomography();
    }

    /**
     * @param seed returned unchanged if no iteration reaches {@code inlierPercent};
     *             null means the exact fit over all correspondences
     */
    public RansacResult run(PointCorrespondences matches, double inlierPercent, double maxErr,
                            HomographyMatrix seed) {
        int n = matches.size();
        if (n < RansacIterations.SAMPLE_SIZE) {
            throw new InsufficientCorrespondencesException(n, RansacIterations.SAMPLE_SIZE);
        }
        if (!(maxErr > 0)) {
            throw new IllegalArgumentException("maxErr must be positive, got " + maxErr);
        }
        int k = RansacIterations.count(inlierPercent);
        if (seed == null) seed = estimator.estimateExact(matches);

        List<int[]> samples = drawSamples(n, k);
        IntStream iterations = IntStream.range(0, k);
        if (parallel) iterations = iterations.parallel();
        List<Candidate> candidates = iterations
                .mapToObj(i -> evaluate(samples.get(i), matches, inlierPercent, maxErr))
                .collect(Collectors.toList());

        // ordered fold: strict improvement only, so the earliest iteration wins ties
        Candidate best = null;
        int accepted = 0;
        for (Candidate c : candidates) {
            if (c == null) continue;
            accepted++;
            double bestMse = best == null ? FitScore.NO_INLIERS_MSE : best.score.getDistMse();
            if (c.score.getDistMse() < bestMse) best = c;
        }

        if (best == null) {
            logger.warn("RANSAC: no sample out of {} reached inlier fraction {}; returning the seed homography",
                    k, inlierPercent);
            return new RansacResult(seed, scorer.score(seed, matches, maxErr), k, accepted, true);
        }
        logger.info("RANSAC: {} iterations, {} accepted, best {}", k, accepted, best.score);
        return new RansacResult(best.homography, best.score, k, accepted, false);
    }

    private List<int[]> drawSamples(int n, int k) {
        List<Integer> indices = new ArrayList<>(n);
        for (int i = 0; i < n; i++) indices.add(i);

        List<int[]> samples = new ArrayList<>(k);
        for (int i = 0; i < k; i++) {
            Collections.shuffle(indices, random);
            int[] sample = new int[RansacIterations.SAMPLE_SIZE];
            for (int s = 0; s < sample.length; s++) sample[s] = indices.get(s);
            samples.add(sample);
        }
        return samples;
    }

    private Candidate evaluate(int[] sample, PointCorrespondences matches, double inlierPercent, double maxErr) {
        HomographyMatrix H = estimator.estimateExact(matches.subset(sample));
        FitScore score = scorer.score(H, matches, maxErr);
        if (score.getFitPercent() < inlierPercent) return null;

        PointCorrespondences inliers = scorer.selectInliers(H, matches, maxErr);
        if (inliers.size() < HomographyEstimator.MIN_CORRESPONDENCES) {
            // a degenerate sample can pass a low threshold without 4 inliers to refit on
            return null;
        }
        HomographyMatrix refined = estimator.estimateExact(inliers);
        FitScore refinedScore = scorer.score(refined, matches, maxErr);
        logger.debug("RANSAC: sample accepted with {}, refit gives {}", score, refinedScore);
        return new Candidate(refined, refinedScore);
    }

    private static class Candidate {
        final HomographyMatrix homography;
        final FitScore score;

        Candidate(HomographyMatrix homography, FitScore score) {
            this.homography = homography;
            this.score = score;
        }
    }
}
