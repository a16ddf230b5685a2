package com.panorama.API;

import com.panorama.Stitcher.PanoramaCompositor;
import com.panorama.Stitcher.PanoramaGeometry;
import com.panorama.Stitcher.PanoramaResult;
import com.panorama.config.PanoramaProperties;
import com.panorama.homography.CorrespondenceScorer;
import com.panorama.homography.FitScore;
import com.panorama.homography.HomographyEstimator;
import com.panorama.homography.HomographyMatrix;
import com.panorama.homography.PointCorrespondences;
import com.panorama.homography.RansacResult;
import com.panorama.homography.RobustHomographyEstimator;
import com.panorama.imageOperation.CanvasShape;
import com.panorama.warper.BackwardWarper;
import com.panorama.warper.ForwardWarper;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Random;

@Service
public class PanoramaService {
    private static final Logger logger = LoggerFactory.getLogger(PanoramaService.class);

    @Autowired
    private PanoramaProperties properties;

    @Autowired
    private HomographyEstimator homographyEstimator;

    @Autowired
    private CorrespondenceScorer correspondenceScorer;

    @Autowired
    private ForwardWarper forwardWarper;

    @Autowired
    private BackwardWarper backwardWarper;

    @Autowired
    private PanoramaGeometry panoramaGeometry;

    @Autowired
    private ImageCodecService imageCodecService;

    public HomographyResponse estimateHomography(HomographyRequest request) {
        PointCorrespondences matches = PointCorrespondences.of(request.getSrc(), request.getDst());
        double inlierPercent = inlierPercent(request);
        double maxErr = maxErr(request);

        if (!request.isRobust()) {
            HomographyMatrix H = homographyEstimator.estimateExact(matches);
            FitScore score = correspondenceScorer.score(H, matches, maxErr);
            return toResponse(H, score, false);
        }
        RansacResult result = newRansac().run(matches, inlierPercent, maxErr, null);
        return toResponse(result.getHomography(), result.getScore(), result.isFallback());
    }

    public byte[] composePanorama(MultipartFile source, MultipartFile destination, HomographyRequest request)
            throws IOException {
        PointCorrespondences matches = PointCorrespondences.of(request.getSrc(), request.getDst());
        Mat src = imageCodecService.decode(source);
        Mat dst = null;
        PanoramaResult result = null;
        try {
            dst = imageCodecService.decode(destination);
            PanoramaCompositor compositor = new PanoramaCompositor(newRansac(), panoramaGeometry, backwardWarper,
                    properties.getApi().getMaxCanvasPixels());
            result = compositor.compose(src, dst, matches, inlierPercent(request), maxErr(request));
            logger.info("Panorama from {} + {}: {}x{}, forward {}, backward {}",
                    source.getOriginalFilename(), destination.getOriginalFilename(),
                    result.getShape().getRows(), result.getShape().getCols(),
                    result.getForward().getScore(), result.getBackward().getScore());
            return imageCodecService.encodePng(result.getPanorama());
        } finally {
            src.release();
            if (dst != null) dst.release();
            if (result != null) result.getPanorama().release();
        }
    }

    public byte[] warpForward(MultipartFile source, ForwardWarpRequest request) throws IOException {
        HomographyMatrix H = new HomographyMatrix(request.getHomography());
        CanvasShape shape = CanvasShape.of(request.getRows(), request.getCols());
        if ((long) shape.getRows() * shape.getCols() > properties.getApi().getMaxCanvasPixels()) {
            throw new IllegalArgumentException("Canvas " + shape + " exceeds the configured pixel limit");
        }
        Mat src = imageCodecService.decode(source);
        Mat warped = null;
        try {
            if ("iterative".equalsIgnoreCase(request.getStrategy())) {
                warped = forwardWarper.warpIterative(H, src, shape);
            } else if ("bulk".equalsIgnoreCase(request.getStrategy())) {
                warped = forwardWarper.warpBulk(H, src, shape);
            } else {
                throw new IllegalArgumentException("Unknown forward warp strategy: " + request.getStrategy());
            }
            return imageCodecService.encodePng(warped);
        } finally {
            src.release();
            if (warped != null) warped.release();
        }
    }

    private RobustHomographyEstimator newRansac() {
        PanoramaProperties.RansacConfig cfg = properties.getRansac();
        Random random = cfg.getSeed() != null ? new Random(cfg.getSeed()) : new Random();
        return new RobustHomographyEstimator(homographyEstimator, correspondenceScorer, random, cfg.isParallel());
    }

    private double inlierPercent(HomographyRequest request) {
        return request.getInlierPercent() != null ? request.getInlierPercent() : properties.getRansac().getInlierPercent();
    }

    private double maxErr(HomographyRequest request) {
        return request.getMaxErr() != null ? request.getMaxErr() : properties.getRansac().getMaxErr();
    }

    private static HomographyResponse toResponse(HomographyMatrix H, FitScore score, boolean fallback) {
        return new HomographyResponse(H.getData(), score.getFitPercent(), score.getDistMse(),
                score.getInlierCount(), fallback);
    }
}
