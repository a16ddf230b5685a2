package com.panorama.config;

import com.panorama.Stitcher.PanoramaGeometry;
import com.panorama.homography.CorrespondenceScorer;
import com.panorama.homography.HomographyEstimator;
import com.panorama.warper.BackwardWarper;
import com.panorama.warper.CubicGridInterpolator;
import com.panorama.warper.ForwardWarper;
import com.panorama.warper.ScatteredInterpolator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;

/**
 * Wires the stateless core components. The RANSAC estimator is built per request because it
 * owns its random source.
 */
@Configuration
public class PanoramaConfig {
    private static final Logger logger = LoggerFactory.getLogger(PanoramaConfig.class);

    @Autowired
    private PanoramaProperties properties;

    @PostConstruct
    public void logSettings() {
        PanoramaProperties.RansacConfig ransac = properties.getRansac();
        logger.info("Panorama config: inlierPercent={}, maxErr={}, seed={}, parallel={}, maxCanvasPixels={}",
                ransac.getInlierPercent(), ransac.getMaxErr(), ransac.getSeed(), ransac.isParallel(),
                properties.getApi().getMaxCanvasPixels());
    }

    @Bean
    public HomographyEstimator homographyEstimator() {
        return new HomographyEstimator();
    }

    @Bean
    public CorrespondenceScorer correspondenceScorer() {
        return new CorrespondenceScorer();
    }

    @Bean
    public ScatteredInterpolator scatteredInterpolator() {
        return new CubicGridInterpolator();
    }

    @Bean
    public BackwardWarper backwardWarper(ScatteredInterpolator interpolator) {
        return new BackwardWarper(interpolator);
    }

    @Bean
    public ForwardWarper forwardWarper() {
        return new ForwardWarper();
    }

    @Bean
    public PanoramaGeometry panoramaGeometry() {
        return new PanoramaGeometry();
    }
}
