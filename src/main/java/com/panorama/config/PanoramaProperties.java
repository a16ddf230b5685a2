package com.panorama.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "panorama")
public class PanoramaProperties {
    private RansacConfig ransac = new RansacConfig();
    private ApiConfig api = new ApiConfig();

    @Data
    public static class RansacConfig {
        // expected fraction of correct matches
        private double inlierPercent = 0.8;
        // pixels
        private double maxErr = 2.0;
        // fixed seed for reproducible sampling; null draws a fresh seed per request
        private Long seed;
        private boolean parallel = false;
    }

    @Data
    public static class ApiConfig {
        private long maxCanvasPixels = 40_000_000L;
    }
}
