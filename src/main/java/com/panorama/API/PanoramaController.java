package com.panorama.API;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class PanoramaController {
    private static final Logger logger = LoggerFactory.getLogger(PanoramaController.class);

    @Autowired
    private PanoramaService panoramaService;

    @PostMapping(value = "/homography", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<HomographyResponse> estimateHomography(@RequestBody HomographyRequest request) {
        logger.info("POST /api/homography robust={}", request.isRobust());
        return ResponseEntity.ok(panoramaService.estimateHomography(request));
    }

    @PostMapping(value = "/panorama", consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.IMAGE_PNG_VALUE)
    public ResponseEntity<byte[]> composePanorama(
            @RequestPart("source") MultipartFile source,
            @RequestPart("destination") MultipartFile destination,
            @RequestPart("matches") HomographyRequest matches) throws IOException {
        logger.info("POST /api/panorama source={} destination={}",
                source.getOriginalFilename(), destination.getOriginalFilename());
        byte[] png = panoramaService.composePanorama(source, destination, matches);
        return ResponseEntity.ok().contentType(MediaType.IMAGE_PNG).body(png);
    }

    @PostMapping(value = "/warp/forward", consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.IMAGE_PNG_VALUE)
    public ResponseEntity<byte[]> warpForward(
            @RequestPart("source") MultipartFile source,
            @RequestPart("warp") ForwardWarpRequest warp) throws IOException {
        logger.info("POST /api/warp/forward strategy={} canvas={}x{}", warp.getStrategy(), warp.getRows(), warp.getCols());
        byte[] png = panoramaService.warpForward(source, warp);
        return ResponseEntity.ok().contentType(MediaType.IMAGE_PNG).body(png);
    }
}
