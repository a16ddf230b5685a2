package com.panorama.API;

import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

import static org.bytedeco.opencv.global.opencv_core.CV_8UC1;
import static org.bytedeco.opencv.global.opencv_imgcodecs.*;

/**
 * Decodes uploaded images into 3-channel Mats and encodes results as PNG.
 */
@Service
public class ImageCodecService {

    /** Image content type and a known image extension. */
    public boolean isValidImageFile(MultipartFile file) {
        if (file == null || file.isEmpty()) return false;

        String contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            return false;
        }

        String originalFilename = file.getOriginalFilename();
        return originalFilename != null &&
                originalFilename.matches("(?i).+\\.(jpg|jpeg|png|bmp|webp|tif|tiff)$");
    }

    public Mat decode(MultipartFile file) throws IOException {
        if (!isValidImageFile(file)) {
            throw new IllegalArgumentException("Not a supported image file: " + (file == null ? null : file.getOriginalFilename()));
        }
        return decode(file.getBytes(), file.getOriginalFilename());
    }

    public Mat decode(byte[] bytes, String name) {
        BytePointer data = new BytePointer(bytes);
        Mat encoded = new Mat(1, bytes.length, CV_8UC1, data);
        Mat img = imdecode(encoded, IMREAD_COLOR);
        encoded.release();
        data.close();
        if (img == null || img.empty()) {
            throw new IllegalArgumentException("Could not decode image " + name);
        }
        return img;
    }

    public byte[] encodePng(Mat img) {
        BytePointer buf = new BytePointer();
        if (!imencode(".png", img, buf)) {
            buf.close();
            throw new IllegalStateException("PNG encoding failed");
        }
        byte[] out = new byte[(int) buf.limit()];
        buf.get(out);
        buf.close();
        return out;
    }
}
