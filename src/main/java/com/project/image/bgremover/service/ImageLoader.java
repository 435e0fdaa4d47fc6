package com.project.image.bgremover.service;

import com.project.image.bgremover.exceptions.DecodeException;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;

/**
 * Decodes raster files. ImageIO handles PNG, JPEG, BMP and GIF; anything it has no reader for
 * (WEBP among others) is handed to OpenCV.
 */
@Component
public class ImageLoader {
    private static final Logger log = LoggerFactory.getLogger(ImageLoader.class);

    public BufferedImage read(Path path) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new DecodeException("Cannot read image file " + path.getFileName() + ": " + e.getMessage(), e);
        }
        return decode(bytes, String.valueOf(path.getFileName()));
    }

    public BufferedImage decode(byte[] bytes, String name) {
        if (bytes.length == 0) {
            throw new DecodeException("File " + name + " is empty");
        }
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
            if (image != null) {
                return image;
            }
        } catch (IOException | RuntimeException e) {
            log.debug("ImageIO could not decode {}: {}", name, e.getMessage());
        }

        BufferedImage fallback = decodeWithOpenCv(bytes);
        if (fallback == null) {
            throw new DecodeException("File " + name + " is not a valid image or is corrupted");
        }
        log.debug("Decoded {} with OpenCV ({}x{})", name, fallback.getWidth(), fallback.getHeight());
        return fallback;
    }

    private BufferedImage decodeWithOpenCv(byte[] bytes) {
        MatSupport.ensureLoaded();
        Mat decoded;
        try {
            decoded = Imgcodecs.imdecode(new MatOfByte(bytes), Imgcodecs.IMREAD_COLOR);
        } catch (RuntimeException | UnsatisfiedLinkError e) {
            log.debug("OpenCV could not decode image: {}", e.getMessage());
            return null;
        }
        if (decoded == null || decoded.empty()) {
            return null;
        }
        return MatSupport.matToRgbImage(decoded);
    }
}
