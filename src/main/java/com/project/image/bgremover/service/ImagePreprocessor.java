package com.project.image.bgremover.service;

import com.project.image.bgremover.DTOs.NormalizedArray;
import com.project.image.bgremover.DTOs.PreprocessedImage;
import com.project.image.bgremover.DTOs.SourceImage;
import com.project.image.bgremover.exceptions.DecodeException;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

/**
 * Turns an image file into the 1x3x320x320 tensor expected by the saliency model.
 */
@Service
public class ImagePreprocessor {
    private static final Logger log = LoggerFactory.getLogger(ImagePreprocessor.class);

    public static final int MODEL_INPUT_SIZE = 320;

    // ImageNet statistics the model was trained with, in R, G, B order
    static final float[] MEAN = {0.485f, 0.456f, 0.406f};
    static final float[] STD = {0.229f, 0.224f, 0.225f};

    private final ImageLoader imageLoader;

    public ImagePreprocessor(ImageLoader imageLoader) {
        this.imageLoader = imageLoader;
    }

    public PreprocessedImage preprocess(Path path) {
        return preprocess(imageLoader.read(path));
    }

    public PreprocessedImage preprocess(BufferedImage image) {
        SourceImage source = toSourceImage(image);
        log.debug("Preprocessing image {}x{} to {}x{}", source.width(), source.height(),
                MODEL_INPUT_SIZE, MODEL_INPUT_SIZE);

        MatSupport.ensureLoaded();
        Mat bgr = MatSupport.bufferedImageToMat(source.rgb());
        Mat resized = MatSupport.resizeBilinear(bgr, MODEL_INPUT_SIZE, MODEL_INPUT_SIZE);
        byte[] pixels = MatSupport.matToBytes(resized);

        return new PreprocessedImage(normalize(pixels, MODEL_INPUT_SIZE, MODEL_INPUT_SIZE), source);
    }

    /**
     * Drops alpha and any extra bands. Translucent pixels keep their color; they are not blended
     * against a backdrop.
     */
    static SourceImage toSourceImage(BufferedImage image) {
        int w = image.getWidth(), h = image.getHeight();
        if (w <= 0 || h <= 0) {
            throw new DecodeException("Image has no pixels");
        }
        int[] argb = image.getRGB(0, 0, w, h, null, 0, w);
        BufferedImage rgb = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        rgb.setRGB(0, 0, w, h, argb, 0, w);
        return new SourceImage(rgb, w, h);
    }

    /** Interleaved BGR bytes to planar, normalized R, G, B floats. */
    static NormalizedArray normalize(byte[] bgr, int width, int height) {
        int plane = width * height;
        float[] data = new float[3 * plane];
        for (int i = 0; i < plane; i++) {
            for (int c = 0; c < 3; c++) {
                int value = bgr[3 * i + (2 - c)] & 0xFF;
                data[c * plane + i] = (value / 255.0f - MEAN[c]) / STD[c];
            }
        }
        return new NormalizedArray(data, height, width);
    }
}
