package com.project.image.bgremover.service;

import com.project.image.bgremover.DTOs.AlphaMask;
import com.project.image.bgremover.DTOs.BackgroundSpec;
import com.project.image.bgremover.DTOs.ProcessingOptions;
import com.project.image.bgremover.DTOs.SourceImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds the RGBA subject from the original pixels and the alpha mask, and places it over a
 * background when one is requested.
 */
@Service
public class Compositor {
    private static final Logger log = LoggerFactory.getLogger(Compositor.class);

    private final BackgroundSynthesizer backgroundSynthesizer;

    public Compositor(BackgroundSynthesizer backgroundSynthesizer) {
        this.backgroundSynthesizer = backgroundSynthesizer;
    }

    /**
     * Subject only: RGB from the source, alpha from the mask. Both must have the same size.
     */
    public BufferedImage subject(SourceImage source, AlphaMask mask) {
        int w = source.width(), h = source.height();
        if (mask.width() != w || mask.height() != h) {
            throw new IllegalArgumentException("Mask " + mask.width() + "x" + mask.height()
                    + " does not match image " + w + "x" + h);
        }
        int[] rgb = source.rgb().getRGB(0, 0, w, h, null, 0, w);
        byte[] alpha = mask.data();
        for (int i = 0; i < rgb.length; i++) {
            rgb[i] = ((alpha[i] & 0xFF) << 24) | (rgb[i] & 0x00FFFFFF);
        }
        BufferedImage subject = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        subject.setRGB(0, 0, w, h, rgb, 0, w);
        return subject;
    }

    /**
     * Applies the requested background. An existing background image wins over the color. When
     * the image is missing the color is used, and white stands in for {@code transparent}.
     * {@code transparent} without an image returns the subject as is.
     */
    public BufferedImage composite(SourceImage source, AlphaMask mask, ProcessingOptions options) {
        BufferedImage subject = subject(source, mask);
        if (options.isTransparent()) {
            return subject;
        }
        BackgroundSpec spec = backgroundFor(options);
        log.debug("Compositing subject over {} background", spec.kind());
        BufferedImage background = backgroundSynthesizer.synthesize(subject.getWidth(), subject.getHeight(), spec);
        return over(subject, background);
    }

    private static BackgroundSpec backgroundFor(ProcessingOptions options) {
        Path imagePath = options.backgroundImagePath();
        if (imagePath != null && Files.isRegularFile(imagePath)) {
            return BackgroundSpec.image(imagePath);
        }
        if (imagePath != null) {
            log.warn("Background image {} not found, using color {}", imagePath, options.backgroundColor());
        }
        String color = options.backgroundColor();
        return BackgroundSpec.color(ProcessingOptions.TRANSPARENT.equalsIgnoreCase(color.trim()) ? "white" : color);
    }

    /**
     * Alpha-over of {@code subject} onto {@code background}. The background counts as fully
     * opaque, so the result is opaque too.
     */
    public BufferedImage over(BufferedImage subject, BufferedImage background) {
        int w = subject.getWidth(), h = subject.getHeight();
        if (background.getWidth() != w || background.getHeight() != h) {
            throw new IllegalArgumentException("Background " + background.getWidth() + "x" + background.getHeight()
                    + " does not match subject " + w + "x" + h);
        }
        int[] fg = subject.getRGB(0, 0, w, h, null, 0, w);
        int[] bg = background.getRGB(0, 0, w, h, null, 0, w);
        int[] out = new int[fg.length];
        for (int i = 0; i < fg.length; i++) {
            out[i] = blendPixel(fg[i], bg[i]);
        }
        BufferedImage result = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        result.setRGB(0, 0, w, h, out, 0, w);
        return result;
    }

    /** One ARGB pixel over an opaque one; the result alpha is always 255. */
    static int blendPixel(int fg, int bg) {
        int a = fg >>> 24;
        if (a == 255) return fg;
        if (a == 0) return 0xFF000000 | (bg & 0x00FFFFFF);
        int r = blend((fg >> 16) & 0xFF, (bg >> 16) & 0xFF, a);
        int g = blend((fg >> 8) & 0xFF, (bg >> 8) & 0xFF, a);
        int b = blend(fg & 0xFF, bg & 0xFF, a);
        return (0xFF << 24) | (r << 16) | (g << 8) | b;
    }

    private static int blend(int fg, int bg, int alpha) {
        return clamp(Math.round((fg * alpha + bg * (255 - alpha)) / 255f));
    }

    private static int clamp(int v) {
        return (v < 0) ? 0 : Math.min(255, v);
    }
}
