package com.project.image.bgremover.service;

import com.project.image.bgremover.DTOs.BackgroundSpec;
import com.project.image.bgremover.exceptions.DecodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Produces opaque backgrounds of an exact size: solid colors, resized images and vertical
 * two-color gradients. Both the removal flow and the change-background flow go through here.
 */
@Service
public class BackgroundSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(BackgroundSynthesizer.class);

    static final Map<String, Color> NAMED_COLORS = Map.of(
            "white", new Color(255, 255, 255),
            "black", new Color(0, 0, 0),
            "blue", new Color(52, 152, 219),
            "green", new Color(46, 204, 113),
            "red", new Color(231, 76, 60)
    );

    private static final Pattern HEX_COLOR = Pattern.compile("#[0-9a-fA-F]{6}");

    private final ImageLoader imageLoader;

    public BackgroundSynthesizer(ImageLoader imageLoader) {
        this.imageLoader = imageLoader;
    }

    public BufferedImage synthesize(int width, int height, BackgroundSpec spec) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Invalid background size " + width + "x" + height);
        }
        switch (spec.kind()) {
            case IMAGE:
                return fromImage(width, height, spec.imagePath());
            case GRADIENT:
                return gradient(width, height, parseColor(spec.gradientStart()), parseColor(spec.gradientEnd()));
            case COLOR:
            default:
                return solid(width, height, parseColor(spec.color()));
        }
    }

    public BufferedImage solid(int width, int height, Color color) {
        BufferedImage background = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D graphics = background.createGraphics();
        graphics.setColor(new Color(color.getRed(), color.getGreen(), color.getBlue(), 255));
        graphics.fillRect(0, 0, width, height);
        graphics.dispose();
        return background;
    }

    /**
     * Loads {@code path} and stretches it bilinearly to the target size. A missing or unreadable
     * file gives a white background instead of an error.
     */
    public BufferedImage fromImage(int width, int height, Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            log.warn("Background image {} not found, using white", path);
            return solid(width, height, Color.WHITE);
        }
        BufferedImage image;
        try {
            image = imageLoader.read(path);
        } catch (DecodeException e) {
            log.warn("Background image {} unusable ({}), using white", path, e.getMessage());
            return solid(width, height, Color.WHITE);
        }
        MatSupport.ensureLoaded();
        return MatSupport.resizeArgb(image, width, height);
    }

    /**
     * Vertical linear gradient. Row {@code i} of {@code height} uses {@code ratio = i / height},
     * so the first row is exactly {@code top} and the last row approaches {@code bottom}.
     */
    public BufferedImage gradient(int width, int height, Color top, Color bottom) {
        BufferedImage background = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            double ratio = (double) y / height;
            int r = (int) (top.getRed() * (1 - ratio) + bottom.getRed() * ratio);
            int g = (int) (top.getGreen() * (1 - ratio) + bottom.getGreen() * ratio);
            int b = (int) (top.getBlue() * (1 - ratio) + bottom.getBlue() * ratio);
            Arrays.fill(row, (0xFF << 24) | (r << 16) | (g << 8) | b);
            background.setRGB(0, y, width, 1, row, 0, width);
        }
        return background;
    }

    /** Named color or {@code #RRGGBB}; anything else is white. */
    public static Color parseColor(String token) {
        if (token == null) {
            return Color.WHITE;
        }
        String value = token.trim();
        if (HEX_COLOR.matcher(value).matches()) {
            return new Color(Integer.parseInt(value.substring(1), 16));
        }
        Color named = NAMED_COLORS.get(value.toLowerCase(Locale.ROOT));
        if (named == null) {
            log.debug("Unrecognized color '{}', using white", token);
            return Color.WHITE;
        }
        return named;
    }
}
