package com.project.image.bgremover.DTOs;

import java.awt.image.BufferedImage;

/** Decoded input image, forced to 3 channels ({@code TYPE_INT_RGB}), at its original size. */
public record SourceImage(BufferedImage rgb, int width, int height) {

    public SourceImage {
        if (rgb.getWidth() != width || rgb.getHeight() != height) {
            throw new IllegalArgumentException("Image size " + rgb.getWidth() + "x" + rgb.getHeight()
                    + " does not match declared size " + width + "x" + height);
        }
    }
}
