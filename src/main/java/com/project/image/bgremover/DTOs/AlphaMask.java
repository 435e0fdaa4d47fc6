package com.project.image.bgremover.DTOs;

/**
 * Binary alpha mask at the original image resolution. Every value is either 0 (background)
 * or 255 (foreground), stored as unsigned bytes in row-major order.
 */
public record AlphaMask(byte[] data, int width, int height) {

    public AlphaMask {
        if (data.length != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " values, got " + data.length);
        }
    }

    public int alphaAt(int x, int y) {
        return data[y * width + x] & 0xFF;
    }
}
