package com.project.image.bgremover.DTOs;

/** Single channel model output at model resolution, row-major, unbounded range. */
public record RawMask(float[] data, int height, int width) {

    public RawMask {
        if (data.length != height * width) {
            throw new IllegalArgumentException("Expected " + (height * width) + " values, got " + data.length);
        }
    }
}
